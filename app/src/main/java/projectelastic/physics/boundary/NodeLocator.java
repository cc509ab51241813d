package projectelastic.physics.boundary;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import projectelastic.domain.exception.FemModelException;
import projectelastic.domain.mesh.Mesh;
import projectelastic.domain.mesh.Node;

/**
 * Búsquedas geométricas de nodos del mallado.
 */
public final class NodeLocator {

    private NodeLocator() {
    }

    /**
     * Índice denso del nodo más cercano a (x, y) por distancia euclídea al cuadrado.
     * En caso de empate gana el primero en orden de mallado.
     *
     * @throws FemModelException si el mallado no tiene nodos.
     */
    public static int nearestNode(Mesh mesh, double x, double y) {
        if (mesh.numberOfNodes() == 0) {
            throw FemModelException.validation("No se puede buscar el nodo más cercano en un mallado vacío.");
        }
        int best = 0;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int i = 0; i < mesh.numberOfNodes(); i++) {
            double distance = mesh.nodeAt(i).squaredDistanceTo(x, y);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = i;
            }
        }
        return best;
    }

    /**
     * Índices densos (en orden de mallado) de los nodos situados sobre el segmento AB.
     * <p>
     * Un nodo pertenece al segmento si su distancia perpendicular a la recta AB es
     * como máximo {@code tolerance} y su proyección cae en [−tolerance, |AB| + tolerance].
     * Un segmento de longitud nula no contiene ningún nodo.
     */
    public static IntArrayList nodesOnSegment(Mesh mesh, double ax, double ay, double bx, double by, double tolerance) {
        IntArrayList found = new IntArrayList();
        double ux = bx - ax;
        double uy = by - ay;
        double length = Math.hypot(ux, uy);
        if (length == 0.0) {
            return found;
        }
        ux /= length;
        uy /= length;

        for (int i = 0; i < mesh.numberOfNodes(); i++) {
            Node node = mesh.nodeAt(i);
            double px = node.x() - ax;
            double py = node.y() - ay;
            double along = px * ux + py * uy;
            double across = Math.abs(px * uy - py * ux);
            if (across <= tolerance && along >= -tolerance && along <= length + tolerance) {
                found.add(i);
            }
        }
        return found;
    }
}
