package projectelastic.factory;

import lombok.extern.slf4j.Slf4j;
import projectelastic.domain.exception.FemModelException;
import projectelastic.domain.mesh.Mesh;
import projectelastic.domain.mesh.MeshBuilder;
import projectelastic.domain.mesh.SectionProperties;

/**
 * Fábrica de mallados estructurados sobre un rectángulo alineado con los ejes.
 * <p>
 * Numeración común a todos los generadores:
 * <ol>
 * <li>Nodos por filas (fila 0 en y = y0), de izquierda a derecha, ids desde 1.</li>
 * <li>Elementos fila a fila, con conectividad antihoraria.</li>
 * </ol>
 * No es un mallador general: solo rejillas regulares.
 */
@Slf4j
public class MeshFactory {

    private MeshFactory() {
    }

    /**
     * Rejilla de cuadriláteros de 4 nodos.
     *
     * @param x0         Esquina inferior izquierda X.
     * @param y0         Esquina inferior izquierda Y.
     * @param width      Ancho del rectángulo.
     * @param height     Alto del rectángulo.
     * @param divisionsX Número de elementos en X.
     * @param divisionsY Número de elementos en Y.
     * @param integrationOrder Orden de integración de cada elemento (1, 4 o 9).
     * @param section    Propiedades comunes a todos los elementos.
     * @return Mallado con (divisionsX + 1) · (divisionsY + 1) nodos.
     */
    public static Mesh rectangularQuadGrid(double x0, double y0, double width, double height,
                                           int divisionsX, int divisionsY,
                                           int integrationOrder, SectionProperties section) {
        MeshBuilder builder = gridNodes(x0, y0, width, height, divisionsX, divisionsY);
        int nodesPerRow = divisionsX + 1;

        for (int i = 0; i < divisionsY; i++) {
            for (int j = 0; j < divisionsX; j++) {
                int n0 = i * nodesPerRow + j + 1;
                int n1 = n0 + 1;
                int n3 = n0 + nodesPerRow;
                int n2 = n3 + 1;
                builder.addElement(new int[]{n0, n1, n2, n3}, integrationOrder, section);
            }
        }
        return builder.build();
    }

    /**
     * Rejilla de triángulos de 3 nodos: cada celda se divide por la diagonal
     * inferior izquierda - superior derecha en dos triángulos antihorarios.
     */
    public static Mesh rectangularTriangleGrid(double x0, double y0, double width, double height,
                                               int divisionsX, int divisionsY,
                                               int integrationOrder, SectionProperties section) {
        MeshBuilder builder = gridNodes(x0, y0, width, height, divisionsX, divisionsY);
        int nodesPerRow = divisionsX + 1;

        for (int i = 0; i < divisionsY; i++) {
            for (int j = 0; j < divisionsX; j++) {
                int n0 = i * nodesPerRow + j + 1;
                int n1 = n0 + 1;
                int n3 = n0 + nodesPerRow;
                int n2 = n3 + 1;
                builder.addElement(new int[]{n0, n1, n2}, integrationOrder, section);
                builder.addElement(new int[]{n0, n2, n3}, integrationOrder, section);
            }
        }
        return builder.build();
    }

    private static MeshBuilder gridNodes(double x0, double y0, double width, double height,
                                         int divisionsX, int divisionsY) {
        if (divisionsX < 1 || divisionsY < 1) {
            throw FemModelException.validation("La rejilla necesita al menos una división por eje (recibido: "
                    + divisionsX + " x " + divisionsY + ").");
        }
        if (!(width > 0.0) || !(height > 0.0)) {
            throw FemModelException.validation("Las dimensiones del rectángulo deben ser positivas (recibido: "
                    + width + " x " + height + ").");
        }

        log.debug("Generando rejilla {} x {} sobre [{}, {}] x [{}, {}].",
                divisionsX, divisionsY, x0, x0 + width, y0, y0 + height);
        MeshBuilder builder = Mesh.builder();
        double dx = width / divisionsX;
        double dy = height / divisionsY;
        for (int i = 0; i <= divisionsY; i++) {
            for (int j = 0; j <= divisionsX; j++) {
                builder.addNode(x0 + j * dx, y0 + i * dy);
            }
        }
        return builder;
    }
}
