package projectelastic.domain.geometry;

import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import projectelastic.domain.exception.FemModelException;

import java.util.List;
import java.util.Optional;

/**
 * Contenedor de puntos y líneas geométricas usados para resolver apoyos y cargas
 * definidos fuera del mallado.
 * <p>
 * Conserva el orden de inserción. Los identificadores se asignan como máximo + 1
 * salvo que el llamador los indique.
 */
public class Geometry {

    private final Int2ObjectLinkedOpenHashMap<Point> points = new Int2ObjectLinkedOpenHashMap<>();
    private final Int2ObjectLinkedOpenHashMap<Line> lines = new Int2ObjectLinkedOpenHashMap<>();
    private int maxPointId = 0;
    private int maxLineId = 0;

    /**
     * Construye un polígono cerrado: un punto por vértice (en el orden dado, se espera
     * antihorario) y una línea por lado, incluida la de cierre del último al primero.
     *
     * @param coordinates Pares {x, y} de cada vértice.
     */
    public static Geometry polygon(double[]... coordinates) {
        if (coordinates.length < 3) {
            throw FemModelException.validation("Un polígono necesita al menos 3 vértices (recibidos: " + coordinates.length + ").");
        }
        Geometry geometry = new Geometry();
        int[] ids = new int[coordinates.length];
        for (int i = 0; i < coordinates.length; i++) {
            if (coordinates[i].length != 2) {
                throw FemModelException.validation("El vértice " + i + " debe tener exactamente 2 coordenadas.");
            }
            ids[i] = geometry.addPoint(coordinates[i][0], coordinates[i][1]);
        }
        for (int i = 0; i < ids.length; i++) {
            geometry.addLine(ids[i], ids[(i + 1) % ids.length]);
        }
        return geometry;
    }

    public int addPoint(double x, double y) {
        return addPoint(maxPointId + 1, x, y);
    }

    public int addPoint(int id, double x, double y) {
        if (points.containsKey(id)) {
            throw FemModelException.validation("Identificador de punto duplicado: " + id);
        }
        points.put(id, new Point(id, x, y));
        maxPointId = Math.max(maxPointId, id);
        return id;
    }

    public int addLine(int startPointId, int endPointId) {
        return addLine(maxLineId + 1, startPointId, endPointId);
    }

    /**
     * Añade una línea. Los puntos extremos no se comprueban aquí: la validación se hace
     * al resolver, para poder definir líneas antes que puntos.
     */
    public int addLine(int id, int startPointId, int endPointId) {
        if (lines.containsKey(id)) {
            throw FemModelException.validation("Identificador de línea duplicado: " + id);
        }
        lines.put(id, new Line(id, startPointId, endPointId));
        maxLineId = Math.max(maxLineId, id);
        return id;
    }

    public Optional<Point> findPoint(int id) {
        return Optional.ofNullable(points.get(id));
    }

    public Optional<Line> findLine(int id) {
        return Optional.ofNullable(lines.get(id));
    }

    public Point point(int id) {
        Point point = points.get(id);
        if (point == null) {
            throw FemModelException.validation("El punto geométrico " + id + " no está definido.");
        }
        return point;
    }

    public Line line(int id) {
        Line line = lines.get(id);
        if (line == null) {
            throw FemModelException.validation("La línea geométrica " + id + " no está definida.");
        }
        return line;
    }

    public List<Point> points() {
        return List.copyOf(points.values());
    }

    public List<Line> lines() {
        return List.copyOf(lines.values());
    }

    public boolean hasPoints() {
        return !points.isEmpty();
    }

    public int numberOfPoints() {
        return points.size();
    }

    public int numberOfLines() {
        return lines.size();
    }
}
