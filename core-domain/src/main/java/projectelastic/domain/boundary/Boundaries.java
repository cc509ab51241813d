package projectelastic.domain.boundary;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.List;

/**
 * Apoyos del modelo agrupados por el tipo de objetivo: nodos del mallado,
 * puntos geométricos y líneas geométricas.
 * <p>
 * Cada lista conserva el orden de inserción, que es el que decide qué valor
 * prescrito gana cuando varias definiciones coinciden en un nodo.
 */
public class Boundaries {

    private final ObjectArrayList<DisplacementConstraint> onNodes = new ObjectArrayList<>();
    private final ObjectArrayList<DisplacementConstraint> onPoints = new ObjectArrayList<>();
    private final ObjectArrayList<DisplacementConstraint> onLines = new ObjectArrayList<>();

    public int addOnNode(int nodeId, AxisConstraint x, AxisConstraint y) {
        return append(onNodes, nodeId, x, y);
    }

    public int addOnPoint(int pointId, AxisConstraint x, AxisConstraint y) {
        return append(onPoints, pointId, x, y);
    }

    public int addOnLine(int lineId, AxisConstraint x, AxisConstraint y) {
        return append(onLines, lineId, x, y);
    }

    /**
     * Empotramiento (ambos ejes fijos) sobre una línea.
     */
    public int fixLine(int lineId) {
        return addOnLine(lineId, AxisConstraint.FIXED, AxisConstraint.FIXED);
    }

    public boolean removeOnNode(int id) {
        return onNodes.removeIf(c -> c.id() == id);
    }

    public boolean removeOnPoint(int id) {
        return onPoints.removeIf(c -> c.id() == id);
    }

    public boolean removeOnLine(int id) {
        return onLines.removeIf(c -> c.id() == id);
    }

    public List<DisplacementConstraint> onNodes() {
        return List.copyOf(onNodes);
    }

    public List<DisplacementConstraint> onPoints() {
        return List.copyOf(onPoints);
    }

    public List<DisplacementConstraint> onLines() {
        return List.copyOf(onLines);
    }

    public boolean isEmpty() {
        return onNodes.isEmpty() && onPoints.isEmpty() && onLines.isEmpty();
    }

    /**
     * Reconstruye el contenedor a partir de listas ya identificadas (p. ej. leídas de JSON).
     */
    public static Boundaries of(List<DisplacementConstraint> onNodes,
                                List<DisplacementConstraint> onPoints,
                                List<DisplacementConstraint> onLines) {
        Boundaries boundaries = new Boundaries();
        boundaries.onNodes.addAll(onNodes);
        boundaries.onPoints.addAll(onPoints);
        boundaries.onLines.addAll(onLines);
        return boundaries;
    }

    private static int append(ObjectArrayList<DisplacementConstraint> target, int targetId,
                              AxisConstraint x, AxisConstraint y) {
        int id = target.stream().mapToInt(DisplacementConstraint::id).max().orElse(0) + 1;
        target.add(new DisplacementConstraint(id, targetId, x, y));
        return id;
    }
}
