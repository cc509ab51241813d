package projectelastic.domain.load;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.List;

/**
 * Cargas del modelo agrupadas por tipo de objetivo (nodos, puntos, líneas).
 */
public class Loads {

    private final ObjectArrayList<Load> onNodes = new ObjectArrayList<>();
    private final ObjectArrayList<Load> onPoints = new ObjectArrayList<>();
    private final ObjectArrayList<Load> onLines = new ObjectArrayList<>();

    public int addOnNode(int nodeId, double fx, double fy) {
        return append(onNodes, nodeId, fx, fy);
    }

    public int addOnPoint(int pointId, double fx, double fy) {
        return append(onPoints, pointId, fx, fy);
    }

    /**
     * @param fx Carga por unidad de longitud en X.
     * @param fy Carga por unidad de longitud en Y.
     */
    public int addOnLine(int lineId, double fx, double fy) {
        return append(onLines, lineId, fx, fy);
    }

    public boolean removeOnNode(int id) {
        return onNodes.removeIf(l -> l.id() == id);
    }

    public boolean removeOnPoint(int id) {
        return onPoints.removeIf(l -> l.id() == id);
    }

    public boolean removeOnLine(int id) {
        return onLines.removeIf(l -> l.id() == id);
    }

    public List<Load> onNodes() {
        return List.copyOf(onNodes);
    }

    public List<Load> onPoints() {
        return List.copyOf(onPoints);
    }

    public List<Load> onLines() {
        return List.copyOf(onLines);
    }

    public boolean isEmpty() {
        return onNodes.isEmpty() && onPoints.isEmpty() && onLines.isEmpty();
    }

    public static Loads of(List<Load> onNodes, List<Load> onPoints, List<Load> onLines) {
        Loads loads = new Loads();
        loads.onNodes.addAll(onNodes);
        loads.onPoints.addAll(onPoints);
        loads.onLines.addAll(onLines);
        return loads;
    }

    private static int append(ObjectArrayList<Load> target, int targetId, double fx, double fy) {
        int id = target.stream().mapToInt(Load::id).max().orElse(0) + 1;
        target.add(new Load(id, targetId, fx, fy));
        return id;
    }
}
