package projectelastic.domain.solution;

/**
 * Desplazamiento resultante de un nodo.
 *
 * @param total Módulo del desplazamiento, sqrt(dx² + dy²).
 */
public record NodalDisplacement(int nodeId, double dx, double dy, double total) {

    public static NodalDisplacement of(int nodeId, double dx, double dy) {
        return new NodalDisplacement(nodeId, dx, dy, Math.sqrt(dx * dx + dy * dy));
    }
}
