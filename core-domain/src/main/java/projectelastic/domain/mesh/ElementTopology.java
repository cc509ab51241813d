package projectelastic.domain.mesh;

import projectelastic.domain.exception.FemModelException;

import java.util.Arrays;
import java.util.Set;

/**
 * Topologías de elemento isoparamétrico soportadas.
 * <p>
 * Convenio de numeración: primero los nodos de vértice (antihorario) y después los
 * nodos de centro de arista, empezando por la arista vértice 1 - vértice 2.
 * La extracción de aristas para cargas lineales depende de este orden.
 */
public enum ElementTopology {

    TRIA3(3, Family.TRIANGLE, false, Set.of(1, 3, 4, 7)),
    QUAD4(4, Family.QUADRILATERAL, false, Set.of(1, 4, 9)),
    TRIA6(6, Family.TRIANGLE, true, Set.of(1, 3, 4, 7)),
    QUAD8(8, Family.QUADRILATERAL, true, Set.of(1, 4, 9));

    private final int nodeCount;
    private final Family family;
    private final boolean quadratic;
    private final Set<Integer> supportedOrders;

    ElementTopology(int nodeCount, Family family, boolean quadratic, Set<Integer> supportedOrders) {
        this.nodeCount = nodeCount;
        this.family = family;
        this.quadratic = quadratic;
        this.supportedOrders = supportedOrders;
    }

    public int nodeCount() {
        return nodeCount;
    }

    public Family family() {
        return family;
    }

    /**
     * @return true si las aristas del elemento tienen tres nodos (funciones de forma cuadráticas).
     */
    public boolean isQuadratic() {
        return quadratic;
    }

    /**
     * Número de nodos que debe tener una arista del elemento situada sobre una línea cargada.
     */
    public int edgeNodeCount() {
        return quadratic ? 3 : 2;
    }

    public boolean supportsIntegrationOrder(int order) {
        return supportedOrders.contains(order);
    }

    public Set<Integer> supportedIntegrationOrders() {
        return supportedOrders;
    }

    /**
     * Resuelve la topología a partir del número de nodos del elemento.
     *
     * @throws FemModelException si el número de nodos no corresponde a ninguna topología soportada.
     */
    public static ElementTopology fromNodeCount(int nodeCount) {
        return Arrays.stream(values())
                .filter(t -> t.nodeCount == nodeCount)
                .findFirst()
                .orElseThrow(() -> FemModelException.unsupported(
                        "Tipo de elemento con " + nodeCount + " nodos no implementado (soportados: 3, 4, 6, 8)."));
    }

    public enum Family {
        TRIANGLE,
        QUADRILATERAL
    }
}
