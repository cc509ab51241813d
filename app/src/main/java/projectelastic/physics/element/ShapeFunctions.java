package projectelastic.physics.element;

import projectelastic.domain.mesh.ElementTopology;

import java.util.EnumMap;
import java.util.Map;

/**
 * Funciones de forma isoparamétricas en forma cerrada.
 * <p>
 * MÉTODO:
 * Cada topología tiene una base de monomios p(ξ, η) de longitud m y una matriz de
 * coeficientes C (m x k). Las funciones de forma son N_j = Σ_m p_m · C[m][j], y las
 * derivadas se obtienen igual sustituyendo p por ∂p/∂ξ o ∂p/∂η.
 * <p>
 * Bases:
 * - TRIA3: [1, ξ, η]
 * - TRIA6: [1, ξ, η, ξη, ξ², η²]
 * - QUAD4: [1, ξ, η, ξη]
 * - QUAD8: [1, ξ, η, ξη, ξ², η², ξ²η, ξη²]
 * <p>
 * Triángulos en coordenadas de área (0 ≤ ξ, η; ξ + η ≤ 1); cuadriláteros en [-1, 1]².
 */
public final class ShapeFunctions {

    private static final double[] LINEAR_EDGE_COEFFICIENTS = {0.5, 0.5};
    private static final double[] QUADRATIC_EDGE_COEFFICIENTS = {1.0 / 6.0, 1.0 / 6.0, 4.0 / 6.0};

    private static final Map<ElementTopology, double[][]> COEFFICIENTS = new EnumMap<>(ElementTopology.class);

    static {
        COEFFICIENTS.put(ElementTopology.TRIA3, new double[][]{
                {1, 0, 0},
                {-1, 1, 0},
                {-1, 0, 1}
        });
        COEFFICIENTS.put(ElementTopology.TRIA6, new double[][]{
                {1, 0, 0, 0, 0, 0},
                {-3, -1, 0, 4, 0, 0},
                {-3, 0, -1, 0, 0, 4},
                {4, 0, 0, -4, 4, -4},
                {2, 2, 0, -4, 0, 0},
                {2, 0, 2, 0, 0, -4}
        });
        COEFFICIENTS.put(ElementTopology.QUAD4, scaled(0.25, new double[][]{
                {1, 1, 1, 1},
                {-1, 1, 1, -1},
                {-1, -1, 1, 1},
                {1, -1, 1, -1}
        }));
        COEFFICIENTS.put(ElementTopology.QUAD8, scaled(0.25, new double[][]{
                {-1, -1, -1, -1, 2, 2, 2, 2},
                {0, 0, 0, 0, 0, 2, 0, -2},
                {0, 0, 0, 0, -2, 0, 2, 0},
                {1, -1, 1, -1, 0, 0, 0, 0},
                {1, 1, 1, 1, -2, 0, -2, 0},
                {1, 1, 1, 1, 0, -2, 0, -2},
                {-1, -1, 1, 1, 2, 0, -2, 0},
                {-1, 1, 1, -1, 0, -2, 0, 2}
        }));
    }

    private ShapeFunctions() {
    }

    /**
     * Valores de las funciones de forma en (ξ, η).
     *
     * @return Array de longitud k (nodos del elemento).
     */
    public static double[] values(ElementTopology topology, double xi, double eta) {
        return combine(topology, basis(topology, xi, eta));
    }

    /**
     * Derivadas locales de las funciones de forma.
     *
     * @return [0] = ∂N/∂ξ, [1] = ∂N/∂η, cada una de longitud k.
     */
    public static double[][] derivatives(ElementTopology topology, double xi, double eta) {
        return new double[][]{
                combine(topology, basisDerivativeXi(topology, xi, eta)),
                combine(topology, basisDerivativeEta(topology, xi, eta))
        };
    }

    /**
     * Coeficientes de reparto de una carga lineal uniforme entre los nodos de una arista,
     * en el orden en que aparecen en la conectividad (vértices primero).
     */
    public static double[] lineLoadCoefficients(ElementTopology topology) {
        return topology.isQuadratic() ? QUADRATIC_EDGE_COEFFICIENTS.clone() : LINEAR_EDGE_COEFFICIENTS.clone();
    }

    /**
     * Coordenadas globales de un punto local: x = N · X_nodos.
     *
     * @param shapeValues Valores N del punto.
     * @param coords      Coordenadas nodales k x 2.
     * @return {x, y}.
     */
    public static double[] interpolate(double[] shapeValues, double[][] coords) {
        double x = 0.0;
        double y = 0.0;
        for (int i = 0; i < shapeValues.length; i++) {
            x += shapeValues[i] * coords[i][0];
            y += shapeValues[i] * coords[i][1];
        }
        return new double[]{x, y};
    }

    private static double[] combine(ElementTopology topology, double[] monomials) {
        double[][] c = COEFFICIENTS.get(topology);
        int k = topology.nodeCount();
        double[] result = new double[k];
        for (int m = 0; m < monomials.length; m++) {
            if (monomials[m] == 0.0) continue;
            for (int j = 0; j < k; j++) {
                result[j] += monomials[m] * c[m][j];
            }
        }
        return result;
    }

    private static double[] basis(ElementTopology topology, double xi, double eta) {
        return switch (topology) {
            case TRIA3 -> new double[]{1, xi, eta};
            case TRIA6 -> new double[]{1, xi, eta, xi * eta, xi * xi, eta * eta};
            case QUAD4 -> new double[]{1, xi, eta, xi * eta};
            case QUAD8 -> new double[]{1, xi, eta, xi * eta, xi * xi, eta * eta, xi * xi * eta, xi * eta * eta};
        };
    }

    private static double[] basisDerivativeXi(ElementTopology topology, double xi, double eta) {
        return switch (topology) {
            case TRIA3 -> new double[]{0, 1, 0};
            case TRIA6 -> new double[]{0, 1, 0, eta, 2 * xi, 0};
            case QUAD4 -> new double[]{0, 1, 0, eta};
            case QUAD8 -> new double[]{0, 1, 0, eta, 2 * xi, 0, 2 * xi * eta, eta * eta};
        };
    }

    private static double[] basisDerivativeEta(ElementTopology topology, double xi, double eta) {
        return switch (topology) {
            case TRIA3 -> new double[]{0, 0, 1};
            case TRIA6 -> new double[]{0, 0, 1, xi, 0, 2 * eta};
            case QUAD4 -> new double[]{0, 0, 1, xi};
            case QUAD8 -> new double[]{0, 0, 1, xi, 0, 2 * eta, xi * xi, 2 * xi * eta};
        };
    }

    private static double[][] scaled(double factor, double[][] matrix) {
        for (double[] row : matrix) {
            for (int j = 0; j < row.length; j++) {
                row[j] *= factor;
            }
        }
        return matrix;
    }
}
