package projectelastic.physics.element;

import projectelastic.domain.exception.FemModelException;
import projectelastic.domain.mesh.ElementTopology;

import java.util.Map;

/**
 * Tablas de integración de Gauss por familia de elemento.
 * <p>
 * Triángulos: órdenes 1, 3, 4 y 7 (los pesos suman 1/2, el área del triángulo de referencia).
 * Cuadriláteros: órdenes 1, 4 y 9 (los pesos suman 4).
 */
public final class GaussQuadrature {

    private static final Map<Integer, QuadratureRule> TRIANGLE_RULES;
    private static final Map<Integer, QuadratureRule> QUADRILATERAL_RULES;

    static {
        double third = 1.0 / 3.0;
        TRIANGLE_RULES = Map.of(
                1, new QuadratureRule(
                        new double[]{third},
                        new double[]{third},
                        new double[]{0.5}),
                3, new QuadratureRule(
                        new double[]{1.0 / 6.0, 2.0 / 3.0, 1.0 / 6.0},
                        new double[]{1.0 / 6.0, 1.0 / 6.0, 2.0 / 3.0},
                        new double[]{1.0 / 6.0, 1.0 / 6.0, 1.0 / 6.0}),
                4, new QuadratureRule(
                        new double[]{third, 0.6, 0.2, 0.2},
                        new double[]{third, 0.2, 0.6, 0.2},
                        new double[]{-9.0 / 32.0, 25.0 / 96.0, 25.0 / 96.0, 25.0 / 96.0}),
                7, new QuadratureRule(
                        new double[]{0.0, 0.5, 1.0, 0.5, 0.0, 0.0, third},
                        new double[]{0.0, 0.0, 0.0, 0.5, 1.0, 0.5, third},
                        new double[]{1.0 / 40.0, 1.0 / 15.0, 1.0 / 40.0, 1.0 / 15.0, 1.0 / 40.0, 1.0 / 15.0, 9.0 / 40.0})
        );

        double g = 1.0 / Math.sqrt(3.0);
        double a = Math.sqrt(0.6);
        double w1 = 25.0 / 81.0;
        double w2 = 40.0 / 81.0;
        double w3 = 64.0 / 81.0;
        QUADRILATERAL_RULES = Map.of(
                1, new QuadratureRule(
                        new double[]{0.0},
                        new double[]{0.0},
                        new double[]{4.0}),
                4, new QuadratureRule(
                        new double[]{-g, g, g, -g},
                        new double[]{-g, -g, g, g},
                        new double[]{1.0, 1.0, 1.0, 1.0}),
                9, new QuadratureRule(
                        new double[]{-a, 0.0, a, -a, 0.0, a, -a, 0.0, a},
                        new double[]{-a, -a, -a, 0.0, 0.0, 0.0, a, a, a},
                        new double[]{w1, w2, w1, w2, w3, w2, w1, w2, w1})
        );
    }

    private GaussQuadrature() {
    }

    /**
     * Regla de integración para una topología y un número de puntos.
     *
     * @throws FemModelException (UNSUPPORTED_CONFIGURATION) si la combinación no existe.
     */
    public static QuadratureRule rule(ElementTopology topology, int order) {
        Map<Integer, QuadratureRule> rules = topology.family() == ElementTopology.Family.TRIANGLE
                ? TRIANGLE_RULES
                : QUADRILATERAL_RULES;
        QuadratureRule rule = rules.get(order);
        if (rule == null) {
            throw FemModelException.unsupported("Orden de integración " + order + " no implementado para "
                    + topology + " (soportados: " + topology.supportedIntegrationOrders() + ").");
        }
        return rule;
    }
}
