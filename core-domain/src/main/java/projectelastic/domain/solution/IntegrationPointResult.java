package projectelastic.domain.solution;

import lombok.Builder;
import projectelastic.domain.mesh.IntegrationPoint;

/**
 * Estado tensional y de deformación en un punto de Gauss.
 * <p>
 * Las deformaciones angulares son ingenieriles (γxy). Las tensiones principales
 * están ordenadas de mayor a menor: principal1 ≥ principal2 ≥ principal3.
 */
@Builder
public record IntegrationPointResult(
        IntegrationPoint point,
        double strainX,
        double strainY,
        double strainXY,
        double stressX,
        double stressY,
        double stressXY,
        double stressZ,
        double principal1,
        double principal2,
        double principal3,
        double vonMises
) {
    public double value(ResultVariable variable) {
        return switch (variable) {
            case STRAIN_X -> strainX;
            case STRAIN_Y -> strainY;
            case STRAIN_XY -> strainXY;
            case STRESS_X -> stressX;
            case STRESS_Y -> stressY;
            case STRESS_XY -> stressXY;
            case STRESS_Z -> stressZ;
            case PRINCIPAL_1 -> principal1;
            case PRINCIPAL_2 -> principal2;
            case PRINCIPAL_3 -> principal3;
            case VON_MISES -> vonMises;
            default -> throw new IllegalArgumentException(
                    "La variable " + variable + " es nodal, no se evalúa en puntos de integración.");
        };
    }
}
