package projectelastic.domain.solution;

/**
 * Magnitudes que puede extraer un consumidor de la solución (exportación, gráficos).
 * Las variables de desplazamiento son nodales; el resto se evalúan en puntos de integración.
 */
public enum ResultVariable {
    DISPLACEMENT_X(true),
    DISPLACEMENT_Y(true),
    DISPLACEMENT_TOTAL(true),
    STRAIN_X(false),
    STRAIN_Y(false),
    STRAIN_XY(false),
    STRESS_X(false),
    STRESS_Y(false),
    STRESS_XY(false),
    STRESS_Z(false),
    PRINCIPAL_1(false),
    PRINCIPAL_2(false),
    PRINCIPAL_3(false),
    VON_MISES(false);

    private final boolean nodal;

    ResultVariable(boolean nodal) {
        this.nodal = nodal;
    }

    public boolean isNodal() {
        return nodal;
    }
}
