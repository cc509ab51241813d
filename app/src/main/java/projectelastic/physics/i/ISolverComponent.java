package projectelastic.physics.i;

/**
 * Identificación común de los componentes numéricos del cálculo (factorizaciones,
 * integradores). El nombre aparece en los logs de cada resolución.
 */
public interface ISolverComponent {

    /**
     * Nombre corto del método (ej: "LU", "Cholesky").
     */
    String getName();

    /**
     * Descripción del método para informes de diagnóstico.
     */
    default String getDescription() {
        return getName();
    }
}
