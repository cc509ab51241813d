package projectelastic.factory;

import projectelastic.config.SolverConfig;
import projectelastic.config.SolverConfig.LinearSolverType;
import projectelastic.physics.i.ILinearSolver;
import projectelastic.physics.impl.CholeskyLinearSolver;
import projectelastic.physics.impl.LuLinearSolver;

/**
 * Fábrica centralizada del solver lineal según la configuración y el tipo de sistema.
 */
public class LinearSolverFactory {

    private LinearSolverFactory() {
    }

    /**
     * Elige la implementación.
     * <p>
     * En modo AUTO se usa Cholesky cuando el sistema es simétrico (no hay filas
     * sustituidas por desplazamientos prescritos) y LU en caso contrario.
     *
     * @param config       Configuración del cálculo.
     * @param symmetric    true si la matriz reducida conserva la simetría.
     */
    public static ILinearSolver create(SolverConfig config, boolean symmetric) {
        LinearSolverType type = config.getLinearSolverType() == null ? LinearSolverType.AUTO : config.getLinearSolverType();
        double tolerance = config.getSingularityTolerance();

        switch (type) {
            case LU:
                return new LuLinearSolver(tolerance);
            case CHOLESKY:
                return new CholeskyLinearSolver(tolerance);
            case AUTO:
            default:
                return symmetric ? new CholeskyLinearSolver(tolerance) : new LuLinearSolver(tolerance);
        }
    }
}
