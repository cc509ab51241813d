package projectelastic.physics.i;

import org.ejml.data.DMatrixRMaj;

/**
 * Estrategia de resolución del sistema lineal reducido K·u = f.
 */
public interface ILinearSolver extends ISolverComponent {
    /**
     * Resuelve el sistema sin modificar las matrices de entrada.
     *
     * @param stiffness Matriz de rigidez reducida (n x n).
     * @param load      Vector de cargas reducido (n x 1).
     * @return Vector de desplazamientos reducido (n x 1).
     * @throws projectelastic.domain.exception.FemModelException (NUMERICAL) si la matriz es singular
     *                                                           o el resultado no es finito.
     */
    DMatrixRMaj solve(DMatrixRMaj stiffness, DMatrixRMaj load);
}
