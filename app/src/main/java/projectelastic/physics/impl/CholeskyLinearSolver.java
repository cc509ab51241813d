package projectelastic.physics.impl;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.decomposition.chol.CholeskyDecompositionInner_DDRM;
import org.ejml.dense.row.linsol.chol.LinearSolverChol_DDRM;
import org.ejml.interfaces.decomposition.CholeskyDecomposition_F64;
import org.ejml.interfaces.linsol.LinearSolverDense;

/**
 * Factorización de Cholesky (K = L·Lᵀ). Solo para sistemas simétricos definidos positivos;
 * si la matriz no lo es, la factorización falla y se informa como error numérico.
 */
public class CholeskyLinearSolver extends AbstractDenseLinearSolver {

    public CholeskyLinearSolver(double singularityTolerance) {
        super(singularityTolerance);
    }

    @Override
    public String getName() {
        return "Cholesky";
    }

    @Override
    public String getDescription() {
        return "Factorización de Cholesky densa para matrices simétricas definidas positivas (EJML)";
    }

    /**
     * Siempre la variante por filas: la variante por bloques de EJML (matrices grandes)
     * expone su factor en otro formato de matriz.
     */
    @Override
    protected LinearSolverDense<DMatrixRMaj> createSolver(int size) {
        return new LinearSolverChol_DDRM(new CholeskyDecompositionInner_DDRM(true));
    }

    /**
     * Los pivotes equivalentes de LU son los cuadrados de la diagonal de L.
     */
    @Override
    protected double[] pivotMagnitudes(LinearSolverDense<DMatrixRMaj> solver) {
        CholeskyDecomposition_F64<DMatrixRMaj> decomposition = solver.getDecomposition();
        DMatrixRMaj factor = decomposition.getT(null);
        int n = factor.getNumRows();
        double[] pivots = new double[n];
        for (int i = 0; i < n; i++) {
            double l = factor.get(i, i);
            pivots[i] = l * l;
        }
        return pivots;
    }
}
