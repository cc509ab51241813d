package projectelastic.physics.impl;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.decomposition.LUDecomposition_F64;
import org.ejml.interfaces.linsol.LinearSolverDense;

/**
 * Factorización LU con pivotamiento parcial. Válida también para el sistema no simétrico
 * que resulta de sustituir filas por desplazamientos prescritos.
 */
public class LuLinearSolver extends AbstractDenseLinearSolver {

    public LuLinearSolver(double singularityTolerance) {
        super(singularityTolerance);
    }

    @Override
    public String getName() {
        return "LU";
    }

    @Override
    public String getDescription() {
        return "Factorización LU densa con pivotamiento parcial (EJML)";
    }

    @Override
    protected LinearSolverDense<DMatrixRMaj> createSolver(int size) {
        return LinearSolverFactory_DDRM.lu(size);
    }

    @Override
    protected double[] pivotMagnitudes(LinearSolverDense<DMatrixRMaj> solver) {
        LUDecomposition_F64<DMatrixRMaj> decomposition = solver.getDecomposition();
        DMatrixRMaj upper = decomposition.getUpper(null);
        int n = Math.min(upper.getNumRows(), upper.getNumCols());
        double[] pivots = new double[n];
        for (int i = 0; i < n; i++) {
            pivots[i] = upper.get(i, i);
        }
        return pivots;
    }
}
