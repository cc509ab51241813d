package projectelastic.physics.impl;

import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.interfaces.linsol.LinearSolverDense;
import projectelastic.domain.exception.FemModelException;
import projectelastic.physics.i.ILinearSolver;

/**
 * Esqueleto común de los solvers densos basados en factorización (EJML).
 * <p>
 * FLUJO:
 * <ol>
 * <li>Factoriza la matriz (sin modificar la original).</li>
 * <li>Comprueba el cociente min|pivote| / max|pivote| frente a la tolerancia de singularidad.</li>
 * <li>Resuelve y rechaza cualquier valor no finito.</li>
 * </ol>
 */
@Slf4j
public abstract class AbstractDenseLinearSolver implements ILinearSolver {

    private final double singularityTolerance;

    protected AbstractDenseLinearSolver(double singularityTolerance) {
        this.singularityTolerance = singularityTolerance;
    }

    /**
     * Crea el solver EJML para una matriz n x n.
     */
    protected abstract LinearSolverDense<DMatrixRMaj> createSolver(int size);

    /**
     * Magnitudes de los pivotes de la factorización ya calculada.
     */
    protected abstract double[] pivotMagnitudes(LinearSolverDense<DMatrixRMaj> solver);

    @Override
    public DMatrixRMaj solve(DMatrixRMaj stiffness, DMatrixRMaj load) {
        int n = stiffness.getNumRows();
        if (stiffness.getNumCols() != n || load.getNumRows() != n) {
            throw new IllegalArgumentException("Dimensiones incompatibles: K " + stiffness.getNumRows() + "x"
                    + stiffness.getNumCols() + ", f " + load.getNumRows() + "x" + load.getNumCols());
        }

        LinearSolverDense<DMatrixRMaj> solver = createSolver(n);
        DMatrixRMaj a = solver.modifiesA() ? stiffness.copy() : stiffness;
        if (!solver.setA(a)) {
            throw FemModelException.numerical("La factorización " + getName()
                    + " ha fallado: la matriz de rigidez reducida es singular o no definida positiva"
                    + " (¿modo de sólido rígido sin restringir?).");
        }

        checkPivots(pivotMagnitudes(solver));

        DMatrixRMaj b = solver.modifiesB() ? load.copy() : load;
        DMatrixRMaj x = new DMatrixRMaj(n, 1);
        solver.solve(b, x);

        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(x.get(i))) {
                throw FemModelException.numerical("La solución del sistema contiene valores no finitos (GDL reducido "
                        + i + " = " + x.get(i) + ").");
            }
        }
        return x;
    }

    private void checkPivots(double[] pivots) {
        double max = 0.0;
        double min = Double.POSITIVE_INFINITY;
        for (double p : pivots) {
            double magnitude = Math.abs(p);
            max = Math.max(max, magnitude);
            min = Math.min(min, magnitude);
        }
        // Cociente adimensional: no depende de las unidades de E ni del espesor
        double ratio = max > 0.0 ? min / max : 0.0;
        log.debug("{}: cociente de pivotes min/max = {}", getName(), ratio);
        if (!(ratio >= singularityTolerance)) {
            throw FemModelException.numerical("La matriz de rigidez reducida es singular o está mal condicionada"
                    + " (min|pivote|/max|pivote| = " + ratio + " < " + singularityTolerance
                    + "). Revise que todos los modos de sólido rígido estén restringidos.");
        }
    }
}
