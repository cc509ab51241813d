package projectelastic.physics.boundary;

import projectelastic.domain.boundary.AxisConstraint;
import projectelastic.domain.solution.ConsolidationNotice;

import java.util.Arrays;
import java.util.List;

/**
 * Apoyos y cargas ya resueltos a nodos: una entrada por nodo del mallado (índice denso)
 * y por eje. Los grados de libertad siguen el convenio 2·i (X), 2·i + 1 (Y).
 */
public final class NodalBoundaryTable {

    private final AxisConstraint[] constraints;
    private final double[] loads;
    private final List<ConsolidationNotice> notices;

    NodalBoundaryTable(AxisConstraint[] constraints, double[] loads, List<ConsolidationNotice> notices) {
        this.constraints = constraints;
        this.loads = loads;
        this.notices = List.copyOf(notices);
    }

    public int numberOfNodes() {
        return constraints.length / 2;
    }

    public AxisConstraint constraintX(int nodeIndex) {
        return constraints[2 * nodeIndex];
    }

    public AxisConstraint constraintY(int nodeIndex) {
        return constraints[2 * nodeIndex + 1];
    }

    public double forceX(int nodeIndex) {
        return loads[2 * nodeIndex];
    }

    public double forceY(int nodeIndex) {
        return loads[2 * nodeIndex + 1];
    }

    public AxisConstraint dofConstraint(int dof) {
        return constraints[dof];
    }

    /**
     * Vector de cargas nodales (2N), copia.
     */
    public double[] loadVector() {
        return loads.clone();
    }

    public int fixedDofCount() {
        return (int) Arrays.stream(constraints).filter(AxisConstraint::isFixed).count();
    }

    public int prescribedDofCount() {
        return (int) Arrays.stream(constraints).filter(AxisConstraint::isPrescribed).count();
    }

    public boolean hasPrescribedDisplacements() {
        return prescribedDofCount() > 0;
    }

    public List<ConsolidationNotice> notices() {
        return notices;
    }
}
