package projectelastic.physics.solver;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import projectelastic.domain.boundary.AxisConstraint;
import projectelastic.domain.mesh.Element;
import projectelastic.domain.mesh.Mesh;
import projectelastic.physics.boundary.NodalBoundaryTable;
import projectelastic.physics.element.ElementStiffnessBuilder;
import projectelastic.physics.i.ILinearSolver;

/**
 * Sesión de resolución de un cálculo: posee el sistema global K·u = f y lo muta in situ.
 * <p>
 * SECUENCIA:
 * <ol>
 * <li>{@link #assemble()}: ensamblaje de las matrices elementales (2N x 2N).</li>
 * <li>{@link #applyLoads()}: vector de cargas nodales.</li>
 * <li>{@link #applyPrescribedDisplacements()}: sustitución de filas (fila a cero, diagonal k_ii, f = k_ii · valor).</li>
 * <li>{@link #reduce()}: eliminación de filas y columnas de los GDL fijos.</li>
 * <li>{@link #solve(ILinearSolver)} y {@link #expandSolution()}.</li>
 * </ol>
 * Una instancia por llamada a solve; no se reutiliza ni se comparte.
 */
@Slf4j
public class GlobalSystem {

    private final Mesh mesh;
    private final NodalBoundaryTable boundaryTable;
    private final int totalDof;

    @Getter
    private final DMatrixRMaj stiffness;
    @Getter
    private final DMatrixRMaj load;

    /**
     * GDL que permanecen en el sistema reducido, en orden creciente.
     */
    private int[] openDofs;
    @Getter
    private DMatrixRMaj reducedStiffness;
    @Getter
    private DMatrixRMaj reducedLoad;
    private DMatrixRMaj reducedSolution;

    public GlobalSystem(Mesh mesh, NodalBoundaryTable boundaryTable) {
        this.mesh = mesh;
        this.boundaryTable = boundaryTable;
        this.totalDof = mesh.totalDof();
        this.stiffness = new DMatrixRMaj(totalDof, totalDof);
        this.load = new DMatrixRMaj(totalDof, 1);
    }

    /**
     * Vector guía: posiciones globales de los GDL de un elemento, intercalando X e Y
     * por nodo (2·idx, 2·idx + 1).
     */
    public static int[] guideVector(int[] nodeIndices) {
        int[] guide = new int[2 * nodeIndices.length];
        for (int i = 0; i < nodeIndices.length; i++) {
            guide[2 * i] = 2 * nodeIndices[i];
            guide[2 * i + 1] = 2 * nodeIndices[i] + 1;
        }
        return guide;
    }

    public void assemble() {
        for (Element element : mesh.elements()) {
            DMatrixRMaj ke = ElementStiffnessBuilder.stiffness(element, mesh.elementCoordinates(element));
            int[] guide = guideVector(mesh.elementNodeIndices(element));
            for (int r = 0; r < guide.length; r++) {
                for (int c = 0; c < guide.length; c++) {
                    stiffness.add(guide[r], guide[c], ke.get(r, c));
                }
            }
        }
        log.debug("Ensamblados {} elementos en una matriz {}x{}.", mesh.numberOfElements(), totalDof, totalDof);
    }

    public void applyLoads() {
        double[] nodal = boundaryTable.loadVector();
        for (int dof = 0; dof < totalDof; dof++) {
            load.set(dof, 0, nodal[dof]);
        }
    }

    /**
     * Impone cada desplazamiento prescrito por sustitución de filas: la fila se anula,
     * la diagonal conserva su rigidez original k_ii y la carga pasa a ser k_ii · valor.
     * La fila sustituida queda así en la escala de rigidez del resto del sistema.
     * Solo se anula la fila: la matriz deja de ser simétrica.
     */
    public void applyPrescribedDisplacements() {
        double fallbackScale = maxAbsDiagonal();
        int count = 0;
        for (int dof = 0; dof < totalDof; dof++) {
            AxisConstraint constraint = boundaryTable.dofConstraint(dof);
            if (!constraint.isPrescribed()) continue;

            double diagonal = stiffness.get(dof, dof);
            if (!(diagonal > 0.0)) {
                // Nodo sin rigidez propia (no pertenece a ningún elemento)
                diagonal = fallbackScale > 0.0 ? fallbackScale : 1.0;
            }
            for (int c = 0; c < totalDof; c++) {
                stiffness.set(dof, c, 0.0);
            }
            stiffness.set(dof, dof, diagonal);
            load.set(dof, 0, diagonal * constraint.value());
            count++;
        }
        if (count > 0) {
            log.debug("Impuestos {} desplazamientos prescritos por sustitución de filas.", count);
        }
    }

    private double maxAbsDiagonal() {
        double max = 0.0;
        for (int i = 0; i < totalDof; i++) {
            max = Math.max(max, Math.abs(stiffness.get(i, i)));
        }
        return max;
    }

    public void reduce() {
        IntArrayList open = new IntArrayList(totalDof);
        for (int dof = 0; dof < totalDof; dof++) {
            if (!boundaryTable.dofConstraint(dof).isFixed()) {
                open.add(dof);
            }
        }
        openDofs = open.toIntArray();

        int n = openDofs.length;
        reducedStiffness = new DMatrixRMaj(n, n);
        reducedLoad = new DMatrixRMaj(n, 1);
        for (int r = 0; r < n; r++) {
            reducedLoad.set(r, 0, load.get(openDofs[r], 0));
            for (int c = 0; c < n; c++) {
                reducedStiffness.set(r, c, stiffness.get(openDofs[r], openDofs[c]));
            }
        }
        log.debug("Sistema reducido: {} GDL libres de {} totales.", n, totalDof);
    }

    public void solve(ILinearSolver solver) {
        if (openDofs == null) {
            throw new IllegalStateException("El sistema debe reducirse antes de resolverse.");
        }
        if (openDofs.length == 0) {
            reducedSolution = new DMatrixRMaj(0, 1);
            return;
        }
        log.debug("Resolviendo sistema de {} ecuaciones con {}.", openDofs.length, solver.getName());
        reducedSolution = solver.solve(reducedStiffness, reducedLoad);
    }

    /**
     * Vector completo de desplazamientos (2N): ceros en los GDL fijos y el valor
     * exacto en los prescritos.
     */
    public double[] expandSolution() {
        if (reducedSolution == null) {
            throw new IllegalStateException("El sistema no se ha resuelto todavía.");
        }
        double[] full = new double[totalDof];
        for (int i = 0; i < openDofs.length; i++) {
            full[openDofs[i]] = reducedSolution.get(i, 0);
        }
        for (int dof = 0; dof < totalDof; dof++) {
            AxisConstraint constraint = boundaryTable.dofConstraint(dof);
            if (constraint.isPrescribed()) {
                full[dof] = constraint.value();
            }
        }
        return full;
    }

    /**
     * GDL del sistema reducido: 2N menos los ejes fijos.
     */
    public int degreesOfFreedom() {
        return totalDof - boundaryTable.fixedDofCount();
    }

    public int totalDof() {
        return totalDof;
    }

    /**
     * true si ninguna fila ha sido sustituida y la matriz reducida es simétrica.
     */
    public boolean isSymmetric() {
        return !boundaryTable.hasPrescribedDisplacements();
    }

    /**
     * Diferencia máxima |K - Kᵀ| de la matriz global (útil para diagnóstico).
     */
    public double symmetryError() {
        DMatrixRMaj transposed = CommonOps_DDRM.transpose(stiffness, null);
        DMatrixRMaj diff = new DMatrixRMaj(totalDof, totalDof);
        CommonOps_DDRM.subtract(stiffness, transposed, diff);
        return CommonOps_DDRM.elementMaxAbs(diff);
    }
}
