package projectelastic.physics.solver;

import lombok.extern.slf4j.Slf4j;
import org.ejml.dense.row.CommonOps_DDRM;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectelastic.config.SolverConfig;
import projectelastic.domain.boundary.AxisConstraint;
import projectelastic.domain.boundary.Boundaries;
import projectelastic.domain.geometry.Geometry;
import projectelastic.domain.load.Loads;
import projectelastic.domain.mesh.Mesh;
import projectelastic.domain.mesh.SectionProperties;
import projectelastic.factory.MeshFactory;
import projectelastic.physics.boundary.BoundaryConsolidator;
import projectelastic.physics.boundary.NodalBoundaryTable;
import projectelastic.physics.impl.LuLinearSolver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class GlobalSystemTest {

    private static final SectionProperties STEEL = SectionProperties.planeStress(210000.0, 0.3, 1.0);

    private Mesh mesh;
    private Geometry geometry;
    private Boundaries boundaries;
    private Loads loads;

    @BeforeEach
    void setUp() {
        // Nodos 1..6: (0,0) (1,0) (2,0) / (0,1) (1,1) (2,1)
        mesh = MeshFactory.rectangularQuadGrid(0, 0, 2, 1, 2, 1, 4, STEEL);
        geometry = new Geometry();
        boundaries = new Boundaries();
        loads = new Loads();
    }

    private GlobalSystem newSystem() {
        NodalBoundaryTable table = new BoundaryConsolidator(SolverConfig.defaults())
                .consolidate(mesh, geometry, boundaries, loads);
        return new GlobalSystem(mesh, table);
    }

    @Test
    @DisplayName("Vector guía: intercala X e Y por nodo")
    void guideVector_shouldInterleaveAxes() {
        assertThat(GlobalSystem.guideVector(new int[]{0, 2, 5})).containsExactly(0, 1, 4, 5, 10, 11);
    }

    @Test
    @DisplayName("Ensamblaje: matriz 2N x 2N simétrica con el nodo central acoplado a ambos elementos")
    void assemble_shouldProduceSymmetricGlobalMatrix() {
        log.info(">>> TEST: Ensamblaje global");

        // ARRANGE
        GlobalSystem system = newSystem();

        // ACT
        system.assemble();

        // ASSERT
        assertEquals(12, system.getStiffness().getNumRows());
        double scale = CommonOps_DDRM.elementMaxAbs(system.getStiffness());
        assertTrue(system.symmetryError() <= 1e-12 * scale);

        // Nodos 1 y 3 no comparten elemento
        int n1 = 2 * mesh.nodeIndex(1);
        int n3 = 2 * mesh.nodeIndex(3);
        assertEquals(0.0, system.getStiffness().get(n1, n3), 0.0);
        assertNotEquals(0.0, system.getStiffness().get(n1, 2 * mesh.nodeIndex(2)));
    }

    @Test
    @DisplayName("Reducción: los GDL fijos desaparecen y el contador coincide con 2N menos los fijos")
    void reduce_shouldDropFixedDofs() {
        // ARRANGE
        boundaries.addOnNode(1, AxisConstraint.FIXED, AxisConstraint.FIXED);
        boundaries.addOnNode(4, AxisConstraint.FIXED, AxisConstraint.FREE);
        loads.addOnNode(6, 7.0, 0.0);
        GlobalSystem system = newSystem();

        // ACT
        system.assemble();
        system.applyLoads();
        system.applyPrescribedDisplacements();
        system.reduce();

        // ASSERT
        assertEquals(9, system.degreesOfFreedom());
        assertEquals(9, system.getReducedStiffness().getNumRows());
        assertEquals(7.0, CommonOps_DDRM.elementSum(system.getReducedLoad()), 0.0);
        assertTrue(system.isSymmetric());
    }

    @Test
    @DisplayName("Desplazamiento prescrito: fila anulada, diagonal original k_ii y carga k_ii · valor")
    void applyPrescribedDisplacements_shouldSubstituteRow() {
        // ARRANGE
        boundaries.addOnNode(3, AxisConstraint.prescribed(0.01), AxisConstraint.FREE);
        GlobalSystem system = newSystem();
        int dof = 2 * mesh.nodeIndex(3);

        // ACT
        system.assemble();
        double diagonal = system.getStiffness().get(dof, dof);
        system.applyLoads();
        system.applyPrescribedDisplacements();

        // ASSERT
        assertTrue(diagonal > 0.0);
        for (int c = 0; c < system.totalDof(); c++) {
            assertEquals(c == dof ? diagonal : 0.0, system.getStiffness().get(dof, c), 0.0);
        }
        assertEquals(diagonal * 0.01, system.getLoad().get(dof, 0), 0.0);
        assertFalse(system.isSymmetric());
        assertTrue(system.symmetryError() > 0.0, "La sustitución de filas rompe la simetría.");
    }

    @Test
    @DisplayName("Solución expandida: los GDL prescritos llevan exactamente su valor")
    void expandSolution_shouldWriteExactPrescribedValues() {
        // ARRANGE
        boundaries.addOnNode(1, AxisConstraint.FIXED, AxisConstraint.FIXED);
        boundaries.addOnNode(4, AxisConstraint.FIXED, AxisConstraint.FREE);
        boundaries.addOnNode(3, AxisConstraint.prescribed(1e-3), AxisConstraint.FREE);
        GlobalSystem system = newSystem();

        // ACT
        system.assemble();
        system.applyLoads();
        system.applyPrescribedDisplacements();
        system.reduce();
        system.solve(new LuLinearSolver(1e-12));
        double[] u = system.expandSolution();

        // ASSERT
        assertEquals(1e-3, u[2 * mesh.nodeIndex(3)], 0.0);
        assertEquals(0.0, u[2 * mesh.nodeIndex(1)], 0.0);
    }

    @Test
    @DisplayName("Todos los GDL fijos: el sistema reducido está vacío y la solución es nula")
    void solve_allFixed_shouldReturnZeroDisplacement() {
        for (int id = 1; id <= 6; id++) {
            boundaries.addOnNode(id, AxisConstraint.FIXED, AxisConstraint.FIXED);
        }
        loads.addOnNode(5, 100.0, 100.0);
        GlobalSystem system = newSystem();

        system.assemble();
        system.applyLoads();
        system.applyPrescribedDisplacements();
        system.reduce();
        system.solve(new LuLinearSolver(1e-12));

        assertEquals(0, system.degreesOfFreedom());
        assertThat(system.expandSolution()).hasSize(12).containsOnly(0.0);
    }

    @Test
    @DisplayName("Orden de uso: resolver antes de reducir es un error de programación")
    void solve_beforeReduce_shouldThrow() {
        GlobalSystem system = newSystem();

        assertThrows(IllegalStateException.class, () -> system.solve(new LuLinearSolver(1e-12)));
        assertThrows(IllegalStateException.class, system::expandSolution);
    }
}
