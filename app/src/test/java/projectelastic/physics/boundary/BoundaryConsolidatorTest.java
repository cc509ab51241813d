package projectelastic.physics.boundary;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectelastic.config.SolverConfig;
import projectelastic.domain.boundary.AxisConstraint;
import projectelastic.domain.boundary.Boundaries;
import projectelastic.domain.exception.FemModelException;
import projectelastic.domain.geometry.Geometry;
import projectelastic.domain.load.Loads;
import projectelastic.domain.mesh.Mesh;
import projectelastic.domain.mesh.MeshBuilder;
import projectelastic.domain.mesh.SectionProperties;
import projectelastic.domain.solution.ConsolidationNotice;
import projectelastic.factory.MeshFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class BoundaryConsolidatorTest {

    private static final SectionProperties STEEL = SectionProperties.planeStress(210000.0, 0.3, 1.0);
    private static final double EPS = 1e-12;

    private Mesh mesh;
    private Geometry geometry;
    private Boundaries boundaries;
    private Loads loads;
    private BoundaryConsolidator consolidator;

    @BeforeEach
    void setUp() {
        // Rejilla 2x1 sobre el rectángulo [0,2]x[0,1]
        // Nodos: 1 (0,0), 2 (1,0), 3 (2,0), 4 (0,1), 5 (1,1), 6 (2,1)
        // Líneas: 1 inferior, 2 derecha, 3 superior, 4 izquierda
        mesh = MeshFactory.rectangularQuadGrid(0, 0, 2, 1, 2, 1, 4, STEEL);
        geometry = Geometry.polygon(new double[]{0, 0}, new double[]{2, 0}, new double[]{2, 1}, new double[]{0, 1});
        boundaries = new Boundaries();
        loads = new Loads();
        consolidator = new BoundaryConsolidator(SolverConfig.defaults());
    }

    @Test
    @DisplayName("Empotramiento de línea: todos los nodos de la línea izquierda quedan fijos en X e Y")
    void consolidate_fixedLine_shouldFixAllNodesOnLine() {
        log.info(">>> TEST: Empotramiento sobre línea");

        // ARRANGE
        boundaries.fixLine(4);

        // ACT
        NodalBoundaryTable table = consolidator.consolidate(mesh, geometry, boundaries, loads);

        // ASSERT
        assertEquals(4, table.fixedDofCount());
        assertTrue(table.constraintX(mesh.nodeIndex(1)).isFixed());
        assertTrue(table.constraintY(mesh.nodeIndex(4)).isFixed());
        assertTrue(table.constraintX(mesh.nodeIndex(2)).isFree());
        assertFalse(table.hasPrescribedDisplacements());
        assertThat(table.notices()).isEmpty();
    }

    @Test
    @DisplayName("Prioridad: un eje fijo en cualquier definición gana a un desplazamiento prescrito")
    void consolidate_fixedBeatsPrescribed() {
        // ARRANGE: nodo 1 prescrito en X; la línea izquierda lo fija
        boundaries.addOnNode(1, AxisConstraint.prescribed(0.5), AxisConstraint.FREE);
        boundaries.addOnLine(4, AxisConstraint.FIXED, AxisConstraint.FREE);

        // ACT
        NodalBoundaryTable table = consolidator.consolidate(mesh, geometry, boundaries, loads);

        // ASSERT
        assertTrue(table.constraintX(mesh.nodeIndex(1)).isFixed());
        assertTrue(table.constraintY(mesh.nodeIndex(1)).isFree());
        assertEquals(0, table.prescribedDofCount());
    }

    @Test
    @DisplayName("Prioridad: entre prescritos gana el primero (nodos antes que puntos)")
    void consolidate_firstPrescribedWins() {
        // ARRANGE: punto 3 = (2, 1) → nodo 6
        boundaries.addOnPoint(3, AxisConstraint.FREE, AxisConstraint.prescribed(-0.2));
        boundaries.addOnNode(6, AxisConstraint.FREE, AxisConstraint.prescribed(-0.1));

        // ACT
        NodalBoundaryTable table = consolidator.consolidate(mesh, geometry, boundaries, loads);

        // ASSERT
        AxisConstraint y = table.constraintY(mesh.nodeIndex(6));
        assertTrue(y.isPrescribed());
        assertEquals(-0.1, y.value(), EPS);
        assertTrue(table.hasPrescribedDisplacements());
    }

    @Test
    @DisplayName("Fijo y libre sobre el mismo eje desde fuentes distintas: el resultado es fijo (valor 0)")
    void consolidate_fixedAndFree_shouldResolveToFixed() {
        // ARRANGE: libre en X desde el nodo, fijo en X desde el punto 1 = (0, 0)
        boundaries.addOnNode(1, AxisConstraint.FREE, AxisConstraint.FREE);
        boundaries.addOnPoint(1, AxisConstraint.FIXED, AxisConstraint.FREE);

        // ACT
        NodalBoundaryTable table = consolidator.consolidate(mesh, geometry, boundaries, loads);

        // ASSERT
        AxisConstraint x = table.constraintX(mesh.nodeIndex(1));
        assertTrue(x.isFixed());
        assertEquals(0.0, x.value(), 0.0);
        assertTrue(table.constraintY(mesh.nodeIndex(1)).isFree());
    }

    @Test
    @DisplayName("Cargas puntuales sobre un mismo nodo: suma por componentes")
    void consolidate_pointLoads_shouldAccumulate() {
        // ARRANGE: el punto 2 = (2, 0) se resuelve al nodo 3
        loads.addOnNode(3, 5.0, 0.0);
        loads.addOnPoint(2, -2.0, 3.0);

        // ACT
        NodalBoundaryTable table = consolidator.consolidate(mesh, geometry, boundaries, loads);

        // ASSERT
        int index = mesh.nodeIndex(3);
        assertEquals(3.0, table.forceX(index), EPS);
        assertEquals(3.0, table.forceY(index), EPS);
        assertEquals(12, table.loadVector().length);
    }

    @Test
    @DisplayName("Carga lineal sobre elementos lineales: ½ de cada arista a cada extremo")
    void consolidate_lineLoad_linearEdges() {
        log.info(">>> TEST: Reparto de carga lineal en QUAD4");

        // ARRANGE
        loads.addOnLine(3, 0.0, -10.0);

        // ACT
        NodalBoundaryTable table = consolidator.consolidate(mesh, geometry, boundaries, loads);

        // ASSERT: el nodo central recibe la contribución de dos aristas
        assertEquals(-5.0, table.forceY(mesh.nodeIndex(4)), EPS);
        assertEquals(-10.0, table.forceY(mesh.nodeIndex(5)), EPS);
        assertEquals(-5.0, table.forceY(mesh.nodeIndex(6)), EPS);
        assertEquals(0.0, table.forceX(mesh.nodeIndex(5)), EPS);

        double total = 0.0;
        double[] f = table.loadVector();
        for (int i = 1; i < f.length; i += 2) {
            total += f[i];
        }
        assertEquals(-20.0, total, 1e-9, "La resultante debe ser q · longitud.");
    }

    @Test
    @DisplayName("Carga lineal sobre elementos cuadráticos: ⅙, ⅙ y ⅔ de la arista")
    void consolidate_lineLoad_quadraticEdge() {
        // ARRANGE: un TRIA6 con vértices (0,0), (2,0), (0,2)
        Mesh tria6 = quadraticTriangle();
        Geometry line = new Geometry();
        int a = line.addPoint(0, 0);
        int b = line.addPoint(2, 0);
        int lineId = line.addLine(a, b);
        loads.addOnLine(lineId, 0.0, -6.0);

        // ACT
        NodalBoundaryTable table = consolidator.consolidate(tria6, line, boundaries, loads);

        // ASSERT
        assertEquals(-2.0, table.forceY(tria6.nodeIndex(1)), EPS);
        assertEquals(-2.0, table.forceY(tria6.nodeIndex(2)), EPS);
        assertEquals(-8.0, table.forceY(tria6.nodeIndex(4)), EPS);
        assertEquals(0.0, table.forceY(tria6.nodeIndex(3)), EPS);
    }

    @Test
    @DisplayName("Carga lineal que no termina en vértices de un elemento cuadrático: error de validación")
    void consolidate_lineLoad_quadraticPartialEdge_shouldThrow() {
        Mesh tria6 = quadraticTriangle();
        Geometry line = new Geometry();
        int a = line.addPoint(0, 0);
        int b = line.addPoint(1, 0);
        loads.addOnLine(line.addLine(a, b), 0.0, -6.0);

        assertThatThrownBy(() -> consolidator.consolidate(tria6, line, boundaries, loads))
                .isInstanceOf(FemModelException.class)
                .hasMessageContaining("vértices");
    }

    @Test
    @DisplayName("Línea sin nodos (modo permisivo): la definición se ignora y queda un aviso")
    void consolidate_emptyLine_shouldProduceNotice() {
        // ARRANGE: línea fuera del mallado
        int p = geometry.addPoint(5, 5);
        int q = geometry.addPoint(6, 5);
        int outside = geometry.addLine(p, q);
        int boundaryId = boundaries.fixLine(outside);
        int loadId = loads.addOnLine(outside, 1.0, 0.0);

        // ACT
        NodalBoundaryTable table = consolidator.consolidate(mesh, geometry, boundaries, loads);

        // ASSERT
        assertEquals(0, table.fixedDofCount());
        assertThat(table.notices()).hasSize(2);
        ConsolidationNotice first = table.notices().get(0);
        assertEquals(ConsolidationNotice.Kind.EMPTY_LINE_BOUNDARY, first.kind());
        assertEquals(outside, first.lineId());
        assertEquals(boundaryId, first.definitionId());
        assertEquals(ConsolidationNotice.Kind.EMPTY_LINE_LOAD, table.notices().get(1).kind());
        assertEquals(loadId, table.notices().get(1).definitionId());
        assertThat(table.loadVector()).containsOnly(0.0);
    }

    @Test
    @DisplayName("Línea sin nodos (modo estricto): error de validación")
    void consolidate_emptyLine_strict_shouldThrow() {
        int p = geometry.addPoint(5, 5);
        int q = geometry.addPoint(6, 5);
        boundaries.fixLine(geometry.addLine(p, q));
        BoundaryConsolidator strict = new BoundaryConsolidator(SolverConfig.defaults().withStrictLineResolution(true));

        FemModelException ex = assertThrows(FemModelException.class,
                () -> strict.consolidate(mesh, geometry, boundaries, loads));
        assertEquals(FemModelException.ErrorType.VALIDATION, ex.getType());
    }

    private static Mesh quadraticTriangle() {
        MeshBuilder builder = Mesh.builder();
        builder.addNode(1, 0, 0);
        builder.addNode(2, 2, 0);
        builder.addNode(3, 0, 2);
        builder.addNode(4, 1, 0);
        builder.addNode(5, 1, 1);
        builder.addNode(6, 0, 1);
        builder.addElement(new int[]{1, 2, 3, 4, 5, 6}, 3, STEEL);
        return builder.build();
    }
}
