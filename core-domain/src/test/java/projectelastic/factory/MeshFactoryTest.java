package projectelastic.factory;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectelastic.domain.exception.FemModelException;
import projectelastic.domain.mesh.ElementTopology;
import projectelastic.domain.mesh.Mesh;
import projectelastic.domain.mesh.Node;
import projectelastic.domain.mesh.SectionProperties;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class MeshFactoryTest {

    private static final SectionProperties SECTION = SectionProperties.planeStress(1000.0, 0.25, 0.1);

    @Test
    @DisplayName("Rejilla de cuadriláteros: numeración por filas y conectividad antihoraria")
    void rectangularQuadGrid_shouldNumberRowMajor() {
        log.info(">>> TEST: Rejilla 3x2 de QUAD4");

        // ACT
        Mesh mesh = MeshFactory.rectangularQuadGrid(0.0, 0.0, 3.0, 2.0, 3, 2, 4, SECTION);

        // ASSERT
        assertEquals(12, mesh.numberOfNodes());
        assertEquals(6, mesh.numberOfElements());
        assertEquals(new Node(1, 0.0, 0.0), mesh.node(1));
        assertEquals(new Node(4, 3.0, 0.0), mesh.node(4));
        assertEquals(new Node(5, 0.0, 1.0), mesh.node(5));
        assertEquals(new Node(12, 3.0, 2.0), mesh.node(12));

        assertArrayEquals(new int[]{1, 2, 6, 5}, mesh.element(1).nodeIds());
        assertArrayEquals(new int[]{7, 8, 12, 11}, mesh.element(6).nodeIds());
        assertEquals(ElementTopology.QUAD4, mesh.element(1).topology());
    }

    @Test
    @DisplayName("Rejilla de triángulos: dos triángulos antihorarios por celda")
    void rectangularTriangleGrid_shouldSplitCells() {
        Mesh mesh = MeshFactory.rectangularTriangleGrid(1.0, 1.0, 2.0, 1.0, 2, 1, 1, SECTION);

        assertEquals(6, mesh.numberOfNodes());
        assertEquals(4, mesh.numberOfElements());
        assertArrayEquals(new int[]{1, 2, 5}, mesh.element(1).nodeIds());
        assertArrayEquals(new int[]{1, 5, 4}, mesh.element(2).nodeIds());
        assertEquals(new Node(6, 3.0, 2.0), mesh.node(6));
    }

    @Test
    @DisplayName("Parámetros inválidos: sin divisiones o con dimensiones no positivas")
    void grid_invalidArguments_shouldThrow() {
        assertThrows(FemModelException.class,
                () -> MeshFactory.rectangularQuadGrid(0, 0, 1, 1, 0, 1, 4, SECTION));
        assertThrows(FemModelException.class,
                () -> MeshFactory.rectangularQuadGrid(0, 0, -1, 1, 1, 1, 4, SECTION));
    }
}
