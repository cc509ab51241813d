package projectelastic.domain.mesh;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectelastic.domain.exception.FemModelException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class MeshBuilderTest {

    private static final SectionProperties STEEL = SectionProperties.planeStress(210000.0, 0.3, 1.0);

    private MeshBuilder builder;

    @BeforeEach
    void setUp() {
        builder = Mesh.builder();
    }

    @Test
    @DisplayName("Ids automáticos: empiezan en 1 y continúan desde el máximo existente")
    void addNode_autoIds_shouldContinueFromMaximum() {
        log.info(">>> TEST: Ids autoincrementales");

        // ARRANGE & ACT
        int first = builder.addNode(0.0, 0.0);
        int explicit = builder.addNode(10, 1.0, 0.0);
        int next = builder.addNode(2.0, 0.0);

        // ASSERT
        assertEquals(1, first);
        assertEquals(10, explicit);
        assertEquals(11, next, "El siguiente id automático debe ser máximo + 1.");
    }

    @Test
    @DisplayName("Id duplicado: añadir dos nodos con el mismo id debe fallar")
    void addNode_duplicateId_shouldThrowValidation() {
        builder.addNode(5, 0.0, 0.0);

        assertThatThrownBy(() -> builder.addNode(5, 1.0, 1.0))
                .isInstanceOf(FemModelException.class)
                .hasMessageStartingWith("[VALIDATION]")
                .hasMessageContaining("5");
    }

    @Test
    @DisplayName("Conectividad rota: un elemento con un nodo inexistente no permite congelar el mallado")
    void build_elementWithUnknownNode_shouldThrowValidation() {
        builder.addNode(0.0, 0.0);
        builder.addNode(1.0, 0.0);
        builder.addNode(0.0, 1.0);
        builder.addElement(new int[]{1, 2, 99}, 1, STEEL);

        FemModelException ex = assertThrows(FemModelException.class, () -> builder.build());
        assertEquals(FemModelException.ErrorType.VALIDATION, ex.getType());
        assertThat(ex.getMessage()).contains("99");
    }

    @Test
    @DisplayName("Mapa de índices: ids arbitrarios se resuelven a su posición densa")
    void build_shouldMapIdsToDenseIndices() {
        // ARRANGE: ids no correlativos
        builder.addNode(100, 0.0, 0.0);
        builder.addNode(7, 1.0, 0.0);
        builder.addNode(42, 0.0, 1.0);
        builder.addElement(3, new int[]{100, 7, 42}, 1, STEEL);

        // ACT
        Mesh mesh = builder.build();

        // ASSERT
        assertEquals(0, mesh.nodeIndex(100));
        assertEquals(1, mesh.nodeIndex(7));
        assertEquals(2, mesh.nodeIndex(42));
        assertArrayEquals(new int[]{0, 1, 2}, mesh.elementNodeIndices(mesh.element(3)));
        assertEquals(6, mesh.totalDof());
        assertThatThrownBy(() -> mesh.nodeIndex(8)).isInstanceOf(FemModelException.class);
    }

    @Test
    @DisplayName("Mallado deformado: mismos ids y elementos, coordenadas desplazadas")
    void withDisplacedNodes_shouldKeepTopology() {
        builder.addNode(0.0, 0.0);
        builder.addNode(1.0, 0.0);
        builder.addNode(0.0, 1.0);
        builder.addElement(new int[]{1, 2, 3}, 1, STEEL);
        Mesh mesh = builder.build();

        Mesh deformed = mesh.withDisplacedNodes(new double[]{0.0, 0.5, 0.0}, new double[]{0.0, 0.0, -0.25});

        assertEquals(mesh.elements(), deformed.elements());
        assertEquals(new Node(2, 1.5, 0.0), deformed.node(2));
        assertEquals(new Node(3, 0.0, 0.75), deformed.node(3));
        assertEquals(new Node(2, 1.0, 0.0), mesh.node(2), "El mallado original no debe cambiar.");
    }
}
