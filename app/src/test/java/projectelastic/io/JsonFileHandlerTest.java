package projectelastic.io;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import projectelastic.config.SolverConfig;
import projectelastic.domain.boundary.AxisConstraint;
import projectelastic.domain.boundary.Boundaries;
import projectelastic.domain.geometry.Geometry;
import projectelastic.domain.load.Loads;
import projectelastic.domain.mesh.Mesh;
import projectelastic.domain.mesh.SectionProperties;
import projectelastic.domain.model.ModelDefinition;
import projectelastic.domain.model.SolutionSummary;
import projectelastic.domain.solution.Solution;
import projectelastic.factory.MeshFactory;
import projectelastic.physics.simulator.LinearStaticAnalysis;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class JsonFileHandlerTest {

    @TempDir
    Path tempDir;

    private JsonFileHandler handler;
    private Mesh mesh;
    private Geometry geometry;
    private Boundaries boundaries;
    private Loads loads;

    @BeforeEach
    void setUp() {
        handler = new JsonFileHandler();
        mesh = MeshFactory.rectangularQuadGrid(0, 0, 2, 1, 2, 1, 4, SectionProperties.planeStrain(210000.0, 0.3, 0.5));
        geometry = Geometry.polygon(new double[]{0, 0}, new double[]{2, 0}, new double[]{2, 1}, new double[]{0, 1});
        boundaries = new Boundaries();
        boundaries.fixLine(4);
        boundaries.addOnNode(3, AxisConstraint.FREE, AxisConstraint.prescribed(-0.01));
        loads = new Loads();
        loads.addOnLine(2, 100.0, 0.0);
        loads.addOnPoint(3, 0.0, -25.0);
    }

    @Test
    @DisplayName("Modelo: escribir y leer devuelve una definición idéntica")
    void writeAndReadModel_shouldPreserveDefinition() throws IOException {
        log.info(">>> TEST: Persistencia JSON del modelo");

        // ARRANGE
        ModelDefinition model = ModelDefinition.from("barra", mesh, geometry, boundaries, loads);
        Path file = tempDir.resolve("modelos/barra.json");

        // ACT
        handler.writeModel(model, file);
        ModelDefinition read = handler.readModel(file);

        // ASSERT
        assertTrue(Files.exists(file));
        assertEquals(model, read);
        assertEquals(mesh.nodes(), read.toMesh().nodes());
        assertEquals(2.0, read.toGeometry().point(2).x());
        assertTrue(read.toBoundaries().onNodes().get(0).y().isPrescribed());
    }

    @Test
    @DisplayName("Formato: los ejes libres se escriben como \"free\" y la hipótesis plana por su nombre")
    void writeModel_shouldUseReadableTokens() throws IOException {
        Path file = tempDir.resolve("barra.json");

        handler.writeModel(ModelDefinition.from("barra", mesh, geometry, boundaries, loads), file);

        String json = Files.readString(file);
        assertThat(json).contains("\"free\"").contains("PLANE_STRAIN").contains("\"name\" : \"barra\"");
    }

    @Test
    @DisplayName("Solución: el resumen se guarda y se recupera sin pérdidas")
    void writeAndReadSolution_shouldPreserveSummary() throws IOException {
        // ARRANGE
        Solution solution = new LinearStaticAnalysis(SolverConfig.defaults()).solve(mesh, geometry, boundaries, loads);
        Path file = tempDir.resolve("resultado.json");

        // ACT
        handler.writeSolution(solution, file);
        SolutionSummary read = handler.readSolution(file);

        // ASSERT
        assertEquals(SolutionSummary.of(solution), read);
        assertEquals(solution.getResults().size(), read.results().size());
    }

    @Test
    @DisplayName("Archivo inexistente: IOException")
    void readModel_missingFile_shouldThrow() {
        Path missing = tempDir.resolve("no_existe.json");

        IOException ex = assertThrows(IOException.class, () -> handler.readModel(missing));
        assertTrue(ex.getMessage().contains("no existe"));
    }

    @Test
    @DisplayName("JSON inválido: el error de Jackson se propaga como IOException")
    void readModel_malformed_shouldThrow() throws IOException {
        Path file = tempDir.resolve("roto.json");
        Files.writeString(file, "{ \"name\": \"roto\", \"nodes\": [ ");

        assertThrows(IOException.class, () -> handler.readModel(file));
    }
}
