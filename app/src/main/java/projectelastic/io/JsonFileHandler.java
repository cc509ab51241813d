package projectelastic.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import projectelastic.domain.model.ModelDefinition;
import projectelastic.domain.model.SolutionSummary;
import projectelastic.domain.solution.Solution;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Persistencia JSON de modelos y resultados.
 * <p>
 * Un modelo se guarda como {@link ModelDefinition} (mallado, geometría, apoyos y cargas);
 * una solución como {@link SolutionSummary} (desplazamientos, resultados por punto de Gauss y avisos).
 */
@Slf4j
public class JsonFileHandler {

    // Costoso de crear y thread-safe: una instancia compartida.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.findAndRegisterModules();
        return mapper;
    }

    public void writeModel(ModelDefinition model, Path path) throws IOException {
        log.info("Guardando modelo '{}' ({} nodos, {} elementos) en {}",
                model.name(), model.nodes().size(), model.elements().size(), path.toAbsolutePath());
        write(model, path);
    }

    /**
     * Lee un modelo. Las inconsistencias de dominio (ids duplicados, órdenes de integración
     * no soportados, hipótesis plana desconocida) se notifican como {@link IOException} de Jackson.
     */
    public ModelDefinition readModel(Path path) throws IOException {
        return read(path, ModelDefinition.class);
    }

    public void writeSolution(Solution solution, Path path) throws IOException {
        log.info("Guardando resumen de solución ({} GDL, {} puntos de Gauss) en {}",
                solution.getDegreesOfFreedom(), solution.getResults().size(), path.toAbsolutePath());
        write(SolutionSummary.of(solution), path);
    }

    public SolutionSummary readSolution(Path path) throws IOException {
        return read(path, SolutionSummary.class);
    }

    private <T> void write(T data, Path path) throws IOException {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura de {} completada.", data.getClass().getSimpleName());
        } catch (IOException e) {
            log.error("Error fatal al escribir el archivo JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    private <T> T read(Path path, Class<T> type) throws IOException {
        log.info("Leyendo {} desde {}", type.getSimpleName(), path.toAbsolutePath());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try {
            return objectMapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            log.error("Error fatal al leer o interpretar el archivo JSON {}", path.toAbsolutePath(), e);
            throw e;
        }
    }
}
