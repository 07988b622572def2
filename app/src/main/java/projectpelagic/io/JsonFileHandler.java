package projectpelagic.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import projectpelagic.config.LikelihoodConfig;
import projectpelagic.domain.likelihood.LikelihoodResult;
import projectpelagic.domain.likelihood.LikelihoodRunReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lectura de configuraciones y escritura del registro de ejecución en JSON.
 * <p>
 * Las fechas se serializan en ISO-8601 ({@code 2024-03-01}), no como arrays numéricos.
 */
@Slf4j
public class JsonFileHandler {

    // Thread-safe, se reutiliza.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * Serializa un objeto a JSON. Si el archivo existe se sobrescribe.
     *
     * @throws IOException Si falla la escritura.
     */
    public <T> void writeToFile(T data, Path path) throws IOException {
        log.info("Serializando {} a {}", data.getClass().getSimpleName(), path.toAbsolutePath());
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(path.toFile(), data);
        } catch (IOException e) {
            log.error("Error al escribir el archivo JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * @throws IOException Si el archivo no existe o no se puede parsear.
     */
    public <T> T readFromFile(Path path, Class<T> objectType) throws IOException {
        log.info("Deserializando {} a {}", path.toAbsolutePath(), objectType.getSimpleName());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error al leer o parsear el archivo JSON {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Escribe el resumen de la ejecución (sin la pila de verosimilitudes).
     */
    public void writeRunReport(LikelihoodResult result, Path path) throws IOException {
        writeToFile(result.toRunReport(), path);
    }

    public LikelihoodRunReport readRunReport(Path path) throws IOException {
        return readFromFile(path, LikelihoodRunReport.class);
    }

    public LikelihoodConfig readConfig(Path path) throws IOException {
        return readFromFile(path, LikelihoodConfig.class);
    }
}
