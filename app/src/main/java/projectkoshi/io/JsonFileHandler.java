package projectkoshi.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serialización y deserialización JSON de configuraciones, puntos de entrenamiento y
 * productos de salida.
 * <p>
 * Comparte un único {@link ObjectMapper} (seguro entre hilos) con indentación y con los
 * módulos de fechas registrados.
 */
@Slf4j
public class JsonFileHandler {

    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.findAndRegisterModules();
        return mapper;
    }

    public static ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Serializa un objeto a un archivo JSON. Si el archivo ya existe, se sobrescribe.
     *
     * @throws IOException Si ocurre un error durante la escritura.
     */
    public <T> void writeToFile(T data, Path path) throws IOException {
        log.info("Serializando objeto de tipo {} a archivo: {}", data.getClass().getSimpleName(), path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura a JSON completada con éxito.");
        } catch (IOException e) {
            log.error("Error fatal al escribir el archivo JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Deserializa un archivo JSON a una instancia del tipo indicado (ej: WatershedConfig.class).
     *
     * @throws IOException Si el archivo no existe o su contenido no es válido.
     */
    public <T> T readFromFile(Path path, Class<T> objectType) throws IOException {
        log.info("Deserializando archivo {} a un objeto de tipo {}", path.toAbsolutePath(), objectType.getSimpleName());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el archivo JSON desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Deserializa un recurso del classpath a un tipo genérico.
     *
     * @throws IOException Si el recurso no existe o su contenido no es válido.
     */
    public <T> T readFromResource(String resource, TypeReference<T> type) throws IOException {
        log.info("Leyendo recurso JSON {}", resource);
        try (InputStream in = JsonFileHandler.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("El recurso especificado no existe en el classpath: " + resource);
            }
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            log.error("Error fatal al leer el recurso JSON {}", resource, e);
            throw e;
        }
    }
}
