package motorlab.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import motorlab.config.RawMotorInput;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lectura de entradas de motor y escritura de informes en JSON.
 * <p>
 * Los enumerados se aceptan sin distinguir mayúsculas ("hybrid", "HTPB"...) y el inyector se
 * identifica por su campo {@code type}. Un campo desconocido es un error: una errata en el
 * nombre de un parámetro no debe convertirse en silencio en un valor por defecto.
 */
@Slf4j
public class MotorInputReader {

    // Costoso de crear y thread-safe: se comparte.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        return JsonMapper.builder()
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    /**
     * @throws IOException si el archivo no existe o el JSON no es válido.
     */
    public RawMotorInput read(Path path) throws IOException {
        log.info("Leyendo entrada de motor desde {}", path.toAbsolutePath());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (IOException e) {
            log.error("Error al leer o parsear la entrada de motor desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    public RawMotorInput read(InputStream in) throws IOException {
        return objectMapper.readValue(in, RawMotorInput.class);
    }

    public RawMotorInput parse(String json) throws IOException {
        return objectMapper.readValue(json, RawMotorInput.class);
    }

    /**
     * Serializa un resultado (rendimiento, diseño de inyector, resumen...) a un archivo JSON.
     * Crea los directorios intermedios si hace falta.
     */
    public <T> void writeReport(T report, Path path) throws IOException {
        log.info("Escribiendo informe {} en {}", report.getClass().getSimpleName(), path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), report);
        } catch (IOException e) {
            log.error("Error al escribir el informe JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    public String toJson(Object report) throws IOException {
        return objectMapper.writeValueAsString(report);
    }
}
