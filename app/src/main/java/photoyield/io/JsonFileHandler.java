package photoyield.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import photoyield.config.AnalysisConfig;
import photoyield.config.ExperimentParameters;
import photoyield.domain.analysis.AnalysisReport;
import photoyield.domain.exception.InputDataException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Ficheros JSON de una invocación de análisis: parámetros del experimento y
 * configuración del algoritmo a la entrada, informe de resultados a la salida.
 */
@Slf4j
public class JsonFileHandler {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            // Un campo mal escrito en los parámetros no debe ignorarse en silencio.
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    /**
     * Carga los parámetros del experimento. Los campos ausentes quedan nulos, lo que
     * marca el desconocido (qy o I) o la constante térmica no fijada.
     *
     * @throws InputDataException si el JSON es legible pero los parámetros son inconsistentes.
     * @throws IOException        si el fichero no existe o no es JSON válido.
     */
    public ExperimentParameters readParameters(Path file) throws IOException {
        ExperimentParameters params = read(file, ExperimentParameters.class);
        log.info("Parámetros cargados de {}: qy={}, I={}, ventana=[{}, {}), semilla={} puntos",
                file.getFileName(), params.quantumYield(), params.photonFlux(),
                params.startPoint(), params.endPoint(), params.seedPoints());
        return params;
    }

    /**
     * Carga la configuración del algoritmo. El fichero debe traer todos los campos
     * (un campo ausente queda a cero); la forma más segura de crearlo es escribir
     * {@link AnalysisConfig#defaults()} y editar el resultado.
     */
    public AnalysisConfig readConfig(Path file) throws IOException {
        AnalysisConfig config = read(file, AnalysisConfig.class);
        log.info("Configuración cargada de {}: máx. iteraciones={}, perturbación={}",
                file.getFileName(), config.getMaxIterations(), config.getPerturbation());
        return config;
    }

    /**
     * Escribe el informe de un análisis, sobrescribiendo el fichero si ya existe.
     */
    public void writeReport(AnalysisReport report, Path file) throws IOException {
        Path path = file.toAbsolutePath();
        log.info("Escribiendo informe {} ({}) en {}", report.status(), report.mode(), path);
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(path.toFile(), report);
        } catch (IOException e) {
            log.error("No se pudo escribir el informe en {}", path, e);
            throw e;
        }
    }

    private <T> T read(Path file, Class<T> type) throws IOException {
        Path path = file.toAbsolutePath();
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path);
        }
        try {
            return objectMapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            // Jackson envuelve las validaciones del constructor; se recupera el error de dominio.
            if (e.getCause() instanceof InputDataException) {
                throw (InputDataException) e.getCause();
            }
            log.error("Error al leer {} como {}", path, type.getSimpleName(), e);
            throw e;
        }
    }
}
