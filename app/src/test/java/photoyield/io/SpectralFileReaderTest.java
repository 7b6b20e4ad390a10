package photoyield.io;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import photoyield.domain.exception.InputDataException;
import photoyield.domain.spectra.SpectralDataset;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Pruebas del lector del fichero de medidas: metadatos, referencia, eje y filas de datos.
 */
@Slf4j
class SpectralFileReaderTest {

    private static final String VALID = String.join("\n",
            "Muestra A 25C celda 1cm",
            "0.01 0.02 0.03",
            "350 400 450",
            "0.0 0 1.000 0.800 0.010",
            "",
            "10.0 1 0.900 0.700 0.011",
            "20.0 0 0.810 0.620 0.012");

    private SpectralFileReader reader;

    @BeforeEach
    void setUp() {
        reader = new SpectralFileReader();
    }

    @Test
    @DisplayName("Un fichero bien formado produce la matriz tiempo x longitud de onda")
    void read_shouldParseValidFile() throws IOException {
        // ACT
        SpectralDataset dataset = reader.read(new StringReader(VALID));

        // ASSERT
        assertEquals("Muestra A 25C celda 1cm", dataset.metadata());
        assertEquals(3, dataset.rowCount(), "Las líneas en blanco se ignoran.");
        assertArrayEquals(new double[]{350, 400, 450}, dataset.wavelengths());
        assertArrayEquals(new double[]{0.01, 0.02, 0.03}, dataset.referenceSpectrum());
        assertEquals(20.0, dataset.elapsedTimeAt(2));
        assertEquals(1.0, dataset.auxiliaryFlags()[1]);
        assertEquals(0.62, dataset.absorbanceAt(2, 1), 1e-12);
    }

    @Test
    @DisplayName("Una fila con distinto número de columnas que el eje es un error de entrada")
    void read_shouldRejectRowWidthMismatch() {
        // ARRANGE
        String malformed = VALID + "\n30.0 0 0.7 0.5";

        // ACT & ASSERT
        InputDataException e = assertThrows(InputDataException.class, () -> reader.read(new StringReader(malformed)));
        log.info("Rechazo esperado: {}", e.getMessage());
        assertTrue(e.getMessage().contains("columnas"));
    }

    @Test
    @DisplayName("Una referencia de longitud distinta al eje es un error de entrada")
    void read_shouldRejectReferenceMismatch() {
        String malformed = VALID.replace("0.01 0.02 0.03", "0.01 0.02");
        assertThrows(InputDataException.class, () -> reader.read(new StringReader(malformed)));
    }

    @Test
    @DisplayName("Un valor no numérico se notifica como error de entrada")
    void read_shouldRejectNonNumericValue() {
        String malformed = VALID.replace("0.900", "abc");
        assertThrows(InputDataException.class, () -> reader.read(new StringReader(malformed)));
    }

    @Test
    @DisplayName("Los tokens NaN e Infinity son errores de entrada, no valores del ajuste")
    void read_shouldRejectNonFiniteValues() {
        // ARRANGE
        String withNaN = VALID.replace("0.011", "NaN");
        String withInfinity = VALID.replace("0.620", "Infinity");

        // ACT & ASSERT
        InputDataException e = assertThrows(InputDataException.class, () -> reader.read(new StringReader(withNaN)));
        assertTrue(e.getMessage().contains("no finito"));
        assertThrows(InputDataException.class, () -> reader.read(new StringReader(withInfinity)));
    }

    @Test
    @DisplayName("Un fichero sin filas de datos se rechaza")
    void read_shouldRejectFileWithoutData() {
        assertThrows(InputDataException.class, () -> reader.read(new StringReader("meta\n1 2\n350 400\n")));
    }

    @Test
    @DisplayName("Leer desde disco: existente se parsea, inexistente lanza IOException")
    void read_shouldHandlePaths(@TempDir Path dir) throws IOException {
        // ARRANGE
        Path file = dir.resolve("medidas.txt");
        Files.writeString(file, VALID, StandardCharsets.UTF_8);

        // ACT & ASSERT
        assertEquals(3, reader.read(file).rowCount());
        assertThrows(IOException.class, () -> reader.read(dir.resolve("no-existe.txt")));
    }
}
