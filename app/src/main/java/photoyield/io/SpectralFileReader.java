package photoyield.io;

import lombok.extern.slf4j.Slf4j;
import photoyield.domain.exception.InputDataException;
import photoyield.domain.spectra.SpectralDataset;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Lee los ficheros de medida del espectrómetro: filas separadas por espacios en blanco.
 * <ul>
 * <li>Fila 0: metadatos (texto libre).</li>
 * <li>Fila 1: espectro de luz/referencia, un valor por longitud de onda.</li>
 * <li>Fila 2: eje de longitudes de onda.</li>
 * <li>Filas 3+: tiempo transcurrido, indicador auxiliar y una absorbancia por longitud de onda.</li>
 * </ul>
 * Las líneas en blanco se ignoran. Cualquier inconsistencia de longitudes o valor no
 * numérico se notifica como {@link InputDataException}.
 */
@Slf4j
public class SpectralFileReader {

    private static final int LEADING_COLUMNS = 2;

    public SpectralDataset read(Path path) throws IOException {
        log.info("Leyendo fichero espectral {}", path.toAbsolutePath());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            log.error("Error al leer el fichero espectral {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    public SpectralDataset read(Reader source) throws IOException {
        List<String> lines = new ArrayList<>();
        BufferedReader reader = source instanceof BufferedReader br ? br : new BufferedReader(source);
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.isBlank()) {
                lines.add(line.trim());
            }
        }

        if (lines.size() < 4) {
            throw new InputDataException("El fichero necesita metadatos, referencia, eje y al menos una fila de datos; tiene "
                    + lines.size() + " líneas útiles.");
        }

        String metadata = lines.get(0);
        double[] reference = parseRow(lines.get(1), 1);
        double[] wavelengths = parseRow(lines.get(2), 2);
        final int width = wavelengths.length;

        if (reference.length != width) {
            throw new InputDataException("La fila de referencia tiene " + reference.length
                    + " valores y el eje de longitudes de onda " + width + ".");
        }

        int rows = lines.size() - 3;
        double[] times = new double[rows];
        double[] flags = new double[rows];
        double[][] absorbance = new double[rows][];

        for (int r = 0; r < rows; r++) {
            int lineIndex = r + 3;
            double[] values = parseRow(lines.get(lineIndex), lineIndex);
            if (values.length != width + LEADING_COLUMNS) {
                throw new InputDataException("La fila " + lineIndex + " tiene " + values.length
                        + " columnas; se esperaban " + (width + LEADING_COLUMNS)
                        + " (tiempo, indicador y " + width + " longitudes de onda).");
            }
            times[r] = values[0];
            flags[r] = values[1];
            double[] spectrum = new double[width];
            System.arraycopy(values, LEADING_COLUMNS, spectrum, 0, width);
            absorbance[r] = spectrum;
        }

        SpectralDataset dataset = new SpectralDataset(metadata, reference, wavelengths, times, flags, absorbance);
        log.debug("Fichero espectral leído: {} instantes x {} longitudes de onda.", rows, width);
        return dataset;
    }

    private double[] parseRow(String line, int lineIndex) {
        String[] tokens = line.split("\\s+");
        double[] values = new double[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            try {
                values[i] = Double.parseDouble(tokens[i]);
            } catch (NumberFormatException e) {
                throw new InputDataException("Valor no numérico '" + tokens[i] + "' en la fila " + lineIndex
                        + ", columna " + i + ".", e);
            }
            // parseDouble acepta "NaN" e "Infinity".
            if (!Double.isFinite(values[i])) {
                throw new InputDataException("Valor no finito '" + tokens[i] + "' en la fila " + lineIndex
                        + ", columna " + i + ".");
            }
        }
        return values;
    }
}
