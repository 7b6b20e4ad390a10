package photoyield.domain.spectra;

import photoyield.domain.exception.InputDataException;

import java.util.Objects;

/**
 * Medida espectral resuelta en el tiempo: una fila de absorbancias por instante,
 * todas sobre el mismo eje de longitudes de onda.
 * <p>
 * Se crea una vez por fichero cargado y es inmutable a partir de entonces. Los arrays
 * se copian en la construcción y los accesores devuelven copias; para recorridos
 * punto a punto están los accesores indexados, que no copian nada.
 *
 * @param metadata          Texto libre de la cabecera del fichero.
 * @param referenceSpectrum Espectro de luz/referencia (una absorbancia por longitud de onda).
 * @param wavelengths       Eje de longitudes de onda compartido (nm).
 * @param elapsedTimes      Tiempo transcurrido de cada fila (s), estrictamente creciente.
 * @param auxiliaryFlags    Columna auxiliar de cada fila (estado de la lámpara, válvula...).
 * @param absorbance        Matriz tiempo x longitud de onda.
 */
public record SpectralDataset(
        String metadata,
        double[] referenceSpectrum,
        double[] wavelengths,
        double[] elapsedTimes,
        double[] auxiliaryFlags,
        double[][] absorbance
) {
    public SpectralDataset {
        Objects.requireNonNull(wavelengths, "El eje de longitudes de onda no puede ser nulo.");
        Objects.requireNonNull(elapsedTimes, "El vector de tiempos no puede ser nulo.");
        Objects.requireNonNull(absorbance, "La matriz de absorbancias no puede ser nula.");

        final int width = wavelengths.length;
        final int rows = elapsedTimes.length;
        if (width == 0) {
            throw new InputDataException("El eje de longitudes de onda está vacío.");
        }
        if (rows == 0 || absorbance.length != rows) {
            throw new InputDataException("Se esperaban " + rows + " filas de absorbancia y hay " + absorbance.length + ".");
        }
        if (auxiliaryFlags == null) {
            auxiliaryFlags = new double[rows];
        } else if (auxiliaryFlags.length != rows) {
            throw new InputDataException("La columna auxiliar tiene " + auxiliaryFlags.length + " valores para " + rows + " filas.");
        }
        if (referenceSpectrum != null && referenceSpectrum.length != width) {
            throw new InputDataException("El espectro de referencia tiene " + referenceSpectrum.length
                    + " valores pero el eje tiene " + width + ".");
        }

        double[][] rowsCopy = new double[rows][];
        for (int i = 0; i < rows; i++) {
            if (absorbance[i] == null || absorbance[i].length != width) {
                int found = absorbance[i] == null ? 0 : absorbance[i].length;
                throw new InputDataException("La fila " + i + " tiene " + found
                        + " absorbancias pero el eje de longitudes de onda tiene " + width + ".");
            }
            for (int j = 0; j < width; j++) {
                if (!Double.isFinite(absorbance[i][j])) {
                    throw new InputDataException("Absorbancia no finita (" + absorbance[i][j] + ") en la fila " + i
                            + ", columna " + j + ".");
                }
            }
            if (!Double.isFinite(elapsedTimes[i])) {
                throw new InputDataException("Tiempo no finito en la fila " + i + ".");
            }
            if (i > 0 && !(elapsedTimes[i] > elapsedTimes[i - 1])) {
                throw new InputDataException("El tiempo no es estrictamente creciente en la fila " + i
                        + " (" + elapsedTimes[i - 1] + " -> " + elapsedTimes[i] + ").");
            }
            rowsCopy[i] = absorbance[i].clone();
        }

        metadata = metadata == null ? "" : metadata;
        referenceSpectrum = referenceSpectrum == null ? null : referenceSpectrum.clone();
        wavelengths = wavelengths.clone();
        elapsedTimes = elapsedTimes.clone();
        auxiliaryFlags = auxiliaryFlags.clone();
        absorbance = rowsCopy;
    }

    public double[] referenceSpectrum() {
        return referenceSpectrum == null ? null : referenceSpectrum.clone();
    }

    public double[] wavelengths() {
        return wavelengths.clone();
    }

    public double[] elapsedTimes() {
        return elapsedTimes.clone();
    }

    public double[] auxiliaryFlags() {
        return auxiliaryFlags.clone();
    }

    /** Copia profunda de la matriz: modificarla no altera el conjunto de datos. */
    public double[][] absorbance() {
        double[][] copy = new double[absorbance.length][];
        for (int i = 0; i < absorbance.length; i++) {
            copy[i] = absorbance[i].clone();
        }
        return copy;
    }

    public int rowCount() {
        return elapsedTimes.length;
    }

    public int wavelengthCount() {
        return wavelengths.length;
    }

    public double elapsedTimeAt(int row) {
        return elapsedTimes[row];
    }

    public double wavelengthAt(int index) {
        return wavelengths[index];
    }

    public double absorbanceAt(int row, int wavelengthIndex) {
        return absorbance[row][wavelengthIndex];
    }

    /**
     * Índice del eje más cercano a la longitud de onda pedida (vecino más próximo).
     * En caso de empate gana el índice menor.
     */
    public int nearestWavelengthIndex(double wavelength) {
        int best = 0;
        double bestDistance = Math.abs(wavelengths[0] - wavelength);
        for (int i = 1; i < wavelengths.length; i++) {
            double distance = Math.abs(wavelengths[i] - wavelength);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = i;
            }
        }
        return best;
    }
}
