package photoyield.factory;

import lombok.extern.slf4j.Slf4j;
import photoyield.config.ExperimentParameters;
import photoyield.domain.exception.InputDataException;
import photoyield.domain.spectra.KineticTrace;
import photoyield.domain.spectra.SpectralDataset;

/**
 * Construye la {@link KineticTrace} a partir de la matriz espectral y los parámetros
 * del experimento.
 * <p>
 * Pasos:
 * 1. Localiza (vecino más próximo) las columnas de referencia cero, excitación y análisis.
 * 2. Resta, instante a instante, la absorbancia de la referencia cero: elimina la deriva
 *    de offset del instrumento común a todas las longitudes de onda.
 * 3. Autocalibra las absortividades aparentes b y b_ex con la primera muestra corregida,
 *    b = A(0) / (c₀·l), en lugar de confiar solo en el coeficiente de extinción introducido.
 */
@Slf4j
public class KineticTraceFactory {

    /** Discrepancia relativa tolerada entre coeficiente introducido y absortividad aparente. */
    static final double CONSISTENCY_TOLERANCE = 0.10;

    public KineticTrace createTrace(SpectralDataset dataset, ExperimentParameters params) {
        final int zeroIndex = dataset.nearestWavelengthIndex(params.zeroReferenceWavelength());
        final int excitationIndex = dataset.nearestWavelengthIndex(params.excitationWavelength());
        final int analysisIndex = dataset.nearestWavelengthIndex(params.analysisWavelength());

        final int start = params.startPoint();
        final int end = Math.min(params.endPoint(), dataset.rowCount());
        final int count = end - start;
        if (count < 2) {
            throw new InputDataException("La ventana de análisis [" + start + ", " + params.endPoint()
                    + ") deja " + Math.max(count, 0) + " muestras útiles de " + dataset.rowCount() + "; se necesitan al menos 2.");
        }

        double[] times = new double[count];
        double[] analysis = new double[count];
        double[] excitation = new double[count];
        final double t0 = dataset.elapsedTimeAt(start);

        for (int i = 0; i < count; i++) {
            int row = start + i;
            double zero = dataset.absorbanceAt(row, zeroIndex);
            times[i] = dataset.elapsedTimeAt(row) - t0;
            analysis[i] = dataset.absorbanceAt(row, analysisIndex) - zero;
            excitation[i] = dataset.absorbanceAt(row, excitationIndex) - zero;
        }

        final double concentrationTimesPath = params.startingConcentration() * params.pathLength();
        final double b = analysis[0] / concentrationTimesPath;
        final double bEx = excitation[0] / concentrationTimesPath;

        // Sin absorbancia inicial positiva el modelo no puede calibrarse (división por b_ex).
        if (!(b > 0) || !(bEx > 0)) {
            throw new InputDataException(String.format(
                    "Absorbancia inicial corregida no positiva (análisis=%.4g, excitación=%.4g); no se puede calibrar el modelo.",
                    analysis[0], excitation[0]));
        }

        warnIfInconsistent("análisis", params.reactantAnalysisExtinction(), b);
        warnIfInconsistent("excitación", params.reactantExcitationExtinction(), bEx);

        log.info("Traza extraída: {} puntos, λ análisis={} nm, λ excitación={} nm, λ cero={} nm, b={}, b_ex={}",
                count,
                dataset.wavelengthAt(analysisIndex),
                dataset.wavelengthAt(excitationIndex),
                dataset.wavelengthAt(zeroIndex),
                String.format("%.4g", b),
                String.format("%.4g", bEx));

        return new KineticTrace(times, analysis, excitation,
                dataset.wavelengthAt(analysisIndex),
                dataset.wavelengthAt(excitationIndex),
                b, bEx);
    }

    /**
     * Avisa si el coeficiente de extinción introducido
     * se aleja de la absortividad autocalibrada más de {@link #CONSISTENCY_TOLERANCE}.
     * El modelo usa siempre el valor autocalibrado.
     */
    private static void warnIfInconsistent(String label, double supplied, double apparent) {
        if (!(supplied > 0)) {
            return;
        }
        double relative = Math.abs(apparent - supplied) / supplied;
        if (relative > CONSISTENCY_TOLERANCE) {
            log.warn("La absortividad aparente en {} ({}) difiere un {} % del coeficiente introducido ({}).",
                    label,
                    String.format("%.4g", apparent),
                    String.format("%.1f", relative * 100),
                    String.format("%.4g", supplied));
        }
    }
}
