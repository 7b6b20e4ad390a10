package photoyield.physics.diagnostics;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import photoyield.domain.exception.NumericalDegeneracyException;
import photoyield.domain.fit.ConvergenceTier;
import photoyield.domain.fit.GoodnessOfFit;

/**
 * Calidad de ajuste entre traza medida y predicha.
 * <ul>
 * <li><b>R² laxo:</b> cuadrado de la correlación de Pearson. Mide la forma; insensible a escala y offset.</li>
 * <li><b>R² estricto:</b> 1 - SSR/SST. Sensible al acuerdo absoluto.</li>
 * </ul>
 * Funciones puras y sin estado. Una predicción no finita nunca llega al cálculo del R².
 */
public final class ConvergenceReporter {

    /**
     * Prohibido construir esta clase utilidad
     */
    private ConvergenceReporter() {
    }

    /**
     * @throws NumericalDegeneracyException si algún valor predicho no es finito.
     * @throws IllegalArgumentException     si las longitudes no coinciden.
     */
    public static GoodnessOfFit evaluate(double[] measured, double[] predicted) {
        requireComparable(measured, predicted);

        final int n = measured.length;
        double[] residuals = new double[n];
        double ssr = 0.0;
        for (int i = 0; i < n; i++) {
            residuals[i] = measured[i] - predicted[i];
            ssr += residuals[i] * residuals[i];
        }

        double mean = StatUtils.mean(measured);
        double sst = 0.0;
        for (double value : measured) {
            sst += (value - mean) * (value - mean);
        }
        // Traza medida plana: el R² estricto solo tiene sentido si el acuerdo es perfecto.
        double tight = sst > 0 ? 1.0 - ssr / sst : (ssr == 0 ? 1.0 : 0.0);

        double loose = 0.0;
        if (n > 1) {
            double r = new PearsonsCorrelation().correlation(measured, predicted);
            // Varianza nula en alguna de las series: correlación indefinida.
            loose = Double.isNaN(r) ? 0.0 : r * r;
        }

        return new GoodnessOfFit(loose, tight, ssr, residuals);
    }

    /**
     * Suma de cuadrados de los residuos.
     *
     * @throws NumericalDegeneracyException si algún valor predicho no es finito.
     */
    public static double sumOfSquaredResiduals(double[] measured, double[] predicted) {
        requireComparable(measured, predicted);
        double ssr = 0.0;
        for (int i = 0; i < measured.length; i++) {
            double residual = measured[i] - predicted[i];
            ssr += residual * residual;
        }
        return ssr;
    }

    /**
     * Nivel alcanzado por una evaluación. El umbral exacto solo se comprueba sobre el R² estricto.
     */
    public static ConvergenceTier classify(GoodnessOfFit goodness, double looseThreshold,
                                           double tightThreshold, double exactThreshold) {
        if (goodness == null) {
            return ConvergenceTier.NONE;
        }
        if (goodness.tightR2() >= exactThreshold) {
            return ConvergenceTier.EXACT;
        }
        if (goodness.tightR2() >= tightThreshold) {
            return ConvergenceTier.TIGHT;
        }
        if (goodness.looseR2() >= looseThreshold) {
            return ConvergenceTier.LOOSE;
        }
        return ConvergenceTier.NONE;
    }

    private static void requireComparable(double[] measured, double[] predicted) {
        if (measured.length != predicted.length) {
            throw new IllegalArgumentException("Traza medida (" + measured.length + ") y predicha ("
                    + predicted.length + ") deben tener la misma longitud.");
        }
        for (int i = 0; i < predicted.length; i++) {
            if (!Double.isFinite(predicted[i])) {
                throw new NumericalDegeneracyException("Valor predicho no finito en el punto " + i + ": " + predicted[i]);
            }
        }
    }
}
