package photoyield.physics.optimizer;

import lombok.extern.slf4j.Slf4j;
import photoyield.domain.exception.NumericalDegeneracyException;
import photoyield.domain.fit.GoodnessOfFit;
import photoyield.domain.spectra.KineticTrace;
import photoyield.physics.diagnostics.ConvergenceReporter;
import photoyield.physics.i.IIntegratedModel;

/**
 * Enlaza un modelo integrado con la traza medida y convierte las degeneraciones
 * numéricas en evaluaciones fallidas: SSR = +∞ para elegir dirección y
 * {@code null} para la calidad de ajuste.
 */
@Slf4j
final class ResidualEvaluator {

    private final IIntegratedModel model;
    private final double[] times;
    private final double[] measured;

    ResidualEvaluator(IIntegratedModel model, KineticTrace trace) {
        this.model = model;
        this.times = trace.times();
        this.measured = trace.absorbance();
    }

    /**
     * SSR para los parámetros dados, o {@link Double#POSITIVE_INFINITY} si la evaluación degenera.
     */
    double ssr(double first, double second) {
        try {
            return ConvergenceReporter.sumOfSquaredResiduals(measured, model.predict(times, first, second));
        } catch (NumericalDegeneracyException e) {
            log.debug("Evaluación fallida de {} ({}, {}): {}", model.getName(), first, second, e.getMessage());
            return Double.POSITIVE_INFINITY;
        }
    }

    /**
     * Predicción y calidad de ajuste, o {@code null} si la evaluación degenera.
     */
    Evaluation evaluate(double first, double second) {
        try {
            double[] predicted = model.predict(times, first, second);
            return new Evaluation(predicted, ConvergenceReporter.evaluate(measured, predicted));
        } catch (NumericalDegeneracyException e) {
            log.warn("Iteración fallida en {} ({}, {}): {}", model.getName(), first, second, e.getMessage());
            return null;
        }
    }

    record Evaluation(double[] predicted, GoodnessOfFit goodness) {
    }
}
