package photoyield.physics.solver;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer.Optimum;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.Pair;
import photoyield.config.AnalysisConfig;
import photoyield.config.ExperimentParameters;
import photoyield.domain.exception.ModelDivergenceException;
import photoyield.domain.exception.NumericalDegeneracyException;
import photoyield.domain.fit.ConvergenceTier;
import photoyield.domain.fit.FitResult;
import photoyield.domain.fit.GoodnessOfFit;
import photoyield.domain.fit.UnknownParameter;
import photoyield.domain.spectra.KineticTrace;
import photoyield.physics.diagnostics.ConvergenceReporter;
import photoyield.physics.i.IDecayFitter;
import photoyield.physics.model.ClosedFormDecayModel;

/**
 * Ajuste no lineal acotado del modelo de forma cerrada sobre los primeros puntos de la
 * traza, variando solo el desconocido (rendimiento cuántico o flujo fotónico).
 * <p>
 * Levenberg-Marquardt con límites impuestos por un {@link ParameterValidator} que
 * recorta el parámetro al intervalo, y jacobiano por diferencias centradas sobre el
 * propio modelo complejo. Se limita a la ventana inicial porque es donde el modelo de
 * una sola especie es válido.
 */
@Slf4j
public class PrimaryDecayFitter implements IDecayFitter {

    private static final double FINITE_DIFFERENCE_STEP = 1e-6;
    private static final double SINGULARITY_THRESHOLD = 1e-14;
    private static final double TOLERANCE = 1e-12;

    private final AnalysisConfig config;

    public PrimaryDecayFitter(AnalysisConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "Levenberg-Marquardt";
    }

    @Override
    public String getDescription() {
        return "Mínimos cuadrados acotados de un parámetro sobre el modelo de decaimiento de forma cerrada";
    }

    @Override
    public FitResult fit(KineticTrace trace, ExperimentParameters params) {
        final UnknownParameter unknown = params.unknownParameter();
        final KineticTrace window = trace.head(params.seedPoints());
        final ClosedFormDecayModel model = ClosedFormDecayModel.of(window, params);
        final double[] times = window.times();
        final double fixed = unknown == UnknownParameter.QUANTUM_YIELD ? params.photonFlux() : params.quantumYield();

        final double lower;
        final double upper;
        final double initialGuess;
        if (unknown == UnknownParameter.QUANTUM_YIELD) {
            lower = config.getQuantumYieldLowerBound();
            upper = config.getQuantumYieldUpperBound();
            initialGuess = config.getQuantumYieldInitialGuess();
        } else {
            lower = config.getPhotonFluxLowerBound();
            upper = config.getPhotonFluxUpperBound();
            initialGuess = config.getPhotonFluxInitialGuess();
        }

        log.info("Ajuste primario de {} sobre {} puntos (límites [{}, {}], inicio {})",
                unknown.getSymbol(), window.size(), lower, upper, initialGuess);

        MultivariateJacobianFunction function = point -> {
            double value = point.getEntry(0);
            double[] predicted = predict(model, times, unknown, value, fixed);

            // Paso relativo; el mínimo absoluto evita h = 0 cuando el parámetro pasa por cero.
            double h = FINITE_DIFFERENCE_STEP * Math.max(Math.abs(value), Math.abs(initialGuess) * 1e-3);
            double[] plus = predict(model, times, unknown, value + h, fixed);
            double[] minus = predict(model, times, unknown, value - h, fixed);

            RealMatrix jacobian = new Array2DRowRealMatrix(times.length, 1);
            for (int i = 0; i < times.length; i++) {
                jacobian.setEntry(i, 0, (plus[i] - minus[i]) / (2.0 * h));
            }
            return new Pair<>(new ArrayRealVector(predicted, false), jacobian);
        };

        ParameterValidator bounds = point -> {
            double clamped = Math.max(lower, Math.min(upper, point.getEntry(0)));
            return new ArrayRealVector(new double[]{clamped}, false);
        };

        LeastSquaresProblem problem = new LeastSquaresBuilder()
                .start(new double[]{initialGuess})
                .model(function)
                .target(window.absorbance())
                .parameterValidator(bounds)
                .lazyEvaluation(false)
                .maxEvaluations(config.getPrimaryMaxEvaluations())
                .maxIterations(config.getPrimaryMaxEvaluations())
                .build();

        LevenbergMarquardtOptimizer optimizer = new LevenbergMarquardtOptimizer()
                .withCostRelativeTolerance(TOLERANCE)
                .withParameterRelativeTolerance(TOLERANCE);

        final Optimum optimum;
        final double unscaledVariance;
        try {
            optimum = optimizer.optimize(problem);
            unscaledVariance = optimum.getCovariances(SINGULARITY_THRESHOLD).getEntry(0, 0);
        } catch (NumericalDegeneracyException e) {
            throw new ModelDivergenceException("El modelo degeneró durante el ajuste primario: " + e.getMessage(), e);
        } catch (MathIllegalStateException | MathIllegalArgumentException | MathArithmeticException e) {
            throw new ModelDivergenceException("El ajuste primario no convergió: " + e.getMessage(), e);
        }

        final double estimate = optimum.getPoint().getEntry(0);
        if (estimate <= lower || estimate >= upper) {
            throw new ModelDivergenceException(String.format(
                    "La solución de %s quedó en un límite de búsqueda (%.6g en [%.6g, %.6g]).",
                    unknown.getSymbol(), estimate, lower, upper));
        }

        // Covarianza escalada por la varianza residual, como en un ajuste de curva clásico.
        final int degreesOfFreedom = Math.max(1, window.size() - 1);
        double[] predicted = predict(model, times, unknown, estimate, fixed);
        GoodnessOfFit goodness = ConvergenceReporter.evaluate(window.absorbance(), predicted);
        double variance = unscaledVariance * goodness.ssr() / degreesOfFreedom;
        if (!Double.isFinite(variance) || variance < 0) {
            throw new ModelDivergenceException("Covarianza indefinida en el ajuste primario: " + variance);
        }

        ConvergenceTier tier = ConvergenceReporter.classify(goodness,
                config.getLooseThreshold(), config.getTightThreshold(), config.getPrimaryExactThreshold());

        log.info("Ajuste primario: {} = {} ± {} ({} iteraciones, R²={}, {})",
                unknown.getSymbol(),
                String.format("%.6g", estimate),
                String.format("%.3g", Math.sqrt(variance)),
                optimum.getIterations(),
                String.format("%.6f", goodness.tightR2()),
                tier.getLabel());

        return FitResult.builder()
                .unknown(unknown)
                .estimate(estimate)
                .variance(variance)
                .standardError(Math.sqrt(variance))
                .predicted(predicted)
                .goodness(goodness)
                .tier(tier)
                .converged(true)
                .iterations(optimum.getIterations())
                .pointsUsed(window.size())
                .build();
    }

    private static double[] predict(ClosedFormDecayModel model, double[] times,
                                    UnknownParameter unknown, double value, double fixed) {
        return unknown == UnknownParameter.QUANTUM_YIELD
                ? model.predict(times, value, fixed)
                : model.predict(times, fixed, value);
    }
}
