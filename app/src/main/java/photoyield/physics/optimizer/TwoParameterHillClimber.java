package photoyield.physics.optimizer;

import lombok.extern.slf4j.Slf4j;
import photoyield.config.AnalysisConfig;
import photoyield.config.ExperimentParameters;
import photoyield.domain.fit.ConvergenceTier;
import photoyield.domain.fit.IterationRecord;
import photoyield.domain.fit.JointFitResult;
import photoyield.domain.spectra.KineticTrace;
import photoyield.physics.i.IIntegratedModel;
import photoyield.physics.i.IJointOptimizer;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

/**
 * Esqueleto común de los optimizadores conjuntos: búsqueda sin derivadas de dos
 * parámetros por empujones multiplicativos, con criterio de convergencia dual.
 * <p>
 * Cada iteración:
 * 1. Calcula el SSR actual.
 * 2. Propone un nuevo valor para cada parámetro por separado, con el otro fijo
 *    (la regla concreta la define la subclase).
 * 3. Aplica ambos cambios, reintegra y calcula R² laxo y estricto.
 * 4. Registra LOOSE / TIGHT y se detiene al superar el umbral exacto.
 * <p>
 * Todo el estado de la búsqueda (valores actuales, nivel, historial) vive en variables
 * locales de {@link #optimize}: no hay campos mutables y las invocaciones concurrentes
 * no interfieren. No hay aleatoriedad: mismas entradas, misma secuencia.
 */
@Slf4j
public abstract class TwoParameterHillClimber implements IJointOptimizer {

    protected final AnalysisConfig config;

    protected TwoParameterHillClimber(AnalysisConfig config) {
        this.config = config;
    }

    protected abstract IIntegratedModel createModel(KineticTrace trace, ExperimentParameters params, double photonFlux);

    protected abstract double initialSecond(ExperimentParameters params);

    protected abstract String firstName();

    protected abstract String secondName();

    protected abstract double exactThreshold();

    /**
     * Valor propuesto para un parámetro.
     *
     * @param value      Valor actual.
     * @param currentSsr SSR con los valores actuales (+∞ si la evaluación falló).
     * @param attempt    Número de iteración (desde 1).
     * @param ssrAt      SSR en función de este parámetro, con el otro fijo.
     */
    protected abstract double nextValue(double value, double currentSsr, int attempt, DoubleUnaryOperator ssrAt);

    @Override
    public final JointFitResult optimize(KineticTrace trace, ExperimentParameters params,
                                         double quantumYield, double photonFlux) {
        final IIntegratedModel model = createModel(trace, params, photonFlux);
        final ResidualEvaluator evaluator = new ResidualEvaluator(model, trace);
        final int maxIterations = config.getMaxIterations();

        double first = quantumYield;
        double second = initialSecond(params);
        ConvergenceTier tier = ConvergenceTier.NONE;
        ResidualEvaluator.Evaluation current = null;
        List<IterationRecord> history = new ArrayList<>();
        int iteration = 0;

        log.info("{}: inicio {}={} {}={} (I={}, máx. {} iteraciones)", getName(),
                firstName(), first, secondName(), second, photonFlux, maxIterations);

        while (iteration < maxIterations) {
            iteration++;
            final double heldFirst = first;
            final double heldSecond = second;
            final double ssr = evaluator.ssr(heldFirst, heldSecond);

            double nextFirst = nextValue(heldFirst, ssr, iteration, v -> evaluator.ssr(v, heldSecond));
            double nextSecond = nextValue(heldSecond, ssr, iteration, v -> evaluator.ssr(heldFirst, v));
            first = nextFirst;
            second = nextSecond;

            current = evaluator.evaluate(first, second);
            double loose = current == null ? Double.NaN : current.goodness().looseR2();
            double tight = current == null ? Double.NaN : current.goodness().tightR2();

            IterationRecord record = new IterationRecord(iteration, trace.analysisWavelength(),
                    firstName(), first, secondName(), second, loose, tight);
            history.add(record);
            log.info(record.toLogLine());

            // Una iteración fallida no cambia el nivel registrado.
            if (current == null) {
                continue;
            }
            if (loose >= config.getLooseThreshold()) {
                tier = tier.max(ConvergenceTier.LOOSE);
            }
            if (tight >= config.getTightThreshold()) {
                tier = tier.max(ConvergenceTier.TIGHT);
            }
            if (tight >= exactThreshold()) {
                tier = ConvergenceTier.EXACT;
                break;
            }
        }

        boolean converged = tier == ConvergenceTier.EXACT;
        if (converged) {
            log.info("{}: convergencia exacta en {} iteraciones ({}={}, {}={})",
                    getName(), iteration, firstName(), first, secondName(), second);
        } else {
            log.warn("{}: sin alcanzar R² ≥ {} tras {} iteraciones; se devuelve la última iteración ({}).",
                    getName(), exactThreshold(), iteration, tier.getLabel());
        }

        return JointFitResult.builder()
                .mode(getMode())
                .firstName(firstName())
                .firstValue(first)
                .secondName(secondName())
                .secondValue(second)
                .photonFlux(photonFlux)
                .predicted(current == null ? null : current.predicted())
                .goodness(current == null ? null : current.goodness())
                .tier(tier)
                .converged(converged)
                .iterations(iteration)
                .history(history)
                .build();
    }
}
