package photoyield.physics.optimizer;

import photoyield.config.AnalysisConfig;
import photoyield.config.ExperimentParameters;
import photoyield.domain.analysis.AnalysisMode;
import photoyield.domain.spectra.KineticTrace;
import photoyield.physics.i.IIntegratedModel;
import photoyield.physics.model.ThermalReversionModel;

import java.util.function.DoubleUnaryOperator;

/**
 * Refinamiento conjunto de (qy, k) cuando el reactivo revierte térmicamente.
 * <p>
 * Gradiente simétrico (SSR(p + δ|p|) - SSR(p - δ|p|)) / (2δ|p|) y paso cuesta abajo de
 * tamaño relativo δ. A partir de la iteración {@code dampingOnset} el paso se divide por
 * (intento / dampingOnset) para frenar la oscilación cerca del mínimo. Un paso solo se
 * acepta si reduce el SSR.
 * <p>
 * Una k fijada en {@link ExperimentParameters#thermalRateConstant()} es solo el punto de
 * partida de la búsqueda, no un valor que se respete: el optimizador la ajusta junto con qy.
 * La excepción es k = 0, punto fijo de los pasos multiplicativos, con el que el modelo se
 * reduce al decaimiento simple.
 */
public class ThermalBackConversionOptimizer extends TwoParameterHillClimber {

    public ThermalBackConversionOptimizer(AnalysisConfig config) {
        super(config);
    }

    @Override
    public String getName() {
        return "HillClimb-Termico";
    }

    @Override
    public String getDescription() {
        return "Búsqueda (qy, k) con gradientes simétricos y paso amortiguado desde la iteración "
                + config.getDampingOnset();
    }

    @Override
    public AnalysisMode getMode() {
        return AnalysisMode.THERMAL_BACK_CONVERSION;
    }

    @Override
    protected IIntegratedModel createModel(KineticTrace trace, ExperimentParameters params, double photonFlux) {
        return ThermalReversionModel.of(trace, params, photonFlux, config.getThermalTimeStep());
    }

    @Override
    protected double initialSecond(ExperimentParameters params) {
        return params.thermalRateConstantOr(config.getThermalRateSeed());
    }

    @Override
    protected String firstName() {
        return "qy";
    }

    @Override
    protected String secondName() {
        return "k";
    }

    @Override
    protected double exactThreshold() {
        return config.getThermalExactThreshold();
    }

    @Override
    protected double nextValue(double value, double currentSsr, int attempt, DoubleUnaryOperator ssrAt) {
        if (value == 0.0) {
            return value;
        }
        final double delta = config.getPerturbation();
        final double magnitude = Math.abs(value);
        final double ssrPlus = ssrAt.applyAsDouble(value + delta * magnitude);
        final double ssrMinus = ssrAt.applyAsDouble(value - delta * magnitude);
        final double gradient = (ssrPlus - ssrMinus) / (2.0 * delta * magnitude);

        if (Double.isNaN(gradient) || gradient == 0.0) {
            return value;
        }

        final int onset = config.getDampingOnset();
        final double scale = attempt > onset ? delta / ((double) attempt / onset) : delta;
        final double trial = value - Math.signum(gradient) * scale * magnitude;

        // Sin amortiguar, el punto de prueba coincide con una de las perturbaciones ya evaluadas.
        final double trialSsr;
        if (scale == delta) {
            trialSsr = gradient < 0 ? ssrPlus : ssrMinus;
        } else {
            trialSsr = ssrAt.applyAsDouble(trial);
        }
        return trialSsr < currentSsr ? trial : value;
    }
}
