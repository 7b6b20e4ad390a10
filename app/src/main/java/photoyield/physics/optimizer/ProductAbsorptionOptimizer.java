package photoyield.physics.optimizer;

import photoyield.config.AnalysisConfig;
import photoyield.config.ExperimentParameters;
import photoyield.domain.analysis.AnalysisMode;
import photoyield.domain.spectra.KineticTrace;
import photoyield.physics.i.IIntegratedModel;
import photoyield.physics.model.PhotoproductAbsorptionModel;

import java.util.function.DoubleUnaryOperator;

/**
 * Refinamiento conjunto de (qy del reactivo, qy del fotoproducto) cuando el fotoproducto
 * absorbe a la longitud de onda de análisis o de excitación.
 * <p>
 * Gradiente unilateral en cada dirección: (SSR(p·(1±δ)) - SSR(p)) / (δ·|p|). El parámetro
 * se mueve exactamente un factor (1±δ) hacia la dirección con gradiente más negativo.
 * <p>
 * Si ninguna de las dos direcciones reduce el SSR, el parámetro se mantiene en lugar de
 * moverse hacia la que empeora menos: así no oscila alrededor de un mínimo ya alcanzado.
 */
public class ProductAbsorptionOptimizer extends TwoParameterHillClimber {

    public ProductAbsorptionOptimizer(AnalysisConfig config) {
        super(config);
    }

    @Override
    public String getName() {
        return "HillClimb-Fotoproducto";
    }

    @Override
    public String getDescription() {
        return "Búsqueda (qy, qy_prod) con gradientes unilaterales y pasos multiplicativos de ±"
                + (config.getPerturbation() * 100) + " %";
    }

    @Override
    public AnalysisMode getMode() {
        return AnalysisMode.PRODUCT_ABSORPTION;
    }

    @Override
    protected IIntegratedModel createModel(KineticTrace trace, ExperimentParameters params, double photonFlux) {
        return PhotoproductAbsorptionModel.of(trace, params, photonFlux, config.getProductTimeStep());
    }

    @Override
    protected double initialSecond(ExperimentParameters params) {
        return config.getProductQuantumYieldSeed();
    }

    @Override
    protected String firstName() {
        return "qy";
    }

    @Override
    protected String secondName() {
        return "qy_prod";
    }

    @Override
    protected double exactThreshold() {
        return config.getProductExactThreshold();
    }

    @Override
    protected double nextValue(double value, double currentSsr, int attempt, DoubleUnaryOperator ssrAt) {
        if (value == 0.0) {
            return value;
        }
        final double delta = config.getPerturbation();
        final double up = value * (1.0 + delta);
        final double down = value * (1.0 - delta);

        // Gradiente direccional: negativo si el SSR baja al moverse en esa dirección.
        double gradientUp = (ssrAt.applyAsDouble(up) - currentSsr) / Math.abs(up - value);
        double gradientDown = (ssrAt.applyAsDouble(down) - currentSsr) / Math.abs(down - value);

        boolean upImproves = gradientUp < 0;
        boolean downImproves = gradientDown < 0;
        if (upImproves && (!downImproves || gradientUp <= gradientDown)) {
            return up;
        }
        if (downImproves) {
            return down;
        }
        return value;
    }
}
