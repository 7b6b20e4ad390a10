package photoyield.physics.optimizer;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import photoyield.config.AnalysisConfig;
import photoyield.config.ExperimentParameters;
import photoyield.domain.analysis.AnalysisMode;
import photoyield.domain.fit.ConvergenceTier;
import photoyield.domain.fit.FitResult;
import photoyield.domain.fit.IterationRecord;
import photoyield.domain.fit.JointFitResult;
import photoyield.domain.spectra.KineticTrace;
import photoyield.factory.KineticTraceFactory;
import photoyield.physics.model.PhotoproductAbsorptionModel;
import photoyield.physics.solver.PrimaryDecayFitter;
import photoyield.support.SyntheticSpectra;

import static org.junit.jupiter.api.Assertions.*;
import static photoyield.config.PhysicalConstants.AVOGADRO;
import static photoyield.support.SyntheticSpectra.*;

/**
 * Pruebas del optimizador conjunto (qy, qy_prod).
 */
@Slf4j
class ProductAbsorptionOptimizerTest {

    private static final double PRODUCT_EXCITATION = 5e3;
    private static final double PRODUCT_ANALYSIS = 4e3;
    private static final double PRODUCT_YIELD = 0.1;

    private AnalysisConfig config;
    private ProductAbsorptionOptimizer optimizer;

    @BeforeEach
    void setUp() {
        config = AnalysisConfig.defaults();
        optimizer = new ProductAbsorptionOptimizer(config);
    }

    @Test
    @DisplayName("Si el fotoproducto no absorbe, reproduce el qy del ajuste primario")
    void optimize_shouldMatchPrimaryFitWithoutProductAbsorption() {
        // ARRANGE
        ExperimentParameters params = SyntheticSpectra.parameters(20).build();
        KineticTrace trace = new KineticTraceFactory()
                .createTrace(closedFormDataset(20, 10.0, QUANTUM_YIELD, PHOTON_FLUX), params);
        FitResult primary = new PrimaryDecayFitter(config).fit(trace, params);

        // ACT
        JointFitResult result = optimizer.optimize(trace, params, primary.estimate(), PHOTON_FLUX);

        // ASSERT
        assertEquals(AnalysisMode.PRODUCT_ABSORPTION, result.mode());
        assertEquals("qy", result.firstName());
        assertEquals("qy_prod", result.secondName());
        assertEquals(primary.estimate(), result.firstValue(), primary.estimate() * 1e-6);
        assertEquals(config.getProductQuantumYieldSeed(), result.secondValue(), "qy_prod no influye y no debe moverse.");
        assertTrue(result.converged());
        assertEquals(ConvergenceTier.EXACT, result.tier());
        assertEquals(1, result.iterations());
    }

    @Test
    @DisplayName("Partiendo de un qy desviado un 10 % converge hacia el valor real")
    void optimize_shouldImproveDisplacedStart() {
        // ARRANGE
        ExperimentParameters params = productParameters();
        KineticTrace trace = productTrace();
        ProductAbsorptionOptimizer seeded = new ProductAbsorptionOptimizer(config.withProductQuantumYieldSeed(PRODUCT_YIELD));

        // ACT
        JointFitResult result = seeded.optimize(trace, params, QUANTUM_YIELD * 0.9, PHOTON_FLUX);
        log.info("qy={} qy_prod={} tras {} iteraciones", result.firstValue(), result.secondValue(), result.iterations());

        // ASSERT
        assertTrue(result.converged(), "Debe alcanzar R² ≥ " + config.getProductExactThreshold());
        assertEquals(QUANTUM_YIELD, result.firstValue(), QUANTUM_YIELD * 0.05);
        IterationRecord first = result.history().get(0);
        IterationRecord last = result.history().get(result.history().size() - 1);
        assertTrue(last.tightR2() > first.tightR2());
        assertEquals(result.iterations(), result.history().size());
        assertEquals(last.tightR2(), result.goodness().tightR2());
    }

    @Test
    @DisplayName("Dos ejecuciones con las mismas entradas producen historiales idénticos")
    void optimize_shouldBeDeterministic() {
        ExperimentParameters params = productParameters();
        KineticTrace trace = productTrace();

        JointFitResult a = optimizer.optimize(trace, params, QUANTUM_YIELD * 0.8, PHOTON_FLUX);
        JointFitResult b = optimizer.optimize(trace, params, QUANTUM_YIELD * 0.8, PHOTON_FLUX);

        assertEquals(a.history(), b.history());
        assertEquals(a.firstValue(), b.firstValue());
        assertEquals(a.secondValue(), b.secondValue());
    }

    @Test
    @DisplayName("Las evaluaciones degeneradas se registran como fallidas sin abortar ni producir R² NaN")
    void optimize_shouldSurviveDegenerateEvaluations() {
        // ARRANGE
        // b_ex = 0 y ε_p,ex = 0: la absorbancia total de excitación es nula en todo momento.
        KineticTrace transparent = new KineticTrace(new double[]{0, 10, 20, 30}, new double[]{0.8, 0.7, 0.6, 0.5},
                new double[4], ANALYSIS_WAVELENGTH, EXCITATION_WAVELENGTH, ANALYSIS_EXTINCTION, 0.0);
        ProductAbsorptionOptimizer capped = new ProductAbsorptionOptimizer(config.withMaxIterations(5));

        // ACT
        JointFitResult result = capped.optimize(transparent, SyntheticSpectra.parameters(4).build(), QUANTUM_YIELD, PHOTON_FLUX);

        // ASSERT
        assertFalse(result.converged());
        assertEquals(ConvergenceTier.NONE, result.tier());
        assertEquals(5, result.iterations());
        assertNull(result.goodness());
        assertTrue(result.history().stream().allMatch(IterationRecord::isEvaluationFailed));
        assertEquals(QUANTUM_YIELD, result.firstValue(), "Sin evaluaciones válidas los parámetros no se mueven.");
    }

    private static ExperimentParameters productParameters() {
        return SyntheticSpectra.parameters(20)
                .productExcitationExtinction(PRODUCT_EXCITATION)
                .productAnalysisExtinction(PRODUCT_ANALYSIS)
                .build();
    }

    private static KineticTrace productTrace() {
        PhotoproductAbsorptionModel truth = new PhotoproductAbsorptionModel(
                PHOTON_FLUX / (CELL_VOLUME * AVOGADRO), CONCENTRATION,
                EXCITATION_EXTINCTION, PRODUCT_EXCITATION, ANALYSIS_EXTINCTION, PRODUCT_ANALYSIS, 0.0, 1.0);
        return SyntheticSpectra.traceFrom(truth, 20, 10.0, QUANTUM_YIELD, PRODUCT_YIELD);
    }
}
