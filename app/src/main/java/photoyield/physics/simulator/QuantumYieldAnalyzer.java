package photoyield.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import photoyield.config.AnalysisConfig;
import photoyield.config.ExperimentParameters;
import photoyield.domain.analysis.AnalysisMode;
import photoyield.domain.analysis.AnalysisReport;
import photoyield.domain.analysis.AnalysisStatus;
import photoyield.domain.exception.InputDataException;
import photoyield.domain.exception.ModelDivergenceException;
import photoyield.domain.fit.FitResult;
import photoyield.domain.fit.JointFitResult;
import photoyield.domain.fit.UnknownParameter;
import photoyield.domain.spectra.KineticTrace;
import photoyield.domain.spectra.SpectralDataset;
import photoyield.factory.KineticTraceFactory;
import photoyield.io.JsonFileHandler;
import photoyield.io.SpectralFileReader;
import photoyield.physics.i.IDecayFitter;
import photoyield.physics.i.IJointOptimizer;
import photoyield.physics.optimizer.ProductAbsorptionOptimizer;
import photoyield.physics.optimizer.ThermalBackConversionOptimizer;
import photoyield.physics.solver.PrimaryDecayFitter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Fachada de alto nivel de una invocación de análisis:
 * extracción de la traza → ajuste primario → (opcional) refinamiento conjunto.
 * <p>
 * Traduce la taxonomía de errores tipados a un {@link AnalysisReport}: los errores de
 * entrada y las divergencias del ajuste se registran en WARN sin traza de pila y se
 * devuelven como estado; la falta de convergencia de un optimizador conjunto no es un
 * error y produce un informe PROVISIONAL.
 */
@Slf4j
public class QuantumYieldAnalyzer {

    private final KineticTraceFactory traceFactory;
    private final IDecayFitter primaryFitter;
    private final IJointOptimizer productOptimizer;
    private final IJointOptimizer thermalOptimizer;
    private final JsonFileHandler jsonFileHandler;

    public QuantumYieldAnalyzer(AnalysisConfig config) {
        this(new KineticTraceFactory(),
                new PrimaryDecayFitter(config),
                new ProductAbsorptionOptimizer(config),
                new ThermalBackConversionOptimizer(config));
    }

    public QuantumYieldAnalyzer(KineticTraceFactory traceFactory, IDecayFitter primaryFitter,
                                IJointOptimizer productOptimizer, IJointOptimizer thermalOptimizer) {
        this(traceFactory, primaryFitter, productOptimizer, thermalOptimizer, new JsonFileHandler());
    }

    public QuantumYieldAnalyzer(KineticTraceFactory traceFactory, IDecayFitter primaryFitter,
                                IJointOptimizer productOptimizer, IJointOptimizer thermalOptimizer,
                                JsonFileHandler jsonFileHandler) {
        this.jsonFileHandler = jsonFileHandler;
        this.traceFactory = traceFactory;
        this.primaryFitter = primaryFitter;
        this.productOptimizer = productOptimizer;
        this.thermalOptimizer = thermalOptimizer;
        log.info("QuantumYieldAnalyzer inicializado. Primario={}, Fotoproducto={}, Térmico={}",
                primaryFitter.getName(), productOptimizer.getName(), thermalOptimizer.getName());
    }

    /**
     * Crea un analizador con la configuración del algoritmo guardada en JSON.
     */
    public static QuantumYieldAnalyzer fromConfigFile(Path configFile) throws IOException {
        return new QuantumYieldAnalyzer(new JsonFileHandler().readConfig(configFile));
    }

    /**
     * Invocación completa desde disco: parámetros en JSON, medidas en texto e informe
     * escrito en JSON. El informe se escribe también cuando el análisis falla.
     *
     * @throws IOException si algún fichero no puede leerse o el informe no puede escribirse.
     */
    public AnalysisReport analyzeFiles(Path dataFile, Path parametersFile, AnalysisMode mode, Path reportFile)
            throws IOException {
        AnalysisReport report;
        try {
            ExperimentParameters params = jsonFileHandler.readParameters(parametersFile);
            report = analyzeFile(dataFile, params, mode);
        } catch (InputDataException e) {
            log.warn("Parámetros rechazados ({}): {}", parametersFile, e.getMessage());
            report = AnalysisReport.failure(AnalysisStatus.INPUT_ERROR, mode, e.getMessage());
        }
        jsonFileHandler.writeReport(report, reportFile);
        return report;
    }

    /**
     * Lee el fichero de medidas y analiza su contenido.
     *
     * @throws IOException si el fichero no puede leerse. Un fichero legible pero mal formado
     *                     produce un informe INPUT_ERROR.
     */
    public AnalysisReport analyzeFile(Path file, ExperimentParameters params, AnalysisMode mode) throws IOException {
        final SpectralDataset dataset;
        try {
            dataset = new SpectralFileReader().read(file);
        } catch (InputDataException e) {
            log.warn("Fichero de medidas rechazado ({}): {}", file, e.getMessage());
            return AnalysisReport.failure(AnalysisStatus.INPUT_ERROR, mode, e.getMessage());
        }
        return analyze(dataset, params, mode);
    }

    public AnalysisReport analyze(SpectralDataset dataset, ExperimentParameters params, AnalysisMode mode) {
        try {
            return run(dataset, params, mode);
        } catch (InputDataException e) {
            log.warn("Datos de entrada rechazados: {}", e.getMessage());
            return AnalysisReport.failure(AnalysisStatus.INPUT_ERROR, mode, e.getMessage());
        } catch (ModelDivergenceException e) {
            log.warn("El ajuste primario divergió: {}", e.getMessage());
            return AnalysisReport.failure(AnalysisStatus.MODEL_DIVERGENCE, mode, e.getMessage());
        }
    }

    private AnalysisReport run(SpectralDataset dataset, ExperimentParameters params, AnalysisMode mode) {
        final UnknownParameter unknown = params.unknownParameter();
        final KineticTrace trace = traceFactory.createTrace(dataset, params);
        final FitResult primary = primaryFitter.fit(trace, params);

        final double quantumYield = unknown == UnknownParameter.QUANTUM_YIELD ? primary.estimate() : params.quantumYield();
        final double photonFlux = unknown == UnknownParameter.PHOTON_FLUX ? primary.estimate() : params.photonFlux();

        JointFitResult joint = null;
        double estimate = primary.estimate();
        double standardError = primary.standardError();

        IJointOptimizer optimizer = optimizerFor(mode);
        if (optimizer != null) {
            joint = optimizer.optimize(trace, params, quantumYield, photonFlux);
            // Solo el producto qy·I es identificable: en actinometría el cambio relativo de qy
            // se traslada al flujo, manteniendo qy en su valor fijado.
            double refined = unknown == UnknownParameter.QUANTUM_YIELD
                    ? joint.firstValue()
                    : photonFlux * (joint.firstValue() / quantumYield);
            standardError = primary.estimate() != 0.0
                    ? standardError * Math.abs(refined / primary.estimate())
                    : standardError;
            estimate = refined;
        }

        Double fluxPerMilliamp = unknown == UnknownParameter.PHOTON_FLUX && params.ledCurrent() > 0
                ? estimate / params.ledCurrent()
                : null;

        boolean provisional = joint != null && !joint.converged();
        AnalysisStatus status = provisional ? AnalysisStatus.PROVISIONAL : AnalysisStatus.COMPLETED;
        String message = String.format(Locale.ROOT, "%s = %.6g ± %.2g (%s%s)",
                unknown.getSymbol(), estimate, standardError, mode,
                joint == null ? "" : ", " + joint.tier().getLabel());

        if (provisional) {
            log.warn("Análisis provisional: {}", message);
        } else {
            log.info("Análisis completado: {}", message);
        }

        return AnalysisReport.builder()
                .status(status)
                .message(message)
                .mode(mode)
                .unknown(unknown)
                .estimate(estimate)
                .standardError(standardError)
                .primaryFit(primary)
                .jointFit(joint)
                .photonFluxPerMilliamp(fluxPerMilliamp)
                .build();
    }

    private IJointOptimizer optimizerFor(AnalysisMode mode) {
        switch (mode) {
            case PRODUCT_ABSORPTION:
                return productOptimizer;
            case THERMAL_BACK_CONVERSION:
                return thermalOptimizer;
            case SIMPLE:
            default:
                return null;
        }
    }
}
