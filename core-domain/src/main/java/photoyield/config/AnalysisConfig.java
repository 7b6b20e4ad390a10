package photoyield.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Constantes numéricas del ajuste y de los optimizadores conjuntos.
 * Separa la configuración del algoritmo de los parámetros del experimento.
 */
@Value
@Builder
@With
@Jacksonized
public class AnalysisConfig {

    // --- Ajuste primario (mínimos cuadrados acotados) ---
    double quantumYieldLowerBound;
    double quantumYieldUpperBound;
    double quantumYieldInitialGuess;
    double photonFluxLowerBound;
    double photonFluxUpperBound;
    double photonFluxInitialGuess;
    /**
     * Límite de evaluaciones e iteraciones de Levenberg-Marquardt.
     */
    int primaryMaxEvaluations;

    // --- Búsqueda conjunta ---
    /**
     * Tope de iteraciones de ambos optimizadores conjuntos.
     */
    int maxIterations;
    /**
     * Perturbación relativa (factor de escala multiplicativo) de cada parámetro.
     */
    double perturbation;
    /**
     * Iteración a partir de la cual el optimizador térmico amortigua el paso (paso / (intento / onset)).
     */
    int dampingOnset;
    double productQuantumYieldSeed;
    double thermalRateSeed;

    // --- Integración ---
    /**
     * Paso fijo (s) del modelo con absorción del fotoproducto.
     */
    double productTimeStep;
    /**
     * Paso fijo (s) del modelo con retroconversión térmica.
     */
    double thermalTimeStep;

    // --- Umbrales de convergencia ---
    double looseThreshold;
    double tightThreshold;
    double productExactThreshold;
    double thermalExactThreshold;
    /**
     * Umbral "exacto" aplicado a la calidad del ajuste primario.
     */
    double primaryExactThreshold;

    public static AnalysisConfig defaults() {
        return AnalysisConfig.builder()
                .quantumYieldLowerBound(-1.0)
                .quantumYieldUpperBound(10.0)
                .quantumYieldInitialGuess(0.5)
                .photonFluxLowerBound(0.0)
                .photonFluxUpperBound(1e21)
                .photonFluxInitialGuess(1e15)
                .primaryMaxEvaluations(1000)
                .maxIterations(100)
                .perturbation(0.02)
                .dampingOnset(50)
                .productQuantumYieldSeed(0.5)
                .thermalRateSeed(1e-4)
                .productTimeStep(1.0)
                .thermalTimeStep(0.2)
                .looseThreshold(0.995)
                .tightThreshold(0.995)
                .productExactThreshold(0.999)
                .thermalExactThreshold(0.9999)
                .primaryExactThreshold(0.999)
                .build();
    }
}
