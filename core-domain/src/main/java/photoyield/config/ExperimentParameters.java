package photoyield.config;

import lombok.Builder;
import lombok.With;
import photoyield.domain.exception.InputDataException;
import photoyield.domain.fit.UnknownParameter;

/**
 * Objeto de valor inmutable con todos los parámetros experimentales de una invocación
 * de análisis. Se construye una sola vez a partir de los valores del operador y se pasa
 * en modo solo lectura a cada función del motor.
 * <p>
 * Exactamente uno de {@code quantumYield} / {@code photonFlux} debe quedar sin fijar
 * ({@code null}) para poder analizar: ese es el desconocido que se estima.
 *
 * @param quantumYield                 Rendimiento cuántico conocido, o {@code null} si se estima.
 * @param photonFlux                   Flujo fotónico conocido (fotones/s), o {@code null} si se estima (actinometría).
 * @param thermalRateConstant          Constante de reversión térmica k (s⁻¹) de partida del optimizador
 *                                     térmico, o {@code null} para usar la semilla configurada.
 * @param startingConcentration        Concentración inicial del reactivo (mol/L).
 * @param reactantExtinctionCoefficient Coeficiente de extinción del reactivo (L mol⁻¹ cm⁻¹).
 * @param reactantExtinctionWavelength Longitud de onda a la que se midió dicho coeficiente (nm).
 * @param reactantExcitationExtinction Extinción del reactivo a la longitud de onda de excitación.
 * @param productExcitationExtinction  Extinción del fotoproducto a la longitud de onda de excitación.
 * @param reactantAnalysisExtinction   Extinción del reactivo a la longitud de onda de análisis.
 * @param productAnalysisExtinction    Extinción del fotoproducto a la longitud de onda de análisis.
 * @param pathLength                   Camino óptico de la celda de flujo (cm).
 * @param cellVolume                   Volumen irradiado de la celda de flujo (L).
 * @param ledCurrent                   Corriente del LED (mA), proxy del flujo fotónico.
 * @param analysisWavelength           Longitud de onda de análisis (nm).
 * @param excitationWavelength         Longitud de onda de excitación (nm).
 * @param zeroReferenceWavelength      Longitud de onda de referencia cero (nm), sin absorción.
 * @param seedPoints                   Número de puntos iniciales usados en el ajuste primario.
 * @param startPoint                   Primer índice (incluido) de la ventana de análisis.
 * @param endPoint                     Último índice (excluido) de la ventana de análisis.
 */
@Builder
@With
public record ExperimentParameters(
        // --- Desconocidos / constantes fijadas ---
        Double quantumYield,
        Double photonFlux,
        Double thermalRateConstant,

        // --- Química ---
        double startingConcentration,
        double reactantExtinctionCoefficient,
        double reactantExtinctionWavelength,
        double reactantExcitationExtinction,
        double productExcitationExtinction,
        double reactantAnalysisExtinction,
        double productAnalysisExtinction,

        // --- Celda de flujo y fuente de luz ---
        double pathLength,
        double cellVolume,
        double ledCurrent,

        // --- Longitudes de onda monitorizadas ---
        double analysisWavelength,
        double excitationWavelength,
        double zeroReferenceWavelength,

        // --- Ventana de análisis ---
        int seedPoints,
        int startPoint,
        int endPoint
) {
    public ExperimentParameters {
        if (!(startingConcentration > 0)) {
            throw new InputDataException("La concentración inicial debe ser positiva: " + startingConcentration);
        }
        if (!(pathLength > 0)) {
            throw new InputDataException("El camino óptico debe ser positivo: " + pathLength);
        }
        if (!(cellVolume > 0)) {
            throw new InputDataException("El volumen de la celda debe ser positivo: " + cellVolume);
        }
        if (startPoint < 0 || endPoint <= startPoint) {
            throw new InputDataException("Ventana de análisis inválida [" + startPoint + ", " + endPoint + ").");
        }
        if (seedPoints < 2) {
            throw new InputDataException("El ajuste primario necesita al menos 2 puntos semilla, recibidos " + seedPoints);
        }
        if (quantumYield != null && photonFlux != null) {
            throw new InputDataException("Solo uno de {rendimiento cuántico, flujo fotónico} puede fijarse como conocido.");
        }
        if (thermalRateConstant != null && thermalRateConstant < 0) {
            throw new InputDataException("La constante térmica k no puede ser negativa: " + thermalRateConstant);
        }
    }

    /**
     * Devuelve cuál de los dos parámetros se estima en esta invocación.
     *
     * @throws InputDataException si ninguno de los dos está fijado.
     */
    public UnknownParameter unknownParameter() {
        if (quantumYield == null && photonFlux == null) {
            throw new InputDataException("Hay que fijar el rendimiento cuántico o el flujo fotónico para estimar el otro.");
        }
        return quantumYield == null ? UnknownParameter.QUANTUM_YIELD : UnknownParameter.PHOTON_FLUX;
    }

    /**
     * k fijada, o el valor semilla indicado si no se fijó ninguna.
     */
    public double thermalRateConstantOr(double seed) {
        return thermalRateConstant != null ? thermalRateConstant : seed;
    }
}
