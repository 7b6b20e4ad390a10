package photoyield.domain.analysis;

/**
 * Modelo cinético aplicado en una invocación de análisis.
 */
public enum AnalysisMode {
    /** Solo el modelo de forma cerrada y el ajuste primario. */
    SIMPLE,
    /** Ajuste primario refinado con la absorción del fotoproducto. */
    PRODUCT_ABSORPTION,
    /** Ajuste primario refinado con la retroconversión térmica. */
    THERMAL_BACK_CONVERSION
}
