package photoyield.domain.analysis;

public enum AnalysisStatus {
    /** Ajuste completado y convergido. */
    COMPLETED,
    /** Se devuelve la mejor estimación disponible, pero sin alcanzar el umbral exacto. */
    PROVISIONAL,
    /** Datos o parámetros de entrada inutilizables; no se ajustó nada. */
    INPUT_ERROR,
    /** El ajuste primario divergió. */
    MODEL_DIVERGENCE
}
