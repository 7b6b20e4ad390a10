package photoyield.domain.fit;

import java.util.Locale;

/**
 * Estado de una iteración de un optimizador conjunto, tal y como se registra en el log.
 *
 * @param iteration    Número de iteración (desde 1).
 * @param wavelength   Longitud de onda de análisis (nm).
 * @param firstName    Nombre del primer parámetro (ej: "qy").
 * @param firstValue   Valor del primer parámetro tras la actualización.
 * @param secondName   Nombre del segundo parámetro (ej: "qy_prod", "k").
 * @param secondValue  Valor del segundo parámetro tras la actualización.
 * @param looseR2      R² laxo de la iteración (NaN si la evaluación falló).
 * @param tightR2      R² estricto de la iteración (NaN si la evaluación falló).
 */
public record IterationRecord(
        int iteration,
        double wavelength,
        String firstName,
        double firstValue,
        String secondName,
        double secondValue,
        double looseR2,
        double tightR2
) {
    public boolean isEvaluationFailed() {
        return Double.isNaN(tightR2);
    }

    public String toLogLine() {
        return String.format(Locale.ROOT, "[%d] λ=%.1f nm %s=%.6g %s=%.6g R²(laxo)=%.6f R²(estricto)=%.6f",
                iteration, wavelength, firstName, firstValue, secondName, secondValue, looseR2, tightR2);
    }
}
