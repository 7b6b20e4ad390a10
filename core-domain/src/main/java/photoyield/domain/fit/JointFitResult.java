package photoyield.domain.fit;

import lombok.Builder;
import photoyield.domain.analysis.AnalysisMode;

import java.util.List;

/**
 * Resultado inmutable de un optimizador conjunto de dos parámetros.
 * <p>
 * Siempre contiene la última iteración disponible: si no se alcanzó el umbral exacto,
 * {@code converged} es {@code false} y el resultado debe tratarse como provisional.
 *
 * @param mode         Optimizador que lo produjo.
 * @param firstName    Nombre del primer parámetro ("qy").
 * @param firstValue   Valor final del primer parámetro.
 * @param secondName   Nombre del segundo parámetro ("qy_prod" o "k").
 * @param secondValue  Valor final del segundo parámetro.
 * @param photonFlux   Flujo fotónico usado en la integración (fotones/s).
 * @param predicted    Traza predicha con los parámetros finales.
 * @param goodness     Calidad del ajuste final.
 * @param tier         Nivel de convergencia alcanzado.
 * @param converged    {@code true} solo si se alcanzó el nivel exacto.
 * @param iterations   Iteraciones realizadas.
 * @param history      Registro de cada iteración.
 */
@Builder
public record JointFitResult(
        AnalysisMode mode,
        String firstName,
        double firstValue,
        String secondName,
        double secondValue,
        double photonFlux,
        double[] predicted,
        GoodnessOfFit goodness,
        ConvergenceTier tier,
        boolean converged,
        int iterations,
        List<IterationRecord> history
) {
    public JointFitResult {
        predicted = predicted == null ? new double[0] : predicted.clone();
        history = history == null ? List.of() : List.copyOf(history);
    }

    public double[] predicted() {
        return predicted.clone();
    }

    public double[] residuals() {
        return goodness == null ? new double[0] : goodness.residuals();
    }
}
