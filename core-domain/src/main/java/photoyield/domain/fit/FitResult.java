package photoyield.domain.fit;

import lombok.Builder;

/**
 * Resultado inmutable del ajuste no lineal primario.
 *
 * @param unknown        Parámetro estimado.
 * @param estimate       Valor estimado del desconocido.
 * @param variance       Varianza de la estimación (diagonal de la covarianza).
 * @param standardError  Error estándar, raíz de la varianza.
 * @param predicted      Traza predicha sobre los puntos usados en el ajuste.
 * @param goodness       Calidad del ajuste sobre esos puntos.
 * @param tier           Nivel de convergencia según la calidad del ajuste.
 * @param converged      {@code true} si el optimizador terminó por su criterio de convergencia.
 * @param iterations     Iteraciones consumidas por el optimizador.
 * @param pointsUsed     Número de puntos de la traza usados en el ajuste.
 */
@Builder
public record FitResult(
        UnknownParameter unknown,
        double estimate,
        double variance,
        double standardError,
        double[] predicted,
        GoodnessOfFit goodness,
        ConvergenceTier tier,
        boolean converged,
        int iterations,
        int pointsUsed
) {
    public FitResult {
        predicted = predicted == null ? new double[0] : predicted.clone();
    }

    public double[] predicted() {
        return predicted.clone();
    }

    public double[] residuals() {
        return goodness == null ? new double[0] : goodness.residuals();
    }
}
