package photoyield.domain.analysis;

import lombok.Builder;
import photoyield.domain.fit.FitResult;
import photoyield.domain.fit.JointFitResult;
import photoyield.domain.fit.UnknownParameter;

/**
 * Resultado estructurado de una invocación de análisis, destinado al colaborador de
 * presentación. Los fallos llegan aquí como estado + mensaje, nunca como excepciones.
 *
 * @param status                Estado final de la invocación.
 * @param message               Mensaje legible (motivo del fallo o resumen).
 * @param mode                  Modelo cinético solicitado.
 * @param unknown               Parámetro estimado, o {@code null} si no llegó a determinarse.
 * @param estimate              Estimación final del desconocido (NaN tras un fallo).
 * @param standardError         Error estándar de la estimación final (NaN tras un fallo).
 * @param primaryFit            Ajuste primario, o {@code null} si no llegó a ejecutarse.
 * @param jointFit              Refinamiento conjunto, o {@code null} en modo simple o tras un fallo.
 * @param photonFluxPerMilliamp Flujo estimado por mA de corriente del LED (solo en actinometría), o {@code null}.
 */
@Builder
public record AnalysisReport(
        AnalysisStatus status,
        String message,
        AnalysisMode mode,
        UnknownParameter unknown,
        double estimate,
        double standardError,
        FitResult primaryFit,
        JointFitResult jointFit,
        Double photonFluxPerMilliamp
) {
    public boolean isUsable() {
        return status == AnalysisStatus.COMPLETED || status == AnalysisStatus.PROVISIONAL;
    }

    /**
     * Informe de fallo sin resultados numéricos.
     */
    public static AnalysisReport failure(AnalysisStatus status, AnalysisMode mode, String message) {
        return AnalysisReport.builder()
                .status(status)
                .mode(mode)
                .message(message)
                .estimate(Double.NaN)
                .standardError(Double.NaN)
                .build();
    }
}
