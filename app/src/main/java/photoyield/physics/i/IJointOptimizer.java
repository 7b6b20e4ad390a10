package photoyield.physics.i;

import photoyield.config.ExperimentParameters;
import photoyield.domain.analysis.AnalysisMode;
import photoyield.domain.fit.JointFitResult;
import photoyield.domain.spectra.KineticTrace;

/**
 * Búsqueda conjunta de dos parámetros sin derivadas sobre un modelo integrado.
 * Cada llamada es autocontenida: el estado de la búsqueda es local a la invocación.
 */
public interface IJointOptimizer extends ISolverComponent {

    AnalysisMode getMode();

    /**
     * @param trace        Traza medida completa.
     * @param params       Parámetros del experimento (solo lectura).
     * @param quantumYield Rendimiento cuántico de partida (ajuste primario o valor fijado).
     * @param photonFlux   Flujo fotónico (fijado o estimado por el ajuste primario).
     * @return la última iteración, convergida o no.
     */
    JointFitResult optimize(KineticTrace trace, ExperimentParameters params, double quantumYield, double photonFlux);
}
