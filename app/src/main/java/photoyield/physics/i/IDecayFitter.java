package photoyield.physics.i;

import photoyield.config.ExperimentParameters;
import photoyield.domain.fit.FitResult;
import photoyield.domain.spectra.KineticTrace;

/**
 * Ajuste del modelo de decaimiento simple sobre una traza, estimando el único
 * desconocido de {rendimiento cuántico, flujo fotónico}.
 */
public interface IDecayFitter extends ISolverComponent {

    /**
     * @throws photoyield.domain.exception.ModelDivergenceException si el ajuste no converge.
     * @throws photoyield.domain.exception.InputDataException       si la traza o los parámetros no permiten ajustar.
     */
    FitResult fit(KineticTrace trace, ExperimentParameters params);
}
