package photoyield.domain.exception;

/**
 * El ajuste no lineal primario no ha convergido (covarianza singular o indefinida,
 * solución pegada a un límite o fallo interno del optimizador).
 */
public class ModelDivergenceException extends PhotoyieldException {

    public ModelDivergenceException(String message) {
        super(message);
    }

    public ModelDivergenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
