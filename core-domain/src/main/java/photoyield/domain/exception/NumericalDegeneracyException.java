package photoyield.domain.exception;

/**
 * Una evaluación del modelo ha producido un valor no finito (logaritmo de un argumento
 * no positivo, división por una fracción de absorción casi nula...).
 * <p>
 * Se lanza en el punto de evaluación; los optimizadores la capturan y tratan la
 * evaluación como fallida en lugar de propagar NaN hasta el R².
 */
public class NumericalDegeneracyException extends PhotoyieldException {

    public NumericalDegeneracyException(String message) {
        super(message);
    }
}
