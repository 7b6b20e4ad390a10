package photoyield.domain.exception;

/**
 * Raíz de la taxonomía de errores del motor de ajuste cinético.
 * <p>
 * Todas las excepciones son no comprobadas: el llamador decide en qué capa
 * convertirlas en un resultado estructurado.
 */
public abstract class PhotoyieldException extends RuntimeException {

    protected PhotoyieldException(String message) {
        super(message);
    }

    protected PhotoyieldException(String message, Throwable cause) {
        super(message, cause);
    }
}
