package photoyield.domain.exception;

/**
 * Datos de entrada inutilizables: fichero espectral mal formado, longitudes de fila
 * inconsistentes, parámetros experimentales inválidos o una traza con menos de dos puntos.
 * Aborta la ejecución en curso.
 */
public class InputDataException extends PhotoyieldException {

    public InputDataException(String message) {
        super(message);
    }

    public InputDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
