package photoyield.domain.fit;

/**
 * Parámetro físico que se estima en una invocación: el otro queda fijado como conocido.
 */
public enum UnknownParameter {
    /** Se conoce el flujo fotónico y se estima el rendimiento cuántico. */
    QUANTUM_YIELD("qy"),
    /** Se conoce el rendimiento cuántico y se estima el flujo fotónico (actinometría). */
    PHOTON_FLUX("I");

    private final String symbol;

    UnknownParameter(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
