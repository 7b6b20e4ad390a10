package photoyield.domain.fit;

/**
 * Nivel de convergencia alcanzado por un ajuste, de menor a mayor exigencia.
 * <ul>
 * <li><b>NONE:</b> ningún umbral superado.</li>
 * <li><b>LOOSE:</b> R² de Pearson (forma) por encima del umbral laxo.</li>
 * <li><b>TIGHT:</b> R² de determinación (acuerdo absoluto) por encima del umbral estricto.</li>
 * <li><b>EXACT:</b> R² de determinación por encima del umbral exacto; la búsqueda se detiene.</li>
 * </ul>
 */
public enum ConvergenceTier {
    NONE("sin convergencia"),
    LOOSE("convergencia laxa"),
    TIGHT("convergencia estricta"),
    EXACT("convergencia exacta");

    private final String label;

    ConvergenceTier(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * El más exigente de los dos niveles.
     */
    public ConvergenceTier max(ConvergenceTier other) {
        return other != null && other.ordinal() > this.ordinal() ? other : this;
    }

    public boolean isAtLeast(ConvergenceTier other) {
        return this.ordinal() >= other.ordinal();
    }
}
