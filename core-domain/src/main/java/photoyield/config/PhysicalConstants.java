package photoyield.config;

/**
 * Constantes físicas compartidas por los modelos cinéticos.
 */
public final class PhysicalConstants {

    /**
     * Número de Avogadro (mol⁻¹), valor exacto SI 2019.
     */
    public static final double AVOGADRO = 6.02214076e23;

    /**
     * ln(10): convierte entre potencias de 10 (Beer-Lambert) y exponenciales naturales.
     */
    public static final double LN10 = Math.log(10.0);

    /**
     * Prohibido construir esta clase utilidad
     */
    private PhysicalConstants() {
    }
}
