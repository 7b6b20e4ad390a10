package photoyield.physics.model;

import org.apache.commons.math3.complex.Complex;
import photoyield.config.ExperimentParameters;
import photoyield.domain.exception.NumericalDegeneracyException;
import photoyield.domain.spectra.KineticTrace;
import photoyield.physics.i.ISolverComponent;

import static photoyield.config.PhysicalConstants.AVOGADRO;
import static photoyield.config.PhysicalConstants.LN10;

/**
 * Solución analítica de la fotoisomerización de una sola especie bajo cinética
 * actinométrica (limitada por fotones), con autoapantallamiento de Beer-Lambert:
 * <pre>
 *   dc/dt = -(qy·I)/(V·Nₐ) · (1 - 10^(-b_ex·c))
 *   A(t)  = (b/b_ex) · log10(1 - exp(ln10·b_ex·c₁ - ln10·a·b_ex·t)),   a = qy·I/(V·Nₐ)
 *   c₁    = (ln(1 - 10^(b_ex·c₀)) + 2πi·n) / (b_ex·ln10)
 * </pre>
 * c₁ es complejo (el logaritmo de un número negativo) y la aritmética compleja se
 * mantiene hasta el logaritmo final; solo se devuelve la parte real.
 * <p>
 * b y b_ex entran multiplicadas por el camino óptico, es decir, como absorbancia por
 * unidad de concentración. La instancia es inmutable y segura entre hilos.
 */
public final class ClosedFormDecayModel implements ISolverComponent {

    /**
     * Índice de rama del logaritmo complejo. Constante fija del método de
     * ajuste; no afecta a la parte real mientras exp(2πi·n) = 1.
     */
    static final int BRANCH_INDEX = 1;

    private final double absorptivity;
    private final double excitationAbsorptivity;
    private final double cellVolume;
    private final Complex c1;

    /**
     * @param absorptivity           b·l a la longitud de onda de análisis (L/mol).
     * @param excitationAbsorptivity b_ex·l a la longitud de onda de excitación (L/mol).
     * @param startingConcentration  c₀ (mol/L).
     * @param cellVolume             Volumen irradiado (L).
     */
    public ClosedFormDecayModel(double absorptivity, double excitationAbsorptivity,
                                double startingConcentration, double cellVolume) {
        if (!(excitationAbsorptivity > 0) || !(cellVolume > 0)) {
            throw new IllegalArgumentException("b_ex y el volumen deben ser positivos.");
        }
        this.absorptivity = absorptivity;
        this.excitationAbsorptivity = excitationAbsorptivity;
        this.cellVolume = cellVolume;

        // ln(1 - 10^(b_ex·c₀)) es el logaritmo de un número negativo: parte imaginaria π.
        Complex boundary = new Complex(1.0 - Math.pow(10.0, excitationAbsorptivity * startingConcentration), 0.0).log();
        this.c1 = boundary
                .add(new Complex(0.0, 2.0 * Math.PI * BRANCH_INDEX))
                .divide(excitationAbsorptivity * LN10);
    }

    /**
     * Modelo calibrado con las absortividades aparentes de la traza.
     */
    public static ClosedFormDecayModel of(KineticTrace trace, ExperimentParameters params) {
        return new ClosedFormDecayModel(
                trace.apparentAbsorptivity() * params.pathLength(),
                trace.apparentExcitationAbsorptivity() * params.pathLength(),
                params.startingConcentration(),
                params.cellVolume());
    }

    @Override
    public String getName() {
        return "ClosedFormDecay";
    }

    @Override
    public String getDescription() {
        return "Solución analítica compleja de dc/dt = -a(1 - 10^(-b_ex·c)), rama n = " + BRANCH_INDEX;
    }

    /**
     * a = qy·I / (V·Nₐ), velocidad máxima de conversión (mol L⁻¹ s⁻¹).
     */
    public double rateConstant(double quantumYield, double photonFlux) {
        return quantumYield * photonFlux / (cellVolume * AVOGADRO);
    }

    /**
     * Absorbancia predicha a la longitud de onda de análisis en el instante t.
     *
     * @throws NumericalDegeneracyException si el resultado no es finito.
     */
    public double absorbanceAt(double time, double quantumYield, double photonFlux) {
        double a = rateConstant(quantumYield, photonFlux);
        Complex exponent = c1.multiply(LN10 * excitationAbsorptivity)
                .subtract(LN10 * a * excitationAbsorptivity * time);
        Complex argument = Complex.ONE.subtract(exponent.exp());
        double value = (absorptivity / excitationAbsorptivity) * realLog10(argument);
        if (!Double.isFinite(value)) {
            throw new NumericalDegeneracyException(String.format(
                    "Modelo de forma cerrada no finito en t=%.3f s (qy=%.6g, I=%.6g)", time, quantumYield, photonFlux));
        }
        return value;
    }

    public double[] predict(double[] times, double quantumYield, double photonFlux) {
        double[] predicted = new double[times.length];
        for (int i = 0; i < times.length; i++) {
            predicted[i] = absorbanceAt(times[i], quantumYield, photonFlux);
        }
        return predicted;
    }

    /**
     * Parte real de log10(z). El argumento debe ser finito y con parte real positiva:
     * la solución física nunca cruza el eje negativo, así que cualquier otro caso es
     * una degeneración numérica.
     */
    static double realLog10(Complex argument) {
        if (argument.isNaN() || argument.isInfinite() || !(argument.getReal() > 0)) {
            throw new NumericalDegeneracyException("Argumento del logaritmo no positivo o no finito: " + argument);
        }
        return argument.log().getReal() / LN10;
    }
}
