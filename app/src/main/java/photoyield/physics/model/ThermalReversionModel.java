package photoyield.physics.model;

import photoyield.config.ExperimentParameters;
import photoyield.domain.spectra.KineticTrace;

import static photoyield.config.PhysicalConstants.AVOGADRO;
import static photoyield.config.PhysicalConstants.LN10;

/**
 * Fotoconversión de una sola especie con retroconversión térmica de primer orden:
 * <pre>
 *   dc/dt = -qy·I·(1 - 10^(-b_ex·c))/(V·Nₐ) + k·(c_total - c)
 *   A     = c·b
 * </pre>
 * Los parámetros ajustados son (qy, k). Con k = 0 se reduce al decaimiento simple.
 */
public class ThermalReversionModel extends FixedStepKineticModel {

    private final double photonRate;
    private final double totalConcentration;
    private final double excitationAbsorptivity;
    private final double absorptivity;

    public ThermalReversionModel(double photonRate, double totalConcentration,
                                 double excitationAbsorptivity, double absorptivity, double timeStep) {
        super(timeStep);
        this.photonRate = photonRate;
        this.totalConcentration = totalConcentration;
        this.excitationAbsorptivity = excitationAbsorptivity;
        this.absorptivity = absorptivity;
    }

    public static ThermalReversionModel of(KineticTrace trace, ExperimentParameters params,
                                           double photonFlux, double timeStep) {
        double l = params.pathLength();
        return new ThermalReversionModel(
                photonFlux / (params.cellVolume() * AVOGADRO),
                params.startingConcentration(),
                trace.apparentExcitationAbsorptivity() * l,
                trace.apparentAbsorptivity() * l,
                timeStep);
    }

    @Override
    public String getName() {
        return "RK4-Termico";
    }

    @Override
    public String getDescription() {
        return "Decaimiento fotoquímico con reversión térmica de primer orden, RK4 de paso " + getTimeStep() + " s";
    }

    @Override
    protected double initialConcentration() {
        return totalConcentration;
    }

    @Override
    protected double rateOfChange(double concentration, double quantumYield, double thermalRate) {
        double absorbedFraction = 1.0 - Math.exp(-LN10 * excitationAbsorptivity * concentration);
        return -quantumYield * photonRate * absorbedFraction + thermalRate * (totalConcentration - concentration);
    }

    @Override
    protected double absorbanceOf(double concentration) {
        return concentration * absorptivity;
    }
}
