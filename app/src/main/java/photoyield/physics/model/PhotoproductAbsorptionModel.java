package photoyield.physics.model;

import photoyield.config.ExperimentParameters;
import photoyield.domain.exception.NumericalDegeneracyException;
import photoyield.domain.spectra.KineticTrace;

import static photoyield.config.PhysicalConstants.AVOGADRO;
import static photoyield.config.PhysicalConstants.LN10;

/**
 * Sistema reactivo/fotoproducto en el que ambas especies compiten por los fotones según
 * su fracción de absorbancia a la longitud de onda de excitación:
 * <pre>
 *   D        = c_r·ε_r,ex + c_p·ε_p,ex
 *   dc_r/dt  = (I/(V·Nₐ)) · (1 - 10^(-D))/D · (qy_p·c_p·ε_p,ex - qy_r·c_r·ε_r,ex) + k·c_p
 *   c_p      = c_total - c_r
 *   A        = c_r·ε_r,an + c_p·ε_p,an
 * </pre>
 * Los parámetros ajustados son (qy_r, qy_p). Para el reactivo se usan las absortividades
 * aparentes de la traza; para el fotoproducto, los coeficientes de extinción introducidos.
 */
public class PhotoproductAbsorptionModel extends FixedStepKineticModel {

    /**
     * Por debajo de esta absorbancia total la fracción (1 - 10^(-D))/D queda indefinida.
     */
    static final double MIN_TOTAL_ABSORBANCE = 1e-12;

    private final double photonRate;
    private final double totalConcentration;
    private final double reactantExcitation;
    private final double productExcitation;
    private final double reactantAnalysis;
    private final double productAnalysis;
    private final double thermalRate;

    /**
     * @param photonRate         I/(V·Nₐ) (mol L⁻¹ s⁻¹).
     * @param totalConcentration c_total (mol/L), igual a la concentración inicial del reactivo.
     * @param reactantExcitation ε_r,ex·l.
     * @param productExcitation  ε_p,ex·l.
     * @param reactantAnalysis   ε_r,an·l.
     * @param productAnalysis    ε_p,an·l.
     * @param thermalRate        k (s⁻¹), reversión térmica producto → reactivo; 0 si no hay.
     * @param timeStep           Paso fijo de integración (s).
     */
    public PhotoproductAbsorptionModel(double photonRate, double totalConcentration,
                                       double reactantExcitation, double productExcitation,
                                       double reactantAnalysis, double productAnalysis,
                                       double thermalRate, double timeStep) {
        super(timeStep);
        this.photonRate = photonRate;
        this.totalConcentration = totalConcentration;
        this.reactantExcitation = reactantExcitation;
        this.productExcitation = productExcitation;
        this.reactantAnalysis = reactantAnalysis;
        this.productAnalysis = productAnalysis;
        this.thermalRate = thermalRate;
    }

    public static PhotoproductAbsorptionModel of(KineticTrace trace, ExperimentParameters params,
                                                 double photonFlux, double timeStep) {
        double l = params.pathLength();
        return new PhotoproductAbsorptionModel(
                photonFlux / (params.cellVolume() * AVOGADRO),
                params.startingConcentration(),
                trace.apparentExcitationAbsorptivity() * l,
                params.productExcitationExtinction() * l,
                trace.apparentAbsorptivity() * l,
                params.productAnalysisExtinction() * l,
                params.thermalRateConstantOr(0.0),
                timeStep);
    }

    @Override
    public String getName() {
        return "RK4-Fotoproducto";
    }

    @Override
    public String getDescription() {
        return "Reactivo/fotoproducto con reparto de fotones por absorbancia, RK4 de paso " + getTimeStep() + " s";
    }

    @Override
    protected double initialConcentration() {
        return totalConcentration;
    }

    @Override
    protected double rateOfChange(double reactant, double reactantYield, double productYield) {
        double product = totalConcentration - reactant;
        double totalAbsorbance = reactant * reactantExcitation + product * productExcitation;
        if (Math.abs(totalAbsorbance) < MIN_TOTAL_ABSORBANCE) {
            throw new NumericalDegeneracyException(
                    "Absorbancia total de excitación casi nula (" + totalAbsorbance + "); reparto de fotones indefinido.");
        }
        double absorbedPerUnit = (1.0 - Math.exp(-LN10 * totalAbsorbance)) / totalAbsorbance;
        return photonRate * absorbedPerUnit
                * (productYield * product * productExcitation - reactantYield * reactant * reactantExcitation)
                + thermalRate * product;
    }

    @Override
    protected double absorbanceOf(double reactant) {
        return reactant * reactantAnalysis + (totalConcentration - reactant) * productAnalysis;
    }
}
