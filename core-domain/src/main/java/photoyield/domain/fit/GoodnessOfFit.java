package photoyield.domain.fit;

/**
 * Comparación entre la traza medida y la predicha.
 *
 * @param looseR2   Cuadrado del coeficiente de correlación de Pearson.
 * @param tightR2   Coeficiente de determinación 1 - SSR/SST.
 * @param ssr       Suma de cuadrados de los residuos.
 * @param residuals Residuos medido - predicho, punto a punto.
 */
public record GoodnessOfFit(
        double looseR2,
        double tightR2,
        double ssr,
        double[] residuals
) {
    public GoodnessOfFit {
        residuals = residuals == null ? new double[0] : residuals.clone();
    }

    public double[] residuals() {
        return residuals.clone();
    }
}
