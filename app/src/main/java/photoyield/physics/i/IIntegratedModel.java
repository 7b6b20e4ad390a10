package photoyield.physics.i;

/**
 * Modelo cinético integrado numéricamente, parametrizado por los dos valores que
 * ajusta un optimizador conjunto.
 */
public interface IIntegratedModel extends ISolverComponent {

    /**
     * Absorbancia predicha a la longitud de onda de análisis en cada instante pedido.
     *
     * @param times  Instantes (s) relativos al inicio de la ventana, no negativos.
     * @param first  Primer parámetro (rendimiento cuántico del reactivo).
     * @param second Segundo parámetro (rendimiento del fotoproducto o constante térmica).
     * @throws photoyield.domain.exception.NumericalDegeneracyException si la integración produce valores no finitos.
     */
    double[] predict(double[] times, double first, double second);
}
