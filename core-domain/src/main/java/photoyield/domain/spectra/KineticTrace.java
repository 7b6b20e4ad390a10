package photoyield.domain.spectra;

import photoyield.domain.exception.InputDataException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Serie temporal de absorbancia corregida por línea base, lista para el ajuste.
 * <p>
 * Lleva además las absortividades aparentes calibradas con el primer punto, que el
 * modelo de forma cerrada necesita y que antes viajaban como estado compartido.
 *
 * @param times                          Tiempo relativo al primer punto de la ventana (s); empieza en 0.
 * @param absorbance                     Absorbancia corregida a la longitud de onda de análisis.
 * @param excitationAbsorbance           Absorbancia corregida a la longitud de onda de excitación.
 * @param analysisWavelength             Longitud de onda de análisis efectivamente usada (nm).
 * @param excitationWavelength           Longitud de onda de excitación efectivamente usada (nm).
 * @param apparentAbsorptivity           b: primera muestra de análisis / (c₀·l).
 * @param apparentExcitationAbsorptivity b_ex: primera muestra de excitación / (c₀·l).
 */
public record KineticTrace(
        double[] times,
        double[] absorbance,
        double[] excitationAbsorbance,
        double analysisWavelength,
        double excitationWavelength,
        double apparentAbsorptivity,
        double apparentExcitationAbsorptivity
) {
    public KineticTrace {
        Objects.requireNonNull(times, "El vector de tiempos no puede ser nulo.");
        Objects.requireNonNull(absorbance, "La traza de absorbancia no puede ser nula.");
        Objects.requireNonNull(excitationAbsorbance, "La traza de excitación no puede ser nula.");
        if (absorbance.length != times.length || excitationAbsorbance.length != times.length) {
            throw new IllegalArgumentException("Tiempos y absorbancias deben tener la misma longitud.");
        }
        if (times.length < 2) {
            throw new InputDataException("La traza necesita al menos 2 puntos para ajustarse, tiene " + times.length + ".");
        }
        times = times.clone();
        absorbance = absorbance.clone();
        excitationAbsorbance = excitationAbsorbance.clone();
    }

    public double[] times() {
        return times.clone();
    }

    public double[] absorbance() {
        return absorbance.clone();
    }

    public double[] excitationAbsorbance() {
        return excitationAbsorbance.clone();
    }

    public int size() {
        return times.length;
    }

    public double timeAt(int index) {
        return times[index];
    }

    public double absorbanceAt(int index) {
        return absorbance[index];
    }

    public double lastTime() {
        return times[times.length - 1];
    }

    /**
     * Primeros {@code count} puntos de la traza (todos si hay menos), con la misma calibración.
     */
    public KineticTrace head(int count) {
        int n = Math.min(count, times.length);
        return new KineticTrace(
                Arrays.copyOf(times, n),
                Arrays.copyOf(absorbance, n),
                Arrays.copyOf(excitationAbsorbance, n),
                analysisWavelength,
                excitationWavelength,
                apparentAbsorptivity,
                apparentExcitationAbsorptivity);
    }
}
