package photoyield.physics.model;

import org.apache.commons.math3.ode.FirstOrderDifferentialEquations;
import org.apache.commons.math3.ode.nonstiff.ClassicalRungeKuttaIntegrator;
import org.apache.commons.math3.ode.sampling.StepHandler;
import org.apache.commons.math3.ode.sampling.StepInterpolator;
import photoyield.domain.exception.NumericalDegeneracyException;
import photoyield.physics.i.IIntegratedModel;

/**
 * Base de los modelos de una concentración integrados con Runge-Kutta clásico de paso
 * fijo sobre [0, t_final].
 * <p>
 * La trayectoria se guarda en la rejilla t_k = k·Δt y se remuestrea sobre los instantes
 * medidos por índice más cercano. Todo el estado de la integración es local a cada
 * llamada a {@link #predict}, así que una misma instancia puede compartirse.
 */
public abstract class FixedStepKineticModel implements IIntegratedModel {

    private final double timeStep;

    protected FixedStepKineticModel(double timeStep) {
        if (!(timeStep > 0)) {
            throw new IllegalArgumentException("El paso de integración debe ser > 0: " + timeStep);
        }
        this.timeStep = timeStep;
    }

    public double getTimeStep() {
        return timeStep;
    }

    /**
     * Concentración del reactivo en t = 0 (mol/L).
     */
    protected abstract double initialConcentration();

    /**
     * dc/dt del reactivo para la concentración actual y los dos parámetros ajustados.
     */
    protected abstract double rateOfChange(double concentration, double first, double second);

    /**
     * Absorbancia a la longitud de onda de análisis correspondiente a la concentración del reactivo.
     */
    protected abstract double absorbanceOf(double concentration);

    @Override
    public double[] predict(double[] times, double first, double second) {
        final double lastTime = times[times.length - 1];
        final int steps = Math.max(1, (int) Math.ceil(lastTime / timeStep - 1e-9));
        double[] trajectory = integrate(first, second, steps);

        double[] predicted = new double[times.length];
        for (int i = 0; i < times.length; i++) {
            int index = (int) Math.round(times[i] / timeStep);
            index = Math.max(0, Math.min(steps, index));
            double absorbance = absorbanceOf(trajectory[index]);
            if (!Double.isFinite(absorbance)) {
                throw new NumericalDegeneracyException(String.format(
                        "%s: absorbancia no finita en t=%.3f s", getName(), times[i]));
            }
            predicted[i] = absorbance;
        }
        return predicted;
    }

    /**
     * Concentración del reactivo en cada punto de la rejilla 0..steps.
     */
    double[] integrate(double first, double second, int steps) {
        final double[] trajectory = new double[steps + 1];
        trajectory[0] = initialConcentration();

        FirstOrderDifferentialEquations equations = new FirstOrderDifferentialEquations() {
            @Override
            public int getDimension() {
                return 1;
            }

            @Override
            public void computeDerivatives(double t, double[] y, double[] yDot) {
                double rate = rateOfChange(y[0], first, second);
                if (!Double.isFinite(rate)) {
                    throw new NumericalDegeneracyException(String.format(
                            "%s: dc/dt no finita en t=%.3f s (c=%.6g)", getName(), t, y[0]));
                }
                yDot[0] = rate;
            }
        };

        ClassicalRungeKuttaIntegrator integrator = new ClassicalRungeKuttaIntegrator(timeStep);
        integrator.addStepHandler(new StepHandler() {
            @Override
            public void init(double t0, double[] y0, double t) {
                // La rejilla ya tiene el estado inicial.
            }

            @Override
            public void handleStep(StepInterpolator interpolator, boolean isLast) {
                double t = interpolator.getCurrentTime();
                // El redondeo absorbe la deriva acumulada de t y el posible paso residual final.
                int index = (int) Math.round(t / timeStep);
                if (index >= 0 && index <= steps) {
                    interpolator.setInterpolatedTime(t);
                    trajectory[index] = interpolator.getInterpolatedState()[0];
                }
            }
        });

        integrator.integrate(equations, 0.0, new double[]{trajectory[0]}, steps * timeStep, new double[1]);
        return trajectory;
    }
}
