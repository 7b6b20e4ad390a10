package photoyield.physics.i;

/**
 * Contrato base para cualquier componente numérico del motor.
 * Permite tratar modelos, ajustadores y optimizadores de forma polimórfica para
 * tareas de logging e identificación.
 */
public interface ISolverComponent {
    /**
     * Nombre corto del algoritmo (ej: "Levenberg-Marquardt", "RK4-1s").
     */
    String getName();

    /**
     * Descripción técnica detallada.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
