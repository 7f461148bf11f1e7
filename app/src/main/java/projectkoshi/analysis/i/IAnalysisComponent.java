package projectkoshi.analysis.i;

/**
 * Contrato base para cualquier componente de análisis del sistema.
 * Permite tratar a todos los motores de forma polimórfica para tareas
 * de logging, identificación y depuración.
 */
public interface IAnalysisComponent {
    /**
     * Nombre corto del algoritmo (ej: "NormalizedDifference", "Horn3x3").
     */
    String getName();

    /**
     * Descripción técnica detallada.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
