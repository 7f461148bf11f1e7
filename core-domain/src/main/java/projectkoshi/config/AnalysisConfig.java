package projectkoshi.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Contenedor de la configuración de ejecución de un análisis.
 * Agrupa la configuración científica de la cuenca con los parámetros de cómputo.
 */
@Value
@Builder
@With
public class AnalysisConfig {

    /**
     * Parámetros científicos de la cuenca.
     */
    @Builder.Default
    WatershedConfig watershedConfig = WatershedConfig.getDudhKoshiDefaults();

    /**
     * Número de hilos del pool de teselas. Valores menores que 1 se tratan como 1.
     */
    @Builder.Default
    int threadCount = Runtime.getRuntime().availableProcessors();

    /**
     * Filas por tesela en las transformaciones ráster a ráster.
     */
    @Builder.Default
    int tileRows = 256;

    /**
     * Configuración de los bosques aleatorios de riesgo.
     */
    @Builder.Default
    ClassifierConfig classifierConfig = ClassifierConfig.builder().build();

    /**
     * Hiperparámetros del bosque aleatorio.
     */
    @Value
    @Builder
    @With
    public static class ClassifierConfig {
        /**
         * Número de árboles del conjunto.
         */
        @Builder.Default
        int treeCount = 50;
        /**
         * Semilla para el muestreo bootstrap y la selección de variables. Fija para reproducibilidad.
         */
        @Builder.Default
        long seed = 0L;
        /**
         * Variables candidatas en cada división. 0 = raíz cuadrada del número de variables.
         */
        @Builder.Default
        int variablesPerSplit = 0;
        /**
         * Fracción del conjunto de entrenamiento muestreada (con reemplazo) por árbol.
         */
        @Builder.Default
        double bagFraction = 1.0;
        /**
         * Población mínima de un nodo hoja.
         */
        @Builder.Default
        int minLeafPopulation = 1;
        /**
         * Profundidad máxima de los árboles. 0 = sin límite.
         */
        @Builder.Default
        int maxDepth = 0;
    }
}
