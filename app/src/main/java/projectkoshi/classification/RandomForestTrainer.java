package projectkoshi.classification;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import projectkoshi.analysis.tiling.TileProcessor;
import projectkoshi.config.AnalysisConfig.ClassifierConfig;
import projectkoshi.domain.classification.TrainingSample;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * Entrenamiento de bosques aleatorios de clasificación.
 * <p>
 * Cada árbol se ajusta sobre una muestra bootstrap (con reemplazo) de
 * {@code round(bagFraction * n)} muestras y, en cada nodo, sobre un subconjunto aleatorio
 * de variables. La aleatoriedad de cada árbol depende sólo de la semilla y de su índice,
 * por lo que el resultado es reproducible aunque los árboles se entrenen en paralelo.
 * <p>
 * Admite cualquier conjunto de etiquetas enteras con al menos dos valores distintos; la
 * restricción a clases binarias de riesgo la aplica {@link HazardClassifier}.
 */
@Slf4j
public class RandomForestTrainer {

    @Getter
    private final ClassifierConfig config;
    private final TileProcessor tileProcessor;

    public RandomForestTrainer(ClassifierConfig config, TileProcessor tileProcessor) {
        this.config = Objects.requireNonNull(config, "La configuración del clasificador no puede ser nula.");
        this.tileProcessor = Objects.requireNonNull(tileProcessor, "El TileProcessor no puede ser nulo.");
    }

    public RandomForestModel train(List<TrainingSample> samples) {
        return train(samples, config.getTreeCount());
    }

    /**
     * @throws IllegalArgumentException si no hay muestras, hay menos de dos clases, las
     *                                  longitudes de los vectores difieren o {@code treeCount < 1}.
     */
    public RandomForestModel train(List<TrainingSample> samples, int treeCount) {
        Objects.requireNonNull(samples, "La lista de muestras no puede ser nula.");
        if (treeCount < 1) {
            throw new IllegalArgumentException("El número de árboles debe ser al menos 1: " + treeCount);
        }
        if (samples.isEmpty()) {
            throw new IllegalArgumentException("No hay muestras de entrenamiento.");
        }
        int featureCount = samples.get(0).featureCount();
        if (featureCount == 0) {
            throw new IllegalArgumentException("Las muestras no tienen características.");
        }
        for (TrainingSample sample : samples) {
            if (sample.featureCount() != featureCount) {
                throw new IllegalArgumentException("Longitudes de vector inconsistentes: se esperaban "
                        + featureCount + " y se encontró " + sample);
            }
        }
        TreeSet<Integer> distinct = new TreeSet<>();
        samples.forEach(sample -> distinct.add(sample.label()));
        if (distinct.size() < 2) {
            throw new IllegalArgumentException("Se necesitan al menos dos clases distintas, encontradas: " + distinct);
        }

        long startTime = System.currentTimeMillis();
        int[] classes = distinct.stream().mapToInt(Integer::intValue).toArray();
        int n = samples.size();
        double[][] x = new double[n][];
        int[] y = new int[n];
        for (int i = 0; i < n; i++) {
            TrainingSample sample = samples.get(i);
            x[i] = sample.features();
            y[i] = Arrays.binarySearch(classes, sample.label());
        }

        int variablesPerSplit = config.getVariablesPerSplit() > 0
                ? Math.min(config.getVariablesPerSplit(), featureCount)
                : Math.max(1, (int) Math.floor(Math.sqrt(featureCount)));
        int bagSize = Math.max(1, (int) Math.round(config.getBagFraction() * n));

        List<Callable<DecisionTree>> tasks = new ArrayList<>(treeCount);
        for (int t = 0; t < treeCount; t++) {
            final int treeIndex = t;
            tasks.add(() -> {
                SplittableRandom random = treeRandom(config.getSeed(), treeIndex);
                int[] bag = new int[bagSize];
                for (int i = 0; i < bagSize; i++) {
                    bag[i] = random.nextInt(n);
                }
                return DecisionTree.fit(x, y, classes.length, bag, variablesPerSplit,
                        config.getMinLeafPopulation(), config.getMaxDepth(), random);
            });
        }
        List<DecisionTree> trees = tileProcessor.invokeAll(tasks);

        RandomForestModel model = new RandomForestModel(trees, classes, featureCount);
        log.info("Bosque entrenado: {} árboles, {} muestras, {} variables (mtry={}) en {} ms.",
                treeCount, n, featureCount, variablesPerSplit, System.currentTimeMillis() - startTime);
        return model;
    }

    /**
     * Generador de un árbol: depende sólo de la semilla global y del índice del árbol.
     */
    static SplittableRandom treeRandom(long seed, int treeIndex) {
        return new SplittableRandom(seed * 0x9E3779B97F4A7C15L + treeIndex);
    }
}
