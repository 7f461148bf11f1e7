package projectkoshi.classification;

import projectkoshi.domain.classification.TrainingSample;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Bosque aleatorio entrenado. Inmutable y seguro para clasificar desde varios hilos.
 * <p>
 * La predicción es el voto mayoritario de los árboles; un empate se resuelve a favor
 * de la etiqueta más baja.
 */
public final class RandomForestModel {

    private final List<DecisionTree> trees;
    private final int[] classes;
    private final int featureCount;

    RandomForestModel(List<DecisionTree> trees, int[] classes, int featureCount) {
        Objects.requireNonNull(trees, "La lista de árboles no puede ser nula.");
        if (trees.isEmpty()) {
            throw new IllegalArgumentException("Un bosque necesita al menos un árbol.");
        }
        this.trees = List.copyOf(trees);
        this.classes = classes.clone();
        this.featureCount = featureCount;
    }

    /**
     * Etiqueta predicha para un vector de características.
     *
     * @throws IllegalArgumentException si la longitud del vector no coincide con la del entrenamiento.
     */
    public int classify(double[] features) {
        if (features.length != featureCount) {
            throw new IllegalArgumentException("Se esperaban " + featureCount
                    + " características, recibidas " + features.length + ".");
        }
        int[] votes = new int[classes.length];
        for (DecisionTree tree : trees) {
            votes[tree.predict(features)]++;
        }
        // Las etiquetas están ordenadas: el primer máximo es la etiqueta más baja
        return classes[DecisionTree.majority(votes)];
    }

    /**
     * Fracción de muestras mal clasificadas (error de resustitución).
     */
    public double errorRate(List<TrainingSample> samples) {
        if (samples.isEmpty()) {
            return Double.NaN;
        }
        long wrong = samples.stream()
                .filter(sample -> classify(sample.features()) != sample.label())
                .count();
        return (double) wrong / samples.size();
    }

    public int getTreeCount() {
        return trees.size();
    }

    public int getFeatureCount() {
        return featureCount;
    }

    public int[] getClasses() {
        return classes.clone();
    }

    @Override
    public String toString() {
        return "RandomForestModel{trees=" + trees.size()
                + ", features=" + featureCount
                + ", classes=" + Arrays.toString(classes) + "}";
    }
}
