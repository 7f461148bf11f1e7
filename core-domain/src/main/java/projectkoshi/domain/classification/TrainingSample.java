package projectkoshi.domain.classification;

import java.util.Arrays;
import java.util.Objects;

/**
 * Muestra de entrenamiento: valores de banda muestreados en un punto y su clase.
 */
public record TrainingSample(double[] features, int label) {

    public TrainingSample {
        Objects.requireNonNull(features, "El vector de características no puede ser nulo.");
        features = features.clone();
    }

    @Override
    public double[] features() {
        return features.clone();
    }

    public double feature(int index) {
        return features[index];
    }

    public int featureCount() {
        return features.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TrainingSample that)) return false;
        return label == that.label && Arrays.equals(features, that.features);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(features) + label;
    }

    @Override
    public String toString() {
        return "TrainingSample{features=" + Arrays.toString(features) + ", label=" + label + "}";
    }
}
