package projectkoshi.classification;

import projectkoshi.domain.classification.HazardType;
import projectkoshi.domain.raster.Raster;

import java.util.Objects;

/**
 * Resultado de una clasificación de riesgo.
 *
 * @param type        Riesgo clasificado.
 * @param model       Bosque entrenado.
 * @param raster      Ráster de clases (banda {@link HazardClassifier#CLASSIFICATION_BAND}).
 * @param sampleCount Muestras de entrenamiento efectivamente usadas.
 * @param trainingError Error de resustitución sobre esas muestras.
 */
public record HazardClassification(
        HazardType type,
        RandomForestModel model,
        Raster raster,
        int sampleCount,
        double trainingError
) {
    public HazardClassification {
        Objects.requireNonNull(type, "El tipo de riesgo no puede ser nulo.");
        Objects.requireNonNull(model, "El modelo no puede ser nulo.");
        Objects.requireNonNull(raster, "El ráster clasificado no puede ser nulo.");
    }
}
