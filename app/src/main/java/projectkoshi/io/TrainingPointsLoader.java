package projectkoshi.io;

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import projectkoshi.domain.classification.HazardType;
import projectkoshi.domain.vector.LabeledPoint;

import java.io.IOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Carga los puntos de entrenamiento por tipo de riesgo desde un JSON de la forma
 * {@code {"ROCKFALL": [{"x":..,"y":..,"class":1}, ...], "GLOF": [...]}}.
 */
@Slf4j
@RequiredArgsConstructor
public class TrainingPointsLoader {

    public static final String DUDH_KOSHI_RESOURCE = "training/dudh-koshi-training-points.json";

    private final JsonFileHandler jsonFileHandler;

    public TrainingPointsLoader() {
        this(new JsonFileHandler());
    }

    public Map<HazardType, List<LabeledPoint>> loadDudhKoshiDefaults() throws IOException {
        return loadResource(DUDH_KOSHI_RESOURCE);
    }

    public Map<HazardType, List<LabeledPoint>> loadResource(String resource) throws IOException {
        Map<HazardType, List<LabeledPoint>> raw = jsonFileHandler.readFromResource(resource,
                new TypeReference<Map<HazardType, List<LabeledPoint>>>() {
                });
        Map<HazardType, List<LabeledPoint>> points = new EnumMap<>(HazardType.class);
        raw.forEach((type, list) -> points.put(type, List.copyOf(list)));
        points.forEach((type, list) -> log.debug("{} puntos de entrenamiento para {}.", list.size(), type));
        return points;
    }
}
