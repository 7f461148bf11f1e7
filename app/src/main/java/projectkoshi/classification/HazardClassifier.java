package projectkoshi.classification;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import projectkoshi.analysis.i.IHazardClassifier;
import projectkoshi.analysis.tiling.TileProcessor;
import projectkoshi.domain.classification.HazardType;
import projectkoshi.domain.classification.TrainingSample;
import projectkoshi.domain.raster.Raster;
import projectkoshi.domain.raster.RasterGrid;
import projectkoshi.domain.vector.LabeledPoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Clasificador supervisado de un tipo de riesgo: muestreo de puntos etiquetados, bosque
 * aleatorio y clasificación píxel a píxel por teselas.
 * <p>
 * Las clases de riesgo son binarias: {@link #NO_HAZARD} o {@link #HAZARD}.
 */
@Slf4j
public class HazardClassifier implements IHazardClassifier {

    public static final String CLASSIFICATION_BAND = "classification";
    public static final int NO_HAZARD = 0;
    public static final int HAZARD = 1;

    @Getter
    private final HazardType hazardType;
    private final RandomForestTrainer trainer;
    private final TileProcessor tileProcessor;

    public HazardClassifier(HazardType hazardType, RandomForestTrainer trainer, TileProcessor tileProcessor) {
        this.hazardType = Objects.requireNonNull(hazardType, "El tipo de riesgo no puede ser nulo.");
        this.trainer = Objects.requireNonNull(trainer, "El entrenador no puede ser nulo.");
        this.tileProcessor = Objects.requireNonNull(tileProcessor, "El TileProcessor no puede ser nulo.");
    }

    @Override
    public String getName() {
        return "RandomForest-" + hazardType;
    }

    @Override
    public String getDescription() {
        return "Bosque aleatorio (Gini, bootstrap) de " + trainer.getConfig().getTreeCount()
                + " árboles para " + hazardType + ".";
    }

    @Override
    public List<TrainingSample> extractFeatures(Raster raster, List<String> bands, List<LabeledPoint> points) {
        Objects.requireNonNull(points, "La lista de puntos no puede ser nula.");
        RasterGrid grid = raster.getGrid();
        int[] bandIndices = raster.bandIndices(bands);

        List<TrainingSample> samples = new ArrayList<>(points.size());
        for (LabeledPoint point : points) {
            if (!point.isLabeled()) {
                throw new IllegalArgumentException("El punto de entrenamiento (" + point.x() + ", " + point.y()
                        + ") no tiene clase.");
            }
            if (!Double.isFinite(point.x()) || !Double.isFinite(point.y())) {
                throw new IllegalArgumentException("El punto de entrenamiento (" + point.x() + ", " + point.y()
                        + ") tiene coordenadas no finitas.");
            }
            if (point.label() != NO_HAZARD && point.label() != HAZARD) {
                throw new IllegalArgumentException("La clase del punto (" + point.x() + ", " + point.y()
                        + ") debe ser " + NO_HAZARD + " o " + HAZARD + ": " + point.label());
            }
            int col = grid.columnOf(point.x());
            int row = grid.rowOf(point.y());
            if (!grid.containsPixel(col, row)) {
                log.warn("[{}] Punto ({}, {}) fuera de la extensión del ráster; se descarta.",
                        hazardType, point.x(), point.y());
                continue;
            }
            double[] features = raster.pixelVector(bandIndices, grid.indexOf(col, row));
            if (features == null) {
                log.warn("[{}] Punto ({}, {}) sobre un píxel sin datos; se descarta.",
                        hazardType, point.x(), point.y());
                continue;
            }
            samples.add(new TrainingSample(features, point.label()));
        }
        log.info("[{}] {} de {} puntos muestreados sobre {} bandas.",
                hazardType, samples.size(), points.size(), bands.size());
        return samples;
    }

    @Override
    public Raster classify(RandomForestModel model, Raster raster) {
        if (raster.getBandCount() != model.getFeatureCount()) {
            throw new IllegalArgumentException("El ráster tiene " + raster.getBandCount()
                    + " bandas y el modelo espera " + model.getFeatureCount() + ".");
        }
        long startTime = System.currentTimeMillis();
        RasterGrid grid = raster.getGrid();
        int width = grid.width();
        int[] bandIndices = new int[raster.getBandCount()];
        for (int b = 0; b < bandIndices.length; b++) {
            bandIndices[b] = b;
        }

        Raster classified = tileProcessor.computeRaster(grid, List.of(CLASSIFICATION_BAND), (rowStart, rowEnd, block) -> {
            int offset = rowStart * width;
            for (int i = 0; i < block[0].length; i++) {
                double[] features = raster.pixelVector(bandIndices, offset + i);
                block[0][i] = features == null ? Raster.NO_DATA : model.classify(features);
            }
        });
        log.info("[{}] Clasificación de {} completada en {} ms.",
                hazardType, raster, System.currentTimeMillis() - startTime);
        return classified;
    }

    @Override
    public HazardClassification run(Raster raster, List<String> bands, List<LabeledPoint> points) {
        Raster features = raster.select(bands);
        List<TrainingSample> samples = extractFeatures(features, bands, points);
        RandomForestModel model = trainer.train(samples);
        double trainingError = model.errorRate(samples);
        log.info("[{}] Modelo {} con error de entrenamiento {}.", hazardType, model, trainingError);
        return new HazardClassification(hazardType, model, classify(model, features), samples.size(), trainingError);
    }
}
