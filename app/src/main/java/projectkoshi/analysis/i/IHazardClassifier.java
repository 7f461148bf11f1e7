package projectkoshi.analysis.i;

import projectkoshi.classification.HazardClassification;
import projectkoshi.classification.RandomForestModel;
import projectkoshi.domain.classification.HazardType;
import projectkoshi.domain.classification.TrainingSample;
import projectkoshi.domain.raster.Raster;
import projectkoshi.domain.vector.LabeledPoint;

import java.util.List;

public interface IHazardClassifier extends IAnalysisComponent {

    HazardType getHazardType();

    /**
     * Muestrea las bandas en el píxel más cercano a cada punto. Los puntos fuera de la malla
     * o sobre no-data se descartan.
     */
    List<TrainingSample> extractFeatures(Raster raster, List<String> bands, List<LabeledPoint> points);

    /**
     * Ráster de una banda con la etiqueta predicha; no-data donde alguna banda lo es.
     */
    Raster classify(RandomForestModel model, Raster raster);

    /**
     * Extracción, entrenamiento y clasificación en un solo paso.
     */
    HazardClassification run(Raster raster, List<String> bands, List<LabeledPoint> points);
}
