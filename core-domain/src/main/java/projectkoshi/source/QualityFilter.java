package projectkoshi.source;

import projectkoshi.domain.raster.QualityMetadata;

/**
 * Criterio de aceptación de imágenes según sus metadatos de calidad.
 */
@FunctionalInterface
public interface QualityFilter {

    QualityFilter ACCEPT_ALL = quality -> true;

    boolean accept(QualityMetadata quality);

    /**
     * Acepta escenas con nubosidad estrictamente inferior al umbral. Las escenas sin
     * nubosidad informada se descartan.
     */
    static QualityFilter maxCloudCover(double maxCloudyPixelPercentage) {
        return quality -> quality.hasCloudCover() && quality.cloudyPixelPercentage() < maxCloudyPixelPercentage;
    }

    default QualityFilter and(QualityFilter other) {
        return quality -> accept(quality) && other.accept(quality);
    }
}
