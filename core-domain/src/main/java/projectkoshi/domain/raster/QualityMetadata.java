package projectkoshi.domain.raster;

import lombok.Builder;
import lombok.With;

import java.util.Map;
import java.util.Optional;

/**
 * Metadatos de calidad asociados a una imagen de una colección.
 *
 * @param cloudyPixelPercentage Porcentaje de píxeles nubosos de la escena [0, 100]. NaN si el
 *                              proveedor no lo informa.
 * @param properties            Propiedades numéricas adicionales del proveedor (solo lectura).
 */
@Builder
@With
public record QualityMetadata(
        double cloudyPixelPercentage,
        Map<String, Double> properties
) {
    public static final QualityMetadata UNKNOWN = new QualityMetadata(Double.NaN, Map.of());

    public QualityMetadata {
        properties = (properties == null) ? Map.of() : Map.copyOf(properties);
    }

    public static QualityMetadata ofCloudCover(double cloudyPixelPercentage) {
        return new QualityMetadata(cloudyPixelPercentage, Map.of());
    }

    public boolean hasCloudCover() {
        return !Double.isNaN(cloudyPixelPercentage);
    }

    public Optional<Double> getProperty(String name) {
        return Optional.ofNullable(properties.get(name));
    }
}
