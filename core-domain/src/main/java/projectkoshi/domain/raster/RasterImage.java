package projectkoshi.domain.raster;

import java.time.Instant;
import java.util.Objects;

/**
 * Una imagen fechada de una colección: ráster, instante de adquisición y metadatos de calidad.
 */
public record RasterImage(
        Raster raster,
        Instant timestamp,
        QualityMetadata quality
) {
    public RasterImage {
        Objects.requireNonNull(raster, "El ráster de la imagen no puede ser nulo.");
        Objects.requireNonNull(timestamp, "La fecha de la imagen no puede ser nula.");
        quality = (quality == null) ? QualityMetadata.UNKNOWN : quality;
    }

    public RasterImage withRaster(Raster newRaster) {
        return new RasterImage(newRaster, timestamp, quality);
    }
}
