package projectkoshi.domain.result;

import lombok.Builder;
import projectkoshi.domain.raster.Raster;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Capa ráster de salida del análisis con sus metadatos de presentación.
 *
 * @param name             Identificador corto (ej: "ndwi", "slope").
 * @param description      Título legible de la capa.
 * @param unit             Unidad física de los valores, o cadena vacía si es adimensional.
 * @param raster           Datos de la capa.
 * @param sourceTimestamps Fechas de las imágenes de las que procede (vacía para capas estáticas).
 */
@Builder
public record RasterLayer(
        String name,
        String description,
        String unit,
        Raster raster,
        List<Instant> sourceTimestamps
) {
    public RasterLayer {
        Objects.requireNonNull(name, "El nombre de la capa no puede ser nulo.");
        Objects.requireNonNull(raster, "El ráster de la capa '" + name + "' no puede ser nulo.");
        description = (description == null) ? name : description;
        unit = (unit == null) ? "" : unit;
        sourceTimestamps = (sourceTimestamps == null) ? List.of() : List.copyOf(sourceTimestamps);
    }
}
