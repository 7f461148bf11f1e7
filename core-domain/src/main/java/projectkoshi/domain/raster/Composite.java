package projectkoshi.domain.raster;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Ráster obtenido al reducir píxel a píxel un subconjunto de una colección.
 * <p>
 * Conserva la clave de periodo a la que pertenece y las fechas de las imágenes
 * que lo originaron (procedencia). Un compuesto sin imágenes de origen es un
 * compuesto vacío: todos sus píxeles son no-data.
 *
 * @param periodKey        Clave del periodo (mes 1..12, fecha...). Puede ser nula para compuestos anuales.
 * @param raster           Ráster resultante.
 * @param sourceTimestamps Fechas de las imágenes que contribuyeron, en orden cronológico.
 * @param reducer          Estadístico aplicado.
 * @param <K>              Tipo de la clave de periodo.
 */
public record Composite<K extends Comparable<? super K>>(
        K periodKey,
        Raster raster,
        List<Instant> sourceTimestamps,
        PixelReducer reducer
) {
    public Composite {
        Objects.requireNonNull(raster, "El ráster del compuesto no puede ser nulo.");
        Objects.requireNonNull(reducer, "El reductor del compuesto no puede ser nulo.");
        sourceTimestamps = (sourceTimestamps == null) ? List.of() : List.copyOf(sourceTimestamps);
    }

    public boolean isEmpty() {
        return sourceTimestamps.isEmpty();
    }

    public int getSourceCount() {
        return sourceTimestamps.size();
    }
}
