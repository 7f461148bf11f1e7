package projectkoshi.domain.raster;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import projectkoshi.source.DateRange;
import projectkoshi.source.QualityFilter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Secuencia de imágenes fechadas que comparten malla y esquema de bandas.
 * <p>
 * Las imágenes se ordenan por fecha (orden estable ante empates). La colección no
 * garantiza continuidad temporal: puede tener huecos o estar vacía, y aun así conserva
 * su malla y su esquema para poder construir compuestos no-data.
 */
@Slf4j
public final class RasterCollection implements Iterable<RasterImage> {

    @Getter
    private final RasterGrid grid;
    @Getter
    private final List<String> bandSchema;
    private final List<RasterImage> images;

    public RasterCollection(RasterGrid grid, List<String> bandSchema, List<RasterImage> images) {
        Objects.requireNonNull(grid, "La malla de la colección no puede ser nula.");
        Objects.requireNonNull(bandSchema, "El esquema de bandas no puede ser nulo.");
        Objects.requireNonNull(images, "La lista de imágenes no puede ser nula.");
        if (bandSchema.isEmpty()) {
            throw new IllegalArgumentException("El esquema de bandas no puede estar vacío.");
        }

        for (RasterImage image : images) {
            Objects.requireNonNull(image, "La colección no admite imágenes nulas.");
            Raster raster = image.raster();
            grid.requireAlignedWith(raster.getGrid(), "RasterCollection (imagen " + image.timestamp() + ")");
            if (!raster.getBandNames().equals(bandSchema)) {
                throw new IllegalArgumentException("La imagen " + image.timestamp() + " tiene bandas "
                        + raster.getBandNames() + " pero el esquema de la colección es " + bandSchema);
            }
        }

        List<RasterImage> sorted = new ArrayList<>(images);
        sorted.sort(Comparator.comparing(RasterImage::timestamp));
        this.grid = grid;
        this.bandSchema = List.copyOf(bandSchema);
        this.images = List.copyOf(sorted);
    }

    public static RasterCollection empty(RasterGrid grid, List<String> bandSchema) {
        return new RasterCollection(grid, bandSchema, List.of());
    }

    public int size() {
        return images.size();
    }

    public boolean isEmpty() {
        return images.isEmpty();
    }

    public RasterImage get(int index) {
        return images.get(index);
    }

    public List<RasterImage> getImages() {
        return images;
    }

    public List<Instant> getTimestamps() {
        return images.stream().map(RasterImage::timestamp).toList();
    }

    public Stream<RasterImage> stream() {
        return images.stream();
    }

    @Override
    public Iterator<RasterImage> iterator() {
        return images.iterator();
    }

    public RasterCollection filterDate(DateRange range) {
        RasterCollection filtered = new RasterCollection(grid, bandSchema,
                images.stream().filter(img -> range.contains(img.timestamp())).toList());
        log.debug("Filtro temporal {}: {} de {} imágenes conservadas.", range, filtered.size(), size());
        return filtered;
    }

    public RasterCollection filterQuality(QualityFilter filter) {
        RasterCollection filtered = new RasterCollection(grid, bandSchema,
                images.stream().filter(img -> filter.accept(img.quality())).toList());
        if (filtered.size() < size()) {
            log.debug("Filtro de calidad: {} de {} imágenes descartadas.", size() - filtered.size(), size());
        }
        return filtered;
    }

    public RasterCollection select(List<String> bands) {
        return new RasterCollection(grid, bands,
                images.stream().map(img -> img.withRaster(img.raster().select(bands))).toList());
    }

    /**
     * Aplica una transformación ráster a ráster a cada imagen, conservando fecha y calidad.
     * Todas las imágenes resultantes deben compartir malla y esquema.
     */
    public RasterCollection map(UnaryOperator<Raster> operation) {
        List<RasterImage> mapped = images.stream().map(img -> img.withRaster(operation.apply(img.raster()))).toList();
        if (mapped.isEmpty()) {
            return this;
        }
        Raster first = mapped.get(0).raster();
        return new RasterCollection(first.getGrid(), first.getBandNames(), mapped);
    }

    @Override
    public String toString() {
        return "RasterCollection{" + images.size() + " imágenes, bandas=" + bandSchema + ", malla="
                + grid.width() + "x" + grid.height() + "}";
    }
}
