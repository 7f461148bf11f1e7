package projectkoshi.domain.raster;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectkoshi.source.DateRange;
import projectkoshi.source.QualityFilter;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RasterCollectionTest {

    private static final RasterGrid GRID = new RasterGrid(2, 1, 0.0, 1.0, 1.0, "TEST");
    private static final List<String> SCHEMA = List.of("B3", "B8");

    private static RasterImage image(String timestamp, double cloud) {
        return new RasterImage(Raster.filled(GRID, SCHEMA, 1f), Instant.parse(timestamp),
                QualityMetadata.ofCloudCover(cloud));
    }

    @Test
    @DisplayName("Las imágenes se ordenan por fecha de adquisición")
    void constructor_shouldSortByTimestamp() {
        RasterCollection collection = new RasterCollection(GRID, SCHEMA, List.of(
                image("2024-03-01T00:00:00Z", 1),
                image("2024-01-01T00:00:00Z", 1)));

        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), collection.get(0).timestamp());
    }

    @Test
    @DisplayName("Una imagen con esquema distinto o malla desalineada se rechaza")
    void constructor_shouldValidateMembers() {
        RasterImage wrongSchema = new RasterImage(Raster.filled(GRID, List.of("B3"), 1f),
                Instant.parse("2024-01-01T00:00:00Z"), null);
        RasterImage wrongGrid = new RasterImage(Raster.filled(GRID.withOriginX(7.0), SCHEMA, 1f),
                Instant.parse("2024-01-01T00:00:00Z"), null);

        assertThrows(IllegalArgumentException.class, () -> new RasterCollection(GRID, SCHEMA, List.of(wrongSchema)));
        assertThrows(IllegalArgumentException.class, () -> new RasterCollection(GRID, SCHEMA, List.of(wrongGrid)));
    }

    @Test
    @DisplayName("El filtro de nubes es estricto y descarta escenas sin nubosidad informada")
    void filterQuality_shouldApplyStrictCloudThreshold() {
        RasterImage unknown = new RasterImage(Raster.filled(GRID, SCHEMA, 1f),
                Instant.parse("2024-04-01T00:00:00Z"), null);
        RasterCollection collection = new RasterCollection(GRID, SCHEMA, List.of(
                image("2024-01-01T00:00:00Z", 2.0),
                image("2024-02-01T00:00:00Z", 5.0),
                image("2024-03-01T00:00:00Z", 4.99),
                unknown));

        RasterCollection clear = collection.filterQuality(QualityFilter.maxCloudCover(5));

        assertEquals(2, clear.size());
        assertEquals(4, collection.filterQuality(QualityFilter.ACCEPT_ALL).size());
    }

    @Test
    @DisplayName("filterDate usa un intervalo semiabierto [inicio, fin)")
    void filterDate_shouldBeHalfOpen() {
        RasterCollection collection = new RasterCollection(GRID, SCHEMA, List.of(
                image("2024-01-31T23:59:59Z", 0),
                image("2024-02-01T00:00:00Z", 0)));

        assertEquals(1, collection.filterDate(DateRange.ofMonth(2024, 1)).size());
        assertEquals(1, collection.filterDate(DateRange.ofMonth(2024, 2)).size());
    }

    @Test
    @DisplayName("Una colección vacía conserva malla y esquema")
    void empty_shouldKeepGridAndSchema() {
        RasterCollection empty = RasterCollection.empty(GRID, SCHEMA);
        assertTrue(empty.isEmpty());
        assertEquals(GRID, empty.getGrid());
        assertEquals(SCHEMA, empty.select(List.of("B8", "B3")).getBandSchema().stream().sorted().toList());
    }
}
