package projectkoshi.domain.raster;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RasterTest {

    private static final RasterGrid GRID = new RasterGrid(2, 2, 0.0, 2.0, 1.0, "TEST");

    @Test
    @DisplayName("El ráster copia los datos: modificar el array original no lo altera")
    void constructor_shouldCopyBands() {
        // ARRANGE
        float[] data = {1f, 2f, 3f, 4f};

        // ACT
        Raster raster = Raster.singleBand(GRID, "b", data);
        data[0] = 99f;
        float[] exported = raster.cloneBand("b");
        exported[1] = 99f;

        // ASSERT
        assertEquals(1f, raster.getValue("b", 0, 0));
        assertEquals(2f, raster.getValue("b", 1, 0));
    }

    @Test
    @DisplayName("Longitudes incorrectas o nombres duplicados se rechazan")
    void constructor_shouldValidateShape() {
        assertThrows(IllegalArgumentException.class,
                () -> Raster.singleBand(GRID, "b", new float[3]));
        assertThrows(IllegalArgumentException.class,
                () -> new Raster(GRID, List.of("a", "a"), List.of(new float[4], new float[4])));
        assertThrows(IllegalArgumentException.class,
                () -> new Raster(GRID, List.of("a"), List.of(new float[4], new float[4])));
    }

    @Test
    @DisplayName("Una banda inexistente lanza IllegalArgumentException")
    void bandIndex_shouldRejectUnknownBand() {
        Raster raster = Raster.filled(GRID, List.of("B3", "B8"), 0f);
        assertEquals(1, raster.bandIndex("B8"));
        assertThrows(IllegalArgumentException.class, () -> raster.bandIndex("B4"));
    }

    @Test
    @DisplayName("pixelVector devuelve null si alguna banda es no-data")
    void pixelVector_shouldReturnNullOnNoData() {
        Raster raster = new Raster(GRID, List.of("a", "b"), List.of(
                new float[]{1f, 2f, 3f, 4f},
                new float[]{5f, Float.NaN, 7f, 8f}));
        int[] indices = raster.bandIndices(List.of("a", "b"));

        assertArrayEquals(new double[]{1.0, 5.0}, raster.pixelVector(indices, 0));
        assertNull(raster.pixelVector(indices, 1));
        assertEquals(3, raster.countValid(1));
    }

    @Test
    @DisplayName("select, rename y addBands conservan la malla y reordenan bandas")
    void bandOperations_shouldPreserveGrid() {
        Raster a = Raster.filled(GRID, List.of("x", "y"), 1f);
        Raster b = Raster.singleBand(GRID, "z", new float[]{0f, 1f, 2f, 3f});

        Raster combined = a.addBands(b).select(List.of("z", "x")).rename(List.of("first", "second"));

        assertEquals(List.of("first", "second"), combined.getBandNames());
        assertEquals(3f, combined.getValue("first", 1, 1));
        assertEquals(1f, combined.getValue("second", 1, 1));
        assertEquals(GRID, combined.getGrid());
    }

    @Test
    @DisplayName("addBands rechaza rásters de mallas distintas")
    void addBands_shouldRequireAlignment() {
        Raster a = Raster.filled(GRID, List.of("x"), 1f);
        Raster b = Raster.filled(GRID.withOriginX(5.0), List.of("y"), 1f);
        assertThrows(IllegalArgumentException.class, () -> a.addBands(b));
    }
}
