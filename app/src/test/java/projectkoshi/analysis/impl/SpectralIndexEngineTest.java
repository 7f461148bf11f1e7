package projectkoshi.analysis.impl;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;
import projectkoshi.analysis.tiling.TileProcessor;
import projectkoshi.domain.raster.Raster;
import projectkoshi.domain.raster.RasterGrid;
import projectkoshi.domain.vector.MaskPolygon;

import java.util.List;
import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.*;

class SpectralIndexEngineTest {

    private static final RasterGrid GRID_4X4 = new RasterGrid(4, 4, 0.0, 40.0, 10.0, "TEST");

    private TileProcessor tileProcessor;
    private SpectralIndexEngine engine;

    @BeforeEach
    void setUp() {
        tileProcessor = new TileProcessor(2, 1);
        engine = new SpectralIndexEngine(tileProcessor);
    }

    @AfterEach
    void tearDown() {
        tileProcessor.close();
    }

    @Test
    @DisplayName("El índice está en [-1, 1] y es no-data donde a + b = 0")
    void computeIndex_shouldStayInRange() {
        // ARRANGE
        SplittableRandom random = new SplittableRandom(42);
        RasterGrid grid = new RasterGrid(10, 10, 0, 10, 1, "TEST");
        float[] a = new float[100];
        float[] b = new float[100];
        for (int i = 0; i < 100; i++) {
            a[i] = (float) random.nextDouble(-500, 5000);
            b[i] = (float) random.nextDouble(-500, 5000);
        }
        a[0] = 0f;
        b[0] = 0f;
        a[1] = Float.NaN;
        a[2] = 0.2f;
        b[2] = -0.2f;

        // ACT
        Raster index = engine.computeIndex(new Raster(grid, List.of("B3", "B8"), List.of(a, b)), "B3", "B8");

        // ASSERT
        assertTrue(index.isNoData(0, 0), "a + b = 0 debe ser no-data");
        assertTrue(index.isNoData(0, 1), "una banda no-data debe propagarse");
        assertTrue(index.isNoData(0, 2), "a = -b distinto de 0 también es no-data");
        for (int i = 0; i < 100; i++) {
            float v = index.getValueAt(0, i);
            if ((double) a[i] + (double) b[i] == 0.0) {
                assertTrue(Float.isNaN(v), "a + b = 0 debe ser no-data en el píxel " + i);
            }
            if (!Float.isNaN(v)) {
                assertTrue(v >= -1f && v <= 1f, "valor fuera de rango: " + v);
            }
        }
    }

    @Test
    @DisplayName("Diferencia normalizada de valores conocidos")
    void normalizedDifference_knownValues() {
        assertEquals(0.5f, SpectralIndexEngine.normalizedDifference(3f, 1f), 1e-6);
        assertEquals(-1f, SpectralIndexEngine.normalizedDifference(0f, 2f), 1e-6);
        assertEquals(1f, SpectralIndexEngine.normalizedDifference(0.4f, 0f), 1e-6);
        assertTrue(Float.isNaN(SpectralIndexEngine.normalizedDifference(2f, -5f)));
        assertTrue(Float.isNaN(SpectralIndexEngine.normalizedDifference(-1f, -1f)));
    }

    @Test
    @DisplayName("a + b = 0 con a = -b distinto de 0 es no-data y nunca cuenta como agua")
    void oppositeReflectances_shouldBeNoDataAndNotWater() {
        // ARRANGE
        RasterGrid grid = new RasterGrid(3, 1, 0, 1, 1, "TEST");
        float[] green = {-0.1f, 0.2f, 0.5f};
        float[] nir = {0.1f, -0.2f, -0.45f};

        // ACT
        Raster index = engine.computeIndex(new Raster(grid, List.of("B3", "B8"), List.of(green, nir)), "B3", "B8");
        Raster mask = engine.threshold(index, 0.3f);

        // ASSERT
        for (int col = 0; col < 3; col++) {
            assertTrue(index.isNoData(0, col), "píxel " + col);
            assertEquals(0f, mask.getValueAt(0, col), "píxel " + col);
        }
        assertEquals(0, SpectralIndexEngine.countSet(mask));
    }

    @Test
    @DisplayName("El umbral es monótono: subirlo nunca añade píxeles")
    void threshold_shouldBeMonotonic() {
        float[] values = {-1f, -0.5f, 0f, 0.1f, 0.3f, 0.30001f, 0.8f, 1f, Float.NaN};
        RasterGrid grid = new RasterGrid(9, 1, 0, 1, 1, "TEST");
        Raster index = Raster.singleBand(grid, SpectralIndexEngine.INDEX_BAND, values);

        Raster low = engine.threshold(index, 0.0f);
        Raster high = engine.threshold(index, 0.3f);

        for (int i = 0; i < values.length; i++) {
            if (high.getValueAt(0, i) == 1f) {
                assertEquals(1f, low.getValueAt(0, i), "píxel " + i);
            }
        }
        assertEquals(0f, high.getValueAt(0, 4), "el umbral es estricto");
        assertEquals(0f, high.getValueAt(0, 8), "el no-data nunca supera el umbral");
        assertEquals(3, SpectralIndexEngine.countSet(high));
    }

    @Test
    @DisplayName("Escenario 4x4: sólo el bloque 2x2 superior izquierdo es agua y forma un polígono")
    void waterScenario_shouldProduceSinglePolygon() {
        // ARRANGE: B3 alto y B8 bajo en el bloque de agua
        float[] green = new float[16];
        float[] nir = new float[16];
        for (int row = 0; row < 4; row++) {
            for (int col = 0; col < 4; col++) {
                boolean water = row < 2 && col < 2;
                green[row * 4 + col] = water ? 0.30f : 0.10f;
                nir[row * 4 + col] = water ? 0.05f : 0.40f;
            }
        }
        Raster scene = new Raster(GRID_4X4, List.of("B3", "B8"), List.of(green, nir));

        // ACT
        Raster mask = engine.threshold(engine.computeIndex(scene, "B3", "B8"), 0.3f);
        List<MaskPolygon> lakes = new MaskVectorizer().vectorize(mask);

        // ASSERT
        assertEquals(1, lakes.size());
        MaskPolygon lake = lakes.get(0);
        assertEquals(4, lake.pixelCount());
        assertEquals(400.0, lake.geometry().getArea(), 1e-9);
        assertEquals(new Envelope(0, 20, 20, 40), lake.geometry().getEnvelopeInternal());
    }

    @Test
    @DisplayName("Umbralizar un ráster multibanda es un error de entrada")
    void threshold_shouldRejectMultiBand() {
        Raster multi = Raster.filled(GRID_4X4, List.of("a", "b"), 0f);
        assertThrows(IllegalArgumentException.class, () -> engine.threshold(multi, 0.3f));
    }
}
