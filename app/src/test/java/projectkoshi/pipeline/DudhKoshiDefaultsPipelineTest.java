package projectkoshi.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.locationtech.jts.geom.Geometry;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import projectkoshi.classification.HazardClassification;
import projectkoshi.config.AnalysisConfig;
import projectkoshi.config.WatershedConfig;
import projectkoshi.domain.classification.HazardType;
import projectkoshi.domain.raster.QualityMetadata;
import projectkoshi.domain.raster.Raster;
import projectkoshi.domain.raster.RasterCollection;
import projectkoshi.domain.raster.RasterGrid;
import projectkoshi.domain.raster.RasterImage;
import projectkoshi.domain.series.TimeSeries;
import projectkoshi.domain.vector.LabeledPoint;
import projectkoshi.factory.RasterLayerFactory;
import projectkoshi.io.TrainingPointsLoader;
import projectkoshi.source.DateRange;
import projectkoshi.source.RasterSource;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Análisis completo con la configuración por defecto del Dudh Koshi sobre una malla lon/lat
 * de 0.01° que cubre los puntos de entrenamiento incluidos en el proyecto.
 */
@Slf4j
@ExtendWith(MockitoExtension.class)
class DudhKoshiDefaultsPipelineTest {

    // 55 x 35 píxeles de 0.01° (~1 km): lon [86.45, 87.00], lat [27.65, 28.00]
    private static final RasterGrid GRID = new RasterGrid(55, 35, 86.45, 28.0, 0.01, "EPSG:4326");
    private static final Geometry STUDY_AREA = GRID.toPolygon();

    @Mock
    private RasterSource optical;
    @Mock
    private RasterSource elevation;
    @Mock
    private RasterSource precipitation;
    @Mock
    private RasterSource temperature;

    private WatershedConfig watershed;
    private WatershedDataSources sources;

    @BeforeEach
    void setUp() {
        watershed = WatershedConfig.getDudhKoshiDefaults();
        sources = new WatershedDataSources(optical, elevation, precipitation, temperature);
    }

    private static Instant at(int year, int month, int day) {
        return LocalDate.of(year, month, day).atStartOfDay(ZoneOffset.UTC).toInstant().plusSeconds(5 * 3600);
    }

    private RasterCollection opticalScene(List<String> bands) {
        int pixels = GRID.getPixelCount();
        List<float[]> values = new ArrayList<>();
        if (bands.equals(List.of(watershed.waterBandA(), watershed.waterBandB()))) {
            // Un lago de 2x2 píxeles en la esquina noroeste
            float[] green = new float[pixels];
            float[] nir = new float[pixels];
            for (int i = 0; i < pixels; i++) {
                boolean water = i % GRID.width() < 2 && i / GRID.width() < 2;
                green[i] = water ? 0.5f : 0.1f;
                nir[i] = water ? 0.1f : 0.5f;
            }
            values.add(green);
            values.add(nir);
        } else {
            // Reflectancias distintas en cada píxel: gradiente por columna y fila
            for (int b = 0; b < bands.size(); b++) {
                float[] band = new float[pixels];
                for (int i = 0; i < pixels; i++) {
                    band[i] = 500f * (b + 1) + 20f * (i % GRID.width()) + 3f * (i / GRID.width());
                }
                values.add(band);
            }
        }
        Raster raster = new Raster(GRID, bands, values);
        return new RasterCollection(GRID, bands, List.of(
                new RasterImage(raster, at(2023, 10, 1), QualityMetadata.ofCloudCover(1.0))));
    }

    private void stubSources() throws IOException {
        when(optical.fetchCollection(any(), any(), any(), any()))
                .thenAnswer(invocation -> opticalScene(invocation.getArgument(0)));

        // MDE que sube 10 m por columna (~1 km)
        float[] z = new float[GRID.getPixelCount()];
        for (int i = 0; i < z.length; i++) {
            z[i] = 4000f + 10f * (i % GRID.width());
        }
        when(elevation.fetchCollection(any(), any(), any(), any())).thenReturn(new RasterCollection(GRID,
                List.of(watershed.demBand()), List.of(new RasterImage(
                        Raster.singleBand(GRID, watershed.demBand(), z), at(2000, 2, 11), null))));

        when(precipitation.fetchCollection(any(), any(), any(), any())).thenAnswer(invocation -> {
            DateRange range = invocation.getArgument(2);
            int month = range.start().atZone(ZoneOffset.UTC).getMonthValue();
            List<String> schema = List.of(watershed.precipitationBand());
            return new RasterCollection(GRID, schema, List.of(
                    new RasterImage(Raster.filled(GRID, schema, month), at(2024, month, 15), null)));
        });

        List<String> lstSchema = List.of(watershed.lstBand());
        when(temperature.fetchCollection(any(), any(), any(), any())).thenReturn(new RasterCollection(GRID, lstSchema,
                List.of(new RasterImage(Raster.filled(GRID, lstSchema, 14157.5f), at(2024, 7, 1), null))));
    }

    @Test
    @DisplayName("La configuración por defecto produce series medidas, pendientes realistas y clasificaciones")
    void defaults_shouldProduceConsistentProductsOnGeographicGrid() throws IOException {
        // ARRANGE
        stubSources();
        Map<HazardType, List<LabeledPoint>> training = new TrainingPointsLoader().loadDudhKoshiDefaults();
        AnalysisConfig config = AnalysisConfig.builder().threadCount(2).build();

        // ACT
        WatershedAnalysisResult result;
        try (WatershedAnalysisPipeline pipeline = new WatershedAnalysisPipeline(config, sources)) {
            result = pipeline.run(STUDY_AREA, List.of(), training);
        }

        // ASSERT
        // 1. Precipitación reducida a 5 km: todos los meses medidos
        TimeSeries<Integer> rain = result.precipitationSeries();
        assertEquals(12, rain.countMeasured());
        assertEquals(500.0, rain.find(5).orElseThrow().value(), 1e-3);

        // 2. Temperatura reducida a 1 km
        TimeSeries<LocalDate> lst = result.lstSeries();
        assertEquals(List.of(LocalDate.of(2024, 7, 1)), lst.getPeriods());
        assertEquals(10.0, lst.entries().get(0).value(), 1e-2);

        // 3. Pendiente: 10 m de desnivel por ~1 km de píxel es terreno casi llano
        Raster slope = result.getLayer(RasterLayerFactory.SLOPE).orElseThrow().raster();
        float maxSlope = 0f;
        for (int i = 0; i < GRID.getPixelCount(); i++) {
            maxSlope = Math.max(maxSlope, slope.getValueAt(0, i));
        }
        log.info("Pendiente máxima sobre la malla geográfica: {}°", maxSlope);
        assertTrue(maxSlope > 0.3f && maxSlope < 1f, "pendiente fuera de lo esperado: " + maxSlope);

        // 4. Lagos
        assertEquals(1, result.lakePolygons().size());

        // 5. Todos los puntos incluidos caen dentro de la malla y se muestrean
        HazardClassification glof = result.getClassification(HazardType.GLOF).orElseThrow();
        HazardClassification rockfall = result.getClassification(HazardType.ROCKFALL).orElseThrow();
        assertEquals(16, glof.sampleCount());
        assertEquals(5, rockfall.sampleCount());
        for (HazardClassification classification : List.of(glof, rockfall)) {
            Raster classes = classification.raster();
            for (int i = 0; i < GRID.getPixelCount(); i++) {
                float value = classes.getValueAt(0, i);
                assertTrue(value == 0f || value == 1f, "clase inesperada " + value + " en el píxel " + i);
            }
        }
    }
}
