package projectkoshi.pipeline;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import projectkoshi.analysis.impl.BandMath;
import projectkoshi.analysis.impl.MaskVectorizer;
import projectkoshi.analysis.impl.SpectralIndexEngine;
import projectkoshi.analysis.impl.TemporalAggregator;
import projectkoshi.analysis.impl.TerrainAnalyzer;
import projectkoshi.analysis.tiling.TileProcessor;
import projectkoshi.classification.HazardClassification;
import projectkoshi.classification.HazardClassifier;
import projectkoshi.classification.RandomForestTrainer;
import projectkoshi.config.AnalysisConfig;
import projectkoshi.config.WatershedConfig;
import projectkoshi.domain.classification.HazardType;
import projectkoshi.domain.raster.Composite;
import projectkoshi.domain.raster.PixelReducer;
import projectkoshi.domain.raster.Raster;
import projectkoshi.domain.raster.RasterCollection;
import projectkoshi.domain.raster.RasterGrid;
import projectkoshi.domain.raster.RasterImage;
import projectkoshi.domain.result.RasterLayer;
import projectkoshi.domain.series.TimeSeries;
import projectkoshi.domain.series.TimeSeriesEntry;
import projectkoshi.domain.terrain.GlacierProxies;
import projectkoshi.domain.terrain.SlopeAspect;
import projectkoshi.domain.vector.GlacierOutline;
import projectkoshi.domain.vector.LabeledPoint;
import projectkoshi.domain.vector.MaskPolygon;
import projectkoshi.factory.PeriodFunctions;
import projectkoshi.factory.RasterLayerFactory;
import projectkoshi.source.DateRange;
import projectkoshi.source.QualityFilter;

import java.io.IOException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Orquestador del análisis completo de una cuenca.
 * <p>
 * Etapas:
 * 1. Agua superficial: compuesto mediano sin nubes, índice normalizado, umbral y vectorización.
 * 2. Terreno: pendiente, orientación y proxies glaciares a partir del MDE.
 * 3. Precipitación: compuestos mensuales, serie por mes y mapa medio anual.
 * 4. Temperatura superficial: conversión a °C, serie por fecha y mapa medio.
 * 5. Glaciares que intersectan el área de estudio.
 * 6. Clasificaciones de riesgo (desprendimientos y GLOF) sobre el compuesto del año de clasificación.
 * <p>
 * El fallo de una fuente en un mes de precipitación, o de la serie de temperatura, se
 * registra como hueco. El resto de fuentes son imprescindibles y su fallo se propaga.
 */
@Slf4j
public class WatershedAnalysisPipeline implements AutoCloseable {

    private static final DateRange STATIC_RANGE = DateRange.of(LocalDate.of(1900, 1, 1), LocalDate.of(2100, 1, 1));

    @Getter
    private final AnalysisConfig config;
    private final WatershedDataSources sources;
    private final TileProcessor tileProcessor;
    private final SpectralIndexEngine indexEngine;
    private final MaskVectorizer vectorizer;
    private final TerrainAnalyzer terrainAnalyzer;
    private final TemporalAggregator aggregator;
    private final RandomForestTrainer trainer;

    public WatershedAnalysisPipeline(AnalysisConfig config, WatershedDataSources sources) {
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
        this.sources = Objects.requireNonNull(sources, "Las fuentes de datos no pueden ser nulas.");
        this.tileProcessor = new TileProcessor(config);
        this.indexEngine = new SpectralIndexEngine(tileProcessor);
        this.vectorizer = new MaskVectorizer();
        this.terrainAnalyzer = new TerrainAnalyzer(tileProcessor);
        this.aggregator = new TemporalAggregator(tileProcessor);
        this.trainer = new RandomForestTrainer(config.getClassifierConfig(), tileProcessor);
    }

    /**
     * Ejecuta todas las etapas sobre el área de estudio.
     *
     * @param studyArea      Límite de la cuenca.
     * @param glaciers       Inventario de glaciares (se filtran los que intersectan el área).
     * @param trainingPoints Puntos etiquetados por tipo de riesgo. Un tipo ausente no se clasifica.
     * @throws IOException Si falla una fuente imprescindible (óptica o elevación).
     */
    public WatershedAnalysisResult run(Geometry studyArea,
                                       List<GlacierOutline> glaciers,
                                       Map<HazardType, List<LabeledPoint>> trainingPoints) throws IOException {
        Objects.requireNonNull(studyArea, "El área de estudio no puede ser nula.");
        WatershedConfig watershed = config.getWatershedConfig();
        long startTime = System.currentTimeMillis();
        log.info("Iniciando análisis de la cuenca '{}' (año {}, clasificación {}).",
                watershed.studyAreaName(), watershed.analysisYear(), watershed.classificationYear());

        Map<String, RasterLayer> layers = new LinkedHashMap<>();

        // --- 1. AGUA SUPERFICIAL ---
        List<MaskPolygon> lakes = detectWater(studyArea, watershed, layers);

        // --- 2. TERRENO Y GLACIARES ---
        analyzeTerrain(studyArea, watershed, layers);

        // --- 3. PRECIPITACIÓN ---
        TimeSeries<Integer> precipitation = analyzePrecipitation(studyArea, watershed, layers);

        // --- 4. TEMPERATURA SUPERFICIAL ---
        TimeSeries<LocalDate> lst = analyzeTemperature(studyArea, watershed, layers);

        // --- 5. INVENTARIO GLACIAR ---
        List<GlacierOutline> glaciersInArea = glaciers == null ? List.of() : glaciers.stream()
                .filter(glacier -> glacier.intersects(studyArea))
                .toList();
        log.info("{} glaciares intersectan el área de estudio.", glaciersInArea.size());

        // --- 6. RIESGOS ---
        Map<HazardType, HazardClassification> classifications =
                classifyHazards(studyArea, watershed, trainingPoints == null ? Map.of() : trainingPoints, layers);

        log.info("Análisis de '{}' completado en {} ms: {} capas, {} lagos.",
                watershed.studyAreaName(), System.currentTimeMillis() - startTime, layers.size(), lakes.size());
        return new WatershedAnalysisResult(layers, lakes, glaciersInArea, precipitation, lst, classifications);
    }

    private List<MaskPolygon> detectWater(Geometry studyArea, WatershedConfig watershed,
                                          Map<String, RasterLayer> layers) throws IOException {
        List<String> bands = List.of(watershed.waterBandA(), watershed.waterBandB());
        QualityFilter cloudFilter = QualityFilter.maxCloudCover(watershed.maxCloudyPixelPercentage());
        RasterCollection scenes = sources.optical().fetchCollection(bands, studyArea,
                DateRange.ofYear(watershed.analysisYear()), cloudFilter);

        Composite<Integer> composite = aggregator.composite(scenes, cloudFilter, PixelReducer.MEDIAN);
        if (composite.isEmpty()) {
            log.warn("Ninguna escena óptica de {} supera el filtro de nubes; el índice de agua queda sin datos.",
                    watershed.analysisYear());
        }
        Raster clipped = BandMath.clip(composite.raster(), studyArea);
        Raster index = indexEngine.computeIndex(clipped, watershed.waterBandA(), watershed.waterBandB());
        Raster mask = indexEngine.threshold(index, watershed.waterIndexThreshold());
        List<MaskPolygon> lakes = vectorizer.vectorize(mask);

        put(layers, RasterLayerFactory.createWaterIndexLayer(composite, index));
        put(layers, RasterLayerFactory.createLakeMaskLayer(composite, mask));
        return lakes;
    }

    private void analyzeTerrain(Geometry studyArea, WatershedConfig watershed,
                                Map<String, RasterLayer> layers) throws IOException {
        RasterCollection tiles = sources.elevation().fetchCollection(List.of(watershed.demBand()), studyArea,
                STATIC_RANGE, QualityFilter.ACCEPT_ALL);
        if (tiles.isEmpty()) {
            throw new IllegalStateException("La fuente de elevación no devolvió ningún MDE para el área de estudio.");
        }
        Raster dem = BandMath.clip(aggregator.collectionMean(tiles), studyArea);

        SlopeAspect terrain = terrainAnalyzer.deriveSlopeAspect(dem);
        GlacierProxies proxies = terrainAnalyzer.estimateThickness(dem, terrain.slope(),
                watershed.snowlineElevation(), watershed.velocityFactor());

        put(layers, RasterLayerFactory.createDemLayer(dem));
        put(layers, RasterLayerFactory.createSlopeLayer(terrain.slope()));
        put(layers, RasterLayerFactory.createAspectLayer(terrain.aspect()));
        put(layers, RasterLayerFactory.createSnowlineLayer(proxies.snowlineMask()));
        put(layers, RasterLayerFactory.createThicknessLayer(proxies.thickness()));
        put(layers, RasterLayerFactory.createVelocityLayer(proxies.velocity()));
    }

    private TimeSeries<Integer> analyzePrecipitation(Geometry studyArea, WatershedConfig watershed,
                                                     Map<String, RasterLayer> layers) {
        int year = watershed.analysisYear();
        List<String> schema = List.of(watershed.precipitationBand());
        List<Integer> months = PeriodFunctions.allMonths();

        RasterGrid grid = null;
        List<RasterImage> images = new ArrayList<>();
        for (int month : months) {
            try {
                RasterCollection monthly = sources.precipitation().fetchCollection(schema, studyArea,
                        DateRange.ofMonth(year, month), QualityFilter.ACCEPT_ALL);
                grid = (grid == null) ? monthly.getGrid() : grid;
                images.addAll(monthly.getImages());
            } catch (IOException | RuntimeException e) {
                log.warn("Fallo al obtener la precipitación de {}-{}; el mes se trata como hueco: {}",
                        year, month, e.getMessage());
            }
        }

        String name = "mean_precipitation";
        String unit = "mm";
        if (grid == null) {
            log.warn("Ningún mes de precipitación disponible para {}; serie sin medidas.", year);
            return new TimeSeries<>(name, unit, months.stream()
                    .map(month -> new TimeSeriesEntry<Integer>(month, TimeSeriesEntry.UNMEASURED))
                    .toList());
        }

        RasterCollection collection = new RasterCollection(grid, schema, images);
        ZoneId zone = ZoneId.of(watershed.timeZone());
        float factor = watershed.precipitationFactor();
        List<Composite<Integer>> monthlyComposites = aggregator.aggregateByPeriod(collection, months,
                        PeriodFunctions.monthOfYear(year, zone), PixelReducer.MEAN).stream()
                .map(c -> new Composite<Integer>(c.periodKey(),
                        BandMath.clip(BandMath.linear(c.raster(), factor, 0f), studyArea),
                        c.sourceTimestamps(), c.reducer()))
                .toList();

        TimeSeries<Integer> series = aggregator.buildTimeSeries(monthlyComposites, watershed.precipitationBand(),
                studyArea, PixelReducer.MEAN, watershed.precipitationScale(), name, unit);

        Composite<Integer> annual = aggregator.reduceComposites(monthlyComposites, year, PixelReducer.MEAN);
        put(layers, RasterLayerFactory.createAnnualPrecipitationLayer(annual.raster(), annual.sourceTimestamps()));
        return series;
    }

    private TimeSeries<LocalDate> analyzeTemperature(Geometry studyArea, WatershedConfig watershed,
                                                     Map<String, RasterLayer> layers) {
        String name = "mean_LST_Celsius";
        String unit = "°C";
        RasterCollection raw;
        try {
            raw = sources.temperature().fetchCollection(List.of(watershed.lstBand()), studyArea,
                    DateRange.ofYear(watershed.analysisYear()), QualityFilter.ACCEPT_ALL);
        } catch (IOException | RuntimeException e) {
            log.warn("Fallo al obtener la temperatura superficial de {}; serie vacía: {}",
                    watershed.analysisYear(), e.getMessage());
            return new TimeSeries<>(name, unit, List.of());
        }

        RasterCollection celsius = raw.map(raster ->
                BandMath.linear(raster, watershed.lstScaleFactor(), watershed.lstOffset()));
        ZoneId zone = ZoneId.of(watershed.timeZone());
        List<LocalDate> days = PeriodFunctions.distinctDays(celsius.getTimestamps(), zone);

        List<Composite<LocalDate>> daily = aggregator.aggregateByPeriod(celsius, days,
                PeriodFunctions.dayOf(zone), PixelReducer.MEAN);
        TimeSeries<LocalDate> series = aggregator.buildTimeSeries(daily, watershed.lstBand(), studyArea,
                PixelReducer.MEAN, watershed.lstScale(), name, unit);

        if (!celsius.isEmpty()) {
            Raster mean = BandMath.clip(aggregator.collectionMean(celsius), studyArea);
            put(layers, RasterLayerFactory.createMeanLstLayer(mean, celsius.getTimestamps()));
        } else {
            log.warn("Sin imágenes de temperatura superficial en {}.", watershed.analysisYear());
        }
        return series;
    }

    private Map<HazardType, HazardClassification> classifyHazards(Geometry studyArea,
                                                                  WatershedConfig watershed,
                                                                  Map<HazardType, List<LabeledPoint>> trainingPoints,
                                                                  Map<String, RasterLayer> layers) throws IOException {
        Map<HazardType, HazardClassification> results = new EnumMap<>(HazardType.class);
        if (trainingPoints.isEmpty()) {
            log.info("Sin puntos de entrenamiento; se omiten las clasificaciones de riesgo.");
            return results;
        }

        List<String> bands = watershed.classificationBands();
        QualityFilter cloudFilter = QualityFilter.maxCloudCover(watershed.maxCloudyPixelPercentage());
        RasterCollection scenes = sources.optical().fetchCollection(bands, studyArea,
                DateRange.ofYear(watershed.classificationYear()), cloudFilter);
        Composite<Integer> composite = aggregator.composite(scenes, cloudFilter, PixelReducer.MEDIAN);
        Raster image = BandMath.clip(composite.raster(), studyArea);

        for (HazardType type : HazardType.values()) {
            List<LabeledPoint> points = trainingPoints.get(type);
            if (points == null) {
                continue;
            }
            HazardClassifier classifier = new HazardClassifier(type, trainer, tileProcessor);
            HazardClassification classification = classifier.run(image, bands, points);
            results.put(type, classification);
            RasterLayer layer = (type == HazardType.ROCKFALL)
                    ? RasterLayerFactory.createRockfallLayer(classification.raster(), composite.sourceTimestamps())
                    : RasterLayerFactory.createGlofLayer(classification.raster(), composite.sourceTimestamps());
            put(layers, layer);
        }
        return results;
    }

    private static void put(Map<String, RasterLayer> layers, RasterLayer layer) {
        layers.put(layer.name(), layer);
    }

    @Override
    public void close() {
        tileProcessor.close();
    }
}
