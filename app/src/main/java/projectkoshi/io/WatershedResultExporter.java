package projectkoshi.io;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import projectkoshi.classification.HazardClassification;
import projectkoshi.domain.result.RasterLayer;
import projectkoshi.pipeline.WatershedAnalysisResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exporta las tablas y vectores de un análisis a un directorio:
 * {@code lakes.geojson}, {@code glaciers.geojson}, {@code precipitation.csv},
 * {@code lst_time_series.csv} y un resumen {@code summary.json} de capas y clasificaciones.
 * <p>
 * Los rásteres no se escriben: su codificación (GeoTIFF...) corresponde a otro colaborador.
 */
@Slf4j
@RequiredArgsConstructor
public class WatershedResultExporter {

    public static final String LAKES_FILE = "lakes.geojson";
    public static final String GLACIERS_FILE = "glaciers.geojson";
    public static final String PRECIPITATION_FILE = "precipitation.csv";
    public static final String LST_FILE = "lst_time_series.csv";
    public static final String SUMMARY_FILE = "summary.json";

    private final JsonFileHandler jsonFileHandler;
    private final TimeSeriesCsvWriter csvWriter;
    private final GeoJsonPolygonWriter geoJsonWriter;

    public WatershedResultExporter() {
        this(new JsonFileHandler(), new TimeSeriesCsvWriter(), new GeoJsonPolygonWriter());
    }

    public void export(WatershedAnalysisResult result, Path directory) throws IOException {
        long startTime = System.currentTimeMillis();
        geoJsonWriter.writeToFile(result.lakePolygons(), directory.resolve(LAKES_FILE));
        geoJsonWriter.writeGlaciersToFile(result.glaciers(), directory.resolve(GLACIERS_FILE));
        csvWriter.writeToFile(result.precipitationSeries(), directory.resolve(PRECIPITATION_FILE));
        csvWriter.writeToFile(result.lstSeries(), directory.resolve(LST_FILE));
        jsonFileHandler.writeToFile(summarize(result), directory.resolve(SUMMARY_FILE));
        log.info("Resultados exportados a {} en {} ms.", directory.toAbsolutePath(), System.currentTimeMillis() - startTime);
    }

    Map<String, Object> summarize(WatershedAnalysisResult result) {
        Map<String, Object> summary = new LinkedHashMap<>();
        List<Map<String, Object>> layers = result.layers().values().stream()
                .map(WatershedResultExporter::describe)
                .toList();
        summary.put("layers", layers);
        summary.put("lakeCount", result.lakePolygons().size());
        summary.put("glacierCount", result.glaciers().size());

        Map<String, Object> classifications = new LinkedHashMap<>();
        for (HazardClassification classification : result.classifications().values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("trees", classification.model().getTreeCount());
            entry.put("samples", classification.sampleCount());
            entry.put("trainingError", classification.trainingError());
            classifications.put(classification.type().name(), entry);
        }
        summary.put("classifications", classifications);
        return summary;
    }

    private static Map<String, Object> describe(RasterLayer layer) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name", layer.name());
        entry.put("description", layer.description());
        entry.put("unit", layer.unit());
        entry.put("width", layer.raster().getGrid().width());
        entry.put("height", layer.raster().getGrid().height());
        entry.put("bands", layer.raster().getBandNames());
        entry.put("sources", layer.sourceTimestamps());
        return entry;
    }
}
