package projectkoshi.pipeline;

import projectkoshi.classification.HazardClassification;
import projectkoshi.domain.classification.HazardType;
import projectkoshi.domain.result.RasterLayer;
import projectkoshi.domain.series.TimeSeries;
import projectkoshi.domain.vector.GlacierOutline;
import projectkoshi.domain.vector.MaskPolygon;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Productos de un análisis completo de la cuenca.
 *
 * @param layers              Capas ráster por nombre, en el orden en que se generaron.
 * @param lakePolygons        Polígonos de los lagos detectados.
 * @param glaciers            Contornos glaciares que intersectan el área de estudio.
 * @param precipitationSeries Precipitación media por mes (1..12).
 * @param lstSeries           Temperatura superficial media por fecha.
 * @param classifications     Resultado de cada clasificación de riesgo.
 */
public record WatershedAnalysisResult(
        Map<String, RasterLayer> layers,
        List<MaskPolygon> lakePolygons,
        List<GlacierOutline> glaciers,
        TimeSeries<Integer> precipitationSeries,
        TimeSeries<LocalDate> lstSeries,
        Map<HazardType, HazardClassification> classifications
) {
    public WatershedAnalysisResult {
        layers = Collections.unmodifiableMap(new LinkedHashMap<>(layers));
        lakePolygons = List.copyOf(lakePolygons);
        glaciers = List.copyOf(glaciers);
        classifications = classifications.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(classifications));
    }

    public Optional<RasterLayer> getLayer(String name) {
        return Optional.ofNullable(layers.get(name));
    }

    public Optional<HazardClassification> getClassification(HazardType type) {
        return Optional.ofNullable(classifications.get(type));
    }
}
