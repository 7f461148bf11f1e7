package projectkoshi.analysis.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import projectkoshi.analysis.i.IRegionReducer;
import projectkoshi.analysis.i.ITemporalAggregator;
import projectkoshi.analysis.tiling.TileProcessor;
import projectkoshi.domain.raster.Composite;
import projectkoshi.domain.raster.PixelReducer;
import projectkoshi.domain.raster.Raster;
import projectkoshi.domain.raster.RasterCollection;
import projectkoshi.domain.raster.RasterGrid;
import projectkoshi.domain.raster.RasterImage;
import projectkoshi.domain.series.TimeSeries;
import projectkoshi.domain.series.TimeSeriesEntry;
import projectkoshi.source.QualityFilter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Agregación temporal de colecciones de imágenes en compuestos por periodo y series escalares.
 * <p>
 * Política de huecos: un periodo sin imágenes produce un compuesto vacío (todo no-data) y,
 * en la serie temporal, la entrada centinela {@link TimeSeriesEntry#UNMEASURED}. Nunca se
 * descarta un periodo solicitado.
 * <p>
 * Los compuestos de distintos periodos se calculan en paralelo y se devuelven ordenados por
 * clave, no por orden de finalización.
 */
@Slf4j
@RequiredArgsConstructor
public class TemporalAggregator implements ITemporalAggregator {

    private final TileProcessor tileProcessor;
    private final IRegionReducer regionReducer;

    public TemporalAggregator(TileProcessor tileProcessor) {
        this(tileProcessor, new RegionReducer());
    }

    @Override
    public String getName() {
        return "PeriodComposite";
    }

    @Override
    public String getDescription() {
        return "Compuestos píxel a píxel por periodo (media o mediana) y reducción zonal a series ordenadas.";
    }

    @Override
    public <K extends Comparable<? super K>> List<Composite<K>> aggregateByPeriod(RasterCollection collection,
                                                                                  List<K> periods,
                                                                                  Function<Instant, K> periodFn,
                                                                                  PixelReducer reducer) {
        Objects.requireNonNull(collection, "La colección no puede ser nula.");
        Objects.requireNonNull(periods, "La lista de periodos no puede ser nula.");
        Objects.requireNonNull(periodFn, "La función de periodo no puede ser nula.");
        long startTime = System.currentTimeMillis();

        // Agrupar las imágenes por clave, conservando únicamente los periodos solicitados
        Map<K, List<RasterImage>> members = new LinkedHashMap<>();
        for (K period : new LinkedHashSet<>(periods)) {
            members.put(period, new ArrayList<>());
        }
        int ignored = 0;
        for (RasterImage image : collection) {
            K key = periodFn.apply(image.timestamp());
            List<RasterImage> bucket = (key == null) ? null : members.get(key);
            if (bucket == null) {
                ignored++;
                continue;
            }
            bucket.add(image);
        }
        if (ignored > 0) {
            log.debug("{} imágenes fuera de los periodos solicitados fueron ignoradas.", ignored);
        }

        List<Callable<Composite<K>>> tasks = new ArrayList<>(members.size());
        for (Map.Entry<K, List<RasterImage>> entry : members.entrySet()) {
            K period = entry.getKey();
            List<RasterImage> images = entry.getValue();
            tasks.add(() -> buildComposite(period, collection.getGrid(), collection.getBandSchema(), images, reducer));
        }

        List<Composite<K>> composites = new ArrayList<>(tileProcessor.invokeAll(tasks));
        composites.sort(Comparator.comparing(Composite::periodKey));

        long emptyCount = composites.stream().filter(Composite::isEmpty).count();
        if (emptyCount > 0) {
            log.warn("{} de {} periodos no tienen imágenes; se representan como compuestos sin datos.",
                    emptyCount, composites.size());
        }
        log.info("Agregación {} completada: {} periodos a partir de {} imágenes en {} ms.",
                reducer, composites.size(), collection.size(), System.currentTimeMillis() - startTime);
        return composites;
    }

    /**
     * Compuesto de toda la colección tras aplicar el filtro de calidad (ej: mediana de escenas
     * con nubosidad inferior al 5 %). La clave de periodo queda a {@code null}.
     */
    public <K extends Comparable<? super K>> Composite<K> composite(RasterCollection collection,
                                                                    QualityFilter qualityFilter,
                                                                    PixelReducer reducer) {
        RasterCollection filtered = collection.filterQuality(qualityFilter);
        log.info("Compuesto {}: {} de {} imágenes superan el filtro de calidad.",
                reducer, filtered.size(), collection.size());
        return buildComposite(null, collection.getGrid(), collection.getBandSchema(), filtered.getImages(), reducer);
    }

    /**
     * Reduce píxel a píxel una lista de compuestos (ej: media anual de los compuestos mensuales).
     * Los compuestos vacíos no aportan valores.
     */
    public <K extends Comparable<? super K>> Composite<K> reduceComposites(List<Composite<K>> composites,
                                                                           K key,
                                                                           PixelReducer reducer) {
        if (composites.isEmpty()) {
            throw new IllegalArgumentException("Se necesita al menos un compuesto para reducir.");
        }
        Raster first = composites.get(0).raster();
        List<RasterImage> images = new ArrayList<>();
        List<Instant> sources = new ArrayList<>();
        for (Composite<K> composite : composites) {
            if (composite.isEmpty()) {
                continue;
            }
            images.add(new RasterImage(composite.raster(), composite.sourceTimestamps().get(0), null));
            sources.addAll(composite.sourceTimestamps());
        }
        Composite<K> reduced = buildComposite(key, first.getGrid(), first.getBandNames(), images, reducer);
        return new Composite<>(key, reduced.raster(), sources.stream().sorted().toList(), reducer);
    }

    /**
     * Media píxel a píxel de los compuestos de un periodo superior (ej: precipitación anual a
     * partir de los doce compuestos mensuales).
     */
    public <K extends Comparable<? super K>> Raster annualMean(List<Composite<K>> composites) {
        return reduceComposites(composites, null, PixelReducer.MEAN).raster();
    }

    /**
     * Media píxel a píxel de todas las imágenes de una colección.
     */
    public Raster collectionMean(RasterCollection collection) {
        return this.<Integer>buildComposite(null, collection.getGrid(), collection.getBandSchema(),
                collection.getImages(), PixelReducer.MEAN).raster();
    }

    @Override
    public <K extends Comparable<? super K>> TimeSeries<K> buildTimeSeries(List<Composite<K>> composites,
                                                                           String band,
                                                                           Geometry geometry,
                                                                           PixelReducer reducer,
                                                                           double scale,
                                                                           String name,
                                                                           String unit) {
        List<Composite<K>> ordered = new ArrayList<>(composites);
        ordered.sort(Comparator.comparing(Composite::periodKey));

        List<TimeSeriesEntry<K>> entries = new ArrayList<>(ordered.size());
        for (Composite<K> composite : ordered) {
            double value = composite.isEmpty()
                    ? TimeSeriesEntry.UNMEASURED
                    : regionReducer.reduceRegion(composite.raster(), band, geometry, reducer, scale);
            if (Double.isNaN(value)) {
                log.debug("Periodo {} sin medida válida en la región.", composite.periodKey());
            }
            entries.add(new TimeSeriesEntry<>(composite.periodKey(), value));
        }
        TimeSeries<K> series = new TimeSeries<>(name, unit, entries);
        log.info("Serie '{}' construida: {} periodos, {} medidos.", name, series.size(), series.countMeasured());
        return series;
    }

    /**
     * Construye el compuesto de un periodo. Un píxel sin ningún valor válido queda como no-data.
     */
    private <K extends Comparable<? super K>> Composite<K> buildComposite(K period,
                                                                          RasterGrid grid,
                                                                          List<String> bandNames,
                                                                          List<RasterImage> images,
                                                                          PixelReducer reducer) {
        if (images.isEmpty()) {
            return new Composite<>(period, Raster.filled(grid, bandNames, Raster.NO_DATA), List.of(), reducer);
        }

        int pixelCount = grid.getPixelCount();
        int memberCount = images.size();
        List<float[]> bands = new ArrayList<>(bandNames.size());
        double[] buffer = new double[memberCount];

        for (int b = 0; b < bandNames.size(); b++) {
            float[][] memberBands = new float[memberCount][];
            for (int m = 0; m < memberCount; m++) {
                memberBands[m] = images.get(m).raster().cloneBand(b);
            }
            float[] out = new float[pixelCount];
            for (int p = 0; p < pixelCount; p++) {
                for (int m = 0; m < memberCount; m++) {
                    buffer[m] = memberBands[m][p];
                }
                out[p] = (float) reducer.reduce(buffer, memberCount);
            }
            bands.add(out);
        }

        List<Instant> sources = images.stream().map(RasterImage::timestamp).sorted().toList();
        log.debug("Compuesto del periodo {} construido con {} imágenes.", period, memberCount);
        return new Composite<>(period, new Raster(grid, bandNames, bands), sources, reducer);
    }
}
