package projectkoshi.analysis.i;

import org.locationtech.jts.geom.Geometry;
import projectkoshi.domain.raster.Composite;
import projectkoshi.domain.raster.PixelReducer;
import projectkoshi.domain.raster.RasterCollection;
import projectkoshi.domain.series.TimeSeries;

import java.time.Instant;
import java.util.List;
import java.util.function.Function;

public interface ITemporalAggregator extends IAnalysisComponent {

    /**
     * Un compuesto por periodo solicitado, en orden de clave. Los periodos sin imágenes
     * producen un compuesto vacío (no-data).
     */
    <K extends Comparable<? super K>> List<Composite<K>> aggregateByPeriod(RasterCollection collection,
                                                                           List<K> periods,
                                                                           Function<Instant, K> periodFn,
                                                                           PixelReducer reducer);

    /**
     * Serie temporal de la reducción zonal de cada compuesto. Los compuestos vacíos
     * producen la entrada centinela NaN.
     */
    <K extends Comparable<? super K>> TimeSeries<K> buildTimeSeries(List<Composite<K>> composites,
                                                                    String band,
                                                                    Geometry geometry,
                                                                    PixelReducer reducer,
                                                                    double scale,
                                                                    String name,
                                                                    String unit);
}
