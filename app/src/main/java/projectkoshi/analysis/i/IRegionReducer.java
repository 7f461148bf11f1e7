package projectkoshi.analysis.i;

import org.locationtech.jts.geom.Geometry;
import projectkoshi.domain.raster.PixelReducer;
import projectkoshi.domain.raster.Raster;

public interface IRegionReducer extends IAnalysisComponent {
    /**
     * Reduce a un escalar los píxeles válidos de una banda dentro de la geometría,
     * muestreando a la escala indicada en metros. NaN si no hay ningún píxel válido.
     */
    double reduceRegion(Raster raster, String band, Geometry geometry, PixelReducer reducer, double scale);
}
