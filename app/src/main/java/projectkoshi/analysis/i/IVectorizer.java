package projectkoshi.analysis.i;

import projectkoshi.domain.raster.Raster;
import projectkoshi.domain.vector.Connectivity;
import projectkoshi.domain.vector.MaskPolygon;

import java.util.List;

public interface IVectorizer extends IAnalysisComponent {
    /**
     * Un polígono por componente conexo de píxeles activos, con la conectividad por defecto.
     */
    List<MaskPolygon> vectorize(Raster mask);

    List<MaskPolygon> vectorize(Raster mask, Connectivity connectivity);
}
