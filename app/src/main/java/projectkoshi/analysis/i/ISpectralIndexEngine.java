package projectkoshi.analysis.i;

import projectkoshi.domain.raster.Raster;

public interface ISpectralIndexEngine extends IAnalysisComponent {
    /**
     * Índice de diferencia normalizada (a - b) / (a + b). No-data donde a + b = 0.
     */
    Raster computeIndex(Raster raster, String bandA, String bandB);

    /**
     * Máscara binaria: 1 donde el índice supera estrictamente el umbral, 0 en el resto (no-data incluido).
     */
    Raster threshold(Raster indexRaster, float threshold);
}
