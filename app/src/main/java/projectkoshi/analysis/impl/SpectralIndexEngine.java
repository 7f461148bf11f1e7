package projectkoshi.analysis.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import projectkoshi.analysis.i.ISpectralIndexEngine;
import projectkoshi.analysis.tiling.TileProcessor;
import projectkoshi.domain.raster.Raster;
import projectkoshi.domain.raster.RasterGrid;

import java.util.List;

/**
 * Índices espectrales de diferencia normalizada (tipo NDWI) y su umbralización.
 * <p>
 * Política de no-data: un píxel sin índice (denominador nulo o banda de entrada no-data)
 * nunca se considera agua, por lo que en la máscara vale 0.
 */
@Slf4j
@RequiredArgsConstructor
public class SpectralIndexEngine implements ISpectralIndexEngine {

    public static final String INDEX_BAND = "nd";
    public static final String MASK_BAND = "mask";

    private final TileProcessor tileProcessor;

    @Override
    public String getName() {
        return "NormalizedDifference";
    }

    @Override
    public String getDescription() {
        return "Índice (A - B) / (A + B) con no-data en denominador nulo; máscara por umbral estricto.";
    }

    @Override
    public Raster computeIndex(Raster raster, String bandA, String bandB) {
        final float[] a = raster.cloneBand(bandA);
        final float[] b = raster.cloneBand(bandB);
        final RasterGrid grid = raster.getGrid();
        final int width = grid.width();

        log.debug("Calculando índice normalizado ({} - {}) / ({} + {}) sobre {}", bandA, bandB, bandA, bandB, raster);
        return tileProcessor.computeRaster(grid, List.of(INDEX_BAND), (rowStart, rowEnd, block) -> {
            float[] out = block[0];
            int offset = rowStart * width;
            for (int i = 0; i < out.length; i++) {
                out[i] = normalizedDifference(a[offset + i], b[offset + i]);
            }
        });
    }

    @Override
    public Raster threshold(Raster indexRaster, float threshold) {
        if (indexRaster.getBandCount() != 1) {
            throw new IllegalArgumentException("La umbralización requiere un ráster de una sola banda, recibido: "
                    + indexRaster.getBandNames());
        }
        final float[] index = indexRaster.cloneBand(0);
        final int width = indexRaster.getGrid().width();

        Raster mask = tileProcessor.computeRaster(indexRaster.getGrid(), List.of(MASK_BAND), (rowStart, rowEnd, block) -> {
            float[] out = block[0];
            int offset = rowStart * width;
            for (int i = 0; i < out.length; i++) {
                // NaN > t es falso: el no-data queda excluido
                out[i] = index[offset + i] > threshold ? 1f : 0f;
            }
        });
        log.debug("Umbral {} aplicado: {} píxeles activos.", threshold, countSet(mask));
        return mask;
    }

    /**
     * Diferencia normalizada de dos reflectancias. Es no-data si alguna banda es no-data,
     * si el denominador crudo a + b es 0 o si alguna reflectancia es negativa (artefactos
     * de corrección atmosférica). Con ambas no negativas el resultado queda en [-1, 1].
     */
    static float normalizedDifference(float a, float b) {
        if (Float.isNaN(a) || Float.isNaN(b)) {
            return Raster.NO_DATA;
        }
        double sum = (double) a + (double) b;
        if (sum == 0.0) {
            return Raster.NO_DATA;
        }
        if (a < 0f || b < 0f) {
            return Raster.NO_DATA;
        }
        return (float) ((a - (double) b) / sum);
    }

    static int countSet(Raster mask) {
        int count = 0;
        int pixels = mask.getGrid().getPixelCount();
        for (int i = 0; i < pixels; i++) {
            if (mask.getValueAt(0, i) == 1f) {
                count++;
            }
        }
        return count;
    }
}
