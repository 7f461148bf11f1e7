package projectkoshi.analysis.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import projectkoshi.analysis.i.ITerrainAnalyzer;
import projectkoshi.analysis.tiling.TileProcessor;
import projectkoshi.domain.raster.Raster;
import projectkoshi.domain.raster.RasterGrid;
import projectkoshi.domain.terrain.GlacierProxies;
import projectkoshi.domain.terrain.SlopeAspect;

/**
 * Derivadas del terreno a partir de un Modelo Digital de Elevaciones (MDE).
 * <p>
 * El gradiente se estima con el kernel 3x3 de Horn sobre la vecindad
 * <pre>
 *   a b c
 *   d e f
 *   g h i
 * </pre>
 * dz/dx = ((c + 2f + i) - (a + 2d + g)) / (8 * dx), dz/dy(norte) = ((a + 2b + c) - (g + 2h + i)) / (8 * dy),
 * con dx y dy el ancho y el alto del píxel en metros.
 * <p>
 * Contorno: los vecinos fuera de la malla o no-data se sustituyen por el valor central.
 * Terreno llano: pendiente 0 y orientación {@link #FLAT_ASPECT}, distinto del no-data.
 * <p>
 * La elevación se expresa en metros. En mallas geográficas el tamaño de píxel en grados se convierte
 * a metros con {@link RasterGrid#pixelWidthMeters()} y {@link RasterGrid#pixelHeightMeters()}.
 */
@Slf4j
@RequiredArgsConstructor
public class TerrainAnalyzer implements ITerrainAnalyzer {

    public static final String SLOPE_BAND = "slope";
    public static final String ASPECT_BAND = "aspect";
    public static final String THICKNESS_BAND = "thickness";
    public static final String VELOCITY_BAND = "velocity";
    public static final String SNOWLINE_BAND = "snowline";

    /**
     * Orientación centinela de los píxeles llanos.
     */
    public static final float FLAT_ASPECT = -1f;

    private static final double FLAT_GRADIENT = 1e-12;

    private final TileProcessor tileProcessor;

    @Override
    public String getName() {
        return "Horn3x3";
    }

    @Override
    public String getDescription() {
        return "Pendiente y orientación por diferencias finitas de Horn; proxies glaciares por fórmula fija.";
    }

    @Override
    public SlopeAspect deriveSlopeAspect(Raster dem) {
        if (dem.getBandCount() != 1) {
            throw new IllegalArgumentException("El MDE debe tener una sola banda de elevación: " + dem.getBandNames());
        }
        long startTime = System.currentTimeMillis();
        final RasterGrid grid = dem.getGrid();
        final float[] z = dem.cloneBand(0);
        final int width = grid.width();
        final int height = grid.height();
        final double pixelWidth = grid.pixelWidthMeters();
        final double pixelHeight = grid.pixelHeightMeters();

        float[][] bands = tileProcessor.computeBands(grid, 2, (rowStart, rowEnd, block) -> {
            float[] neighbourhood = new float[9];
            for (int row = rowStart; row < rowEnd; row++) {
                for (int col = 0; col < width; col++) {
                    int local = (row - rowStart) * width + col;
                    float centre = z[row * width + col];
                    if (Float.isNaN(centre)) {
                        block[0][local] = Raster.NO_DATA;
                        block[1][local] = Raster.NO_DATA;
                        continue;
                    }
                    fillNeighbourhood(z, width, height, col, row, centre, neighbourhood);
                    float[] slopeAspect = computeSlopeAspect(neighbourhood, pixelWidth, pixelHeight);
                    block[0][local] = slopeAspect[0];
                    block[1][local] = slopeAspect[1];
                }
            }
        });

        log.info("Pendiente y orientación calculadas sobre {} (píxel {} x {} m) en {} ms.",
                dem, pixelWidth, pixelHeight, System.currentTimeMillis() - startTime);
        return new SlopeAspect(
                Raster.singleBand(grid, SLOPE_BAND, bands[0]),
                Raster.singleBand(grid, ASPECT_BAND, bands[1]));
    }

    /**
     * Aproximación empírica: espesor = pendiente * lineaNieve / 100 donde el MDE alcanza la
     * línea de nieve (no-data debajo); velocidad = espesor * factor.
     */
    @Override
    public GlacierProxies estimateThickness(Raster dem, Raster slope, float snowlineElevation, float velocityFactor) {
        dem.getGrid().requireAlignedWith(slope.getGrid(), "estimateThickness");
        final float[] z = dem.cloneBand(0);
        final float[] s = slope.cloneBand(0);
        final int width = dem.getGrid().width();

        float[][] bands = tileProcessor.computeBands(dem.getGrid(), 3, (rowStart, rowEnd, block) -> {
            int offset = rowStart * width;
            for (int i = 0; i < block[0].length; i++) {
                float elevation = z[offset + i];
                if (Float.isNaN(elevation)) {
                    block[0][i] = Raster.NO_DATA;
                    block[1][i] = Raster.NO_DATA;
                    block[2][i] = Raster.NO_DATA;
                    continue;
                }
                boolean aboveSnowline = elevation >= snowlineElevation;
                float thickness = aboveSnowline ? s[offset + i] * snowlineElevation / 100f : Raster.NO_DATA;
                block[0][i] = thickness;
                block[1][i] = thickness * velocityFactor;
                block[2][i] = aboveSnowline ? 1f : 0f;
            }
        });

        log.debug("Proxies glaciares calculados (línea de nieve: {} m, factor de velocidad: {}).",
                snowlineElevation, velocityFactor);
        return new GlacierProxies(
                Raster.singleBand(dem.getGrid(), THICKNESS_BAND, bands[0]),
                Raster.singleBand(dem.getGrid(), VELOCITY_BAND, bands[1]),
                Raster.singleBand(dem.getGrid(), SNOWLINE_BAND, bands[2]));
    }

    private static void fillNeighbourhood(float[] z, int width, int height, int col, int row,
                                          float centre, float[] neighbourhood) {
        int k = 0;
        for (int dRow = -1; dRow <= 1; dRow++) {
            for (int dCol = -1; dCol <= 1; dCol++) {
                int nCol = col + dCol;
                int nRow = row + dRow;
                float value = centre;
                if (nCol >= 0 && nCol < width && nRow >= 0 && nRow < height) {
                    float candidate = z[nRow * width + nCol];
                    if (!Float.isNaN(candidate)) {
                        value = candidate;
                    }
                }
                neighbourhood[k++] = value;
            }
        }
    }

    /**
     * Pendiente (grados, [0, 90]) y orientación (grados, [0, 360) o {@link #FLAT_ASPECT})
     * de una vecindad 3x3 ordenada por filas de norte a sur.
     */
    static float[] computeSlopeAspect(float[] elev, double pixelSize) {
        return computeSlopeAspect(elev, pixelSize, pixelSize);
    }

    static float[] computeSlopeAspect(float[] elev, double pixelWidth, double pixelHeight) {
        double dzdx = ((elev[2] + 2.0 * elev[5] + elev[8]) - (elev[0] + 2.0 * elev[3] + elev[6])) / (8.0 * pixelWidth);
        double dzdn = ((elev[0] + 2.0 * elev[1] + elev[2]) - (elev[6] + 2.0 * elev[7] + elev[8])) / (8.0 * pixelHeight);
        double gradient = Math.sqrt(dzdx * dzdx + dzdn * dzdn);

        if (gradient < FLAT_GRADIENT) {
            return new float[]{0f, FLAT_ASPECT};
        }

        double slope = Math.toDegrees(Math.atan(gradient));
        slope = Math.max(0.0, Math.min(90.0, slope));

        // Rumbo (horario desde el norte) del vector descendente (-dz/dx, -dz/dy)
        double aspect = Math.toDegrees(Math.atan2(-dzdx, -dzdn));
        if (aspect < 0.0) {
            aspect += 360.0;
        }
        float bearing = (float) aspect;
        if (bearing >= 360f) {
            bearing = 0f;
        }
        return new float[]{(float) slope, bearing};
    }
}
