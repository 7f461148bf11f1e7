package projectkoshi.analysis.impl;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import projectkoshi.domain.raster.Raster;
import projectkoshi.domain.raster.RasterGrid;

import java.util.ArrayList;
import java.util.List;

/**
 * Operaciones de álgebra de bandas sencillas usadas por la cadena de análisis:
 * reescalado lineal, recorte al área de estudio, comparación con un valor y enmascarado.
 * Todas devuelven un ráster nuevo y conservan el no-data.
 */
public final class BandMath {

    private BandMath() {
    }

    /**
     * {@code valor * multiply + add} en todas las bandas (ej: LST digital a °C, precipitación a mm).
     */
    public static Raster linear(Raster raster, float multiply, float add) {
        List<float[]> bands = new ArrayList<>(raster.getBandCount());
        for (int b = 0; b < raster.getBandCount(); b++) {
            float[] data = raster.cloneBand(b);
            for (int i = 0; i < data.length; i++) {
                data[i] = data[i] * multiply + add; // NaN se propaga
            }
            bands.add(data);
        }
        return new Raster(raster.getGrid(), raster.getBandNames(), bands);
    }

    /**
     * Recorta el ráster a la geometría: los píxeles cuyo centro queda fuera pasan a no-data.
     */
    public static Raster clip(Raster raster, Geometry geometry) {
        RasterGrid grid = raster.getGrid();
        boolean[] inside = centersInside(grid, geometry);
        List<float[]> bands = new ArrayList<>(raster.getBandCount());
        for (int b = 0; b < raster.getBandCount(); b++) {
            float[] data = raster.cloneBand(b);
            for (int i = 0; i < data.length; i++) {
                if (!inside[i]) {
                    data[i] = Raster.NO_DATA;
                }
            }
            bands.add(data);
        }
        return new Raster(grid, raster.getBandNames(), bands);
    }

    /**
     * Máscara 1/0 de {@code banda >= value}; no-data donde la banda es no-data.
     */
    public static Raster greaterOrEqual(Raster raster, String band, float value, String outputBand) {
        float[] data = raster.cloneBand(band);
        for (int i = 0; i < data.length; i++) {
            if (!Float.isNaN(data[i])) {
                data[i] = data[i] >= value ? 1f : 0f;
            }
        }
        return Raster.singleBand(raster.getGrid(), outputBand, data);
    }

    /**
     * Pone a no-data los píxeles donde la máscara no vale 1.
     */
    public static Raster updateMask(Raster raster, Raster mask) {
        raster.getGrid().requireAlignedWith(mask.getGrid(), "updateMask");
        float[] maskData = mask.cloneBand(0);
        List<float[]> bands = new ArrayList<>(raster.getBandCount());
        for (int b = 0; b < raster.getBandCount(); b++) {
            float[] data = raster.cloneBand(b);
            for (int i = 0; i < data.length; i++) {
                if (maskData[i] != 1f) {
                    data[i] = Raster.NO_DATA;
                }
            }
            bands.add(data);
        }
        return new Raster(raster.getGrid(), raster.getBandNames(), bands);
    }

    /**
     * Indica, para cada píxel, si su centro queda dentro (o en el borde) de la geometría.
     */
    static boolean[] centersInside(RasterGrid grid, Geometry geometry) {
        PreparedGeometry prepared = PreparedGeometryFactory.prepare(geometry);
        GeometryFactory factory = geometry.getFactory();
        boolean[] inside = new boolean[grid.getPixelCount()];
        for (int row = 0; row < grid.height(); row++) {
            double y = grid.pixelCenterY(row);
            for (int col = 0; col < grid.width(); col++) {
                double x = grid.pixelCenterX(col);
                inside[row * grid.width() + col] = prepared.covers(factory.createPoint(new Coordinate(x, y)));
            }
        }
        return inside;
    }
}
