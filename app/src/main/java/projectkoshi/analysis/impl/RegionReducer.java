package projectkoshi.analysis.impl;

import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import projectkoshi.analysis.i.IRegionReducer;
import projectkoshi.domain.raster.PixelReducer;
import projectkoshi.domain.raster.Raster;
import projectkoshi.domain.raster.RasterGrid;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Reducción zonal de un ráster dentro de una geometría.
 * <p>
 * La escala se expresa en metros y se pasa a unidades de la malla por eje
 * ({@link RasterGrid#metersPerUnitX()}, {@link RasterGrid#metersPerUnitY()}), de modo que la
 * misma configuración sirve para mallas proyectadas y geográficas.
 * <p>
 * Regla de inclusión de píxeles, por eje:
 * <ul>
 *   <li>Si la escala no supera el tamaño de píxel se muestrea cada píxel nativo cuyo centro
 *   queda dentro (o en el borde) de la geometría.</li>
 *   <li>Si lo supera se superpone una retícula de paso {@code scale} anclada en el origen de la
 *   malla; por cada celda de la retícula cuyo centro cae dentro de la geometría y de la malla se
 *   toma el píxel nativo más próximo.</li>
 * </ul>
 * Los valores no-data se ignoran. Sin muestras válidas el resultado es NaN.
 * <p>
 * Las filas de la retícula se reducen en paralelo con acumuladores parciales combinables
 * (suma, recuento), de modo que la media no depende de cómo se repartan las filas.
 */
@Slf4j
public class RegionReducer implements IRegionReducer {

    @Override
    public String getName() {
        return "ZonalReduction";
    }

    @Override
    public String getDescription() {
        return "Reducción zonal por centro de píxel, con retícula de muestreo a la escala solicitada.";
    }

    @Override
    public double reduceRegion(Raster raster, String band, Geometry geometry, PixelReducer reducer, double scale) {
        Objects.requireNonNull(geometry, "La geometría de reducción no puede ser nula.");
        Objects.requireNonNull(reducer, "El reductor no puede ser nulo.");
        if (!(scale > 0)) {
            throw new IllegalArgumentException("La escala de reducción debe ser positiva: " + scale);
        }

        final RasterGrid grid = raster.getGrid();
        final int bandIndex = raster.bandIndex(band);
        final double stepX = Math.max(scale / grid.metersPerUnitX(), grid.pixelSize());
        final double stepY = Math.max(scale / grid.metersPerUnitY(), grid.pixelSize());

        Envelope region = new Envelope(geometry.getEnvelopeInternal());
        region = region.intersection(grid.toEnvelope());
        if (region.isNull()) {
            log.debug("La geometría no intersecta la malla; reducción vacía.");
            return Double.NaN;
        }

        // Índices de la retícula que cubren la envolvente de la región
        final int colStart = Math.max(0, (int) Math.floor((region.getMinX() - grid.originX()) / stepX));
        final int colEnd = (int) Math.ceil((region.getMaxX() - grid.originX()) / stepX);
        final int rowStart = Math.max(0, (int) Math.floor((grid.originY() - region.getMaxY()) / stepY));
        final int rowEnd = (int) Math.ceil((grid.originY() - region.getMinY()) / stepY);

        final PreparedGeometry prepared = PreparedGeometryFactory.prepare(geometry);
        final GeometryFactory factory = geometry.getFactory();
        final boolean keepValues = reducer != PixelReducer.MEAN;

        RegionAccumulator total = IntStream.range(rowStart, rowEnd)
                .parallel()
                .mapToObj(latticeRow -> {
                    RegionAccumulator partial = new RegionAccumulator(keepValues);
                    double y = grid.originY() - (latticeRow + 0.5) * stepY;
                    for (int latticeCol = colStart; latticeCol < colEnd; latticeCol++) {
                        double x = grid.originX() + (latticeCol + 0.5) * stepX;
                        int col = grid.columnOf(x);
                        int row = grid.rowOf(y);
                        if (!grid.containsPixel(col, row)) {
                            continue;
                        }
                        if (!prepared.covers(factory.createPoint(new Coordinate(x, y)))) {
                            continue;
                        }
                        partial.add(raster.getValueAt(bandIndex, row * grid.width() + col));
                    }
                    return partial;
                })
                .reduce(new RegionAccumulator(keepValues), RegionAccumulator::combine);

        double result = total.result(reducer);
        log.debug("Reducción zonal {} de la banda {} a escala {} m (paso {} x {}): {} muestras válidas -> {}",
                reducer, band, scale, stepX, stepY, total.getCount(), result);
        return result;
    }

    /**
     * Acumulador asociativo y conmutativo de la reducción: suma y recuento de valores válidos,
     * más los valores en sí cuando el reductor no es la media.
     */
    static final class RegionAccumulator {
        private final boolean keepValues;
        private double sum;
        private long count;
        private double[] values;

        RegionAccumulator(boolean keepValues) {
            this.keepValues = keepValues;
            this.values = keepValues ? new double[16] : new double[0];
        }

        void add(float value) {
            if (Float.isNaN(value)) {
                return;
            }
            sum += value;
            if (keepValues) {
                if (count == values.length) {
                    values = Arrays.copyOf(values, values.length * 2);
                }
                values[(int) count] = value;
            }
            count++;
        }

        RegionAccumulator combine(RegionAccumulator other) {
            RegionAccumulator merged = new RegionAccumulator(keepValues);
            merged.sum = this.sum + other.sum;
            merged.count = this.count + other.count;
            if (keepValues) {
                merged.values = new double[(int) Math.max(merged.count, 1)];
                System.arraycopy(this.values, 0, merged.values, 0, (int) this.count);
                System.arraycopy(other.values, 0, merged.values, (int) this.count, (int) other.count);
            }
            return merged;
        }

        double result(PixelReducer reducer) {
            if (count == 0) {
                return Double.NaN;
            }
            if (reducer == PixelReducer.MEAN) {
                return sum / count;
            }
            return reducer.reduce(values, (int) count);
        }

        long getCount() {
            return count;
        }
    }
}
