package projectkoshi.domain.raster;

import lombok.Builder;
import lombok.With;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;

/**
 * Malla regular de píxeles cuadrados sobre la que se definen todos los rásters.
 * <p>
 * El origen es la esquina noroeste: la columna crece hacia el este y la fila hacia el sur.
 * El píxel (col, row) cubre el rectángulo
 * {@code [originX + col*ps, originX + (col+1)*ps] x [originY - (row+1)*ps, originY - row*ps]}.
 * <p>
 * No hay reproyección: el sistema de referencia es una etiqueta y dos mallas sólo son
 * compatibles si coinciden exactamente (ver {@link #isAlignedWith(RasterGrid)}). La etiqueta
 * sólo se interpreta para pasar distancias en metros a unidades de la malla: las mallas
 * geográficas (grados, ver {@link #isGeographic()}) usan una esfera con
 * {@link #METERS_PER_DEGREE} metros por grado de latitud; el resto se suponen proyectadas en metros.
 *
 * @param width     Número de columnas (> 0).
 * @param height    Número de filas (> 0).
 * @param originX   Coordenada X del borde oeste.
 * @param originY   Coordenada Y del borde norte.
 * @param pixelSize Tamaño del píxel en unidades del sistema de referencia (> 0).
 * @param crs       Etiqueta del sistema de referencia (ej: "EPSG:4326").
 */
@Builder
@With
public record RasterGrid(
        int width,
        int height,
        double originX,
        double originY,
        double pixelSize,
        String crs
) {
    /**
     * Longitud de un grado de latitud (y de longitud en el ecuador), en metros.
     */
    public static final double METERS_PER_DEGREE = 111_320.0;

    private static final double ALIGNMENT_TOLERANCE = 1e-9;
    private static final double MIN_LATITUDE_COSINE = 1e-3;
    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    public RasterGrid {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Las dimensiones de la malla deben ser positivas: " + width + "x" + height);
        }
        if (!(pixelSize > 0) || Double.isInfinite(pixelSize)) {
            throw new IllegalArgumentException("El tamaño de píxel debe ser positivo y finito: " + pixelSize);
        }
        if (Double.isNaN(originX) || Double.isNaN(originY)) {
            throw new IllegalArgumentException("El origen de la malla no puede ser NaN.");
        }
        crs = (crs == null) ? "UNDEFINED" : crs;
    }

    public int getPixelCount() {
        return width * height;
    }

    public int indexOf(int col, int row) {
        validatePixel(col, row);
        return row * width + col;
    }

    public boolean containsPixel(int col, int row) {
        return col >= 0 && col < width && row >= 0 && row < height;
    }

    public double pixelCenterX(int col) {
        return originX + (col + 0.5) * pixelSize;
    }

    public double pixelCenterY(int row) {
        return originY - (row + 0.5) * pixelSize;
    }

    /**
     * Columna del píxel que contiene la coordenada X (vecino más próximo, sin interpolación).
     * Puede quedar fuera de [0, width).
     */
    public int columnOf(double x) {
        return (int) Math.floor((x - originX) / pixelSize);
    }

    /**
     * Fila del píxel que contiene la coordenada Y. Puede quedar fuera de [0, height).
     */
    public int rowOf(double y) {
        return (int) Math.floor((originY - y) / pixelSize);
    }

    /**
     * Indica si la malla está en coordenadas geográficas lon/lat (EPSG:4326, CRS:84, WGS84).
     */
    public boolean isGeographic() {
        return "EPSG:4326".equalsIgnoreCase(crs)
                || "CRS:84".equalsIgnoreCase(crs)
                || "OGC:CRS84".equalsIgnoreCase(crs)
                || "WGS84".equalsIgnoreCase(crs);
    }

    /**
     * Metros por unidad de malla en el eje X. En mallas geográficas se evalúa en la latitud
     * central de la malla.
     */
    public double metersPerUnitX() {
        if (!isGeographic()) {
            return 1.0;
        }
        double centreLatitude = originY - height * pixelSize / 2.0;
        double cosine = Math.cos(Math.toRadians(centreLatitude));
        return METERS_PER_DEGREE * Math.max(cosine, MIN_LATITUDE_COSINE);
    }

    /**
     * Metros por unidad de malla en el eje Y.
     */
    public double metersPerUnitY() {
        return isGeographic() ? METERS_PER_DEGREE : 1.0;
    }

    public double pixelWidthMeters() {
        return pixelSize * metersPerUnitX();
    }

    public double pixelHeightMeters() {
        return pixelSize * metersPerUnitY();
    }

    public boolean containsCoordinate(double x, double y) {
        return containsPixel(columnOf(x), rowOf(y));
    }

    public double getMaxX() {
        return originX + width * pixelSize;
    }

    public double getMinY() {
        return originY - height * pixelSize;
    }

    public Envelope toEnvelope() {
        return new Envelope(originX, getMaxX(), getMinY(), originY);
    }

    public Polygon toPolygon() {
        return (Polygon) GEOMETRY_FACTORY.toGeometry(toEnvelope());
    }

    /**
     * Rectángulo de un bloque de píxeles [col0, col1) x [row0, row1) en coordenadas de mapa.
     */
    public Polygon pixelBlockToPolygon(int col0, int row0, int col1, int row1) {
        double x0 = originX + col0 * pixelSize;
        double x1 = originX + col1 * pixelSize;
        double yTop = originY - row0 * pixelSize;
        double yBottom = originY - row1 * pixelSize;
        Coordinate[] ring = {
                new Coordinate(x0, yTop),
                new Coordinate(x1, yTop),
                new Coordinate(x1, yBottom),
                new Coordinate(x0, yBottom),
                new Coordinate(x0, yTop)
        };
        return GEOMETRY_FACTORY.createPolygon(ring);
    }

    /**
     * Dos mallas están alineadas si comparten dimensiones, origen, resolución y sistema de referencia.
     * Es precondición de cualquier aritmética píxel a píxel entre rásters.
     */
    public boolean isAlignedWith(RasterGrid other) {
        if (other == null) {
            return false;
        }
        return width == other.width
                && height == other.height
                && closeEnough(originX, other.originX)
                && closeEnough(originY, other.originY)
                && closeEnough(pixelSize, other.pixelSize)
                && crs.equals(other.crs);
    }

    public void requireAlignedWith(RasterGrid other, String context) {
        if (!isAlignedWith(other)) {
            throw new IllegalArgumentException(String.format(
                    "Mallas no alineadas en %s: %s vs %s", context, this, other));
        }
    }

    private boolean closeEnough(double a, double b) {
        double scale = Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
        return Math.abs(a - b) <= ALIGNMENT_TOLERANCE * scale;
    }

    private void validatePixel(int col, int row) {
        if (!containsPixel(col, row)) {
            throw new IndexOutOfBoundsException("El píxel (" + col + ", " + row + ") está fuera de la malla "
                    + width + "x" + height + ".");
        }
    }
}
