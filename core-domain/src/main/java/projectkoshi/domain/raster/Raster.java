package projectkoshi.domain.raster;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ráster multibanda inmutable sobre una {@link RasterGrid}.
 * <p>
 * Cada banda se almacena como un array {@code float[]} en orden de fila (row-major)
 * de longitud {@code width * height}. El valor {@link #NO_DATA} ({@code Float.NaN}) marca
 * un píxel indefinido o no medido, distinto de un cero válido.
 * <p>
 * Una vez creado no puede modificarse: los arrays se copian al construir y al exportar,
 * por lo que una instancia puede compartirse entre hilos sin sincronización.
 */
public final class Raster {

    public static final float NO_DATA = Float.NaN;

    @Getter
    private final RasterGrid grid;
    private final List<String> bandNames;
    private final float[][] bands;

    /**
     * @param grid      Malla de referencia.
     * @param bandNames Nombres de banda, únicos y en el mismo orden que {@code bands}.
     * @param bands     Un array por banda de longitud {@code grid.getPixelCount()}.
     */
    public Raster(RasterGrid grid, List<String> bandNames, List<float[]> bands) {
        Objects.requireNonNull(grid, "La malla no puede ser nula.");
        Objects.requireNonNull(bandNames, "La lista de nombres de banda no puede ser nula.");
        Objects.requireNonNull(bands, "La lista de bandas no puede ser nula.");

        if (bandNames.isEmpty()) {
            throw new IllegalArgumentException("Un ráster debe tener al menos una banda.");
        }
        if (bandNames.size() != bands.size()) {
            throw new IllegalArgumentException("El número de nombres de banda (" + bandNames.size()
                    + ") no coincide con el número de bandas (" + bands.size() + ").");
        }
        if (bandNames.stream().distinct().count() != bandNames.size()) {
            throw new IllegalArgumentException("Los nombres de banda deben ser únicos: " + bandNames);
        }

        int pixelCount = grid.getPixelCount();
        float[][] copies = new float[bands.size()][];
        for (int b = 0; b < bands.size(); b++) {
            float[] data = Objects.requireNonNull(bands.get(b), "La banda " + bandNames.get(b) + " no puede ser nula.");
            if (data.length != pixelCount) {
                throw new IllegalArgumentException(String.format(
                        "La banda %s tiene %d valores, se esperaban %d (%dx%d).",
                        bandNames.get(b), data.length, pixelCount, grid.width(), grid.height()));
            }
            copies[b] = data.clone();
        }

        this.grid = grid;
        this.bandNames = List.copyOf(bandNames);
        this.bands = copies;
    }

    public static Raster singleBand(RasterGrid grid, String bandName, float[] values) {
        return new Raster(grid, List.of(bandName), List.of(values));
    }

    /**
     * Ráster constante, útil como máscara trivial o como compuesto vacío (con {@link #NO_DATA}).
     */
    public static Raster filled(RasterGrid grid, List<String> bandNames, float value) {
        List<float[]> data = new ArrayList<>(bandNames.size());
        for (int b = 0; b < bandNames.size(); b++) {
            float[] band = new float[grid.getPixelCount()];
            Arrays.fill(band, value);
            data.add(band);
        }
        return new Raster(grid, bandNames, data);
    }

    public List<String> getBandNames() {
        return bandNames;
    }

    public int getBandCount() {
        return bandNames.size();
    }

    public boolean hasBand(String bandName) {
        return bandNames.contains(bandName);
    }

    /**
     * Índice de una banda por nombre.
     *
     * @throws IllegalArgumentException si la banda no existe.
     */
    public int bandIndex(String bandName) {
        int index = bandNames.indexOf(bandName);
        if (index < 0) {
            throw new IllegalArgumentException("La banda '" + bandName + "' no existe. Bandas disponibles: " + bandNames);
        }
        return index;
    }

    public float getValue(int bandIndex, int col, int row) {
        return bands[bandIndex][grid.indexOf(col, row)];
    }

    public float getValue(String bandName, int col, int row) {
        return getValue(bandIndex(bandName), col, row);
    }

    /**
     * Acceso directo por índice lineal (row * width + col), sin comprobación de banda.
     */
    public float getValueAt(int bandIndex, int pixelIndex) {
        return bands[bandIndex][pixelIndex];
    }

    public boolean isNoData(int bandIndex, int pixelIndex) {
        return Float.isNaN(bands[bandIndex][pixelIndex]);
    }

    /**
     * Vector de valores de las bandas indicadas en un píxel.
     * Devuelve {@code null} si alguna de ellas es no-data.
     */
    public double[] pixelVector(int[] bandIndices, int pixelIndex) {
        double[] vector = new double[bandIndices.length];
        for (int i = 0; i < bandIndices.length; i++) {
            float value = bands[bandIndices[i]][pixelIndex];
            if (Float.isNaN(value)) {
                return null;
            }
            vector[i] = value;
        }
        return vector;
    }

    public int[] bandIndices(List<String> names) {
        int[] indices = new int[names.size()];
        for (int i = 0; i < names.size(); i++) {
            indices[i] = bandIndex(names.get(i));
        }
        return indices;
    }

    /**
     * Devuelve una copia de la banda. Las modificaciones no afectan al ráster.
     */
    public float[] cloneBand(String bandName) {
        return bands[bandIndex(bandName)].clone();
    }

    public float[] cloneBand(int bandIndex) {
        return bands[bandIndex].clone();
    }

    /**
     * Nuevo ráster con las bandas indicadas, en ese orden.
     */
    public Raster select(List<String> names) {
        List<float[]> selected = new ArrayList<>(names.size());
        for (String name : names) {
            selected.add(bands[bandIndex(name)]);
        }
        return new Raster(grid, names, selected);
    }

    public Raster rename(List<String> newNames) {
        return new Raster(grid, newNames, Arrays.asList(bands));
    }

    /**
     * Une las bandas de otro ráster alineado a las de éste.
     */
    public Raster addBands(Raster other) {
        grid.requireAlignedWith(other.grid, "addBands");
        List<String> names = new ArrayList<>(bandNames);
        names.addAll(other.bandNames);
        List<float[]> data = new ArrayList<>(Arrays.asList(bands));
        data.addAll(Arrays.asList(other.bands));
        return new Raster(grid, names, data);
    }

    public int countValid(int bandIndex) {
        int count = 0;
        for (float v : bands[bandIndex]) {
            if (!Float.isNaN(v)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Raster that = (Raster) o;
        return grid.equals(that.grid) && bandNames.equals(that.bandNames) && Arrays.deepEquals(bands, that.bands);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(grid, bandNames);
        result = 31 * result + Arrays.deepHashCode(bands);
        return result;
    }

    @Override
    public String toString() {
        return "Raster{" + grid.width() + "x" + grid.height()
                + ", pixelSize=" + grid.pixelSize()
                + ", crs=" + grid.crs()
                + ", bands=" + Collections.unmodifiableList(bandNames) + "}";
    }
}
