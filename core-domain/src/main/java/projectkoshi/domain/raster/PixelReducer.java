package projectkoshi.domain.raster;

import java.util.Arrays;

/**
 * Estadísticos admitidos para reducir un conjunto de valores de píxel a un escalar.
 * <p>
 * Los valores no-data (NaN) se ignoran siempre. Si no queda ningún valor válido el resultado es NaN.
 */
public enum PixelReducer {

    MEAN {
        @Override
        public double reduce(double[] values, int count) {
            double sum = 0.0;
            int valid = 0;
            for (int i = 0; i < count; i++) {
                if (!Double.isNaN(values[i])) {
                    sum += values[i];
                    valid++;
                }
            }
            return valid == 0 ? Double.NaN : sum / valid;
        }
    },

    MEDIAN {
        @Override
        public double reduce(double[] values, int count) {
            double[] valid = new double[count];
            int n = 0;
            for (int i = 0; i < count; i++) {
                if (!Double.isNaN(values[i])) {
                    valid[n++] = values[i];
                }
            }
            if (n == 0) {
                return Double.NaN;
            }
            Arrays.sort(valid, 0, n);
            int mid = n / 2;
            // Con un número par de valores se promedian los dos centrales
            return (n % 2 == 1) ? valid[mid] : (valid[mid - 1] + valid[mid]) / 2.0;
        }
    };

    /**
     * Reduce los primeros {@code count} elementos de {@code values}.
     */
    public abstract double reduce(double[] values, int count);

    public double reduce(double[] values) {
        return reduce(values, values.length);
    }
}
