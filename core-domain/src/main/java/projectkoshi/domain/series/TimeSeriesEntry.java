package projectkoshi.domain.series;

import java.util.Objects;

/**
 * Entrada de una serie temporal: clave de periodo y valor escalar.
 * <p>
 * Un valor NaN es el centinela de "periodo no medido", distinto de un cero medido.
 */
public record TimeSeriesEntry<K extends Comparable<? super K>>(K period, double value) {

    public static final double UNMEASURED = Double.NaN;

    public TimeSeriesEntry {
        Objects.requireNonNull(period, "La clave de periodo no puede ser nula.");
    }

    public boolean isMeasured() {
        return !Double.isNaN(value);
    }
}
