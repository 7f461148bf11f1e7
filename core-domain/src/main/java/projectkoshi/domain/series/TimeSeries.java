package projectkoshi.domain.series;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Serie temporal inmutable con claves de periodo únicas y estrictamente crecientes.
 *
 * @param name    Nombre de la variable (ej: "mean_precipitation").
 * @param unit    Unidad de los valores (ej: "mm").
 * @param entries Entradas en orden de periodo.
 */
public record TimeSeries<K extends Comparable<? super K>>(
        String name,
        String unit,
        List<TimeSeriesEntry<K>> entries
) {
    public TimeSeries {
        Objects.requireNonNull(name, "El nombre de la serie no puede ser nulo.");
        Objects.requireNonNull(entries, "Las entradas de la serie no pueden ser nulas.");
        for (int i = 1; i < entries.size(); i++) {
            K previous = entries.get(i - 1).period();
            K current = entries.get(i).period();
            if (previous.compareTo(current) >= 0) {
                throw new IllegalArgumentException("Las claves de periodo deben ser únicas y crecientes: "
                        + previous + " seguido de " + current);
            }
        }
        entries = List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public List<K> getPeriods() {
        List<K> periods = new ArrayList<>(entries.size());
        entries.forEach(e -> periods.add(e.period()));
        return periods;
    }

    public Optional<TimeSeriesEntry<K>> find(K period) {
        return entries.stream().filter(e -> e.period().equals(period)).findFirst();
    }

    public long countMeasured() {
        return entries.stream().filter(TimeSeriesEntry::isMeasured).count();
    }
}
