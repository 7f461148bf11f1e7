package projectkoshi.domain.series;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimeSeriesTest {

    @Test
    @DisplayName("Las claves deben ser únicas y crecientes")
    void constructor_shouldRequireIncreasingKeys() {
        List<TimeSeriesEntry<Integer>> unordered = List.of(
                new TimeSeriesEntry<>(2, 1.0),
                new TimeSeriesEntry<>(1, 1.0));
        List<TimeSeriesEntry<Integer>> duplicated = List.of(
                new TimeSeriesEntry<>(1, 1.0),
                new TimeSeriesEntry<>(1, 2.0));

        assertThrows(IllegalArgumentException.class, () -> new TimeSeries<>("p", "mm", unordered));
        assertThrows(IllegalArgumentException.class, () -> new TimeSeries<>("p", "mm", duplicated));
    }

    @Test
    @DisplayName("Los periodos sin medida se conservan con el centinela NaN")
    void unmeasuredEntries_shouldBeKept() {
        TimeSeries<Integer> series = new TimeSeries<>("p", "mm", List.of(
                new TimeSeriesEntry<>(1, 10.0),
                new TimeSeriesEntry<>(2, TimeSeriesEntry.UNMEASURED),
                new TimeSeriesEntry<>(3, 30.0)));

        assertEquals(3, series.size());
        assertEquals(2, series.countMeasured());
        assertEquals(List.of(1, 2, 3), series.getPeriods());
        assertFalse(series.find(2).orElseThrow().isMeasured());
        assertTrue(series.find(4).isEmpty());
    }

    @Test
    @DisplayName("Las fechas sirven de clave aunque LocalDate sea comparable como ChronoLocalDate")
    void localDateKeys_shouldBeAccepted() {
        // ARRANGE
        LocalDate first = LocalDate.of(2024, 5, 1);
        LocalDate second = LocalDate.of(2024, 5, 2);

        // ACT
        TimeSeries<LocalDate> series = new TimeSeries<>("lst", "°C", List.of(
                new TimeSeriesEntry<>(first, 12.5),
                new TimeSeriesEntry<>(second, TimeSeriesEntry.UNMEASURED)));

        // ASSERT
        assertEquals(List.of(first, second), series.getPeriods());
        assertEquals(12.5, series.find(first).orElseThrow().value());
        assertThrows(IllegalArgumentException.class, () -> new TimeSeries<>("lst", "°C", List.of(
                new TimeSeriesEntry<>(second, 1.0),
                new TimeSeriesEntry<>(first, 2.0))));
    }
}
