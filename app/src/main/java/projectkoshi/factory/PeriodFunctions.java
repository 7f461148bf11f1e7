package projectkoshi.factory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Funciones de asignación de periodo para {@code aggregateByPeriod}.
 * <p>
 * Todas interpretan la fecha de adquisición en la zona horaria indicada y devuelven
 * {@code null} cuando la imagen no pertenece a ningún periodo válido.
 */
public final class PeriodFunctions {

    private PeriodFunctions() {
    }

    /**
     * Mes del año (1..12) de las imágenes del año dado; {@code null} para cualquier otro año.
     */
    public static Function<Instant, Integer> monthOfYear(int year, ZoneId zone) {
        return instant -> {
            ZonedDateTime local = instant.atZone(zone);
            return local.getYear() == year ? local.getMonthValue() : null;
        };
    }

    /**
     * Día de calendario de la adquisición (una entrada por fecha en la serie de LST).
     */
    public static Function<Instant, LocalDate> dayOf(ZoneId zone) {
        return instant -> instant.atZone(zone).toLocalDate();
    }

    public static List<Integer> allMonths() {
        return IntStream.rangeClosed(1, 12).boxed().collect(Collectors.toList());
    }

    /**
     * Días distintos de las fechas dadas, en orden cronológico.
     */
    public static List<LocalDate> distinctDays(List<Instant> timestamps, ZoneId zone) {
        Function<Instant, LocalDate> day = dayOf(zone);
        return timestamps.stream().map(day).distinct().sorted().collect(Collectors.toList());
    }
}
