package projectkoshi.source;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Intervalo temporal semiabierto {@code [start, end)}.
 */
public record DateRange(Instant start, Instant end) {

    public DateRange {
        Objects.requireNonNull(start, "El inicio del intervalo no puede ser nulo.");
        Objects.requireNonNull(end, "El fin del intervalo no puede ser nulo.");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("El fin del intervalo (" + end + ") es anterior al inicio (" + start + ").");
        }
    }

    public static DateRange of(LocalDate startInclusive, LocalDate endExclusive) {
        return new DateRange(startInclusive.atStartOfDay(ZoneOffset.UTC).toInstant(),
                endExclusive.atStartOfDay(ZoneOffset.UTC).toInstant());
    }

    public static DateRange ofYear(int year) {
        return of(LocalDate.of(year, 1, 1), LocalDate.of(year + 1, 1, 1));
    }

    public static DateRange ofMonth(int year, int month) {
        LocalDate first = LocalDate.of(year, month, 1);
        return of(first, first.plusMonths(1));
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
