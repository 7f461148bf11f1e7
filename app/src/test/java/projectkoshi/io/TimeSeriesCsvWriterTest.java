package projectkoshi.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import projectkoshi.domain.series.TimeSeries;
import projectkoshi.domain.series.TimeSeriesEntry;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimeSeriesCsvWriterTest {

    private final TimeSeriesCsvWriter writer = new TimeSeriesCsvWriter();

    @Test
    @DisplayName("Los periodos sin medida se escriben con la celda vacía, no con cero")
    void write_shouldLeaveGapsEmpty() throws IOException {
        // ARRANGE
        TimeSeries<Integer> series = new TimeSeries<>("mean_precipitation", "mm", List.of(
                new TimeSeriesEntry<>(1, 12.5),
                new TimeSeriesEntry<>(2, TimeSeriesEntry.UNMEASURED),
                new TimeSeriesEntry<>(3, 0.0)));
        StringWriter out = new StringWriter();

        // ACT
        writer.write(series, out);

        // ASSERT
        assertEquals("period,value\n1,12.500000\n2,\n3,0.000000\n", out.toString());
    }

    @Test
    @DisplayName("writeToFile crea los directorios intermedios y usa fechas ISO")
    void writeToFile_shouldCreateParents(@TempDir Path tempDir) throws IOException {
        TimeSeries<LocalDate> series = new TimeSeries<>("mean_LST_Celsius", "°C", List.of(
                new TimeSeriesEntry<>(LocalDate.of(2024, 1, 5), -3.25)));
        Path target = tempDir.resolve("out/lst.csv");

        writer.writeToFile(series, target);

        List<String> lines = Files.readAllLines(target, StandardCharsets.UTF_8);
        assertEquals(List.of(TimeSeriesCsvWriter.HEADER, "2024-01-05,-3.250000"), lines);
    }
}
