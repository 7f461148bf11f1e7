package projectkoshi.io;

import lombok.extern.slf4j.Slf4j;
import projectkoshi.domain.series.TimeSeries;
import projectkoshi.domain.series.TimeSeriesEntry;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Exporta una serie temporal a CSV con cabecera {@code period,value}.
 * Los periodos sin medida se escriben con la celda de valor vacía.
 */
@Slf4j
public class TimeSeriesCsvWriter {

    public static final String HEADER = "period,value";

    public <K extends Comparable<? super K>> void write(TimeSeries<K> series, Writer writer) throws IOException {
        writer.write(HEADER);
        writer.write('\n');
        for (TimeSeriesEntry<K> entry : series.entries()) {
            writer.write(String.valueOf(entry.period()));
            writer.write(',');
            if (entry.isMeasured()) {
                writer.write(String.format(Locale.ROOT, "%.6f", entry.value()));
            }
            writer.write('\n');
        }
        writer.flush();
    }

    public <K extends Comparable<? super K>> void writeToFile(TimeSeries<K> series, Path path) throws IOException {
        log.info("Exportando serie '{}' ({} periodos) a {}", series.name(), series.size(), path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                write(series, writer);
            }
        } catch (IOException e) {
            log.error("Error al escribir la serie '{}' en {}", series.name(), path.toAbsolutePath(), e);
            throw e;
        }
    }
}
