package projectkoshi.pipeline;

import projectkoshi.source.RasterSource;

import java.util.Objects;

/**
 * Proveedores de datos de cada producto del análisis.
 *
 * @param optical       Reflectancia de superficie multiespectral (Sentinel-2 en el estudio original).
 * @param elevation     Modelo digital de elevaciones (SRTM).
 * @param precipitation Precipitación por péntadas (CHIRPS).
 * @param temperature   Temperatura superficial diaria (MODIS LST).
 */
public record WatershedDataSources(
        RasterSource optical,
        RasterSource elevation,
        RasterSource precipitation,
        RasterSource temperature
) {
    public WatershedDataSources {
        Objects.requireNonNull(optical, "La fuente óptica no puede ser nula.");
        Objects.requireNonNull(elevation, "La fuente de elevación no puede ser nula.");
        Objects.requireNonNull(precipitation, "La fuente de precipitación no puede ser nula.");
        Objects.requireNonNull(temperature, "La fuente de temperatura no puede ser nula.");
    }
}
