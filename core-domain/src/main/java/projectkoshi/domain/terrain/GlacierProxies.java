package projectkoshi.domain.terrain;

import projectkoshi.domain.raster.Raster;

import java.util.Objects;

/**
 * Aproximaciones empíricas de espesor y velocidad glaciar. No son modelos físicos:
 * sólo reproducen una fórmula fija a partir de la pendiente y la línea de nieve.
 *
 * @param thickness    Espesor estimado, banda "thickness" (no-data bajo la línea de nieve).
 * @param velocity     Velocidad estimada, banda "velocity".
 * @param snowlineMask 1 donde el MDE alcanza la línea de nieve, 0 debajo, banda "snowline".
 */
public record GlacierProxies(Raster thickness, Raster velocity, Raster snowlineMask) {

    public GlacierProxies {
        Objects.requireNonNull(thickness, "El ráster de espesor no puede ser nulo.");
        Objects.requireNonNull(velocity, "El ráster de velocidad no puede ser nulo.");
        Objects.requireNonNull(snowlineMask, "La máscara de línea de nieve no puede ser nula.");
    }
}
