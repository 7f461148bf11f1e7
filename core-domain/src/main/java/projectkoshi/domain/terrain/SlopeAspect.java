package projectkoshi.domain.terrain;

import projectkoshi.domain.raster.Raster;

import java.util.Objects;

/**
 * Derivadas del terreno calculadas sobre la misma malla que el MDE.
 *
 * @param slope  Pendiente en grados [0, 90], banda "slope".
 * @param aspect Orientación (rumbo de la máxima pendiente descendente) en grados [0, 360), banda "aspect".
 */
public record SlopeAspect(Raster slope, Raster aspect) {

    public SlopeAspect {
        Objects.requireNonNull(slope, "El ráster de pendiente no puede ser nulo.");
        Objects.requireNonNull(aspect, "El ráster de orientación no puede ser nulo.");
        slope.getGrid().requireAlignedWith(aspect.getGrid(), "SlopeAspect");
    }
}
