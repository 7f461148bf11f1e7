package projectkoshi.domain.vector;

import org.locationtech.jts.geom.Geometry;

import java.util.Objects;

/**
 * Contorno de glaciar suministrado como entrada vectorial externa (inventario tipo GLIMS).
 * Se consume en modo sólo lectura.
 */
public record GlacierOutline(String id, Geometry geometry) {

    public GlacierOutline {
        Objects.requireNonNull(id, "El identificador del glaciar no puede ser nulo.");
        Objects.requireNonNull(geometry, "La geometría del glaciar no puede ser nula.");
    }

    public boolean intersects(Geometry area) {
        return geometry.intersects(area);
    }
}
