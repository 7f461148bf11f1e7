package projectkoshi.domain.vector;

import org.locationtech.jts.geom.Geometry;

import java.util.Objects;

/**
 * Polígono de un componente conexo de una máscara binaria.
 *
 * @param componentId Identificador del componente (1..N) en orden de descubrimiento (barrido por filas).
 * @param geometry    Contorno del componente a la resolución de la máscara. Es un {@code Polygon},
 *                    o un {@code MultiPolygon} si con conectividad 8 los píxeles sólo se tocan en una esquina.
 * @param pixelCount  Número de píxeles del componente.
 * @param minCol      Columna mínima del componente (incluida).
 * @param minRow      Fila mínima del componente (incluida).
 * @param maxCol      Columna máxima del componente (incluida).
 * @param maxRow      Fila máxima del componente (incluida).
 */
public record MaskPolygon(
        int componentId,
        Geometry geometry,
        int pixelCount,
        int minCol,
        int minRow,
        int maxCol,
        int maxRow
) {
    public MaskPolygon {
        Objects.requireNonNull(geometry, "La geometría del componente no puede ser nula.");
        if (pixelCount <= 0) {
            throw new IllegalArgumentException("Un componente debe contener al menos un píxel.");
        }
    }
}
