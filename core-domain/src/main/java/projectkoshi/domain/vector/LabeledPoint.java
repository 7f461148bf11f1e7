package projectkoshi.domain.vector;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Punto de entrenamiento etiquetado en coordenadas del sistema de referencia de la malla
 * (en la cuenca del Dudh Koshi, longitud/latitud).
 *
 * @param x     Coordenada X (longitud).
 * @param y     Coordenada Y (latitud).
 * @param label Clase del punto (0 = estable, 1 = peligro). Nula si el punto no está etiquetado.
 */
public record LabeledPoint(
        @JsonProperty("x") double x,
        @JsonProperty("y") double y,
        @JsonProperty("class") Integer label
) {
    public static LabeledPoint of(double x, double y, int label) {
        return new LabeledPoint(x, y, label);
    }

    public boolean isLabeled() {
        return label != null;
    }
}
