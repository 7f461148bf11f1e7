package projectkoshi.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.With;

import java.util.List;

/**
 * Objeto de valor inmutable con los parámetros científicos del análisis de una cuenca.
 * <p>
 * Agrupa los umbrales, bandas, escalas de reducción y conversiones de unidades que definen
 * cada indicador. Las constantes proceden del estudio original de la cuenca del Dudh Koshi
 * y pueden ajustarse por cuenca sin tocar el código de los motores.
 *
 * @param studyAreaName            Nombre del área de estudio (informativo).
 * @param analysisYear             Año de análisis de agua, precipitación y temperatura.
 * @param classificationYear       Año de la imagen usada en las clasificaciones de riesgo.
 * @param maxCloudyPixelPercentage Nubosidad máxima (exclusiva) admitida en composiciones ópticas, en %.
 * @param waterBandA               Banda verde del índice de agua (NDWI: B3).
 * @param waterBandB               Banda de infrarrojo cercano del índice de agua (NDWI: B8).
 * @param waterIndexThreshold      Umbral estricto del índice para detectar agua.
 * @param waterScale               Resolución nominal (m) de la vectorización de lagos.
 * @param demBand                  Nombre de la banda de elevación del MDE.
 * @param snowlineElevation        Elevación de la línea de nieve en metros.
 * @param velocityFactor           Factor de proporcionalidad velocidad/espesor del proxy glaciar.
 * @param precipitationBand        Banda de precipitación de la fuente climática.
 * @param precipitationScale       Escala (m) de la reducción zonal de precipitación, con independencia del CRS de la malla.
 * @param precipitationFactor      Factor aplicado a la precipitación media (conversión a mm del estudio).
 * @param lstBand                  Banda de temperatura superficial diurna.
 * @param lstScaleFactor           Factor de escala del producto LST (valor digital a Kelvin).
 * @param lstOffset                Desplazamiento tras el escalado (Kelvin a °C).
 * @param lstScale                 Escala (m) de la reducción zonal de temperatura, con independencia del CRS de la malla.
 * @param classificationBands      Bandas espectrales usadas como características de los clasificadores.
 * @param timeZone                 Zona horaria para asignar fechas a periodos (ej: "UTC").
 */
@Builder
@With
@JsonIgnoreProperties(ignoreUnknown = true)
public record WatershedConfig(
        // --- Área de estudio y periodo ---
        String studyAreaName,
        int analysisYear,
        int classificationYear,
        double maxCloudyPixelPercentage,

        // --- Agua superficial ---
        String waterBandA,
        String waterBandB,
        float waterIndexThreshold,
        double waterScale,

        // --- Terreno y glaciares ---
        String demBand,
        float snowlineElevation,
        float velocityFactor,

        // --- Precipitación ---
        String precipitationBand,
        double precipitationScale,
        float precipitationFactor,

        // --- Temperatura superficial ---
        String lstBand,
        float lstScaleFactor,
        float lstOffset,
        double lstScale,

        // --- Clasificación ---
        List<String> classificationBands,

        String timeZone
) {
    public WatershedConfig {
        classificationBands = (classificationBands == null) ? List.of() : List.copyOf(classificationBands);
        timeZone = (timeZone == null) ? "UTC" : timeZone;
    }

    public static WatershedConfig getDudhKoshiDefaults() {
        return WatershedConfig.builder()
                .studyAreaName("dudhkoshi")
                .analysisYear(2024)
                .classificationYear(2023)
                .maxCloudyPixelPercentage(5)
                .waterBandA("B3")
                .waterBandB("B8")
                .waterIndexThreshold(0.3f)
                .waterScale(10)
                .demBand("elevation")
                .snowlineElevation(3000)
                .velocityFactor(0.02f)
                .precipitationBand("precipitation")
                .precipitationScale(5000)
                .precipitationFactor(100)
                .lstBand("LST_Day_1km")
                .lstScaleFactor(0.02f)
                .lstOffset(-273.15f)
                .lstScale(1000)
                .classificationBands(List.of("B2", "B3", "B4", "B8", "B11", "B12"))
                .timeZone("UTC")
                .build();
    }
}
