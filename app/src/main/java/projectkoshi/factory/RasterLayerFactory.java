package projectkoshi.factory;

import projectkoshi.domain.raster.Composite;
import projectkoshi.domain.raster.Raster;
import projectkoshi.domain.result.RasterLayer;

import java.time.Instant;
import java.util.List;

/**
 * Fábrica centralizada de las capas de salida del análisis.
 * <p>
 * Fija nombres, títulos y unidades de cada producto para que todos los consumidores
 * (exportadores, visores) reciban las mismas etiquetas.
 */
public class RasterLayerFactory {

    public static final String NDWI = "ndwi";
    public static final String LAKES = "lakes";
    public static final String DEM = "dem";
    public static final String SLOPE = "slope";
    public static final String ASPECT = "aspect";
    public static final String SNOWLINE = "snowline";
    public static final String THICKNESS = "thickness";
    public static final String VELOCITY = "velocity";
    public static final String ANNUAL_PRECIPITATION = "annual_precipitation";
    public static final String MEAN_LST = "mean_lst";
    public static final String ROCKFALL = "rockfall";
    public static final String GLOF = "glof";

    // --- 1. AGUA ---

    public static RasterLayer createWaterIndexLayer(Composite<?> source, Raster index) {
        return layer(NDWI, "Índice de agua de diferencia normalizada", "", index, source.sourceTimestamps());
    }

    public static RasterLayer createLakeMaskLayer(Composite<?> source, Raster mask) {
        return layer(LAKES, "Máscara de lagos glaciares", "", mask, source.sourceTimestamps());
    }

    // --- 2. TERRENO Y GLACIARES ---

    public static RasterLayer createDemLayer(Raster dem) {
        return layer(DEM, "Modelo digital de elevaciones", "m", dem, List.of());
    }

    public static RasterLayer createSlopeLayer(Raster slope) {
        return layer(SLOPE, "Pendiente", "°", slope, List.of());
    }

    public static RasterLayer createAspectLayer(Raster aspect) {
        return layer(ASPECT, "Orientación", "°", aspect, List.of());
    }

    public static RasterLayer createSnowlineLayer(Raster snowline) {
        return layer(SNOWLINE, "Zona sobre la línea de nieve", "", snowline, List.of());
    }

    /**
     * Espesor glaciar aproximado. Es un indicador empírico, no un modelo físico.
     */
    public static RasterLayer createThicknessLayer(Raster thickness) {
        return layer(THICKNESS, "Espesor glaciar estimado", "m", thickness, List.of());
    }

    public static RasterLayer createVelocityLayer(Raster velocity) {
        return layer(VELOCITY, "Velocidad glaciar estimada", "m/año", velocity, List.of());
    }

    // --- 3. CLIMA ---

    public static RasterLayer createAnnualPrecipitationLayer(Raster precipitation, List<Instant> sources) {
        return layer(ANNUAL_PRECIPITATION, "Precipitación media mensual del año", "mm", precipitation, sources);
    }

    public static RasterLayer createMeanLstLayer(Raster lst, List<Instant> sources) {
        return layer(MEAN_LST, "Temperatura media de la superficie terrestre", "°C", lst, sources);
    }

    // --- 4. RIESGOS ---

    public static RasterLayer createRockfallLayer(Raster classification, List<Instant> sources) {
        return layer(ROCKFALL, "Susceptibilidad a desprendimientos", "clase", classification, sources);
    }

    public static RasterLayer createGlofLayer(Raster classification, List<Instant> sources) {
        return layer(GLOF, "Riesgo de desbordamiento de lago glaciar (GLOF)", "clase", classification, sources);
    }

    private static RasterLayer layer(String name, String description, String unit,
                                     Raster raster, List<Instant> sources) {
        return RasterLayer.builder()
                .name(name)
                .description(description)
                .unit(unit)
                .raster(raster)
                .sourceTimestamps(sources)
                .build();
    }
}
