package projectkoshi.analysis.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectkoshi.domain.raster.Raster;
import projectkoshi.domain.raster.RasterGrid;
import projectkoshi.domain.vector.Connectivity;
import projectkoshi.domain.vector.MaskPolygon;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MaskVectorizerTest {

    private final MaskVectorizer vectorizer = new MaskVectorizer();

    private static Raster mask(int width, int height, float... values) {
        return Raster.singleBand(new RasterGrid(width, height, 0, height, 1, "TEST"), "mask", values);
    }

    @Test
    @DisplayName("Una máscara vacía no produce polígonos")
    void emptyMask_shouldProduceNoPolygons() {
        assertTrue(vectorizer.vectorize(mask(3, 2, 0, 0, 0, 0, Float.NaN, 0)).isEmpty());
    }

    @Test
    @DisplayName("Una máscara completa produce un único polígono del tamaño de la malla")
    void fullMask_shouldProduceGridPolygon() {
        List<MaskPolygon> polygons = vectorizer.vectorize(mask(3, 2, 1, 1, 1, 1, 1, 1));

        assertEquals(1, polygons.size());
        assertEquals(6, polygons.get(0).pixelCount());
        assertEquals(6.0, polygons.get(0).geometry().getArea(), 1e-9);
        assertEquals("Polygon", polygons.get(0).geometry().getGeometryType());
    }

    @Test
    @DisplayName("Un tablero de ajedrez es un componente con conectividad 8 y uno por píxel con 4")
    void checkerboard_shouldDependOnConnectivity() {
        Raster checkerboard = mask(3, 3,
                1, 0, 1,
                0, 1, 0,
                1, 0, 1);

        List<MaskPolygon> eight = vectorizer.vectorize(checkerboard, Connectivity.EIGHT);
        List<MaskPolygon> four = vectorizer.vectorize(checkerboard, Connectivity.FOUR);

        assertEquals(1, eight.size());
        assertEquals(5, eight.get(0).pixelCount());
        assertEquals(5, four.size());
        four.forEach(p -> assertEquals(1.0, p.geometry().getArea(), 1e-9));
    }

    @Test
    @DisplayName("Componentes numerados en orden de barrido con su caja envolvente")
    void components_shouldBeOrderedByScan() {
        Raster twoLakes = mask(4, 2,
                0, 0, 1, 1,
                1, 0, 0, 1);

        List<MaskPolygon> polygons = vectorizer.vectorize(twoLakes);

        assertEquals(2, polygons.size());
        MaskPolygon first = polygons.get(0);
        assertEquals(1, first.componentId());
        assertEquals(3, first.pixelCount());
        assertEquals(2, first.minCol());
        assertEquals(3, first.maxCol());
        assertEquals(1, first.maxRow());
        MaskPolygon second = polygons.get(1);
        assertEquals(0, second.minCol());
        assertEquals(1, second.minRow());
    }

    @Test
    @DisplayName("Una forma en L se une en un único polígono sin huecos")
    void lShape_shouldUnionIntoOnePolygon() {
        Raster lShape = mask(3, 3,
                1, 0, 0,
                1, 0, 0,
                1, 1, 1);

        List<MaskPolygon> polygons = vectorizer.vectorize(lShape);

        assertEquals(1, polygons.size());
        assertEquals("Polygon", polygons.get(0).geometry().getGeometryType());
        assertEquals(5.0, polygons.get(0).geometry().getArea(), 1e-9);
    }

    @Test
    @DisplayName("Valores distintos de 0, 1 o no-data se rechazan")
    void nonBinaryMask_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> vectorizer.vectorize(mask(2, 1, 1, 0.5f)));
    }

    @Test
    @DisplayName("Alterar los desplazamientos obtenidos de la conectividad no cambia el etiquetado posterior")
    void mutatedOffsets_shouldNotLeakIntoVectorization() {
        // ARRANGE
        Raster checkerboard = mask(3, 3,
                1, 0, 1,
                0, 1, 0,
                1, 0, 1);
        int[][] leaked = Connectivity.EIGHT.getOffsets();
        for (int[] offset : leaked) {
            offset[0] = 0;
            offset[1] = 0;
        }

        // ACT
        List<MaskPolygon> eight = vectorizer.vectorize(checkerboard, Connectivity.EIGHT);

        // ASSERT
        assertEquals(1, eight.size());
        assertEquals(5, eight.get(0).pixelCount());
    }

    @Test
    @DisplayName("Una conectividad nula se rechaza")
    void nullConnectivity_shouldBeRejected() {
        assertThrows(NullPointerException.class, () -> vectorizer.vectorize(mask(1, 1, 1), null));
    }
}
