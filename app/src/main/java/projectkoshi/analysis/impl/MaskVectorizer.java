package projectkoshi.analysis.impl;

import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.operation.union.UnaryUnionOp;
import org.locationtech.jts.simplify.DouglasPeuckerSimplifier;
import projectkoshi.analysis.i.IVectorizer;
import projectkoshi.domain.raster.Raster;
import projectkoshi.domain.raster.RasterGrid;
import projectkoshi.domain.vector.Connectivity;
import projectkoshi.domain.vector.MaskPolygon;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Convierte una máscara binaria en polígonos, uno por componente conexo.
 * <p>
 * El etiquetado es un relleno por inundación (BFS) iterativo con semillas en orden de
 * barrido por filas, por lo que el resultado es determinista. La geometría de cada
 * componente se obtiene uniendo los tramos horizontales de sus píxeles y eliminando
 * después los vértices colineales.
 * <p>
 * La conectividad por defecto es 8.
 */
@Slf4j
public class MaskVectorizer implements IVectorizer {

    private static final int UNLABELED = 0;

    private final Connectivity defaultConnectivity;

    public MaskVectorizer() {
        this(Connectivity.EIGHT);
    }

    public MaskVectorizer(Connectivity defaultConnectivity) {
        this.defaultConnectivity = defaultConnectivity;
    }

    @Override
    public String getName() {
        return "ConnectedComponents";
    }

    @Override
    public String getDescription() {
        return "Etiquetado BFS con conectividad " + defaultConnectivity + " y unión de tramos por fila.";
    }

    @Override
    public List<MaskPolygon> vectorize(Raster mask) {
        return vectorize(mask, defaultConnectivity);
    }

    @Override
    public List<MaskPolygon> vectorize(Raster mask, Connectivity connectivity) {
        long startTime = System.currentTimeMillis();
        RasterGrid grid = mask.getGrid();
        boolean[] set = readMask(mask);
        int[][] offsets = Objects.requireNonNull(connectivity, "La conectividad no puede ser nula.").getOffsets();

        int width = grid.width();
        int height = grid.height();
        int[] labels = new int[grid.getPixelCount()];
        int[] queue = new int[grid.getPixelCount()];
        List<int[]> boxes = new ArrayList<>(); // {minCol, minRow, maxCol, maxRow, pixelCount}

        int nextLabel = 1;
        for (int seed = 0; seed < set.length; seed++) {
            if (!set[seed] || labels[seed] != UNLABELED) {
                continue;
            }
            int label = nextLabel++;
            int[] box = {seed % width, seed / width, seed % width, seed / width, 0};
            int head = 0;
            int tail = 0;
            queue[tail++] = seed;
            labels[seed] = label;

            while (head < tail) {
                int current = queue[head++];
                int col = current % width;
                int row = current / width;
                box[0] = Math.min(box[0], col);
                box[1] = Math.min(box[1], row);
                box[2] = Math.max(box[2], col);
                box[3] = Math.max(box[3], row);
                box[4]++;

                for (int[] offset : offsets) {
                    int nCol = col + offset[0];
                    int nRow = row + offset[1];
                    if (nCol < 0 || nCol >= width || nRow < 0 || nRow >= height) {
                        continue;
                    }
                    int neighbour = nRow * width + nCol;
                    if (set[neighbour] && labels[neighbour] == UNLABELED) {
                        labels[neighbour] = label;
                        queue[tail++] = neighbour;
                    }
                }
            }
            boxes.add(box);
        }

        List<MaskPolygon> polygons = new ArrayList<>(boxes.size());
        for (int i = 0; i < boxes.size(); i++) {
            int label = i + 1;
            int[] box = boxes.get(i);
            Geometry geometry = traceComponent(grid, labels, label, box);
            polygons.add(new MaskPolygon(label, geometry, box[4], box[0], box[1], box[2], box[3]));
        }

        log.info("Vectorización completada: {} componentes ({}) en {} ms.",
                polygons.size(), connectivity, System.currentTimeMillis() - startTime);
        return polygons;
    }

    /**
     * Contorno de un componente: unión de los tramos horizontales contiguos de cada fila.
     */
    private Geometry traceComponent(RasterGrid grid, int[] labels, int label, int[] box) {
        int width = grid.width();
        List<Polygon> runs = new ArrayList<>();
        for (int row = box[1]; row <= box[3]; row++) {
            int col = box[0];
            while (col <= box[2]) {
                if (labels[row * width + col] != label) {
                    col++;
                    continue;
                }
                int runStart = col;
                while (col <= box[2] && labels[row * width + col] == label) {
                    col++;
                }
                runs.add(grid.pixelBlockToPolygon(runStart, row, col, row + 1));
            }
        }
        Geometry union = runs.size() == 1 ? runs.get(0) : UnaryUnionOp.union(runs);
        // Tolerancia 0: sólo elimina los vértices colineales que deja la unión de tramos
        return DouglasPeuckerSimplifier.simplify(union, 0.0);
    }

    private boolean[] readMask(Raster mask) {
        if (mask.getBandCount() != 1) {
            throw new IllegalArgumentException("La máscara debe tener una sola banda, recibida: " + mask.getBandNames());
        }
        int pixels = mask.getGrid().getPixelCount();
        boolean[] set = new boolean[pixels];
        for (int i = 0; i < pixels; i++) {
            float v = mask.getValueAt(0, i);
            if (v == 1f) {
                set[i] = true;
            } else if (v != 0f && !Float.isNaN(v)) {
                throw new IllegalArgumentException("Valor de máscara no binario " + v + " en el píxel " + i + ".");
            }
        }
        return set;
    }
}
