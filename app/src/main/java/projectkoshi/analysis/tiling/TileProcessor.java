package projectkoshi.analysis.tiling;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import projectkoshi.config.AnalysisConfig;
import projectkoshi.domain.raster.Raster;
import projectkoshi.domain.raster.RasterGrid;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Orquestador del cómputo paralelo por teselas.
 * <p>
 * Responsabilidades:
 * 1. Dividir una malla en bloques horizontales de filas independientes.
 * 2. Ejecutar cada bloque en un pool fijo de hilos ({@link RowBlockTask}).
 * 3. Fusionar los bloques en el orden de las filas, sin depender del orden de finalización.
 * <p>
 * También expone {@link #invokeAll(List)} para tareas que no son por filas (periodos
 * temporales, árboles del bosque aleatorio).
 */
@Slf4j
public class TileProcessor implements AutoCloseable {

    /**
     * Cálculo de un bloque de filas. Escribe en {@code block[banda][(row - rowStart) * width + col]}.
     */
    @FunctionalInterface
    public interface BlockKernel {
        void compute(int rowStart, int rowEnd, float[][] block);
    }

    private final ExecutorService threadPool;
    @Getter
    private final int tileRows;
    @Getter
    private final int threadCount;

    public TileProcessor(int threadCount, int tileRows) {
        this.threadCount = Math.max(threadCount, 1);
        this.tileRows = Math.max(tileRows, 1);
        this.threadPool = Executors.newFixedThreadPool(this.threadCount);
        log.info("TileProcessor inicializado. (Hilos: {}, Filas por tesela: {})", this.threadCount, this.tileRows);
    }

    public TileProcessor(AnalysisConfig config) {
        this(config.getThreadCount(), config.getTileRows());
    }

    /**
     * Calcula un ráster nuevo sobre la malla dada aplicando el kernel por bloques de filas.
     *
     * @param grid      Malla de salida.
     * @param bandNames Nombres de las bandas de salida.
     * @param kernel    Cálculo de cada bloque.
     * @return Ráster inmutable con el resultado fusionado.
     */
    public Raster computeRaster(RasterGrid grid, List<String> bandNames, BlockKernel kernel) {
        return new Raster(grid, bandNames, Arrays.asList(computeBands(grid, bandNames.size(), kernel)));
    }

    public float[][] computeBands(RasterGrid grid, int bandCount, BlockKernel kernel) {
        int height = grid.height();
        int width = grid.width();

        List<RowBlockTask> tasks = new ArrayList<>();
        for (int rowStart = 0; rowStart < height; rowStart += tileRows) {
            int rowEnd = Math.min(rowStart + tileRows, height);
            tasks.add(new RowBlockTask(rowStart, rowEnd, width, bandCount, kernel));
        }
        log.debug("Procesando malla {}x{} en {} teselas.", width, height, tasks.size());

        List<RowBlockTask> finished = invokeAll(tasks);

        float[][] output = new float[bandCount][grid.getPixelCount()];
        for (RowBlockTask task : finished) {
            int offset = task.getRowStart() * width;
            for (int b = 0; b < bandCount; b++) {
                float[] block = task.getBlock()[b];
                System.arraycopy(block, 0, output[b], offset, block.length);
            }
        }
        return output;
    }

    /**
     * Ejecuta las tareas en el pool y devuelve sus resultados en el mismo orden de la lista.
     *
     * @throws IllegalStateException si el hilo es interrumpido o una tarea falla con una excepción comprobada.
     */
    public <T> List<T> invokeAll(List<? extends Callable<T>> tasks) {
        List<Future<T>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Procesamiento por teselas interrumpido.", e);
        }

        List<T> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Procesamiento por teselas interrumpido.", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                if (cause instanceof Error error) {
                    throw error;
                }
                throw new IllegalStateException("Error en la tarea " + i, cause);
            }
        }
        return results;
    }

    @Override
    public void close() {
        if (!threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("TileProcessor cerrado.");
    }
}
