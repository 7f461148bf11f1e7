package projectkoshi.analysis.tiling;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.Callable;

/**
 * Tarea que calcula un bloque horizontal de filas [rowStart, rowEnd) de un ráster de salida.
 * Está diseñada para ejecutarse en el pool de {@link TileProcessor}.
 * <p>
 * Cada tarea reserva su propio buffer de bloque, de modo que las tareas no comparten
 * estado mutable; el procesador copia los bloques a la salida al terminar.
 */
@Getter
@RequiredArgsConstructor
public class RowBlockTask implements Callable<RowBlockTask> {

    // --- Entradas para la tarea ---
    private final int rowStart;
    private final int rowEnd;
    private final int width;
    private final int bandCount;
    private final TileProcessor.BlockKernel kernel;

    // --- Resultado de la tarea ---
    private float[][] block;

    @Override
    public RowBlockTask call() {
        int blockSize = (rowEnd - rowStart) * width;
        this.block = new float[bandCount][blockSize];
        kernel.compute(rowStart, rowEnd, block);
        return this;
    }
}
