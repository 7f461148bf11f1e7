package projectkoshi.domain.vector;

/**
 * Regla de vecindad para agrupar píxeles en componentes conexos.
 */
public enum Connectivity {
    FOUR(new int[][]{{0, -1}, {-1, 0}, {1, 0}, {0, 1}}),
    EIGHT(new int[][]{{-1, -1}, {0, -1}, {1, -1}, {-1, 0}, {1, 0}, {-1, 1}, {0, 1}, {1, 1}});

    private final int[][] offsets;

    Connectivity(int[][] offsets) {
        this.offsets = offsets;
    }

    /**
     * Desplazamientos (dCol, dRow) de los vecinos, en orden fijo.
     * Devuelve una copia; modificarla no altera la constante.
     */
    public int[][] getOffsets() {
        int[][] copy = new int[offsets.length][];
        for (int i = 0; i < offsets.length; i++) {
            copy[i] = offsets[i].clone();
        }
        return copy;
    }
}
