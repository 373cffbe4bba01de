package com.cellactors.engine;

/**
 * Toroidal addressing between linear field offsets and grid coordinates.
 */
public final class CoordinateMapper {

    public static final int NEIGHBOR_COUNT = 8;

    private static final int[] NEIGHBOR_DX = {-1, 0, 1, -1, 1, -1, 0, 1};
    private static final int[] NEIGHBOR_DY = {-1, -1, -1, 0, 0, 1, 1, 1};

    private CoordinateMapper() {
    }

    public static CellCoordinate toXy(int offset, int width) {
        return new CellCoordinate(offset % width, offset / width);
    }

    public static int wrap(int value, int limit) {
        int mod = value % limit;
        if (mod < 0) {
            mod += limit;
        }
        return mod;
    }

    public static int toOffset(int x, int y, int width, int height) {
        return wrap(x, width) + wrap(y, height) * width;
    }

    /**
     * Moore neighbourhood of {@code offset}, row by row from the top-left neighbour. On boards
     * narrower or shorter than 3 cells the result repeats offsets and may contain the cell itself.
     */
    public static int[] neighborOffsets(int offset, int width, int height) {
        int x = offset % width;
        int y = offset / width;
        int[] neighbors = new int[NEIGHBOR_COUNT];
        for (int i = 0; i < NEIGHBOR_COUNT; i++) {
            neighbors[i] = toOffset(x + NEIGHBOR_DX[i], y + NEIGHBOR_DY[i], width, height);
        }
        return neighbors;
    }
}
