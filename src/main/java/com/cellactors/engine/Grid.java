package com.cellactors.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Plain toroidal cell field. Used to seed boards, to hold board snapshots and as the sequential
 * reference for the actor engine.
 */
public final class Grid {

    public static final char ALIVE = '*';
    public static final char DEAD = '_';

    private final int width;
    private final int height;
    private final boolean[] cells;

    public Grid(int width, int height) {
        InvalidDimensionsException.check(width, height);
        this.width = width;
        this.height = height;
        this.cells = new boolean[width * height];
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public void set(int x, int y, boolean alive) {
        cells[index(x, y)] = alive;
    }

    public boolean get(int x, int y) {
        return cells[index(x, y)];
    }

    boolean getAt(int offset) {
        return cells[offset];
    }

    void setAt(int offset, boolean alive) {
        cells[offset] = alive;
    }

    public int aliveCount() {
        int count = 0;
        for (boolean cell : cells) {
            if (cell) {
                count++;
            }
        }
        return count;
    }

    public List<String> rows() {
        List<String> rows = new ArrayList<>(height);
        StringBuilder row = new StringBuilder(width);
        for (int y = 0; y < height; y++) {
            row.setLength(0);
            for (int x = 0; x < width; x++) {
                row.append(get(x, y) ? ALIVE : DEAD);
            }
            rows.add(row.toString());
        }
        return rows;
    }

    private int index(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Coordinates out of range: (" + x + ", " + y + ")");
        }
        return y * width + x;
    }

    /**
     * Sequential single-pass generation step over the torus.
     */
    public static Grid advance(Grid current) {
        Grid next = new Grid(current.width, current.height);
        for (int offset = 0; offset < current.cells.length; offset++) {
            int neighbors = neighborCount(current, offset);
            next.cells[offset] = LifeRule.nextState(current.cells[offset], neighbors);
        }
        return next;
    }

    static int neighborCount(Grid grid, int offset) {
        int count = 0;
        for (int neighbor : CoordinateMapper.neighborOffsets(offset, grid.width, grid.height)) {
            if (grid.cells[neighbor]) {
                count++;
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Grid other)) {
            return false;
        }
        return width == other.width && height == other.height && Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(width);
        result = 31 * result + Integer.hashCode(height);
        result = 31 * result + Arrays.hashCode(cells);
        return result;
    }

    @Override
    public String toString() {
        return String.join("\n", rows());
    }
}
