package com.cellactors.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

class GridTest {

    @Test
    void blinkerWrapsAcrossTheRightEdge() {
        Grid grid = new Grid(5, 5);
        grid.set(4, 2, true);
        grid.set(0, 2, true);
        grid.set(1, 2, true);

        Grid first = Grid.advance(grid);
        assertEquals(3, first.aliveCount());
        assertTrue(first.get(0, 1));
        assertTrue(first.get(0, 2));
        assertTrue(first.get(0, 3));

        assertEquals(grid, Grid.advance(first));
    }

    @Test
    void wraparoundCountsNeighbors() {
        Grid grid = new Grid(3, 3);
        grid.set(2, 2, true);
        assertEquals(1, Grid.neighborCount(grid, 0));
        assertEquals(0, Grid.neighborCount(grid, 8));
    }

    @Test
    void rowsUseRenderAlphabet() {
        Grid grid = new Grid(3, 2);
        grid.set(1, 0, true);
        grid.set(2, 1, true);
        assertEquals(List.of("_*_", "__*"), grid.rows());
    }

    @Test
    void rejectsInvalidDimensionsAndCoordinates() {
        assertThrows(InvalidDimensionsException.class, () -> new Grid(0, 1));
        assertThrows(InvalidDimensionsException.class, () -> new Grid(70_000, 70_000));
        Grid grid = new Grid(2, 2);
        assertThrows(IndexOutOfBoundsException.class, () -> grid.get(2, 0));
    }
}
