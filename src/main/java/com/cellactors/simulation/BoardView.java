package com.cellactors.simulation;

import java.util.List;

import com.cellactors.engine.Grid;

public record BoardView(int width, int height, long generation, int aliveCount, List<String> rows) {

    public BoardView {
        rows = List.copyOf(rows);
    }

    static BoardView of(long generation, Grid snapshot) {
        return new BoardView(snapshot.width(), snapshot.height(), generation, snapshot.aliveCount(), snapshot.rows());
    }

    public String frame() {
        return String.join("\n", rows) + "\ngeneration " + generation;
    }
}
