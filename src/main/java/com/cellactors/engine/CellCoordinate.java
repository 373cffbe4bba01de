package com.cellactors.engine;

public record CellCoordinate(int x, int y) {
}
