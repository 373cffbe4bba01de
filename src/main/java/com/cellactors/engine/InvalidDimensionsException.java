package com.cellactors.engine;

public class InvalidDimensionsException extends IllegalArgumentException {

    public InvalidDimensionsException(int width, int height) {
        this("Board dimensions must be positive but were " + width + "x" + height);
    }

    public InvalidDimensionsException(String message) {
        super(message);
    }

    static void check(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new InvalidDimensionsException(width, height);
        }
        if ((long) width * height > Integer.MAX_VALUE) {
            throw new InvalidDimensionsException("Board of " + width + "x" + height + " cells is too large");
        }
    }
}
