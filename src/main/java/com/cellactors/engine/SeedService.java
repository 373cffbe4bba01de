package com.cellactors.engine;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.function.BooleanSupplier;

public final class SeedService {

    public static final double DEFAULT_RANDOM_DENSITY = 0.5d;

    private SeedService() {
    }

    public static BooleanSupplier randomSource(double density, long seed) {
        ensureDensity(density);
        Random random = new Random(seed);
        return () -> random.nextDouble() < density;
    }

    /**
     * Parses rows in the render format. {@code *} or {@code O} is alive, {@code _} or {@code .} is
     * dead; every row must have the same length.
     */
    public static Grid parsePattern(List<String> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("Pattern must contain at least one row");
        }
        int width = rows.get(0).length();
        if (width == 0) {
            throw new IllegalArgumentException("Pattern rows must not be empty");
        }
        Grid grid = new Grid(width, rows.size());
        for (int y = 0; y < rows.size(); y++) {
            String row = rows.get(y);
            if (row == null || row.length() != width) {
                throw new IllegalArgumentException("Pattern row " + y + " must have " + width + " cells");
            }
            for (int x = 0; x < width; x++) {
                grid.set(x, y, parseCell(row.charAt(x), x, y));
            }
        }
        return grid;
    }

    public static Grid loadSeedFromFile(Path path, int width, int height) throws IOException {
        Objects.requireNonNull(path, "path");
        Grid grid = new Grid(width, height);
        try (BufferedReader reader = Files.newBufferedReader(path)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                String[] parts = trimmed.split("\\s+");
                if (parts.length != 2) {
                    throw new IllegalArgumentException("Line " + lineNo + " must contain two integers: '" + trimmed + "'");
                }
                int x = parseCoordinate(parts[0], lineNo, 'x');
                int y = parseCoordinate(parts[1], lineNo, 'y');
                if (x < 0 || x >= width || y < 0 || y >= height) {
                    throw new IllegalArgumentException("Coordinate (" + x + ", " + y + ") on line " + lineNo + " is outside the " + width + "x" + height + " grid");
                }
                grid.set(x, y, true);
            }
        }
        return grid;
    }

    private static boolean parseCell(char ch, int x, int y) {
        return switch (ch) {
            case Grid.ALIVE, 'O' -> true;
            case Grid.DEAD, '.' -> false;
            default -> throw new IllegalArgumentException("Invalid cell '" + ch + "' at (" + x + ", " + y + ")");
        };
    }

    private static void ensureDensity(double density) {
        if (Double.isNaN(density) || density < 0.0 || density > 1.0) {
            throw new IllegalArgumentException("Density must be between 0.0 and 1.0 inclusive");
        }
    }

    private static int parseCoordinate(String raw, int lineNo, char axis) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid " + axis + " coordinate '" + raw + "' on line " + lineNo);
        }
    }
}
