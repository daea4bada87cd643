package org.villecon.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * A rectangular grid of {@link Tile}s addressed by {@code (x, y)}.
 * <p>
 * The grid is built once by world setup and shared by all villages. Tiles are mutated in
 * place by harvesting and recovery; the grid itself never changes shape.
 */
public final class TerrainGrid {

    private final int width;
    private final int height;
    private final Tile[] tiles;

    /**
     * Creates a grid from a row-major list of tiles.
     *
     * @param width  number of columns, must be positive.
     * @param height number of rows, must be positive.
     * @param tiles  {@code width * height} tiles in row-major order.
     */
    public TerrainGrid(int width, int height, List<Tile> tiles) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + width + "x" + height);
        }
        if (tiles.size() != width * height) {
            throw new IllegalArgumentException(
                    "Expected " + (width * height) + " tiles for a " + width + "x" + height + " grid, got " + tiles.size());
        }
        this.width = width;
        this.height = height;
        this.tiles = tiles.toArray(new Tile[0]);
        for (Tile tile : this.tiles) {
            if (tile == null) {
                throw new IllegalArgumentException("Grid must not contain null tiles");
            }
        }
    }

    /**
     * Creates a grid in which every cell has the same terrain and capacity.
     *
     * @param width    number of columns.
     * @param height   number of rows.
     * @param type     terrain of every cell.
     * @param capacity maximum resources of every cell; each tile starts full.
     * @return the new grid.
     */
    public static TerrainGrid uniform(int width, int height, TerrainType type, ResourceAmounts capacity) {
        List<Tile> cells = new ArrayList<>(width * height);
        for (int i = 0; i < width * height; i++) {
            cells.add(new Tile(type, capacity));
        }
        return new TerrainGrid(width, height, cells);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public boolean isInBounds(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    /**
     * @param x column.
     * @param y row.
     * @return the tile at the given position.
     * @throws IndexOutOfBoundsException if the position lies outside the grid.
     */
    public Tile getTile(int x, int y) {
        if (!isInBounds(x, y)) {
            throw new IndexOutOfBoundsException("Position (" + x + "," + y + ") outside " + width + "x" + height + " grid");
        }
        return tiles[y * width + x];
    }

    /**
     * Returns the tiles in the square window of half-width {@code radius} around {@code (x, y)}.
     * Cells outside the grid are skipped.
     *
     * @param x      centre column.
     * @param y      centre row.
     * @param radius half-width of the window; negative values yield an empty list.
     * @return the tiles inside the window, row by row.
     */
    public List<Tile> tilesInRadius(int x, int y, int radius) {
        if (radius < 0) {
            return Collections.emptyList();
        }
        // window clipped to the grid, computed in long so huge radii cannot overflow
        int minX = (int) Math.max(0L, (long) x - radius);
        int maxX = (int) Math.min(width - 1L, (long) x + radius);
        int minY = (int) Math.max(0L, (long) y - radius);
        int maxY = (int) Math.min(height - 1L, (long) y + radius);
        List<Tile> result = new ArrayList<>();
        for (int ty = minY; ty <= maxY; ty++) {
            for (int tx = minX; tx <= maxX; tx++) {
                result.add(tiles[ty * width + tx]);
            }
        }
        return result;
    }

    /**
     * Sums the current resources in the window around {@code (x, y)}.
     *
     * @param x      centre column.
     * @param y      centre row.
     * @param radius half-width of the window.
     * @return the per-resource totals.
     */
    public ResourceAmounts availableInRadius(int x, int y, int radius) {
        ResourceAmounts total = new ResourceAmounts();
        for (Tile tile : tilesInRadius(x, y, radius)) {
            for (ResourceType r : ResourceType.values()) {
                total.add(r, tile.getResource(r));
            }
        }
        return total;
    }

    /**
     * Sums the maximum resources in the window around {@code (x, y)}.
     *
     * @param x      centre column.
     * @param y      centre row.
     * @param radius half-width of the window.
     * @return the per-resource capacity totals.
     */
    public ResourceAmounts capacityInRadius(int x, int y, int radius) {
        ResourceAmounts total = new ResourceAmounts();
        for (Tile tile : tilesInRadius(x, y, radius)) {
            for (ResourceType r : ResourceType.values()) {
                total.add(r, tile.getMaxResource(r));
            }
        }
        return total;
    }

    public void forEachTile(Consumer<Tile> action) {
        for (Tile tile : tiles) {
            action.accept(tile);
        }
    }
}
