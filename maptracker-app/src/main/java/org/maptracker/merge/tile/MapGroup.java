package org.maptracker.merge.tile;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named collection of tile data keyed by grid coordinates.
 * The first value added for a key is kept, later duplicates are ignored with a warning.
 *
 * @param  <T>  tile data type (e.g. source file path or loaded {@link Tile}).
 */
public class MapGroup<T> {

    private final String name;
    private final SortedMap<TileKey, T> tiles;

    public MapGroup(final String name) {
        this.name = name;
        this.tiles = new TreeMap<>();
    }

    public String getName() {
        return name;
    }

    /**
     * @return true if the tile was added; false if a tile with the same key already exists.
     */
    public boolean addTile(final TileKey key,
                           final T tile) {
        final boolean isNewKey = ! tiles.containsKey(key);
        if (isNewKey) {
            tiles.put(key, tile);
        } else {
            LOG.warn("addTile: duplicate tile at {} for {}, skipping {}", key, name, tile);
        }
        return isNewKey;
    }

    /**
     * @return view of this group's tiles sorted by key.
     */
    public SortedMap<TileKey, T> getTiles() {
        return Collections.unmodifiableSortedMap(tiles);
    }

    public int size() {
        return tiles.size();
    }

    public boolean isEmpty() {
        return tiles.isEmpty();
    }

    /**
     * @return grid extent covered by this group's tiles.
     */
    public GridExtent getGridExtent() {
        return GridExtent.of(tiles.keySet());
    }

    @Override
    public String toString() {
        return name + " (" + tiles.size() + " tiles)";
    }

    private static final Logger LOG = LoggerFactory.getLogger(MapGroup.class);
}
