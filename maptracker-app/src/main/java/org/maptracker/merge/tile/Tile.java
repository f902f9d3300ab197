package org.maptracker.merge.tile;

import java.awt.image.BufferedImage;
import java.util.Objects;

import org.maptracker.merge.image.ArgbImages;

/**
 * One screenshot fragment of a map.
 * Instances are never modified; alignment changes produce a new tile.
 */
public class Tile {

    private final String fileName;
    private final TileKey key;
    private final BufferedImage image;
    private final TileAlignment alignment;

    /**
     * Constructs an unaligned tile.
     *
     * @param  fileName  name of the tile's source file.
     * @param  key       grid coordinates of the tile.
     * @param  image     tile pixels, copied into a TYPE_INT_ARGB image owned by the tile.
     */
    public Tile(final String fileName,
                final TileKey key,
                final BufferedImage image) {
        this(fileName, key, ArgbImages.toArgb(Objects.requireNonNull(image, "image")), null);
    }

    private Tile(final String fileName,
                 final TileKey key,
                 final BufferedImage image,
                 final TileAlignment alignment) {
        this.fileName = fileName;
        this.key = Objects.requireNonNull(key, "key");
        this.image = Objects.requireNonNull(image, "image");
        this.alignment = alignment;
    }

    public String getFileName() {
        return fileName;
    }

    public TileKey getKey() {
        return key;
    }

    /**
     * @return the tile's own pixels, shared by every aligned copy of this tile and only ever read.
     */
    public BufferedImage getImage() {
        return image;
    }

    public int getWidth() {
        return image.getWidth();
    }

    public int getHeight() {
        return image.getHeight();
    }

    /**
     * @return alignment of this tile or null if the tile has standard size (or has not been aligned yet).
     */
    public TileAlignment getAlignment() {
        return alignment;
    }

    /**
     * @return copy of this tile with the specified alignment.
     */
    public Tile withAlignment(final TileAlignment alignment) {
        return new Tile(fileName, key, image, alignment);
    }

    /**
     * @return copy of this tile with the specified direction and the current alignment mode
     *         (manual if this tile has not been aligned).
     */
    public Tile withDirection(final AlignDirection direction) {
        final AlignMode mode = alignment == null ? AlignMode.MANUAL : alignment.getMode();
        return withAlignment(new TileAlignment(mode, direction));
    }

    @Override
    public String toString() {
        return fileName + " " + key + " " + getWidth() + "x" + getHeight() +
               (alignment == null ? "" : " " + alignment);
    }
}
