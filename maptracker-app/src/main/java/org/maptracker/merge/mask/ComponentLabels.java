package org.maptracker.merge.mask;

/**
 * Result of connected component labeling.
 * Label 0 marks background pixels, components are numbered from 1 in raster order of their first pixel.
 */
public class ComponentLabels {

    private final int width;
    private final int height;
    private final int[] labels;
    private final int componentCount;
    private final int[] componentPixels;
    private final int[] componentOffsets;

    ComponentLabels(final int width,
                    final int height,
                    final int[] labels,
                    final int componentCount,
                    final int[] componentPixels,
                    final int[] componentOffsets) {
        this.width = width;
        this.height = height;
        this.labels = labels;
        this.componentCount = componentCount;
        this.componentPixels = componentPixels;
        this.componentOffsets = componentOffsets;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getComponentCount() {
        return componentCount;
    }

    public int getLabel(final int index) {
        return labels[index];
    }

    public int getLabel(final int x,
                        final int y) {
        return labels[(y * width) + x];
    }

    public int getComponentSize(final int label) {
        return componentOffsets[label] - componentOffsets[label - 1];
    }

    /**
     * @return pixel indices of the component with the specified label (1 based).
     */
    public int[] getComponentPixels(final int label) {
        final int from = componentOffsets[label - 1];
        final int to = componentOffsets[label];
        final int[] pixels = new int[to - from];
        System.arraycopy(componentPixels, from, pixels, 0, pixels.length);
        return pixels;
    }

}
