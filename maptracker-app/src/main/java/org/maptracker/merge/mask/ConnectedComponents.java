package org.maptracker.merge.mask;

/**
 * Breadth first connected component labeling of binary masks.
 */
public class ConnectedComponents {

    public enum Connectivity {
        FOUR(new int[] { 0, -1, 1, 0 },
             new int[] { -1, 0, 0, 1 }),
        EIGHT(new int[] { -1, 0, 1, -1, 1, -1, 0, 1 },
              new int[] { -1, -1, -1, 0, 0, 1, 1, 1 });

        private final int[] dx;
        private final int[] dy;

        Connectivity(final int[] dx,
                     final int[] dy) {
            this.dx = dx;
            this.dy = dy;
        }

        int getNeighborCount() {
            return dx.length;
        }
    }

    private ConnectedComponents() {
    }

    public static ComponentLabels label(final BinaryMask mask,
                                        final Connectivity connectivity) {

        final int width = mask.getWidth();
        final int height = mask.getHeight();
        final int[] labels = new int[mask.getPixelCount()];

        // labeled pixels in discovery order, each component occupies one contiguous range
        final int[] componentPixels = new int[mask.count()];
        final int[] offsets = new int[componentPixels.length + 1];

        int componentCount = 0;
        int tail = 0;

        for (int start = 0; start < labels.length; start++) {

            if ((! mask.get(start)) || (labels[start] != 0)) {
                continue;
            }

            componentCount++;
            labels[start] = componentCount;
            componentPixels[tail++] = start;

            int head = offsets[componentCount - 1];
            while (head < tail) {
                final int index = componentPixels[head++];
                final int x = index % width;
                final int y = index / width;
                for (int n = 0; n < connectivity.getNeighborCount(); n++) {
                    final int nx = x + connectivity.dx[n];
                    final int ny = y + connectivity.dy[n];
                    if ((nx >= 0) && (nx < width) && (ny >= 0) && (ny < height)) {
                        final int neighbor = (ny * width) + nx;
                        if (mask.get(neighbor) && (labels[neighbor] == 0)) {
                            labels[neighbor] = componentCount;
                            componentPixels[tail++] = neighbor;
                        }
                    }
                }
            }

            offsets[componentCount] = tail;
        }

        final int[] componentOffsets = new int[componentCount + 1];
        System.arraycopy(offsets, 0, componentOffsets, 0, componentCount + 1);

        return new ComponentLabels(width, height, labels, componentCount, componentPixels, componentOffsets);
    }

}
