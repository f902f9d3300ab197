package org.maptracker.merge.match;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Global placement of a group of maps on a shared canvas.
 */
public class Layout {

    private final SortedMap<String, CanvasPosition> nameToPosition;
    private final List<List<String>> components;

    public Layout(final SortedMap<String, CanvasPosition> nameToPosition,
                  final List<List<String>> components) {
        this.nameToPosition = Collections.unmodifiableSortedMap(new TreeMap<>(nameToPosition));
        final List<List<String>> copiedComponents = new ArrayList<>(components.size());
        for (final List<String> component : components) {
            copiedComponents.add(Collections.unmodifiableList(new ArrayList<>(component)));
        }
        this.components = Collections.unmodifiableList(copiedComponents);
    }

    public SortedMap<String, CanvasPosition> getNameToPosition() {
        return nameToPosition;
    }

    /**
     * @throws IllegalArgumentException
     *   if the named map is not part of this layout.
     */
    public CanvasPosition getPosition(final String mapName)
            throws IllegalArgumentException {
        final CanvasPosition position = nameToPosition.get(mapName);
        if (position == null) {
            throw new IllegalArgumentException("map '" + mapName + "' is not part of this layout");
        }
        return position;
    }

    /**
     * @return connected components in placement order, each listing its maps in visit order.
     */
    public List<List<String>> getComponents() {
        return components;
    }

    public int getComponentCount() {
        return components.size();
    }

    @Override
    public String toString() {
        return "{ positions: " + nameToPosition + ", components: " + components + " }";
    }
}
