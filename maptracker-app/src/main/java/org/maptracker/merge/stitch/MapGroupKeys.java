package org.maptracker.merge.stitch;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Derives stitch group keys from merged map names.
 */
public class MapGroupKeys {

    static final String LEVEL_SEPARATOR = "_lv";

    private MapGroupKeys() {
    }

    /**
     * @return the map id prefix of a merged map name (e.g. 'map01' for 'map01_lv002'),
     *         or the full name if it has no level separator.
     */
    public static String groupKey(final String mapName) {
        final int separatorIndex = mapName.indexOf(LEVEL_SEPARATOR);
        return separatorIndex < 0 ? mapName : mapName.substring(0, separatorIndex);
    }

    /**
     * @return the specified values grouped by the group key of their names (keys and groups sorted by name).
     */
    public static <T> SortedMap<String, SortedMap<String, T>> groupByKey(final Map<String, T> namedValues) {
        final SortedMap<String, SortedMap<String, T>> groups = new TreeMap<>();
        for (final Map.Entry<String, T> entry : namedValues.entrySet()) {
            groups.computeIfAbsent(groupKey(entry.getKey()), k -> new TreeMap<>())
                    .put(entry.getKey(), entry.getValue());
        }
        return groups;
    }
}
