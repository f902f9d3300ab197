package org.maptracker.client;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.maptracker.merge.tile.GridExtent;
import org.maptracker.merge.tile.MapGroup;
import org.maptracker.merge.tile.TileKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds tile files below a directory and groups them by map name.
 *
 * Normal tile files are named {mapId}_lv{level}_{x}_{y}.png, tier tile files
 * {mapId}_lv{level}_{x}_{y}_tier_{suffix}.png (grouped as {mapId}_lv{level}_tier_{suffix}).
 */
public class TileFileScanner {

    public static final String TIER_SEPARATOR = "_tier_";

    public enum MapType {

        NORMAL_TIER(new TilePattern("(map\\d+_lv\\d+)_(\\d+)_(\\d+)\\.png", false),
                    new TilePattern("(\\w+)_(\\d+)_(\\d+)_tier_(\\w+)\\.png", true)),
        BASE(new TilePattern("(base\\d+_lv\\d+)_(\\d+)_(\\d+)\\.png", false)),
        DUNGEON(new TilePattern("(dung\\d+_lv\\d+)_(\\d+)_(\\d+)\\.png", false));

        private final List<TilePattern> patterns;

        MapType(final TilePattern... patterns) {
            this.patterns = Collections.unmodifiableList(Arrays.asList(patterns));
        }
    }

    private static class TilePattern {

        private final Pattern pattern;
        private final boolean tier;

        TilePattern(final String regex,
                    final boolean tier) {
            this.pattern = Pattern.compile(regex);
            this.tier = tier;
        }
    }

    private final MapType mapType;

    public TileFileScanner(final MapType mapType) {
        this.mapType = mapType;
    }

    /**
     * @return groups found below the directory, sorted by name.
     *
     * @throws IOException
     *   if the directory cannot be walked.
     */
    public SortedMap<String, MapGroup<File>> scan(final File directory)
            throws IOException {

        LOG.info("scan: entry, mapType={}, directory={}", mapType, directory.getAbsolutePath());

        final List<Path> paths;
        try (final Stream<Path> stream = Files.walk(directory.toPath())) {
            paths = stream.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }

        final SortedMap<String, MapGroup<File>> groups = new TreeMap<>();

        for (final Path path : paths) {
            final String fileName = path.getFileName().toString();
            for (final TilePattern tilePattern : mapType.patterns) {
                final Matcher m = tilePattern.pattern.matcher(fileName);
                if (m.matches()) {
                    final String groupName = tilePattern.tier ? m.group(1) + TIER_SEPARATOR + m.group(4) : m.group(1);
                    final TileKey key = new TileKey(Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
                    groups.computeIfAbsent(groupName, MapGroup::new).addTile(key, path.toFile());
                    break;
                }
            }
        }

        if (groups.isEmpty()) {
            LOG.warn("scan: no map tiles found in {}", directory.getAbsolutePath());
        } else {
            LOG.info("scan: exit, found {} group(s): {}", groups.size(), groups.keySet());
        }

        return groups;
    }

    public static boolean isTierGroup(final String groupName) {
        return groupName.contains(TIER_SEPARATOR);
    }

    /**
     * @return name of the normal group a tier group belongs to (e.g. 'map01_lv001' for 'map01_lv001_tier_a').
     */
    public static String getNormalGroupName(final String tierGroupName) {
        final int separatorIndex = tierGroupName.indexOf(TIER_SEPARATOR);
        return separatorIndex < 0 ? tierGroupName : tierGroupName.substring(0, separatorIndex);
    }

    /**
     * @return grid extent to use for each group, tier groups share the extent of their normal group when one exists.
     */
    public static SortedMap<String, GridExtent> getCanvasExtents(final SortedMap<String, ? extends MapGroup<?>> groups) {

        final SortedMap<String, GridExtent> extents = new TreeMap<>();

        for (final MapGroup<?> group : groups.values()) {
            if (! isTierGroup(group.getName())) {
                extents.put(group.getName(), group.getGridExtent());
            }
        }

        for (final MapGroup<?> group : groups.values()) {
            final String groupName = group.getName();
            if (isTierGroup(groupName)) {
                final String normalGroupName = getNormalGroupName(groupName);
                final GridExtent normalExtent = extents.get(normalGroupName);
                if (normalExtent == null) {
                    LOG.warn("getCanvasExtents: no matching normal group for tier group '{}', using own bounds",
                             groupName);
                    extents.put(groupName, group.getGridExtent());
                } else {
                    LOG.info("getCanvasExtents: tier group '{}' aligned to normal group '{}': {} -> {}",
                             groupName, normalGroupName, group.getGridExtent(), normalExtent);
                    extents.put(groupName, normalExtent);
                }
            }
        }

        return extents;
    }

    private static final Logger LOG = LoggerFactory.getLogger(TileFileScanner.class);
}
