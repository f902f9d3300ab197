package org.maptracker.merge.util;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.maptracker.merge.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared file management utilities.
 */
public class FileUtil {

    public static final String GITIGNORE_FILE_NAME = ".gitignore";

    private FileUtil() {
    }

    public static void saveJsonFile(final Path path,
                                    final Object data)
            throws IOException {
        saveJsonFile(path, data, JsonUtils.MAPPER);
    }

    public static void saveJsonFile(final Path path,
                                    final Object data,
                                    final ObjectMapper mapper)
            throws IOException {

        final Path toPath = path.toAbsolutePath();

        try (final Writer writer = Files.newBufferedWriter(toPath, StandardCharsets.UTF_8)) {
            mapper.writeValue(writer, data);
        } catch (final Throwable t) {
            throw new IOException("failed to write " + toPath, t);
        }

        LOG.info("saveJsonFile: exit, wrote data to {}", toPath);
    }

    public static void ensureWritableDirectory(final File directory) {
        // try twice to work around concurrent access issues
        if (! directory.exists()) {
            if (! directory.mkdirs()) {
                if (! directory.exists()) {
                    throw new IllegalArgumentException("failed to create " + directory);
                }
            }
        }
        if (! directory.canWrite()) {
            throw new IllegalArgumentException("not allowed to write to " + directory);
        }
    }

    /**
     * Ensures the specified generated output directory exists and
     * contains a .gitignore file that excludes all of its content.
     */
    public static void ensureOutputDirectory(final File directory)
            throws IOException {

        ensureWritableDirectory(directory);

        final Path gitignorePath = new File(directory, GITIGNORE_FILE_NAME).toPath();
        Files.write(gitignorePath, "*\n".getBytes(StandardCharsets.UTF_8));
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileUtil.class);
}
