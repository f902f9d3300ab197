package org.maptracker.client;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.Iterator;

import javax.imageio.ImageIO;
import javax.imageio.ImageWriter;
import javax.imageio.stream.FileImageOutputStream;

import org.maptracker.merge.image.ArgbImages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PNG file reading and writing.
 */
public class ImageFiles {

    public static final String PNG_FORMAT = "png";
    public static final String PNG_EXTENSION = "." + PNG_FORMAT;

    private ImageFiles() {
    }

    /**
     * Opens an image as a TYPE_INT_ARGB image.
     *
     * @return the loaded image, or null (after logging a warning) if the file is missing or cannot be decoded.
     */
    public static BufferedImage openImage(final File file) {

        BufferedImage image = null;

        if (file.isFile()) {
            try {
                final BufferedImage loadedImage = ImageIO.read(file);
                if (loadedImage == null) {
                    LOG.warn("openImage: no reader can decode {}, skipping it", file.getAbsolutePath());
                } else {
                    image = ArgbImages.toArgb(loadedImage);
                }
            } catch (final IOException e) {
                LOG.warn("openImage: failed to read " + file.getAbsolutePath() + ", skipping it", e);
            }
        } else {
            LOG.warn("openImage: {} does not exist, skipping it", file.getAbsolutePath());
        }

        return image;
    }

    /**
     * Saves an image in PNG format, replacing any existing file.
     *
     * @throws IOException
     *   if the image cannot be written.
     */
    public static void savePng(final BufferedImage image,
                               final File toFile)
            throws IOException {

        final File parentDirectory = toFile.getAbsoluteFile().getParentFile();
        if ((parentDirectory != null) && (! parentDirectory.isDirectory()) && (! parentDirectory.mkdirs())) {
            throw new IOException("failed to create " + parentDirectory);
        }

        if (toFile.exists() && (! toFile.delete())) {
            throw new IOException("failed to replace " + toFile.getAbsolutePath());
        }

        final Iterator<ImageWriter> writersForFormat = ImageIO.getImageWritersByFormatName(PNG_FORMAT);
        if ((writersForFormat == null) || (! writersForFormat.hasNext())) {
            throw new IOException("no ImageIO writers exist for the '" + PNG_FORMAT + "' format");
        }

        final ImageWriter writer = writersForFormat.next();
        try (final FileImageOutputStream outputStream = new FileImageOutputStream(toFile)) {
            writer.setOutput(outputStream);
            writer.write(image);
        } finally {
            writer.dispose();
        }

        LOG.info("savePng: exit, saved {}", toFile.getAbsolutePath());
    }

    /**
     * @return file name without its png extension.
     */
    public static String getBaseName(final File file) {
        final String name = file.getName();
        return name.endsWith(PNG_EXTENSION) ? name.substring(0, name.length() - PNG_EXTENSION.length()) : name;
    }

    public static boolean isPng(final File file) {
        return file.isFile() && file.getName().endsWith(PNG_EXTENSION);
    }

    private static final Logger LOG = LoggerFactory.getLogger(ImageFiles.class);
}
