package org.revas.reference.util;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.commons.io.FilenameUtils;
import org.revas.reference.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared file management utilities.
 */
public class FileUtil {

    public static Reader getReader(final String path)
            throws IOException {
        return Files.newBufferedReader(Paths.get(path), StandardCharsets.UTF_8);
    }

    public static void saveJsonFile(final String path,
                                    final Object data)
            throws IOException {

        final Path toPath = Paths.get(path).toAbsolutePath();

        try (final Writer writer = Files.newBufferedWriter(toPath, StandardCharsets.UTF_8)) {
            JsonUtils.MAPPER.writeValue(writer, data);
        } catch (final Throwable t) {
            throw new IOException("failed to write " + toPath, t);
        }

        LOG.info("saveJsonFile: exit, wrote data to {}", toPath);
    }

    public static void ensureWritableDirectory(final File directory) {
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
     * Removes the specified file if it exists, logging (but otherwise ignoring) failures
     * since this is used to clean up partial output after another error.
     *
     * @return true if the file no longer exists.
     */
    public static boolean deleteIfExists(final File file) {
        boolean deleted = true;
        try {
            if (Files.deleteIfExists(file.toPath())) {
                LOG.info("deleteIfExists: deleted {}", file.getAbsolutePath());
            }
        } catch (final IOException e) {
            LOG.warn("deleteIfExists: failed to delete " + file.getAbsolutePath(), e);
            deleted = false;
        }
        return deleted;
    }

    public static boolean deleteRecursive(final File file) {

        boolean deleteSuccessful = true;

        if (file.isDirectory()) {
            final File[] files = file.listFiles();
            if (files != null) {
                for (final File f : files) {
                    deleteSuccessful = deleteSuccessful && deleteRecursive(f);
                }
            }
        }

        if (file.delete()) {
            LOG.debug("deleted " + file.getAbsolutePath());
        } else {
            LOG.warn("failed to delete " + file.getAbsolutePath());
            deleteSuccessful = false;
        }

        return deleteSuccessful;
    }

    /**
     * @return name of the specified path without its directory and extension
     *         (e.g. "session_1" for "/data/session_1.avi").
     */
    public static String getBaseName(final String path) {
        return FilenameUtils.getBaseName(path);
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileUtil.class);
}
