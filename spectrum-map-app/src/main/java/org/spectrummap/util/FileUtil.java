package org.spectrummap.util;

import java.io.File;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared file management utilities.
 */
public class FileUtil {

    /**
     * @return regular files (not directories) in the specified directory sorted by name.
     *
     * @throws IllegalArgumentException
     *   if the directory does not exist or is not a directory.
     *
     * @throws IOException
     *   if the directory cannot be listed.
     */
    public static List<Path> listRegularFiles(final Path directory)
            throws IllegalArgumentException, IOException {

        if (! Files.isDirectory(directory)) {
            throw new IllegalArgumentException("input path " + directory + " is not an existing directory");
        }

        final List<Path> files = new ArrayList<>();
        try (final DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (final Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                } else {
                    LOG.debug("listRegularFiles: skipping {}", path);
                }
            }
        }

        Collections.sort(files);

        return files;
    }

    public static void ensureWritableDirectory(final File directory) {
        if (! directory.exists()) {
            if (! directory.mkdirs()) {
                // check again in case the directory was created by someone else in the meantime
                if (! directory.exists()) {
                    throw new IllegalArgumentException("failed to create " + directory);
                }
            }
        }
        if (! directory.isDirectory()) {
            throw new IllegalArgumentException(directory + " is not a directory");
        }
        if (! directory.canWrite()) {
            throw new IllegalArgumentException("not allowed to write to " + directory);
        }
    }

    /**
     * Deletes the specified path and, for a directory, everything below it.
     * Symbolic links are deleted without following them.  A missing path is ignored.
     *
     * @throws IOException
     *   if any file or directory cannot be deleted.
     */
    public static void deleteRecursive(final Path path)
            throws IOException {

        if (! Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }

        Files.walkFileTree(path, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(final Path file,
                                             final BasicFileAttributes attributes)
                    throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(final Path directory,
                                                      final IOException exception)
                    throws IOException {
                if (exception != null) {
                    throw exception;
                }
                Files.delete(directory);
                return FileVisitResult.CONTINUE;
            }
        });

        LOG.debug("deleteRecursive: deleted {}", path);
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileUtil.class);

}
