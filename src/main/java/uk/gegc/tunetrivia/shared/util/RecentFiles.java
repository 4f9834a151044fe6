package uk.gegc.tunetrivia.shared.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Lists files of one extension modified after a point in time.
 */
public final class RecentFiles {

    private RecentFiles() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * @return matching regular files sorted by name; empty when the directory does not exist
     * @throws IOException when the directory cannot be listed
     */
    public static List<Path> list(Path directory, String extension, Instant modifiedAfter) throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(path -> path.getFileName().toString().endsWith(extension))
                    .filter(Files::isRegularFile)
                    .filter(path -> lastModified(path).isAfter(modifiedAfter))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static Instant lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path).toInstant();
        } catch (IOException e) {
            // vanished between listing and stat
            return Instant.MIN;
        }
    }
}
