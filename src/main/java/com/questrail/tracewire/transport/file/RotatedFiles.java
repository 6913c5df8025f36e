package com.questrail.tracewire.transport.file;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Naming, discovery and pruning of rotated log files.
 *
 * <p>A rotated file of base {@code logs/app.sil} is named
 * {@code logs/app-yyyy-MM-dd-HH-mm-ss.sil} with the UTC time it was opened.
 * If that name is taken an {@code a} is appended to the timestamp until it
 * is free.</p>
 */
final class RotatedFiles {
    private static final Logger log = LoggerFactory.getLogger(RotatedFiles.class);

    static final String TIMESTAMP_PATTERN = "yyyy-MM-dd-HH-mm-ss";
    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern(TIMESTAMP_PATTERN);
    static final String ALREADY_EXISTS_SUFFIX = "a";

    private RotatedFiles() {
    }

    /**
     * File to open: with {@code append} the newest existing rotated file,
     * otherwise (or if none exists) a new name for {@code now}.
     */
    static Path fileName(Path base, boolean append, Instant now) throws IOException {
        if (append) {
            List<Path> files = list(base);
            if (!files.isEmpty()) {
                return files.get(files.size() - 1);
            }
        }
        return expand(base, now);
    }

    static Path expand(Path base, Instant now) {
        String[] parts = split(base.getFileName().toString());
        String prefix = parts[0] + "-" + TIMESTAMP.format(LocalDateTime.ofInstant(now, ZoneOffset.UTC));
        Path result = base.resolveSibling(prefix + parts[1]);
        while (Files.exists(result)) {
            prefix = prefix + ALREADY_EXISTS_SUFFIX;
            result = base.resolveSibling(prefix + parts[1]);
        }
        return result;
    }

    /**
     * Rotated files of {@code base}, oldest first.
     */
    static List<Path> list(Path base) throws IOException {
        Path dir = directory(base);
        if (!Files.isDirectory(dir)) {
            return Collections.emptyList();
        }
        String[] parts = split(base.getFileName().toString());
        List<Path> result = new ArrayList<>();
        // names are matched literally; the base name may contain glob characters
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path p : stream) {
                String name = p.getFileName().toString();
                if (name.startsWith(parts[0] + "-") && name.endsWith(parts[1]) && fileDate(base, p).isPresent()) {
                    result.add(p);
                }
            }
        }
        result.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        return result;
    }

    /**
     * Timestamp encoded in the name of a rotated file.
     */
    static Optional<Instant> fileDate(Path base, Path file) {
        String baseName = split(base.getFileName().toString())[0];
        String fileName = file.getFileName().toString();
        if (!fileName.startsWith(baseName + "-")) {
            return Optional.empty();
        }
        String value = split(fileName.substring(baseName.length() + 1))[0];
        if (value.length() > TIMESTAMP_PATTERN.length()) {
            value = value.substring(0, TIMESTAMP_PATTERN.length());
        }
        if (value.length() != TIMESTAMP_PATTERN.length()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDateTime.parse(value, TIMESTAMP).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Deletes the oldest rotated files so that at most {@code maxParts}
     * remain. A file that cannot be deleted is logged and skipped.
     */
    static void deleteOldest(Path base, int maxParts) throws IOException {
        List<Path> files = list(base);
        for (int i = 0; i + maxParts < files.size(); i++) {
            try {
                Files.deleteIfExists(files.get(i));
            } catch (IOException e) {
                log.warn("Could not delete rotated log file {}", files.get(i), e);
            }
        }
    }

    private static Path directory(Path base) {
        Path parent = base.toAbsolutePath().getParent();
        return parent != null ? parent : base.toAbsolutePath();
    }

    // {name, extension including the dot}
    private static String[] split(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return new String[] { fileName, "" };
        }
        return new String[] { fileName.substring(0, dot), fileName.substring(dot) };
    }
}
