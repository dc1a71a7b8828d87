package com.szntopology.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private static final Logger log = LoggerFactory.getLogger(FileUtils.class);

    private static final char[] GLOB_CHARACTERS = {'*', '?', '[', '{'};

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds regular files whose absolute path matches a glob pattern.
     *
     * <p>The walk starts at the longest leading part of the pattern that has no
     * wildcard, so {@code /a/b/test_*.py} only lists {@code /a/b}. A single
     * {@code *} does not cross directory boundaries, {@code **} does.
     *
     * <p>Symbolic links are followed. Directories that cannot be read and links
     * that lead back into the walk are logged and skipped.
     *
     * @param absolutePattern absolute glob pattern
     * @return matching files sorted by path, empty if the base directory does not exist
     * @throws IOException if the base directory cannot be walked
     */
    public static List<Path> findFiles(String absolutePattern) throws IOException {
        Path base = globBase(absolutePattern);
        if (!Files.exists(base)) {
            return List.of();
        }
        if (base.toString().equals(absolutePattern)) {
            return Files.isRegularFile(base) ? List.of(base) : List.of();
        }

        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + absolutePattern);
        int depth = absolutePattern.contains("**")
            ? Integer.MAX_VALUE
            : Path.of(absolutePattern).getNameCount() - base.getNameCount();

        List<Path> matches = new ArrayList<>();
        Files.walkFileTree(base, EnumSet.of(FileVisitOption.FOLLOW_LINKS), depth, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && matcher.matches(file)) {
                    matches.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.warn("Skipping {} while matching {}: {}", file, absolutePattern, e.toString());
                return FileVisitResult.CONTINUE;
            }
        });
        matches.sort(null);
        return matches;
    }

    /**
     * Lists every subdirectory below a root, skipping hidden directories and
     * everything below them. The children of a directory are listed together,
     * sorted by name, before any of their own subdirectories.
     *
     * <p>A directory reached a second time through a symbolic link is left out.
     * A directory that cannot be listed is logged and contributes no
     * subdirectories, its siblings are still expanded.
     *
     * @param root directory to expand
     * @return subdirectories, not including {@code root} itself
     */
    public static List<Path> subdirectories(Path root) {
        List<Path> result = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return result;
        }
        Set<Path> visited = new HashSet<>();
        realPath(root).ifPresent(visited::add);
        collectSubdirectories(root, visited, result);
        return result;
    }

    private static void collectSubdirectories(Path directory, Set<Path> visited, List<Path> result) {
        List<Path> children;
        try (Stream<Path> entries = Files.list(directory)) {
            children = entries
                .filter(Files::isDirectory)
                .filter(path -> !isHidden(path))
                .sorted()
                .toList();
        } catch (IOException | UncheckedIOException e) {
            log.warn("Unable to list subdirectories of {}: {}", directory, e.toString());
            return;
        }

        List<Path> fresh = new ArrayList<>();
        for (Path child : children) {
            Optional<Path> real = realPath(child);
            if (real.isPresent() && visited.add(real.get())) {
                fresh.add(child);
            }
        }
        result.addAll(fresh);
        for (Path child : fresh) {
            collectSubdirectories(child, visited, result);
        }
    }

    private static Optional<Path> realPath(Path path) {
        try {
            return Optional.of(path.toRealPath());
        } catch (IOException e) {
            log.warn("Unable to resolve {}: {}", path, e.toString());
            return Optional.empty();
        }
    }

    /**
     * Returns true if the file name starts with a dot.
     */
    public static boolean isHidden(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().startsWith(".");
    }

    /**
     * Tests a file name against simple glob patterns such as {@code *.szn}.
     *
     * @param path file to test
     * @param patterns file name globs
     * @return true if any pattern matches the file name
     */
    public static boolean nameMatchesAny(Path path, List<String> patterns) {
        Path name = path.getFileName();
        if (name == null) {
            return false;
        }
        return patterns.stream().anyMatch(pattern -> GlobPattern.matches(pattern, name.toString()));
    }

    /**
     * Reads a file as a string.
     *
     * @param path path to file
     * @return file content as string
     * @throws IOException if reading fails
     */
    public static String readString(Path path) throws IOException {
        return Files.readString(path);
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }

    private static Path globBase(String pattern) {
        int firstGlob = pattern.length();
        for (char c : GLOB_CHARACTERS) {
            int index = pattern.indexOf(c);
            if (index >= 0 && index < firstGlob) {
                firstGlob = index;
            }
        }
        if (firstGlob == pattern.length()) {
            return Path.of(pattern);
        }
        int lastSeparator = pattern.lastIndexOf('/', firstGlob);
        if (lastSeparator < 0) {
            lastSeparator = pattern.lastIndexOf('\\', firstGlob);
        }
        return lastSeparator <= 0 ? Path.of(pattern.substring(0, 1)) : Path.of(pattern.substring(0, lastSeparator));
    }
}
