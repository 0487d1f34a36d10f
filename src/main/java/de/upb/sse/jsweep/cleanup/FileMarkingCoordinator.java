package de.upb.sse.jsweep.cleanup;

import de.upb.sse.jsweep.model.CleanupScope;
import de.upb.sse.jsweep.util.FileUtil;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

/**
 * Maintains the marker comment that flags a file for the marked-file cleanup. A file is marked when
 * its first token, after an optional byte order mark and whitespace, is the marker line.
 *
 * Works on raw text so that marking never reformats a file.
 */
public class FileMarkingCoordinator {
    private static final Logger logger = Logger.getLogger(FileMarkingCoordinator.class.getName());
    private static final char BOM = '\uFEFF';

    private final String marker;

    public FileMarkingCoordinator(String marker) {
        if (marker == null || !marker.startsWith("//")) {
            throw new IllegalArgumentException("Marker must be a line comment: " + marker);
        }
        this.marker = marker;
    }

    public String getMarker() {
        return marker;
    }

    /** Marked files among the scope's candidates, sorted. */
    public List<Path> listMarkedFiles(CleanupScope scope) {
        Set<Path> marked = new TreeSet<>();
        for (Path root : scope.getCandidateRoots()) {
            for (Path file : FileUtil.getAllJavaFiles(root)) {
                if (scope.isCandidate(file) && isMarked(file)) marked.add(file);
            }
        }
        return new ArrayList<>(marked);
    }

    /**
     * @throws UncheckedIOException if the file exists but cannot be read
     */
    public boolean isMarked(Path file) {
        if (!Files.isRegularFile(file)) return false;
        return markerOffset(read(file)) >= 0;
    }

    /**
     * Puts the marker line in front of every given file that is not marked yet. Missing files are
     * skipped.
     *
     * @return the files that were changed
     */
    public List<Path> mark(Collection<Path> files) {
        List<Path> changed = new ArrayList<>();
        for (Path file : files) {
            if (!Files.isRegularFile(file)) {
                logger.fine("Not marking missing file " + file);
                continue;
            }
            try {
                String text = read(file);
                if (markerOffset(text) >= 0) continue;
                boolean bom = !text.isEmpty() && text.charAt(0) == BOM;
                String body = bom ? text.substring(1) : text;
                String marked = (bom ? String.valueOf(BOM) : "") + marker + FileUtil.lineSeparatorOf(body) + body;
                Files.write(file, marked.getBytes(StandardCharsets.UTF_8));
                changed.add(file);
            } catch (IOException | UncheckedIOException e) {
                logger.warning("Could not mark " + file + ": " + e.getMessage());
            }
        }
        return changed;
    }

    /**
     * Removes the marker line from every given file that carries it. Missing files are skipped.
     *
     * @return the files that were changed
     */
    public List<Path> unmark(Collection<Path> files) {
        List<Path> changed = new ArrayList<>();
        for (Path file : files) {
            if (!Files.isRegularFile(file)) continue;
            try {
                String text = read(file);
                int offset = markerOffset(text);
                if (offset < 0) continue;
                String rest = text.substring(offset + marker.length());
                int newline = rest.indexOf('\n');
                rest = newline < 0 ? "" : rest.substring(newline + 1);
                Files.write(file, (text.substring(0, offset) + rest).getBytes(StandardCharsets.UTF_8));
                changed.add(file);
            } catch (IOException | UncheckedIOException e) {
                logger.warning("Could not unmark " + file + ": " + e.getMessage());
            }
        }
        return changed;
    }

    /** Offset of the marker when it is the file's first token, else -1. */
    int markerOffset(String text) {
        int i = 0;
        if (!text.isEmpty() && text.charAt(0) == BOM) i++;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
        if (!text.startsWith(marker, i)) return -1;
        int end = i + marker.length();
        // same prefix, different comment
        if (end < text.length() && !Character.isWhitespace(text.charAt(end))) return -1;
        return i;
    }

    private static String read(Path file) {
        try {
            return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + file, e);
        }
    }
}
