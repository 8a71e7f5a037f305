package com.propertyintel.epc.output;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves export file names against the configured output directory.
 *
 * Names come from request parameters, so anything that could land outside
 * the directory is rejected with {@link IllegalArgumentException}.
 */
final class ExportPaths {

    private ExportPaths() {
    }

    static Path resolve(String outputDir, String filename, String extension) {
        if (filename == null || filename.isBlank()
                || filename.contains("/") || filename.contains("\\") || filename.contains("..")) {
            throw new IllegalArgumentException("Invalid export filename: " + filename);
        }

        Path dir = Paths.get(outputDir).toAbsolutePath().normalize();
        Path target = dir.resolve(filename + extension).normalize();
        if (!dir.equals(target.getParent())) {
            throw new IllegalArgumentException("Export filename escapes the output directory: " + filename);
        }
        return target;
    }

    /** Reduces free text such as an area or supplier name to a file-name fragment. */
    static String slug(String label) {
        String slug = label == null ? "" : label.trim().replaceAll("[^A-Za-z0-9_-]+", "_");
        return slug.isEmpty() ? "all" : slug;
    }
}
