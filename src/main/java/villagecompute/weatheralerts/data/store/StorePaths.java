/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.data.store;

import java.util.ArrayList;
import java.util.List;

import villagecompute.weatheralerts.exceptions.ValidationException;

/**
 * Helpers for slash-separated hierarchical store paths.
 *
 * <p>
 * Segments must be non-blank and must not contain any of {@code / . # $ [ ]}, the characters the hosted store reserves
 * in keys.
 */
public final class StorePaths {

    private static final String RESERVED = "/.#$[]";

    private StorePaths() {
        // Utility class, no instantiation
    }

    /**
     * Joins segments into a path, validating each one.
     *
     * @throws ValidationException
     *             if any segment is blank or contains a reserved character
     */
    public static String join(String... segments) {
        StringBuilder path = new StringBuilder();
        for (String segment : segments) {
            requireValidSegment(segment);
            if (path.length() > 0) {
                path.append('/');
            }
            path.append(segment);
        }
        return path.toString();
    }

    /**
     * Appends a single validated segment to an existing path.
     */
    public static String child(String parent, String segment) {
        requireValidSegment(segment);
        return parent.isEmpty() ? segment : parent + "/" + segment;
    }

    /**
     * Splits a path into its segments. Leading and trailing slashes are ignored; the empty path is the root.
     *
     * @throws ValidationException
     *             if the path contains an empty or invalid segment
     */
    public static List<String> split(String path) {
        List<String> segments = new ArrayList<>();
        if (path == null) {
            throw new ValidationException("Store path must not be null");
        }
        String trimmed = path;
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.isEmpty()) {
            return segments;
        }
        for (String segment : trimmed.split("/", -1)) {
            requireValidSegment(segment);
            segments.add(segment);
        }
        return segments;
    }

    public static boolean isValidSegment(String segment) {
        if (segment == null || segment.isBlank()) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (RESERVED.indexOf(segment.charAt(i)) >= 0) {
                return false;
            }
        }
        return true;
    }

    private static void requireValidSegment(String segment) {
        if (!isValidSegment(segment)) {
            throw new ValidationException("Invalid store path segment: '" + segment + "'");
        }
    }
}
