package com.libragraph.relay.util;

import java.util.Locale;
import java.util.Map;

/**
 * Maps artifact filenames to content types. Unknown extensions fall back to
 * {@code application/octet-stream}.
 */
public final class MediaTypes {

    public static final String OCTET_STREAM = "application/octet-stream";

    private static final Map<String, String> BY_EXTENSION = Map.of(
            ".mp4", "video/mp4",
            ".webm", "video/webm",
            ".gif", "image/gif",
            ".png", "image/png",
            ".jpg", "image/jpeg",
            ".jpeg", "image/jpeg",
            ".webp", "image/webp"
    );

    private MediaTypes() {
    }

    public static String forFileName(String fileName) {
        return BY_EXTENSION.getOrDefault(extension(fileName), OCTET_STREAM);
    }

    /** Lowercased extension including the dot, or {@code ""} when there is none. */
    public static String extension(String fileName) {
        if (fileName == null) return "";
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        int dot = fileName.lastIndexOf('.');
        if (dot <= slash + 1 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }
}
