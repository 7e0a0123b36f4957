package com.questrail.htl.resource;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Content-Type lookup by file extension for the common web formats.
 */
public final class ContentTypes {

    public static final String DEFAULT = "application/octet-stream";
    public static final String HTML = "text/html";

    private static final Map<String, String> COMMON = new HashMap<>();
    static {
        COMMON.put("avif", "image/avif");
        COMMON.put("bmp", "image/bmp");
        COMMON.put("css", "text/css");
        COMMON.put("csv", "text/csv");
        COMMON.put("gif", "image/gif");
        COMMON.put("gz", "application/gzip");
        COMMON.put("htm", HTML);
        COMMON.put("html", HTML);
        COMMON.put("ico", "image/vnd.microsoft.icon");
        COMMON.put("jpeg", "image/jpeg");
        COMMON.put("jpg", "image/jpeg");
        COMMON.put("js", "text/javascript");
        COMMON.put("json", "application/json");
        COMMON.put("md", "text/markdown");
        COMMON.put("mjs", "text/javascript");
        COMMON.put("mp3", "audio/mpeg");
        COMMON.put("mp4", "video/mp4");
        COMMON.put("otf", "font/otf");
        COMMON.put("pdf", "application/pdf");
        COMMON.put("png", "image/png");
        COMMON.put("svg", "image/svg+xml");
        COMMON.put("ttf", "font/ttf");
        COMMON.put("txt", "text/plain");
        COMMON.put("wasm", "application/wasm");
        COMMON.put("webmanifest", "application/manifest+json");
        COMMON.put("webp", "image/webp");
        COMMON.put("woff", "font/woff");
        COMMON.put("woff2", "font/woff2");
        COMMON.put("xhtml", "application/xhtml+xml");
        COMMON.put("xml", "application/xml");
        COMMON.put("zip", "application/zip");
    }

    private ContentTypes() {}

    /**
     * Returns the Content-Type for the given extension (without the dot),
     * or {@link #DEFAULT} if it is not known.
     */
    public static String forExtension(String extension) {
        if (extension == null || extension.isEmpty()) {
            return DEFAULT;
        }
        return COMMON.getOrDefault(extension.toLowerCase(Locale.ROOT), DEFAULT);
    }

    /**
     * Returns the extension of {@code file} without the dot, or the empty
     * string if the file name has none.
     */
    public static String extensionOf(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return "";
        }
        String s = name.toString();
        int dot = s.lastIndexOf('.');
        return (dot < 0) ? "" : s.substring(dot + 1);
    }
}
