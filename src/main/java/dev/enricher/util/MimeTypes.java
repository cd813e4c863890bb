package dev.enricher.util;

import java.util.Locale;
import java.util.Map;

public final class MimeTypes {

    private static final Map<String, String> EXTENSIONS = Map.of(
            "image/jpeg", "jpg",
            "image/png", "png",
            "image/gif", "gif",
            "image/webp", "webp",
            "image/bmp", "bmp",
            "video/mp4", "mp4",
            "video/webm", "webm",
            "video/x-matroska", "mkv");

    private static final Map<String, String> BY_EXTENSION = Map.of(
            "jpg", "image/jpeg",
            "jpeg", "image/jpeg",
            "png", "image/png",
            "gif", "image/gif",
            "webp", "image/webp",
            "mp4", "video/mp4",
            "webm", "video/webm",
            "mkv", "video/x-matroska");

    private MimeTypes() {
    }

    public static String extensionFor(String mimeType) {
        if (mimeType == null) {
            return "bin";
        }
        return EXTENSIONS.getOrDefault(mimeType.toLowerCase(Locale.ROOT), "bin");
    }

    /**
     * Guess from the URL path; {@code application/octet-stream} when unknown.
     */
    public static String fromUrl(String url) {
        if (url == null) {
            return "application/octet-stream";
        }
        String path = url;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        int dot = path.lastIndexOf('.');
        if (dot < 0 || dot == path.length() - 1) {
            return "application/octet-stream";
        }
        String extension = path.substring(dot + 1).toLowerCase(Locale.ROOT);
        return BY_EXTENSION.getOrDefault(extension, "application/octet-stream");
    }

    /**
     * Mime type for an ImageIO format name such as "JPEG" or "png".
     */
    public static String fromImageFormat(String formatName) {
        String format = formatName.toLowerCase(Locale.ROOT);
        if (format.equals("jpg")) {
            format = "jpeg";
        }
        return "image/" + format;
    }
}
