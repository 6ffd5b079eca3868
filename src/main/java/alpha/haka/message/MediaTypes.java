package alpha.haka.message;

import java.nio.file.Path;
import java.util.Map;

/**
 * Media type constants and a file-extension lookup.<p>
 * 
 * The lookup is a small fixed table. Extensions are matched case-sensitively;
 * {@code "index.HTML"} is served as {@value #APPLICATION_OCTET_STREAM}.
 */
public final class MediaTypes
{
    private MediaTypes() {
        // Empty
    }
    
    /** {@value} */
    public static final String TEXT_PLAIN = "text/plain";
    /** {@value} */
    public static final String TEXT_HTML = "text/html";
    /** {@value} */
    public static final String TEXT_CSS = "text/css";
    /** {@value} */
    public static final String APPLICATION_JAVASCRIPT = "application/javascript";
    /** {@value} */
    public static final String APPLICATION_JSON = "application/json";
    /** {@value} */
    public static final String APPLICATION_PDF = "application/pdf";
    /** {@value} */
    public static final String APPLICATION_OCTET_STREAM = "application/octet-stream";
    /** {@value} */
    public static final String IMAGE_PNG = "image/png";
    /** {@value} */
    public static final String IMAGE_JPEG = "image/jpeg";
    /** {@value} */
    public static final String IMAGE_GIF = "image/gif";
    /** {@value} */
    public static final String IMAGE_SVG = "image/svg+xml";
    
    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
            Map.entry(".html", TEXT_HTML),
            Map.entry(".htm",  TEXT_HTML),
            Map.entry(".css",  TEXT_CSS),
            Map.entry(".js",   APPLICATION_JAVASCRIPT),
            Map.entry(".json", APPLICATION_JSON),
            Map.entry(".png",  IMAGE_PNG),
            Map.entry(".jpg",  IMAGE_JPEG),
            Map.entry(".jpeg", IMAGE_JPEG),
            Map.entry(".gif",  IMAGE_GIF),
            Map.entry(".svg",  IMAGE_SVG),
            Map.entry(".pdf",  APPLICATION_PDF));
    
    /**
     * Guess the media type of a file from the extension of its name.
     * 
     * @param filename file name (may be a path)
     * 
     * @return the media type, never {@code null}
     * 
     * @throws NullPointerException if {@code filename} is {@code null}
     */
    public static String guess(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot == -1) {
            return APPLICATION_OCTET_STREAM;
        }
        return BY_EXTENSION.getOrDefault(
                filename.substring(dot), APPLICATION_OCTET_STREAM);
    }
    
    /**
     * Guess the media type of a file from the extension of its name.
     * 
     * @param file the file
     * 
     * @return the media type, never {@code null}
     * 
     * @throws NullPointerException if {@code file} is {@code null}
     */
    public static String guess(Path file) {
        Path name = file.getFileName();
        return name == null ? APPLICATION_OCTET_STREAM : guess(name.toString());
    }
}
