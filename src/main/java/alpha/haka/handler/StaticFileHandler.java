package alpha.haka.handler;

import alpha.haka.message.MediaTypes;
import alpha.haka.message.Request;
import alpha.haka.message.Response;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static alpha.haka.HttpConstants.HeaderKey.CONTENT_TYPE;
import static alpha.haka.HttpConstants.ReasonPhrase.INTERNAL_SERVER_ERROR;
import static alpha.haka.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.haka.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static alpha.haka.HttpConstants.StatusCode.TWO_HUNDRED;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * Responds with the contents of a file.<p>
 * 
 * The whole file is read into memory. Content-Type is guessed from the file
 * extension using {@link MediaTypes#guess(Path)}.<p>
 * 
 * If the file does not exist when the handler runs, the response is 404 (Not
 * Found) with the text "File not found: " followed by the file path. Any
 * other I/O error results in 500 (Internal Server Error). Neither case
 * propagates an exception.
 */
public final class StaticFileHandler implements RequestHandler
{
    private final Path file;
    private final System.Logger log;
    
    /**
     * Constructs a {@code StaticFileHandler} that logs to this package's
     * {@code System.Logger}, unfiltered by any server configuration.<p>
     * 
     * The router passes its own logger using {@link
     * #StaticFileHandler(Path, System.Logger)}.
     * 
     * @param file to serve
     * @throws NullPointerException if {@code file} is {@code null}
     */
    public StaticFileHandler(Path file) {
        this(file, System.getLogger(StaticFileHandler.class.getPackageName()));
    }
    
    /**
     * Constructs a {@code StaticFileHandler}.
     * 
     * @param file to serve
     * @param log logger to use
     * @throws NullPointerException if any argument is {@code null}
     */
    public StaticFileHandler(Path file, System.Logger log) {
        this.file = requireNonNull(file);
        this.log  = requireNonNull(log);
    }
    
    /**
     * Returns the file served.
     * 
     * @return the file served
     */
    public Path file() {
        return file;
    }
    
    @Override
    public void handle(Request request, Response response) {
        final byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            log.log(WARNING, () -> "File vanished before it could be served: " + file);
            response.status(FOUR_HUNDRED_FOUR).text("File not found: " + file);
            return;
        } catch (IOException e) {
            log.log(ERROR, "Failed to read file: " + file, e);
            response.status(FIVE_HUNDRED).text(INTERNAL_SERVER_ERROR);
            return;
        }
        response.status(TWO_HUNDRED)
                .header(CONTENT_TYPE, MediaTypes.guess(file))
                .body(bytes);
    }
    
    @Override
    public String toString() {
        return StaticFileHandler.class.getSimpleName() + "{file=" + file + "}";
    }
}
