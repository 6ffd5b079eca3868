package alpha.haka.handler;

import static alpha.haka.HttpConstants.StatusCode.FOUR_HUNDRED;
import static alpha.haka.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static java.util.Objects.requireNonNull;

/**
 * Factories of {@link RequestHandler}s.
 */
public final class RequestHandlers
{
    private RequestHandlers() {
        // Empty
    }
    
    private static final RequestHandler
            NOT_FOUND    = (req, res) -> res.status(FOUR_HUNDRED_FOUR).text("Not found: " + req.path()),
            INVALID_PATH = (req, res) -> res.status(FOUR_HUNDRED).text("Invalid path.");
    
    /**
     * Returns a handler that responds 404 (Not Found) with the text "Not found:
     * " followed by the request path.
     * 
     * @return a handler
     */
    public static RequestHandler notFound() {
        return NOT_FOUND;
    }
    
    /**
     * Returns a handler that responds 400 (Bad Request) with the text "Invalid
     * path.".<p>
     * 
     * Used for static file requests that resolve outside of the served
     * directory.
     * 
     * @return a handler
     */
    public static RequestHandler invalidPath() {
        return INVALID_PATH;
    }
    
    /**
     * Returns a handler that responds 200 (OK) with the given plain text.
     * 
     * @param text body
     * @return a handler
     * @throws NullPointerException if {@code text} is {@code null}
     */
    public static RequestHandler text(String text) {
        requireNonNull(text);
        return (req, res) -> res.text(text);
    }
    
    /**
     * Returns a handler that responds 200 (OK) with the given HTML.
     * 
     * @param html body
     * @return a handler
     * @throws NullPointerException if {@code html} is {@code null}
     */
    public static RequestHandler html(String html) {
        requireNonNull(html);
        return (req, res) -> res.html(html);
    }
    
    /**
     * Returns a handler that responds 200 (OK) with the given value serialized
     * as JSON.<p>
     * 
     * The value is serialized anew for each request.
     * 
     * @param value to serialize (may be {@code null})
     * @return a handler
     */
    public static RequestHandler json(Object value) {
        return (req, res) -> res.json(value);
    }
}
