package alpha.haka.message;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static alpha.haka.HttpConstants.HeaderKey.CONTENT_TYPE;
import static alpha.haka.HttpConstants.ReasonPhrase.INTERNAL_SERVER_ERROR;
import static alpha.haka.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.haka.HttpConstants.StatusCode.TWO_HUNDRED;
import static alpha.haka.message.MediaTypes.APPLICATION_JSON;
import static alpha.haka.message.MediaTypes.TEXT_HTML;
import static alpha.haka.message.MediaTypes.TEXT_PLAIN;
import static java.lang.System.Logger.Level.ERROR;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * An outbound HTTP response.<p>
 * 
 * A new response has status code 200, one header "Content-Type: text/plain"
 * and an empty body. The request handler populates the response in place; the
 * server writes it once the handler returns.<p>
 * 
 * Headers are written in insertion order. Setting a header that already exists
 * replaces its value but keeps its position. The server computes
 * "Content-Length" from the body and ignores any value set here.<p>
 * 
 * The implementation is not thread-safe. A response belongs to the one
 * connection it was created for.
 */
public final class Response
{
    private static final Gson GSON = new GsonBuilder().serializeNulls().create();
    
    private static final byte[] EMPTY = new byte[0];
    
    private final System.Logger log;
    private int status;
    private final Map<String, String> headers;
    private byte[] body;
    
    /**
     * Constructs a {@code Response} with default values.<p>
     * 
     * A JSON serialization failure is logged to this package's
     * {@code System.Logger}.
     */
    public Response() {
        this(System.getLogger(Response.class.getPackageName()));
    }
    
    /**
     * Constructs a {@code Response} with default values.
     * 
     * @param log logger of JSON serialization failures
     * @throws NullPointerException if {@code log} is {@code null}
     */
    public Response(System.Logger log) {
        this.log = requireNonNull(log);
        status  = TWO_HUNDRED;
        headers = new LinkedHashMap<>();
        headers.put(CONTENT_TYPE, TEXT_PLAIN);
        body    = EMPTY;
    }
    
    /**
     * Returns the status code.
     * 
     * @return the status code
     */
    public int status() {
        return status;
    }
    
    /**
     * Sets the status code.<p>
     * 
     * Any integer is accepted.
     * 
     * @param code status code
     * @return this
     */
    public Response status(int code) {
        status = code;
        return this;
    }
    
    /**
     * Returns all headers.
     * 
     * @return an unmodifiable view in insertion order
     */
    public Map<String, String> headers() {
        return Collections.unmodifiableMap(headers);
    }
    
    /**
     * Returns the value of a header.
     * 
     * @param name of header (case-sensitive)
     * @return the value, or an empty optional
     */
    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }
    
    /**
     * Sets a header.
     * 
     * @param name of header
     * @param value of header
     * @return this
     * @throws NullPointerException if any argument is {@code null}
     */
    public Response header(String name, String value) {
        headers.put(requireNonNull(name), requireNonNull(value));
        return this;
    }
    
    /**
     * Returns the body.
     * 
     * @return the body (not a copy)
     */
    public byte[] body() {
        return body;
    }
    
    /**
     * Sets the body.
     * 
     * @param bytes body (not copied)
     * @return this
     * @throws NullPointerException if {@code bytes} is {@code null}
     */
    public Response body(byte[] bytes) {
        body = requireNonNull(bytes);
        return this;
    }
    
    /**
     * Sets the body to the UTF-8 encoded text.
     * 
     * @param text body
     * @return this
     * @throws NullPointerException if {@code text} is {@code null}
     */
    public Response body(String text) {
        return body(text.getBytes(UTF_8));
    }
    
    /**
     * Returns the body decoded using UTF-8.
     * 
     * @return the body as text
     */
    public String bodyAsText() {
        return new String(body, UTF_8);
    }
    
    /**
     * Sets a plain text body.<p>
     * 
     * Content-Type is set to "text/plain". The status code is not touched.
     * 
     * @param text body
     * @return this
     */
    public Response text(String text) {
        header(CONTENT_TYPE, TEXT_PLAIN);
        return body(text);
    }
    
    /**
     * Sets an HTML body.<p>
     * 
     * Content-Type is set to "text/html". The status code is not touched.
     * 
     * @param html body
     * @return this
     */
    public Response html(String html) {
        header(CONTENT_TYPE, TEXT_HTML);
        return body(html);
    }
    
    /**
     * Sets a JSON body.<p>
     * 
     * The value is serialized using Gson, nulls included, and Content-Type is
     * set to "application/json". A {@code JsonElement} is written as-is.<p>
     * 
     * If serialization fails, the failure is logged and this response becomes
     * a 500 (Internal Server Error) with a plain text body.
     * 
     * @param value to serialize (may be {@code null})
     * @return this
     */
    public Response json(Object value) {
        final String json;
        try {
            json = GSON.toJson(value);
        } catch (RuntimeException e) {
            log.log(ERROR, "JSON serialization failed.", e);
            status(FIVE_HUNDRED);
            return text(INTERNAL_SERVER_ERROR);
        }
        header(CONTENT_TYPE, APPLICATION_JSON);
        return body(json);
    }
    
    @Override
    public String toString() {
        return Response.class.getSimpleName() + "{" +
                "status=" + status +
                ", headers=" + headers +
                ", body=" + body.length + " bytes}";
    }
}
