package alpha.haka.message;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * An inbound HTTP request.<p>
 * 
 * The request carries the method token and the path exactly as they appeared
 * on the request-line, and the headers that followed. The HTTP version is not
 * retained and a request body is never read.<p>
 * 
 * Header names keep the case they were received in. If the same name occurs
 * more than once, the last value wins. Iteration order is the order of
 * arrival.<p>
 * 
 * The implementation is immutable.
 */
public final class Request
{
    private final String method;
    private final String path;
    private final Map<String, String> headers;
    
    /**
     * Constructs a {@code Request} without headers.
     * 
     * @param method request method
     * @param path request path
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public Request(String method, String path) {
        this(method, path, Map.of());
    }
    
    /**
     * Constructs a {@code Request}.<p>
     * 
     * The given headers are copied.
     * 
     * @param method request method
     * @param path request path
     * @param headers request headers
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public Request(String method, String path, Map<String, String> headers) {
        this.method  = requireNonNull(method);
        this.path    = requireNonNull(path);
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }
    
    /**
     * Returns the request method, e.g. "GET".
     * 
     * @return the request method
     */
    public String method() {
        return method;
    }
    
    /**
     * Returns the request path, e.g. "/hello".
     * 
     * @return the request path
     */
    public String path() {
        return path;
    }
    
    /**
     * Returns all headers.
     * 
     * @return an unmodifiable map in order of arrival
     */
    public Map<String, String> headers() {
        return headers;
    }
    
    /**
     * Returns the value of a header.<p>
     * 
     * An exact match of the name is preferred. If there is none, the first
     * header whose name equals the given name ignoring case is returned.
     * 
     * @param name of header
     * 
     * @return the value, or an empty optional
     */
    public Optional<String> header(String name) {
        String v = headers.get(name);
        if (v != null) {
            return Optional.of(v);
        }
        return headers.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(name))
                .map(Map.Entry::getValue)
                .findFirst();
    }
    
    /**
     * Returns {@code true} if the path starts with the given prefix.
     * 
     * @param prefix to test
     * 
     * @return see javadoc
     */
    public boolean pathStartsWith(String prefix) {
        return path.startsWith(prefix);
    }
    
    /**
     * Returns the part of the path that follows the given prefix.<p>
     * 
     * If the path equals the prefix, "/" is returned. If the path does not
     * start with the prefix, the path is returned unchanged.
     * 
     * @param prefix to strip
     * 
     * @return the remaining path
     */
    public String pathAfterPrefix(String prefix) {
        if (!path.startsWith(prefix)) {
            return path;
        }
        String rest = path.substring(prefix.length());
        return rest.isEmpty() ? "/" : rest;
    }
    
    @Override
    public String toString() {
        return method + " " + path;
    }
}
