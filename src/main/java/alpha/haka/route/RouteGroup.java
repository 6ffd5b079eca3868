package alpha.haka.route;

import alpha.haka.handler.RequestHandler;

import java.util.function.Consumer;

import static alpha.haka.HttpConstants.Method.GET;
import static alpha.haka.HttpConstants.Method.POST;

/**
 * A scope in which routes are registered under a common prefix.<p>
 * 
 * A group is handed to the configuration callback of {@link
 * Router#group(String, Consumer)} and is only valid for the duration of that
 * call. Using it afterwards throws an {@code IllegalStateException}.<p>
 * 
 * Groups do not apply to static mounts.
 */
public interface RouteGroup
{
    /**
     * Returns the normalized prefix of this group, including the prefixes of
     * all enclosing groups.
     * 
     * @return the prefix
     */
    String prefix();
    
    /**
     * Register a route under this group's prefix.
     * 
     * @param method request method
     * @param path relative to the prefix
     * @param handler of requests
     * 
     * @return this
     * 
     * @throws NullPointerException if {@code method} or {@code handler} is {@code null}
     * @throws IllegalStateException if the group's callback has returned
     */
    RouteGroup add(String method, String path, RequestHandler handler);
    
    /**
     * Register a GET route under this group's prefix.
     * 
     * @param path relative to the prefix
     * @param handler of requests
     * 
     * @return this
     * 
     * @see #add(String, String, RequestHandler)
     */
    default RouteGroup get(String path, RequestHandler handler) {
        return add(GET, path, handler);
    }
    
    /**
     * Register a POST route under this group's prefix.
     * 
     * @param path relative to the prefix
     * @param handler of requests
     * 
     * @return this
     * 
     * @see #add(String, String, RequestHandler)
     */
    default RouteGroup post(String path, RequestHandler handler) {
        return add(POST, path, handler);
    }
    
    /**
     * Open a nested group.<p>
     * 
     * The nested group's prefix is this group's prefix joined with the given
     * prefix.
     * 
     * @param prefix relative to this group's prefix
     * @param config invoked synchronously with the nested group
     * 
     * @return this
     * 
     * @throws NullPointerException if {@code config} is {@code null}
     * @throws IllegalStateException if the group's callback has returned
     */
    RouteGroup group(String prefix, Consumer<RouteGroup> config);
}
