package alpha.haka.route;

import alpha.haka.handler.RequestHandler;
import alpha.haka.message.Request;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static alpha.haka.HttpConstants.Method.GET;
import static alpha.haka.HttpConstants.Method.POST;

/**
 * Resolves requests to handlers.<p>
 * 
 * A router holds two tables. Static mounts map a URL prefix to a directory and
 * are consulted first, in the order they were added. Routes map an exact
 * method and {@linkplain RoutePaths#normalize(String) normalized} path to a
 * handler and are consulted second. A request that matches neither is
 * answered with 404 (Not Found).<p>
 * 
 * A static file request whose path would resolve outside of the mounted
 * directory is answered with 400 (Bad Request) "Invalid path." and no other
 * mount or route is consulted.<p>
 * 
 * There is no support for path parameters, wildcards or removal of routes.
 * Registering a route with the same method and path as an existing route
 * replaces the handler.<p>
 * 
 * The implementation is not thread-safe. A router is configured before the
 * server starts and only read thereafter.
 */
public interface Router
{
    /**
     * Creates a new, empty router.
     * 
     * @return a new router
     */
    static Router create() {
        return new DefaultRouter(System.getLogger(Router.class.getPackageName()));
    }
    
    /**
     * Creates a new, empty router that logs to the given logger.
     * 
     * @param log logger to use
     * 
     * @return a new router
     * 
     * @throws NullPointerException if {@code log} is {@code null}
     */
    static Router create(System.Logger log) {
        return new DefaultRouter(log);
    }
    
    /**
     * Register a route.
     * 
     * @param method request method, matched exactly
     * @param path request path, normalized
     * @param handler of requests
     * 
     * @return this
     * 
     * @throws NullPointerException if {@code method} or {@code handler} is {@code null}
     */
    Router add(String method, String path, RequestHandler handler);
    
    /**
     * Register a GET route.
     * 
     * @param path request path
     * @param handler of requests
     * 
     * @return this
     * 
     * @see #add(String, String, RequestHandler)
     */
    default Router get(String path, RequestHandler handler) {
        return add(GET, path, handler);
    }
    
    /**
     * Register a POST route.
     * 
     * @param path request path
     * @param handler of requests
     * 
     * @return this
     * 
     * @see #add(String, String, RequestHandler)
     */
    default Router post(String path, RequestHandler handler) {
        return add(POST, path, handler);
    }
    
    /**
     * Serve files from a directory.<p>
     * 
     * A request for the prefix itself, or the prefix followed by "/", is served
     * the file "index.html" in the directory.
     * 
     * @param urlPrefix URL prefix
     * @param root directory, relative paths resolve against the working
     *             directory at the time of the request
     * 
     * @return this
     * 
     * @throws NullPointerException if {@code root} is {@code null}
     */
    Router serveStatic(String urlPrefix, Path root);
    
    /**
     * Serve files from a directory.
     * 
     * @param urlPrefix URL prefix
     * @param root directory
     * 
     * @return this
     * 
     * @see #serveStatic(String, Path)
     */
    default Router serveStatic(String urlPrefix, String root) {
        return serveStatic(urlPrefix, Path.of(root));
    }
    
    /**
     * Register routes under a common prefix.<p>
     * 
     * The callback is invoked synchronously, before this method returns.
     * 
     * @param prefix of all routes in the group
     * @param config registers routes through the given group
     * 
     * @return this
     * 
     * @throws NullPointerException if {@code config} is {@code null}
     */
    Router group(String prefix, Consumer<RouteGroup> config);
    
    /**
     * Copy all routes and static mounts of another router into this one,
     * under a prefix.<p>
     * 
     * The copy is made once. Changes to the other router after this call are
     * not reflected in this router.
     * 
     * @param prefix of all copied routes and static mounts
     * @param other router to copy from
     * 
     * @return this
     * 
     * @throws NullPointerException if {@code other} is {@code null}
     */
    Router mount(String prefix, Router other);
    
    /**
     * Resolve a request to a handler.<p>
     * 
     * This method never returns {@code null}. If nothing matches, a handler
     * that responds 404 (Not Found) is returned.
     * 
     * @param request to resolve
     * 
     * @return a handler
     * 
     * @throws NullPointerException if {@code request} is {@code null}
     */
    RequestHandler match(Request request);
    
    /**
     * Returns all routes keyed by method and normalized path, separated by a
     * space, e.g. "GET /hello".
     * 
     * @return an unmodifiable map in registration order
     */
    Map<String, RequestHandler> routes();
    
    /**
     * Returns all static mounts.
     * 
     * @return an unmodifiable list in registration order
     */
    List<StaticMount> staticMounts();
}
