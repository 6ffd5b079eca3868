package alpha.haka.route;

import alpha.haka.handler.RequestHandler;
import alpha.haka.handler.RequestHandlers;
import alpha.haka.handler.StaticFileHandler;
import alpha.haka.message.Request;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Router}.
 * 
 * @implNote
 * Routes are stored in a hash map keyed by "METHOD /normalized/path", which
 * makes the explicit lookup a single map access. Static mounts are few and
 * scanned linearly.<p>
 * 
 * A static file request is resolved against the absolute, normalized root. The
 * result is first checked lexically, then, if both paths exist, checked again
 * after resolving symbolic links. Containment is tested on whole path
 * components, so a root "/srv/www" does not contain "/srv/www-private".
 */
final class DefaultRouter implements Router
{
    private final System.Logger log;
    private final Map<String, RequestHandler> routes;
    private final List<StaticMount> mounts;
    
    DefaultRouter(System.Logger log) {
        this.log    = requireNonNull(log);
        this.routes = new LinkedHashMap<>();
        this.mounts = new ArrayList<>();
    }
    
    @Override
    public Router add(String method, String path, RequestHandler handler) {
        put(method, RoutePaths.normalize(path), handler);
        return this;
    }
    
    @Override
    public Router serveStatic(String urlPrefix, Path root) {
        addMount(new StaticMount(urlPrefix, root));
        return this;
    }
    
    @Override
    public Router group(String prefix, Consumer<RouteGroup> config) {
        new Scope(RoutePaths.normalize(prefix)).run(config);
        return this;
    }
    
    @Override
    public Router mount(String prefix, Router other) {
        requireNonNull(other);
        // Snapshot first, the other router may be this router
        var copyRoutes = new ArrayList<>(other.routes().entrySet());
        var copyMounts = new ArrayList<>(other.staticMounts());
        
        for (var e : copyRoutes) {
            String key = e.getKey();
            int sp = key.indexOf(' ');
            put(key.substring(0, sp),
                RoutePaths.join(prefix, key.substring(sp + 1)),
                e.getValue());
        }
        
        for (StaticMount m : copyMounts) {
            addMount(new StaticMount(RoutePaths.join(prefix, m.urlPrefix()), m.root()));
        }
        
        return this;
    }
    
    @Override
    public RequestHandler match(Request request) {
        final String path = request.path();
        
        for (StaticMount m : mounts) {
            if (!m.covers(request)) {
                continue;
            }
            RequestHandler h = resolveStatic(m, request);
            if (h != null) {
                return h;
            }
        }
        
        String key = request.method() + " " + RoutePaths.normalize(path);
        RequestHandler h = routes.get(key);
        if (h != null) {
            log.log(DEBUG, () -> "Matched route: " + key);
            return h;
        }
        
        log.log(DEBUG, () -> "No match: " + request);
        return RequestHandlers.notFound();
    }
    
    @Override
    public Map<String, RequestHandler> routes() {
        return Collections.unmodifiableMap(routes);
    }
    
    @Override
    public List<StaticMount> staticMounts() {
        return Collections.unmodifiableList(mounts);
    }
    
    private void put(String method, String normalizedPath, RequestHandler handler) {
        requireNonNull(method);
        requireNonNull(handler);
        String key = method + " " + normalizedPath;
        if (routes.put(key, handler) == null) {
            log.log(INFO, () -> "Added route: " + key);
        } else {
            log.log(INFO, () -> "Replaced route: " + key);
        }
    }
    
    private void addMount(StaticMount m) {
        mounts.add(m);
        log.log(INFO, () -> "Serving static files: " + m.urlPrefix() + " -> " + m.root());
    }
    
    /**
     * Returns the handler of a static file, an invalid-path handler, or
     * {@code null} if the file does not exist.
     */
    private RequestHandler resolveStatic(StaticMount m, Request request) {
        final String path = request.path(),
                     sub  = m.subPath(request);
        final Path root = m.root().toAbsolutePath().normalize();
        
        final Path file;
        try {
            file = root.resolve(sub.substring(1)).normalize();
        } catch (InvalidPathException e) {
            log.log(WARNING, () -> "Rejected static path: " + path + " (" + e.getMessage() + ")");
            return RequestHandlers.invalidPath();
        }
        
        if (!file.startsWith(root)) {
            log.log(WARNING, () -> "Rejected static path outside of root: " + path);
            return RequestHandlers.invalidPath();
        }
        
        Path serve = file;
        try {
            Path realRoot = root.toRealPath(),
                 realFile = file.toRealPath();
            if (!realFile.startsWith(realRoot)) {
                log.log(WARNING, () -> "Rejected static path linked outside of root: " + path);
                return RequestHandlers.invalidPath();
            }
            serve = realFile;
        } catch (IOException e) {
            log.log(DEBUG, () -> "Not canonicalized: " + file + " (" + e + ")");
        }
        
        if (!Files.isRegularFile(serve)) {
            log.log(DEBUG, () -> "No static file for " + path + " in " + m.urlPrefix());
            return null;
        }
        
        final Path target = serve;
        log.log(DEBUG, () -> "Matched static file: " + target);
        return new StaticFileHandler(target, log);
    }
    
    private final class Scope implements RouteGroup
    {
        private final String prefix;
        private boolean open;
        
        Scope(String prefix) {
            this.prefix = prefix;
        }
        
        void run(Consumer<RouteGroup> config) {
            requireNonNull(config);
            open = true;
            try {
                config.accept(this);
            } finally {
                open = false;
            }
        }
        
        @Override
        public String prefix() {
            return prefix;
        }
        
        @Override
        public RouteGroup add(String method, String path, RequestHandler handler) {
            requireOpen();
            put(method, RoutePaths.join(prefix, path), handler);
            return this;
        }
        
        @Override
        public RouteGroup group(String prefix, Consumer<RouteGroup> config) {
            requireOpen();
            new Scope(RoutePaths.join(this.prefix, prefix)).run(config);
            return this;
        }
        
        private void requireOpen() {
            if (!open) {
                throw new IllegalStateException("Group closed: " + prefix);
            }
        }
    }
}
