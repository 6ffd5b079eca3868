package alpha.haka.route;

import alpha.haka.message.Request;

import java.nio.file.Path;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A URL prefix mapped to a directory in the file system.
 * 
 * @see Router#serveStatic(String, Path)
 */
public final class StaticMount
{
    private final String urlPrefix;
    private final Path root;
    
    /**
     * Constructs a {@code StaticMount}.<p>
     * 
     * The prefix is {@linkplain RoutePaths#normalize(String) normalized}. The
     * root is not validated; it may not even exist.
     * 
     * @param urlPrefix URL prefix
     * @param root directory
     * 
     * @throws NullPointerException if {@code root} is {@code null}
     */
    public StaticMount(String urlPrefix, Path root) {
        this.urlPrefix = RoutePaths.normalize(urlPrefix);
        this.root = requireNonNull(root);
    }
    
    /**
     * Returns the normalized URL prefix.
     * 
     * @return the normalized URL prefix
     */
    public String urlPrefix() {
        return urlPrefix;
    }
    
    /**
     * Returns the directory.
     * 
     * @return the directory
     */
    public Path root() {
        return root;
    }
    
    /**
     * Returns {@code true} if the path of the given request falls under this
     * mount.<p>
     * 
     * That is the case if the path equals the prefix or continues it with a
     * "/". The prefix "/" covers all paths.
     * 
     * @param request to test
     * 
     * @return see javadoc
     */
    public boolean covers(Request request) {
        if (urlPrefix.equals("/")) {
            return request.pathStartsWith("/");
        }
        return request.path().equals(urlPrefix) ||
               request.pathStartsWith(urlPrefix + "/");
    }
    
    /**
     * Returns the part of a covered path that names a file relative to the
     * root.<p>
     * 
     * The result starts with "/". If nothing follows the prefix, or only a
     * "/" does, the result is "/index.html".
     * 
     * @param request a covered request
     * 
     * @return the sub path
     */
    public String subPath(Request request) {
        String sub = urlPrefix.equals("/") ?
                request.path() : request.pathAfterPrefix(urlPrefix);
        return sub.isEmpty() || sub.equals("/") ? "/index.html" : sub;
    }
    
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof StaticMount)) {
            return false;
        }
        StaticMount other = (StaticMount) obj;
        return urlPrefix.equals(other.urlPrefix) && root.equals(other.root);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(urlPrefix, root);
    }
    
    @Override
    public String toString() {
        return StaticMount.class.getSimpleName() + "{" +
                "urlPrefix='" + urlPrefix + '\'' +
                ", root=" + root + '}';
    }
}
