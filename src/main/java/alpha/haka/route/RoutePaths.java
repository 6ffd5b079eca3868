package alpha.haka.route;

/**
 * Normalization of route paths.<p>
 * 
 * A normalized path starts with "/" and does not end with "/", unless the
 * path is exactly "/".
 */
public final class RoutePaths
{
    private RoutePaths() {
        // Empty
    }
    
    /**
     * Normalize a path.<p>
     * 
     * A missing leading "/" is added and all trailing "/" are removed, unless
     * the result would be empty. The function is total and idempotent.
     * 
     * <pre>
     *   normalize(null)     = "/"
     *   normalize("")       = "/"
     *   normalize("a/b/")   = "/a/b"
     *   normalize("/a/b//") = "/a/b"
     *   normalize("/")      = "/"
     * </pre>
     * 
     * @param path to normalize (may be {@code null})
     * 
     * @return the normalized path
     */
    public static String normalize(String path) {
        String p = path == null ? "" : path;
        if (!p.startsWith("/")) {
            p = "/" + p;
        }
        int end = p.length();
        while (end > 1 && p.charAt(end - 1) == '/') {
            --end;
        }
        return p.substring(0, end);
    }
    
    /**
     * Join a prefix and a path.<p>
     * 
     * Both are normalized before concatenation and the result is normalized.
     * A prefix of "/" contributes nothing.
     * 
     * <pre>
     *   join("/api", "users")  = "/api/users"
     *   join("/api/", "/")     = "/api"
     *   join("/", "/users")    = "/users"
     * </pre>
     * 
     * @param prefix to prepend (may be {@code null})
     * @param path to append (may be {@code null})
     * 
     * @return the normalized concatenation
     */
    public static String join(String prefix, String path) {
        String pre = normalize(prefix);
        if (pre.equals("/")) {
            return normalize(path);
        }
        return normalize(pre + normalize(path));
    }
}
