package alpha.haka;

import alpha.haka.handler.RequestHandler;
import alpha.haka.internal.DefaultServer;
import alpha.haka.route.RouteGroup;
import alpha.haka.route.Router;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.file.Path;
import java.util.function.Consumer;

import static java.net.InetAddress.getLoopbackAddress;

/**
 * Listens on a port for HTTP connections and serves one request per
 * connection.<p>
 * 
 * The server owns a {@link Router}. Routes and static mounts are added before
 * the server starts, either through {@link #router()} or through the
 * delegating methods on this interface.<p>
 * 
 * All I/O completions and all request handlers run on one event loop thread,
 * named after {@link Config#threadName()}. Each connection reads a request
 * head, dispatches it, writes the response and closes. There are no timeouts
 * and no limit on the number of open connections.<p>
 * 
 * {@code start} returns as soon as the server is listening. {@code run}
 * starts the server and blocks until it has stopped.
 * 
 * <pre>
 *   HttpServer.create()
 *             .get("/hello", (req, res) -&gt; res.text("Hello World!"))
 *             .run(8080);
 * </pre>
 */
public interface HttpServer
{
    /**
     * Create a server using {@linkplain Config#DEFAULT default
     * configuration}.
     * 
     * @return a new server, not started
     */
    static HttpServer create() {
        return create(Config.DEFAULT);
    }
    
    /**
     * Create a server.
     * 
     * @param config of server
     * 
     * @return a new server, not started
     * 
     * @throws NullPointerException if {@code config} is {@code null}
     */
    static HttpServer create(Config config) {
        return new DefaultServer(config);
    }
    
    /**
     * Returns the router of this server.
     * 
     * @return the router of this server
     */
    Router router();
    
    /**
     * Returns the configuration of this server.
     * 
     * @return the configuration of this server
     */
    Config getConfig();
    
    /**
     * Register a route.
     * 
     * @param method request method
     * @param path request path
     * @param handler of requests
     * 
     * @return this
     * 
     * @see Router#add(String, String, RequestHandler)
     */
    default HttpServer add(String method, String path, RequestHandler handler) {
        router().add(method, path, handler);
        return this;
    }
    
    /**
     * Register a GET route.
     * 
     * @param path request path
     * @param handler of requests
     * 
     * @return this
     * 
     * @see Router#get(String, RequestHandler)
     */
    default HttpServer get(String path, RequestHandler handler) {
        router().get(path, handler);
        return this;
    }
    
    /**
     * Register a POST route.
     * 
     * @param path request path
     * @param handler of requests
     * 
     * @return this
     * 
     * @see Router#post(String, RequestHandler)
     */
    default HttpServer post(String path, RequestHandler handler) {
        router().post(path, handler);
        return this;
    }
    
    /**
     * Serve files from a directory.
     * 
     * @param urlPrefix URL prefix
     * @param root directory
     * 
     * @return this
     * 
     * @see Router#serveStatic(String, Path)
     */
    default HttpServer serveStatic(String urlPrefix, Path root) {
        router().serveStatic(urlPrefix, root);
        return this;
    }
    
    /**
     * Serve files from a directory.
     * 
     * @param urlPrefix URL prefix
     * @param root directory
     * 
     * @return this
     * 
     * @see Router#serveStatic(String, String)
     */
    default HttpServer serveStatic(String urlPrefix, String root) {
        router().serveStatic(urlPrefix, root);
        return this;
    }
    
    /**
     * Register routes under a common prefix.
     * 
     * @param prefix of all routes in the group
     * @param config registers routes through the given group
     * 
     * @return this
     * 
     * @see Router#group(String, Consumer)
     */
    default HttpServer group(String prefix, Consumer<RouteGroup> config) {
        router().group(prefix, config);
        return this;
    }
    
    /**
     * Copy all routes and static mounts of another router into this server's
     * router.
     * 
     * @param prefix of all copied routes and static mounts
     * @param other router to copy from
     * 
     * @return this
     * 
     * @see Router#mount(String, Router)
     */
    default HttpServer mount(String prefix, Router other) {
        router().mount(prefix, other);
        return this;
    }
    
    /**
     * Listen on a system-picked port of the loopback address.<p>
     * 
     * The server is reachable only from the local machine. Use {@link
     * #getPort()} to find out which port was picked.
     * 
     * @return this
     * 
     * @throws IllegalStateException if the server is already running
     * @throws IOException if an I/O error occurs
     */
    default HttpServer start() throws IOException {
        return start(new InetSocketAddress(getLoopbackAddress(), 0));
    }
    
    /**
     * Listen on a port of the wildcard address.
     * 
     * @param port to listen on
     * 
     * @return this
     * 
     * @throws IllegalStateException if the server is already running
     * @throws IOException if an I/O error occurs
     */
    default HttpServer start(int port) throws IOException {
        return start(new InetSocketAddress(port));
    }
    
    /**
     * Listen on a port of the given host.
     * 
     * @param hostname to bind
     * @param port to listen on
     * 
     * @return this
     * 
     * @throws IllegalStateException if the server is already running
     * @throws IOException if an I/O error occurs
     */
    default HttpServer start(String hostname, int port) throws IOException {
        return start(new InetSocketAddress(hostname, port));
    }
    
    /**
     * Listen on the given address.<p>
     * 
     * This method returns as soon as the server is listening.
     * 
     * @param address to bind
     * 
     * @return this
     * 
     * @throws NullPointerException if {@code address} is {@code null}
     * @throws IllegalStateException if the server is already running
     * @throws IOException if an I/O error occurs
     */
    HttpServer start(SocketAddress address) throws IOException;
    
    /**
     * Listen on a port of the wildcard address and block until the server has
     * stopped.
     * 
     * @param port to listen on
     * 
     * @throws IllegalStateException if the server is already running
     * @throws IOException if an I/O error occurs
     * @throws InterruptedException if interrupted while waiting
     */
    default void run(int port) throws IOException, InterruptedException {
        run(new InetSocketAddress(port));
    }
    
    /**
     * Listen on the given address and block until the server has stopped.
     * 
     * @param address to bind
     * 
     * @throws NullPointerException if {@code address} is {@code null}
     * @throws IllegalStateException if the server is already running
     * @throws IOException if an I/O error occurs
     * @throws InterruptedException if interrupted while waiting
     */
    void run(SocketAddress address) throws IOException, InterruptedException;
    
    /**
     * Stop listening.<p>
     * 
     * Connections already accepted are allowed to complete. The event loop
     * terminates when the last one has closed.<p>
     * 
     * Is NOP if the server is not running.
     * 
     * @throws IOException if closing the listener fails
     */
    void stop() throws IOException;
    
    /**
     * Stop listening and close all open connections.<p>
     * 
     * Is NOP if the server is not running.
     * 
     * @throws IOException if an I/O error occurs
     */
    void stopNow() throws IOException;
    
    /**
     * Returns {@code true} if the server is listening.
     * 
     * @return see javadoc
     */
    boolean isRunning();
    
    /**
     * Returns the address the server is listening on.
     * 
     * @return the address the server is listening on
     * 
     * @throws IllegalStateException if the server is not running
     * @throws IOException if an I/O error occurs
     */
    InetSocketAddress getLocalAddress() throws IOException;
    
    /**
     * Returns the port the server is listening on.
     * 
     * @return the port the server is listening on
     * 
     * @throws IllegalStateException if the server is not running
     * @throws IOException if an I/O error occurs
     */
    default int getPort() throws IOException {
        return getLocalAddress().getPort();
    }
}
