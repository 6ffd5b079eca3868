package alpha.haka.examples;

import alpha.haka.HttpServer;
import alpha.haka.handler.RequestHandler;
import alpha.haka.handler.RequestHandlers;

import java.io.IOException;

/**
 * Responds "Hello World!" to client.
 */
public class HelloWorld
{
    /**
     * Application entry point.
     * 
     * @param args ignored
     * 
     * @throws IOException If an I/O error occurs
     */
    public static void main(String... args) throws IOException {
        HttpServer app = HttpServer.create();
        
        // A handler populates the response it is given. This one ignores the
        // request and always responds the same text.
        RequestHandler handler = RequestHandlers.text("Hello World!");
        
        // Requests are matched on method and path. Trailing slashes do not
        // matter, "/hello/" ends up here too.
        app.get("/hello", handler);
        
        /*
         * If we don't supply a port number, the system will pick one on the
         * the loopback address. The server is then reachable only on
         * localhost:{port} and 127.0.0.1:{port}.
         * 
         * start() returns immediately. The event loop thread is not a daemon
         * and keeps the JVM alive until the server is stopped.
         */
        app.start();
        
        System.out.println("Listening on port " + app.getPort() + ".");
    }
}
