package alpha.haka.examples;

import alpha.haka.Config;
import alpha.haka.HttpServer;
import alpha.haka.message.JsonMessage;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

/**
 * A demo application exercising text, HTML and JSON responses, a route group,
 * a mounted router and static files.<p>
 * 
 * The server listens on 127.0.0.1:8080. Static files are served from the
 * directory "public" in the working directory, under "/static". Pass
 * {@code -debug} to log at level DEBUG.
 */
public final class HakaDemo
{
    private static final System.Logger LOG = System.getLogger(HakaDemo.class.getPackageName());
    
    private static final String INFO_PAGE = """
            <!DOCTYPE html>
            <html lang="en">
            <head>
                <meta charset="UTF-8">
                <title>Haka Server Info</title>
                <style>
                    body { font-family: sans-serif; margin: 20px; }
                    ul { list-style: none; padding: 0; }
                    li { margin-bottom: 10px; }
                </style>
            </head>
            <body>
                <h1>Haka Server Info</h1>
                <p>Available Routes:</p>
                <ul>
                    <li><a href="/">GET /</a> - Welcome Message</li>
                    <li><a href="/hello">GET /hello</a> - HTML Greeting</li>
                    <li><a href="/status">GET /status</a> - Server Status (JSON)</li>
                    <li><a href="/product/1">GET /product/1</a> - Example Product (JSON)</li>
                    <li><a href="/info">GET /info</a> - This Info Page (HTML)</li>
                    <li><a href="/json">GET /json</a> - 15 Products List (JSON)</li>
                    <li><a href="/api/users/list">GET /api/users/list</a> - List Users (JSON)</li>
                    <li><a href="/api/users/profile">GET /api/users/profile</a> - User Profile (JSON)</li>
                    <li><a href="/static/">Static Files</a> - Served from ./public/</li>
                </ul>
            </body>
            </html>
            """;
    
    private HakaDemo() {
        // Empty
    }
    
    /**
     * A product.
     */
    static final class Product {
        final int id;
        final String name;
        final double price;
        
        Product(int id, String name, double price) {
            this.id = id;
            this.name = name;
            this.price = price;
        }
    }
    
    /**
     * Application entry point.
     * 
     * @param args "-debug" to enable debug logging
     * 
     * @throws IOException if the server fails to start
     * @throws InterruptedException if interrupted while running
     */
    public static void main(String... args) throws IOException, InterruptedException {
        HttpServer server = create(config(args));
        LOG.log(INFO, "Starting Haka server on 127.0.0.1:8080.");
        server.run(new InetSocketAddress("127.0.0.1", 8080));
    }
    
    /**
     * Returns the configuration for the given command line arguments.
     * 
     * @param args command line arguments
     * 
     * @return a configuration
     */
    static Config config(String... args) {
        if (Arrays.asList(args).contains("-debug")) {
            LOG.log(INFO, "Debug logging enabled.");
            return Config.configuration().logLevel(DEBUG).build();
        }
        return Config.DEFAULT;
    }
    
    /**
     * Creates the demo server, with all routes added, not started.
     * 
     * @param config of server
     * 
     * @return the server
     */
    static HttpServer create(Config config) {
        HttpServer server = HttpServer.create(config);
        
        server.get("/", (req, res) -> res.text("Welcome to Haka Server!"));
        
        server.get("/hello", (req, res) -> res.html(
                "<h1>Hello, Haka!</h1><p>This is an HTML response from the /hello route.</p>"));
        
        server.get("/status", (req, res) -> res.json(new JsonMessage(
                "Server Status",
                "Haka server is operational and ready!")));
        
        server.group("/product", products ->
                products.get("/1", (req, res) ->
                        res.json(new Product(101, "Example Gadget", 19.99))));
        
        server.get("/info", (req, res) -> res.html(INFO_PAGE));
        
        server.get("/json", (req, res) -> res.json(randomProducts(15)));
        
        server.mount("/api/users", UserApi.createRouter());
        
        server.serveStatic("/static", "./public");
        
        return server;
    }
    
    private static List<Product> randomProducts(int n) {
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        List<Product> products = new ArrayList<>(n);
        for (int i = 1; i <= n; ++i) {
            double price = Math.round(rnd.nextDouble(1.0, 100.0) * 100.0) / 100.0;
            products.add(new Product(i, "Product " + i, price));
        }
        return products;
    }
}
