package alpha.haka.examples;

import alpha.haka.HttpServer;
import alpha.haka.testutil.TestClient;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static alpha.haka.testutil.TestClient.CRLF;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the routes of {@link HakaDemo} against a real server.
 */
class HakaDemoTest
{
    HttpServer server;
    TestClient client;
    
    @BeforeEach
    void start() throws IOException {
        server = HakaDemo.create(HakaDemo.config()).start();
        client = new TestClient(server);
    }
    
    @AfterEach
    void stop() throws IOException {
        server.stopNow();
    }
    
    @Test
    void debug_flag() {
        assertThat(HakaDemo.config().logLevel()).isEqualTo(INFO);
        assertThat(HakaDemo.config("-x", "-debug").logLevel()).isEqualTo(DEBUG);
    }
    
    @Test
    void welcome() throws IOException {
        assertThat(get("/")).isEqualTo(
            "HTTP/1.1 200 OK" + CRLF +
            "Content-Type: text/plain" + CRLF +
            "Content-Length: 23" + CRLF + CRLF +
            
            "Welcome to Haka Server!");
    }
    
    @Test
    void hello_is_html() throws IOException {
        assertThat(get("/hello"))
            .contains("Content-Type: text/html" + CRLF)
            .endsWith("<h1>Hello, Haka!</h1><p>This is an HTML response from the /hello route.</p>");
    }
    
    @Test
    void status() throws IOException {
        JsonObject o = JsonParser.parseString(body(get("/status"))).getAsJsonObject();
        assertThat(o.get("title").getAsString()).isEqualTo("Server Status");
        assertThat(o.get("message").getAsString()).isEqualTo("Haka server is operational and ready!");
    }
    
    @Test
    void product() throws IOException {
        String res = get("/product/1");
        assertThat(res).contains("Content-Type: application/json" + CRLF);
        assertThat(body(res)).isEqualTo("{\"id\":101,\"name\":\"Example Gadget\",\"price\":19.99}");
    }
    
    @Test
    void fifteen_products() throws IOException {
        JsonArray arr = JsonParser.parseString(body(get("/json"))).getAsJsonArray();
        assertThat(arr).hasSize(15);
        for (int i = 0; i < 15; ++i) {
            JsonObject p = arr.get(i).getAsJsonObject();
            assertThat(p.get("id").getAsInt()).isEqualTo(i + 1);
            assertThat(p.get("name").getAsString()).isEqualTo("Product " + (i + 1));
            assertThat(p.get("price").getAsDouble()).isBetween(1.0, 100.0);
        }
    }
    
    @Test
    void mounted_users() throws IOException {
        assertThat(body(get("/api/users/list"))).isEqualTo(
            "[{\"id\":1,\"name\":\"Alice\"},{\"id\":2,\"name\":\"Bob\"},{\"id\":3,\"name\":\"Charlie\"}]");
        assertThat(body(get("/api/users/profile/")))
            .contains("\"title\":\"User Profile\"");
    }
    
    @Test
    void info_lists_routes() throws IOException {
        assertThat(get("/info"))
            .contains("Content-Type: text/html" + CRLF)
            .contains("<a href=\"/api/users/list\">");
    }
    
    private String get(String path) throws IOException {
        return client.writeRead("GET " + path + " HTTP/1.1" + CRLF + CRLF);
    }
    
    private static String body(String response) {
        return response.substring(response.indexOf(CRLF + CRLF) + 4);
    }
}
