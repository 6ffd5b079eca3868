package alpha.haka.internal;

import alpha.haka.Config;
import alpha.haka.HttpServer;
import alpha.haka.testutil.TestClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static alpha.haka.testutil.TestClient.CRLF;
import static java.net.InetAddress.getLoopbackAddress;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Lifecycle tests of {@link DefaultServer}.
 */
class DefaultServerTest
{
    HttpServer testee = HttpServer.create();
    
    @AfterEach
    void stop() throws IOException {
        testee.stopNow();
    }
    
    @Test
    void not_running() {
        assertThat(testee.isRunning()).isFalse();
        assertThatThrownBy(testee::getLocalAddress)
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("Server is not running.");
    }
    
    @Test
    void start_on_system_picked_loopback_port() throws IOException {
        testee.start();
        assertThat(testee.isRunning()).isTrue();
        assertThat(testee.getLocalAddress().getAddress()).isEqualTo(getLoopbackAddress());
        assertThat(testee.getPort()).isPositive();
    }
    
    @Test
    void start_twice() throws IOException {
        testee.start();
        assertThatThrownBy(testee::start)
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("Already started.");
    }
    
    @Test
    void stop_is_idempotent_and_server_restartable() throws IOException {
        testee.stop();
        testee.start();
        testee.stop();
        testee.stop();
        assertThat(testee.isRunning()).isFalse();
        
        testee.get("/", (req, res) -> res.text("again"));
        testee.start();
        assertThat(new TestClient(testee).writeRead("GET / HTTP/1.1" + CRLF + CRLF))
                .endsWith("again");
    }
    
    @Test
    void handlers_run_on_named_event_loop() throws IOException {
        testee = HttpServer.create(Config.configuration().threadName("loop-x").build());
        AtomicReference<String> thread = new AtomicReference<>();
        testee.get("/", (req, res) -> thread.set(Thread.currentThread().getName()));
        testee.start();
        
        new TestClient(testee).writeRead("GET / HTTP/1.1" + CRLF + CRLF);
        assertThat(thread.get()).isEqualTo("loop-x");
    }
    
    @Test
    void run_blocks_until_stopped() throws Exception {
        CompletableFuture<Void> running = CompletableFuture.runAsync(() -> {
            try {
                testee.run(new InetSocketAddress(getLoopbackAddress(), 0));
            } catch (IOException | InterruptedException e) {
                throw new RuntimeException(e);
            }
        });
        
        long deadline = System.nanoTime() + SECONDS.toNanos(3);
        while (!testee.isRunning()) {
            assertThat(System.nanoTime()).isLessThan(deadline);
            Thread.sleep(10);
        }
        assertThat(running).isNotDone();
        
        testee.stop();
        running.get(3, SECONDS);
    }
    
    @Test
    void router_is_owned_by_server() {
        testee.get("/a", (req, res) -> {});
        assertThat(testee.router().routes()).containsOnlyKeys("GET /a");
    }
}
