package alpha.haka.internal;

import alpha.haka.Config;
import alpha.haka.HttpServer;
import alpha.haka.testutil.Logging;
import alpha.haka.testutil.TestClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.io.IOException;
import java.util.List;
import java.util.logging.Logger;
import java.util.logging.LogRecord;

import static java.util.logging.Level.INFO;
import static java.util.logging.Level.SEVERE;
import static java.util.stream.Collectors.toList;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Will setup a {@link #server()} and a {@link #client()}, the latter configured
 * with the server's port. Both scoped to each test.<p>
 * 
 * The server has no routes added and so most test cases will have to add
 * those in manually. Routes may be added after the server has started, as
 * long as no request is in flight.<p>
 * 
 * Log recording is activated before starting the server. The recorder can be
 * retrieved using {@link #logRecorder()}. By default, after-each asserts that
 * no record of level SEVERE (ERROR) was logged. Tests that expect errors must
 * call {@link #allowErrors()}.
 */
abstract class AbstractEndToEndTest
{
    final Logger LOG = Logger.getLogger(getClass().getPackageName());
    
    private Logging.Recorder key;
    private HttpServer server;
    private TestClient client;
    private boolean errorsAllowed;
    
    @BeforeEach
    void start(TestInfo test) throws IOException {
        LOG.log(INFO, "Executing " + test.getDisplayName());
        key = Logging.startRecording();
        server = HttpServer.create(config()).start();
        client = new TestClient(server);
    }
    
    @AfterEach
    void stopNow(TestInfo test) throws IOException {
        server.stopNow();
        List<LogRecord> errors = Logging.stopRecording(key)
                .filter(r -> r.getLevel().equals(SEVERE))
                .collect(toList());
        if (!errorsAllowed) {
            assertThat(errors).extracting(LogRecord::getMessage).isEmpty();
        }
        LOG.log(INFO, "Finished " + test.getDisplayName());
    }
    
    /**
     * Returns the configuration of the server.<p>
     * 
     * Subclasses may override.
     * 
     * @return the configuration of the server
     */
    Config config() {
        return Config.DEFAULT;
    }
    
    /**
     * Returns the server instance.
     * 
     * @return the server instance
     */
    final HttpServer server() {
        return server;
    }
    
    /**
     * Returns the client instance.
     * 
     * @return the client instance
     */
    final TestClient client() {
        return client;
    }
    
    /**
     * Returns the log recorder.
     * 
     * @return the log recorder
     */
    final Logging.Recorder logRecorder() {
        return key;
    }
    
    /**
     * Do not fail the test because of logged errors.
     */
    final void allowErrors() {
        errorsAllowed = true;
    }
}
