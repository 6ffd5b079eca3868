package alpha.haka.testutil;

import alpha.haka.HttpServer;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;

import static java.net.InetAddress.getLoopbackAddress;
import static java.nio.ByteBuffer.allocate;
import static java.nio.ByteBuffer.wrap;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * A utility API on top of a blocking {@code SocketChannel}.<p>
 * 
 * This class provides low-level access for test cases that need direct control
 * over what bytes are put on the wire and monitor what is received. This class
 * has no knowledge about the HTTP protocol.<p>
 * 
 * Each exchange opens a new connection, writes the request and then reads
 * until the server closes the connection. Since the server closes after every
 * response, what is returned is exactly one response.<p>
 * 
 * An exchange that takes longer than 3 seconds is aborted by closing the
 * channel, which fails the blocked read.
 */
public final class TestClient
{
    /**
     * An HTTP newline.
     */
    public static final String CRLF = "\r\n";
    
    private static final ScheduledExecutorService TIMER =
            Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "test-client-timer");
                t.setDaemon(true);
                return t;
            });
    
    private final int port;
    
    /**
     * Constructs a {@code TestClient} connecting to the given server.
     * 
     * @param server client should connect to
     * @throws IOException if an I/O error occurs
     */
    public TestClient(HttpServer server) throws IOException {
        this(server.getPort());
    }
    
    /**
     * Constructs a {@code TestClient} connecting to the given loopback port.
     * 
     * @param port of server
     */
    public TestClient(int port) {
        this.port = port;
    }
    
    /**
     * Write the UTF-8 encoded request and read the response as UTF-8.
     * 
     * @param request to write
     * 
     * @return the response
     * 
     * @throws IOException if an I/O error occurs, or 3 seconds passes
     */
    public String writeRead(String request) throws IOException {
        return new String(writeRead(request.getBytes(UTF_8)), UTF_8);
    }
    
    /**
     * Write the request bytes and read until end-of-stream.
     * 
     * @param request bytes to write
     * 
     * @return the response
     * 
     * @throws IOException if an I/O error occurs, or 3 seconds passes
     */
    public byte[] writeRead(byte[] request) throws IOException {
        try (SocketChannel ch = open()) {
            ScheduledFuture<?> timeout = TIMER.schedule(() -> {
                ch.close();
                return null;
            }, 3, SECONDS);
            try {
                ByteBuffer out = wrap(request);
                while (out.hasRemaining()) {
                    ch.write(out);
                }
                return readUntilEOS(ch);
            } finally {
                timeout.cancel(false);
            }
        }
    }
    
    /**
     * Open a connection and immediately close it without writing anything.
     * 
     * @throws IOException if an I/O error occurs
     */
    public void connectAndClose() throws IOException {
        open().close();
    }
    
    private SocketChannel open() throws IOException {
        return SocketChannel.open(new InetSocketAddress(getLoopbackAddress(), port));
    }
    
    private static byte[] readUntilEOS(SocketChannel ch) throws IOException {
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        ByteBuffer buf = allocate(512);
        while (ch.read(buf) != -1) {
            buf.flip();
            sink.write(buf.array(), 0, buf.limit());
            buf.clear();
        }
        return sink.toByteArray();
    }
}
