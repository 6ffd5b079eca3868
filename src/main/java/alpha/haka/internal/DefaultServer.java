package alpha.haka.internal;

import alpha.haka.Config;
import alpha.haka.HttpServer;
import alpha.haka.route.Router;
import alpha.haka.util.LevelFilteredLogger;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.channels.AsynchronousChannelGroup;
import java.nio.channels.AsynchronousServerSocketChannel;
import java.nio.channels.AsynchronousSocketChannel;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.CompletionHandler;
import java.nio.channels.ShutdownChannelGroupException;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.DAYS;

/**
 * A fully asynchronous implementation of {@code HttpServer}.<p>
 * 
 * @implNote
 * When the server starts, a channel group backed by exactly one thread is
 * created, and an asynchronous server channel is opened in the group and bound
 * to the given address. The server channel is also known as "listener". Each
 * accepted channel, the "child", is handed to a new {@link Connection}.<p>
 * 
 * Since the group has one thread, all completion handlers of the listener and
 * of all children run sequentially on that thread. This is the event loop.
 * Request handlers run on it too.<p>
 * 
 * Stopping closes the listener and shuts down the group. The group terminates
 * once all children have closed, or immediately on {@link #stopNow()}, which
 * closes them. A stopped server can be started again.
 */
public final class DefaultServer implements HttpServer
{
    private final Config config;
    private final System.Logger log;
    private final Router router;
    
    private AsynchronousChannelGroup group;
    private AsynchronousServerSocketChannel listener;
    
    /**
     * Constructs a {@code DefaultServer}.
     * 
     * @param config of server
     * @throws NullPointerException if {@code config} is {@code null}
     */
    public DefaultServer(Config config) {
        this.config = requireNonNull(config);
        this.log    = LevelFilteredLogger.of(DefaultServer.class, config.logLevel());
        this.router = Router.create(LevelFilteredLogger.of(Router.class, config.logLevel()));
    }
    
    @Override
    public Router router() {
        return router;
    }
    
    @Override
    public Config getConfig() {
        return config;
    }
    
    @Override
    public synchronized HttpServer start(SocketAddress address) throws IOException {
        requireNonNull(address);
        if (listener != null) {
            throw new IllegalStateException("Already started.");
        }
        
        final String name = config.threadName();
        AsynchronousChannelGroup g = AsynchronousChannelGroup.withFixedThreadPool(
                1, r -> new Thread(r, name));
        
        AsynchronousServerSocketChannel l;
        try {
            l = AsynchronousServerSocketChannel.open(g).bind(address);
        } catch (IOException | RuntimeException e) {
            g.shutdownNow();
            throw e;
        }
        
        group = g;
        listener = l;
        log.log(INFO, () -> "Opened server channel: " + l);
        
        new OnAccept(l).acceptNext();
        return this;
    }
    
    @Override
    public void run(SocketAddress address) throws IOException, InterruptedException {
        final AsynchronousChannelGroup g;
        synchronized (this) {
            start(address);
            g = group;
        }
        g.awaitTermination(Long.MAX_VALUE, DAYS);
        log.log(INFO, "Event loop terminated.");
    }
    
    @Override
    public synchronized void stop() throws IOException {
        if (listener == null) {
            return;
        }
        try {
            closeListener();
        } finally {
            group.shutdown();
            group = null;
        }
    }
    
    @Override
    public synchronized void stopNow() throws IOException {
        if (listener == null) {
            return;
        }
        try {
            closeListener();
        } finally {
            group.shutdownNow();
            group = null;
            log.log(INFO, "Closed all children.");
        }
    }
    
    @Override
    public synchronized boolean isRunning() {
        return listener != null && listener.isOpen();
    }
    
    @Override
    public synchronized InetSocketAddress getLocalAddress() throws IOException {
        if (listener == null) {
            throw new IllegalStateException("Server is not running.");
        }
        return (InetSocketAddress) listener.getLocalAddress();
    }
    
    private void closeListener() throws IOException {
        final AsynchronousServerSocketChannel l = listener;
        listener = null;
        l.close();
        log.log(INFO, () -> "Closed server channel: " + l);
    }
    
    private static boolean isShutdown(Throwable t) {
        return t instanceof ClosedChannelException ||
               t instanceof ShutdownChannelGroupException ||
               t instanceof IOException && t.getCause() instanceof ShutdownChannelGroupException;
    }
    
    /**
     * Handles the completion of a listener accept operation.<p>
     * 
     * A new accept is initiated before the accepted child is served, and after
     * any failure that is not caused by the listener or the group having been
     * closed.
     */
    private final class OnAccept implements CompletionHandler<AsynchronousSocketChannel, Void>
    {
        private final AsynchronousServerSocketChannel listener;
        
        OnAccept(AsynchronousServerSocketChannel listener) {
            this.listener = listener;
        }
        
        void acceptNext() {
            try {
                listener.accept(null, this);
            } catch (Throwable t) {
                if (isShutdown(t)) {
                    log.log(DEBUG, "Group closed when initiating a new accept. Will accept no more.");
                } else {
                    log.log(ERROR, "Failed to initiate a new accept. Will accept no more.", t);
                }
            }
        }
        
        @Override
        public void completed(AsynchronousSocketChannel child, Void noAttachment) {
            log.log(DEBUG, () -> "Accepted child: " + child);
            acceptNext();
            new Connection(child, router, config.readBufferSize(), log).begin();
        }
        
        @Override
        public void failed(Throwable t, Void noAttachment) {
            if (isShutdown(t)) {
                log.log(DEBUG, "Listener closed. Will accept no more.");
            } else {
                log.log(ERROR, "Accept failed. Will accept next.", t);
                acceptNext();
            }
        }
    }
}
