package alpha.haka.internal;

import java.io.IOException;
import java.nio.channels.AsynchronousSocketChannel;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.NotYetConnectedException;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * An extension API for {@code AsynchronousSocketChannel}, the child.
 */
final class ChannelOperations
{
    private final AsynchronousSocketChannel ch;
    private final System.Logger log;
    
    ChannelOperations(AsynchronousSocketChannel delegate, System.Logger log) {
        this.ch  = requireNonNull(delegate);
        this.log = requireNonNull(log);
    }
    
    /**
     * Returns the underlying channel this API delegates to.
     * 
     * @return the underlying channel this API delegates to
     */
    AsynchronousSocketChannel delegate() {
        return ch;
    }
    
    /**
     * End the child channel's connection and then close the channel.<p>
     * 
     * The input stream is shut down first, then the output stream, then the
     * channel is closed. Each step is attempted even if the previous one
     * failed. Failures are logged and otherwise ignored; a connection that
     * was never established or is already closed is not a failure.<p>
     * 
     * Is NOP if child is already closed.
     */
    void orderlyClose() {
        if (!ch.isOpen()) {
            return;
        }
        
        try {
            ch.shutdownInput();
        } catch (ClosedChannelException | NotYetConnectedException e) {
            log.log(DEBUG, () -> "Input stream already gone: " + e);
        } catch (IOException e) {
            log.log(WARNING, "Failed to shutdown child connection's input stream.", e);
        }
        
        try {
            ch.shutdownOutput();
        } catch (ClosedChannelException | NotYetConnectedException e) {
            log.log(DEBUG, () -> "Output stream already gone: " + e);
        } catch (IOException e) {
            log.log(WARNING, "Failed to shutdown child connection's output stream.", e);
        }
        
        try {
            ch.close();
            log.log(DEBUG, () -> "Closed child: " + ch);
        } catch (IOException e) {
            log.log(WARNING, "Failed to close child.", e);
        }
    }
}
