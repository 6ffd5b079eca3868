package alpha.haka.util;

import java.io.IOException;
import java.nio.channels.AsynchronousCloseException;

/**
 * Utils for {@link IOException}.
 */
public final class IOExceptions
{
    private IOExceptions() {
        // Empty
    }
    
    // Observed messages, Windows first, then Linux
    
    private static final String[] BROKEN_READ = {
            "The specified network name is no longer available",
            "The specified network name is no longer available.",
            "An existing connection was forcibly closed by the remote host",
            "An established connection was aborted by the software in your host machine",
            "Connection reset by peer",
            "Connection reset"};
    
    private static final String[] BROKEN_WRITE = {
            "An existing connection was forcibly closed by the remote host",
            "An established connection was aborted by the software in your host machine",
            "Software caused connection abort: no further information",
            "Connection reset by peer",
            "Connection reset",
            "Broken pipe"};
    
    /**
     * Returns {@code true} if it is safe to assume that the given exception was
     * caused by a broken input stream (channel read operation failed because
     * the client went away), otherwise {@code false}.
     * 
     * @param exc to test
     * 
     * @return {@code true} if input stream is broken, otherwise {@code false}
     */
    public static boolean isCausedByBrokenInputStream(Throwable exc) {
        return check(exc, BROKEN_READ);
    }
    
    /**
     * Returns {@code true} if it is safe to assume that the given exception was
     * caused by a broken output stream (channel write operation failed because
     * the client went away), otherwise {@code false}.
     * 
     * @param exc to test
     * 
     * @return {@code true} if output stream is broken, otherwise {@code false}
     */
    public static boolean isCausedByBrokenOutputStream(Throwable exc) {
        return check(exc, BROKEN_WRITE);
    }
    
    /**
     * Returns {@code true} if the given exception signals that a pending
     * channel operation was aborted because the channel was closed.<p>
     * 
     * This is what happens to an outstanding read or write when the server
     * stops, and it is not an error.
     * 
     * @param exc to test
     * 
     * @return {@code true} if the operation was aborted by a close
     */
    public static boolean isAbortedByClose(Throwable exc) {
        return exc instanceof AsynchronousCloseException;
    }
    
    private static boolean check(Throwable exc, String[] against) {
        if (!(exc instanceof IOException)) {
            return false;
        }
        for (String msg : against) {
            if (msg.equals(exc.getMessage())) {
                return true;
            }
        }
        return false;
    }
}
