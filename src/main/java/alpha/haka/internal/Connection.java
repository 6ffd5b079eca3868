package alpha.haka.internal;

import alpha.haka.handler.RequestHandler;
import alpha.haka.message.BadRequestException;
import alpha.haka.message.Request;
import alpha.haka.message.Response;
import alpha.haka.route.Router;

import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousSocketChannel;
import java.nio.channels.CompletionHandler;
import java.util.Arrays;

import static alpha.haka.HttpConstants.ReasonPhrase.BAD_REQUEST;
import static alpha.haka.HttpConstants.ReasonPhrase.INTERNAL_SERVER_ERROR;
import static alpha.haka.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.haka.HttpConstants.StatusCode.FOUR_HUNDRED;
import static alpha.haka.util.IOExceptions.isAbortedByClose;
import static alpha.haka.util.IOExceptions.isCausedByBrokenInputStream;
import static alpha.haka.util.IOExceptions.isCausedByBrokenOutputStream;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Serves exactly one request on an accepted channel, then closes it.<p>
 * 
 * The connection moves through the states {@link State#READING READING},
 * {@link State#DISPATCHING DISPATCHING}, {@link State#WRITING WRITING} and
 * {@link State#CLOSED CLOSED}, in that order. A malformed request skips
 * dispatching and writes a 400 (Bad Request). A failed read or write skips
 * straight to closed.<p>
 * 
 * Bytes are read until the request head is complete, that is until the first
 * CRLFCRLF. There is no limit on the head size. A request body, if any, is
 * never read.
 * 
 * @implNote
 * All methods run on the server's event loop, one completion at a time, so the
 * state needs no synchronization. The channel holds a reference to the pending
 * completion handler and the handler holds a reference to this connection,
 * which is what keeps the connection alive between operations. Once the
 * channel is closed and the last completion has run, nothing references the
 * connection anymore.
 */
final class Connection
{
    /**
     * Lifecycle of a connection.
     */
    enum State {
        /** Accumulating the request head. */
        READING,
        /** Parsing the head and running the handler. */
        DISPATCHING,
        /** Sending the response. */
        WRITING,
        /** Channel closed. Terminal. */
        CLOSED
    }
    
    private static final byte[] TERMINATOR = {'\r', '\n', '\r', '\n'};
    
    private final ChannelOperations child;
    private final Router router;
    private final RequestHeadParser parser;
    private final System.Logger log;
    private final ByteBuffer buf;
    
    private byte[] acc;
    private int size;
    private State state;
    
    Connection(AsynchronousSocketChannel child, Router router, int readBufferSize, System.Logger log) {
        this.child  = new ChannelOperations(child, log);
        this.router = requireNonNull(router);
        this.parser = new RequestHeadParser(log);
        this.log    = log;
        this.buf    = ByteBuffer.allocate(readBufferSize);
        this.acc    = new byte[readBufferSize];
        this.size   = 0;
        this.state  = null;
    }
    
    /**
     * Start reading the request.
     * 
     * @throws IllegalStateException if already started
     */
    void begin() {
        if (state != null) {
            throw new IllegalStateException("Already started.");
        }
        state = State.READING;
        read();
    }
    
    private void read() {
        buf.clear();
        try {
            child.delegate().read(buf, null, new OnRead());
        } catch (Throwable t) {
            failed("Read", t);
        }
    }
    
    private void append() {
        buf.flip();
        int n = buf.remaining();
        if (size + n > acc.length) {
            acc = Arrays.copyOf(acc, Math.max(acc.length * 2, size + n));
        }
        buf.get(acc, size, n);
        size += n;
    }
    
    /**
     * Returns the index of the byte after CRLFCRLF, or -1 if not found.
     * 
     * @param from index to start searching from
     */
    private int endOfHead(int from) {
        outer:
        for (int i = Math.max(0, from); i <= size - TERMINATOR.length; ++i) {
            for (int j = 0; j < TERMINATOR.length; ++j) {
                if (acc[i + j] != TERMINATOR[j]) {
                    continue outer;
                }
            }
            return i + TERMINATOR.length;
        }
        return -1;
    }
    
    private void dispatch(String head) {
        state = State.DISPATCHING;
        
        final Request req;
        try {
            req = parser.parse(head);
        } catch (BadRequestException e) {
            log.log(WARNING, () -> "Bad request: " + e.getMessage());
            write(new Response(log).status(FOUR_HUNDRED).text(BAD_REQUEST));
            return;
        }
        
        log.log(DEBUG, () -> "Received: " + req);
        
        Response res = new Response(log);
        try {
            RequestHandler h = router.match(req);
            h.handle(req, res);
        } catch (Throwable t) {
            log.log(ERROR, "Request handler failed: " + req, t);
            res = new Response(log).status(FIVE_HUNDRED).text(INTERNAL_SERVER_ERROR);
        }
        
        write(res);
    }
    
    private void write(Response res) {
        state = State.WRITING;
        ByteBuffer out = ResponseSerializer.serialize(res);
        log.log(DEBUG, () -> "Sending: " + res.status() + " (" + out.remaining() + " bytes)");
        write(out, new OnWrite());
    }
    
    private void write(ByteBuffer out, OnWrite handler) {
        try {
            child.delegate().write(out, out, handler);
        } catch (Throwable t) {
            failed("Write", t);
        }
    }
    
    private void close() {
        if (state == State.CLOSED) {
            return;
        }
        state = State.CLOSED;
        child.orderlyClose();
    }
    
    private void failed(String op, Throwable t) {
        if (isAbortedByClose(t)) {
            log.log(DEBUG, () -> op + " aborted, channel closed.");
        } else if (isCausedByBrokenInputStream(t) || isCausedByBrokenOutputStream(t)) {
            log.log(DEBUG, () -> op + " failed, client went away: " + t.getMessage());
        } else {
            log.log(ERROR, op + " failed. Will close child.", t);
        }
        close();
    }
    
    private final class OnRead implements CompletionHandler<Integer, Void>
    {
        @Override
        public void completed(Integer n, Void noAttachment) {
            if (n == -1) {
                log.log(DEBUG, () -> size == 0 ?
                        "Client closed without sending anything." :
                        "Client closed before request head was complete.");
                close();
                return;
            }
            
            int from = size - (TERMINATOR.length - 1);
            append();
            int end = endOfHead(from);
            
            if (end == -1) {
                read();
            } else {
                dispatch(new String(acc, 0, end, UTF_8));
            }
        }
        
        @Override
        public void failed(Throwable t, Void noAttachment) {
            Connection.this.failed("Read", t);
        }
    }
    
    private final class OnWrite implements CompletionHandler<Integer, ByteBuffer>
    {
        @Override
        public void completed(Integer n, ByteBuffer out) {
            if (out.hasRemaining()) {
                write(out, this);
            } else {
                log.log(DEBUG, "Response sent.");
                close();
            }
        }
        
        @Override
        public void failed(Throwable t, ByteBuffer out) {
            Connection.this.failed("Write", t);
        }
    }
}
