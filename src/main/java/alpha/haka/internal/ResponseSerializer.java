package alpha.haka.internal;

import alpha.haka.HttpConstants.ReasonPhrase;
import alpha.haka.message.Response;

import java.nio.ByteBuffer;
import java.util.Map;

import static alpha.haka.HttpConstants.HeaderKey.CONTENT_LENGTH;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Serializes a {@link Response} into the bytes put on the wire.<p>
 * 
 * The format is:
 * <pre>
 *   HTTP/1.1 {status} {reason}\r\n
 *   {name}: {value}\r\n          (for each header, in insertion order)
 *   Content-Length: {n}\r\n
 *   \r\n
 *   {body}
 * </pre>
 * 
 * A "Content-Length" header set on the response is skipped; the length of the
 * body is authoritative.
 */
final class ResponseSerializer
{
    private static final String CRLF = "\r\n";
    
    private ResponseSerializer() {
        // Empty
    }
    
    /**
     * Returns the status-line and headers, including the empty line that
     * terminates them.
     * 
     * @param response to serialize
     * 
     * @return the head
     */
    static String head(Response response) {
        StringBuilder b = new StringBuilder(128)
                .append("HTTP/1.1 ")
                .append(response.status())
                .append(' ')
                .append(ReasonPhrase.of(response.status()))
                .append(CRLF);
        
        for (Map.Entry<String, String> h : response.headers().entrySet()) {
            if (h.getKey().equalsIgnoreCase(CONTENT_LENGTH)) {
                continue;
            }
            b.append(h.getKey()).append(": ").append(h.getValue()).append(CRLF);
        }
        
        return b.append(CONTENT_LENGTH).append(": ").append(response.body().length)
                .append(CRLF)
                .append(CRLF)
                .toString();
    }
    
    /**
     * Serialize the response.
     * 
     * @param response to serialize
     * 
     * @return a buffer ready to be written
     */
    static ByteBuffer serialize(Response response) {
        byte[] head = head(response).getBytes(UTF_8),
               body = response.body();
        
        return ByteBuffer.allocate(head.length + body.length)
                .put(head)
                .put(body)
                .flip();
    }
}
