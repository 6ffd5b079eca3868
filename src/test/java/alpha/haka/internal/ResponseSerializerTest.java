package alpha.haka.internal;

import alpha.haka.message.Response;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests for {@link ResponseSerializer}.
 */
class ResponseSerializerTest
{
    @Test
    void not_found() {
        Response r = new Response().status(404).text("Not found: /x");
        
        assertThat(serialize(r)).isEqualTo(
            "HTTP/1.1 404 Not Found\r\n" +
            "Content-Type: text/plain\r\n" +
            "Content-Length: 13\r\n\r\n" +
            "Not found: /x");
    }
    
    @Test
    void empty_body() {
        assertThat(serialize(new Response().status(204))).isEqualTo(
            "HTTP/1.1 204 No Content\r\n" +
            "Content-Type: text/plain\r\n" +
            "Content-Length: 0\r\n\r\n");
    }
    
    @Test
    void unknown_status() {
        assertThat(ResponseSerializer.head(new Response().status(299)))
                .startsWith("HTTP/1.1 299 Unknown Status\r\n");
    }
    
    @Test
    void headers_in_insertion_order() {
        Response r = new Response()
                .header("X-B", "b")
                .header("X-A", "a");
        
        assertThat(ResponseSerializer.head(r)).isEqualTo(
            "HTTP/1.1 200 OK\r\n" +
            "Content-Type: text/plain\r\n" +
            "X-B: b\r\n" +
            "X-A: a\r\n" +
            "Content-Length: 0\r\n\r\n");
    }
    
    @Test
    void application_content_length_is_ignored() {
        Response r = new Response()
                .header("content-length", "999")
                .text("abc");
        
        assertThat(ResponseSerializer.head(r))
                .contains("Content-Length: 3\r\n")
                .doesNotContain("999");
    }
    
    @Test
    void content_length_counts_bytes() {
        Response r = new Response().text("ö");
        assertThat(ResponseSerializer.head(r)).contains("Content-Length: 2\r\n");
    }
    
    private static String serialize(Response r) {
        ByteBuffer b = ResponseSerializer.serialize(r);
        byte[] bytes = new byte[b.remaining()];
        b.get(bytes);
        return new String(bytes, UTF_8);
    }
}
