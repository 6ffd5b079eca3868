package alpha.haka.internal;

import alpha.haka.message.Request;
import alpha.haka.message.RequestLineParseException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;

import java.util.Map;
import java.util.function.Supplier;

import static java.lang.System.Logger.Level.WARNING;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Small tests for {@link RequestHeadParser}.
 */
class RequestHeadParserTest
{
    final System.Logger log = mock(System.Logger.class);
    final RequestHeadParser testee = new RequestHeadParser(log);
    
    @Test
    void request_line_and_headers() {
        Request r = testee.parse(
                "GET /hello HTTP/1.1\r\n" +
                "Host: localhost\r\n" +
                "Accept:\t \ttext/plain\r\n\r\n");
        
        assertThat(r.method()).isEqualTo("GET");
        assertThat(r.path()).isEqualTo("/hello");
        assertThat(r.headers()).containsExactly(
                Map.entry("Host", "localhost"),
                Map.entry("Accept", "text/plain"));
        verifyNoInteractions(log);
    }
    
    @Test
    void version_is_optional_and_extra_whitespace_ignored() {
        Request r = testee.parse("  POST   /submit  \r\n\r\n");
        assertThat(r.method()).isEqualTo("POST");
        assertThat(r.path()).isEqualTo("/submit");
        assertThat(r.headers()).isEmpty();
    }
    
    @Test
    void bare_lf_line_endings() {
        Request r = testee.parse("GET / HTTP/1.0\nA: 1\n\n");
        assertThat(r.headers()).containsExactly(Map.entry("A", "1"));
    }
    
    @Test
    void last_duplicate_header_wins() {
        Request r = testee.parse("GET / HTTP/1.1\r\nX: 1\r\nY: 2\r\nX: 3\r\n\r\n");
        assertThat(r.headers()).containsExactly(
                Map.entry("X", "3"),
                Map.entry("Y", "2"));
    }
    
    @Test
    void value_keeps_colons_and_trailing_space() {
        Request r = testee.parse("GET / HTTP/1.1\r\nHost: localhost:8080 \r\n\r\n");
        assertThat(r.header("Host")).contains("localhost:8080 ");
    }
    
    @Test
    void header_without_colon_is_skipped_and_logged() {
        Request r = testee.parse("GET / HTTP/1.1\r\nNoColonHere\r\nA: 1\r\n\r\n");
        assertThat(r.headers()).containsExactly(Map.entry("A", "1"));
        verify(log).log(eq(WARNING), ArgumentMatchers.<Supplier<String>>any());
    }
    
    @Test
    void empty_request_line() {
        assertThatThrownBy(() -> testee.parse("\r\n\r\n"))
                .isExactlyInstanceOf(RequestLineParseException.class)
                .hasMessage("Request-line lacks method or path.");
    }
    
    @Test
    void missing_path() {
        assertThatThrownBy(() -> testee.parse("GARBAGE\r\n\r\n"))
                .isExactlyInstanceOf(RequestLineParseException.class)
                .extracting(e -> ((RequestLineParseException) e).line())
                .isEqualTo("GARBAGE");
    }
}
