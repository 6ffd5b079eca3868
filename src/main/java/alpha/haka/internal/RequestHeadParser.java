package alpha.haka.internal;

import alpha.haka.message.Request;
import alpha.haka.message.RequestLineParseException;

import java.util.LinkedHashMap;
import java.util.Map;

import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * Parses a request head into a {@link Request}.<p>
 * 
 * The head is the request-line followed by header lines, up to and including
 * the empty line that terminates it. Lines are separated by LF with an
 * optional preceding CR.<p>
 * 
 * The request-line is split on whitespace into method, path and version. The
 * version is not validated and not retained. A missing method or path is a
 * {@link RequestLineParseException}.<p>
 * 
 * A header line is split on the first colon. Spaces and tabs that follow the
 * colon are stripped from the value. A line without a colon is logged and
 * skipped.
 */
final class RequestHeadParser
{
    private final System.Logger log;
    
    RequestHeadParser(System.Logger log) {
        this.log = requireNonNull(log);
    }
    
    /**
     * Parse the head.
     * 
     * @param head decoded request head
     * 
     * @return the request
     * 
     * @throws RequestLineParseException if the request-line is malformed
     */
    Request parse(String head) {
        final String[] lines = head.split("\n", -1);
        final String reqLine = stripCR(lines[0]);
        
        final String[] tokens = reqLine.strip().split("\\s+");
        if (tokens.length < 2 || tokens[0].isEmpty()) {
            throw new RequestLineParseException(
                    "Request-line lacks method or path.", reqLine);
        }
        
        Map<String, String> headers = new LinkedHashMap<>();
        for (int i = 1; i < lines.length; ++i) {
            final String line = stripCR(lines[i]);
            if (line.isEmpty()) {
                break;
            }
            int colon = line.indexOf(':');
            if (colon == -1) {
                log.log(WARNING, () -> "Malformed header line skipped: " + line);
                continue;
            }
            headers.put(line.substring(0, colon), stripLeading(line.substring(colon + 1)));
        }
        
        return new Request(tokens[0], tokens[1], headers);
    }
    
    private static String stripCR(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
    
    private static String stripLeading(String value) {
        int i = 0;
        while (i < value.length() && (value.charAt(i) == ' ' || value.charAt(i) == '\t')) {
            ++i;
        }
        return value.substring(i);
    }
}
