package alpha.haka.message;

/**
 * Parsing a request-line from a request head failed.<p>
 * 
 * Thrown when the request-line is empty, or it lacks a method or a path.
 */
public class RequestLineParseException extends BadRequestException
{
    private static final long serialVersionUID = 1L;
    
    private final String line;
    
    /**
     * Initializes this object.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     * @param line the offending request-line (may be empty)
     */
    public RequestLineParseException(String message, String line) {
        super(message);
        this.line = line;
    }
    
    /**
     * Returns the offending request-line.
     * 
     * @return the offending request-line
     */
    public String line() {
        return line;
    }
}
