package alpha.haka.message;

/**
 * A generic exception to reject a bad request.<p>
 * 
 * The connection translates this exception to a 400 (Bad Request) response
 * and then closes as it would after any other response.
 */
public class BadRequestException extends RuntimeException
{
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code BadRequestException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public BadRequestException(String message) {
        super(message);
    }
}
