package alpha.haka.message;

import java.util.Objects;

/**
 * A title and a message, for simple JSON responses.<p>
 * 
 * Serializes to {@code {"title":"...","message":"..."}}.
 * 
 * @see Response#json(Object)
 */
public final class JsonMessage
{
    private final String title;
    private final String message;
    
    /**
     * Constructs a {@code JsonMessage}.
     * 
     * @param title the title (may be {@code null})
     * @param message the message (may be {@code null})
     */
    public JsonMessage(String title, String message) {
        this.title = title;
        this.message = message;
    }
    
    /**
     * Returns the title.
     * 
     * @return the title
     */
    public String title() {
        return title;
    }
    
    /**
     * Returns the message.
     * 
     * @return the message
     */
    public String message() {
        return message;
    }
    
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof JsonMessage)) {
            return false;
        }
        JsonMessage other = (JsonMessage) obj;
        return Objects.equals(title, other.title) &&
               Objects.equals(message, other.message);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(title, message);
    }
    
    @Override
    public String toString() {
        return JsonMessage.class.getSimpleName() + "{" +
                "title='" + title + '\'' +
                ", message='" + message + "'}";
    }
}
