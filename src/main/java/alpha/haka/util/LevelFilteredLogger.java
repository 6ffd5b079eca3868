package alpha.haka.util;

import java.util.ResourceBundle;

import static java.lang.System.Logger.Level.OFF;
import static java.util.Objects.requireNonNull;

/**
 * A {@code System.Logger} that drops records below a threshold before they
 * reach the delegate.<p>
 * 
 * The server creates one of these from {@link alpha.haka.Config#logLevel()}
 * and hands it to every component it owns, so that a verbose server and a
 * quiet server may run side by side in the same JVM.<p>
 * 
 * Records at or above the threshold are forwarded as-is and the delegate
 * applies its own filtering on top.
 */
public final class LevelFilteredLogger implements System.Logger
{
    /**
     * Returns a logger for the package of the given component.
     * 
     * @param component to extract package from
     * @param threshold least severe level to forward
     * 
     * @return a filtering logger
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static System.Logger of(Class<?> component, Level threshold) {
        return new LevelFilteredLogger(
                System.getLogger(component.getPackageName()), threshold);
    }
    
    private final System.Logger delegate;
    private final Level threshold;
    
    /**
     * Constructs a {@code LevelFilteredLogger}.
     * 
     * @param delegate receiver of forwarded records
     * @param threshold least severe level to forward
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public LevelFilteredLogger(System.Logger delegate, Level threshold) {
        this.delegate  = requireNonNull(delegate);
        this.threshold = requireNonNull(threshold);
    }
    
    /**
     * Returns the threshold.
     * 
     * @return the threshold
     */
    public Level threshold() {
        return threshold;
    }
    
    @Override
    public String getName() {
        return delegate.getName();
    }
    
    @Override
    public boolean isLoggable(Level level) {
        return level != OFF &&
               threshold != OFF &&
               level.getSeverity() >= threshold.getSeverity() &&
               delegate.isLoggable(level);
    }
    
    @Override
    public void log(Level level, ResourceBundle bundle, String msg, Throwable thrown) {
        if (isLoggable(level)) {
            delegate.log(level, bundle, msg, thrown);
        }
    }
    
    @Override
    public void log(Level level, ResourceBundle bundle, String format, Object... params) {
        if (isLoggable(level)) {
            delegate.log(level, bundle, format, params);
        }
    }
}
