package alpha.nomagicmvc.testutil;

import org.assertj.core.groups.Tuple;

import static java.lang.System.Logger.Level;
import static java.util.Objects.requireNonNull;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Utils for JUL's {@link java.util.logging.LogRecord} and related types.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class LogRecords {
    private LogRecords() {
        // Empty
    }
    
    /**
     * Create an AssertJ Tuple consisting of a log- level and message.
     * 
     * @param level of log record
     * @param msg of log record
     * @return a tuple
     * 
     * @throws NullPointerException
     *             if {@code level} is {@code null}
     */
    public static Tuple rec(Level level, String msg) {
        return tuple(toJUL(level), msg);
    }
    
    /**
     * Convert {@code System.Logger.Level} to {@code java.util.logging.Level}.
     *
     * @param level to convert
     * @return the converted value
     * @throws NullPointerException if {@code level} is {@code null}
     */
    static java.util.logging.Level toJUL(Level level) {
        return switch (requireNonNull(level)) {
            case ALL     -> java.util.logging.Level.ALL;
            case TRACE   -> java.util.logging.Level.FINER;
            case DEBUG   -> java.util.logging.Level.FINE;
            case INFO    -> java.util.logging.Level.INFO;
            case WARNING -> java.util.logging.Level.WARNING;
            case ERROR   -> java.util.logging.Level.SEVERE;
            case OFF     -> java.util.logging.Level.OFF;
        };
    }
}
