package alpha.nomagicmvc.testutil;

import org.assertj.core.api.AbstractThrowableAssert;

import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.Predicate;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static alpha.nomagicmvc.testutil.LogRecords.rec;
import static alpha.nomagicmvc.testutil.LogRecords.toJUL;
import static java.util.Comparator.comparing;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Stream.of;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertNotNull;

/**
 * A utility for asserting log records.<p>
 * 
 * Many methods in this class accept predicate arguments for matching a record.
 * Each observed record's values are compared with the arguments accordingly:
 * 
 * <ul>
 *   <li>{@code getLevel()} must be equal to {@code level} 
 *   <li>{@code getMessage().}{@link String#startsWith(String) startsWith}{@code ()}
 *       must return {@code true} given {@code messageStartsWith}
 *   <li>{@code getThrown()} must be an instance of {@code thr}</li>
 * </ul>
 * 
 * Methods with an "assert" prefix throws an {@code AssertionError} if the
 * record can not be found.<p>
 * 
 * Methods with "remove" in their name will remove and return the earliest
 * record which is a match, meaning that the matched record will not be matched
 * again. The purpose is to limit subsequent assertions to what is left
 * behind. For example:
 * 
 * <pre>
 *     // The test provoked an expected warning...
 *     recorder.assertRemove(WARNING, "Rejected session cookie")
 *     // ...but no other warnings or records with a throwable are expected
 *             .assertNoProblem();
 * </pre>
 * 
 * Create a log recorder using {@link #startRecording(Class, Class[])}. While
 * recording, the targeted loggers log all levels.<p>
 * 
 * The recorder only observes records published synchronously by the test
 * worker, which is all that this library does.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class LogRecorder
{
    /**
     * Starts recording log records from the loggers of the packages that the
     * given components belong to.<p>
     * 
     * Recording should eventually be stopped using {@link #stopRecording()}.
     * 
     * @param firstComponent at least one
     * @param more may be provided
     * 
     * @return a new log recorder
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     */
    public static LogRecorder startRecording(Class<?> firstComponent, Class<?>... more) {
        RecordHandler[] h = Stream.concat(of(firstComponent), of(more))
                .map(Class::getPackageName)
                .distinct()
                .map(RecordHandler::new)
                .toArray(RecordHandler[]::new);
        return new LogRecorder(h);
    }
    
    private final RecordHandler[] handlers;
    
    private LogRecorder(RecordHandler[] handlers) {
        this.handlers = handlers;
    }
    
    /**
     * Removes the matched record.
     * 
     * @param level record's level predicate
     * @param messageStartsWith record's message predicate
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws AssertionError
     *             if a match could not be found
     * 
     * @see LogRecorder
     */
    public LogRecorder assertRemove(
            System.Logger.Level level, String messageStartsWith) {
        var jul = toJUL(level);
        requireNonNull(messageStartsWith);
        assertRemoveIf(r ->
                r.getLevel().equals(jul) &&
                r.getMessage().startsWith(messageStartsWith));
        return this;
    }
    
    /**
     * Removes the matched record.
     * 
     * @param level record's level predicate
     * @param messageStartsWith record's message predicate
     * @param thr record's thrown predicate
     * 
     * @return an assert object of the throwable
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws AssertionError
     *             if a match could not be found
     * 
     * @see LogRecorder
     */
    public AbstractThrowableAssert<?, ? extends Throwable>
           assertRemove(System.Logger.Level level, String messageStartsWith,
           Class<? extends Throwable> thr)
    {
        var jul = toJUL(level);
        requireNonNull(messageStartsWith);
        requireNonNull(thr);
        var rec = assertRemoveIf(r ->
                r.getLevel().equals(jul) &&
                r.getMessage().startsWith(messageStartsWith) &&
                thr.isInstance(r.getThrown()));
        return assertThat(rec.getThrown());
    }
    
    /**
     * Removes the earliest record which has a throwable.
     * 
     * @return an assert object of the throwable
     * 
     * @throws AssertionError
     *             if a match could not be found
     */
    public AbstractThrowableAssert<?, ? extends Throwable> assertRemoveThrown() {
        return assertThat(assertRemoveIf(r -> r.getThrown() != null).getThrown());
    }
    
    /**
     * Asserts that no record has a throwable nor a level greater than
     * {@code INFO}.
     * 
     * @return this for chaining/fluency
     * 
     * @throws AssertionError
     *             if a record has a throwable
     *             or a level greater than {@code INFO}
     */
    public LogRecorder assertNoProblem() {
        assertThat(records())
            .noneMatch(v -> v.getLevel().intValue() > Level.INFO.intValue())
            .noneMatch(v -> v.getThrown() != null);
        return this;
    }
    
    /**
     * Asserts that only one record has the given values.<p>
     * 
     * The record's throwable, if present, has no effect.
     * 
     * @param level record's level predicate
     * @param message record's message predicate
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws AssertionError
     *             if not exactly one record is found
     */
    public LogRecorder assertContainsOnlyOnce(System.Logger.Level level, String message) {
        assertThat(records())
            .extracting(
                LogRecord::getLevel,
                LogRecord::getMessage)
            .containsOnlyOnce(rec(level, message));
        return this;
    }
    
    /**
     * Stop recording log records.<p>
     * 
     * The level of each targeted logger is restored.
     */
    public void stopRecording() {
        Stream.of(handlers).forEach(RecordHandler::uninstall);
    }
    
    private Stream<LogRecord> records() {
        return Stream.of(handlers)
                .flatMap(h -> h.recordsDeque().stream())
                .sorted(comparing(LogRecord::getInstant));
    }
    
    /**
     * Removes and returns the earliest record matching the given predicate.
     * 
     * @param test record predicate
     * 
     * @return the record (never {@code null}
     * 
     * @throws AssertionError
     *             if no record matched the predicate
     */
    private LogRecord assertRemoveIf(Predicate<LogRecord> test) {
        LogRecord match = null;
        search: for (var h : handlers) {
            var it = h.recordsDeque().iterator();
            while (it.hasNext()) {
                var r = it.next();
                if (test.test(r)) {
                    it.remove();
                    match = r;
                    break search;
                }
            }
        }
        assertNotNull(match);
        return match;
    }
    
    private static final class RecordHandler extends Handler {
        // Strong reference, or the configured level may be lost to GC
        private final Logger logger;
        private final Level oldLevel;
        private final Deque<LogRecord> deq;
        
        RecordHandler(String packageName) {
            logger   = Logger.getLogger(packageName);
            oldLevel = logger.getLevel();
            deq      = new ConcurrentLinkedDeque<>();
            super.setLevel(Level.ALL);
            logger.setLevel(Level.ALL);
            logger.addHandler(this);
        }
        
        void uninstall() {
            logger.removeHandler(this);
            logger.setLevel(oldLevel);
        }
        
        Deque<LogRecord> recordsDeque() {
            return deq;
        }
        
        @Override
        public void publish(LogRecord record) {
            deq.add(record);
        }
        
        @Override
        public void flush() {
            // Empty
        }
        
        @Override
        public void close() {
            // Empty
        }
    }
}
