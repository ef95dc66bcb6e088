package alpha.nomagicmvc.util;

/**
 * Namespace for functional types whose single method may throw a checked
 * exception.<p>
 * 
 * Application code such as an action or a pipeline stage is free to call into
 * APIs that declare checked exceptions, for example a repository doing I/O.
 * Wrapping those in unchecked exceptions is noise, and so the library's
 * functional types extend from the types declared here.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Throwing {
    private Throwing() {
        // Empty
    }
    
    /**
     * A value consumer that may throw an exception.
     * 
     * @param <T> the type of the input to the operation
     * @param <X> the type of problem that can happen
     */
    @FunctionalInterface
    public interface Consumer<T, X extends Exception> {
        /**
         * Performs this operation on the given argument.
         * 
         * @param t value to consume
         * @throws X should be documented by implementation
         */
        void accept(T t) throws X;
    }
}
