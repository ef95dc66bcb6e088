package alpha.nomagicmvc.context;

import alpha.nomagicmvc.HttpConstants.StatusCode;

import static java.util.Objects.requireNonNull;

/**
 * A response status, as put by the application.<p>
 *
 * The status is either numeric (404) or symbolic ("not_found"). Putting a
 * status always succeeds; the status is resolved and validated against the
 * table of recognized codes in {@link StatusCode} only when the response is
 * committed, by calling {@link #code()}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Status
{
    /**
     * Returns a numeric status.
     *
     * @param code status code
     * @return a status
     */
    public static Status of(int code) {
        return new Status(code, null);
    }

    /**
     * Returns a symbolic status.
     *
     * @param name symbolic name, e.g. "not_found"
     * @return a status
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public static Status of(String name) {
        return new Status(0, requireNonNull(name));
    }

    private final int code;
    private final String name;

    private Status(int code, String name) {
        this.code = code;
        this.name = name;
    }

    /**
     * Resolves the status code.
     *
     * @return the status code
     *
     * @throws InvalidStatusException
     *             if the code or name is not a recognized status
     */
    public int code() {
        if (name != null) {
            return StatusCode.fromName(name).orElseThrow(() ->
                    new InvalidStatusException(name));
        }
        if (!StatusCode.isRecognized(code)) {
            throw new InvalidStatusException(String.valueOf(code));
        }
        return code;
    }

    /**
     * {@return {@code true} if this status is symbolic}
     */
    public boolean isSymbolic() {
        return name != null;
    }

    @Override
    public String toString() {
        return name != null ? name : String.valueOf(code);
    }
}
