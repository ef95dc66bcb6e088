package alpha.nomagicmvc.context;

import alpha.nomagicmvc.Config;
import alpha.nomagicmvc.Controller;
import alpha.nomagicmvc.HttpConstants.StatusCode;
import alpha.nomagicmvc.flash.Flash;
import alpha.nomagicmvc.message.MediaType;
import alpha.nomagicmvc.message.Request;
import alpha.nomagicmvc.message.Response;
import alpha.nomagicmvc.render.Format;
import alpha.nomagicmvc.render.FormatNotAcceptedException;
import alpha.nomagicmvc.render.TemplateNotFoundException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * The state of one request/response exchange.<p>
 *
 * A context is created by the controller for each request and handed to each
 * pipeline stage and to the action. The request side is immutable; the
 * response side (status, headers, assigns, format, layout, session and flash)
 * is mutated by stages and the action until a response is committed.<p>
 *
 * A response is committed exactly once, by one of the response methods:
 * {@link #render()}, {@link #redirect(Redirect)}, {@link #text(String)},
 * {@link #html(String)}, {@link #json(Object)} or {@link #sendResp(String)}.
 * Committing runs the before-commit callbacks in reverse registration order,
 * validates the status and seals the response. Thereafter, every method that
 * mutates the status, headers or body throws a
 * {@link ResponseCommittedException}.<p>
 *
 * Halting a context stops the pipeline from running any further stages, but
 * does not by itself commit a response.<p>
 *
 * The session and the flash must be fetched before they are used, usually by
 * a pipeline stage. Reading either before it is fetched throws an
 * {@code IllegalStateException}.<p>
 *
 * Methods that mutate the context return the context for chaining.<p>
 *
 * The implementation is not thread-safe. A context is only ever used by the
 * thread processing its request.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Context
{
    /**
     * {@return the inbound request}
     */
    Request request();

    /**
     * {@return the request method}
     */
    default String method() {
        return request().method();
    }

    /**
     * {@return the raw request path}
     */
    default String path() {
        return request().path();
    }

    /**
     * {@return all request parameters}
     */
    default Map<String, String> params() {
        return request().params();
    }

    /**
     * Returns a request parameter.
     *
     * @param name of parameter
     * @return the value, if present
     */
    default Optional<String> param(String name) {
        return request().param(name);
    }

    /**
     * {@return the controller processing the request}
     */
    Controller controller();

    /**
     * {@return the controller's configuration}
     */
    default Config config() {
        return controller().config();
    }

    /**
     * {@return the name of the requested action}
     */
    String actionName();

    // Status
    // ------

    /**
     * Returns the status put, if any.<p>
     *
     * A committed response without a status put has status 200 (OK).
     *
     * @return the status, if put
     */
    Optional<Status> status();

    /**
     * Puts the response status.<p>
     *
     * Any value is accepted. The status is validated when the response is
     * committed; an unrecognized status causes an
     * {@link InvalidStatusException} at that point. Putting a status has no
     * other effect.
     *
     * @param code status code, e.g. {@link StatusCode#FOUR_HUNDRED_FOUR}
     * @return this context
     * @throws ResponseCommittedException if the response is committed
     */
    Context putStatus(int code);

    /**
     * Puts the response status by its symbolic name.<p>
     *
     * The symbolic name is the snake-cased reason phrase, e.g. "not_found",
     * "unprocessable_entity" or "im_a_teapot". The name is resolved and
     * validated when the response is committed.
     *
     * @param name symbolic name of status
     * @return this context
     * @throws NullPointerException if {@code name} is {@code null}
     * @throws ResponseCommittedException if the response is committed
     */
    Context putStatus(String name);

    // Headers
    // -------

    /**
     * Returns the response headers put so far.<p>
     *
     * The returned map looks up its keys case-insensitively.
     *
     * @return an unmodifiable view
     */
    Map<String, List<String>> respHeaders();

    /**
     * Returns the first value of a response header.
     *
     * @param name of header
     * @return the first value, if present
     */
    default Optional<String> respHeader(String name) {
        var vals = respHeaders().get(name);
        return vals == null || vals.isEmpty() ?
                Optional.empty() : Optional.of(vals.get(0));
    }

    /**
     * Puts a response header, replacing all previous values of the header.
     *
     * @param name of header
     * @param value of header
     * @return this context
     * @throws NullPointerException if any argument is {@code null}
     * @throws ResponseCommittedException if the response is committed
     */
    Context putRespHeader(String name, String value);

    /**
     * Adds a value to a response header.
     *
     * @param name of header
     * @param value of header
     * @return this context
     * @throws NullPointerException if any argument is {@code null}
     * @throws ResponseCommittedException if the response is committed
     */
    Context addRespHeader(String name, String value);

    /**
     * Removes all values of a response header.
     *
     * @param name of header
     * @return this context
     * @throws NullPointerException if {@code name} is {@code null}
     * @throws ResponseCommittedException if the response is committed
     */
    Context deleteRespHeader(String name);

    /**
     * Puts the "Content-Type" response header.<p>
     *
     * An explicitly put content type is not replaced by the render
     * dispatcher.
     *
     * @param type media type
     * @return this context
     * @throws NullPointerException if {@code type} is {@code null}
     * @throws ResponseCommittedException if the response is committed
     */
    Context putRespContentType(MediaType type);

    // Assigns
    // -------

    /**
     * {@return the template variables assigned so far (unmodifiable)}
     */
    Map<String, Object> assigns();

    /**
     * Assigns a template variable.<p>
     *
     * The value may be {@code null}, for example to state that there is no
     * current user. The key is then present in {@link #assigns()}.
     *
     * @param key of variable
     * @param value of variable (may be {@code null})
     * @return this context
     * @throws NullPointerException if {@code key} is {@code null}
     */
    Context assign(String key, Object value);

    // Formats
    // -------

    /**
     * Returns the formats accepted for this request.<p>
     *
     * Unless overridden by {@link #acceptFormats(Format...)}, this is
     * {@link Config#acceptedFormats()}.
     *
     * @return the accepted formats (never empty)
     */
    List<Format> acceptedFormats();

    /**
     * Overrides the accepted formats for this request.
     *
     * @param formats to accept, in order of preference
     * @return this context
     * @throws NullPointerException if an element is {@code null}
     * @throws IllegalArgumentException if no format is given
     */
    Context acceptFormats(Format... formats);

    /**
     * Explicitly sets the response format.<p>
     *
     * The explicit format takes precedence over the format parameter and the
     * "Accept" header. It must still be an accepted format when rendering.
     *
     * @param format of response
     * @return this context
     * @throws NullPointerException if {@code format} is {@code null}
     */
    Context putFormat(Format format);

    /**
     * Resolves the response format.<p>
     *
     * The format is resolved in this order:
     * <ol>
     *   <li>the format explicitly put using {@link #putFormat(Format)},</li>
     *   <li>the request parameter {@link Config#formatParameter()},</li>
     *   <li>the "Accept" header intersected with the accepted formats,</li>
     *   <li>the {@linkplain Config#defaultFormat() default format} if
     *       accepted, else the first accepted format.</li>
     * </ol>
     *
     * @return the resolved format
     *
     * @throws FormatNotAcceptedException
     *             if the explicit format or the format parameter is not
     *             accepted, or the "Accept" header rules out all accepted
     *             formats
     */
    Format negotiateFormat();

    // View and layout
    // ---------------

    /**
     * Overrides the namespace templates are resolved in.<p>
     *
     * The namespace defaults to {@link Controller#namespace()}.
     *
     * @param namespace of templates
     * @return this context
     * @throws NullPointerException if {@code namespace} is {@code null}
     * @throws IllegalArgumentException if {@code namespace} is empty
     */
    Context putView(String namespace);

    /**
     * {@return the namespace templates are resolved in}
     */
    String view();

    /**
     * Sets the layout that wraps rendered templates.
     *
     * @param name of layout template
     * @return this context
     * @throws NullPointerException if {@code name} is {@code null}
     * @throws IllegalArgumentException if {@code name} is empty
     */
    Context putLayout(String name);

    /**
     * Disables the layout for this request.
     *
     * @return this context
     */
    Context putNoLayout();

    /**
     * Returns the active layout.<p>
     *
     * Unless changed, this is {@link Config#defaultLayout()}, which if empty
     * means no layout.
     *
     * @return the layout, if any
     */
    Optional<String> layout();

    // Session
    // -------

    /**
     * Loads the session from the controller's session store.<p>
     *
     * The first call loads the session and registers a before-commit callback
     * that saves the session, if it changed, or drops it, if
     * {@link #dropSession()} was called. Subsequent calls have no effect.
     *
     * @return this context
     * @throws IllegalStateException if the controller has no session store
     * @throws ResponseCommittedException if the response is committed
     */
    Context fetchSession();

    /**
     * {@return {@code true} if the session has been fetched}
     */
    boolean isSessionFetched();

    /**
     * Returns the session.
     *
     * @return an unmodifiable view
     * @throws IllegalStateException if the session has not been fetched
     */
    Map<String, Object> session();

    /**
     * Returns a session value.
     *
     * @param key of value
     * @return the value, if present
     * @throws IllegalStateException if the session has not been fetched
     */
    Optional<Object> getSession(String key);

    /**
     * Puts a session value.
     *
     * @param key of value
     * @param value to put
     * @return this context
     * @throws NullPointerException if any argument is {@code null}
     * @throws IllegalStateException if the session has not been fetched
     */
    Context putSession(String key, Object value);

    /**
     * Removes a session value.
     *
     * @param key of value
     * @return this context
     * @throws IllegalStateException if the session has not been fetched
     */
    Context deleteSession(String key);

    /**
     * Removes all session values.
     *
     * @return this context
     * @throws IllegalStateException if the session has not been fetched
     */
    Context clearSession();

    /**
     * Drops the session.<p>
     *
     * The session store is asked to drop the client's session when the
     * response is committed. The session is cleared.
     *
     * @return this context
     * @throws IllegalStateException if the session has not been fetched
     */
    Context dropSession();

    // Flash
    // -----

    /**
     * Hydrates the flash from the session.<p>
     *
     * Fetches the session, if not already fetched. Messages persisted by the
     * previous request are read and removed from the session. A before-commit
     * callback is registered that writes the messages persisted by this
     * request into the session. Subsequent calls have no effect.
     *
     * @return this context
     * @throws IllegalStateException if the controller has no session store
     * @throws ResponseCommittedException if the response is committed
     */
    Context fetchFlash();

    /**
     * {@return {@code true} if the flash has been fetched}
     */
    boolean isFlashFetched();

    /**
     * Returns the flash.
     *
     * @return the flash
     * @throws IllegalStateException if the flash has not been fetched
     */
    Flash flash();

    // Life cycle
    // ----------

    /**
     * Halts the pipeline.<p>
     *
     * No further stages run. Halting does not commit a response.
     *
     * @return this context
     */
    Context halt();

    /**
     * {@return {@code true} if the pipeline has been halted}
     */
    boolean isHalted();

    /**
     * {@return {@code true} if the response has been committed}
     */
    boolean isCommitted();

    /**
     * {@return the committed response, if committed}
     */
    Optional<Response> response();

    /**
     * {@return {@code true} if the transport has cancelled the request}
     */
    boolean isCancelled();

    /**
     * Registers a callback to run just before the response is committed.<p>
     *
     * Callbacks run in the reverse order of registration. A callback may
     * still put headers and status. An exception thrown by a callback aborts
     * the commit.
     *
     * @param callback to run
     * @return this context
     * @throws NullPointerException if {@code callback} is {@code null}
     * @throws ResponseCommittedException if the response is committed
     */
    Context registerBeforeCommit(Consumer<Context> callback);

    // Response
    // --------

    /**
     * Renders the action's template and commits the response.<p>
     *
     * Same as {@code render(actionName())}.
     *
     * @return this context
     *
     * @throws FormatNotAcceptedException
     *             if the resolved format is not accepted
     * @throws TemplateNotFoundException
     *             if the template, or the layout, does not exist
     * @throws ResponseCommittedException
     *             if the response is committed
     */
    Context render();

    /**
     * Renders a template and commits the response.<p>
     *
     * The template is either a name ("show"), rendered in the negotiated
     * format, or a name with a format suffix ("show.json"), which is an
     * explicit format.
     *
     * @param template name of template
     * @return this context
     *
     * @throws NullPointerException
     *             if {@code template} is {@code null}
     * @throws FormatNotAcceptedException
     *             if the resolved format is not accepted
     * @throws TemplateNotFoundException
     *             if the template, or the layout, does not exist
     * @throws ResponseCommittedException
     *             if the response is committed
     */
    Context render(String template);

    /**
     * Renders a template with additional assigns and commits the response.<p>
     *
     * The given assigns take precedence over the context's assigns, and are
     * not stored in the context.
     *
     * @param template name of template
     * @param assigns additional template variables
     * @return this context
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws FormatNotAcceptedException
     *             if the resolved format is not accepted
     * @throws TemplateNotFoundException
     *             if the template, or the layout, does not exist
     * @throws ResponseCommittedException
     *             if the response is committed
     */
    Context render(String template, Map<String, ?> assigns);

    /**
     * Redirects the client and commits the response.<p>
     *
     * The status is 302 (Found) unless a status was put. The "Location"
     * header is set and the body is empty. If
     * {@link Config#persistFlashOnRedirect()} is enabled and the flash was
     * fetched, the flash messages put during this request are persisted.
     * Messages carried over from the previous request are not.
     *
     * @param destination of redirect
     * @return this context
     * @throws NullPointerException if {@code destination} is {@code null}
     * @throws ResponseCommittedException if the response is committed
     */
    Context redirect(Redirect destination);

    /**
     * Commits a text body ("text/plain; charset=utf-8").
     *
     * @param body of response
     * @return this context
     * @throws NullPointerException if {@code body} is {@code null}
     * @throws ResponseCommittedException if the response is committed
     */
    Context text(String body);

    /**
     * Commits a HTML body ("text/html; charset=utf-8").
     *
     * @param body of response
     * @return this context
     * @throws NullPointerException if {@code body} is {@code null}
     * @throws ResponseCommittedException if the response is committed
     */
    Context html(String body);

    /**
     * Serializes an object to JSON and commits it ("application/json").
     *
     * @param body to serialize
     * @return this context
     * @throws IllegalArgumentException if the object can not be serialized
     * @throws ResponseCommittedException if the response is committed
     */
    Context json(Object body);

    /**
     * Commits a body as-is.<p>
     *
     * The "Content-Type" is whatever was put; none if none was put.
     *
     * @param body of response
     * @return this context
     * @throws NullPointerException if {@code body} is {@code null}
     * @throws ResponseCommittedException if the response is committed
     */
    Context sendResp(String body);
}
