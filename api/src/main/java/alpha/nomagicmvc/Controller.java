package alpha.nomagicmvc;

import alpha.nomagicmvc.context.Context;
import alpha.nomagicmvc.context.NoResponseException;
import alpha.nomagicmvc.context.RequestCancelledException;
import alpha.nomagicmvc.handler.Action;
import alpha.nomagicmvc.handler.ActionNonUniqueException;
import alpha.nomagicmvc.handler.ActionNotFoundException;
import alpha.nomagicmvc.handler.ExceptionHandler;
import alpha.nomagicmvc.message.Request;
import alpha.nomagicmvc.message.Response;
import alpha.nomagicmvc.pipeline.ActionPredicate;
import alpha.nomagicmvc.pipeline.Pipeline;
import alpha.nomagicmvc.pipeline.Stage;
import alpha.nomagicmvc.pipeline.Stages;
import alpha.nomagicmvc.render.TemplateEngine;
import alpha.nomagicmvc.session.SessionStore;

import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * A group of named actions that share a namespace, a configuration and a
 * pipeline.<p>
 *
 * A router calls the controller with a request and the name of the action
 * that it resolved. The controller creates a {@link Context}, runs the
 * pipeline and returns the committed response:
 *
 * <pre>
 *   Controller users = Controller.builder("users")
 *           .templates(engine)
 *           .sessions(store)
 *           .plug("formats", Stages.acceptFormats(HTML, JSON))
 *           .plug("flash", Stages.fetchFlash())
 *           .action("index", ctx -&gt; ctx.assign("users", repo.all()))
 *           .action("create", ctx -&gt; {
 *               repo.add(ctx.param("name").orElseThrow());
 *               ctx.flash().put("info", "Created.");
 *               ctx.redirect(Redirect.to("/users"));
 *           })
 *           .plug("render", Stages.autoRender(), only("index"))
 *           .build();
 *
 *   Response rsp = users.call(request, "index");
 * </pre>
 *
 * Plugs and the dispatch stage run in the order they were registered. If no
 * {@link Stages#DISPATCH} stage is registered, one is appended last.<p>
 *
 * The controller is immutable and thread-safe.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Controller
{
    /**
     * Returns a new controller builder.
     *
     * @param namespace of controller, e.g. "users"
     * @return a new builder
     * @throws NullPointerException if {@code namespace} is {@code null}
     * @throws IllegalArgumentException if {@code namespace} is empty
     */
    static Builder builder(String namespace) {
        return ControllerFactory.provider().newController(namespace);
    }

    /**
     * Returns the namespace.<p>
     *
     * The namespace is the default namespace templates are resolved in.
     *
     * @return the namespace
     */
    String namespace();

    /**
     * {@return the configuration}
     */
    Config config();

    /**
     * {@return the names of all actions}
     */
    Set<String> actionNames();

    /**
     * Returns an action.
     *
     * @param name of action
     * @return the action, if registered
     */
    Optional<Action> action(String name);

    /**
     * {@return the pipeline, including the dispatch stage}
     */
    Pipeline pipeline();

    /**
     * {@return the template engine}
     */
    TemplateEngine templates();

    /**
     * {@return the session store, if configured}
     */
    Optional<SessionStore> sessions();

    /**
     * Processes a request.<p>
     *
     * Same as {@code call(request, action, Thread.currentThread()::isInterrupted)}.
     *
     * @param request inbound request
     * @param action name of action
     *
     * @return the response
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws RequestCancelledException
     *             if the current thread is interrupted at a stage boundary
     */
    default Response call(Request request, String action) {
        var thr = Thread.currentThread();
        return call(request, action, thr::isInterrupted);
    }

    /**
     * Processes a request.<p>
     *
     * The controller creates a context and runs the pipeline. If the
     * pipeline completes without a response having been committed, a
     * {@link NoResponseException} is raised. Any exception, except
     * {@link RequestCancelledException}, is handed to the exception handlers,
     * whose response is returned. An unknown action is treated the same way
     * (using an {@link ActionNotFoundException}).
     *
     * @param request inbound request
     * @param action name of action
     * @param cancelled queried at stage boundaries
     *
     * @return the response
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws RequestCancelledException
     *             if {@code cancelled} returns {@code true} at a stage boundary
     */
    Response call(Request request, String action, BooleanSupplier cancelled);

    /**
     * Builder of a {@link Controller}.<p>
     *
     * The builder is not thread-safe.
     */
    interface Builder
    {
        /**
         * Sets the configuration.<p>
         *
         * Defaults to {@link Config#DEFAULT}.
         *
         * @param config of controller
         * @return this (for chaining/fluency)
         * @throws NullPointerException if {@code config} is {@code null}
         */
        Builder config(Config config);

        /**
         * Sets the template engine (required).
         *
         * @param engine template engine
         * @return this (for chaining/fluency)
         * @throws NullPointerException if {@code engine} is {@code null}
         */
        Builder templates(TemplateEngine engine);

        /**
         * Sets the session store.<p>
         *
         * Fetching the session or the flash requires a session store.
         *
         * @param store session store
         * @return this (for chaining/fluency)
         * @throws NullPointerException if {@code store} is {@code null}
         */
        Builder sessions(SessionStore store);

        /**
         * Registers an action.
         *
         * @param name of action
         * @param action the action
         *
         * @return this (for chaining/fluency)
         *
         * @throws NullPointerException
         *             if any argument is {@code null}
         * @throws IllegalArgumentException
         *             if {@code name} is empty
         * @throws ActionNonUniqueException
         *             if an action with the same name is already registered
         */
        Builder action(String name, Action action);

        /**
         * Appends a stage that runs for all actions.
         *
         * @param name of stage
         * @param stage to append
         * @return this (for chaining/fluency)
         * @throws IllegalArgumentException if the name is already registered
         */
        default Builder plug(String name, Stage stage) {
            return plug(name, stage, ActionPredicate.always());
        }

        /**
         * Appends a stage.
         *
         * @param name of stage
         * @param stage to append
         * @param predicate decides which actions the stage runs for
         * @return this (for chaining/fluency)
         * @throws IllegalArgumentException if the name is already registered
         */
        Builder plug(String name, Stage stage, ActionPredicate predicate);

        /**
         * Appends all stages of a pipeline.
         *
         * @param pipeline to append
         * @return this (for chaining/fluency)
         * @throws IllegalArgumentException if a name is already registered
         */
        Builder pipeline(Pipeline pipeline);

        /**
         * Adds an exception handler.<p>
         *
         * Handlers are called in the order they were added, before the
         * {@link ExceptionHandler#BASE base handler}.
         *
         * @param handler exception handler
         * @return this (for chaining/fluency)
         * @throws NullPointerException if {@code handler} is {@code null}
         */
        Builder exceptionHandler(ExceptionHandler handler);

        /**
         * Builds the controller.
         *
         * @return a new controller
         *
         * @throws NullPointerException
         *             if no template engine has been set
         * @throws ActionNotFoundException
         *             if a stage predicate references an unknown action
         */
        Controller build();
    }
}
