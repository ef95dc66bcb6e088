package alpha.nomagicmvc.pipeline;

import alpha.nomagicmvc.ControllerFactory;
import alpha.nomagicmvc.context.Context;
import alpha.nomagicmvc.context.RequestCancelledException;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An ordered chain of named stages.<p>
 *
 * Stages run in registration order. A stage whose {@link ActionPredicate} is
 * false for the current action is skipped. The pipeline stops, without running
 * later stages, as soon as the context is halted or committed. Before every
 * stage, the pipeline checks whether the request has been cancelled.<p>
 *
 * <pre>
 *   Pipeline p = Pipeline.builder()
 *           .register("formats", Stages.acceptFormats(HTML, JSON))
 *           .register("flash", Stages.fetchFlash())
 *           .register("dispatch", Stages.DISPATCH)
 *           .register("render", Stages.autoRender(), only("index"))
 *           .build();
 * </pre>
 *
 * A pipeline is immutable and thread-safe.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Pipeline
{
    /**
     * Returns a new builder.
     *
     * @return a new builder
     */
    static Builder builder() {
        return ControllerFactory.provider().newPipeline();
    }

    /**
     * {@return a pipeline without stages}
     */
    static Pipeline empty() {
        return builder().build();
    }

    /**
     * {@return the registered stages, in order}
     */
    List<Registration> registrations();

    /**
     * Returns a builder populated with the registrations of this pipeline.
     *
     * @return a new builder
     */
    Builder toBuilder();

    /**
     * Runs the pipeline.
     *
     * @param ctx request context
     * @param action name of action
     *
     * @return the given context
     *
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws RequestCancelledException
     *             if the request is cancelled at a stage boundary
     * @throws Exception
     *             as thrown by a stage
     */
    Context run(Context ctx, String action) throws Exception;

    /**
     * A registered stage.
     *
     * @param name of stage, unique within the pipeline
     * @param stage the stage
     * @param predicate decides which actions the stage runs for
     */
    record Registration(String name, Stage stage, ActionPredicate predicate) {
        /**
         * Initializes this object.
         *
         * @throws NullPointerException if any argument is {@code null}
         */
        public Registration {
            requireNonNull(name, "name");
            requireNonNull(stage, "stage");
            requireNonNull(predicate, "predicate");
        }
    }

    /**
     * Builder of a {@link Pipeline}.<p>
     *
     * The builder is not thread-safe.
     */
    interface Builder
    {
        /**
         * Appends a stage that runs for all actions.
         *
         * @param name of stage
         * @param stage to append
         *
         * @return this (for chaining/fluency)
         *
         * @throws NullPointerException
         *             if any argument is {@code null}
         * @throws IllegalArgumentException
         *             if {@code name} is empty or already registered
         */
        default Builder register(String name, Stage stage) {
            return register(name, stage, ActionPredicate.always());
        }

        /**
         * Appends a stage.
         *
         * @param name of stage
         * @param stage to append
         * @param predicate decides which actions the stage runs for
         *
         * @return this (for chaining/fluency)
         *
         * @throws NullPointerException
         *             if any argument is {@code null}
         * @throws IllegalArgumentException
         *             if {@code name} is empty or already registered
         */
        Builder register(String name, Stage stage, ActionPredicate predicate);

        /**
         * Builds the pipeline.
         *
         * @return a new pipeline
         */
        Pipeline build();
    }
}
