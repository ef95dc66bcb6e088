package alpha.nomagicmvc.core;

import alpha.nomagicmvc.Config;
import alpha.nomagicmvc.Controller;
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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;

import static alpha.nomagicmvc.message.Responses.internalServerError;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Controller}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultController implements Controller
{
    private static final System.Logger LOG
            = System.getLogger(DefaultController.class.getPackageName());

    private final String namespace;
    private final Config config;
    private final TemplateEngine templates;
    private final SessionStore sessions;
    private final Map<String, Action> actions;
    private final Pipeline pipeline;
    private final List<ExceptionHandler> handlers;

    private DefaultController(DefaultBuilder b, Pipeline pipeline) {
        this.namespace = b.namespace;
        this.config    = b.config;
        this.templates = b.templates;
        this.sessions  = b.sessions;
        this.actions   = Map.copyOf(b.actions);
        this.pipeline  = pipeline;
        this.handlers  = List.copyOf(b.handlers);
    }

    @Override
    public String namespace() {
        return namespace;
    }

    @Override
    public Config config() {
        return config;
    }

    @Override
    public Set<String> actionNames() {
        return actions.keySet();
    }

    @Override
    public Optional<Action> action(String name) {
        return Optional.ofNullable(actions.get(name));
    }

    @Override
    public Pipeline pipeline() {
        return pipeline;
    }

    @Override
    public TemplateEngine templates() {
        return templates;
    }

    @Override
    public Optional<SessionStore> sessions() {
        return Optional.ofNullable(sessions);
    }

    @Override
    public Response call(Request request, String action, BooleanSupplier cancelled) {
        var ctx = new DefaultContext(request, this, action, cancelled);
        LOG.log(DEBUG, () -> "Calling " + namespace + "#" + action + " for " + request);
        try {
            if (!actions.containsKey(action)) {
                throw new ActionNotFoundException(namespace, action);
            }
            pipeline.run(ctx, action);
            return ctx.response().orElseThrow(() ->
                    new NoResponseException(namespace, action));
        } catch (RequestCancelledException e) {
            LOG.log(DEBUG, () -> e.getMessage() + " Not responding.");
            throw e;
        } catch (Exception e) {
            return handle(e, ctx);
        }
    }

    private Response handle(Exception exc, DefaultContext ctx) {
        LOG.log(DEBUG, () -> "Attempting to resolve " + exc);
        try {
            return new ExceptionChain(handlers, exc, ctx).ignite();
        } catch (RuntimeException fromChain) {
            exc.addSuppressed(fromChain);
            LOG.log(ERROR, "Exception processing chain failed to handle this", exc);
            return internalServerError();
        }
    }

    @Override
    public String toString() {
        return DefaultController.class.getSimpleName() + "{" +
                "namespace=" + namespace +
                ", actions=" + actions.keySet() +
                ", pipeline=" + pipeline + '}';
    }

    static final class DefaultBuilder implements Controller.Builder
    {
        private final String namespace;
        private Config config = Config.DEFAULT;
        private TemplateEngine templates;
        private SessionStore sessions;
        private final Map<String, Action> actions = new LinkedHashMap<>();
        private final DefaultPipeline.DefaultBuilder stages = new DefaultPipeline.DefaultBuilder();
        private final List<ExceptionHandler> handlers = new ArrayList<>();

        DefaultBuilder(String namespace) {
            if (requireNonNull(namespace, "namespace").isEmpty()) {
                throw new IllegalArgumentException("Empty namespace.");
            }
            this.namespace = namespace;
        }

        @Override
        public Controller.Builder config(Config config) {
            this.config = requireNonNull(config, "config");
            return this;
        }

        @Override
        public Controller.Builder templates(TemplateEngine engine) {
            this.templates = requireNonNull(engine, "engine");
            return this;
        }

        @Override
        public Controller.Builder sessions(SessionStore store) {
            this.sessions = requireNonNull(store, "store");
            return this;
        }

        @Override
        public Controller.Builder action(String name, Action action) {
            requireNonNull(name, "name");
            requireNonNull(action, "action");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Empty action name.");
            }
            if (actions.putIfAbsent(name, action) != null) {
                throw new ActionNonUniqueException(namespace, name);
            }
            return this;
        }

        @Override
        public Controller.Builder plug(String name, Stage stage, ActionPredicate predicate) {
            stages.register(name, stage, predicate);
            return this;
        }

        @Override
        public Controller.Builder pipeline(Pipeline pipeline) {
            pipeline.registrations().forEach(r ->
                    stages.register(r.name(), r.stage(), r.predicate()));
            return this;
        }

        @Override
        public Controller.Builder exceptionHandler(ExceptionHandler handler) {
            handlers.add(requireNonNull(handler, "handler"));
            return this;
        }

        @Override
        public Controller build() {
            requireNonNull(templates, "templates");
            var p = stages.build();
            if (!stages.contains(Stages.DISPATCH)) {
                p = p.toBuilder()
                     .register(Stages.DISPATCH_NAME, Stages.DISPATCH)
                     .build();
            }
            for (var r : p.registrations()) {
                for (String a : r.predicate().referencedActions()) {
                    if (!actions.containsKey(a)) {
                        throw new ActionNotFoundException(namespace, a);
                    }
                }
            }
            return new DefaultController(this, p);
        }
    }
}
