package alpha.nomagicmvc.core;

import alpha.nomagicmvc.context.Context;
import alpha.nomagicmvc.context.Redirect;
import alpha.nomagicmvc.context.ResponseCommittedException;
import alpha.nomagicmvc.context.Status;
import alpha.nomagicmvc.flash.Flash;
import alpha.nomagicmvc.message.MediaType;
import alpha.nomagicmvc.message.Request;
import alpha.nomagicmvc.message.Response;
import alpha.nomagicmvc.render.Format;
import alpha.nomagicmvc.session.SessionStore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

import static alpha.nomagicmvc.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.nomagicmvc.HttpConstants.HeaderName.LOCATION;
import static alpha.nomagicmvc.HttpConstants.StatusCode.THREE_HUNDRED_TWO;
import static java.lang.String.CASE_INSENSITIVE_ORDER;
import static java.lang.System.Logger.Level.DEBUG;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Context}.<p>
 *
 * Not thread-safe.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultContext implements Context
{
    private static final System.Logger LOG
            = System.getLogger(DefaultContext.class.getPackageName());

    private static final byte[] EMPTY = new byte[0];

    private final Request request;
    private final DefaultController controller;
    private final String action;
    private final BooleanSupplier cancelled;
    private final Map<String, List<String>> headers;
    private final Map<String, Object> assigns;
    private final Deque<Consumer<Context>> beforeCommit;

    private Status status;
    private List<Format> accepted;
    private Format explicitFormat;
    private String view;
    private String layout;
    private Map<String, Object> session;
    private boolean sessionChanged,
                    sessionDropped;
    private DefaultFlash flash;
    private boolean halted;
    private Response response;

    DefaultContext(
            Request request, DefaultController controller,
            String action, BooleanSupplier cancelled)
    {
        this.request      = requireNonNull(request);
        this.controller   = requireNonNull(controller);
        this.action       = requireNonNull(action);
        this.cancelled    = requireNonNull(cancelled);
        this.headers      = new TreeMap<>(CASE_INSENSITIVE_ORDER);
        this.assigns      = new LinkedHashMap<>();
        this.beforeCommit = new ArrayDeque<>();
        this.accepted     = controller.config().acceptedFormats();
        this.view         = controller.namespace();
        var dl = controller.config().defaultLayout();
        this.layout       = dl.isEmpty() ? null : dl;
    }

    @Override
    public Request request() {
        return request;
    }

    @Override
    public DefaultController controller() {
        return controller;
    }

    @Override
    public String actionName() {
        return action;
    }

    // Status
    // ------

    @Override
    public Optional<Status> status() {
        return Optional.ofNullable(status);
    }

    @Override
    public Context putStatus(int code) {
        requireUncommitted("put status");
        status = Status.of(code);
        return this;
    }

    @Override
    public Context putStatus(String name) {
        requireNonNull(name);
        requireUncommitted("put status");
        status = Status.of(name);
        return this;
    }

    // Headers
    // -------

    @Override
    public Map<String, List<String>> respHeaders() {
        return unmodifiableMap(headers);
    }

    @Override
    public Context putRespHeader(String name, String value) {
        requireNonNull(name, "name");
        requireNonNull(value, "value");
        requireUncommitted("put header");
        var vals = new ArrayList<String>(1);
        vals.add(value);
        headers.put(name, vals);
        return this;
    }

    @Override
    public Context addRespHeader(String name, String value) {
        requireNonNull(name, "name");
        requireNonNull(value, "value");
        requireUncommitted("add header");
        headers.computeIfAbsent(name, k -> new ArrayList<>(1)).add(value);
        return this;
    }

    @Override
    public Context deleteRespHeader(String name) {
        requireNonNull(name, "name");
        requireUncommitted("delete header");
        headers.remove(name);
        return this;
    }

    @Override
    public Context putRespContentType(MediaType type) {
        return putRespHeader(CONTENT_TYPE, type.toString());
    }

    // Assigns
    // -------

    @Override
    public Map<String, Object> assigns() {
        return unmodifiableMap(assigns);
    }

    @Override
    public Context assign(String key, Object value) {
        requireNonNull(key, "key");
        assigns.put(key, value);
        return this;
    }

    // Formats
    // -------

    @Override
    public List<Format> acceptedFormats() {
        return accepted;
    }

    @Override
    public Context acceptFormats(Format... formats) {
        var copy = List.of(formats);
        if (copy.isEmpty()) {
            throw new IllegalArgumentException("No formats.");
        }
        accepted = copy;
        return this;
    }

    @Override
    public Context putFormat(Format format) {
        explicitFormat = requireNonNull(format);
        return this;
    }

    @Override
    public Format negotiateFormat() {
        return FormatNegotiator.negotiate(explicitFormat, accepted, request, config());
    }

    // View and layout
    // ---------------

    @Override
    public Context putView(String namespace) {
        view = requireNotEmpty(namespace, "namespace");
        return this;
    }

    @Override
    public String view() {
        return view;
    }

    @Override
    public Context putLayout(String name) {
        layout = requireNotEmpty(name, "name");
        return this;
    }

    @Override
    public Context putNoLayout() {
        layout = null;
        return this;
    }

    @Override
    public Optional<String> layout() {
        return Optional.ofNullable(layout);
    }

    // Session
    // -------

    @Override
    public Context fetchSession() {
        if (session != null) {
            return this;
        }
        requireUncommitted("fetch session");
        final SessionStore store = controller.sessions().orElseThrow(() ->
                new IllegalStateException("No session store configured for controller \"" +
                        controller.namespace() + "\"."));
        session = new LinkedHashMap<>(store.load(request));
        registerBeforeCommit(ctx -> {
            if (sessionDropped) {
                LOG.log(DEBUG, "Dropping session.");
                store.drop(ctx);
            } else if (sessionChanged) {
                LOG.log(DEBUG, "Saving session.");
                store.save(unmodifiableMap(session), ctx);
            }
        });
        return this;
    }

    @Override
    public boolean isSessionFetched() {
        return session != null;
    }

    @Override
    public Map<String, Object> session() {
        return unmodifiableMap(requireSession());
    }

    @Override
    public Optional<Object> getSession(String key) {
        return Optional.ofNullable(requireSession().get(key));
    }

    @Override
    public Context putSession(String key, Object value) {
        requireNonNull(key, "key");
        requireNonNull(value, "value");
        requireSession().put(key, value);
        sessionChanged = true;
        return this;
    }

    @Override
    public Context deleteSession(String key) {
        if (requireSession().remove(key) != null) {
            sessionChanged = true;
        }
        return this;
    }

    @Override
    public Context clearSession() {
        var s = requireSession();
        if (!s.isEmpty()) {
            s.clear();
            sessionChanged = true;
        }
        return this;
    }

    @Override
    public Context dropSession() {
        requireSession().clear();
        sessionDropped = true;
        return this;
    }

    private Map<String, Object> requireSession() {
        if (session == null) {
            throw new IllegalStateException("Session not fetched.");
        }
        return session;
    }

    // Flash
    // -----

    @Override
    public Context fetchFlash() {
        if (flash != null) {
            return this;
        }
        fetchSession();
        final String key = config().flashSessionKey();
        flash = DefaultFlash.hydrate(session.get(key));
        deleteSession(key);
        registerBeforeCommit(ctx -> {
            var v = flash.toSessionValue();
            if (v != null) {
                putSession(key, v);
            } else {
                deleteSession(key);
            }
        });
        return this;
    }

    @Override
    public boolean isFlashFetched() {
        return flash != null;
    }

    @Override
    public Flash flash() {
        if (flash == null) {
            throw new IllegalStateException("Flash not fetched.");
        }
        return flash;
    }

    // Life cycle
    // ----------

    @Override
    public Context halt() {
        halted = true;
        return this;
    }

    @Override
    public boolean isHalted() {
        return halted;
    }

    @Override
    public boolean isCommitted() {
        return response != null;
    }

    @Override
    public Optional<Response> response() {
        return Optional.ofNullable(response);
    }

    @Override
    public boolean isCancelled() {
        return cancelled.getAsBoolean();
    }

    @Override
    public Context registerBeforeCommit(Consumer<Context> callback) {
        requireNonNull(callback);
        requireUncommitted("register before-commit callback");
        beforeCommit.push(callback);
        return this;
    }

    // Response
    // --------

    @Override
    public Context render() {
        RenderDispatcher.render(this, null, Map.of());
        return this;
    }

    @Override
    public Context render(String template) {
        RenderDispatcher.render(this, requireNonNull(template), Map.of());
        return this;
    }

    @Override
    public Context render(String template, Map<String, ?> assigns) {
        RenderDispatcher.render(this, requireNonNull(template), requireNonNull(assigns));
        return this;
    }

    @Override
    public Context redirect(Redirect destination) {
        requireNonNull(destination);
        requireUncommitted("redirect");
        if (flash != null && config().persistFlashOnRedirect()) {
            flash.persistPut();
        }
        if (status == null) {
            status = Status.of(THREE_HUNDRED_TWO);
        }
        putRespHeader(LOCATION, destination.location());
        ResponseFinalizer.commit(this, "redirect", EMPTY);
        return this;
    }

    @Override
    public Context text(String body) {
        return send(MediaType.TEXT_PLAIN, "send text", requireNonNull(body).getBytes(UTF_8));
    }

    @Override
    public Context html(String body) {
        return send(MediaType.TEXT_HTML, "send html", requireNonNull(body).getBytes(UTF_8));
    }

    @Override
    public Context json(Object body) {
        requireUncommitted("send json");
        return send(MediaType.APPLICATION_JSON, "send json", Json.write(body));
    }

    @Override
    public Context sendResp(String body) {
        ResponseFinalizer.commit(this, "send", requireNonNull(body).getBytes(UTF_8));
        return this;
    }

    private Context send(MediaType type, String operation, byte[] body) {
        requireUncommitted(operation);
        if (respHeader(CONTENT_TYPE).isEmpty()) {
            putRespContentType(type.withCharsetUtf8());
        }
        ResponseFinalizer.commit(this, operation, body);
        return this;
    }

    // Used by ResponseFinalizer
    // -------------------------

    void requireUncommitted(String operation) {
        if (response != null) {
            throw new ResponseCommittedException(operation);
        }
    }

    void runBeforeCommit() {
        Consumer<Context> c;
        while ((c = beforeCommit.poll()) != null) {
            c.accept(this);
        }
    }

    void seal(Response rsp) {
        assert response == null;
        response = rsp;
    }

    private static String requireNotEmpty(String str, String what) {
        if (requireNonNull(str, what).isEmpty()) {
            throw new IllegalArgumentException("Empty " + what + ".");
        }
        return str;
    }

    @Override
    public String toString() {
        return DefaultContext.class.getSimpleName() + "{" +
                "controller=" + controller.namespace() +
                ", action=" + action +
                ", status=" + status +
                ", halted=" + halted +
                ", committed=" + isCommitted() + '}';
    }
}
