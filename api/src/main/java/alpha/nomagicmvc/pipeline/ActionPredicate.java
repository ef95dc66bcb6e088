package alpha.nomagicmvc.pipeline;

import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Decides which actions a stage runs for.<p>
 *
 * A predicate is a first-class value so that the names it references can be
 * validated when a controller is built. Naming an action that the controller
 * does not have is a programming error.
 *
 * <pre>
 *   builder.plug("auth", requireUser, ActionPredicate.except("login"));
 *   builder.plug("autoRender", Stages.autoRender(), ActionPredicate.only("index", "show"));
 * </pre>
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class ActionPredicate
{
    private static final ActionPredicate ALWAYS = new ActionPredicate(Kind.ALWAYS, Set.of());

    private enum Kind { ALWAYS, ONLY, EXCEPT }

    /**
     * {@return a predicate that includes all actions}
     */
    public static ActionPredicate always() {
        return ALWAYS;
    }

    /**
     * Returns a predicate that includes only the given actions.
     *
     * @param actions to include
     * @return a predicate
     * @throws NullPointerException if an action is {@code null}
     * @throws IllegalArgumentException if no action is given, or an action is repeated
     */
    public static ActionPredicate only(String... actions) {
        return new ActionPredicate(Kind.ONLY, requireAny(actions));
    }

    /**
     * Returns a predicate that includes all actions but the given ones.
     *
     * @param actions to exclude
     * @return a predicate
     * @throws NullPointerException if an action is {@code null}
     * @throws IllegalArgumentException if no action is given, or an action is repeated
     */
    public static ActionPredicate except(String... actions) {
        return new ActionPredicate(Kind.EXCEPT, requireAny(actions));
    }

    private static Set<String> requireAny(String... actions) {
        if (actions.length == 0) {
            throw new IllegalArgumentException("No actions.");
        }
        // Set.of rejects duplicates and nulls
        return Set.of(actions);
    }

    private final Kind kind;
    private final Set<String> actions;

    private ActionPredicate(Kind kind, Set<String> actions) {
        this.kind = kind;
        this.actions = actions;
    }

    /**
     * Tests an action.
     *
     * @param action name of action
     * @return {@code true} if the stage should run for the action
     * @throws NullPointerException if {@code action} is {@code null}
     */
    public boolean test(String action) {
        requireNonNull(action);
        return switch (kind) {
            case ALWAYS -> true;
            case ONLY   -> actions.contains(action);
            case EXCEPT -> !actions.contains(action);
        };
    }

    /**
     * {@return the action names referenced by this predicate}
     */
    public Set<String> referencedActions() {
        return actions;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ALWAYS -> "always";
            case ONLY   -> "only" + actions;
            case EXCEPT -> "except" + actions;
        };
    }
}
