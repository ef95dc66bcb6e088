package alpha.nomagicmvc;

import alpha.nomagicmvc.pipeline.Pipeline;

import java.util.ServiceLoader;

/**
 * Factory of controller and pipeline builders.<p>
 *
 * The NoMagicMVC library does not support custom implementations of the API,
 * and application code should have no use of this type. It is only public
 * because it is a requirement by Java's service-provider mechanism.
 */
public interface ControllerFactory {
    /**
     * Returns the one factory found on the class path.<p>
     *
     * This method should only be used by {@link Controller#builder(String)}
     * and {@link Pipeline#builder()}.
     *
     * @return the factory
     * @throws AssertionError if not exactly one factory is found
     */
    static ControllerFactory provider() {
        var loader = ServiceLoader.load(ControllerFactory.class);
        var factories = loader.stream().toList();
        if (factories.size() != 1) {
            throw new AssertionError(
                "Expected 1 factory, saw: " + factories.size());
        }
        return factories.get(0).get();
    }

    /**
     * Creates a new controller builder.
     *
     * @param namespace of controller
     * @return a new builder
     * @throws NullPointerException if {@code namespace} is {@code null}
     * @throws IllegalArgumentException if {@code namespace} is empty
     */
    Controller.Builder newController(String namespace);

    /**
     * Creates a new pipeline builder.
     *
     * @return a new builder
     */
    Pipeline.Builder newPipeline();
}
