package alpha.nomagicmvc.core;

import alpha.nomagicmvc.Controller;
import alpha.nomagicmvc.ControllerFactory;
import alpha.nomagicmvc.pipeline.Pipeline;

/**
 * Default {@code ControllerFactory}.<p>
 *
 * This class is specified in the provider configuration file
 * "META-INF/services/alpha.nomagicmvc.ControllerFactory", and so it must be
 * public with a public no-arg constructor.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public class DefaultControllerFactory implements ControllerFactory
{
    /**
     * Constructs this object.
     */
    public DefaultControllerFactory() {
        // Empty
    }

    @Override
    public Controller.Builder newController(String namespace) {
        return new DefaultController.DefaultBuilder(namespace);
    }

    @Override
    public Pipeline.Builder newPipeline() {
        return new DefaultPipeline.DefaultBuilder();
    }
}
