/**
 * Home of the library-provided controller implementation.<p>
 * 
 * The public types in this package are {@link
 * alpha.nomagicmvc.core.DefaultControllerFactory}, which is discovered by
 * {@link alpha.nomagicmvc.ControllerFactory#provider()}, and {@link
 * alpha.nomagicmvc.core.CookieSessionStore}. All other types in this package
 * can be regarded as an implementation detail.<p>
 * 
 * Implementations of public interfaces use the "Default" name-prefix. For
 * example, {@code DefaultContext} implements {@code Context}. Classes that
 * only perform one step of request processing, such as
 * {@code RenderDispatcher} and {@code ResponseFinalizer}, are not named after
 * an interface.<p>
 * 
 * Unless documented differently, all methods within this package expect to
 * be given non-null arguments and will return non-null results.
 */
package alpha.nomagicmvc.core;
