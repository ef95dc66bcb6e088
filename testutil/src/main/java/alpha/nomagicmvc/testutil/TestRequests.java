package alpha.nomagicmvc.testutil;

import alpha.nomagicmvc.message.Request;

import static alpha.nomagicmvc.HttpConstants.HeaderName.ACCEPT;
import static alpha.nomagicmvc.HttpConstants.Method.GET;
import static alpha.nomagicmvc.HttpConstants.Method.POST;

/**
 * Factories of {@link Request}s.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class TestRequests {
    private TestRequests() {
        // Empty
    }
    
    /**
     * Returns a GET request.
     *
     * @param path of request
     * @return a request
     */
    public static Request get(String path) {
        return Request.builder(GET, path).build();
    }
    
    /**
     * Returns a GET request with an "Accept" header.
     *
     * @param path of request
     * @param accept header value
     * @return a request
     */
    public static Request get(String path, String accept) {
        return Request.builder(GET, path).header(ACCEPT, accept).build();
    }
    
    /**
     * Returns a POST request with parameters.
     *
     * @param path of request
     * @param nameValuePairs parameter names and values, interleaved
     * @return a request
     * @throws IllegalArgumentException if an odd number of strings is given
     */
    public static Request post(String path, String... nameValuePairs) {
        if (nameValuePairs.length % 2 != 0) {
            throw new IllegalArgumentException("Odd number of strings.");
        }
        var b = Request.builder(POST, path);
        for (int i = 0; i < nameValuePairs.length; i += 2) {
            b = b.param(nameValuePairs[i], nameValuePairs[i + 1]);
        }
        return b.build();
    }
}
