package alpha.haka.handler;

import alpha.haka.message.Request;
import alpha.haka.message.Response;

/**
 * Populates the response of a request.<p>
 * 
 * A handler is invoked at most once per request, on the server's event loop
 * thread. The given response has status code 200, Content-Type "text/plain"
 * and an empty body. The handler mutates the response in place; the server
 * writes it when the handler returns.<p>
 * 
 * Any exception thrown is caught by the server, logged, and turned into a 500
 * (Internal Server Error) response. Whatever the handler did to the response
 * before throwing is discarded.<p>
 * 
 * A handler must not block, as doing so stalls every other connection on the
 * server.
 * 
 * @see RequestHandlers
 */
@FunctionalInterface
public interface RequestHandler
{
    /**
     * Handle the request.
     * 
     * @param request inbound request
     * @param response outbound response to populate
     * 
     * @throws Exception if anything goes wrong
     */
    void handle(Request request, Response response) throws Exception;
}
