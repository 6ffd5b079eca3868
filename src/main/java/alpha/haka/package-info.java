/**
 * Home of the {@code HttpServer}.<p>
 * 
 * <strong>Architectural Overview</strong>. The {@link alpha.haka.HttpServer
 * HttpServer} accepts connections and serves one request per connection. Each
 * request is resolved by a {@link alpha.haka.route.Router Router} to a {@link
 * alpha.haka.handler.RequestHandler RequestHandler}, which populates a {@link
 * alpha.haka.message.Response Response} for the {@link
 * alpha.haka.message.Request Request}.<p>
 * 
 * <strong>Examples</strong>. See package {@link alpha.haka.examples}.
 */
package alpha.haka;
