/**
 * Routes, static mounts and the router that resolves requests to handlers.
 */
package alpha.haka.route;
