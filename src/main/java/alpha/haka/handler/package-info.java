/**
 * Request handlers.
 */
package alpha.haka.handler;
