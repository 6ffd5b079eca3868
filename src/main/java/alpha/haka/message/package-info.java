/**
 * HTTP request and response.
 */
package alpha.haka.message;
