/**
 * Runnable examples.
 */
package alpha.haka.examples;
