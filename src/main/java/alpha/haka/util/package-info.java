/**
 * Utilities.
 */
package alpha.haka.util;
