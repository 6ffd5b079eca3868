/**
 * Server internals: the accept loop and the connection state machine.<p>
 * 
 * Nothing in this package except {@link alpha.haka.internal.DefaultServer} is
 * meant for application use.
 */
package alpha.haka.internal;
