package alpha.haka;

/**
 * Server configuration.<p>
 *
 * The implementation is immutable and thread-safe.<p>
 *
 * The implementation used if none is specified is {@link #DEFAULT}.<p>
 *
 * Any configuration object can be turned into a builder for customization. The
 * static method {@link #configuration()} is a shortcut for {@code
 * Config.DEFAULT.toBuilder()}.
 */
public interface Config
{
    /**
     * Values used:<p>
     *
     * Read buffer size = 8 192 <br>
     * Log level = INFO <br>
     * Thread name = "haka-event-loop"
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();

    /**
     * Returns the size in bytes of the buffer each connection reads into.<p>
     *
     * The size does not limit the size of a request head; the connection keeps
     * reading and accumulating bytes until the head is complete.<p>
     *
     * The default implementation returns {@code 8_192}.
     *
     * @return number of bytes
     */
    int readBufferSize();

    /**
     * Returns the least severe level logged by the server and its
     * components.<p>
     *
     * Records below this level are dropped before they reach the logging
     * backend. Records at or above the level are forwarded and may still be
     * filtered by the backend's own configuration.<p>
     *
     * The default implementation returns {@link System.Logger.Level#INFO}.
     *
     * @return the log level
     */
    System.Logger.Level logLevel();

    /**
     * Returns the name of the single thread on which the server accepts
     * connections and runs all I/O completions and request handlers.<p>
     *
     * The default implementation returns "haka-event-loop".
     *
     * @return thread name
     */
    String threadName();

    /**
     * Returns a builder pre-populated with the values of this configuration.
     *
     * @return a builder
     */
    Builder toBuilder();

    /**
     * Shortcut for {@code Config.DEFAULT.toBuilder()}.
     *
     * @return a builder pre-populated with default values
     */
    static Builder configuration() {
        return DEFAULT.toBuilder();
    }

    /**
     * Builder of a {@link Config}.<p>
     *
     * The builder is immutable. All setters return a new builder instance
     * representing the new state. The builder can be used as a template to
     * build many configurations.
     */
    interface Builder {
        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws IllegalArgumentException if {@code newVal} is not positive
         * @see Config#readBufferSize()
         */
        Builder readBufferSize(int newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @see Config#logLevel()
         */
        Builder logLevel(System.Logger.Level newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @throws IllegalArgumentException if {@code newVal} is blank
         * @see Config#threadName()
         */
        Builder threadName(String newVal);

        /**
         * Builds the configuration.
         *
         * @return the configuration
         */
        Config build();
    }
}
