package alpha.haka;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;

import static java.lang.System.Logger.Level.INFO;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Config}.
 */
final class DefaultConfig implements Config {
    private final Builder builder;
    private final int     readBufferSize;
    private final System.Logger.Level logLevel;
    private final String  threadName;

    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder        = b;
        readBufferSize = s.readBufferSize;
        logLevel       = s.logLevel;
        threadName     = s.threadName;
    }

    @Override
    public int readBufferSize() {
        return readBufferSize;
    }

    @Override
    public System.Logger.Level logLevel() {
        return logLevel;
    }

    @Override
    public String threadName() {
        return threadName;
    }

    @Override
    public Builder toBuilder() {
        return builder;
    }

    @Override
    public String toString() {
        return DefaultConfig.class.getSimpleName() + "{" +
                "readBufferSize=" + readBufferSize +
                ", logLevel=" + logLevel +
                ", threadName='" + threadName + "'}";
    }

    /**
     * Builders are backwards-linked in a chain and the only real state they
     * each store is a modifying action, which is replayed against a fresh
     * {@link MutableState} when the configuration is built.
     */
    static final class DefaultBuilder implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();

        static class MutableState {
            int                 readBufferSize = 8_192;
            System.Logger.Level logLevel       = INFO;
            String              threadName     = "haka-event-loop";
        }

        private final DefaultBuilder prev;
        private final Consumer<MutableState> modifier;

        private DefaultBuilder() {
            prev = null;
            modifier = null;
        }

        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            this.prev = requireNonNull(prev);
            this.modifier = requireNonNull(modifier);
        }

        @Override
        public Builder readBufferSize(int newVal) {
            if (newVal <= 0) {
                throw new IllegalArgumentException("Read buffer size must be positive, was: " + newVal);
            }
            return new DefaultBuilder(this, s -> s.readBufferSize = newVal);
        }

        @Override
        public Builder logLevel(System.Logger.Level newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.logLevel = newVal);
        }

        @Override
        public Builder threadName(String newVal) {
            if (newVal.isBlank()) {
                throw new IllegalArgumentException("Thread name is blank.");
            }
            return new DefaultBuilder(this, s -> s.threadName = newVal);
        }

        @Override
        public Config build() {
            return new DefaultConfig(this, constructState());
        }

        private MutableState constructState() {
            Deque<Consumer<MutableState>> mods = new ArrayDeque<>();

            for (var b = this; b.modifier != null; b = b.prev) {
                mods.addFirst(b.modifier);
            }

            MutableState s = new MutableState();
            mods.forEach(m -> m.accept(s));
            return s;
        }
    }
}
