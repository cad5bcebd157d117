package io.nlpqlresolver.core.config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Settings for {@code DefinitionResolver}. Passed explicitly to the resolver's constructor.
 *
 * @param trace   log the complete file data after reduction at INFO instead of DEBUG
 * @param charset encoding used to read definitions files
 */
public record ResolverConfig(boolean trace, Charset charset) {

    public ResolverConfig {
        Objects.requireNonNull(charset, "charset must not be null");
    }

    /** Trace off, UTF-8. */
    public static ResolverConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ResolverConfig}; starts from the defaults. */
    public static final class Builder {

        private boolean trace = false;
        private Charset charset = StandardCharsets.UTF_8;

        private Builder() {}

        public Builder trace(boolean trace) {
            this.trace = trace;
            return this;
        }

        public Builder charset(Charset charset) {
            this.charset = charset;
            return this;
        }

        public ResolverConfig build() {
            return new ResolverConfig(trace, charset);
        }
    }
}
