package com.questrail.btlink.config;

import com.questrail.btlink.internal.exec.ListenRetryPolicy;
import com.questrail.btlink.mux.StreamMultiplexer;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregated configuration for a connection manager.
 *
 * <ul>
 *   <li><b>serviceName</b>: service record name every listen attempt registers</li>
 *   <li><b>textCharset</b>: charset for {@code send(String)} and text records</li>
 *   <li><b>textDelimiters</b>: delimiter bytes of the default text stream</li>
 *   <li><b>listenRetryPolicy</b>: automatic re-arming after failed listens</li>
 * </ul>
 */
public record LinkRuntimeConfig(
    String serviceName,
    Charset textCharset,
    Set<Byte> textDelimiters,
    ListenRetryPolicy listenRetryPolicy
) {
    public static final String DEFAULT_SERVICE_NAME = "btlink";

    public LinkRuntimeConfig {
        Objects.requireNonNull(serviceName, "serviceName");
        Objects.requireNonNull(textCharset, "textCharset");
        Objects.requireNonNull(textDelimiters, "textDelimiters");
        Objects.requireNonNull(listenRetryPolicy, "listenRetryPolicy");

        if (serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be blank");
        }
        if (textDelimiters.isEmpty()) {
            throw new IllegalArgumentException("textDelimiters must not be empty");
        }
        textDelimiters = Set.copyOf(textDelimiters);
    }

    /**
     * Service "btlink", UTF-8 text cut at CR or LF, no automatic listen retry.
     */
    public static LinkRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String serviceName = DEFAULT_SERVICE_NAME;
        private Charset textCharset = StandardCharsets.UTF_8;
        private Set<Byte> textDelimiters = StreamMultiplexer.DEFAULT_DELIMITERS;
        private ListenRetryPolicy listenRetryPolicy = ListenRetryPolicy.disabled();

        public Builder withServiceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder withTextCharset(Charset textCharset) {
            this.textCharset = textCharset;
            return this;
        }

        public Builder withTextDelimiters(Set<Byte> textDelimiters) {
            this.textDelimiters = textDelimiters;
            return this;
        }

        public Builder withListenRetryPolicy(ListenRetryPolicy listenRetryPolicy) {
            this.listenRetryPolicy = listenRetryPolicy;
            return this;
        }

        public LinkRuntimeConfig build() {
            return new LinkRuntimeConfig(serviceName, textCharset, textDelimiters, listenRetryPolicy);
        }
    }
}
