package com.questrail.btlink.config;

import com.questrail.btlink.internal.exec.ListenRetryPolicy;
import com.questrail.btlink.mux.StreamMultiplexer;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LinkRuntimeConfigTest {

    @Test
    void defaultsMatchTheDocumentedValues() {
        LinkRuntimeConfig config = LinkRuntimeConfig.defaults();

        assertEquals("btlink", config.serviceName());
        assertEquals(StandardCharsets.UTF_8, config.textCharset());
        assertEquals(StreamMultiplexer.DEFAULT_DELIMITERS, config.textDelimiters());
        assertFalse(config.listenRetryPolicy().enabled());
    }

    @Test
    void builderOverridesEachField() {
        LinkRuntimeConfig config = LinkRuntimeConfig.builder()
                .withServiceName("telemetry")
                .withTextCharset(StandardCharsets.US_ASCII)
                .withTextDelimiters(Set.of((byte) ';'))
                .withListenRetryPolicy(ListenRetryPolicy.of(3, Duration.ofSeconds(1)))
                .build();

        assertEquals("telemetry", config.serviceName());
        assertEquals(StandardCharsets.US_ASCII, config.textCharset());
        assertEquals(Set.of((byte) ';'), config.textDelimiters());
        assertEquals(3, config.listenRetryPolicy().maxRetries());
    }

    @Test
    void delimitersAreCopied() {
        Set<Byte> delimiters = new HashSet<>(Set.of((byte) '\n'));
        LinkRuntimeConfig config = LinkRuntimeConfig.builder().withTextDelimiters(delimiters).build();

        delimiters.add((byte) ';');

        assertEquals(Set.of((byte) '\n'), config.textDelimiters());
    }

    @Test
    void rejectsBlankServiceName() {
        assertThrows(IllegalArgumentException.class, () ->
                LinkRuntimeConfig.builder().withServiceName("  ").build()
        );
    }

    @Test
    void rejectsEmptyDelimiters() {
        assertThrows(IllegalArgumentException.class, () ->
                LinkRuntimeConfig.builder().withTextDelimiters(Set.of()).build()
        );
    }
}
