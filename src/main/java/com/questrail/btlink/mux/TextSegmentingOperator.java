package com.questrail.btlink.mux;

import io.reactivex.rxjava3.core.FlowableOperator;
import io.reactivex.rxjava3.core.FlowableSubscriber;

import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.util.Objects;
import java.util.Set;

/**
 * TextSegmentingOperator
 * -----------------------------------------------------------------------------
 * Cuts a byte stream into text records at delimiter bytes.
 *
 * <h2>Segmentation rule</h2>
 * <ul>
 *   <li>A non-delimiter byte is appended to the pending buffer.</li>
 *   <li>Every delimiter byte emits the pending buffer as text and clears it.
 *       An empty buffer emits {@code ""}, so {@code "AB\r\nCD"} with
 *       delimiters {@code {CR, LF}} yields {@code "AB"}, {@code ""} and (once
 *       the stream ends) {@code "CD"}. Runs of delimiters do not collapse.</li>
 *   <li>On completion or error a non-empty buffer is emitted once before the
 *       terminal signal.</li>
 * </ul>
 *
 * <p>Each subscriber gets its own buffer. The operator emits at most one item
 * per upstream item but may emit one extra item on termination, so it must be
 * followed by a buffering stage ({@code onBackpressureBuffer()}). Upstream
 * demand is counted in bytes, not strings, so the operator stays internal to
 * {@link StreamMultiplexer#textStream(Set)}, which adds that stage.</p>
 */
final class TextSegmentingOperator implements FlowableOperator<String, Byte>
{
    private final Set<Byte> delimiters;
    private final Charset charset;

    TextSegmentingOperator(Set<Byte> delimiters, Charset charset) {
        Objects.requireNonNull(delimiters, "delimiters");
        if (delimiters.isEmpty()) {
            throw new IllegalArgumentException("at least one delimiter byte is required");
        }
        this.delimiters = Set.copyOf(delimiters);
        this.charset = Objects.requireNonNull(charset, "charset");
    }

    @Override
    public Subscriber<? super Byte> apply(Subscriber<? super String> downstream) {
        return new SegmentingSubscriber(downstream, delimiters, charset);
    }

    private static final class SegmentingSubscriber implements FlowableSubscriber<Byte>
    {
        private final Subscriber<? super String> downstream;
        private final Set<Byte> delimiters;
        private final Charset charset;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        private SegmentingSubscriber(Subscriber<? super String> downstream,
                                     Set<Byte> delimiters,
                                     Charset charset) {
            this.downstream = downstream;
            this.delimiters = delimiters;
            this.charset = charset;
        }

        @Override
        public void onSubscribe(Subscription s) {
            downstream.onSubscribe(s);
        }

        @Override
        public void onNext(Byte b) {
            if (delimiters.contains(b)) {
                emit();
            }
            else {
                buffer.write(b);
            }
        }

        @Override
        public void onError(Throwable t) {
            if (buffer.size() > 0) {
                emit();
            }
            downstream.onError(t);
        }

        @Override
        public void onComplete() {
            if (buffer.size() > 0) {
                emit();
            }
            downstream.onComplete();
        }

        private void emit() {
            String text = buffer.toString(charset);
            buffer.reset();
            downstream.onNext(text);
        }
    }
}
