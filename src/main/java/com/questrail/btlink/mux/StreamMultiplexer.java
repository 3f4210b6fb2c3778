package com.questrail.btlink.mux;

import com.questrail.btlink.api.PeerId;
import com.questrail.btlink.transport.ConnectionClosedException;
import com.questrail.btlink.transport.DuplexChannel;
import com.questrail.btlink.transport.TransportException;
import com.questrail.btlink.transport.TransportFailures;

import io.reactivex.rxjava3.core.BackpressureStrategy;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.FlowableEmitter;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Serializable;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * StreamMultiplexer
 * =============================================================================
 * Turns one {@link DuplexChannel} into independently consumable, shared streams
 * without ever reading the channel twice for the same stream kind.
 *
 * <h2>Streams</h2>
 * <ul>
 *   <li>{@link #byteStream()}: every byte read from the channel</li>
 *   <li>{@link #textStream(Set)}: byte stream cut at delimiter bytes; every
 *       delimiter ends a record and runs of delimiters do not collapse</li>
 *   <li>{@link #recordStream()}: records decoded by the channel itself</li>
 * </ul>
 *
 * <h2>One read loop per stream kind</h2>
 * The byte and record streams are created on first access and cached. The
 * first subscriber starts a blocking read loop on the read {@link Scheduler};
 * every later subscriber attaches to the live loop and sees only emissions from
 * that point on. The loop is connected once and never restarted: unsubscribing
 * every consumer does not stop it, and resubscribing does not start a second
 * one. Only closing the channel or a read failure ends it.
 *
 * <h2>Backpressure</h2>
 * The read loop never blocks on a slow consumer, and one consumer never holds
 * back another. Each subscription gets its own unbounded buffer in front of the
 * shared loop, so a fast subscriber keeps receiving while a slow one lags. A
 * consumer that stops requesting grows only its own buffer, for as long as the
 * peer keeps sending.
 *
 * <h2>Failure and close</h2>
 * A read that fails because the channel is gone surfaces as
 * {@link ConnectionClosedException}; any other failure surfaces as
 * {@link TransportException}. Either one marks this multiplexer dead and closes
 * it. {@link #close()} is idempotent and never throws; it clears the cached
 * streams before closing the channel so a blocked loop observes the close on
 * its next step. A loop performs at most one read after {@code close()}.
 * After death every stream accessor returns a stream that errors immediately.
 *
 * <h2>Writes</h2>
 * Sends are serialized with each other, so two records are never interleaved
 * on the wire, but never with reads. A failed write returns {@code false}, marks
 * the multiplexer failed and closes it.
 */
public final class StreamMultiplexer implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(StreamMultiplexer.class);

    public static final byte CR = '\r';
    public static final byte LF = '\n';

    /** Default text delimiters: carriage return and line feed. */
    public static final Set<Byte> DEFAULT_DELIMITERS = Set.of(CR, LF);

    @FunctionalInterface
    private interface ChannelRead<T>
    {
        T read() throws IOException;
    }

    @FunctionalInterface
    private interface ChannelWrite
    {
        void write() throws IOException;
    }

    private final DuplexChannel channel;
    private final PeerId peer;
    private final Scheduler readScheduler;
    private final Charset charset;
    private final Set<Byte> defaultDelimiters;

    private final Object streamLock = new Object();
    private final Object writeLock = new Object();

    private volatile boolean open = true;
    private volatile TransportException failure;

    // Guarded by streamLock; cleared on close.
    private Flowable<Byte> bytes;
    private Flowable<Object> records;

    /**
     * Multiplexer with I/O-scheduler read loops, UTF-8 text and CR/LF delimiters.
     */
    public StreamMultiplexer(DuplexChannel channel) {
        this(channel, Schedulers.io(), StandardCharsets.UTF_8, DEFAULT_DELIMITERS);
    }

    /**
     * @param channel           the channel to own; closed by this multiplexer
     * @param readScheduler     scheduler the blocking read loops run on; must
     *                          tolerate long blocking tasks
     * @param charset           charset text records are decoded with
     * @param defaultDelimiters delimiters used by {@link #textStream()}
     */
    public StreamMultiplexer(DuplexChannel channel,
                             Scheduler readScheduler,
                             Charset charset,
                             Set<Byte> defaultDelimiters)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.peer = channel.remotePeer();
        this.readScheduler = Objects.requireNonNull(readScheduler, "readScheduler");
        this.charset = Objects.requireNonNull(charset, "charset");
        this.defaultDelimiters = Set.copyOf(defaultDelimiters);
    }

    // -------------------------------------------------------------------------
    // Streams
    // -------------------------------------------------------------------------

    /**
     * Shared stream of single bytes. Effectively infinite while the channel is
     * open; terminates with an error when it closes or fails.
     */
    public Flowable<Byte> byteStream() {
        synchronized (streamLock) {
            if (!open) {
                return Flowable.error(deathCause());
            }
            if (bytes == null) {
                bytes = shared("byte", this::readOneByte);
            }
            return bytes;
        }
    }

    /** Text records delimited by CR or LF (or the configured defaults). */
    public Flowable<String> textStream() {
        return textStream(defaultDelimiters);
    }

    /**
     * Text records cut from {@link #byteStream()} at any of {@code delimiters}.
     * A trailing partial record is emitted before the terminal signal.
     */
    public Flowable<String> textStream(Set<Byte> delimiters) {
        TextSegmentingOperator segmenter = new TextSegmentingOperator(delimiters, charset);
        return byteStream()
                .lift(segmenter)
                .onBackpressureBuffer();
    }

    /** Shared stream of records decoded by the channel. */
    public Flowable<Object> recordStream() {
        synchronized (streamLock) {
            if (!open) {
                return Flowable.error(deathCause());
            }
            if (records == null) {
                records = shared("record", channel::readRecord);
            }
            return records;
        }
    }

    /** {@link #recordStream()} restricted to records of {@code type}. */
    public <T> Flowable<T> recordStream(Class<T> type) {
        Objects.requireNonNull(type, "type");
        return recordStream().ofType(type);
    }

    private <T> Flowable<T> shared(String kind, ChannelRead<T> read) {
        return Flowable.<T>create(emitter -> runReadLoop(kind, emitter, read), BackpressureStrategy.BUFFER)
                .subscribeOn(readScheduler)
                .publish()
                .autoConnect()
                .onBackpressureBuffer();
    }

    private Byte readOneByte() throws IOException {
        int b = channel.readByte();
        if (b < 0) {
            throw new ConnectionClosedException("End of stream from " + peer);
        }
        return (byte) b;
    }

    private <T> void runReadLoop(String kind, FlowableEmitter<T> emitter, ChannelRead<T> read) {
        log.debug("Starting {} read loop for {}", kind, peer);

        try {
            while (open && !emitter.isCancelled()) {
                T value = read.read();
                if (!open) {
                    // Read completed after close(); the value belongs to a dead channel.
                    break;
                }
                emitter.onNext(value);
            }
        } catch (IOException | RuntimeException e) {
            if (open) {
                TransportException cause = TransportFailures.classify(e);
                log.debug("{} read loop for {} failed: {}", kind, peer, cause.getMessage());
                fail(cause);
            }
            emitter.tryOnError(deathCause());
            return;
        }

        log.debug("{} read loop for {} stopped", kind, peer);
        emitter.tryOnError(deathCause());
    }

    // -------------------------------------------------------------------------
    // Writes
    // -------------------------------------------------------------------------

    /**
     * Send one byte.
     *
     * @return true if sent; false if the channel is closed or the write failed
     */
    public boolean send(byte oneByte) {
        return send(new byte[] {oneByte});
    }

    /**
     * Send raw bytes.
     *
     * @return true if sent; false if the channel is closed or the write failed
     */
    public boolean send(byte[] data) {
        Objects.requireNonNull(data, "data");
        return write(() -> channel.write(data));
    }

    /**
     * Send text encoded with the multiplexer charset. No delimiter is appended.
     *
     * @return true if sent; false if the channel is closed or the write failed
     */
    public boolean send(String text) {
        Objects.requireNonNull(text, "text");
        return send(text.getBytes(charset));
    }

    /**
     * Send one record through the channel's record encoding.
     *
     * @return true if sent; false if the channel is closed or the write failed
     */
    public boolean sendRecord(Serializable record) {
        Objects.requireNonNull(record, "record");
        return write(() -> channel.writeRecord(record));
    }

    private boolean write(ChannelWrite op) {
        if (!open) {
            return false;
        }
        synchronized (writeLock) {
            if (!open) {
                return false;
            }
            try {
                op.write();
                return true;
            } catch (IOException | RuntimeException e) {
                log.warn("Fail to send data to {}; closing channel", peer, e);
                fail(TransportFailures.classify(e));
                return false;
            }
        }
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    public boolean isOpen() {
        return open;
    }

    public PeerId remotePeer() {
        return peer;
    }

    /**
     * The failure that killed this multiplexer, if it died of one rather than
     * being closed.
     */
    public Optional<TransportException> failure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Close the channel and drop all stream state. Idempotent; errors raised
     * by the channel while closing are logged and dropped.
     */
    @Override
    public void close() {
        synchronized (streamLock) {
            if (!open) {
                return;
            }
            open = false;
            bytes = null;
            records = null;
        }

        log.debug("Closing channel to {}", peer);
        try {
            channel.close();
        } catch (IOException | RuntimeException e) {
            log.debug("Ignoring error while closing channel to {}", peer, e);
        }
    }

    private void fail(TransportException cause) {
        synchronized (streamLock) {
            if (failure == null && open) {
                failure = cause;
            }
        }
        close();
    }

    private TransportException deathCause() {
        TransportException f = failure;
        return f != null ? f : new ConnectionClosedException();
    }
}
