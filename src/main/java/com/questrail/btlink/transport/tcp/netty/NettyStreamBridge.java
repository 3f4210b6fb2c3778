package com.questrail.btlink.transport.tcp.netty;

import com.questrail.btlink.api.LinkEvent;
import com.questrail.btlink.api.PeerId;
import com.questrail.btlink.transport.DuplexChannel;
import com.questrail.btlink.transport.ObjectStreamDuplexChannel;
import com.questrail.btlink.transport.TransportException;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.channels.ClosedChannelException;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * NettyStreamBridge
 * -----------------------------------------------------------------------------
 * Pipeline handler that turns one Netty socket channel into the blocking byte
 * streams an {@link ObjectStreamDuplexChannel} reads and writes.
 *
 * <p>Inbound buffers are copied into {@code byte[]} chunks on the event loop and
 * queued; the read loop takes them from the queue on its own thread. Channel
 * activity is reported as link events. Nothing here blocks the event loop:
 * writes issued from an event-loop thread are not awaited.</p>
 */
final class NettyStreamBridge extends SimpleChannelInboundHandler<ByteBuf>
{
    private static final Logger log = LoggerFactory.getLogger(NettyStreamBridge.class);

    // Identity marker queued once the channel is gone.
    private static final byte[] END = new byte[0];

    private final PeerId peer;
    private final Consumer<LinkEvent> linkEvents;
    private final LinkedBlockingQueue<byte[]> chunks = new LinkedBlockingQueue<>();

    NettyStreamBridge(PeerId peer, Consumer<LinkEvent> linkEvents)
    {
        this.peer = Objects.requireNonNull(peer, "peer");
        this.linkEvents = Objects.requireNonNull(linkEvents, "linkEvents");
    }

    /**
     * Build the duplex channel over {@code channel}. Blocks until the peer's
     * object stream header arrives, so it must not run on the event loop.
     */
    DuplexChannel open(Channel channel) throws TransportException
    {
        return new ObjectStreamDuplexChannel(
                new ChunkInputStream(),
                new ChannelOutputStream(channel),
                peer,
                () -> {
                    chunks.offer(END);
                    channel.close();
                });
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception
    {
        linkEvents.accept(LinkEvent.connected(peer));
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
    {
        byte[] bytes = new byte[msg.readableBytes()];
        msg.readBytes(bytes);
        chunks.offer(bytes);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception
    {
        chunks.offer(END);
        linkEvents.accept(LinkEvent.disconnected(peer));
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        log.debug("Channel to {} failed; closing", peer, cause);
        ctx.close();
    }

    /**
     * Blocking view of the chunk queue. {@link #read(byte[], int, int)} returns
     * as soon as some bytes are available instead of waiting for a full buffer.
     */
    private final class ChunkInputStream extends InputStream
    {
        private byte[] current;
        private int position;
        private boolean ended;

        @Override
        public int read() throws IOException
        {
            if (!fill(true)) {
                return -1;
            }
            return current[position++] & 0xFF;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException
        {
            Objects.checkFromIndexSize(off, len, b.length);
            if (len == 0) {
                return 0;
            }
            if (!fill(true)) {
                return -1;
            }

            int n = 0;
            while (n < len && fill(false)) {
                int count = Math.min(len - n, current.length - position);
                System.arraycopy(current, position, b, off + n, count);
                position += count;
                n += count;
            }
            return n;
        }

        @Override
        public int available()
        {
            return current == null ? 0 : current.length - position;
        }

        /**
         * Make unread bytes available in {@code current}, waiting for a chunk
         * only if {@code block}. False at end of stream, or when nothing is
         * queued and waiting was not allowed.
         */
        private boolean fill(boolean block) throws IOException
        {
            while (current == null || position >= current.length) {
                if (ended) {
                    return false;
                }

                byte[] next;
                if (block) {
                    try {
                        next = chunks.take();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new InterruptedIOException("Interrupted waiting for data from " + peer);
                    }
                } else {
                    next = chunks.poll();
                    if (next == null) {
                        return false;
                    }
                }

                if (next == END) {
                    ended = true;
                    return false;
                }
                current = next;
                position = 0;
            }
            return true;
        }
    }

    /**
     * Writes straight through to the channel, waiting for each write to
     * complete unless called from the channel's own event loop.
     */
    private static final class ChannelOutputStream extends OutputStream
    {
        private final Channel channel;

        ChannelOutputStream(Channel channel)
        {
            this.channel = channel;
        }

        @Override
        public void write(int b) throws IOException
        {
            write(new byte[] {(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException
        {
            Objects.checkFromIndexSize(off, len, b.length);
            if (len == 0) {
                return;
            }
            if (!channel.isActive()) {
                throw new ClosedChannelException();
            }

            ChannelFuture write = channel.writeAndFlush(Unpooled.copiedBuffer(b, off, len));
            if (channel.eventLoop().inEventLoop()) {
                return;
            }

            write.awaitUninterruptibly();
            if (!write.isSuccess()) {
                Throwable cause = write.cause();
                if (cause instanceof IOException io) {
                    throw io;
                }
                throw new TransportException("Write to " + channel.remoteAddress() + " failed", cause);
            }
        }
    }
}
