package com.termdag.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.termdag.api.CycleFoundException;
import com.termdag.engine.LayoutConfig;
import com.termdag.engine.LayoutEngine;
import com.termdag.io.EdgeListParser;

import lombok.extern.log4j.Log4j2;

/**
 * Renders diagrams on a single consumer thread fed by a Disruptor ring
 * buffer.
 *
 * <h3>Workflow</h3>
 * <ol>
 * <li>Any number of producer threads call {@link #publish(long, String)}.</li>
 * <li>The Disruptor sequences the requests.</li>
 * <li>The consumer thread parses each request into its own graph, renders
 * it, and hands the diagram (or the cycle error) to the
 * {@link RenderCallback}.</li>
 * </ol>
 *
 * <p>
 * Requests never share layout state. A cyclic input is reported through
 * {@link RenderCallback#onFailed}; it does not stop the consumer.
 */
@Log4j2
public final class RenderPublisher implements EventHandler<RenderEvent> {
    private final LayoutEngine engine;
    private final RenderCallback callback;
    private final Disruptor<RenderEvent> disruptor;
    private RingBuffer<RenderEvent> ringBuffer;

    public RenderPublisher(LayoutConfig config, int bufferSize, RenderCallback callback) {
        this.engine = new LayoutEngine(config);
        this.callback = callback;
        this.disruptor = new Disruptor<>(
                RenderEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(this);
    }

    public RenderPublisher start() {
        this.ringBuffer = disruptor.start();
        log.debug("Render publisher started with {} slots", ringBuffer.getBufferSize());
        return this;
    }

    /** Queues a request; blocks while the ring buffer is full. */
    public void publish(long requestId, String text) {
        if (ringBuffer == null)
            throw new IllegalStateException("Render publisher not started");
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).set(requestId, text);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /** Drains outstanding requests, then stops the consumer thread. */
    public void shutdown() {
        disruptor.shutdown();
    }

    @Override
    public void onEvent(RenderEvent event, long sequence, boolean endOfBatch) {
        final long requestId = event.requestId();
        final String text = event.text();
        event.clear();
        String diagram;
        try {
            diagram = engine.render(EdgeListParser.parse(text));
        } catch (CycleFoundException e) {
            log.debug("Request {} rejected: {}", requestId, e.getMessage());
            callback.onFailed(requestId, e);
            return;
        }
        callback.onRendered(requestId, diagram);
    }

    /**
     * Receives render results on the consumer thread.
     */
    public interface RenderCallback {
        void onRendered(long requestId, String diagram);

        void onFailed(long requestId, CycleFoundException error);
    }
}
