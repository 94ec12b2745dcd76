package com.termdag.disruptor;

/**
 * A mutable render request, used within the LMAX Disruptor RingBuffer.
 *
 * <p>
 * <b>Flyweight Pattern:</b> Instances are pre-allocated during RingBuffer
 * construction and reused for every request that passes through their slot.
 *
 * <p>
 * <b>Fields:</b>
 * <ul>
 * <li>{@code requestId}: caller-chosen correlation id.</li>
 * <li>{@code text}: the arrow-chain input to render.</li>
 * </ul>
 */
public final class RenderEvent {
    private long requestId;
    private String text;

    public void set(long requestId, String text) {
        this.requestId = requestId;
        this.text = text;
    }

    public long requestId() {
        return requestId;
    }

    public String text() {
        return text;
    }

    public void clear() {
        requestId = 0;
        text = null;
    }
}
