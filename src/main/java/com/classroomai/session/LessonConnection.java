package com.classroomai.session;

import com.classroomai.model.ConnectionRecord;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * One live client of a lesson with its own outbound queue.
 * Messages emitted before the transport subscribes are buffered, up to the queue capacity.
 */
public class LessonConnection {

    private final ConnectionRecord record;
    private final Sinks.Many<String> outbound;
    private volatile boolean closed;

    public LessonConnection(ConnectionRecord record, int bufferSize) {
        this.record = record;
        this.outbound = Sinks.many().multicast().onBackpressureBuffer(bufferSize);
    }

    public ConnectionRecord record() {
        return record;
    }

    public String id() {
        return record.connectionId();
    }

    /**
     * Queue an encoded message.
     * @return false if the connection is closed or its queue is full
     */
    public synchronized boolean emit(String payload) {
        if (closed) {
            return false;
        }
        Sinks.EmitResult result = outbound.tryEmitNext(payload);
        return result.isSuccess();
    }

    public Flux<String> outbound() {
        return outbound.asFlux();
    }

    public synchronized void close() {
        if (!closed) {
            closed = true;
            outbound.tryEmitComplete();
        }
    }

    public boolean isClosed() {
        return closed;
    }
}
