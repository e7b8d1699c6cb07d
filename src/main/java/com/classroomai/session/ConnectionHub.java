package com.classroomai.session;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.classroomai.dto.LessonEvent;
import com.classroomai.model.ConnectionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Live connections of one lesson. A broadcast is encoded once and queued on every
 * connection independently; a connection whose queue rejects the message is pruned.
 */
public class ConnectionHub {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionHub.class);

    private final long lessonId;
    private final ObjectMapper objectMapper;
    private final int outboundBufferSize;
    private final Map<String, LessonConnection> connections = new ConcurrentHashMap<>();

    public ConnectionHub(long lessonId, ObjectMapper objectMapper, int outboundBufferSize) {
        this.lessonId = lessonId;
        this.objectMapper = objectMapper;
        this.outboundBufferSize = outboundBufferSize;
    }

    public LessonConnection register(ConnectionRecord record) {
        LessonConnection connection = new LessonConnection(record, outboundBufferSize);
        connections.put(record.connectionId(), connection);
        logger.info("Connection {} ({}) joined lesson {} ({} connected)",
                record.connectionId(), record.role().wireName(), lessonId, connections.size());
        return connection;
    }

    public boolean deregister(String connectionId) {
        LessonConnection removed = connections.remove(connectionId);
        if (removed == null) {
            return false;
        }
        removed.close();
        logger.info("Connection {} left lesson {} ({} connected)", connectionId, lessonId, connections.size());
        return true;
    }

    /**
     * Deliver an event to every registered connection.
     * @return number of connections the event was queued on
     */
    public int broadcast(LessonEvent event) {
        String payload = encode(event);
        int delivered = 0;
        for (LessonConnection connection : List.copyOf(connections.values())) {
            if (connection.emit(payload)) {
                delivered++;
            } else {
                prune(connection);
            }
        }
        logger.debug("Lesson {} broadcast {} to {} connection(s)", lessonId, event.getType().wireName(), delivered);
        return delivered;
    }

    public boolean sendTo(LessonConnection connection, LessonEvent event) {
        if (connection == null) {
            return false;
        }
        if (connection.emit(encode(event))) {
            return true;
        }
        prune(connection);
        return false;
    }

    public int connectionCount() {
        return connections.size();
    }

    public void closeAll() {
        for (LessonConnection connection : List.copyOf(connections.values())) {
            connections.remove(connection.id());
            connection.close();
        }
        logger.info("Connection hub closed for lesson {}", lessonId);
    }

    String encode(LessonEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode " + event.getType().wireName() + " event", e);
        }
    }

    private void prune(LessonConnection connection) {
        if (connections.remove(connection.id(), connection)) {
            connection.close();
            logger.warn("Pruned connection {} from lesson {}: outbound queue closed or full",
                    connection.id(), lessonId);
        }
    }
}
