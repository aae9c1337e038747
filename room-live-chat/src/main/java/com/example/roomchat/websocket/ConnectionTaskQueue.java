package com.example.roomchat.websocket;

import com.example.roomchat.config.ChatModuleConfig;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs socket event handlers off the Netty event loop while keeping the events of one connection
 * in arrival order. Different connections proceed in parallel.
 */
@Slf4j
@Component
public class ConnectionTaskQueue {

    private final Executor executor;
    private final ConcurrentMap<UUID, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public ConnectionTaskQueue(@Qualifier(ChatModuleConfig.SOCKET_EVENT_EXECUTOR) Executor executor) {
        this.executor = executor;
    }

    public CompletableFuture<Void> submit(UUID sessionId, String description, Runnable task) {
        CompletableFuture<Void> next = tails.compute(sessionId, (id, tail) -> {
            CompletableFuture<Void> previous = tail == null ? CompletableFuture.completedFuture(null) : tail;
            return previous
                    .thenRunAsync(task, executor)
                    .exceptionally(ex -> {
                        log.error("Handler {} failed for connection {}", description, id, ex);
                        return null;
                    });
        });
        // An idle connection keeps no entry, including one whose events arrive after release.
        next.whenComplete((ignored, ex) -> tails.remove(sessionId, next));
        return next;
    }

    /** Forgets the connection's chain; tasks already queued still run. */
    public void release(UUID sessionId) {
        tails.remove(sessionId);
    }

    int pendingConnections() {
        return tails.size();
    }
}
