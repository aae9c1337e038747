package com.example.roomchat.websocket;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ConnectionTaskQueueTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final ConnectionTaskQueue queue = new ConnectionTaskQueue(executor);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void tasksOfOneConnectionRunInSubmissionOrder() throws Exception {
        UUID sessionId = UUID.randomUUID();
        List<Integer> order = new CopyOnWriteArrayList<>();
        CompletableFuture<Void> last = null;
        for (int i = 0; i < 50; i++) {
            int index = i;
            last = queue.submit(sessionId, "task-" + i, () -> {
                if (index % 7 == 0) {
                    sleep(2);
                }
                order.add(index);
            });
        }

        last.get(5, TimeUnit.SECONDS);

        assertEquals(50, order.size());
        for (int i = 0; i < 50; i++) {
            assertEquals(i, order.get(i));
        }
    }

    @Test
    void failedTaskDoesNotBlockTheChain() throws Exception {
        UUID sessionId = UUID.randomUUID();
        List<String> ran = new CopyOnWriteArrayList<>();

        queue.submit(sessionId, "boom", () -> {
            throw new IllegalStateException("boom");
        });
        queue.submit(sessionId, "after", () -> ran.add("after")).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("after"), ran);
    }

    @Test
    void slowConnectionDoesNotBlockOthers() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        queue.submit(UUID.randomUUID(), "slow", () -> await(release));

        queue.submit(UUID.randomUUID(), "fast", () -> { }).get(5, TimeUnit.SECONDS);

        release.countDown();
    }

    @Test
    void releaseForgetsConnection() {
        UUID sessionId = UUID.randomUUID();
        ConnectionTaskQueue inline = new ConnectionTaskQueue(Runnable::run);
        inline.submit(sessionId, "noop", () -> { });

        inline.release(sessionId);

        assertEquals(0, inline.pendingConnections());
    }

    @Test
    void lateEventAfterReleaseLeavesNoEntry() {
        UUID sessionId = UUID.randomUUID();
        ConnectionTaskQueue inline = new ConnectionTaskQueue(Runnable::run);
        inline.release(sessionId);
        List<String> ran = new CopyOnWriteArrayList<>();

        inline.submit(sessionId, "late", () -> ran.add("late"));

        assertEquals(List.of("late"), ran);
        assertEquals(0, inline.pendingConnections());
    }

    @Test
    void finishedChainsAreDropped() throws Exception {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<Void> blocked = queue.submit(first, "blocked", () -> await(release));
        queue.submit(second, "quick", () -> { }).get(5, TimeUnit.SECONDS);

        release.countDown();
        blocked.get(5, TimeUnit.SECONDS);

        assertTrue(waitForNoPending(queue));
    }

    // Removal runs in a completion callback that may trail the future a caller waits on.
    private static boolean waitForNoPending(ConnectionTaskQueue queue) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (queue.pendingConnections() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        return queue.pendingConnections() == 0;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
