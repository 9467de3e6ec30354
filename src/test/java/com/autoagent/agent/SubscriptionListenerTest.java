package com.autoagent.agent;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class SubscriptionListenerTest {

    private final BlockingQueue<InboundRecord> queue = new ArrayBlockingQueue<>(2);
    private final SubscriptionListener listener = new SubscriptionListener(queue);

    @AfterEach
    void tearDown() {
        listener.stop();
    }

    @Test
    void start_shouldForwardRecordsToQueue() {
        listener.start("room", sink -> sink.accept(record("1")));

        await().atMost(Duration.ofSeconds(5)).until(() -> queue.size() == 1);
        assertThat(queue.peek().id()).isEqualTo("1");
    }

    @Test
    void start_shouldDropRecordsWhenQueueIsFull() {
        CountDownLatch delivered = new CountDownLatch(1);
        listener.start("room", sink -> {
            for (int i = 0; i < 5; i++) {
                sink.accept(record(String.valueOf(i)));
            }
            delivered.countDown();
        });

        await().atMost(Duration.ofSeconds(5)).until(() -> delivered.getCount() == 0);
        assertThat(queue).extracting(InboundRecord::id).containsExactly("0", "1");
    }

    @Test
    void start_shouldRunOneSubscriptionPerName() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        SubscriptionSource blocking = sink -> {
            started.countDown();
            Thread.sleep(Long.MAX_VALUE);
        };

        assertThat(listener.start("room", blocking)).isTrue();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(listener.start("room", blocking)).isFalse();
        assertThat(listener.isListening("room")).isTrue();
    }

    @Test
    void stop_shouldInterruptRunningSubscriptions() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        listener.start("room", sink -> {
            try {
                Thread.sleep(Long.MAX_VALUE);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
        });
        await().atMost(Duration.ofSeconds(5)).until(() -> listener.isListening("room"));

        listener.stop();

        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(listener.isListening("room")).isFalse();
    }

    @Test
    void start_shouldSurviveFailingSource() {
        listener.start("broken", sink -> {
            throw new IllegalStateException("connection refused");
        });

        await().atMost(Duration.ofSeconds(5)).until(() -> !listener.isListening("broken"));
        assertThat(listener.start("healthy", sink -> sink.accept(record("ok")))).isTrue();
        await().atMost(Duration.ofSeconds(5)).until(() -> queue.size() == 1);
    }

    private static InboundRecord record(String id) {
        return new InboundRecord("echochambers", id, "alice", "hello @bot", Instant.EPOCH);
    }
}
