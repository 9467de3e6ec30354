package com.autoagent.agent;

import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Runs subscription sources on daemon threads and forwards their records to a queue.
 * <p>
 * The listener only ever offers to the queue. When the queue is full the record is dropped and
 * logged; the source is never blocked by a slow consumer.
 */
@Slf4j
public class SubscriptionListener {

    private final BlockingQueue<InboundRecord> queue;
    private final ExecutorService executor;
    private final Map<String, Future<?>> subscriptions = new ConcurrentHashMap<>();

    public SubscriptionListener(BlockingQueue<InboundRecord> queue) {
        this.queue = queue;
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("subscription-");
        threadFactory.setDaemon(true);
        this.executor = Executors.newCachedThreadPool(threadFactory);
    }

    /**
     * Starts a subscription unless one with the same name is already running.
     *
     * @return {@code true} if a new subscription was started.
     */
    public synchronized boolean start(String name, SubscriptionSource source) {
        if (isListening(name)) {
            return false;
        }
        subscriptions.put(name, executor.submit(() -> run(name, source)));
        log.info("Started subscription {}", name);
        return true;
    }

    public boolean isListening(String name) {
        Future<?> future = subscriptions.get(name);
        return future != null && !future.isDone();
    }

    /**
     * Interrupts every running subscription.
     */
    public synchronized void stop() {
        subscriptions.values().forEach(future -> future.cancel(true));
        subscriptions.clear();
        executor.shutdownNow();
    }

    private void run(String name, SubscriptionSource source) {
        try {
            source.stream(record -> {
                if (!queue.offer(record)) {
                    log.warn("Inbox full, dropping record {} from {}", record.id(), name);
                }
            });
            log.info("Subscription {} ended", name);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Subscription {} stopped", name);
        } catch (Exception e) {
            log.error("Subscription {} failed: {}", name, e.getMessage(), e);
        }
    }
}
