package com.hubframe.core.event;

import com.hubframe.api.event.BatchEventHandler;
import com.hubframe.api.event.Event;
import com.hubframe.api.event.EventHandler;
import com.hubframe.api.exception.HandlerFailureException;
import com.hubframe.core.concurrent.NamedThreadFactory;
import com.hubframe.core.config.HubFrameConfig;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 主题事件总线
 * <p>
 * 特点：
 * - 按主题防抖：窗口内的多次发布只投递最后一次，每次发布重置计时器
 * - 每个订阅者独立邮箱，按发布顺序分批投递
 * - 处理器异常被隔离，只记录和计数
 * - 保留最近投递的事件日志
 */
@Slf4j
public class TopicEventBus implements AutoCloseable {

    private final int debounceMs;
    private final int batchSize;
    private final int logCapacity;
    private final int mailboxCapacity;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService deliveryExecutor;

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Map<String, PendingEmission> pending = new ConcurrentHashMap<>();
    private final Deque<Event> eventLog = new ArrayDeque<>();

    private final AtomicLong emissionSequence = new AtomicLong();
    private final AtomicInteger subscriptionSequence = new AtomicInteger();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private final AtomicLong emittedCount = new AtomicLong();
    private final AtomicLong coalescedCount = new AtomicLong();
    private final AtomicLong deliveredCount = new AtomicLong();
    private final AtomicLong droppedCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();

    public TopicEventBus(HubFrameConfig config) {
        this(config.getEventDebounceMs(),
                config.getEventBatchSize(),
                config.getEventLogCapacity(),
                config.getMailboxCapacity(),
                config.getEventDeliveryThreads());
    }

    public TopicEventBus(int debounceMs, int batchSize, int logCapacity, int mailboxCapacity, int deliveryThreads) {
        if (batchSize < 1 || logCapacity < 1 || mailboxCapacity < 1 || deliveryThreads < 1) {
            throw new IllegalArgumentException("Event bus sizes must be positive");
        }
        this.debounceMs = debounceMs;
        this.batchSize = batchSize;
        this.logCapacity = logCapacity;
        this.mailboxCapacity = mailboxCapacity;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("hubframe-event-timer"));
        // 每个订阅者同一时刻至多一个投递任务，队列长度不会超过订阅者数量
        this.deliveryExecutor = new ThreadPoolExecutor(
                deliveryThreads, deliveryThreads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("hubframe-event-delivery"));
    }

    // ==================== 订阅 ====================

    public String subscribe(String pattern, EventHandler handler) {
        return subscribe(pattern, handler, null);
    }

    /**
     * 订阅事件
     *
     * @param pattern 主题模式
     * @param handler 处理器
     * @param owner   所属插件，用于 {@link #unsubscribeAll(String)}，可为空
     * @return 订阅ID
     */
    public String subscribe(String pattern, EventHandler handler, String owner) {
        Objects.requireNonNull(handler, "handler");
        TopicPattern compiled = TopicPattern.compile(pattern);
        String id = "sub-" + subscriptionSequence.incrementAndGet();
        subscriptions.add(new Subscription(id, owner, compiled, handler));
        log.debug("Subscription {} registered for '{}' (owner={})", id, compiled, owner);
        return id;
    }

    public boolean unsubscribe(String subscriptionId) {
        for (Subscription s : subscriptions) {
            if (s.id.equals(subscriptionId)) {
                s.active = false;
                subscriptions.remove(s);
                log.debug("Subscription {} removed", subscriptionId);
                return true;
            }
        }
        return false;
    }

    /**
     * 移除某个所有者的全部订阅
     *
     * @return 移除数量
     */
    public int unsubscribeAll(String owner) {
        if (owner == null) {
            return 0;
        }
        List<Subscription> owned = new ArrayList<>();
        for (Subscription s : subscriptions) {
            if (owner.equals(s.owner)) {
                s.active = false;
                owned.add(s);
            }
        }
        subscriptions.removeAll(owned);
        if (!owned.isEmpty()) {
            log.debug("[{}] Removed {} subscriptions", owner, owned.size());
        }
        return owned.size();
    }

    public int subscriptionCount(String owner) {
        return (int) subscriptions.stream().filter(s -> Objects.equals(owner, s.owner)).count();
    }

    // ==================== 发布 ====================

    public void emit(String topic, Map<String, Object> payload) {
        emit(topic, payload, null);
    }

    /**
     * 发布事件
     * 在防抖窗口结束后投递；窗口内同主题的新事件覆盖旧事件并重置计时器
     */
    public void emit(String topic, Map<String, Object> payload, String source) {
        if (shutdown.get()) {
            log.warn("Event bus is shut down, dropping event on topic {}", topic);
            return;
        }
        Event event = Event.of(topic, payload, source);
        emittedCount.incrementAndGet();

        if (debounceMs <= 0) {
            dispatch(event);
            return;
        }

        pending.compute(topic, (key, previous) -> {
            if (previous != null) {
                previous.future.cancel(false);
                coalescedCount.incrementAndGet();
            }
            PendingEmission next = new PendingEmission(event, emissionSequence.incrementAndGet());
            next.future = scheduler.schedule(() -> fire(key, next), debounceMs, TimeUnit.MILLISECONDS);
            return next;
        });
    }

    /**
     * 立即触发所有等待中的防抖计时器
     */
    public void flush() {
        List<PendingEmission> due = new ArrayList<>();
        for (String topic : pending.keySet()) {
            PendingEmission p = pending.remove(topic);
            if (p != null) {
                if (p.future != null) {
                    p.future.cancel(false);
                }
                due.add(p);
            }
        }
        due.sort(Comparator.comparingLong(p -> p.sequence));
        due.forEach(p -> dispatch(p.event));
    }

    private void fire(String topic, PendingEmission emission) {
        // flush 或新的发布可能已经接管了这个主题
        if (pending.remove(topic, emission)) {
            dispatch(emission.event);
        }
    }

    private void dispatch(Event event) {
        appendLog(event);
        for (Subscription s : subscriptions) {
            if (s.active && s.pattern.matches(event.topic())) {
                s.offer(event);
            }
        }
    }

    // ==================== 事件日志 ====================

    private void appendLog(Event event) {
        synchronized (eventLog) {
            while (eventLog.size() >= logCapacity) {
                eventLog.removeFirst();
            }
            eventLog.addLast(event);
        }
    }

    /**
     * 最近投递的事件，按时间先后
     */
    public List<Event> recentEvents() {
        synchronized (eventLog) {
            return new ArrayList<>(eventLog);
        }
    }

    public List<Event> recentEvents(String topicPattern) {
        TopicPattern compiled = TopicPattern.compile(topicPattern);
        return recentEvents().stream().filter(e -> compiled.matches(e.topic())).toList();
    }

    // ==================== 关闭 ====================

    /**
     * 触发剩余计时器，等待邮箱排空后关闭线程
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        flush();
        scheduler.shutdownNow();
        deliveryExecutor.shutdown();
        try {
            if (!deliveryExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Event delivery did not drain in time, forcing shutdown");
                deliveryExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deliveryExecutor.shutdownNow();
        }
        log.info("Event bus shutdown. {}", getStats());
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    @Override
    public void close() {
        shutdown();
    }

    public BusStats getStats() {
        int logSize;
        synchronized (eventLog) {
            logSize = eventLog.size();
        }
        return new BusStats(
                subscriptions.size(),
                pending.size(),
                emittedCount.get(),
                coalescedCount.get(),
                deliveredCount.get(),
                droppedCount.get(),
                failureCount.get(),
                logSize);
    }

    // ==================== 内部类 ====================

    private static final class PendingEmission {
        private final Event event;
        private final long sequence;
        private volatile ScheduledFuture<?> future;

        private PendingEmission(Event event, long sequence) {
            this.event = event;
            this.sequence = sequence;
        }
    }

    /**
     * 订阅及其邮箱
     */
    private final class Subscription {
        private final String id;
        private final String owner;
        private final TopicPattern pattern;
        private final EventHandler handler;

        private final Queue<Event> mailbox = new ConcurrentLinkedQueue<>();
        private final AtomicInteger mailboxSize = new AtomicInteger();
        private final AtomicBoolean drainScheduled = new AtomicBoolean(false);
        private volatile boolean active = true;

        private Subscription(String id, String owner, TopicPattern pattern, EventHandler handler) {
            this.id = id;
            this.owner = owner;
            this.pattern = pattern;
            this.handler = handler;
        }

        void offer(Event event) {
            while (mailboxSize.get() >= mailboxCapacity) {
                Event evicted = mailbox.poll();
                if (evicted == null) {
                    break;
                }
                mailboxSize.decrementAndGet();
                droppedCount.incrementAndGet();
                log.warn("Mailbox of {} is full, dropped oldest event on topic {}", id, evicted.topic());
            }
            mailbox.add(event);
            mailboxSize.incrementAndGet();
            scheduleDrain();
        }

        private void scheduleDrain() {
            if (drainScheduled.compareAndSet(false, true)) {
                try {
                    deliveryExecutor.execute(this::drain);
                } catch (RejectedExecutionException e) {
                    drainScheduled.set(false);
                    log.warn("Delivery rejected for {}, {} events left undelivered", id, mailboxSize.get());
                }
            }
        }

        private void drain() {
            try {
                List<Event> batch = new ArrayList<>(batchSize);
                Event next;
                while (batch.size() < batchSize && (next = mailbox.poll()) != null) {
                    mailboxSize.decrementAndGet();
                    batch.add(next);
                }
                if (!batch.isEmpty() && active) {
                    deliver(batch);
                }
            } finally {
                drainScheduled.set(false);
                if (!mailbox.isEmpty()) {
                    scheduleDrain();
                }
            }
        }

        private void deliver(List<Event> batch) {
            if (handler instanceof BatchEventHandler batchHandler) {
                try {
                    batchHandler.onBatch(List.copyOf(batch));
                    deliveredCount.addAndGet(batch.size());
                } catch (Exception e) {
                    onFailure(batch.get(0).topic(), e);
                }
                return;
            }
            for (Event event : batch) {
                try {
                    handler.onEvent(event);
                    deliveredCount.incrementAndGet();
                } catch (Exception e) {
                    onFailure(event.topic(), e);
                }
            }
        }

        private void onFailure(String topic, Exception cause) {
            failureCount.incrementAndGet();
            HandlerFailureException failure = new HandlerFailureException(topic, id, cause);
            log.error("{} (owner={}): {}", failure.getMessage(), owner, cause.getMessage(), failure);
        }
    }

    /**
     * 总线统计信息
     */
    public record BusStats(
            int subscriptions,
            int pendingTopics,
            long emitted,
            long coalesced,
            long delivered,
            long dropped,
            long handlerFailures,
            int logSize) {
        @Override
        @NonNull
        public String toString() {
            return String.format(
                    "BusStats{subs=%d, pending=%d, emitted=%d, coalesced=%d, delivered=%d, dropped=%d, failures=%d, log=%d}",
                    subscriptions, pendingTopics, emitted, coalesced, delivered, dropped, handlerFailures, logSize);
        }
    }
}
