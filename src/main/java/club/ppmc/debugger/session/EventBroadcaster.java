/**
 * EventBroadcaster.java
 *
 * 将一个会话的事件分发给所有订阅了它的通道。
 * 每个通道都有自己的有序发送队列，由共享的线程池串行排空：
 * 慢速或已断开的通道不会阻塞其他通道，也不会阻塞会话自身对调试器输出的处理。
 */
package club.ppmc.debugger.session;

import club.ppmc.debugger.model.debug.WsDebugEvent;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class EventBroadcaster {

    private final String sessionId;
    private final Executor deliveryExecutor;
    private final int queueLimit;
    private final Clock clock;
    private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();
    private volatile long idleSinceMillis;

    public EventBroadcaster(String sessionId, Executor deliveryExecutor, int queueLimit, Clock clock) {
        this.sessionId = sessionId;
        this.deliveryExecutor = deliveryExecutor;
        this.queueLimit = Math.max(1, queueLimit);
        this.clock = clock;
        this.idleSinceMillis = clock.millis();
    }

    /**
     * 订阅一个通道。
     *
     * @return 如果是新的订阅则返回 true；同一通道重复订阅返回 false。
     */
    public boolean subscribe(DebugChannel channel) {
        boolean added = subscribers.putIfAbsent(channel.id(), new Subscriber(channel)) == null;
        if (added) {
            log.info("通道 {} 已订阅会话 {}，当前订阅数: {}", channel.id(), sessionId, subscribers.size());
        }
        return added;
    }

    /**
     * 取消订阅。取消最后一个订阅不会终止会话，只会开始计算空闲时间。
     */
    public boolean unsubscribe(String channelId) {
        Subscriber removed = subscribers.remove(channelId);
        if (removed == null) {
            return false;
        }
        removed.closed.set(true);
        if (subscribers.isEmpty()) {
            idleSinceMillis = clock.millis();
        }
        log.info("通道 {} 已取消订阅会话 {}，剩余订阅数: {}", channelId, sessionId, subscribers.size());
        return true;
    }

    public boolean isSubscribed(String channelId) {
        return subscribers.containsKey(channelId);
    }

    public void broadcast(WsDebugEvent<?> event) {
        subscribers.values().forEach(s -> s.enqueue(event));
    }

    /**
     * 只向一个通道发送事件，例如对某个被拒绝操作的错误回复。通道未订阅时忽略。
     */
    public void sendTo(String channelId, WsDebugEvent<?> event) {
        Subscriber subscriber = channelId == null ? null : subscribers.get(channelId);
        if (subscriber != null) {
            subscriber.enqueue(event);
        } else {
            log.debug("通道 {} 未订阅会话 {}，丢弃定向事件 {}", channelId, sessionId, event.type());
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /**
     * 自最后一个通道离开以来经过的毫秒数；仍有订阅者时返回 0。
     */
    public long idleMillis() {
        if (!subscribers.isEmpty()) {
            return 0;
        }
        return Math.max(0, clock.millis() - idleSinceMillis);
    }

    public void clear() {
        subscribers.keySet().forEach(this::unsubscribe);
    }

    private final class Subscriber {
        private final DebugChannel channel;
        private final ConcurrentLinkedDeque<WsDebugEvent<?>> queue = new ConcurrentLinkedDeque<>();
        private final AtomicInteger queued = new AtomicInteger();
        private final AtomicBoolean draining = new AtomicBoolean(false);
        private final AtomicBoolean closed = new AtomicBoolean(false);

        Subscriber(DebugChannel channel) {
            this.channel = channel;
        }

        void enqueue(WsDebugEvent<?> event) {
            if (closed.get()) {
                return;
            }
            queue.addLast(event);
            if (queued.incrementAndGet() > queueLimit && queue.pollFirst() != null) {
                queued.decrementAndGet();
                log.warn("通道 {} 的发送队列已满 ({}), 丢弃最旧的一条消息。", channel.id(), queueLimit);
            }
            scheduleDrain();
        }

        private void scheduleDrain() {
            if (draining.compareAndSet(false, true)) {
                try {
                    deliveryExecutor.execute(this::drain);
                } catch (RejectedExecutionException e) {
                    draining.set(false);
                    log.warn("发送线程池已关闭，无法向通道 {} 投递消息。", channel.id());
                }
            }
        }

        private void drain() {
            try {
                WsDebugEvent<?> event;
                while ((event = queue.pollFirst()) != null) {
                    queued.decrementAndGet();
                    if (closed.get()) {
                        continue;
                    }
                    try {
                        channel.send(event);
                    } catch (RuntimeException e) {
                        log.warn("向通道 {} 发送 {} 事件失败: {}", channel.id(), event.type(), e.getMessage());
                    }
                }
            } finally {
                draining.set(false);
            }
            if (!queue.isEmpty()) {
                scheduleDrain();
            }
        }
    }
}
