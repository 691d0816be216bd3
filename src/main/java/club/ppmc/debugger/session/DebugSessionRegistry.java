/**
 * DebugSessionRegistry.java
 *
 * 进程内所有调试会话的注册表，以客户端提供的会话 ID 为键。
 * 会话在第一次被引用时创建；没有任何订阅者且超过宽限期的会话由定时任务回收，
 * 应用关闭时所有会话的调试器进程都会被终止。
 */
package club.ppmc.debugger.session;

import club.ppmc.debugger.gdb.DebuggerProcessFactory;
import club.ppmc.debugger.model.Settings;
import club.ppmc.debugger.model.debug.SessionSummary;
import club.ppmc.debugger.service.SettingsService;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class DebugSessionRegistry {

    private static final Pattern SESSION_ID = Pattern.compile("[A-Za-z0-9_.-]{1,64}");
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Map<String, DebugSession> sessions = new ConcurrentHashMap<>();
    private final SettingsService settingsService;
    private final DebuggerProcessFactory processFactory;
    private final ScheduledExecutorService timeoutScheduler;
    private final Executor deliveryExecutor;
    private final Clock clock;

    public DebugSessionRegistry(
            SettingsService settingsService,
            DebuggerProcessFactory processFactory,
            @Qualifier("debugTimeoutScheduler") ScheduledExecutorService timeoutScheduler,
            @Qualifier("debugDeliveryExecutor") Executor deliveryExecutor,
            Clock clock) {
        this.settingsService = settingsService;
        this.processFactory = processFactory;
        this.timeoutScheduler = timeoutScheduler;
        this.deliveryExecutor = deliveryExecutor;
        this.clock = clock;
    }

    /**
     * 校验会话 ID 的格式。会话 ID 会出现在订阅路径和线程名中，只允许有限的字符。
     */
    public static boolean isValidSessionId(String sessionId) {
        return sessionId != null && SESSION_ID.matcher(sessionId).matches();
    }

    /**
     * 返回指定 ID 的会话，不存在时创建。并发调用只会创建一个会话。
     *
     * @throws IllegalArgumentException 如果会话 ID 格式无效。
     */
    public DebugSession getOrCreate(String sessionId) {
        if (!isValidSessionId(sessionId)) {
            throw new IllegalArgumentException("无效的会话 ID: " + sessionId);
        }
        return sessions.computeIfAbsent(sessionId, this::createSession);
    }

    public Optional<DebugSession> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    public List<SessionSummary> summaries() {
        return sessions.values().stream()
                .map(DebugSession::summary)
                .sorted(Comparator.comparing(SessionSummary::id))
                .toList();
    }

    public int size() {
        return sessions.size();
    }

    /**
     * 移除并关闭会话。
     */
    public CompletableFuture<Void> remove(String sessionId) {
        DebugSession session = sessions.remove(sessionId);
        if (session == null) {
            return CompletableFuture.completedFuture(null);
        }
        log.info("移除调试会话: {}", sessionId);
        return session.close();
    }

    /**
     * 一个通道断开时，将它从所有会话中移除。
     */
    public void unsubscribeEverywhere(String channelId) {
        sessions.values().forEach(session -> session.detach(channelId));
    }

    /**
     * 回收没有订阅者且空闲时间超过宽限期的会话。
     */
    @Scheduled(fixedDelayString = "${app.debug.reap-interval-ms:30000}")
    public void reapIdleSessions() {
        reap();
    }

    /**
     * 这里只做初步筛选，最终的判断在各会话的处理循环上进行，与同时到达的重新加入操作串行执行。
     *
     * @return 每个候选会话的回收结果。
     */
    List<CompletableFuture<Boolean>> reap() {
        long graceMillis = TimeUnit.SECONDS.toMillis(settingsService.getSettings().getReconnectGracePeriodSeconds());
        List<CompletableFuture<Boolean>> results = new ArrayList<>();
        sessions.forEach((sessionId, session) -> {
            long idle = session.broadcaster().idleMillis();
            if (session.broadcaster().subscriberCount() == 0 && idle >= graceMillis) {
                results.add(session.closeIfIdle(graceMillis, () -> sessions.remove(sessionId, session))
                        .whenComplete((closed, error) -> {
                            if (Boolean.TRUE.equals(closed)) {
                                log.info("调试会话 {} 已空闲 {} 秒，超过宽限期，已回收。", sessionId, idle / 1000);
                            }
                        }));
            }
        });
        return results;
    }

    @PreDestroy
    public void closeAll() {
        log.info("应用正在关闭，终止 {} 个调试会话...", sessions.size());
        List<CompletableFuture<Void>> closing = sessions.values().stream().map(DebugSession::close).toList();
        sessions.clear();
        try {
            CompletableFuture.allOf(closing.toArray(CompletableFuture[]::new))
                    .get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("部分调试会话未能在 {} 秒内正常关闭: {}", SHUTDOWN_TIMEOUT_SECONDS, e.getMessage());
        }
    }

    private DebugSession createSession(String sessionId) {
        Settings settings = settingsService.getSettings();
        var broadcaster = new EventBroadcaster(sessionId, deliveryExecutor, settings.getOutboundQueueLimit(), clock);
        log.info("创建调试会话: {}", sessionId);
        return new DebugSession(
                sessionId,
                settings,
                processFactory,
                timeoutScheduler,
                broadcaster,
                clock,
                discarded -> {
                    if (sessions.remove(discarded.id(), discarded)) {
                        discarded.close();
                    }
                });
    }
}
