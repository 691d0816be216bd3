/**
 * DebugMessageController.java
 *
 * 处理客户端通过 STOMP 发送的调试消息。它不处理 HTTP 请求：
 * 每条发往 /app/debug/{sessionId} 的消息就是一个调试操作，由对应的会话按顺序执行。
 * 发送操作的连接如果尚未加入会话，会先被加入，以便收到操作的结果和错误。
 */
package club.ppmc.debugger.controller;

import club.ppmc.debugger.model.debug.DebugAction;
import club.ppmc.debugger.service.StompDebugChannel;
import club.ppmc.debugger.service.WebSocketNotificationService;
import club.ppmc.debugger.session.DebugSession;
import club.ppmc.debugger.session.DebugSessionRegistry;
import java.security.Principal;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Controller;

@Controller
@Slf4j
public class DebugMessageController {

    private final DebugSessionRegistry registry;
    private final WebSocketNotificationService notificationService;

    public DebugMessageController(DebugSessionRegistry registry, WebSocketNotificationService notificationService) {
        this.registry = registry;
        this.notificationService = notificationService;
    }

    /**
     * 加入一个调试会话（不存在则创建），并回放当前快照、断点和最近的日志。
     */
    @MessageMapping("/debug/{sessionId}/attach")
    public void attach(@DestinationVariable String sessionId, Principal principal) {
        DebugSession session = resolve(sessionId, principal);
        if (session != null) {
            retryIfClosed(session, () -> session.attach(channel(principal, sessionId)),
                    fresh -> fresh.attach(channel(principal, sessionId)));
        }
    }

    /**
     * 离开一个调试会话。会话本身继续存活，直到宽限期结束。
     */
    @MessageMapping("/debug/{sessionId}/detach")
    public void detach(@DestinationVariable String sessionId, Principal principal) {
        if (principal != null) {
            registry.find(sessionId).ifPresent(session -> session.detach(principal.getName()));
        }
    }

    /**
     * 执行一个调试操作。
     */
    @MessageMapping("/debug/{sessionId}")
    public void handleAction(
            @DestinationVariable String sessionId, @Payload DebugAction action, Principal principal) {
        DebugSession session = resolve(sessionId, principal);
        if (session == null) {
            return;
        }
        retryIfClosed(session, () -> perform(session, action, principal),
                fresh -> perform(fresh, action, principal));
    }

    private CompletableFuture<Void> perform(DebugSession session, DebugAction action, Principal principal) {
        String channelId = principal.getName();
        if (!session.broadcaster().isSubscribed(channelId)) {
            session.attach(channel(principal, session.id()));
        }
        return session.submit(action, channelId);
    }

    /**
     * 会话可能在查找之后、任务执行之前被回收。此时换成注册表中新建的会话重试一次。
     */
    private void retryIfClosed(
            DebugSession session,
            Supplier<CompletableFuture<Void>> first,
            Function<DebugSession, CompletableFuture<Void>> retry) {
        first.get().whenComplete((ignored, error) -> {
            if (error != null && session.isClosed()) {
                log.info("会话 {} 在处理消息前已被回收，改用新会话重试。", session.id());
                retry.apply(registry.getOrCreate(session.id()));
            }
        });
    }

    private DebugSession resolve(String sessionId, Principal principal) {
        if (principal == null) {
            log.warn("收到没有 Principal 的调试消息，会话 ID: {}", sessionId);
            return null;
        }
        if (!DebugSessionRegistry.isValidSessionId(sessionId)) {
            log.warn("连接 {} 使用了无效的会话 ID: {}", principal.getName(), sessionId);
            return null;
        }
        return registry.getOrCreate(sessionId);
    }

    private StompDebugChannel channel(Principal principal, String sessionId) {
        return new StompDebugChannel(principal.getName(), sessionId, notificationService);
    }
}
