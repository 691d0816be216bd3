/**
 * WebSocketSessionListener.java
 *
 * 监听 WebSocket 的连接和断开事件。连接断开（无论是正常关闭还是心跳超时）时，
 * 该连接会从它加入的所有调试会话中移除；会话本身和其中的调试器进程保持运行，等待重新连接。
 */
package club.ppmc.debugger.listener;

import club.ppmc.debugger.session.DebugSessionRegistry;
import java.security.Principal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

@Component
@Slf4j
public class WebSocketSessionListener {

    private final DebugSessionRegistry registry;

    public WebSocketSessionListener(DebugSessionRegistry registry) {
        this.registry = registry;
    }

    @EventListener
    public void handleWebSocketConnectListener(SessionConnectedEvent event) {
        var headerAccessor = StompHeaderAccessor.wrap(event.getMessage());
        Principal user = headerAccessor.getUser();
        log.info("接收到新的 WebSocket 连接，会话 ID: {}，用户: {}",
                headerAccessor.getSessionId(), user != null ? user.getName() : "<anonymous>");
    }

    @EventListener
    public void handleWebSocketDisconnectListener(SessionDisconnectEvent event) {
        Principal user = event.getUser();
        if (user == null) {
            log.debug("WebSocket 连接 {} 断开，没有关联的 Principal。", event.getSessionId());
            return;
        }
        log.info("WebSocket 连接断开，会话 ID: {}，用户: {}", event.getSessionId(), user.getName());
        registry.unsubscribeEverywhere(user.getName());
    }
}
