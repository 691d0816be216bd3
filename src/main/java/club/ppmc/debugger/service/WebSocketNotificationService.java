/**
 * WebSocketNotificationService.java
 *
 * 统一的 WebSocket 消息出口，封装 SimpMessagingTemplate 的使用细节。
 * 调试事件先用 Gson 序列化为 JSON 字符串，再发送到目标连接的用户队列上。
 */
package club.ppmc.debugger.service;

import club.ppmc.debugger.model.debug.WsDebugEvent;
import com.google.gson.Gson;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
public class WebSocketNotificationService {

    private final SimpMessagingTemplate messagingTemplate;
    private final Gson gson;

    public WebSocketNotificationService(SimpMessagingTemplate messagingTemplate, Gson gson) {
        this.messagingTemplate = messagingTemplate;
        this.gson = gson;
    }

    /**
     * 向一个连接发送某个调试会话的事件。
     *
     * @param channelId 连接的 Principal 名称。
     * @param sessionId 调试会话 ID，决定目标队列 /user/queue/debug/{sessionId}。
     * @param event 调试事件。
     */
    public void sendDebugEvent(String channelId, String sessionId, WsDebugEvent<?> event) {
        String payload = gson.toJson(event);
        messagingTemplate.convertAndSendToUser(channelId, debugDestination(sessionId), payload);
    }

    static String debugDestination(String sessionId) {
        return "/queue/debug/" + sessionId;
    }
}
