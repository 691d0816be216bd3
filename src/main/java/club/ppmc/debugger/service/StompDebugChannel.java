/**
 * StompDebugChannel.java
 *
 * 一个 STOMP 连接在某个调试会话中的出站通道。
 */
package club.ppmc.debugger.service;

import club.ppmc.debugger.model.debug.WsDebugEvent;
import club.ppmc.debugger.session.DebugChannel;

public class StompDebugChannel implements DebugChannel {

    private final String channelId;
    private final String sessionId;
    private final WebSocketNotificationService notificationService;

    public StompDebugChannel(String channelId, String sessionId, WebSocketNotificationService notificationService) {
        this.channelId = channelId;
        this.sessionId = sessionId;
        this.notificationService = notificationService;
    }

    @Override
    public String id() {
        return channelId;
    }

    @Override
    public void send(WsDebugEvent<?> event) {
        notificationService.sendDebugEvent(channelId, sessionId, event);
    }
}
