/**
 * DebugChannel.java
 *
 * 一个订阅了调试会话的客户端通道（例如一个浏览器标签页的 WebSocket 连接）。
 */
package club.ppmc.debugger.session;

import club.ppmc.debugger.model.debug.WsDebugEvent;

public interface DebugChannel {

    /** 通道的唯一标识。 */
    String id();

    /**
     * 向通道发送一个事件。实现可以抛出运行时异常，失败只影响该通道本身。
     */
    void send(WsDebugEvent<?> event);
}
