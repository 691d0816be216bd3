/**
 * SessionSummary.java
 *
 * 供 REST 接口列出会话时使用的概要信息。
 *
 * @param id 客户端生成的会话标识。
 * @param status 当前执行状态。
 * @param executable 当前加载的可执行文件；尚未 init 时为 null。
 * @param subscribers 当前订阅该会话的通道数量。
 */
package club.ppmc.debugger.model.debug;

public record SessionSummary(String id, DebugStatus status, String executable, int subscribers) {}
