/**
 * DebugSessionException.java
 *
 * 一个自定义的运行时异常，表示一次可恢复的调试操作失败：
 * 当前状态不允许该操作、参数无效、调试器启动失败或 gdb 返回了错误。
 * 会话在处理循环中捕获它并以 "error" 消息的形式通知客户端，会话本身的状态保持不变。
 */
package club.ppmc.debugger.exception;

import lombok.Getter;

@Getter
public class DebugSessionException extends RuntimeException {

    /** 触发该错误的操作名称，例如 "next"。 */
    private final String action;

    public DebugSessionException(String action, String message) {
        super(message);
        this.action = action;
    }

    public DebugSessionException(String action, String message, Throwable cause) {
        super(message, cause);
        this.action = action;
    }
}
