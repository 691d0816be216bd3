/**
 * LogEntry.java
 *
 * log_event 事件的数据负载。会话会保留最近的若干条日志，在客户端重新连接时回放。
 *
 * @param level 日志级别："info"、"error" 或 "gdb"（调试器内部日志）。
 * @param text 日志文本。
 * @param timestamp UTC 时间的 ISO-8601 字符串。
 */
package club.ppmc.debugger.model.debug;

public record LogEntry(String level, String text, String timestamp) {

    public static final String INFO = "info";
    public static final String ERROR = "error";
    public static final String GDB = "gdb";
}
