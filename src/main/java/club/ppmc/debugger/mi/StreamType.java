/**
 * StreamType.java
 *
 * 流记录的来源：~ 控制台输出，@ 被调试程序输出，&amp; 调试器内部日志。
 */
package club.ppmc.debugger.mi;

public enum StreamType {
    CONSOLE,
    TARGET,
    LOG
}
