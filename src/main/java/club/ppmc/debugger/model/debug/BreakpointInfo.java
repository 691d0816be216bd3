/**
 * BreakpointInfo.java
 *
 * breakpoint_created 事件的数据负载：一个已由 gdb 确认的断点。
 *
 * @param id gdb 分配的断点编号，在调试器进程生命周期内不会复用。
 * @param file 断点所在的源文件。
 * @param line 断点所在的行号。
 */
package club.ppmc.debugger.model.debug;

public record BreakpointInfo(String id, String file, int line) {}
