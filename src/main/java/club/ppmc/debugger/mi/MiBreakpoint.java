/**
 * MiBreakpoint.java
 *
 * 从 bkpt={...} 元组中解码出的断点信息。
 *
 * @param number gdb 分配的断点编号。
 * @param file 断点所在源文件；优先使用 fullname（绝对路径），否则为 file。
 * @param line 断点所在行，挂起的断点没有行号时为 0。
 * @param originalLocation 创建断点时使用的原始位置表达式，例如 "demo.c:7" 或 "main"。
 * @param temporary 是否为命中一次后自动删除的临时断点（disp="del"），例如 -exec-run --start 设置的入口断点。
 */
package club.ppmc.debugger.mi;

public record MiBreakpoint(String number, String file, int line, String originalLocation, boolean temporary) {}
