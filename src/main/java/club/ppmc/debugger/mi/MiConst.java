/**
 * MiConst.java
 *
 * MI 常量值（已去除引号并完成转义解码的 C 字符串）。
 */
package club.ppmc.debugger.mi;

public record MiConst(String value) implements MiValue {}
