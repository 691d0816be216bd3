/**
 * MiParseException.java
 *
 * MiParser 内部使用的受检异常，表示一行输出不符合 MI 语法。
 * 它不会越过 MiParser.decode 的边界：无法解析的行会被降级为原始控制台文本。
 */
package club.ppmc.debugger.mi;

public class MiParseException extends Exception {

    public MiParseException(String message) {
        super(message);
    }
}
