/**
 * MiCommand.java
 *
 * 一条发往 gdb 的 MI 命令。命令由操作名、选项、受信任的字面量和用户参数组成，
 * 编码时由本类统一负责引号与转义：用户参数始终被编码为单个 C 字符串，
 * 永远不会作为命令文本拼接，因此参数中的换行或引号无法注入额外的命令。
 */
package club.ppmc.debugger.mi;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public final class MiCommand {

    private static final Pattern OPERATION = Pattern.compile("-[a-z][a-z0-9-]*");
    private static final Pattern OPTION = Pattern.compile("--?[a-z][a-z0-9-]*");
    private static final Pattern LITERAL = Pattern.compile("[A-Za-z0-9_.*@-]+");

    private final String operation;
    private final List<String> arguments = new ArrayList<>();

    private MiCommand(String operation) {
        this.operation = operation;
    }

    /**
     * 创建一条命令。
     *
     * @param operation MI 操作名，例如 "-exec-next"。
     * @throws IllegalArgumentException 如果操作名不是合法的 MI 操作。
     */
    public static MiCommand of(String operation) {
        if (operation == null || !OPERATION.matcher(operation).matches()) {
            throw new IllegalArgumentException("非法的 MI 操作名: " + operation);
        }
        return new MiCommand(operation);
    }

    public MiCommand option(String option) {
        if (option == null || !OPTION.matcher(option).matches()) {
            throw new IllegalArgumentException("非法的 MI 选项: " + option);
        }
        arguments.add(option);
        return this;
    }

    /**
     * 追加一个由程序自身产生的字面量参数（例如 "-" 或 "*"），不做引号处理。
     */
    public MiCommand literal(String literal) {
        if (literal == null || !LITERAL.matcher(literal).matches()) {
            throw new IllegalArgumentException("非法的 MI 字面量: " + literal);
        }
        arguments.add(literal);
        return this;
    }

    public MiCommand literal(long number) {
        arguments.add(Long.toString(number));
        return this;
    }

    /**
     * 追加一个来自客户端的参数，总是编码为 C 字符串。
     */
    public MiCommand parameter(String value) {
        if (value == null) {
            throw new IllegalArgumentException("MI 参数不能为 null");
        }
        arguments.add(quote(value));
        return this;
    }

    public String operation() {
        return operation;
    }

    /**
     * 编码为一行线路文本（不含行终止符）。
     *
     * @param token 用于关联回复的单调递增令牌。
     */
    public String encode(long token) {
        var sb = new StringBuilder().append(token).append(operation);
        for (String argument : arguments) {
            sb.append(' ').append(argument);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return encode(0).substring(1);
    }

    /**
     * 按 MI 的 C 字符串规则为参数加引号。
     */
    public static String quote(String value) {
        var sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7F) {
                        sb.append(String.format("\\%03o", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
