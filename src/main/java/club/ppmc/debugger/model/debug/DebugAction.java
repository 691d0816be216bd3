/**
 * DebugAction.java
 *
 * 该文件定义了一个数据传输对象 (DTO)，用于封装客户端通过WebSocket发送的一个调试操作，
 * 形如 {"action": "break", "args": {"location": "demo.c:7"}}。
 * 它由 DebugMessageController 接收，并交给对应的 DebugSession 排队处理。
 */
package club.ppmc.debugger.model.debug;

import club.ppmc.debugger.exception.DebugSessionException;
import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * @param action 操作名称，例如 "init"、"next"、"read_memory"。
 * @param args 操作参数，缺省时为空映射。
 */
public record DebugAction(String action, Map<String, Object> args) {

    public DebugAction {
        args = args == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(args));
    }

    public static DebugAction of(String action) {
        return new DebugAction(action, Map.of());
    }

    public static DebugAction of(String action, Map<String, Object> args) {
        return new DebugAction(action, args);
    }

    /**
     * 读取一个必填的字符串参数。
     *
     * @throws DebugSessionException 参数缺失或为空白时。
     */
    public String requireString(String key) {
        Object value = args.get(key);
        if (value == null || value.toString().isBlank()) {
            throw new DebugSessionException(action, "缺少必填参数: " + key);
        }
        return value.toString().trim();
    }

    public boolean booleanArg(String key, boolean defaultValue) {
        Object value = args.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value != null) {
            return Boolean.parseBoolean(value.toString().trim());
        }
        return defaultValue;
    }

    public int intArg(String key, int defaultValue) {
        Object value = args.get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            if (value instanceof BigInteger big) {
                return big.intValueExact();
            }
            if (value instanceof Number n) {
                double d = n.doubleValue();
                if (d != Math.rint(d)) {
                    throw new DebugSessionException(action, "参数 " + key + " 不是合法的整数: " + value);
                }
                return Math.toIntExact(n.longValue());
            }
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException | ArithmeticException e) {
            throw new DebugSessionException(action, "参数 " + key + " 不是合法的整数: " + value);
        }
    }
}
