/**
 * BreakpointLocation.java
 *
 * 用户请求的断点位置：要么是 "file:line" 形式的源码行，要么是函数名等其他 gdb 位置表达式。
 * 同一文件的绝对路径与相对路径（路径后缀相同）被视为同一个位置。
 */
package club.ppmc.debugger.session;

import club.ppmc.debugger.exception.DebugSessionException;

/**
 * @param file 源文件路径；非源码行位置时为 null。
 * @param line 行号；非源码行位置时为 0。
 * @param expression 非源码行位置的原始表达式（例如函数名）；源码行位置时为 null。
 */
public record BreakpointLocation(String file, int line, String expression) {

    /**
     * 解析客户端提供的位置字符串。
     *
     * @throws DebugSessionException 位置为空、行号非法或以 '-' 开头（会被 gdb 当作选项）时。
     */
    public static BreakpointLocation parse(String location) {
        if (location == null || location.isBlank()) {
            throw new DebugSessionException("break", "断点位置不能为空");
        }
        String text = location.trim();
        if (text.startsWith("-")) {
            throw new DebugSessionException("break", "非法的断点位置: " + text);
        }
        int colon = text.lastIndexOf(':');
        if (colon > 0 && colon < text.length() - 1) {
            String linePart = text.substring(colon + 1);
            if (linePart.chars().allMatch(Character::isDigit)) {
                int line;
                try {
                    line = Integer.parseInt(linePart);
                } catch (NumberFormatException e) {
                    throw new DebugSessionException("break", "非法的行号: " + linePart);
                }
                if (line <= 0) {
                    throw new DebugSessionException("break", "行号必须为正数: " + line);
                }
                return new BreakpointLocation(text.substring(0, colon), line, null);
            }
        }
        return new BreakpointLocation(null, 0, text);
    }

    public static BreakpointLocation ofSourceLine(String file, int line) {
        return new BreakpointLocation(file, line, null);
    }

    public boolean isSourceLine() {
        return file != null;
    }

    /**
     * 是否与给定的文件与行号指向同一位置（允许路径后缀等价）。
     */
    public boolean matches(String otherFile, int otherLine) {
        return isSourceLine() && line == otherLine && samePath(file, otherFile);
    }

    public boolean sameAs(BreakpointLocation other) {
        if (other == null) {
            return false;
        }
        if (isSourceLine()) {
            return other.matches(file, line);
        }
        return !other.isSourceLine() && expression.equals(other.expression);
    }

    /**
     * 转换为 gdb 接受的位置表达式。
     */
    public String toMiLocation() {
        return isSourceLine() ? file + ":" + line : expression;
    }

    @Override
    public String toString() {
        return toMiLocation();
    }

    /**
     * 判断两个路径是否指向同一文件：完全相同，或其中一个是另一个以目录分隔符为界的后缀。
     */
    static boolean samePath(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        String left = normalize(a);
        String right = normalize(b);
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        return left.equals(right) || left.endsWith("/" + right) || right.endsWith("/" + left);
    }

    private static String normalize(String path) {
        String p = path.trim().replace('\\', '/');
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        return p;
    }
}
