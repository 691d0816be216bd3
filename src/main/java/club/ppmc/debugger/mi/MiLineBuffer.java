/**
 * MiLineBuffer.java
 *
 * 将从调试器进程读取到的任意分块文本重新组装为完整的行。
 * 不完整的尾部会被缓存，直到读到行终止符；同时兼容伪终端产生的 "\r\n"。
 * 非线程安全，每个读取线程持有一个实例。
 */
package club.ppmc.debugger.mi;

import java.util.ArrayList;
import java.util.List;

public final class MiLineBuffer {

    private final StringBuilder pending = new StringBuilder();

    /**
     * 追加一段输出，返回因此而变得完整的所有行（已去除行终止符）。
     */
    public List<String> append(CharSequence chunk) {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < chunk.length(); i++) {
            char c = chunk.charAt(i);
            if (c == '\n') {
                lines.add(takeLine());
            } else {
                pending.append(c);
            }
        }
        return lines;
    }

    /**
     * 输出流结束时取出剩余的不完整内容；没有剩余时返回 null。
     */
    public String drain() {
        if (pending.length() == 0) {
            return null;
        }
        return takeLine();
    }

    public boolean hasPending() {
        return pending.length() > 0;
    }

    private String takeLine() {
        int end = pending.length();
        if (end > 0 && pending.charAt(end - 1) == '\r') {
            end--;
        }
        String line = pending.substring(0, end);
        pending.setLength(0);
        return line;
    }
}
