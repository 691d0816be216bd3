/**
 * MiParser.java
 *
 * 将 GDB/MI 的单行输出解码为 MiRecord。
 * 这是一个无状态的递归下降解析器；decode 方法永远不会抛出异常，
 * 无法解析的行会以原始控制台文本的形式返回，保证操作者仍能看到它们。
 *
 * <p>被调试程序与 gdb 共用标准输出，程序输出没有以换行结尾时，下一条 MI 记录会被拼接在同一行的末尾。
 * decodeAll 会把这样的行拆分为程序输出和其后的记录。
 */
package club.ppmc.debugger.mi;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class MiParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(MiParser.class);
    private static final String PROMPT = "(gdb)";
    private static final String RECORD_PREFIXES = "^*+=~@&";

    /**
     * 解码一行输出（不含行终止符）。
     *
     * @param line gdb 输出的一整行。
     * @return 解码后的记录；解析失败时返回 {@link MiRecord.Stream#raw(String)}。
     */
    public MiRecord decode(String line) {
        if (line == null) {
            return MiRecord.Stream.raw("");
        }
        String text = stripLineEnd(line);
        try {
            return new Cursor(text).parseRecord();
        } catch (MiParseException | RuntimeException e) {
            LOGGER.debug("无法解析的 MI 输出行，将作为原始文本处理: '{}' ({})", text, e.getMessage());
            return MiRecord.Stream.raw(text);
        }
    }

    /**
     * 解码一行输出，并尝试从无法解析的行中恢复拼接在末尾的 MI 记录。
     *
     * @return 一条或两条记录；拆分时第一条是行首的程序输出（TARGET 流，raw 为 true）。
     */
    public List<MiRecord> decodeAll(String line) {
        MiRecord record = decode(line);
        if (!(record instanceof MiRecord.Stream stream) || !stream.raw() || stream.text().isEmpty()) {
            return List.of(record);
        }
        String text = stream.text();
        if (text.stripTrailing().endsWith(PROMPT)) {
            int start = text.lastIndexOf(PROMPT);
            return List.of(new MiRecord.Stream(StreamType.TARGET, text.substring(0, start), true), new MiRecord.Prompt());
        }
        for (int i = 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (RECORD_PREFIXES.indexOf(c) < 0) {
                continue;
            }
            int start = i;
            if (c == '^') {
                while (start > 0 && Character.isDigit(text.charAt(start - 1))) {
                    start--;
                }
            }
            MiRecord embedded;
            try {
                embedded = new Cursor(text.substring(start)).parseRecord();
            } catch (MiParseException | RuntimeException e) {
                continue;
            }
            if (isRecognizable(embedded) && start > 0) {
                LOGGER.debug("从拼接的输出行中恢复出 MI 记录，位置 {}", start);
                return List.of(new MiRecord.Stream(StreamType.TARGET, text.substring(0, start), true), embedded);
            }
        }
        return List.of(record);
    }

    /**
     * 只有确定来自 gdb 的记录才会被拆分出来，避免把程序输出中偶然出现的 '=' 等字符误认为记录。
     */
    private static boolean isRecognizable(MiRecord record) {
        if (record instanceof MiRecord.Result result) {
            return result.token() != null;
        }
        if (record instanceof MiRecord.ExecAsync exec) {
            return "stopped".equals(exec.asyncClass()) || "running".equals(exec.asyncClass());
        }
        if (record instanceof MiRecord.NotifyAsync notify) {
            return notify.asyncClass().matches("[a-z]+(-[a-z]+)+");
        }
        return record instanceof MiRecord.Stream;
    }

    private static String stripLineEnd(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\r' || line.charAt(end - 1) == '\n')) {
            end--;
        }
        return line.substring(0, end);
    }

    private static final class Cursor {
        private final String text;
        private int pos;

        Cursor(String text) {
            this.text = text;
        }

        MiRecord parseRecord() throws MiParseException {
            if (text.trim().equals(PROMPT)) {
                return new MiRecord.Prompt();
            }
            Long token = parseToken();
            if (atEnd()) {
                throw new MiParseException("记录缺少类型前缀");
            }
            char prefix = text.charAt(pos++);
            switch (prefix) {
                case '^' -> {
                    String name = parseIdentifier();
                    return new MiRecord.Result(token, ResultClass.fromWire(name), parseResults());
                }
                case '*' -> {
                    String name = parseIdentifier();
                    return new MiRecord.ExecAsync(token, name, parseResults());
                }
                case '+' -> {
                    String name = parseIdentifier();
                    return new MiRecord.StatusAsync(token, name, parseResults());
                }
                case '=' -> {
                    String name = parseIdentifier();
                    return new MiRecord.NotifyAsync(token, name, parseResults());
                }
                case '~', '@', '&' -> {
                    String value = parseCString();
                    expectEnd();
                    return new MiRecord.Stream(streamType(prefix), value, false);
                }
                default -> throw new MiParseException("未知的记录前缀: " + prefix);
            }
        }

        private static StreamType streamType(char prefix) {
            return switch (prefix) {
                case '~' -> StreamType.CONSOLE;
                case '@' -> StreamType.TARGET;
                default -> StreamType.LOG;
            };
        }

        private Long parseToken() throws MiParseException {
            int start = pos;
            while (!atEnd() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
            if (start == pos) {
                return null;
            }
            try {
                return Long.parseLong(text.substring(start, pos));
            } catch (NumberFormatException e) {
                throw new MiParseException("令牌超出范围: " + text.substring(start, pos));
            }
        }

        private String parseIdentifier() throws MiParseException {
            int start = pos;
            while (!atEnd()) {
                char c = text.charAt(pos);
                if (c == ',' || c == '=' || c == '{' || c == '}' || c == '[' || c == ']' || c == '"') {
                    break;
                }
                pos++;
            }
            if (start == pos) {
                throw new MiParseException("在位置 " + pos + " 处缺少标识符");
            }
            return text.substring(start, pos);
        }

        private MiTuple parseResults() throws MiParseException {
            Map<String, MiValue> results = new LinkedHashMap<>();
            while (!atEnd()) {
                expect(',');
                String name = parseIdentifier();
                expect('=');
                results.put(name, parseValue());
            }
            return new MiTuple(results);
        }

        private MiValue parseValue() throws MiParseException {
            if (atEnd()) {
                throw new MiParseException("值意外结束");
            }
            char c = text.charAt(pos);
            return switch (c) {
                case '"' -> new MiConst(parseCString());
                case '{' -> parseTuple();
                case '[' -> parseList();
                default -> throw new MiParseException("位置 " + pos + " 处的值无效: " + c);
            };
        }

        private MiTuple parseTuple() throws MiParseException {
            expect('{');
            Map<String, MiValue> entries = new LinkedHashMap<>();
            if (peek('}')) {
                pos++;
                return new MiTuple(entries);
            }
            do {
                String name = parseIdentifier();
                expect('=');
                entries.put(name, parseValue());
            } while (consume(','));
            expect('}');
            return new MiTuple(entries);
        }

        private MiList parseList() throws MiParseException {
            expect('[');
            List<MiValue> items = new ArrayList<>();
            if (peek(']')) {
                pos++;
                return new MiList(items);
            }
            do {
                char c = text.charAt(pos);
                if (c == '"' || c == '{' || c == '[') {
                    items.add(parseValue());
                } else {
                    // name=value 形式的列表项，只保留 value
                    parseIdentifier();
                    expect('=');
                    items.add(parseValue());
                }
            } while (consume(','));
            expect(']');
            return new MiList(items);
        }

        private String parseCString() throws MiParseException {
            expect('"');
            var bytes = new ByteArrayOutputStream();
            while (true) {
                if (atEnd()) {
                    throw new MiParseException("字符串未闭合");
                }
                char c = text.charAt(pos++);
                if (c == '"') {
                    break;
                }
                if (c != '\\') {
                    if (Character.isHighSurrogate(c) && !atEnd() && Character.isLowSurrogate(text.charAt(pos))) {
                        bytes.writeBytes(text.substring(pos - 1, pos + 1).getBytes(StandardCharsets.UTF_8));
                        pos++;
                    } else {
                        writeChar(bytes, c);
                    }
                    continue;
                }
                if (atEnd()) {
                    throw new MiParseException("转义序列不完整");
                }
                char e = text.charAt(pos++);
                switch (e) {
                    case 'n' -> bytes.write('\n');
                    case 't' -> bytes.write('\t');
                    case 'r' -> bytes.write('\r');
                    case 'a' -> bytes.write(7);
                    case 'b' -> bytes.write('\b');
                    case 'f' -> bytes.write('\f');
                    case 'v' -> bytes.write(11);
                    case 'e' -> bytes.write(27);
                    case '0', '1', '2', '3', '4', '5', '6', '7' -> bytes.write(parseOctal(e));
                    default -> writeChar(bytes, e);
                }
            }
            return bytes.toString(StandardCharsets.UTF_8);
        }

        private int parseOctal(char first) {
            int value = first - '0';
            for (int i = 0; i < 2 && !atEnd(); i++) {
                char c = text.charAt(pos);
                if (c < '0' || c > '7') {
                    break;
                }
                value = value * 8 + (c - '0');
                pos++;
            }
            return value & 0xFF;
        }

        private static void writeChar(ByteArrayOutputStream out, char c) {
            if (c < 0x80) {
                out.write(c);
            } else {
                out.writeBytes(String.valueOf(c).getBytes(StandardCharsets.UTF_8));
            }
        }

        private boolean atEnd() {
            return pos >= text.length();
        }

        private boolean peek(char c) {
            return !atEnd() && text.charAt(pos) == c;
        }

        private boolean consume(char c) {
            if (peek(c)) {
                pos++;
                return true;
            }
            return false;
        }

        private void expect(char c) throws MiParseException {
            if (!consume(c)) {
                throw new MiParseException("位置 " + pos + " 处期望 '" + c + "'");
            }
        }

        private void expectEnd() throws MiParseException {
            if (!atEnd() && !text.substring(pos).isBlank()) {
                throw new MiParseException("记录末尾存在多余内容");
            }
        }
    }
}
