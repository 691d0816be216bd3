/**
 * MiRecord.java
 *
 * 一行 GDB/MI 输出解码后的记录。这是一个封闭的变体类型，每种记录类别对应一个实现，
 * 下游代码通过 instanceof 模式匹配分派，而不需要检查无类型的键值映射。
 */
package club.ppmc.debugger.mi;

public sealed interface MiRecord {

    /**
     * 结果记录，与之前发出的带令牌命令相对应，例如 {@code 12^done,bkpt={...}}。
     *
     * @param token 命令令牌；gdb 自发的结果记录没有令牌，此时为 null。
     */
    record Result(Long token, ResultClass resultClass, MiTuple results) implements MiRecord {

        public boolean isError() {
            return resultClass == ResultClass.ERROR;
        }

        public String errorMessage() {
            return results.getString("msg", "未知错误");
        }
    }

    /** 执行状态变化，例如 {@code *stopped,reason="breakpoint-hit",...}。 */
    record ExecAsync(Long token, String asyncClass, MiTuple results) implements MiRecord {}

    /** 进度信息 (+...)，本系统只记录日志。 */
    record StatusAsync(Long token, String asyncClass, MiTuple results) implements MiRecord {}

    /** 带外通知，例如 {@code =breakpoint-created,bkpt={...}}。 */
    record NotifyAsync(Long token, String asyncClass, MiTuple results) implements MiRecord {}

    /**
     * 流输出文本。
     *
     * @param raw 为 true 时表示该行不是合法的 MI 输出，原样作为控制台文本保留。
     */
    record Stream(StreamType type, String text, boolean raw) implements MiRecord {

        public static Stream raw(String line) {
            return new Stream(StreamType.CONSOLE, line, true);
        }
    }

    /** 输出组结束符 {@code (gdb)}。 */
    record Prompt() implements MiRecord {}
}
