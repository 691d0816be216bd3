/**
 * MiValue.java
 *
 * GDB/MI 输出中"值"的类型层次：常量字符串、元组 {...} 与列表 [...]。
 * 由 MiParser 构造，并由 MiPayloads 转换为领域对象。
 */
package club.ppmc.debugger.mi;

public sealed interface MiValue permits MiConst, MiTuple, MiList {

    /**
     * 以文本形式读取该值；非常量值返回 null。
     */
    default String asText() {
        return this instanceof MiConst c ? c.value() : null;
    }
}
