/**
 * MiList.java
 *
 * MI 列表值。对于 "name=value" 形式的列表项，只保留 value 部分，
 * 例如 stack=[frame={...},frame={...}] 会被解析为两个元组。
 */
package club.ppmc.debugger.mi;

import java.util.List;

public record MiList(List<MiValue> items) implements MiValue {

    public static final MiList EMPTY = new MiList(List.of());

    public MiList {
        items = List.copyOf(items);
    }

    /**
     * 返回列表中所有的元组项，忽略其他类型的项。
     */
    public List<MiTuple> tuples() {
        return items.stream()
                .filter(MiTuple.class::isInstance)
                .map(MiTuple.class::cast)
                .toList();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
