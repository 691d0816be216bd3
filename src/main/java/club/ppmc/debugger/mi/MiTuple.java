/**
 * MiTuple.java
 *
 * MI 元组值，即有序的 "name=value" 集合。也用作每条记录顶层的结果集合。
 * 提供带类型的访问方法，缺失或类型不符时返回 null/默认值，而不是抛出异常。
 */
package club.ppmc.debugger.mi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class MiTuple implements MiValue {

    public static final MiTuple EMPTY = new MiTuple(Map.of());

    private final Map<String, MiValue> entries;

    public MiTuple(Map<String, MiValue> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public boolean has(String key) {
        return entries.containsKey(key);
    }

    public MiValue get(String key) {
        return entries.get(key);
    }

    public String optString(String key) {
        MiValue value = entries.get(key);
        return value == null ? null : value.asText();
    }

    public String getString(String key, String defaultValue) {
        String value = optString(key);
        return value != null ? value : defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        String value = optString(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public MiTuple getTuple(String key) {
        return entries.get(key) instanceof MiTuple tuple ? tuple : MiTuple.EMPTY;
    }

    public MiList getList(String key) {
        MiValue value = entries.get(key);
        if (value instanceof MiList list) {
            return list;
        }
        // gdb 对空列表有时输出 {}，统一视为空列表
        return MiList.EMPTY;
    }

    public Map<String, MiValue> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MiTuple other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "MiTuple" + entries;
    }
}
