/**
 * BreakpointRegistry.java
 *
 * 维护用户请求的 "file:line" 位置与 gdb 分配的断点编号之间的映射。
 * 注册表自身保证同一位置（包括路径后缀等价的不同写法）永远不会出现两个断点。
 * 断点在 stop/init 之间保留，重新初始化调试器时会被重放。
 * 非线程安全，只在所属会话的处理线程上访问。
 */
package club.ppmc.debugger.session;

import club.ppmc.debugger.model.debug.BreakpointInfo;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class BreakpointRegistry {

    /** toggle 的结果。 */
    public enum ToggleOutcome {
        /** 新增了一个断点项，调用者应向 gdb 发出设置命令。 */
        ADDED,
        /** 移除了已有的断点项，调用者应向 gdb 发出删除命令（如果已分配编号）。 */
        REMOVED,
        /** 该位置的断点仍在等待确认，未做任何修改。 */
        PENDING_CONFLICT
    }

    public record Toggle(ToggleOutcome outcome, BreakpointEntry entry) {}

    private final List<BreakpointEntry> entries = new ArrayList<>();

    /**
     * 切换给定位置的断点：存在则移除，不存在则新增（状态为 DEFERRED，由调用者决定是否立即设置）。
     */
    public Toggle toggle(BreakpointLocation location) {
        Optional<BreakpointEntry> existing = find(location);
        if (existing.isPresent()) {
            BreakpointEntry entry = existing.get();
            if (entry.isPending()) {
                return new Toggle(ToggleOutcome.PENDING_CONFLICT, entry);
            }
            entries.remove(entry);
            return new Toggle(ToggleOutcome.REMOVED, entry);
        }
        var entry = new BreakpointEntry(location);
        entries.add(entry);
        return new Toggle(ToggleOutcome.ADDED, entry);
    }

    public Optional<BreakpointEntry> find(BreakpointLocation location) {
        return entries.stream().filter(e -> e.matches(location)).findFirst();
    }

    public Optional<BreakpointEntry> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return entries.stream().filter(e -> id.equals(e.getId())).findFirst();
    }

    public Optional<BreakpointEntry> findPending(long token) {
        return entries.stream()
                .filter(e -> e.isPending() && e.getPendingToken() == token)
                .findFirst();
    }

    /**
     * 标记断点已发出设置命令。
     */
    public void markPending(BreakpointEntry entry, long token) {
        entry.markPending(token);
    }

    /**
     * 用 gdb 的确认结果更新断点项。
     *
     * @return 如果确认后的规范位置与另一个已确认的断点重复，返回那个断点；否则为空。
     *         重复时本项不会被确认，调用者应删除 gdb 中的新断点并丢弃本项。
     */
    public Optional<BreakpointEntry> confirm(BreakpointEntry entry, String id, String file, int line) {
        if (file != null && line > 0) {
            BreakpointLocation canonical = BreakpointLocation.ofSourceLine(file, line);
            Optional<BreakpointEntry> duplicate = entries.stream()
                    .filter(e -> e != entry && e.isLive() && e.matches(canonical))
                    .findFirst();
            if (duplicate.isPresent()) {
                return duplicate;
            }
        }
        entry.confirm(id, file, line);
        return Optional.empty();
    }

    /**
     * 记录一个由 gdb 自行报告的断点（例如在 gdb 控制台中设置的断点）。
     *
     * @return 新建的断点项；如果该编号或位置已被登记则返回空。
     */
    public Optional<BreakpointEntry> adopt(String id, String file, int line, String originalLocation) {
        if (findById(id).isPresent()) {
            return Optional.empty();
        }
        BreakpointLocation location = file != null && line > 0
                ? BreakpointLocation.ofSourceLine(file, line)
                : new BreakpointLocation(null, 0, Objects.requireNonNullElse(originalLocation, "#" + id));
        if (find(location).isPresent()) {
            return Optional.empty();
        }
        var entry = new BreakpointEntry(location);
        entry.confirm(id, file, line);
        entries.add(entry);
        return Optional.of(entry);
    }

    public void remove(BreakpointEntry entry) {
        entries.remove(entry);
    }

    public Optional<BreakpointEntry> removeById(String id) {
        Optional<BreakpointEntry> entry = findById(id);
        entry.ifPresent(entries::remove);
        return entry;
    }

    /**
     * 调试器进程结束后调用：所有编号失效，断点回到 DEFERRED 状态，等待下一次重放。
     */
    public void deferAll() {
        entries.forEach(BreakpointEntry::defer);
    }

    public List<BreakpointEntry> entries() {
        return List.copyOf(entries);
    }

    /**
     * 当前已确认的断点。
     */
    public List<BreakpointInfo> live() {
        return entries.stream().filter(BreakpointEntry::isLive).map(BreakpointEntry::toInfo).toList();
    }

    public int size() {
        return entries.size();
    }
}
