/**
 * VarObjectTree.java
 *
 * 维护客户端按需展开的变量对象树，以 gdb 分配的句柄为键。
 * 句柄只在当前暂停期间有效：任何进入 Running 的转换都会清空整棵树并取消所有进行中的展开请求，
 * 之后到达的旧回复会被丢弃。进行中的请求以命令令牌为键，不依赖回复的到达顺序。
 * 非线程安全，只在所属会话的处理线程上访问。
 */
package club.ppmc.debugger.session;

import club.ppmc.debugger.model.debug.VarObjectInfo;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class VarObjectTree {

    /** 树中的一个节点。children 为 null 表示尚未列出子节点。 */
    public static final class Node {
        private final VarObjectInfo info;
        private final String parent;
        private List<VarObjectInfo> children;

        Node(VarObjectInfo info, String parent) {
            this.info = info;
            this.parent = parent;
        }

        public VarObjectInfo info() {
            return info;
        }

        public String handle() {
            return info.name();
        }

        public String expression() {
            return info.expression();
        }

        public String parent() {
            return parent;
        }

        public Optional<List<VarObjectInfo>> children() {
            return Optional.ofNullable(children);
        }
    }

    /** 进行中的展开请求。 */
    public record PendingExpansion(String expression, String handle, int generation) {}

    private final Map<String, Node> nodesByHandle = new HashMap<>();
    private final Map<String, String> rootsByExpression = new HashMap<>();
    private final Map<Long, PendingExpansion> pendingCreates = new HashMap<>();
    private final Map<Long, PendingExpansion> pendingChildren = new HashMap<>();
    private final Set<String> expanded = new HashSet<>();
    private final List<String> staleRoots = new ArrayList<>();
    private int generation;

    public Optional<Node> findRoot(String expression) {
        String handle = rootsByExpression.get(expression);
        return handle == null ? Optional.empty() : Optional.ofNullable(nodesByHandle.get(handle));
    }

    public Optional<Node> findByHandle(String handle) {
        return Optional.ofNullable(nodesByHandle.get(handle));
    }

    public boolean isCreatePending(String expression) {
        return pendingCreates.values().stream().anyMatch(p -> p.expression().equals(expression));
    }

    public void trackCreate(long token, String expression) {
        pendingCreates.put(token, new PendingExpansion(expression, null, generation));
        expanded.add(expression);
    }

    /**
     * 取出与令牌对应的创建请求；请求已被取消（树已失效）时返回空。
     */
    public Optional<PendingExpansion> takeCreate(long token) {
        return Optional.ofNullable(pendingCreates.remove(token)).filter(p -> p.generation() == generation);
    }

    public void trackChildren(long token, Node node) {
        pendingChildren.put(token, new PendingExpansion(node.expression(), node.handle(), generation));
    }

    public Optional<PendingExpansion> takeChildren(long token) {
        return Optional.ofNullable(pendingChildren.remove(token)).filter(p -> p.generation() == generation);
    }

    public Node addRoot(VarObjectInfo info) {
        var node = new Node(info, null);
        nodesByHandle.put(info.name(), node);
        rootsByExpression.put(info.expression(), info.name());
        return node;
    }

    /**
     * 记录某个节点的子节点，子节点本身也成为可以继续展开的节点。
     *
     * @return 父节点；父节点已不在树中时返回空。
     */
    public Optional<Node> setChildren(String handle, List<VarObjectInfo> children) {
        Node parent = nodesByHandle.get(handle);
        if (parent == null) {
            return Optional.empty();
        }
        parent.children = List.copyOf(children);
        for (VarObjectInfo child : children) {
            if (child.name() != null) {
                nodesByHandle.putIfAbsent(child.name(), new Node(child, handle));
            }
        }
        return Optional.of(parent);
    }

    public void markExpanded(String expression) {
        expanded.add(expression);
    }

    /**
     * 折叠只改变显示状态，不会向调试器发出任何命令，句柄与缓存的子节点保持有效。
     */
    public boolean collapse(String expression) {
        return expanded.remove(expression);
    }

    public boolean isExpanded(String expression) {
        return expanded.contains(expression);
    }

    /**
     * 当前展开的根节点，按表达式排序，用于向新加入的通道回放。
     */
    public List<Node> expandedRoots() {
        return rootsByExpression.keySet().stream()
                .filter(this::isExpanded)
                .sorted()
                .map(this::findRoot)
                .flatMap(Optional::stream)
                .toList();
    }

    /**
     * 进入 Running 时调用：丢弃所有句柄与缓存，取消进行中的请求。
     * 旧的根句柄会被记录下来，以便下一次暂停时在 gdb 中删除。
     */
    public void invalidate() {
        staleRoots.addAll(rootsByExpression.values());
        nodesByHandle.clear();
        rootsByExpression.clear();
        pendingCreates.clear();
        pendingChildren.clear();
        expanded.clear();
        generation++;
    }

    /**
     * 调试器进程更换后调用：旧进程中的句柄无需再删除。
     */
    public void reset() {
        invalidate();
        staleRoots.clear();
    }

    /**
     * 记录一个已在 gdb 中创建、但回复到达时树已失效的句柄，下次暂停时删除。
     */
    public void markStale(String handle) {
        if (handle != null) {
            staleRoots.add(handle);
        }
    }

    public List<String> drainStaleRoots() {
        List<String> roots = List.copyOf(staleRoots);
        staleRoots.clear();
        return roots;
    }

    public int generation() {
        return generation;
    }

    public int size() {
        return nodesByHandle.size();
    }
}
