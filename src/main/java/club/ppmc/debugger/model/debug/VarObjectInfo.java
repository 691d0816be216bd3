/**
 * VarObjectInfo.java
 *
 * 代表 gdb 中的一个变量对象（varobj），用于惰性展开结构体、数组和指针。
 * 既是 var_created 事件的负载，也是 var_children 中每个子节点的表示。
 */
package club.ppmc.debugger.model.debug;

/**
 * @param expression 客户端请求展开的表达式；对子节点而言是 gdb 给出的 exp。
 * @param name gdb 分配的句柄，例如 "var1" 或 "var1.next"。只在当前暂停期间有效。
 * @param value 值的文本表示。
 * @param type 类型名。
 * @param numchild 子节点数量。
 */
public record VarObjectInfo(String expression, String name, String value, String type, int numchild) {}
