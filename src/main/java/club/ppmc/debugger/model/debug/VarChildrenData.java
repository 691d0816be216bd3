/**
 * VarChildrenData.java
 *
 * var_children 事件的数据负载。携带父句柄与对应的表达式，
 * 客户端据此把结果归属到正确的展开节点，而不依赖于回复到达的顺序。
 *
 * @param name 父变量对象的句柄。
 * @param expression 父变量对象对应的表达式。
 * @param children 子变量对象列表。
 */
package club.ppmc.debugger.model.debug;

import java.util.List;

public record VarChildrenData(String name, String expression, List<VarObjectInfo> children) {}
