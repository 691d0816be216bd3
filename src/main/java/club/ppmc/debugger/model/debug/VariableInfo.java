/**
 * VariableInfo.java
 *
 * 该文件定义了一个数据传输对象 (DTO)，用于表示调试器暂停时当前帧内的一个顶层变量。
 * 每次暂停都会重新采集整个变量列表。
 */
package club.ppmc.debugger.model.debug;

/**
 * 代表一个顶层变量信息的记录。
 *
 * @param name 变量的名称。
 * @param value 变量当前值的文本表示；聚合类型显示为 "{...}"，需通过变量对象展开。
 * @param type 变量的类型（例如 "int"、"struct Node *"），可能为 null。
 */
public record VariableInfo(String name, String value, String type) {}
