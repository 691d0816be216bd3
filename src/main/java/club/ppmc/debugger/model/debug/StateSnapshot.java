/**
 * StateSnapshot.java
 *
 * 该文件定义了 state_update 事件的数据负载，聚合了会话状态、暂停位置、调用栈和顶层变量。
 * 每次逻辑上的暂停/恢复只会广播一次快照。
 */
package club.ppmc.debugger.model.debug;

import java.util.List;

/**
 * @param status 当前执行状态。
 * @param location 当前暂停位置；未暂停时为 null。
 * @param stack 调用栈，最内层在前。
 * @param variables 当前帧中的顶层变量。
 */
public record StateSnapshot(
        DebugStatus status, LocationInfo location, List<StackFrameInfo> stack, List<VariableInfo> variables) {

    public StateSnapshot {
        stack = stack == null ? List.of() : List.copyOf(stack);
        variables = variables == null ? List.of() : List.copyOf(variables);
    }

    public static StateSnapshot initial() {
        return new StateSnapshot(DebugStatus.READY, null, List.of(), List.of());
    }
}
