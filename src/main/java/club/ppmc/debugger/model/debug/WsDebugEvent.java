/**
 * WsDebugEvent.java
 *
 * 该文件定义了一个通用的、顶层的数据传输对象 (DTO)，用于封装所有通过WebSocket发送到前端的调试相关事件。
 * 前端根据 'type' 字段来分发和处理不同类型的调试事件。
 */
package club.ppmc.debugger.model.debug;

/**
 * 封装所有发送到前端的调试相关WebSocket事件。
 *
 * @param type 事件类型，例如 "state_update"、"breakpoint_created"、"error"。
 * @param payload 事件相关的具体数据负载。其类型取决于 `type`。
 * @param <T> 数据负载的泛型类型。
 */
public record WsDebugEvent<T>(String type, T payload) {

    public static final String STATE_UPDATE = "state_update";
    public static final String BREAKPOINT_CREATED = "breakpoint_created";
    public static final String VAR_CREATED = "var_created";
    public static final String VAR_CHILDREN = "var_children";
    public static final String MEMORY_READ = "memory_read";
    public static final String LOG_EVENT = "log_event";
    public static final String CONSOLE = "console";
    public static final String ERROR = "error";

    public static WsDebugEvent<StateSnapshot> stateUpdate(StateSnapshot snapshot) {
        return new WsDebugEvent<>(STATE_UPDATE, snapshot);
    }

    public static WsDebugEvent<BreakpointInfo> breakpointCreated(BreakpointInfo breakpoint) {
        return new WsDebugEvent<>(BREAKPOINT_CREATED, breakpoint);
    }

    public static WsDebugEvent<VarObjectInfo> varCreated(VarObjectInfo varObject) {
        return new WsDebugEvent<>(VAR_CREATED, varObject);
    }

    public static WsDebugEvent<VarChildrenData> varChildren(VarChildrenData children) {
        return new WsDebugEvent<>(VAR_CHILDREN, children);
    }

    public static WsDebugEvent<MemoryContents> memoryRead(MemoryContents contents) {
        return new WsDebugEvent<>(MEMORY_READ, contents);
    }

    public static WsDebugEvent<LogEntry> logEvent(LogEntry entry) {
        return new WsDebugEvent<>(LOG_EVENT, entry);
    }

    public static WsDebugEvent<String> console(String text) {
        return new WsDebugEvent<>(CONSOLE, text);
    }

    public static WsDebugEvent<String> error(String message) {
        return new WsDebugEvent<>(ERROR, message);
    }
}
