/**
 * DebugStatus.java
 *
 * 调试会话的执行状态。它是决定哪些操作可以被接受的唯一依据。
 * 线路上的取值为 "Ready"、"Running"、"Paused"、"Stopped"、"Exited"。
 */
package club.ppmc.debugger.model.debug;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.gson.annotations.SerializedName;

public enum DebugStatus {
    /** 调试器已就绪（或尚未初始化），程序未运行。 */
    @SerializedName("Ready")
    READY("Ready"),

    @SerializedName("Running")
    RUNNING("Running"),

    /** 在断点、单步完成或可恢复信号处暂停，可以继续单步。 */
    @SerializedName("Paused")
    PAUSED("Paused"),

    /** 因致命信号（如段错误）而停止，只能重新运行。 */
    @SerializedName("Stopped")
    STOPPED("Stopped"),

    @SerializedName("Exited")
    EXITED("Exited");

    private final String wireName;

    DebugStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * 是否允许 init / run：只有在没有活动执行上下文时才允许。
     */
    public boolean canLaunch() {
        return this == READY || this == EXITED || this == STOPPED;
    }

    /**
     * 被调试程序是否存活且处于停止状态，可以读取栈、变量与内存。
     */
    public boolean isInspectable() {
        return this == PAUSED || this == STOPPED;
    }
}
