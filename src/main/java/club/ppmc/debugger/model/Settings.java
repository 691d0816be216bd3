/**
 * Settings.java
 *
 * 该文件定义了一个POJO，用于表示调试后端的各项可配置项。
 * 默认值来自 application.properties，由 SettingsService 负责加载，并可选地持久化到一个 JSON 文件中。
 * 它是一个可变对象，以便于Jackson库进行序列化和反序列化。
 */
package club.ppmc.debugger.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class Settings {

    // --- 调试器进程 ---
    /**
     * gdb 可执行文件，可以是绝对路径或 PATH 中的命令名。
     */
    @NotBlank
    private String gdbPath = "gdb";

    /**
     * 追加到 gdb 启动命令中的额外参数，例如 "--eval-command=set print pretty on"。
     */
    private List<String> gdbExtraArgs = new ArrayList<>();

    /**
     * 释放进程时等待其正常退出的时间，超时后强制终止。
     */
    @Min(1)
    private long processTerminateTimeoutMs = 1000;

    // --- 会话策略 ---
    /**
     * 等待断点创建等确认回复的超时时间。
     */
    @Min(1)
    private long commandTimeoutMs = 5000;

    /**
     * 最后一个通道断开后，会话在被回收前保留的时间，用于容忍页面刷新等短暂断线。
     */
    @Min(0)
    private long reconnectGracePeriodSeconds = 600;

    /** 每个会话保留的日志条数。 */
    @Min(1)
    private int logHistorySize = 50;

    /** 重新连接时回放的日志条数。 */
    @Min(0)
    private int logReplaySize = 10;

    @Min(1)
    private int defaultMemoryReadCount = 256;

    @Min(1)
    private int maxMemoryReadCount = 65536;

    /**
     * 每个通道待发送消息队列的上限，超过时丢弃最旧的消息。
     */
    @Min(1)
    private int outboundQueueLimit = 1000;

    // --- 崩溃分析服务 ---
    @NotBlank
    private String analysisServiceUrl = "http://localhost:8002";
}
