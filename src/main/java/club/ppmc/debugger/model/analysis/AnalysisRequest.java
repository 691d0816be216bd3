/**
 * AnalysisRequest.java
 *
 * 发往崩溃分析服务 /analyze_crash 的请求体，字段名使用该服务约定的下划线风格。
 *
 * @param stackTrace 调用栈，元素可以是帧对象或 "file:line" 形式的字符串。
 * @param exceptionMsg 对当前故障的简短描述，例如收到的信号名。
 * @param recentLogs 最近的会话日志，按行拼接。
 * @param currentFile 用户当前查看的源文件，可以为 null。
 */
package club.ppmc.debugger.model.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record AnalysisRequest(
        @JsonProperty("stack_trace") List<Object> stackTrace,
        @JsonProperty("exception_msg") String exceptionMsg,
        @JsonProperty("recent_logs") String recentLogs,
        @JsonProperty("current_file") String currentFile) {

    public AnalysisRequest {
        stackTrace = stackTrace == null ? List.of() : List.copyOf(stackTrace);
    }
}
