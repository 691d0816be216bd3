/**
 * CrashAnalysisService.java
 *
 * 崩溃分析服务的客户端。调试后端本身不做任何分析，只负责把调用栈、故障描述和最近日志
 * 转发给外部的分析服务；该服务不可达或返回异常时，结果降级为 "Analysis unavailable"。
 */
package club.ppmc.debugger.service;

import club.ppmc.debugger.model.analysis.AnalysisRequest;
import club.ppmc.debugger.model.analysis.AnalysisResult;
import club.ppmc.debugger.model.debug.DebugStatus;
import club.ppmc.debugger.model.debug.LogEntry;
import club.ppmc.debugger.model.debug.StateSnapshot;
import club.ppmc.debugger.session.DebugSession;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Service
@Slf4j
public class CrashAnalysisService {

    private final RestTemplate restTemplate;
    private final SettingsService settingsService;

    public CrashAnalysisService(RestTemplate restTemplate, SettingsService settingsService) {
        this.restTemplate = restTemplate;
        this.settingsService = settingsService;
    }

    /**
     * 将请求原样转发给分析服务。
     */
    public AnalysisResult analyze(AnalysisRequest request) {
        String url = analysisUrl();
        try {
            AnalysisResult result = restTemplate.postForObject(url, request, AnalysisResult.class);
            if (result == null) {
                log.warn("崩溃分析服务 {} 返回了空结果。", url);
                return AnalysisResult.unavailable();
            }
            return result;
        } catch (RestClientException e) {
            log.warn("调用崩溃分析服务 {} 失败: {}", url, e.getMessage());
            return AnalysisResult.unavailable();
        }
    }

    /**
     * 用会话当前的快照和日志构造请求并转发。
     *
     * @param session 调试会话。
     * @param currentFile 用户当前查看的文件；为 null 时使用暂停位置所在的文件。
     */
    public AnalysisResult analyzeSession(DebugSession session, String currentFile) {
        return analyze(buildRequest(session.snapshot(), session.recentLogs(), currentFile));
    }

    static AnalysisRequest buildRequest(StateSnapshot snapshot, List<LogEntry> logs, String currentFile) {
        List<Object> stack = new ArrayList<>(snapshot.stack());
        String file = currentFile;
        if (file == null && snapshot.location() != null) {
            file = snapshot.location().file();
        }
        String recentLogs = logs.stream()
                .map(entry -> "[" + entry.level() + "] " + entry.text())
                .collect(Collectors.joining("\n"));
        return new AnalysisRequest(stack, describe(snapshot.status(), logs), recentLogs, file);
    }

    private static String describe(DebugStatus status, List<LogEntry> logs) {
        for (int i = logs.size() - 1; i >= 0; i--) {
            if (LogEntry.ERROR.equals(logs.get(i).level())) {
                return logs.get(i).text();
            }
        }
        return "程序当前状态: " + status.wireName();
    }

    private String analysisUrl() {
        String base = settingsService.getSettings().getAnalysisServiceUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/analyze_crash";
    }
}
