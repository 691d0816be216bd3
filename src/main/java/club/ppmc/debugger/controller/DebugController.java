/**
 * DebugController.java
 *
 * 调试会话的 REST 查询接口：列出会话、读取某个会话缓存的快照、请求崩溃分析。
 * 调试操作本身只通过 WebSocket 发送，这里不提供执行控制。
 */
package club.ppmc.debugger.controller;

import club.ppmc.debugger.model.analysis.AnalysisResult;
import club.ppmc.debugger.model.debug.SessionSummary;
import club.ppmc.debugger.model.debug.StateSnapshot;
import club.ppmc.debugger.service.CrashAnalysisService;
import club.ppmc.debugger.session.DebugSessionRegistry;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/debug")
public class DebugController {

    private final DebugSessionRegistry registry;
    private final CrashAnalysisService analysisService;

    public DebugController(DebugSessionRegistry registry, CrashAnalysisService analysisService) {
        this.registry = registry;
        this.analysisService = analysisService;
    }

    @GetMapping("/sessions")
    public ResponseEntity<List<SessionSummary>> listSessions() {
        return ResponseEntity.ok(registry.summaries());
    }

    /**
     * 读取会话最近一次广播的快照，不会向调试器发出任何命令。
     */
    @GetMapping("/sessions/{sessionId}/context")
    public ResponseEntity<?> getContext(@PathVariable String sessionId) {
        return registry.find(sessionId)
                .<ResponseEntity<?>>map(session -> ResponseEntity.ok(session.snapshot()))
                .orElseGet(() -> notFound(sessionId));
    }

    /**
     * 用会话当前的调用栈和日志请求崩溃分析。
     *
     * @param body 可选，{"current_file": "..."}。
     */
    @PostMapping("/sessions/{sessionId}/analyze")
    public ResponseEntity<?> analyze(
            @PathVariable String sessionId, @RequestBody(required = false) Map<String, String> body) {
        String currentFile = body != null ? body.get("current_file") : null;
        return registry.find(sessionId)
                .<ResponseEntity<?>>map(session -> {
                    AnalysisResult result = analysisService.analyzeSession(session, currentFile);
                    return ResponseEntity.ok(result);
                })
                .orElseGet(() -> notFound(sessionId));
    }

    private static ResponseEntity<Map<String, String>> notFound(String sessionId) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("message", "调试会话不存在: " + sessionId));
    }
}
