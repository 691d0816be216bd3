/**
 * AnalysisController.java
 *
 * 将前端组装好的崩溃分析请求转发给分析服务。
 */
package club.ppmc.debugger.controller;

import club.ppmc.debugger.model.analysis.AnalysisRequest;
import club.ppmc.debugger.model.analysis.AnalysisResult;
import club.ppmc.debugger.service.CrashAnalysisService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/analyze")
public class AnalysisController {

    private final CrashAnalysisService analysisService;

    public AnalysisController(CrashAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping
    public ResponseEntity<AnalysisResult> analyze(@RequestBody AnalysisRequest request) {
        return ResponseEntity.ok(analysisService.analyze(request));
    }
}
