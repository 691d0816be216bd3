/**
 * SettingsController.java
 *
 * 读取和更新调试后端的设置。更新只影响之后创建的调试会话。
 */
package club.ppmc.debugger.controller;

import club.ppmc.debugger.model.Settings;
import club.ppmc.debugger.service.SettingsService;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/settings")
@Slf4j
public class SettingsController {

    private final SettingsService settingsService;

    public SettingsController(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping
    public ResponseEntity<Settings> getSettings() {
        return ResponseEntity.ok(settingsService.getSettings());
    }

    @PostMapping
    public ResponseEntity<Map<String, String>> updateSettings(@Valid @RequestBody Settings newSettings) {
        try {
            settingsService.updateSettings(newSettings);
            return ResponseEntity.ok(Map.of("message", "设置更新成功。"));
        } catch (IOException e) {
            log.error("保存设置失败", e);
            return ResponseEntity.internalServerError().body(Map.of("message", "保存设置失败: " + e.getMessage()));
        }
    }
}
