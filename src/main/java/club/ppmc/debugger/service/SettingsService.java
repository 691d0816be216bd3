/**
 * SettingsService.java
 *
 * 该服务是整个应用的配置中心，负责管理调试后端的所有可配置项。
 * 在启动时，它使用 application.properties 中的值作为默认设置；
 * 如果配置了 app.settings-file，则从该 JSON 文件加载覆盖值，更新时也写回该文件。
 * 所有其他需要配置的组件都应依赖此服务，而不是直接使用 @Value 注解。
 */
package club.ppmc.debugger.service;

import club.ppmc.debugger.model.Settings;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class SettingsService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SettingsService.class);

    private final Path settingsFilePath;
    private final ObjectMapper objectMapper;
    private final Settings defaults;
    private volatile Settings currentSettings;

    public SettingsService(
            @Value("${app.settings-file:}") String settingsFile,
            @Value("${app.gdb.path:gdb}") String gdbPath,
            @Value("${app.gdb.extra-args:}") List<String> gdbExtraArgs,
            @Value("${app.debug.command-timeout-ms:5000}") long commandTimeoutMs,
            @Value("${app.debug.reconnect-grace-period-seconds:600}") long gracePeriodSeconds,
            @Value("${app.debug.log-history-size:50}") int logHistorySize,
            @Value("${app.debug.log-replay-size:10}") int logReplaySize,
            @Value("${app.debug.max-memory-read:65536}") int maxMemoryRead,
            @Value("${app.debug.outbound-queue-limit:1000}") int outboundQueueLimit,
            @Value("${app.analysis.url:http://localhost:8002}") String analysisServiceUrl) {

        var settings = new Settings();
        settings.setGdbPath(gdbPath);
        settings.setGdbExtraArgs(gdbExtraArgs != null ? new ArrayList<>(gdbExtraArgs) : new ArrayList<>());
        settings.setCommandTimeoutMs(commandTimeoutMs);
        settings.setReconnectGracePeriodSeconds(gracePeriodSeconds);
        settings.setLogHistorySize(logHistorySize);
        settings.setLogReplaySize(logReplaySize);
        settings.setMaxMemoryReadCount(maxMemoryRead);
        settings.setOutboundQueueLimit(outboundQueueLimit);
        settings.setAnalysisServiceUrl(analysisServiceUrl);
        this.defaults = settings;
        this.currentSettings = settings;

        this.settingsFilePath = StringUtils.hasText(settingsFile)
                ? Paths.get(settingsFile).toAbsolutePath().normalize()
                : null;
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @PostConstruct
    public void init() {
        if (settingsFilePath == null) {
            LOGGER.info("未配置设置文件，使用 application.properties 中的默认设置。");
            return;
        }
        if (Files.exists(settingsFilePath)) {
            loadSettings();
        } else {
            LOGGER.info("设置文件 {} 不存在，将在首次更新时创建。", settingsFilePath);
        }
    }

    public synchronized Settings getSettings() {
        return this.currentSettings;
    }

    public synchronized void updateSettings(Settings newSettings) throws IOException {
        this.currentSettings = newSettings;
        saveSettings();
    }

    private void loadSettings() {
        try {
            byte[] jsonData = Files.readAllBytes(settingsFilePath);
            this.currentSettings = objectMapper.readValue(jsonData, Settings.class);
            LOGGER.info("已成功从 {} 加载设置。", settingsFilePath);
        } catch (IOException e) {
            LOGGER.error("读取设置文件时出错。将使用默认设置。", e);
            this.currentSettings = defaults;
        }
    }

    private void saveSettings() throws IOException {
        if (settingsFilePath == null) {
            LOGGER.info("未配置设置文件，更新后的设置只在本次运行期间有效。");
            return;
        }
        if (settingsFilePath.getParent() != null && Files.notExists(settingsFilePath.getParent())) {
            Files.createDirectories(settingsFilePath.getParent());
        }
        try {
            Files.write(settingsFilePath, objectMapper.writeValueAsBytes(currentSettings));
            LOGGER.info("已成功将设置保存到 {}", settingsFilePath);
        } catch (IOException e) {
            LOGGER.error("将设置保存到文件 {} 时失败", settingsFilePath, e);
            throw e;
        }
    }
}
