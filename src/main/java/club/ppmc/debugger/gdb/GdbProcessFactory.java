/**
 * GdbProcessFactory.java
 *
 * 以 MI 解释器模式启动 gdb 的工厂。
 * 启动命令形如: gdb --nx --quiet --interpreter=mi3 --eval-command="set debuginfod enabled off" &lt;可执行文件&gt;
 * gdb 的路径与附加参数来自 SettingsService。
 */
package club.ppmc.debugger.gdb;

import club.ppmc.debugger.model.Settings;
import club.ppmc.debugger.service.SettingsService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class GdbProcessFactory implements DebuggerProcessFactory {

    private final SettingsService settingsService;

    public GdbProcessFactory(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @Override
    public DebuggerProcess launch(String executable, DebuggerOutputListener listener) throws IOException {
        Path binary = Paths.get(executable).toAbsolutePath().normalize();
        if (!Files.isRegularFile(binary)) {
            throw new IOException("找不到可执行文件: " + executable);
        }
        if (!Files.isReadable(binary)) {
            throw new IOException("没有读取可执行文件的权限: " + executable);
        }

        Settings settings = settingsService.getSettings();
        List<String> command = buildCommand(settings, binary);

        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(binary.getParent().toFile())
                .redirectErrorStream(true);
        Map<String, String> env = pb.environment();
        // 避免 gdb 进入分页或彩色输出模式
        env.put("TERM", "dumb");
        env.put("LANG", "en_US.UTF-8");

        log.info("启动调试器: {}", String.join(" ", command));
        Process process = pb.start();
        return new GdbProcess(process, listener, settings.getProcessTerminateTimeoutMs());
    }

    static List<String> buildCommand(Settings settings, Path binary) {
        List<String> command = new ArrayList<>();
        command.add(settings.getGdbPath());
        command.add("--nx");
        command.add("--quiet");
        command.add("--interpreter=mi3");
        command.add("--eval-command=set debuginfod enabled off");
        command.add("--eval-command=set pagination off");
        if (settings.getGdbExtraArgs() != null) {
            settings.getGdbExtraArgs().stream()
                    .filter(arg -> arg != null && !arg.isBlank())
                    .forEach(command::add);
        }
        command.add(binary.toString());
        return command;
    }
}
