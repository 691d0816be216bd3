/**
 * GdbProcess.java
 *
 * 包装一个以 MI 模式运行的 gdb 进程。
 * 每个进程有且只有一个专属的读取线程，它把输出重新组装为整行并按顺序交给监听器，
 * 因此不同会话的输出永远不会交错。销毁时会同时终止 gdb 派生的被调试程序，并回收进程，避免僵尸进程。
 */
package club.ppmc.debugger.gdb;

import club.ppmc.debugger.mi.MiLineBuffer;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

@Slf4j
class GdbProcess implements DebuggerProcess {

    private final Process process;
    private final BufferedWriter writer;
    private final DebuggerOutputListener listener;
    private final long terminateTimeoutMs;
    private final AtomicBoolean destroyed = new AtomicBoolean(false);

    GdbProcess(Process process, DebuggerOutputListener listener, long terminateTimeoutMs) {
        this.process = process;
        this.listener = listener;
        this.terminateTimeoutMs = terminateTimeoutMs;
        this.writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        Thread reader = new Thread(this::readOutput, "gdb-reader-" + process.pid());
        reader.setDaemon(true);
        reader.start();
    }

    private void readOutput() {
        var lineBuffer = new MiLineBuffer();
        try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            char[] buffer = new char[4096];
            int charsRead;
            while ((charsRead = reader.read(buffer)) != -1) {
                for (String line : lineBuffer.append(new String(buffer, 0, charsRead))) {
                    deliver(line);
                }
            }
        } catch (IOException e) {
            // 进程被销毁时读取流会关闭并抛出异常，这是正常行为
            log.info("读取 gdb (PID {}) 输出时流已关闭: {}", process.pid(), e.getMessage());
        }

        String rest = lineBuffer.drain();
        if (rest != null) {
            deliver(rest);
        }

        int exitCode = awaitExit();
        log.info("gdb 进程 PID {} 已退出，退出码: {}", process.pid(), exitCode);
        try {
            listener.onExit(exitCode);
        } catch (RuntimeException e) {
            log.error("处理 gdb 退出事件时出错", e);
        }
    }

    private void deliver(String line) {
        try {
            listener.onLine(line);
        } catch (RuntimeException e) {
            log.error("处理 gdb 输出行时出错: {}", line, e);
        }
    }

    private int awaitExit() {
        try {
            return process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return -1;
        }
    }

    @Override
    public synchronized void write(String line) throws IOException {
        if (destroyed.get()) {
            throw new IOException("调试器进程已被释放");
        }
        log.debug("GDB WRITE: {}", line);
        writer.write(line);
        writer.write('\n');
        writer.flush();
    }

    @Override
    public boolean isAlive() {
        return !destroyed.get() && process.isAlive();
    }

    @Override
    public long pid() {
        return process.pid();
    }

    @Override
    public void destroy() {
        if (!destroyed.compareAndSet(false, true)) {
            return;
        }
        List<ProcessHandle> descendants = process.descendants().toList();
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("关闭 gdb (PID {}) 输入流时出错: {}", process.pid(), e.getMessage());
        }

        process.destroy();
        descendants.forEach(ProcessHandle::destroy);
        try {
            if (!process.waitFor(terminateTimeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("gdb (PID {}) 未在 {} ms 内退出，将强制终止。", process.pid(), terminateTimeoutMs);
                process.destroyForcibly();
                process.waitFor(terminateTimeoutMs, TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
        descendants.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
        log.info("gdb 进程 PID {} 已释放。", process.pid());
    }
}
