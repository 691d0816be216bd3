/**
 * DebuggerProcessFactory.java
 *
 * 创建调试器进程的工厂。生产环境使用 GdbProcessFactory，测试中可替换为脚本化的实现。
 */
package club.ppmc.debugger.gdb;

import java.io.IOException;

public interface DebuggerProcessFactory {

    /**
     * 针对指定的可执行文件启动一个新的调试器进程。
     *
     * @param executable 被调试程序的路径。
     * @param listener 输出接收者。
     * @return 已启动的进程。
     * @throws IOException 可执行文件不存在或调试器无法启动时。
     */
    DebuggerProcess launch(String executable, DebuggerOutputListener listener) throws IOException;
}
