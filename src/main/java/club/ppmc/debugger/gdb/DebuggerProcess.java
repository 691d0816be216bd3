/**
 * DebuggerProcess.java
 *
 * 一个被会话独占的外部调试器进程。输出通过创建时注册的 DebuggerOutputListener 按行异步交付。
 */
package club.ppmc.debugger.gdb;

import java.io.IOException;

public interface DebuggerProcess {

    /**
     * 向调试器写入一行已编码的命令（不含行终止符）。
     *
     * @throws IOException 进程的输入流已关闭时。
     */
    void write(String line) throws IOException;

    boolean isAlive();

    long pid();

    /**
     * 无条件释放进程及其输入输出流，必要时强制终止进程及其子进程（被调试程序）。
     * 可以重复调用。
     */
    void destroy();
}
