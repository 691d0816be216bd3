/**
 * DebuggerOutputListener.java
 *
 * 调试器进程输出的接收者。两个回调都在该进程专属的读取线程上按顺序调用。
 */
package club.ppmc.debugger.gdb;

public interface DebuggerOutputListener {

    /** 收到一整行输出（已去除行终止符）。 */
    void onLine(String line);

    /** 输出流结束且进程已退出，只会调用一次。 */
    void onExit(int exitCode);
}
