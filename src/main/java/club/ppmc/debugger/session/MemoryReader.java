/**
 * MemoryReader.java
 *
 * 跟踪原始内存读取请求。每个新请求都会取代之前的请求：
 * 较早的请求即使稍后才返回，其结果也会被丢弃，而不会覆盖较新的结果。
 * 非线程安全，只在所属会话的处理线程上访问。
 */
package club.ppmc.debugger.session;

import club.ppmc.debugger.exception.DebugSessionException;
import club.ppmc.debugger.model.debug.MemoryBlock;
import java.util.Optional;

public class MemoryReader {

    private long latestRequest;
    private MemoryBlock lastBlock;

    /**
     * 校验读取参数。地址表达式的解析交给 gdb，这里只拒绝会被当作命令选项的写法。
     */
    public static void validate(String address, int count, int maxCount) {
        if (address == null || address.isBlank()) {
            throw new DebugSessionException("read_memory", "缺少必填参数: address");
        }
        if (address.trim().startsWith("-")) {
            throw new DebugSessionException("read_memory", "非法的地址表达式: " + address);
        }
        if (count <= 0 || count > maxCount) {
            throw new DebugSessionException(
                    "read_memory", String.format("读取字节数必须在 1 到 %d 之间: %d", maxCount, count));
        }
    }

    /**
     * 开始一个新的读取请求。
     *
     * @return 请求序号，用于在回复到达时判断它是否仍是最新的请求。
     */
    public long begin() {
        return ++latestRequest;
    }

    public boolean isCurrent(long requestId) {
        return requestId == latestRequest;
    }

    /**
     * 接受一个回复。
     *
     * @return 回复属于最新请求并已被采纳时返回 true；过期回复返回 false。
     */
    public boolean accept(long requestId, MemoryBlock block) {
        if (!isCurrent(requestId)) {
            return false;
        }
        this.lastBlock = block;
        return true;
    }

    /**
     * 进入 Running 或调试器重启时调用：清除结果并使进行中的请求过期。
     */
    public void invalidate() {
        latestRequest++;
        lastBlock = null;
    }

    public Optional<MemoryBlock> lastBlock() {
        return Optional.ofNullable(lastBlock);
    }
}
