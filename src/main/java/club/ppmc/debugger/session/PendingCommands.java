/**
 * PendingCommands.java
 *
 * 将每条发出的 MI 命令以单调递增的令牌登记下来，并把回复路由给发起它的处理器。
 * 回复可能不按发出顺序到达，因此关联只依赖令牌，不依赖位置。
 * 令牌在会话的整个生命周期内单调递增，即使调试器进程被替换也不会重复。
 */
package club.ppmc.debugger.session;

import club.ppmc.debugger.mi.MiRecord;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

class PendingCommands {

    private final AtomicLong nextToken = new AtomicLong(1);
    private final Map<Long, Consumer<MiRecord.Result>> handlers = new HashMap<>();

    long nextToken() {
        return nextToken.getAndIncrement();
    }

    void register(long token, Consumer<MiRecord.Result> handler) {
        handlers.put(token, handler);
    }

    Optional<Consumer<MiRecord.Result>> complete(long token) {
        return Optional.ofNullable(handlers.remove(token));
    }

    void cancel(long token) {
        handlers.remove(token);
    }

    void clear() {
        handlers.clear();
    }

    int size() {
        return handlers.size();
    }
}
