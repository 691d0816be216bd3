/**
 * BreakpointEntry.java
 *
 * 断点注册表中的一项。它记录用户请求的位置，以及 gdb 确认后分配的编号与规范位置。
 * 只在所属会话的处理线程上访问。
 */
package club.ppmc.debugger.session;

import club.ppmc.debugger.model.debug.BreakpointInfo;
import lombok.Getter;

@Getter
public class BreakpointEntry {

    public enum State {
        /** 没有活动的调试器，等待下一次 init 时设置。 */
        DEFERRED,
        /** 已发出 -break-insert，等待确认。 */
        PENDING,
        /** 已由 gdb 确认。 */
        LIVE
    }

    private final BreakpointLocation requested;
    private State state = State.DEFERRED;
    private String id;
    private String file;
    private int line;
    private long pendingToken;

    BreakpointEntry(BreakpointLocation requested) {
        this.requested = requested;
        this.file = requested.file();
        this.line = requested.line();
    }

    void markPending(long token) {
        this.state = State.PENDING;
        this.pendingToken = token;
        this.id = null;
    }

    void confirm(String id, String file, int line) {
        this.state = State.LIVE;
        this.id = id;
        if (file != null) {
            this.file = file;
        }
        if (line > 0) {
            this.line = line;
        }
    }

    void defer() {
        this.state = State.DEFERRED;
        this.id = null;
        this.pendingToken = 0;
    }

    public boolean isLive() {
        return state == State.LIVE;
    }

    public boolean isPending() {
        return state == State.PENDING;
    }

    /**
     * 是否指向给定位置：与请求位置相同，或（已确认时）与 gdb 报告的规范位置相同。
     */
    public boolean matches(BreakpointLocation location) {
        if (requested.sameAs(location)) {
            return true;
        }
        return location.isSourceLine() && file != null && location.matches(file, line);
    }

    public BreakpointInfo toInfo() {
        return new BreakpointInfo(id, file, line);
    }
}
