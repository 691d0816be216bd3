/**
 * DebugSession.java
 *
 * 一个调试会话：拥有一个 gdb 子进程，以及与之对应的执行状态、断点、变量对象树和内存读取状态。
 *
 * 所有状态变更都在会话自己的单线程处理循环上执行：客户端操作、gdb 输出行、命令超时和进程退出
 * 都被投递到该循环中，因此这里的字段不需要加锁。发往 gdb 的命令带有单调递增的令牌，
 * 结果记录按令牌路由到发出它的处理函数，不依赖回复的到达顺序。
 */
package club.ppmc.debugger.session;

import club.ppmc.debugger.exception.DebugSessionException;
import club.ppmc.debugger.gdb.DebuggerOutputListener;
import club.ppmc.debugger.gdb.DebuggerProcess;
import club.ppmc.debugger.gdb.DebuggerProcessFactory;
import club.ppmc.debugger.mi.MiBreakpoint;
import club.ppmc.debugger.mi.MiCommand;
import club.ppmc.debugger.mi.MiParser;
import club.ppmc.debugger.mi.MiPayloads;
import club.ppmc.debugger.mi.MiRecord;
import club.ppmc.debugger.mi.MiTuple;
import club.ppmc.debugger.model.Settings;
import club.ppmc.debugger.model.debug.BreakpointInfo;
import club.ppmc.debugger.model.debug.DebugAction;
import club.ppmc.debugger.model.debug.DebugStatus;
import club.ppmc.debugger.model.debug.LocationInfo;
import club.ppmc.debugger.model.debug.LogEntry;
import club.ppmc.debugger.model.debug.MemoryBlock;
import club.ppmc.debugger.model.debug.MemoryContents;
import club.ppmc.debugger.model.debug.SessionSummary;
import club.ppmc.debugger.model.debug.StackFrameInfo;
import club.ppmc.debugger.model.debug.StateSnapshot;
import club.ppmc.debugger.model.debug.VarChildrenData;
import club.ppmc.debugger.model.debug.VarObjectInfo;
import club.ppmc.debugger.model.debug.VariableInfo;
import club.ppmc.debugger.model.debug.WsDebugEvent;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class DebugSession {

    /** 收到这些信号时程序无法继续执行，状态为 Stopped 而不是 Paused。 */
    private static final Set<String> FATAL_SIGNALS =
            Set.of("SIGSEGV", "SIGABRT", "SIGBUS", "SIGFPE", "SIGILL", "SIGKILL", "SIGSYS");

    private final String id;
    private final Settings settings;
    private final DebuggerProcessFactory processFactory;
    private final ScheduledExecutorService timeoutScheduler;
    private final EventBroadcaster broadcaster;
    private final Clock clock;
    private final Consumer<DebugSession> discardHandler;
    private final ExecutorService loop;

    private final MiParser parser = new MiParser();
    private final PendingCommands pending = new PendingCommands();
    private final BreakpointRegistry breakpoints = new BreakpointRegistry();
    private final VarObjectTree varObjects = new VarObjectTree();
    private final MemoryReader memory = new MemoryReader();
    private final Deque<LogEntry> logHistory = new ArrayDeque<>();

    // 以下字段只在处理循环上读写
    private DebuggerProcess process;
    private long processEpoch;
    private DebugStatus status = DebugStatus.READY;
    private LocationInfo location;
    private List<StackFrameInfo> stack = List.of();
    private List<VariableInfo> variables = List.of();
    private long stopGeneration;
    private long activeExecToken;
    private ContextFetch contextFetch;

    private volatile StateSnapshot lastSnapshot = StateSnapshot.initial();
    private volatile String executable;
    private volatile DebuggerProcess liveProcess;
    private volatile boolean closed;

    public DebugSession(
            String id,
            Settings settings,
            DebuggerProcessFactory processFactory,
            ScheduledExecutorService timeoutScheduler,
            EventBroadcaster broadcaster,
            Clock clock,
            Consumer<DebugSession> discardHandler) {
        this.id = id;
        this.settings = settings;
        this.processFactory = processFactory;
        this.timeoutScheduler = timeoutScheduler;
        this.broadcaster = broadcaster;
        this.clock = clock;
        this.discardHandler = discardHandler;
        this.loop = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "gdb-session-" + id);
            thread.setDaemon(true);
            return thread;
        });
    }

    public String id() {
        return id;
    }

    public String executable() {
        return executable;
    }

    /** 最近一次广播的状态快照。 */
    public StateSnapshot snapshot() {
        return lastSnapshot;
    }

    public DebugStatus status() {
        return lastSnapshot.status();
    }

    public EventBroadcaster broadcaster() {
        return broadcaster;
    }

    public boolean isClosed() {
        return closed;
    }

    public SessionSummary summary() {
        return new SessionSummary(id, lastSnapshot.status(), executable, broadcaster.subscriberCount());
    }

    /**
     * 最近的日志条目，按时间先后排列。
     */
    public List<LogEntry> recentLogs() {
        synchronized (logHistory) {
            return new ArrayList<>(logHistory);
        }
    }

    /**
     * 提交一个客户端操作。操作在处理循环上按提交顺序执行；被拒绝的操作只回复给发起它的通道。
     *
     * @param action 客户端操作。
     * @param channelId 发起操作的通道，可以为 null（此时错误会广播给所有订阅者）。
     */
    public CompletableFuture<Void> submit(DebugAction action, String channelId) {
        return runOnLoop(() -> dispatch(action, channelId));
    }

    /**
     * 将一个通道加入会话。新通道会先收到当前快照、已生效的断点、展开的变量、最近一次内存读取和最近的日志，
     * 之后才是实时事件。
     */
    public CompletableFuture<Void> attach(DebugChannel channel) {
        return runOnLoop(() -> {
            if (!broadcaster.subscribe(channel)) {
                return;
            }
            String channelId = channel.id();
            broadcaster.sendTo(channelId, WsDebugEvent.stateUpdate(lastSnapshot));
            for (BreakpointInfo info : breakpoints.live()) {
                broadcaster.sendTo(channelId, WsDebugEvent.breakpointCreated(info));
            }
            for (VarObjectTree.Node root : varObjects.expandedRoots()) {
                broadcaster.sendTo(channelId, WsDebugEvent.varCreated(root.info()));
                root.children().ifPresent(children -> broadcaster.sendTo(channelId,
                        WsDebugEvent.varChildren(new VarChildrenData(root.handle(), root.expression(), children))));
            }
            memory.lastBlock().ifPresent(block ->
                    broadcaster.sendTo(channelId, WsDebugEvent.memoryRead(MemoryContents.of(block))));
            List<LogEntry> logs = recentLogs();
            int from = Math.max(0, logs.size() - settings.getLogReplaySize());
            for (LogEntry entry : logs.subList(from, logs.size())) {
                broadcaster.sendTo(channelId, WsDebugEvent.logEvent(entry));
            }
        });
    }

    /**
     * 移除一个通道。最后一个通道离开后会话继续存活，直到宽限期结束被回收。
     */
    public void detach(String channelId) {
        broadcaster.unsubscribe(channelId);
    }

    /**
     * 关闭会话：无条件终止调试器进程并停止处理循环。可以重复调用。
     */
    public CompletableFuture<Void> close() {
        if (closed) {
            return CompletableFuture.completedFuture(null);
        }
        closed = true;
        DebuggerProcess current = liveProcess;
        if (current != null) {
            current.destroy();
        }
        CompletableFuture<Void> done;
        try {
            done = CompletableFuture.runAsync(guarded(() -> {
                terminateProcess();
                broadcaster.clear();
                log.info("调试会话 {} 已关闭。", id);
            }), loop);
        } catch (RejectedExecutionException e) {
            done = CompletableFuture.completedFuture(null);
        }
        loop.shutdown();
        return done;
    }

    /**
     * 在处理循环上再次确认会话没有订阅者且空闲超过宽限期，然后关闭会话。
     * 检查与关闭之间不会有其他操作插入，因此不会关闭一个刚刚被重新加入的会话。
     *
     * @param graceMillis 宽限期。
     * @param release 关闭前调用，通常是把会话从注册表中移除；返回 false 时放弃关闭。
     * @return 会话是否被关闭。
     */
    public CompletableFuture<Boolean> closeIfIdle(long graceMillis, BooleanSupplier release) {
        var result = new CompletableFuture<Boolean>();
        runOnLoop(() -> {
            boolean idle = broadcaster.subscriberCount() == 0 && broadcaster.idleMillis() >= graceMillis;
            if (idle && release.getAsBoolean()) {
                close();
                result.complete(true);
            } else {
                result.complete(false);
            }
        }).whenComplete((ignored, error) -> result.complete(false));
        return result;
    }

    /** 在处理循环上执行一个空任务，用于等待之前投递的任务全部完成。 */
    CompletableFuture<Void> sync() {
        return runOnLoop(() -> {});
    }

    BreakpointRegistry breakpoints() {
        return breakpoints;
    }

    VarObjectTree varObjects() {
        return varObjects;
    }

    /**
     * 在处理循环上执行任务。会话关闭后提交的任务，以及关闭前已排队但尚未执行的任务，都以异常结束。
     */
    private CompletableFuture<Void> runOnLoop(Runnable task) {
        Runnable guardedTask = guarded(task);
        try {
            return CompletableFuture.runAsync(() -> {
                if (closed) {
                    throw closedException();
                }
                guardedTask.run();
            }, loop);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(closedException());
        }
    }

    private DebugSessionException closedException() {
        return new DebugSessionException(null, "调试会话 " + id + " 已关闭");
    }

    private void execute(Runnable task) {
        try {
            loop.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            log.debug("会话 {} 已关闭，丢弃任务。", id);
        }
    }

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("会话 {} 的处理循环中发生未预期的异常", id, e);
                reportError("内部错误: " + e.getMessage());
            }
        };
    }

    // ---------------------------------------------------------------- 客户端操作

    private void dispatch(DebugAction action, String channelId) {
        String name = action.action() == null ? "" : action.action();
        log.info("会话 {} 收到操作: {} {}", id, name, action.args());
        try {
            switch (name) {
                case "init" -> init(action);
                case "run" -> run(action);
                case "continue" -> resume(action, "-exec-continue");
                case "next" -> resume(action, "-exec-next");
                case "step" -> resume(action, "-exec-step");
                case "finish" -> resume(action, "-exec-finish");
                case "interrupt" -> interrupt();
                case "stop" -> stop();
                case "discard" -> discard();
                case "break" -> toggleBreakpoint(action);
                case "remove_breakpoint" -> removeBreakpoint(action);
                case "var_create" -> createVarObject(action);
                case "var_list_children" -> listVarChildren(action);
                case "var_collapse" -> varObjects.collapse(action.requireString("expression"));
                case "read_memory" -> readMemory(action);
                case "get_context" -> broadcaster.broadcast(WsDebugEvent.stateUpdate(lastSnapshot));
                default -> throw new DebugSessionException(name, "未知的调试操作: " + name);
            }
        } catch (DebugSessionException e) {
            log.warn("会话 {} 拒绝了操作 {}: {}", id, e.getAction() != null ? e.getAction() : name, e.getMessage());
            if (channelId != null && broadcaster.isSubscribed(channelId)) {
                broadcaster.sendTo(channelId, WsDebugEvent.error(e.getMessage()));
            } else {
                broadcaster.broadcast(WsDebugEvent.error(e.getMessage()));
            }
        }
    }

    private void init(DebugAction action) {
        requireStatus("init", status.canLaunch());
        String path = action.requireString("executable");
        // 新进程启动成功后才终止旧进程，启动失败时会话保持原状
        long epoch = processEpoch + 1;
        DebuggerProcess launched;
        try {
            launched = processFactory.launch(path, listenerFor(epoch));
        } catch (IOException e) {
            appendLog(LogEntry.ERROR, "启动调试器失败: " + e.getMessage());
            throw new DebugSessionException("init", "启动调试器失败: " + e.getMessage(), e);
        }
        terminateProcess();
        process = launched;
        liveProcess = launched;
        executable = path;
        varObjects.reset();
        memory.invalidate();
        clearContext();
        status = DebugStatus.READY;
        breakpoints.deferAll();
        for (BreakpointEntry entry : breakpoints.entries()) {
            insertBreakpoint(entry);
        }
        appendLog(LogEntry.INFO, "[Init] 已加载 " + path);
        broadcastState();
    }

    private void run(DebugAction action) {
        requireStatus("run", status.canLaunch());
        requireProcess("run");
        MiCommand command = MiCommand.of("-exec-run");
        if (action.booleanArg("stop_at_entry", false)) {
            command.option("--start");
        }
        startExecution("run", command);
    }

    private void resume(DebugAction action, String operation) {
        requireStatus(action.action(), status == DebugStatus.PAUSED);
        startExecution(action.action(), MiCommand.of(operation));
    }

    private void interrupt() {
        requireStatus("interrupt", status == DebugStatus.RUNNING);
        send("interrupt", MiCommand.of("-exec-interrupt"), result -> {
            if (result.isError()) {
                reportError(result.errorMessage());
            }
        });
    }

    private void stop() {
        terminateProcess();
        varObjects.reset();
        memory.invalidate();
        clearContext();
        breakpoints.deferAll();
        status = DebugStatus.READY;
        appendLog(LogEntry.INFO, "[Stopped] 调试器已停止");
        broadcastState();
    }

    private void discard() {
        stop();
        discardHandler.accept(this);
    }

    /**
     * 发出一条执行类命令。命令被接受后立即进入 Running 并广播一次；
     * gdb 随后发出的 *running 不会再次广播。命令被拒绝时恢复到之前的状态。
     */
    private void startExecution(String actionName, MiCommand command) {
        DebugStatus previous = status;
        long token = send(actionName, command, result -> onExecutionResult(result, previous));
        activeExecToken = token;
        enterRunning();
    }

    private void onExecutionResult(MiRecord.Result result, DebugStatus previous) {
        if (!result.isError()) {
            return;
        }
        reportError(result.errorMessage());
        if (result.token() == activeExecToken && status == DebugStatus.RUNNING) {
            activeExecToken = 0;
            status = previous;
            if (previous.isInspectable()) {
                stopGeneration++;
                fetchContext();
            } else {
                broadcastState();
            }
        }
    }

    // ---------------------------------------------------------------- 断点

    private void toggleBreakpoint(DebugAction action) {
        BreakpointLocation requested = BreakpointLocation.parse(action.requireString("location"));
        BreakpointRegistry.Toggle toggle = breakpoints.toggle(requested);
        BreakpointEntry entry = toggle.entry();
        switch (toggle.outcome()) {
            case PENDING_CONFLICT -> throw new DebugSessionException(
                    "break", "断点 " + requested.toMiLocation() + " 正在等待调试器确认，请稍后再试");
            case REMOVED -> {
                deleteInDebugger(entry.getId());
                appendLog(LogEntry.INFO, "已移除断点 " + requested.toMiLocation());
            }
            case ADDED -> {
                if (hasLiveProcess()) {
                    insertBreakpoint(entry);
                } else {
                    appendLog(LogEntry.INFO, "断点 " + requested.toMiLocation() + " 将在调试器启动后设置");
                }
            }
        }
    }

    private void removeBreakpoint(DebugAction action) {
        String breakpointId = action.requireString("id");
        BreakpointEntry entry = breakpoints.findById(breakpointId)
                .orElseThrow(() -> new DebugSessionException("remove_breakpoint", "断点不存在: " + breakpointId));
        breakpoints.remove(entry);
        deleteInDebugger(breakpointId);
        appendLog(LogEntry.INFO, "已移除断点 " + breakpointId);
    }

    private void insertBreakpoint(BreakpointEntry entry) {
        long token = send(
                "break",
                MiCommand.of("-break-insert").parameter(entry.getRequested().toMiLocation()),
                this::onBreakpointInserted);
        breakpoints.markPending(entry, token);
        timeoutScheduler.schedule(
                () -> execute(() -> onBreakpointTimeout(token)), settings.getCommandTimeoutMs(), TimeUnit.MILLISECONDS);
    }

    private void onBreakpointInserted(MiRecord.Result result) {
        Optional<BreakpointEntry> entry = breakpoints.findPending(result.token());
        MiBreakpoint confirmed = result.isError() ? null : MiPayloads.breakpoint(result.results().getTuple("bkpt"));
        if (entry.isEmpty()) {
            // 已被移除或已超时；gdb 中刚创建的断点不再需要
            if (confirmed != null && confirmed.number() != null
                    && breakpoints.findById(confirmed.number()).isEmpty()) {
                deleteInDebugger(confirmed.number());
            }
            return;
        }
        if (confirmed == null || confirmed.number() == null) {
            breakpoints.remove(entry.get());
            String message = result.isError() ? result.errorMessage() : "调试器未返回断点编号";
            reportError("设置断点 " + entry.get().getRequested().toMiLocation() + " 失败: " + message);
            return;
        }
        confirmBreakpoint(entry.get(), confirmed);
    }

    private void confirmBreakpoint(BreakpointEntry entry, MiBreakpoint confirmed) {
        Optional<BreakpointEntry> duplicate =
                breakpoints.confirm(entry, confirmed.number(), confirmed.file(), confirmed.line());
        if (duplicate.isPresent()) {
            breakpoints.remove(entry);
            deleteInDebugger(confirmed.number());
            log.debug("断点 {} 与已有断点 {} 位置相同，已删除。", confirmed.number(), duplicate.get().getId());
            return;
        }
        broadcaster.broadcast(WsDebugEvent.breakpointCreated(entry.toInfo()));
        appendLog(LogEntry.INFO, "断点 " + entry.getId() + " 已设置于 " + entry.getFile() + ":" + entry.getLine());
    }

    private void onBreakpointTimeout(long token) {
        breakpoints.findPending(token).ifPresent(entry -> {
            breakpoints.remove(entry);
            reportError("设置断点 " + entry.getRequested().toMiLocation() + " 超时");
        });
    }

    private void deleteInDebugger(String breakpointId) {
        if (breakpointId == null || !hasLiveProcess()) {
            return;
        }
        send("remove_breakpoint", MiCommand.of("-break-delete").parameter(breakpointId), result -> {
            if (result.isError()) {
                log.warn("会话 {} 删除断点 {} 失败: {}", id, breakpointId, result.errorMessage());
            }
        });
    }

    private void onBreakpointNotified(MiTuple results) {
        MiBreakpoint notified = MiPayloads.breakpoint(results.getTuple("bkpt"));
        if (notified.number() == null || notified.temporary()
                || breakpoints.findById(notified.number()).isPresent()) {
            return;
        }
        Optional<BreakpointEntry> pendingMatch = breakpoints.entries().stream()
                .filter(BreakpointEntry::isPending)
                .filter(entry -> entry.getRequested().toMiLocation().equals(notified.originalLocation())
                        || (notified.file() != null
                                && entry.matches(BreakpointLocation.ofSourceLine(notified.file(), notified.line()))))
                .findFirst();
        if (pendingMatch.isPresent()) {
            confirmBreakpoint(pendingMatch.get(), notified);
            return;
        }
        // 通过控制台等其他途径创建的断点
        breakpoints.adopt(notified.number(), notified.file(), notified.line(), notified.originalLocation())
                .ifPresent(entry -> broadcaster.broadcast(WsDebugEvent.breakpointCreated(entry.toInfo())));
    }

    private void onBreakpointModified(MiTuple results) {
        MiBreakpoint modified = MiPayloads.breakpoint(results.getTuple("bkpt"));
        if (modified.number() == null || modified.file() == null) {
            return;
        }
        breakpoints.findById(modified.number())
                .ifPresent(entry -> breakpoints.confirm(entry, modified.number(), modified.file(), modified.line()));
    }

    // ---------------------------------------------------------------- 变量对象

    private void createVarObject(DebugAction action) {
        String expression = action.requireString("expression");
        requireInspectable("var_create");
        Optional<VarObjectTree.Node> existing = varObjects.findRoot(expression);
        if (existing.isPresent()) {
            VarObjectTree.Node node = existing.get();
            varObjects.markExpanded(expression);
            broadcaster.broadcast(WsDebugEvent.varCreated(node.info()));
            if (node.children().isPresent()) {
                broadcaster.broadcast(WsDebugEvent.varChildren(
                        new VarChildrenData(node.handle(), expression, node.children().get())));
            } else if (node.info().numchild() > 0) {
                listChildren(node);
            }
            return;
        }
        if (varObjects.isCreatePending(expression)) {
            log.debug("会话 {} 中表达式 {} 的变量对象正在创建", id, expression);
            return;
        }
        long token = send(
                "var_create",
                MiCommand.of("-var-create").literal("-").literal("*").parameter(expression),
                this::onVarCreated);
        varObjects.trackCreate(token, expression);
    }

    private void onVarCreated(MiRecord.Result result) {
        Optional<VarObjectTree.PendingExpansion> request = varObjects.takeCreate(result.token());
        if (request.isEmpty()) {
            if (!result.isError()) {
                varObjects.markStale(result.results().optString("name"));
            }
            log.debug("丢弃过期的 -var-create 回复 (令牌 {})", result.token());
            return;
        }
        if (result.isError()) {
            reportError("无法创建变量对象 " + request.get().expression() + ": " + result.errorMessage());
            return;
        }
        VarObjectInfo info = MiPayloads.varObject(request.get().expression(), result.results());
        VarObjectTree.Node node = varObjects.addRoot(info);
        broadcaster.broadcast(WsDebugEvent.varCreated(info));
        if (info.numchild() > 0) {
            listChildren(node);
        }
    }

    private void listVarChildren(DebugAction action) {
        String handle = action.requireString("name");
        requireInspectable("var_list_children");
        VarObjectTree.Node node = varObjects.findByHandle(handle)
                .orElseThrow(() -> new DebugSessionException(
                        "var_list_children", "变量对象句柄无效或已过期: " + handle));
        varObjects.markExpanded(node.expression());
        if (node.children().isPresent()) {
            broadcaster.broadcast(WsDebugEvent.varChildren(
                    new VarChildrenData(handle, node.expression(), node.children().get())));
            return;
        }
        listChildren(node);
    }

    private void listChildren(VarObjectTree.Node node) {
        long token = send(
                "var_list_children",
                MiCommand.of("-var-list-children").option("--all-values").parameter(node.handle()),
                this::onVarChildren);
        varObjects.trackChildren(token, node);
    }

    private void onVarChildren(MiRecord.Result result) {
        Optional<VarObjectTree.PendingExpansion> request = varObjects.takeChildren(result.token());
        if (request.isEmpty()) {
            log.debug("丢弃过期的 -var-list-children 回复 (令牌 {})", result.token());
            return;
        }
        if (result.isError()) {
            reportError("无法展开变量对象 " + request.get().handle() + ": " + result.errorMessage());
            return;
        }
        List<VarObjectInfo> children = MiPayloads.children(result.results());
        varObjects.setChildren(request.get().handle(), children);
        broadcaster.broadcast(WsDebugEvent.varChildren(
                new VarChildrenData(request.get().handle(), request.get().expression(), children)));
    }

    private void deleteStaleVarObjects() {
        for (String handle : varObjects.drainStaleRoots()) {
            send("var_delete", MiCommand.of("-var-delete").parameter(handle), result -> {
                if (result.isError()) {
                    log.debug("删除过期变量对象 {} 失败: {}", handle, result.errorMessage());
                }
            });
        }
    }

    // ---------------------------------------------------------------- 内存

    private void readMemory(DebugAction action) {
        String address = action.requireString("address");
        int count = action.intArg("count", settings.getDefaultMemoryReadCount());
        MemoryReader.validate(address, count, settings.getMaxMemoryReadCount());
        requireInspectable("read_memory");
        long requestId = memory.begin();
        send(
                "read_memory",
                MiCommand.of("-data-read-memory-bytes").parameter(address).literal(count),
                result -> onMemoryRead(requestId, address, result));
    }

    private void onMemoryRead(long requestId, String address, MiRecord.Result result) {
        if (!memory.isCurrent(requestId)) {
            log.debug("丢弃过期的内存读取回复 (请求 {})", requestId);
            return;
        }
        if (result.isError()) {
            reportError("读取内存 " + address + " 失败: " + result.errorMessage());
            return;
        }
        MemoryBlock block;
        try {
            block = MiPayloads.memory(result.results());
        } catch (IllegalArgumentException e) {
            reportError("读取内存 " + address + " 失败: 无法解析调试器返回的内容");
            return;
        }
        if (block == null) {
            reportError("读取内存 " + address + " 失败: 调试器未返回任何内容");
            return;
        }
        if (memory.accept(requestId, block)) {
            broadcaster.broadcast(WsDebugEvent.memoryRead(MemoryContents.of(block)));
        }
    }

    // ---------------------------------------------------------------- gdb 输出

    private DebuggerOutputListener listenerFor(long epoch) {
        return new DebuggerOutputListener() {
            @Override
            public void onLine(String line) {
                execute(() -> {
                    if (epoch == processEpoch) {
                        processLine(line);
                    }
                });
            }

            @Override
            public void onExit(int exitCode) {
                execute(() -> {
                    if (epoch == processEpoch) {
                        onProcessExit(exitCode);
                    }
                });
            }
        };
    }

    private void processLine(String line) {
        if (line.isBlank()) {
            return;
        }
        log.debug("GDB [{}]: {}", id, line);
        for (MiRecord record : parser.decodeAll(line)) {
            dispatchRecord(record);
        }
    }

    private void dispatchRecord(MiRecord record) {
        if (record instanceof MiRecord.Result result) {
            onResult(result);
        } else if (record instanceof MiRecord.ExecAsync exec) {
            onExecAsync(exec);
        } else if (record instanceof MiRecord.NotifyAsync notify) {
            onNotify(notify);
        } else if (record instanceof MiRecord.Stream stream) {
            onStream(stream);
        } else if (record instanceof MiRecord.StatusAsync statusAsync) {
            log.debug("会话 {} 状态记录: {}", id, statusAsync.asyncClass());
        }
    }

    private void onResult(MiRecord.Result result) {
        if (result.token() == null) {
            if (result.isError()) {
                reportError(result.errorMessage());
            }
            return;
        }
        Optional<Consumer<MiRecord.Result>> handler = pending.complete(result.token());
        if (handler.isEmpty()) {
            log.debug("令牌 {} 没有对应的请求，丢弃回复。", result.token());
            return;
        }
        try {
            handler.get().accept(result);
        } catch (DebugSessionException e) {
            reportError(e.getMessage());
        }
    }

    private void onExecAsync(MiRecord.ExecAsync exec) {
        switch (exec.asyncClass()) {
            case "running" -> {
                if (status != DebugStatus.RUNNING) {
                    enterRunning();
                }
            }
            case "stopped" -> onStopped(exec.results());
            default -> log.debug("会话 {} 忽略执行记录: {}", id, exec.asyncClass());
        }
    }

    private void onNotify(MiRecord.NotifyAsync notify) {
        switch (notify.asyncClass()) {
            case "breakpoint-created" -> onBreakpointNotified(notify.results());
            case "breakpoint-modified" -> onBreakpointModified(notify.results());
            case "breakpoint-deleted" -> breakpoints.removeById(notify.results().optString("id"));
            default -> log.debug("会话 {} 通知: {}", id, notify.asyncClass());
        }
    }

    private void onStream(MiRecord.Stream stream) {
        switch (stream.type()) {
            case LOG -> appendLog(LogEntry.GDB, stream.text().strip());
            default -> broadcaster.broadcast(WsDebugEvent.console(stream.text()));
        }
    }

    private void onStopped(MiTuple results) {
        activeExecToken = 0;
        String reason = results.getString("reason", "");
        if (reason.startsWith("exited")) {
            onExited(reason, results);
            return;
        }
        String signal = results.optString("signal-name");
        boolean fatal = "signal-received".equals(reason) && signal != null && FATAL_SIGNALS.contains(signal);
        status = fatal ? DebugStatus.STOPPED : DebugStatus.PAUSED;
        location = MiPayloads.location(results);
        stopGeneration++;
        String where = location == null ? "" : " 位于 " + location.file() + ":" + location.line();
        if (fatal) {
            appendLog(LogEntry.ERROR, "[Stopped] 程序收到信号 " + signal + where);
        } else {
            appendLog(LogEntry.INFO, "[Paused] " + (reason.isEmpty() ? "stopped" : reason) + where);
        }
        deleteStaleVarObjects();
        fetchContext();
    }

    private void onExited(String reason, MiTuple results) {
        status = DebugStatus.EXITED;
        stopGeneration++;
        contextFetch = null;
        clearContext();
        varObjects.invalidate();
        memory.invalidate();
        String exitCode = results.optString("exit-code");
        appendLog(LogEntry.INFO, "[Exited] " + reason + (exitCode == null ? "" : "，退出码 " + exitCode));
        broadcastState();
    }

    private void onProcessExit(int exitCode) {
        process = null;
        liveProcess = null;
        pending.clear();
        contextFetch = null;
        clearContext();
        varObjects.reset();
        memory.invalidate();
        breakpoints.deferAll();
        status = DebugStatus.EXITED;
        appendLog(LogEntry.ERROR, "调试器进程意外退出，退出码: " + exitCode);
        broadcastState();
    }

    /**
     * 暂停后同时请求调用栈与变量，两者都返回后才广播快照。
     * 某一项失败时按空列表处理；期间如果再次恢复执行，旧的回复会被忽略。
     */
    private void fetchContext() {
        var fetch = new ContextFetch(stopGeneration);
        contextFetch = fetch;
        try {
            send("get_context", MiCommand.of("-stack-list-frames"), result -> {
                fetch.frames = result.isError() ? List.of() : MiPayloads.frames(result.results());
                completeContext(fetch);
            });
            send("get_context", MiCommand.of("-stack-list-variables").option("--simple-values"), result -> {
                fetch.variables = result.isError() ? List.of() : MiPayloads.variables(result.results());
                completeContext(fetch);
            });
        } catch (DebugSessionException e) {
            log.warn("会话 {} 无法获取暂停上下文: {}", id, e.getMessage());
            contextFetch = null;
            broadcastState();
        }
    }

    private void completeContext(ContextFetch fetch) {
        if (contextFetch != fetch || fetch.generation != stopGeneration) {
            return;
        }
        if (fetch.frames == null || fetch.variables == null) {
            return;
        }
        contextFetch = null;
        stack = fetch.frames;
        variables = fetch.variables;
        broadcastState();
    }

    // ---------------------------------------------------------------- 辅助方法

    private void enterRunning() {
        status = DebugStatus.RUNNING;
        stopGeneration++;
        contextFetch = null;
        clearContext();
        varObjects.invalidate();
        memory.invalidate();
        broadcastState();
    }

    private long send(String actionName, MiCommand command, Consumer<MiRecord.Result> handler) {
        DebuggerProcess current = requireProcess(actionName);
        long token = pending.nextToken();
        pending.register(token, handler);
        try {
            current.write(command.encode(token));
        } catch (IOException e) {
            pending.cancel(token);
            throw new DebugSessionException(
                    actionName, "向调试器发送命令 " + command.operation() + " 失败: " + e.getMessage(), e);
        }
        return token;
    }

    private void terminateProcess() {
        processEpoch++;
        DebuggerProcess current = process;
        process = null;
        liveProcess = null;
        pending.clear();
        contextFetch = null;
        activeExecToken = 0;
        if (current != null) {
            current.destroy();
            log.info("会话 {} 的调试器进程 (PID {}) 已终止。", id, current.pid());
        }
    }

    private void clearContext() {
        location = null;
        stack = List.of();
        variables = List.of();
    }

    private boolean hasLiveProcess() {
        return process != null && process.isAlive();
    }

    private DebuggerProcess requireProcess(String actionName) {
        if (!hasLiveProcess()) {
            throw new DebugSessionException(actionName, "调试器尚未启动，请先执行 init");
        }
        return process;
    }

    private void requireStatus(String actionName, boolean allowed) {
        if (!allowed) {
            throw new DebugSessionException(actionName, "当前状态 " + status.wireName() + " 下不能执行 " + actionName);
        }
    }

    private void requireInspectable(String actionName) {
        if (!hasLiveProcess() || !status.isInspectable()) {
            throw new DebugSessionException(
                    actionName, "程序未处于暂停状态 (当前状态 " + status.wireName() + ")，无法执行 " + actionName);
        }
    }

    private void broadcastState() {
        lastSnapshot = new StateSnapshot(status, location, stack, variables);
        broadcaster.broadcast(WsDebugEvent.stateUpdate(lastSnapshot));
    }

    private void reportError(String message) {
        appendLog(LogEntry.ERROR, "GDB Error: " + message);
        broadcaster.broadcast(WsDebugEvent.error(message));
    }

    private void appendLog(String level, String text) {
        var entry = new LogEntry(level, text, Instant.now(clock).toString());
        synchronized (logHistory) {
            logHistory.addLast(entry);
            while (logHistory.size() > Math.max(1, settings.getLogHistorySize())) {
                logHistory.removeFirst();
            }
        }
        broadcaster.broadcast(WsDebugEvent.logEvent(entry));
    }

    private static final class ContextFetch {
        private final long generation;
        private List<StackFrameInfo> frames;
        private List<VariableInfo> variables;

        ContextFetch(long generation) {
            this.generation = generation;
        }
    }
}
