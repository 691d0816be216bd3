package club.ppmc.debugger.session;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import club.ppmc.debugger.model.Settings;
import club.ppmc.debugger.model.debug.BreakpointInfo;
import club.ppmc.debugger.model.debug.DebugAction;
import club.ppmc.debugger.model.debug.DebugStatus;
import club.ppmc.debugger.model.debug.LogEntry;
import club.ppmc.debugger.model.debug.MemoryContents;
import club.ppmc.debugger.model.debug.StateSnapshot;
import club.ppmc.debugger.model.debug.VarChildrenData;
import club.ppmc.debugger.model.debug.VarObjectInfo;
import club.ppmc.debugger.model.debug.WsDebugEvent;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DebugSessionTest {

    private static final String STOPPED_AT_MAIN = mi("*stopped,reason='breakpoint-hit',disp='del',bkptno='1',"
            + "frame={addr='0x0000555555555149',func='main',args=[],file='demo.c',fullname='/src/demo.c',line='5',"
            + "arch='i386:x86-64'},thread-id='1',stopped-threads='all',core='0'");

    private final Settings settings = new Settings();
    private final FakeProcessFactory factory = new FakeProcessFactory();
    private final List<DebugSession> discarded = new CopyOnWriteArrayList<>();
    private ScheduledExecutorService scheduler;
    private DebugSession session;
    private RecordingChannel channel;

    @BeforeEach
    void setUp() throws Exception {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
        session = new DebugSession(
                "s1",
                settings,
                factory,
                scheduler,
                new EventBroadcaster("s1", Runnable::run, 1000, clock),
                clock,
                discarded::add);
        channel = new RecordingChannel("c1");
        await(session.attach(channel));
    }

    @AfterEach
    void tearDown() throws Exception {
        await(session.close());
        scheduler.shutdownNow();
    }

    // ------------------------------------------------------------ 执行控制

    @Test
    void runWithStopAtEntryPausesWithStackAndBroadcastsTwice() throws Exception {
        FakeDebuggerProcess gdb = init();
        channel.clear();

        pauseAtMain(gdb);

        assertThat(gdb.lastCommand("-exec-run"), endsWith("-exec-run --start"));
        List<StateSnapshot> states = channel.states();
        assertThat(states, hasSize(2));
        assertEquals(DebugStatus.RUNNING, states.get(0).status());
        StateSnapshot paused = states.get(1);
        assertEquals(DebugStatus.PAUSED, paused.status());
        assertThat(paused.stack(), not(empty()));
        assertEquals("main", paused.stack().get(0).function());
        assertEquals("/src/demo.c", paused.location().file());
        assertEquals(5, paused.location().line());
        assertThat(paused.variables(), hasSize(2));
        assertEquals("{...}", paused.variables().get(1).value());
        assertEquals(paused, session.snapshot());
    }

    @Test
    void secondNextWhileRunningIsRejected() throws Exception {
        FakeDebuggerProcess gdb = init();
        pauseAtMain(gdb);
        channel.clear();

        act("next");
        act("next");
        gdb.emit(gdb.tokenOf("-exec-next") + "^running", mi("*running,thread-id='all'"));
        settle();

        assertEquals(1, gdb.count("-exec-next"));
        assertThat(channel.errors(), hasSize(1));
        assertThat(channel.states(), hasSize(1));
        assertEquals(DebugStatus.RUNNING, session.status());
    }

    @Test
    void getContextBroadcastsCachedSnapshotWithoutCommands() throws Exception {
        FakeDebuggerProcess gdb = init();
        pauseAtMain(gdb);
        StateSnapshot before = session.snapshot();
        int written = gdb.written().size();
        channel.clear();

        act("get_context");

        assertEquals(written, gdb.written().size());
        assertThat(channel.states(), contains(before));
        assertEquals(before, session.snapshot());
    }

    @Test
    void rejectedExecutionCommandRestoresPausedState() throws Exception {
        FakeDebuggerProcess gdb = init();
        pauseAtMain(gdb);
        channel.clear();

        act("next");
        gdb.emit(gdb.tokenOf("-exec-next") + mi("^error,msg='Cannot find bounds of current function'"));
        settle();
        answerContext(gdb);

        assertThat(channel.errors(), contains("Cannot find bounds of current function"));
        List<StateSnapshot> states = channel.states();
        assertThat(states, hasSize(2));
        assertEquals(DebugStatus.RUNNING, states.get(0).status());
        assertEquals(DebugStatus.PAUSED, states.get(1).status());
        assertThat(states.get(1).stack(), not(empty()));
    }

    @Test
    void fatalSignalStopsProgramAndAllowsRerun() throws Exception {
        FakeDebuggerProcess gdb = init();
        pauseAtMain(gdb);

        act("continue");
        gdb.emit(mi("*stopped,reason='signal-received',signal-name='SIGSEGV',signal-meaning='Segmentation fault',"
                + "frame={addr='0x0000555555555160',func='crash',args=[],file='crash.c',fullname='/src/crash.c',"
                + "line='12'},thread-id='1',stopped-threads='all'"));
        settle();
        answerContext(gdb);

        assertEquals(DebugStatus.STOPPED, session.status());
        assertEquals(12, session.snapshot().location().line());
        assertThat(logTexts(LogEntry.ERROR), hasItem(containsString("SIGSEGV")));

        act("run");
        assertEquals(2, gdb.count("-exec-run"));
        assertEquals(DebugStatus.RUNNING, session.status());
    }

    @Test
    void programExitBroadcastsExitedOnce() throws Exception {
        FakeDebuggerProcess gdb = init();
        pauseAtMain(gdb);
        channel.clear();

        act("continue");
        gdb.emit(gdb.tokenOf("-exec-continue") + "^running",
                mi("*running,thread-id='all'"),
                mi("*stopped,reason='exited-normally'"));
        settle();

        List<StateSnapshot> states = channel.states();
        assertThat(states, hasSize(2));
        StateSnapshot exited = states.get(1);
        assertEquals(DebugStatus.EXITED, exited.status());
        assertThat(exited.stack(), is(empty()));
        assertNull(exited.location());
    }

    @Test
    void programOutputWithoutNewlineDoesNotHideExit() throws Exception {
        FakeDebuggerProcess gdb = init();
        channel.clear();

        act("run");
        gdb.emit(gdb.tokenOf("-exec-run") + "^running", mi("Result: 0*stopped,reason='exited-normally'"));
        settle();

        assertEquals(DebugStatus.EXITED, session.status());
        assertThat(payloads(WsDebugEvent.CONSOLE), contains("Result: 0"));
    }

    @Test
    void programOutputBeforeSignalStopIsShownAndStopIsApplied() throws Exception {
        FakeDebuggerProcess gdb = init();
        act("run");
        gdb.emit(gdb.tokenOf("-exec-run") + "^running");
        settle();
        channel.clear();

        gdb.emit(mi("About to dereference NULL pointer...*stopped,reason='signal-received',signal-name='SIGSEGV',"
                + "signal-meaning='Segmentation fault',frame={addr='0x1149',func='crash',args=[],file='crash_test.c',"
                + "fullname='/src/crash_test.c',line='9'},thread-id='1',stopped-threads='all'"));
        settle();
        answerContext(gdb);

        assertEquals(DebugStatus.STOPPED, session.status());
        assertThat(payloads(WsDebugEvent.CONSOLE), contains("About to dereference NULL pointer..."));
    }

    @Test
    void interruptRequiresRunningProgram() throws Exception {
        FakeDebuggerProcess gdb = init();
        pauseAtMain(gdb);

        act("interrupt");
        assertEquals(0, gdb.count("-exec-interrupt"));
        assertThat(channel.errors(), hasSize(1));

        act("continue");
        act("interrupt");
        assertEquals(1, gdb.count("-exec-interrupt"));
    }

    @Test
    void runningNotificationFromConsoleIsBroadcastOnce() throws Exception {
        FakeDebuggerProcess gdb = init();
        channel.clear();

        gdb.emit(mi("*running,thread-id='all'"), mi("*running,thread-id='1'"));
        settle();

        assertThat(channel.states(), hasSize(1));
        assertEquals(DebugStatus.RUNNING, session.status());
    }

    @Test
    void stopTerminatesDebuggerAndReturnsToReady() throws Exception {
        FakeDebuggerProcess gdb = init();
        pauseAtMain(gdb);

        act("stop");

        assertTrue(gdb.isDestroyed());
        assertEquals(DebugStatus.READY, session.status());
        channel.clear();
        act("next");
        assertThat(channel.errors(), hasSize(1));
    }

    @Test
    void discardStopsAndHandsSessionToRegistry() throws Exception {
        FakeDebuggerProcess gdb = init();

        act("discard");

        assertTrue(gdb.isDestroyed());
        assertThat(discarded, contains(session));
    }

    @Test
    void unknownActionIsReportedToCaller() throws Exception {
        act("explode");

        assertThat(channel.errors(), contains(containsString("explode")));
    }

    @Test
    void failedLaunchLeavesStatusUnchanged() throws Exception {
        factory.failWith(new IOException("找不到可执行文件: /nope"));
        channel.clear();

        act("init", Map.of("executable", "/nope"));

        assertEquals(0, factory.launchCount());
        assertThat(channel.errors(), contains(containsString("/nope")));
        assertEquals(DebugStatus.READY, session.status());
        assertThat(channel.states(), is(empty()));
    }

    @Test
    void failedRelaunchKeepsPreviousDebuggerAndBreakpoints() throws Exception {
        FakeDebuggerProcess gdb = init();
        act("break", Map.of("location", "demo.c:7"));
        confirmBreakpoint(gdb, "1", "demo.c", 7);
        act("run");
        gdb.emit(gdb.tokenOf("-exec-run") + "^running", mi("*stopped,reason='exited-normally'"));
        settle();
        assertEquals(DebugStatus.EXITED, session.status());

        factory.failWith(new IOException("没有读取可执行文件的权限: /tmp/other"));
        channel.clear();
        act("init", Map.of("executable", "/tmp/other"));

        assertThat(channel.errors(), hasSize(1));
        assertThat(channel.states(), is(empty()));
        assertEquals(DebugStatus.EXITED, session.status());
        assertFalse(gdb.isDestroyed());
        assertEquals("/tmp/demo", session.executable());
        assertEquals(List.of(new BreakpointInfo("1", "/src/demo.c", 7)), session.breakpoints().live());

        act("run");
        assertEquals(2, gdb.count("-exec-run"));
    }

    @Test
    void unexpectedDebuggerExitMarksSessionExitedAndDefersBreakpoints() throws Exception {
        FakeDebuggerProcess gdb = init();
        act("break", Map.of("location", "demo.c:7"));
        confirmBreakpoint(gdb, "1", "demo.c", 7);

        gdb.exit(1);
        settle();

        assertEquals(DebugStatus.EXITED, session.status());
        assertThat(logTexts(LogEntry.ERROR), hasItem(containsString("退出码: 1")));
        assertThat(session.breakpoints().live(), is(empty()));
        assertEquals(1, session.breakpoints().size());

        FakeDebuggerProcess second = init();
        assertThat(second.lastCommand("-break-insert"), endsWith("\"demo.c:7\""));
    }

    // ------------------------------------------------------------ 断点

    @Test
    void breakpointSetBeforeInitIsReplayedAndConfirmed() throws Exception {
        act("break", Map.of("location", "main.c:10"));
        assertEquals(0, factory.launchCount());

        FakeDebuggerProcess gdb = init();
        assertThat(gdb.lastCommand("-break-insert"), endsWith("-break-insert \"main.c:10\""));
        confirmBreakpoint(gdb, "1", "main.c", 10);

        assertEquals(List.of(new BreakpointInfo("1", "/src/main.c", 10)), payloads(WsDebugEvent.BREAKPOINT_CREATED));
    }

    @Test
    void togglingSameBreakpointTwiceNetsZero() throws Exception {
        FakeDebuggerProcess gdb = init();

        act("break", Map.of("location", "demo.c:7"));
        confirmBreakpoint(gdb, "1", "demo.c", 7);
        act("break", Map.of("location", "demo.c:7"));

        assertThat(gdb.lastCommand("-break-delete"), endsWith("-break-delete \"1\""));
        assertEquals(0, session.breakpoints().size());
        assertThat(payloads(WsDebugEvent.BREAKPOINT_CREATED), hasSize(1));
    }

    @Test
    void toggleWhileInsertIsPendingIsRejected() throws Exception {
        FakeDebuggerProcess gdb = init();
        channel.clear();

        act("break", Map.of("location", "demo.c:7"));
        act("break", Map.of("location", "demo.c:7"));

        assertEquals(1, gdb.count("-break-insert"));
        assertThat(channel.errors(), hasSize(1));
        assertEquals(1, session.breakpoints().size());
    }

    @Test
    void removeBreakpointById() throws Exception {
        FakeDebuggerProcess gdb = init();
        act("break", Map.of("location", "demo.c:7"));
        confirmBreakpoint(gdb, "1", "demo.c", 7);

        act("remove_breakpoint", Map.of("id", "1"));
        act("remove_breakpoint", Map.of("id", "1"));

        assertEquals(1, gdb.count("-break-delete"));
        assertThat(channel.errors(), hasSize(1));
        assertEquals(0, session.breakpoints().size());
    }

    @Test
    void rejectedInsertDropsBreakpoint() throws Exception {
        FakeDebuggerProcess gdb = init();

        act("break", Map.of("location", "nosuch.c:3"));
        gdb.emit(gdb.tokenOf("-break-insert") + mi("^error,msg='No source file named nosuch.c.'"));
        settle();

        assertEquals(0, session.breakpoints().size());
        assertThat(channel.errors(), contains(containsString("No source file named nosuch.c.")));
    }

    @Test
    void insertTimeoutDropsBreakpointAndLateReplyIsDeleted() throws Exception {
        settings.setCommandTimeoutMs(20);
        FakeDebuggerProcess gdb = init();

        act("break", Map.of("location", "demo.c:7"));
        long token = gdb.tokenOf("-break-insert");
        Thread.sleep(300);
        settle();

        assertEquals(0, session.breakpoints().size());
        assertThat(channel.errors(), hasItem(containsString("超时")));

        gdb.emit(token + bkpt("1", "demo.c", 7));
        settle();
        assertThat(gdb.lastCommand("-break-delete"), endsWith("\"1\""));
        assertThat(payloads(WsDebugEvent.BREAKPOINT_CREATED), is(empty()));
    }

    @Test
    void notificationBeforeResultConfirmsBreakpointOnce() throws Exception {
        FakeDebuggerProcess gdb = init();

        act("break", Map.of("location", "demo.c:7"));
        long token = gdb.tokenOf("-break-insert");
        gdb.emit("=breakpoint-created" + bkpt("1", "demo.c", 7).substring("^done".length()));
        gdb.emit(token + bkpt("1", "demo.c", 7));
        settle();

        assertThat(payloads(WsDebugEvent.BREAKPOINT_CREATED), hasSize(1));
        assertEquals(0, gdb.count("-break-delete"));
    }

    @Test
    void breakpointsCreatedFromConsoleAreAdoptedAndDeleted() throws Exception {
        FakeDebuggerProcess gdb = init();

        gdb.emit(mi("=breakpoint-created,bkpt={number='5',type='breakpoint',disp='keep',enabled='y',"
                + "file='demo.c',fullname='/src/demo.c',line='20',original-location='demo.c:20'}"));
        gdb.emit(mi("=breakpoint-created,bkpt={number='6',type='breakpoint',disp='del',enabled='y',"
                + "file='demo.c',fullname='/src/demo.c',line='3',original-location='-qualified main'}"));
        settle();

        assertEquals(List.of(new BreakpointInfo("5", "/src/demo.c", 20)), payloads(WsDebugEvent.BREAKPOINT_CREATED));
        assertEquals(1, session.breakpoints().size());

        gdb.emit(mi("=breakpoint-deleted,id='5'"));
        settle();
        assertEquals(0, session.breakpoints().size());
    }

    @Test
    void malformedBreakpointLocationIsRejected() throws Exception {
        FakeDebuggerProcess gdb = init();

        act("break", Map.of("location", "-gdb-exit"));

        assertEquals(0, gdb.count("-break-insert"));
        assertThat(channel.errors(), hasSize(1));
    }

    // ------------------------------------------------------------ 变量对象

    @Test
    void varCreateListsChildrenOfAggregate() throws Exception {
        FakeDebuggerProcess gdb = init();
        pauseAtMain(gdb);

        createPointVar(gdb);

        assertEquals(
                List.of(new VarObjectInfo("p", "var1", "{...}", "struct point", 2)),
                payloads(WsDebugEvent.VAR_CREATED));
        VarChildrenData children = (VarChildrenData) payloads(WsDebugEvent.VAR_CHILDREN).get(0);
        assertEquals("var1", children.name());
        assertEquals("p", children.expression());
        assertThat(children.children(), hasSize(2));
        assertEquals("var1.x", children.children().get(0).name());
        assertEquals("1", children.children().get(0).value());
    }

    @Test
    void varCreateOnKnownExpressionResendsCachedTree() throws Exception {
        FakeDebuggerProcess gdb = init();
        pauseAtMain(gdb);
        createPointVar(gdb);
        channel.clear();

        act("var_collapse", Map.of("expression", "p"));
        act("var_create", Map.of("expression", "p"));

        assertEquals(1, gdb.count("-var-create"));
        assertEquals(1, gdb.count("-var-list-children"));
        assertThat(channel.ofType(WsDebugEvent.VAR_CREATED), hasSize(1));
        assertThat(channel.ofType(WsDebugEvent.VAR_CHILDREN), hasSize(1));
    }

    @Test
    void staleHandleIsRejectedAfterResumeAndDeletedAtNextStop() throws Exception {
        FakeDebuggerProcess gdb = init();
        pauseAtMain(gdb);
        createPointVar(gdb);
        channel.clear();

        act("continue");
        act("var_list_children", Map.of("name", "var1"));
        assertThat(channel.errors(), hasSize(1));

        gdb.emit(mi("*stopped,reason='end-stepping-range',frame={addr='0x0000555555555150',func='main',args=[],"
                + "file='demo.c',fullname='/src/demo.c',line='6'},thread-id='1'"));
        settle();
        answerContext(gdb);

        assertThat(gdb.lastCommand("-var-delete"), endsWith("\"var1\""));
        channel.clear();
        act("var_list_children", Map.of("name", "var1"));
        assertThat(channel.errors(), hasSize(1));
    }

    @Test
    void varCreateReplyAfterResumeIsDiscarded() throws Exception {
        FakeDebuggerProcess gdb = init();
        pauseAtMain(gdb);

        act("var_create", Map.of("expression", "p"));
        long token = gdb.tokenOf("-var-create");
        act("continue");
        gdb.emit(token + mi("^done,name='var1',numchild='2',value='{...}',type='struct point',has_more='0'"));
        settle();

        assertThat(channel.ofType(WsDebugEvent.VAR_CREATED), is(empty()));
        assertEquals(0, gdb.count("-var-list-children"));

        gdb.emit(STOPPED_AT_MAIN);
        settle();
        assertThat(gdb.lastCommand("-var-delete"), endsWith("\"var1\""));
    }

    @Test
    void varCreateRequiresPausedProgram() throws Exception {
        FakeDebuggerProcess gdb = init();

        act("var_create", Map.of("expression", "p"));

        assertEquals(0, gdb.count("-var-create"));
        assertThat(channel.errors(), hasSize(1));
    }

    @Test
    void expressionIsSentAsSingleQuotedArgument() throws Exception {
        FakeDebuggerProcess gdb = init();
        pauseAtMain(gdb);

        act("var_create", Map.of("expression", "x\n-gdb-exit"));

        String line = gdb.lastCommand("-var-create");
        assertThat(line, endsWith("-var-create - * \"x\\n-gdb-exit\""));
        assertFalse(gdb.written().stream().anyMatch(l -> l.startsWith("-gdb-exit")));
    }

    // ------------------------------------------------------------ 内存

    @Test
    void readMemoryBeforeProgramStartsIsAnError() throws Exception {
        FakeDebuggerProcess gdb = init();
        channel.clear();

        act("read_memory", Map.of("address", "&count", "count", 16));

        assertEquals(0, gdb.count("-data-read-memory-bytes"));
        assertThat(channel.errors(), hasSize(1));
    }

    @Test
    void readMemoryReturnsHexContents() throws Exception {
        FakeDebuggerProcess gdb = init();
        pauseAtMain(gdb);

        act("read_memory", Map.of("address", "&count", "count", 4));
        assertThat(gdb.lastCommand("-data-read-memory-bytes"), endsWith("-data-read-memory-bytes \"&count\" 4"));
        gdb.emit(gdb.tokenOf("-data-read-memory-bytes")
                + mi("^done,memory=[{begin='0x7ffe0010',offset='0x0000000000000000',end='0x7ffe0014',"
                        + "contents='2a000000'}]"));
        settle();

        assertEquals(List.of(new MemoryContents("0x7ffe0010", "2a000000")), payloads(WsDebugEvent.MEMORY_READ));
    }

    @Test
    void onlyLatestMemoryReadIsDelivered() throws Exception {
        FakeDebuggerProcess gdb = init();
        pauseAtMain(gdb);

        act("read_memory", Map.of("address", "0x1000", "count", 1));
        long first = gdb.tokenOf("-data-read-memory-bytes");
        act("read_memory", Map.of("address", "0x2000", "count", 1));
        long second = gdb.tokenOf("-data-read-memory-bytes");
        gdb.emit(second + mi("^done,memory=[{begin='0x2000',offset='0x0',end='0x2001',contents='bb'}]"));
        gdb.emit(first + mi("^done,memory=[{begin='0x1000',offset='0x0',end='0x1001',contents='aa'}]"));
        settle();

        assertEquals(List.of(new MemoryContents("0x2000", "bb")), payloads(WsDebugEvent.MEMORY_READ));
    }

    @Test
    void oversizedMemoryReadIsRejected() throws Exception {
        FakeDebuggerProcess gdb = init();
        pauseAtMain(gdb);

        act("read_memory", Map.of("address", "&count", "count", settings.getMaxMemoryReadCount() + 1));

        assertEquals(0, gdb.count("-data-read-memory-bytes"));
        assertThat(channel.errors(), hasSize(1));
    }

    @Test
    void memoryCountOutsideIntRangeIsRejected() throws Exception {
        FakeDebuggerProcess gdb = init();
        pauseAtMain(gdb);
        channel.clear();

        act("read_memory", Map.of("address", "&count", "count", 4294967312L));

        assertEquals(0, gdb.count("-data-read-memory-bytes"));
        assertThat(channel.errors(), hasSize(1));
    }

    // ------------------------------------------------------------ 输出与订阅

    @Test
    void streamsAreForwardedAsConsoleAndLogEvents() throws Exception {
        FakeDebuggerProcess gdb = init();
        channel.clear();

        gdb.emit(mi("~'Hello\\n'"), mi("&'warning: no symbols\\n'"), "Starting program: /tmp/demo", "(gdb) ");
        settle();

        assertEquals(List.of("Hello\n", "Starting program: /tmp/demo"), payloads(WsDebugEvent.CONSOLE));
        assertThat(logTexts(LogEntry.GDB), contains("warning: no symbols"));
    }

    @Test
    void attachReplaysSnapshotBreakpointsAndRecentLogsToNewChannelOnly() throws Exception {
        FakeDebuggerProcess gdb = init();
        act("break", Map.of("location", "demo.c:7"));
        confirmBreakpoint(gdb, "1", "demo.c", 7);
        pauseAtMain(gdb);
        int firstChannelEvents = channel.events().size();

        var second = new RecordingChannel("c2");
        await(session.attach(second));

        List<WsDebugEvent<?>> replay = second.events();
        assertEquals(WsDebugEvent.STATE_UPDATE, replay.get(0).type());
        assertEquals(session.snapshot(), replay.get(0).payload());
        assertEquals(WsDebugEvent.BREAKPOINT_CREATED, replay.get(1).type());
        assertThat(second.ofType(WsDebugEvent.LOG_EVENT), not(empty()));
        assertTrue(second.ofType(WsDebugEvent.LOG_EVENT).size() <= settings.getLogReplaySize());
        assertEquals(firstChannelEvents, channel.events().size());

        session.detach("c2");
        act("get_context");
        assertEquals(replay.size(), second.events().size());
    }

    @Test
    void rejectionGoesOnlyToOriginatingChannel() throws Exception {
        var other = new RecordingChannel("c2");
        await(session.attach(other));
        other.clear();

        act("next");

        assertThat(channel.errors(), hasSize(1));
        assertThat(other.errors(), is(empty()));
    }

    @Test
    void closeTerminatesDebuggerAndRejectsFurtherActions() throws Exception {
        FakeDebuggerProcess gdb = init();

        await(session.close());

        assertTrue(gdb.isDestroyed());
        assertTrue(session.isClosed());
        assertTrue(session.submit(DebugAction.of("get_context"), "c1").isCompletedExceptionally());
    }

    @Test
    void attachReplaysExpandedVariablesAndLastMemoryBlock() throws Exception {
        FakeDebuggerProcess gdb = init();
        pauseAtMain(gdb);
        createPointVar(gdb);
        act("read_memory", Map.of("address", "&count", "count", 4));
        gdb.emit(gdb.tokenOf("-data-read-memory-bytes")
                + mi("^done,memory=[{begin='0x7ffe0010',offset='0x0',end='0x7ffe0014',contents='2a000000'}]"));
        settle();

        var second = new RecordingChannel("c2");
        await(session.attach(second));

        assertEquals(List.of(new VarObjectInfo("p", "var1", "{...}", "struct point", 2)),
                second.ofType(WsDebugEvent.VAR_CREATED).stream().map(e -> (Object) e.payload()).toList());
        VarChildrenData children = (VarChildrenData) second.ofType(WsDebugEvent.VAR_CHILDREN).get(0).payload();
        assertEquals("var1", children.name());
        assertThat(children.children(), hasSize(2));
        assertEquals(List.of(new MemoryContents("0x7ffe0010", "2a000000")),
                second.ofType(WsDebugEvent.MEMORY_READ).stream().map(e -> (Object) e.payload()).toList());

        act("var_collapse", Map.of("expression", "p"));
        var third = new RecordingChannel("c3");
        await(session.attach(third));
        assertThat(third.ofType(WsDebugEvent.VAR_CREATED), is(empty()));
    }

    @Test
    void idleCloseIsAbandonedWhenChannelJoinsFirst() throws Exception {
        FakeDebuggerProcess gdb = init();
        session.detach("c1");
        var released = new AtomicBoolean();

        CompletableFuture<Void> rejoin = session.attach(new RecordingChannel("c2"));
        CompletableFuture<Boolean> closed = session.closeIfIdle(0, () -> {
            released.set(true);
            return true;
        });

        await(rejoin);
        assertFalse(closed.get(5, TimeUnit.SECONDS));
        assertFalse(released.get());
        assertFalse(session.isClosed());
        assertFalse(gdb.isDestroyed());
    }

    @Test
    void idleCloseFailsActionsQueuedBehindIt() throws Exception {
        FakeDebuggerProcess gdb = init();
        session.detach("c1");

        CompletableFuture<Boolean> closed = session.closeIfIdle(0, () -> true);
        CompletableFuture<Void> late = session.submit(DebugAction.of("get_context"), "c1");

        assertTrue(closed.get(5, TimeUnit.SECONDS));
        assertThrows(ExecutionException.class, () -> await(late));
        assertTrue(session.isClosed());
        assertTrue(gdb.isDestroyed());
    }

    @Test
    void idleCloseIsAbandonedWhenReleaseRefuses() throws Exception {
        init();
        session.detach("c1");

        assertFalse(session.closeIfIdle(0, () -> false).get(5, TimeUnit.SECONDS));
        assertFalse(session.isClosed());
    }

    // ------------------------------------------------------------ 辅助方法

    private FakeDebuggerProcess init() throws Exception {
        act("init", Map.of("executable", "/tmp/demo"));
        return factory.last();
    }

    private void pauseAtMain(FakeDebuggerProcess gdb) throws Exception {
        act("run", Map.of("stop_at_entry", true));
        gdb.emit(gdb.tokenOf("-exec-run") + "^running", mi("*running,thread-id='all'"), STOPPED_AT_MAIN);
        settle();
        answerContext(gdb);
    }

    private void answerContext(FakeDebuggerProcess gdb) throws Exception {
        long frames = gdb.tokenOf("-stack-list-frames");
        long variables = gdb.tokenOf("-stack-list-variables");
        gdb.emit(
                frames + mi("^done,stack=[frame={level='0',addr='0x0000555555555149',func='main',file='demo.c',"
                        + "fullname='/src/demo.c',line='5',arch='i386:x86-64'}]"),
                variables + mi("^done,variables=[{name='count',type='int',value='0'},"
                        + "{name='p',type='struct point'}]"));
        settle();
    }

    private void createPointVar(FakeDebuggerProcess gdb) throws Exception {
        act("var_create", Map.of("expression", "p"));
        assertThat(gdb.lastCommand("-var-create"), endsWith("-var-create - * \"p\""));
        gdb.emit(gdb.tokenOf("-var-create")
                + mi("^done,name='var1',numchild='2',value='{...}',type='struct point',thread-id='1',has_more='0'"));
        settle();
        assertThat(gdb.lastCommand("-var-list-children"), endsWith("-var-list-children --all-values \"var1\""));
        gdb.emit(gdb.tokenOf("-var-list-children")
                + mi("^done,numchild='2',children=["
                        + "child={name='var1.x',exp='x',numchild='0',value='1',type='int',thread-id='1'},"
                        + "child={name='var1.y',exp='y',numchild='0',value='2',type='int',thread-id='1'}],"
                        + "has_more='0'"));
        settle();
    }

    private void confirmBreakpoint(FakeDebuggerProcess gdb, String number, String file, int line) throws Exception {
        gdb.emit(gdb.tokenOf("-break-insert") + bkpt(number, file, line));
        settle();
    }

    private static String bkpt(String number, String file, int line) {
        return mi("^done,bkpt={number='" + number + "',type='breakpoint',disp='keep',enabled='y',"
                + "addr='0x0000555555555155',func='main',file='" + file + "',fullname='/src/" + file + "',"
                + "line='" + line + "',thread-groups=['i1'],times='0',original-location='" + file + ":" + line + "'}");
    }

    private List<Object> payloads(String type) {
        return channel.ofType(type).stream().map(e -> (Object) e.payload()).toList();
    }

    private List<String> logTexts(String level) {
        return channel.ofType(WsDebugEvent.LOG_EVENT).stream()
                .map(e -> (LogEntry) e.payload())
                .filter(entry -> entry.level().equals(level))
                .map(LogEntry::text)
                .toList();
    }

    private void act(String action) throws Exception {
        await(session.submit(DebugAction.of(action), channel.id()));
    }

    private void act(String action, Map<String, Object> args) throws Exception {
        await(session.submit(DebugAction.of(action, args), channel.id()));
    }

    private void settle() throws Exception {
        await(session.sync());
    }

    private static void await(CompletableFuture<?> future) throws Exception {
        future.get(5, TimeUnit.SECONDS);
    }

    /** 用单引号书写 MI 行，避免测试中大量的转义。 */
    private static String mi(String text) {
        return text.replace('\'', '"');
    }
}
