package club.ppmc.pyshell.shell;

import static org.junit.jupiter.api.Assertions.*;

import club.ppmc.pyshell.codec.CodecRegistry;
import club.ppmc.pyshell.exception.PythonShellException;
import club.ppmc.pyshell.exception.ShellSpawnException;
import club.ppmc.pyshell.model.CodecChoice;
import club.ppmc.pyshell.model.ShellExit;
import club.ppmc.pyshell.model.ShellMode;
import club.ppmc.pyshell.model.ShellOptions;
import club.ppmc.pyshell.model.ShellSignal;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

class PythonShellTest {

    private final CodecRegistry registry = new CodecRegistry(new ObjectMapper());
    private final FakeProcess process = new FakeProcess();
    private final List<List<String>> launchedCommands = new ArrayList<>();

    private final List<Object> messages = new CopyOnWriteArrayList<>();
    private final List<Object> stderrRecords = new CopyOnWriteArrayList<>();
    private final List<PythonShellException> errors = new CopyOnWriteArrayList<>();
    private final AtomicInteger closes = new AtomicInteger();
    private final List<Object[]> callbacks = new CopyOnWriteArrayList<>();

    private PythonShell newShell(ShellOptions.ShellOptionsBuilder options) {
        ProcessLauncher launcher = (command, opts) -> {
            launchedCommands.add(command);
            return process;
        };
        return new PythonShell("script.py", options.lineSeparator("\n").build(), registry, launcher);
    }

    private PythonShell subscribeAll(PythonShell shell) {
        return shell.onMessage(messages::add)
                .onStderr(stderrRecords::add)
                .onError(errors::add)
                .onClose(closes::incrementAndGet);
    }

    private EndCallback recordingCallback() {
        return (error, code, signal) -> callbacks.add(new Object[] {error, code, signal});
    }

    private static ShellExit await(PythonShell shell) throws Exception {
        return shell.completion().get(5, TimeUnit.SECONDS);
    }

    /** 等待会话事件线程上已排队的任务全部执行完毕。 */
    private static void drainEvents(PythonShell shell) throws InterruptedException {
        var latch = new CountDownLatch(1);
        shell.onClose(latch::countDown);
        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }

    @Test
    void buildsCommandFromInterpreterOptionsScriptAndArgs() {
        PythonShell shell = newShell(ShellOptions.builder()
                .interpreterPath("/usr/bin/python3")
                .interpreterOptions(List.of("-u", "-X", "utf8"))
                .scriptFolder("scripts")
                .args(List.of("--flag", "value")));

        String script = Path.of("scripts", "script.py").toString();
        assertEquals(List.of("/usr/bin/python3", "-u", "-X", "utf8", script, "--flag", "value"), launchedCommands.get(0));
        assertEquals(List.of("-u", "-X", "utf8", script, "--flag", "value"), shell.getCommand());
        assertEquals(script, shell.getScriptPath());
        assertEquals(ShellMode.TEXT, shell.getMode());
        process.finish(0);
    }

    @Test
    void usesDefaultInterpreterWhenNoneConfigured() {
        newShell(ShellOptions.builder());

        assertEquals(PythonShell.DEFAULT_INTERPRETER_PATH, launchedCommands.get(0).get(0));
        process.finish(0);
    }

    @Test
    void sendInTextModeWritesMessageAndOneTerminator() {
        PythonShell shell = newShell(ShellOptions.builder());

        shell.send("hello");
        shell.send(42);

        assertEquals("hello\n42\n", process.stdinText());
        process.finish(0);
    }

    @Test
    void jsonModeRoundTrip() throws Exception {
        PythonShell shell = subscribeAll(newShell(ShellOptions.builder().mode(ShellMode.JSON)));

        shell.send(Map.of("a", 1));
        assertEquals("{\"a\":1}\n", process.stdinText());

        process.writeStdout("{\"a\":1}\n");
        shell.end(recordingCallback());
        process.finish(0);
        await(shell);

        assertEquals(List.of(Map.of("a", 1)), messages);
        assertTrue(process.isStdinClosed());
    }

    @Test
    void recordsArriveInOrderAcrossArbitraryChunks() throws Exception {
        PythonShell shell = subscribeAll(newShell(ShellOptions.builder()));

        process.writeStdout("fir");
        process.writeStdout("st\nsec");
        process.writeStdout("ond\nthird\nunterminated");
        process.finish(0);
        await(shell);

        assertEquals(List.of("first", "second", "third"), messages);
    }

    @Test
    void cleanExitFiresCloseOnceWithoutError() throws Exception {
        PythonShell shell = subscribeAll(newShell(ShellOptions.builder()));
        shell.end(recordingCallback());

        process.finish(0);
        ShellExit exit = await(shell);

        assertTrue(exit.isSuccess());
        assertEquals(0, exit.exitCode());
        assertTrue(errors.isEmpty());
        assertEquals(1, closes.get());
        assertEquals(1, callbacks.size());
        assertNull(callbacks.get(0)[0]);
        assertEquals(0, callbacks.get(0)[1]);
        assertTrue(shell.isTerminated());
        assertEquals(0, shell.getExitCode());
        assertNull(shell.getExitSignal());
    }

    @Test
    void tracebackOnStderrBecomesStructuredError() throws Exception {
        PythonShell shell = subscribeAll(newShell(ShellOptions.builder().interpreterPath("python3")));

        process.writeStderr("Traceback (most recent call last):\n");
        process.writeStderr("  File \"x.py\", line 1\nValueError: bad\n");
        process.finish(1);
        ShellExit exit = await(shell);

        assertEquals(1, errors.size());
        PythonShellException error = errors.get(0);
        assertEquals("ValueError: bad", error.getMessage());
        assertTrue(error.getTraceback().contains("File \"x.py\", line 1"));
        assertEquals(1, error.getExitCode());
        assertEquals("python3", error.getExecutable());
        assertEquals("script.py", error.getScript());
        assertSame(error, exit.error());
        assertEquals(1, closes.get());
        // stderr 行仍然作为记录发布
        assertEquals(List.of("Traceback (most recent call last):", "  File \"x.py\", line 1", "ValueError: bad"),
                stderrRecords);
    }

    @Test
    void stderrRecordsOnCleanExitAreNotErrors() throws Exception {
        PythonShell shell = subscribeAll(newShell(ShellOptions.builder()));

        process.writeStderr("warning one\nwarning two\n");
        process.finish(0);
        await(shell);

        assertEquals(List.of("warning one", "warning two"), stderrRecords);
        assertTrue(errors.isEmpty());
    }

    @Test
    void errorIsReportedOnlyThroughCallbackWhenNoErrorListener() throws Exception {
        PythonShell shell = newShell(ShellOptions.builder());
        shell.end(recordingCallback());

        process.finish(5);
        await(shell);
        shell.onError(errors::add);
        drainEvents(shell);

        assertTrue(errors.isEmpty());
        assertEquals(1, callbacks.size());
        assertEquals("process exited with code 5", ((PythonShellException) callbacks.get(0)[0]).getMessage());
        assertEquals(5, callbacks.get(0)[1]);
    }

    @RepeatedTest(20)
    void scriptExitingOnEofReportsErrorOnlyThroughCallback() throws Exception {
        process.exitWhenStdinCloses(5);
        PythonShell shell = newShell(ShellOptions.builder());

        shell.end(recordingCallback());
        await(shell);
        shell.onError(errors::add);
        drainEvents(shell);

        assertTrue(errors.isEmpty());
        assertEquals(1, callbacks.size());
        assertEquals(5, callbacks.get(0)[1]);
    }

    @Test
    void unsubscribedStderrRecordsAreDroppedAtClose() throws Exception {
        PythonShell shell = newShell(ShellOptions.builder());

        for (int i = 0; i < 2000; i++) {
            process.writeStderr("line " + i + "\n");
        }
        process.finish(0);
        await(shell);
        shell.onStderr(stderrRecords::add);
        drainEvents(shell);

        assertTrue(stderrRecords.isEmpty());
    }

    @Test
    void errorWithoutListenerOrCallbackIsHeldForLateSubscriber() throws Exception {
        PythonShell shell = newShell(ShellOptions.builder());

        process.writeStderr("fatal\n");
        process.finish(2);
        await(shell);
        shell.onError(errors::add);
        drainEvents(shell);

        assertEquals(1, errors.size());
        assertEquals("fatal\n", errors.get(0).getMessage());
    }

    @Test
    void messagesBeforeSubscriptionAreReplayed() throws Exception {
        PythonShell shell = newShell(ShellOptions.builder());

        process.writeStdout("early\n");
        process.finish(0);
        await(shell);
        shell.onMessage(messages::add);
        drainEvents(shell);

        assertEquals(List.of("early"), messages);
    }

    @Test
    void undecodableRecordIsSkipped() throws Exception {
        PythonShell shell = subscribeAll(newShell(ShellOptions.builder().mode(ShellMode.JSON)));

        process.writeStdout("not json\n[1,2]\n");
        process.finish(0);
        await(shell);

        assertEquals(List.of(List.of(1, 2)), messages);
        assertEquals(1, closes.get());
    }

    @Test
    void customParserOverridesMode() throws Exception {
        Function<String, Object> reverse = line -> new StringBuilder(line).reverse().toString();
        PythonShell shell = subscribeAll(newShell(ShellOptions.builder().parser(CodecChoice.custom(reverse))));

        process.writeStdout("abc\n");
        process.finish(0);
        await(shell);

        assertEquals(List.of("cba"), messages);
    }

    @Test
    void binaryModePassesRawBytesBothWays() throws Exception {
        List<byte[]> chunks = new CopyOnWriteArrayList<>();
        PythonShell shell = newShell(ShellOptions.builder().mode(ShellMode.BINARY));
        shell.onData(chunks::add).onMessage(messages::add);

        shell.send(new byte[] {1, 2, 3});
        shell.send("x");
        assertArrayEquals(new byte[] {1, 2, 3, 'x'}, process.stdinBytes());

        process.writeStdout(new byte[] {10, 0, 10});
        process.finish(0);
        await(shell);

        var received = new ByteArrayOutputStream();
        chunks.forEach(received::writeBytes);
        assertArrayEquals(new byte[] {10, 0, 10}, received.toByteArray());
        assertTrue(messages.isEmpty());
    }

    @Test
    void binaryModeStillClassifiesStderr() throws Exception {
        PythonShell shell = newShell(ShellOptions.builder().mode(ShellMode.BINARY));
        shell.onError(errors::add).onStderr(stderrRecords::add);

        process.writeStderr("bad input\n");
        process.finish(1);
        await(shell);

        assertEquals("bad input\n", errors.get(0).getMessage());
        assertTrue(stderrRecords.isEmpty());
    }

    @Test
    void terminateAfterNaturalExitDoesNotFireCloseAgain() throws Exception {
        PythonShell shell = subscribeAll(newShell(ShellOptions.builder()));
        shell.end(recordingCallback());

        process.finish(0);
        await(shell);
        shell.terminate();
        shell.end(recordingCallback());
        drainEvents(shell);

        assertEquals(1, closes.get());
        assertEquals(1, callbacks.size());
        assertTrue(shell.isTerminated());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void terminateBeforeExitReportsSignalAndClosesOnce() throws Exception {
        PythonShell shell = subscribeAll(newShell(ShellOptions.builder()));
        shell.end(recordingCallback());

        shell.terminate();
        assertTrue(shell.isTerminated());
        shell.terminate(ShellSignal.SIGKILL);
        ShellExit exit = await(shell);
        drainEvents(shell);

        assertNull(exit.exitCode());
        assertEquals("SIGTERM", exit.exitSignal());
        assertTrue(errors.isEmpty());
        assertEquals(1, closes.get());
        assertEquals(1, callbacks.size());
        assertEquals("SIGTERM", callbacks.get(0)[2]);
    }

    @Test
    void terminateRacingNaturalExitClosesOnce() throws Exception {
        PythonShell shell = subscribeAll(newShell(ShellOptions.builder()));
        shell.end(recordingCallback());

        Thread killer = new Thread(shell::terminate);
        killer.start();
        process.finish(0);
        killer.join();
        await(shell);
        drainEvents(shell);

        assertEquals(1, closes.get());
        assertEquals(1, callbacks.size());
    }

    @Test
    void lateCloseListenerIsCalledImmediately() throws Exception {
        PythonShell shell = newShell(ShellOptions.builder());
        process.finish(0);
        await(shell);

        var latch = new CountDownLatch(1);
        shell.onClose(latch::countDown);

        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }

    @Test
    void throwingListenerDoesNotBreakTheSession() throws Exception {
        PythonShell shell = newShell(ShellOptions.builder());
        shell.onMessage(message -> {
            throw new IllegalStateException("listener failure");
        }).onMessage(messages::add).onClose(closes::incrementAndGet);

        process.writeStdout("one\ntwo\n");
        process.finish(0);
        await(shell);

        assertEquals(List.of("one", "two"), messages);
        assertEquals(1, closes.get());
    }

    @Test
    void sendAfterEndIsRejected() {
        PythonShell shell = newShell(ShellOptions.builder());
        shell.end(null);

        assertThrows(IllegalStateException.class, () -> shell.send("late"));
        process.finish(0);
    }

    @Test
    void encodingAppliesToOutboundMessages() {
        PythonShell shell = newShell(ShellOptions.builder().encoding("ISO-8859-1"));

        shell.send("é");

        assertArrayEquals(("é\n").getBytes(StandardCharsets.ISO_8859_1), process.stdinBytes());
        process.finish(0);
    }

    @Test
    void spawnFailureIsThrownImmediately() {
        ProcessLauncher failing = (command, opts) -> {
            throw new IOException("Cannot run program \"nope\": error=2, No such file or directory");
        };

        ShellSpawnException e = assertThrows(ShellSpawnException.class,
                () -> new PythonShell("script.py", ShellOptions.builder().interpreterPath("nope").build(), registry, failing));

        assertEquals(List.of("nope", "script.py"), e.getCommand());
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void unknownCodecNameFailsBeforeSpawning() {
        assertThrows(IllegalArgumentException.class,
                () -> newShell(ShellOptions.builder().formatter(CodecChoice.builtIn("xml"))));
        assertTrue(launchedCommands.isEmpty());
    }
}
