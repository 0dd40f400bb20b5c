/**
 * PythonShell.java
 *
 * 一个通过标准输入输出与解释器进程交换数据的交互式会话。
 * 构造时立即启动进程；stdout 与 stderr 分别由读取任务排空，文本块交给会话的事件线程，
 * 经 LineFramer 分帧、Codec 解码后以 message / stderr 事件发布。
 * stderr 的原始文本始终累积，供终止时由 TracebackParser 分类为错误。
 * 终止转换由 LifecycleController 计算，close 事件和完成回调都最多触发一次。
 */
package club.ppmc.pyshell.shell;

import club.ppmc.pyshell.codec.Codec;
import club.ppmc.pyshell.codec.CodecRegistry;
import club.ppmc.pyshell.exception.PythonShellException;
import club.ppmc.pyshell.exception.ShellSpawnException;
import club.ppmc.pyshell.model.ShellExit;
import club.ppmc.pyshell.model.ShellMode;
import club.ppmc.pyshell.model.ShellOptions;
import club.ppmc.pyshell.model.ShellSignal;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

@Slf4j
public class PythonShell {

    private static final boolean IS_WINDOWS = System.getProperty("os.name").toLowerCase().contains("win");

    /** 自2020年起 python2 已停止维护，因此默认使用 python3；Windows 上只有 "python" 命令。 */
    public static final String DEFAULT_INTERPRETER_PATH = IS_WINDOWS ? "python" : "python3";

    private static final int READ_BUFFER_SIZE = 8192;

    private final String scriptPath;
    private final String executable;
    private final List<String> command;
    private final ShellMode mode;
    private final Codec codec;
    private final Charset charset;
    private final String lineSeparator;

    private final Process process;
    private final OutputStream stdin;
    private final LineFramer stdoutFramer;
    private final LineFramer stderrFramer;
    private final LifecycleController lifecycle;
    private final ExecutorService eventLoop;

    // --- 以下通道与监听器只在事件线程上访问 ---
    private final EventChannel<Object> messages = new EventChannel<>("message");
    private final EventChannel<Object> stderrRecords = new EventChannel<>("stderr");
    private final EventChannel<byte[]> data = new EventChannel<>("data");
    private final EventChannel<PythonShellException> errors = new EventChannel<>("error");
    private final List<Runnable> closeListeners = new ArrayList<>();

    private volatile boolean terminated;
    private volatile boolean stdinClosed;
    private volatile ShellSignal requestedSignal;
    private volatile ShellExit exit;

    /**
     * 创建会话并立即启动解释器进程。
     *
     * @param scriptPath 要执行的脚本路径，若配置了 scriptFolder 则相对于它解析。
     * @param options 会话选项，为 null 的字段使用内置默认值。
     * @param codecRegistry 用于解析编解码函数的注册表。
     * @param launcher 进程启动器。
     * @throws ShellSpawnException 如果解释器进程无法启动。
     * @throws IllegalArgumentException 如果选项中的编解码名称或字符集无效。
     */
    public PythonShell(String scriptPath, ShellOptions options, CodecRegistry codecRegistry, ProcessLauncher launcher) {
        ShellOptions opts = options != null ? options : ShellOptions.defaults();

        this.executable = StringUtils.hasText(opts.getInterpreterPath())
                ? opts.getInterpreterPath()
                : DEFAULT_INTERPRETER_PATH;
        List<String> interpreterOptions = opts.getInterpreterOptions() != null ? opts.getInterpreterOptions() : List.of();
        List<String> scriptArgs = opts.getArgs() != null ? opts.getArgs() : List.of();

        this.scriptPath = StringUtils.hasText(opts.getScriptFolder())
                ? Paths.get(opts.getScriptFolder()).resolve(scriptPath).normalize().toString()
                : scriptPath;
        List<String> commandArgs = new ArrayList<>(interpreterOptions);
        commandArgs.add(this.scriptPath);
        commandArgs.addAll(scriptArgs);
        this.command = List.copyOf(commandArgs);

        this.mode = opts.getMode() != null ? opts.getMode() : ShellMode.TEXT;
        this.codec = codecRegistry.resolve(mode, opts.getFormatter(), opts.getParser(), opts.getStderrParser());
        this.charset = StringUtils.hasText(opts.getEncoding()) ? Charset.forName(opts.getEncoding()) : StandardCharsets.UTF_8;
        this.lineSeparator = opts.getLineSeparator() != null ? opts.getLineSeparator() : System.lineSeparator();
        this.stdoutFramer = new LineFramer(lineSeparator);
        this.stderrFramer = new LineFramer(lineSeparator);

        List<String> fullCommand = new ArrayList<>();
        fullCommand.add(executable);
        fullCommand.addAll(command);
        try {
            this.process = launcher.launch(fullCommand, opts);
        } catch (IOException e) {
            log.error("启动解释器进程失败，命令: {}", fullCommand, e);
            throw new ShellSpawnException(fullCommand, e);
        }
        log.info("已启动解释器进程，PID: {}. 命令: {}", process.pid(), String.join(" ", fullCommand));

        this.stdin = process.getOutputStream();
        this.eventLoop = ShellExecutors.newEventLoop("pyshell-" + process.pid());
        this.lifecycle = new LifecycleController(
                new TracebackParser(), new Sink(), executable, interpreterOptions, this.scriptPath, scriptArgs);

        if (codec.hasParser()) {
            ShellExecutors.STREAM_READERS.execute(() -> drainText(
                    process.getInputStream(), "stdout", stdoutFramer, this::receive, lifecycle::onStdoutEnd));
        } else {
            ShellExecutors.STREAM_READERS.execute(this::drainStdoutBytes);
        }
        ShellExecutors.STREAM_READERS.execute(() -> drainText(
                process.getErrorStream(), "stderr", stderrFramer, this::onStderrChunk, lifecycle::onStderrEnd));
        process.onExit().whenComplete((p, t) -> eventLoop.execute(this::handleExit));
    }

    // ========================= 公共操作 =========================

    /**
     * 通过 stdin 向解释器发送一条消息。
     * 非 binary 模式下消息经格式化器编码后追加行分隔符；binary 模式下按原始字节写入。
     *
     * @param message 要发送的消息。
     * @return 当前会话，便于链式调用。
     * @throws IllegalStateException 如果 stdin 已经通过 end() 关闭。
     * @throws UncheckedIOException 如果写入管道失败。
     */
    public PythonShell send(Object message) {
        if (stdinClosed) {
            throw new IllegalStateException("stdin 已关闭，无法再发送消息");
        }
        byte[] bytes = encode(message);
        try {
            synchronized (stdin) {
                stdin.write(bytes);
                stdin.flush();
            }
        } catch (IOException e) {
            log.error("向进程 PID {} 的 stdin 写入失败: {}", process.pid(), e.getMessage());
            throw new UncheckedIOException(e);
        }
        return this;
    }

    /**
     * 关闭 stdin，通知解释器不再有输入，并注册完成回调。
     * 回调在终止转换时最多调用一次；如果会话已经终止，则立即以记录的结果调用。
     *
     * @param callback 完成回调，可以为 null。
     * @return 当前会话。
     */
    public PythonShell end(EndCallback callback) {
        // 先注册回调再关闭 stdin，保证回调早于进程因 EOF 退出而产生的完成事实
        eventLoop.execute(() -> lifecycle.registerEndCallback(callback));
        closeStdin();
        return this;
    }

    /**
     * 以 SIGTERM 终止进程。
     */
    public PythonShell terminate() {
        return terminate(ShellSignal.SIGTERM);
    }

    /**
     * 立即请求终止进程，并同步地将会话标记为已终止。
     * 该方法不会直接发布 close 事件：进程被终止后三个完成事实仍会汇合，
     * 由 LifecycleController 发布唯一一次 close 事件并调用完成回调。
     *
     * @param signal 要发送的信号，为 null 时使用 SIGTERM。
     * @return 当前会话。
     */
    public PythonShell terminate(ShellSignal signal) {
        ShellSignal effective = signal != null ? signal : ShellSignal.SIGTERM;
        if (process.isAlive()) {
            requestedSignal = effective;
            log.info("正在以 {} 终止进程，PID: {}", effective, process.pid());
            if (effective == ShellSignal.SIGKILL) {
                process.destroyForcibly();
            } else {
                process.destroy();
            }
        }
        terminated = true;
        return this;
    }

    // ========================= 订阅 =========================

    /** 订阅解码后的 stdout 记录。首个订阅者会收到订阅前已到达的记录。 */
    public PythonShell onMessage(Consumer<Object> listener) {
        eventLoop.execute(() -> messages.subscribe(listener));
        return this;
    }

    /** 订阅解码后的 stderr 记录。 */
    public PythonShell onStderr(Consumer<Object> listener) {
        eventLoop.execute(() -> stderrRecords.subscribe(listener));
        return this;
    }

    /** 订阅原始 stdout 字节块，仅在没有 stdout 解析器（binary 模式）时发布。 */
    public PythonShell onData(Consumer<byte[]> listener) {
        eventLoop.execute(() -> data.subscribe(listener));
        return this;
    }

    /** 订阅异常退出错误。 */
    public PythonShell onError(Consumer<PythonShellException> listener) {
        eventLoop.execute(() -> errors.subscribe(listener));
        return this;
    }

    /** 订阅终止事件。如果会话已经终止，监听器会被立即调用。 */
    public PythonShell onClose(Runnable listener) {
        eventLoop.execute(() -> {
            if (lifecycle.isTerminal()) {
                runCloseListener(listener);
            } else {
                closeListeners.add(listener);
            }
        });
        return this;
    }

    /**
     * 在终止转换时完成的 Future，完成顺序在 close 事件与完成回调之后。
     */
    public CompletableFuture<ShellExit> completion() {
        return lifecycle.completion().copy();
    }

    // ========================= 接收（可由子类覆盖） =========================

    /**
     * 解析 stdout 的文本块并发布 message 事件。在事件线程上调用。
     *
     * @param chunk 按流顺序到达的文本块。
     */
    protected void receive(String chunk) {
        for (String record : stdoutFramer.push(chunk)) {
            decodeAndPublish(codec.parser(), record, messages);
        }
    }

    /**
     * 解析 stderr 的文本块并发布 stderr 事件。在事件线程上调用。
     *
     * @param chunk 按流顺序到达的文本块。
     */
    protected void receiveStderr(String chunk) {
        for (String record : stderrFramer.push(chunk)) {
            decodeAndPublish(codec.stderrParser(), record, stderrRecords);
        }
    }

    // ========================= 读取与生命周期 =========================

    private void onStderrChunk(String chunk) {
        lifecycle.appendStderr(chunk);
        if (codec.hasStderrParser()) {
            receiveStderr(chunk);
        }
    }

    private void decodeAndPublish(Function<String, Object> parser, String record, EventChannel<Object> channel) {
        Object decoded;
        try {
            decoded = parser.apply(record);
        } catch (RuntimeException e) {
            log.warn("无法解码进程 PID {} 的记录，已跳过: {}", process.pid(), record, e);
            return;
        }
        channel.publish(decoded);
    }

    private void drainText(InputStream stream, String name, LineFramer framer, Consumer<String> onChunk, Runnable onEnd) {
        try (var reader = new InputStreamReader(stream, charset)) {
            char[] buffer = new char[READ_BUFFER_SIZE];
            int charsRead;
            while ((charsRead = reader.read(buffer)) != -1) {
                String chunk = new String(buffer, 0, charsRead);
                eventLoop.execute(() -> onChunk.accept(chunk));
            }
        } catch (IOException e) {
            // 进程被销毁时管道会被关闭，读取抛出异常属于正常现象
            log.debug("读取进程 PID {} 的 {} 时出错 (如果进程被终止，此为正常现象): {}", process.pid(), name, e.getMessage());
        } finally {
            eventLoop.execute(() -> {
                if (framer.hasPendingFragment()) {
                    log.debug("进程 PID {} 的 {} 以未终止的片段结束，已丢弃: {}", process.pid(), name, framer.pendingFragment());
                }
                log.debug("进程 PID {} 的 {} 已结束。", process.pid(), name);
                onEnd.run();
            });
        }
    }

    private void drainStdoutBytes() {
        try (InputStream stream = process.getInputStream()) {
            byte[] buffer = new byte[READ_BUFFER_SIZE];
            int bytesRead;
            while ((bytesRead = stream.read(buffer)) != -1) {
                byte[] chunk = Arrays.copyOf(buffer, bytesRead);
                eventLoop.execute(() -> data.publish(chunk));
            }
        } catch (IOException e) {
            log.debug("读取进程 PID {} 的 stdout 时出错 (如果进程被终止，此为正常现象): {}", process.pid(), e.getMessage());
        } finally {
            eventLoop.execute(lifecycle::onStdoutEnd);
        }
    }

    private void handleExit() {
        int exitValue = process.exitValue();
        ShellSignal signal = requestedSignal;
        if (signal != null && !IS_WINDOWS && exitValue == signal.unixExitValue()) {
            log.info("进程 PID {} 已被 {} 终止。", process.pid(), signal);
            lifecycle.onExit(null, signal.name());
        } else {
            log.info("进程 PID {} 已退出，退出码: {}", process.pid(), exitValue);
            lifecycle.onExit(exitValue, null);
        }
    }

    private void closeStdin() {
        if (stdinClosed) {
            return;
        }
        stdinClosed = true;
        try {
            synchronized (stdin) {
                stdin.close();
            }
        } catch (IOException e) {
            // 进程已经退出时关闭管道可能失败，不影响终止流程
            log.warn("关闭进程 PID {} 的 stdin 时出错: {}", process.pid(), e.getMessage());
        }
    }

    private byte[] encode(Object message) {
        if (mode == ShellMode.BINARY) {
            Object formatted = codec.formatter() != null ? codec.formatter().apply(message) : message;
            if (formatted instanceof byte[] bytes) {
                return bytes;
            }
            return formatted == null ? new byte[0] : formatted.toString().getBytes(charset);
        }
        String text = codec.formatter() != null ? codec.formatter().apply(message) : String.valueOf(message);
        return (text + lineSeparator).getBytes(charset);
    }

    private void runCloseListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.error("close 事件的监听器抛出异常", e);
        }
    }

    private class Sink implements LifecycleController.TerminalSink {

        @Override
        public boolean hasErrorSubscribers() {
            return errors.hasSubscribers();
        }

        @Override
        public void publishError(PythonShellException error) {
            if (!errors.hasSubscribers()) {
                log.warn("脚本 {} 异常退出，但没有 error 监听器或完成回调: {}", scriptPath, error.getMessage());
            }
            errors.publish(error);
        }

        @Override
        public void publishClose(ShellExit result) {
            exit = result;
            terminated = true;
            // 终止后不会再有新的 stderr 或字节块，未被订阅的暂存内容不再保留
            stderrRecords.stopBuffering();
            data.stopBuffering();
            closeListeners.forEach(PythonShell.this::runCloseListener);
            closeListeners.clear();
        }
    }

    // ========================= 状态 =========================

    public String getScriptPath() {
        return scriptPath;
    }

    public String getExecutable() {
        return executable;
    }

    /** 传给解释器的参数：解释器选项、脚本路径、脚本参数。 */
    public List<String> getCommand() {
        return command;
    }

    public ShellMode getMode() {
        return mode;
    }

    public long getPid() {
        return process.pid();
    }

    public boolean isTerminated() {
        return terminated;
    }

    /** 终止转换之前为 null。 */
    public Integer getExitCode() {
        ShellExit current = exit;
        return current != null ? current.exitCode() : null;
    }

    /** 终止转换之前或正常退出时为 null。 */
    public String getExitSignal() {
        ShellExit current = exit;
        return current != null ? current.exitSignal() : null;
    }
}
