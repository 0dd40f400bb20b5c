/**
 * LifecycleController.java
 *
 * 该类负责计算会话唯一的一次终止转换。
 * 它收集三个相互独立的完成事实：stdout 结束、stderr 结束、进程退出，三者到达顺序不定；
 * 只有当三者全部成立时才执行终止转换：必要时构造错误、发布 close 事件、调用完成回调并完成 completion Future。
 * 所有方法都只在会话的事件线程上调用，因此不需要加锁；result 字段保证转换最多发生一次。
 */
package club.ppmc.pyshell.shell;

import club.ppmc.pyshell.exception.PythonShellException;
import club.ppmc.pyshell.model.ShellExit;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

@Slf4j
class LifecycleController {

    /**
     * 终止转换时由会话实现的回调出口。
     */
    interface TerminalSink {

        boolean hasErrorSubscribers();

        void publishError(PythonShellException error);

        /** 标记会话已终止并发布 close 事件。 */
        void publishClose(ShellExit exit);
    }

    private final TracebackParser tracebackParser;
    private final TerminalSink sink;
    private final String executable;
    private final List<String> interpreterOptions;
    private final String script;
    private final List<String> args;

    private final StringBuilder stderrText = new StringBuilder();
    private final CompletableFuture<ShellExit> completion = new CompletableFuture<>();

    private boolean stdoutEnded;
    private boolean stderrEnded;
    private boolean exited;
    private Integer exitCode;
    private String exitSignal;

    private EndCallback endCallback;
    private boolean callbackInvoked;
    private ShellExit result;

    LifecycleController(
            TracebackParser tracebackParser,
            TerminalSink sink,
            String executable,
            List<String> interpreterOptions,
            String script,
            List<String> args) {
        this.tracebackParser = tracebackParser;
        this.sink = sink;
        this.executable = executable;
        this.interpreterOptions = interpreterOptions;
        this.script = script;
        this.args = args;
    }

    void appendStderr(String chunk) {
        stderrText.append(chunk);
    }

    String stderrText() {
        return stderrText.toString();
    }

    void onStdoutEnd() {
        stdoutEnded = true;
        terminateIfNeeded();
    }

    void onStderrEnd() {
        stderrEnded = true;
        terminateIfNeeded();
    }

    void onExit(Integer code, String signal) {
        if (code == null && signal == null) {
            throw new IllegalArgumentException("退出事件必须携带退出码或信号");
        }
        exited = true;
        exitCode = code;
        exitSignal = signal;
        terminateIfNeeded();
    }

    /**
     * 注册完成回调。如果终止转换已经发生，立即以记录的结果调用回调。
     */
    void registerEndCallback(EndCallback callback) {
        if (callback == null) {
            return;
        }
        endCallback = callback;
        if (result != null) {
            invokeEndCallback();
        }
    }

    boolean hasEndCallback() {
        return endCallback != null;
    }

    boolean isTerminal() {
        return result != null;
    }

    ShellExit result() {
        return result;
    }

    CompletableFuture<ShellExit> completion() {
        return completion;
    }

    private void terminateIfNeeded() {
        if (!stdoutEnded || !stderrEnded || !exited || result != null) {
            return;
        }

        PythonShellException error = null;
        if (exitCode != null && exitCode != 0) {
            error = stderrText.length() > 0
                    ? tracebackParser.parse(stderrText.toString())
                    : new PythonShellException("process exited with code " + exitCode);
            error.withProcessContext(executable, interpreterOptions, script, args, exitCode);

            // 只使用回调时不发布 error 事件，避免重复报告
            if (sink.hasErrorSubscribers() || endCallback == null) {
                sink.publishError(error);
            } else {
                log.debug("脚本 {} 异常退出，错误仅通过完成回调报告: {}", script, error.getMessage());
            }
        }

        result = new ShellExit(exitCode, exitSignal, error);
        log.info("脚本 {} 的会话已终止，退出码: {}，信号: {}", script, exitCode, exitSignal);
        sink.publishClose(result);
        invokeEndCallback();
        completion.complete(result);
    }

    private void invokeEndCallback() {
        if (endCallback == null || callbackInvoked) {
            return;
        }
        callbackInvoked = true;
        try {
            endCallback.onEnd(result.error(), result.exitCode(), result.exitSignal());
        } catch (RuntimeException e) {
            log.error("脚本 {} 的完成回调抛出异常", script, e);
        }
    }
}
