/**
 * PythonShellService.java
 *
 * 该服务是创建解释器会话的统一入口，并提供一次性的便捷调用。
 * 它用 ShellSettings 中的默认配置补全每个会话的选项，然后委托给 PythonShell。
 * run / runString 收集全部 message 事件后一次性返回；checkSyntax / checkSyntaxFile
 * 通过 SystemCommandExecutor 执行一次 "-m py_compile"，不创建会话。
 */
package club.ppmc.pyshell.service;

import club.ppmc.pyshell.codec.CodecRegistry;
import club.ppmc.pyshell.exception.PythonShellException;
import club.ppmc.pyshell.exception.SyntaxCheckException;
import club.ppmc.pyshell.model.ShellOptions;
import club.ppmc.pyshell.model.ShellSettings;
import club.ppmc.pyshell.shell.ProcessLauncher;
import club.ppmc.pyshell.shell.PythonShell;
import club.ppmc.pyshell.util.SystemCommandExecutor;
import club.ppmc.pyshell.util.TempScriptFiles;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class PythonShellService {

    private static final String RUN_FILE_PREFIX = "pythonShellFile";
    private static final String SYNTAX_CHECK_FILE_PREFIX = "pythonShellSyntaxCheck";

    private final ShellSettings settings;
    private final CodecRegistry codecRegistry;
    private final ProcessLauncher processLauncher;
    private final SystemCommandExecutor commandExecutor;

    public PythonShellService(
            ShellSettings settings,
            CodecRegistry codecRegistry,
            ProcessLauncher processLauncher,
            SystemCommandExecutor commandExecutor) {
        this.settings = settings;
        this.codecRegistry = codecRegistry;
        this.processLauncher = processLauncher;
        this.commandExecutor = commandExecutor;
    }

    /**
     * 创建一个新会话，未指定的选项使用默认配置。进程会立即启动。
     *
     * @param scriptPath 要执行的脚本。
     * @param options 会话选项，可以为 null。
     * @return 新会话。
     */
    public PythonShell create(String scriptPath, ShellOptions options) {
        ShellOptions effective = (options != null ? options : ShellOptions.defaults()).withDefaults(settings);
        return new PythonShell(scriptPath, effective, codecRegistry, processLauncher);
    }

    /**
     * 运行脚本直到结束，并收集所有 message 事件。
     * 回调参数：异常退出时为 (error, null)；否则为 (null, 消息列表)，没有任何消息时列表为 null。
     *
     * @param scriptPath 要执行的脚本。
     * @param options 会话选项，可以为 null。
     * @param callback 完成回调。
     * @return 正在运行的会话。
     */
    public PythonShell run(String scriptPath, ShellOptions options, BiConsumer<PythonShellException, List<Object>> callback) {
        PythonShell shell = create(scriptPath, options);
        List<Object> output = new ArrayList<>();
        // message 事件与完成回调在同一个事件线程上执行，无需同步
        return shell.onMessage(output::add).end((error, exitCode, exitSignal) -> {
            if (error != null) {
                callback.accept(error, null);
            } else {
                callback.accept(null, output.isEmpty() ? null : output);
            }
        });
    }

    /**
     * run 的 Future 版本：正常结束时以消息列表完成（没有消息时为空列表），异常退出时以 PythonShellException 异常完成。
     */
    public CompletableFuture<List<Object>> run(String scriptPath, ShellOptions options) {
        CompletableFuture<List<Object>> result = new CompletableFuture<>();
        run(scriptPath, options, futureCallback(result));
        return result;
    }

    /**
     * 将代码暂存为临时脚本后运行，会话结束后删除临时文件（无论成功与否）。
     * 请勿传入不受信任的用户输入。
     *
     * @throws club.ppmc.pyshell.exception.ScriptStagingException 如果代码无法暂存，此时不会创建会话。
     */
    public PythonShell runString(String code, ShellOptions options, BiConsumer<PythonShellException, List<Object>> callback) {
        Path scriptFile = TempScriptFiles.stage(code, RUN_FILE_PREFIX, settings.getTempDirectory(), charsetOf(options));
        // 暂存的脚本使用绝对路径，不受 scriptFolder 影响
        ShellOptions effective = (options != null ? options : ShellOptions.defaults()).toBuilder().scriptFolder("").build();
        try {
            return run(scriptFile.toString(), effective, (error, messages) -> {
                TempScriptFiles.delete(scriptFile);
                callback.accept(error, messages);
            });
        } catch (RuntimeException e) {
            TempScriptFiles.delete(scriptFile);
            throw e;
        }
    }

    /**
     * runString 的 Future 版本。
     */
    public CompletableFuture<List<Object>> runString(String code, ShellOptions options) {
        CompletableFuture<List<Object>> result = new CompletableFuture<>();
        runString(code, options, futureCallback(result));
        return result;
    }

    /**
     * 检查代码的语法而不执行它。
     *
     * @param code 要检查的代码。
     * @return 语法正确时正常完成；否则以携带 stderr 的 SyntaxCheckException 异常完成。
     */
    public CompletableFuture<Void> checkSyntax(String code) {
        Path scriptFile = TempScriptFiles.stage(code, SYNTAX_CHECK_FILE_PREFIX, settings.getTempDirectory(), charsetOf(null));
        return checkSyntaxFile(scriptFile.toString())
                .whenComplete((ignored, error) -> TempScriptFiles.delete(scriptFile));
    }

    /**
     * 检查文件的语法而不执行它，使用 "&lt;解释器&gt; -m py_compile &lt;文件&gt;"。
     *
     * @param filePath 要检查的文件。
     * @return 语法正确时正常完成；否则以携带 stderr 的 SyntaxCheckException 异常完成。
     */
    public CompletableFuture<Void> checkSyntaxFile(String filePath) {
        String interpreter = StringUtils.hasText(settings.getInterpreterPath())
                ? settings.getInterpreterPath()
                : PythonShell.DEFAULT_INTERPRETER_PATH;
        List<String> command = List.of(interpreter, "-m", "py_compile", filePath);
        return commandExecutor.executeCommand(command, null, charsetOf(null)).thenAccept(result -> {
            if (!result.isSuccess()) {
                log.debug("文件 {} 语法检查失败，退出码: {}", filePath, result.exitCode());
                throw new SyntaxCheckException(result.exitCode(), result.stderr());
            }
        });
    }

    private Charset charsetOf(ShellOptions options) {
        String encoding = options != null && StringUtils.hasText(options.getEncoding())
                ? options.getEncoding()
                : settings.getEncoding();
        return Charset.forName(StringUtils.hasText(encoding) ? encoding : "UTF-8");
    }

    private static BiConsumer<PythonShellException, List<Object>> futureCallback(CompletableFuture<List<Object>> result) {
        return (error, messages) -> {
            if (error != null) {
                result.completeExceptionally(error);
            } else {
                result.complete(messages != null ? messages : List.of());
            }
        };
    }
}
