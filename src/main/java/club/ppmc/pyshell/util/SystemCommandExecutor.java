/**
 * SystemCommandExecutor.java
 *
 * 这是一个工具类，负责以一次性的请求/响应方式执行外部命令，例如语法检查。
 * 它接受一个命令列表（而不是单个字符串）以避免因路径中存在空格而导致的解析问题。
 * 标准输出和标准错误分别捕获，执行结果通过 CompletableFuture 返回。
 */
package club.ppmc.pyshell.util;

import club.ppmc.pyshell.exception.ShellSpawnException;
import club.ppmc.pyshell.model.CommandResult;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SystemCommandExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(SystemCommandExecutor.class);

    private final ExecutorService executor = Executors.newCachedThreadPool(commandThreads());

    /**
     * 异步执行一个命令直到结束，并捕获其全部输出。
     *
     * @param commandList 要执行的命令及其参数列表 (e.g., ["python3", "-m", "py_compile", "a.py"])。
     * @param workingDirectory 命令执行的工作目录，为 null 时使用当前目录。
     * @param charset 解码输出所用的字符集。
     * @return 一个CompletableFuture，命令结束时以 CommandResult 完成；进程无法启动时以 ShellSpawnException 异常完成。
     */
    public CompletableFuture<CommandResult> executeCommand(
            List<String> commandList, Path workingDirectory, Charset charset) {
        if (commandList == null || commandList.isEmpty()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("执行的命令不能为空。"));
        }
        return CompletableFuture.supplyAsync(
                () -> {
                    LOGGER.info("执行命令: {}", String.join(" ", commandList));
                    var processBuilder = new ProcessBuilder(commandList);
                    if (workingDirectory != null) {
                        processBuilder.directory(workingDirectory.toFile());
                    }

                    Process process;
                    try {
                        process = processBuilder.start();
                    } catch (IOException e) {
                        LOGGER.error("启动命令 {} 失败", commandList, e);
                        throw new ShellSpawnException(commandList, e);
                    }

                    // stderr 在另一个线程上读取，避免任一管道写满导致子进程阻塞
                    CompletableFuture<String> stderrFuture =
                            CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream(), charset), executor);
                    String stdout = readFully(process.getInputStream(), charset);
                    try {
                        int exitCode = process.waitFor();
                        String stderr = stderrFuture.join();
                        LOGGER.info("命令执行完毕，退出码: {}", exitCode);
                        return new CommandResult(exitCode, stdout, stderr);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt(); // 重新设置中断状态
                        process.destroyForcibly();
                        throw new CompletionException(e);
                    }
                },
                executor);
    }

    private static String readFully(InputStream stream, Charset charset) {
        try (stream) {
            return new String(stream.readAllBytes(), charset);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static ThreadFactory commandThreads() {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, "pyshell-command-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
