/**
 * ProcessLauncher.java
 *
 * 对 ProcessBuilder 的抽象，使会话可以在测试中使用受控的假进程。
 * 生产环境使用 ProcessBuilderLauncher。
 */
package club.ppmc.pyshell.shell;

import club.ppmc.pyshell.model.ShellOptions;
import java.io.IOException;
import java.util.List;

@FunctionalInterface
public interface ProcessLauncher {

    /**
     * 启动一个新进程。
     *
     * @param command 完整命令，第一个元素为可执行文件。
     * @param options 会话选项，工作目录与环境变量从中读取。
     * @return 已启动的进程。
     * @throws IOException 如果进程无法启动。
     */
    Process launch(List<String> command, ShellOptions options) throws IOException;
}
