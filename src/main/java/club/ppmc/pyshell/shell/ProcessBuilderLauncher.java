/**
 * ProcessBuilderLauncher.java
 *
 * 基于 ProcessBuilder 的默认进程启动器。stdout 与 stderr 保持分离，不做重定向。
 */
package club.ppmc.pyshell.shell;

import club.ppmc.pyshell.model.ShellOptions;
import java.io.IOException;
import java.util.List;

public class ProcessBuilderLauncher implements ProcessLauncher {

    @Override
    public Process launch(List<String> command, ShellOptions options) throws IOException {
        var processBuilder = new ProcessBuilder(command);
        if (options.getWorkingDirectory() != null) {
            processBuilder.directory(options.getWorkingDirectory().toFile());
        }
        if (options.getEnvironment() != null) {
            processBuilder.environment().putAll(options.getEnvironment());
        }
        return processBuilder.start();
    }
}
