/**
 * ShellSpawnException.java
 *
 * 解释器可执行文件无法启动（不存在、无权限等）时抛出。
 * 它在构造会话时立即抛出，不经过终止转换流程，也不会触发 close 事件。
 */
package club.ppmc.pyshell.exception;

import java.util.List;
import lombok.Getter;

@Getter
public class ShellSpawnException extends RuntimeException {

    /** 尝试执行的完整命令，第一个元素为可执行文件。 */
    private final List<String> command;

    public ShellSpawnException(List<String> command, Throwable cause) {
        super("无法启动解释器进程: " + String.join(" ", command) + " (" + cause.getMessage() + ")", cause);
        this.command = List.copyOf(command);
    }
}
