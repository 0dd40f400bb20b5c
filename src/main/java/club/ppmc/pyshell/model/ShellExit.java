/**
 * ShellExit.java
 *
 * 会话终止时记录的最终结果，由 LifecycleController 在终止转换时创建一次。
 */
package club.ppmc.pyshell.model;

import club.ppmc.pyshell.exception.PythonShellException;

/**
 * @param exitCode 进程退出码；由本会话发送信号终止时为 null。
 * @param exitSignal 终止进程的信号名称，例如 "SIGTERM"；正常退出时为 null。
 * @param error 异常退出时构造的错误；正常退出时为 null。
 */
public record ShellExit(Integer exitCode, String exitSignal, PythonShellException error) {

    public boolean isSuccess() {
        return error == null;
    }
}
