/**
 * EndCallback.java
 *
 * end() 注册的完成回调，在终止转换时最多调用一次。
 */
package club.ppmc.pyshell.shell;

import club.ppmc.pyshell.exception.PythonShellException;

@FunctionalInterface
public interface EndCallback {

    /**
     * @param error 异常退出时的错误，正常退出时为 null。
     * @param exitCode 进程退出码；被信号终止时为 null。
     * @param exitSignal 终止进程的信号名称；正常退出时为 null。
     */
    void onEnd(PythonShellException error, Integer exitCode, String exitSignal);
}
