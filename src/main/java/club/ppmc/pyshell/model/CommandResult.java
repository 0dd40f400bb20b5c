/**
 * CommandResult.java
 *
 * 一次性子进程命令的执行结果，由 SystemCommandExecutor 返回。
 * 标准输出与标准错误分别捕获，供语法检查等请求/响应式调用使用。
 */
package club.ppmc.pyshell.model;

/**
 * @param exitCode 进程退出码。
 * @param stdout 完整的标准输出文本。
 * @param stderr 完整的标准错误文本。
 */
public record CommandResult(int exitCode, String stdout, String stderr) {

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
