/**
 * ShellSignal.java
 *
 * terminate() 可以发送给解释器进程的信号。
 * JDK 只能可靠地发送这两种信号：destroy() 对应 SIGTERM，destroyForcibly() 对应 SIGKILL。
 */
package club.ppmc.pyshell.model;

public enum ShellSignal {
    SIGTERM(15),
    SIGKILL(9);

    private final int number;

    ShellSignal(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }

    /**
     * Unix 上 JDK 将被信号终止的子进程报告为 128 + 信号值。
     */
    public int unixExitValue() {
        return 128 + number;
    }
}
