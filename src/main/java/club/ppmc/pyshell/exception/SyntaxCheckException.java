/**
 * SyntaxCheckException.java
 *
 * 一次性语法检查进程以非0退出码结束时抛出，携带解释器输出的原始 stderr 文本。
 */
package club.ppmc.pyshell.exception;

import lombok.Getter;

@Getter
public class SyntaxCheckException extends RuntimeException {

    private final int exitCode;
    private final String stderr;

    public SyntaxCheckException(int exitCode, String stderr) {
        super(stderr == null || stderr.isBlank() ? "语法检查失败，退出码: " + exitCode : stderr.strip());
        this.exitCode = exitCode;
        this.stderr = stderr;
    }
}
