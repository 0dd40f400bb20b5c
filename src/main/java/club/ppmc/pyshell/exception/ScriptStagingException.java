/**
 * ScriptStagingException.java
 *
 * 无法将内联代码写入临时脚本文件时抛出。此时不会创建任何会话。
 */
package club.ppmc.pyshell.exception;

public class ScriptStagingException extends RuntimeException {

    public ScriptStagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
