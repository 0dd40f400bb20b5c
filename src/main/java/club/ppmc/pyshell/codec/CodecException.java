/**
 * CodecException.java
 *
 * 记录编码或解码失败，例如 json 模式下收到的行不是合法的JSON。
 */
package club.ppmc.pyshell.codec;

public class CodecException extends RuntimeException {

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
