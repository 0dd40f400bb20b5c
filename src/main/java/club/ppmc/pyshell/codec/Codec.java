/**
 * Codec.java
 *
 * 会话构造时解析出的一组编解码函数，之后不可变。
 * binary 模式下未指定自定义函数时，三个函数均为 null：不做格式化，也不分帧解码。
 */
package club.ppmc.pyshell.codec;

import java.util.function.Function;

/**
 * @param formatter 出站编码函数，可以为 null。
 * @param parser stdout 记录的解码函数，为 null 时 stdout 以原始字节块发布。
 * @param stderrParser stderr 记录的解码函数，为 null 时不发布 stderr 记录事件。
 */
public record Codec(
        Function<Object, String> formatter,
        Function<String, Object> parser,
        Function<String, Object> stderrParser) {

    public boolean hasParser() {
        return parser != null;
    }

    public boolean hasStderrParser() {
        return stderrParser != null;
    }
}
