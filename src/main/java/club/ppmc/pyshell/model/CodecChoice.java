/**
 * CodecChoice.java
 *
 * 编解码函数的选择：要么是内置表中的名称，要么是调用方提供的自定义函数。
 * 在会话构造时一次性解析为具体函数，之后不再按名称查找。
 */
package club.ppmc.pyshell.model;

import java.util.Objects;

/**
 * @param builtInName 内置函数名称 ("text", "json")，自定义时为 null。
 * @param custom 自定义函数，内置时为 null。
 * @param <F> 函数类型。
 */
public record CodecChoice<F>(String builtInName, F custom) {

    public CodecChoice {
        if ((builtInName == null) == (custom == null)) {
            throw new IllegalArgumentException("CodecChoice 必须且只能指定内置名称或自定义函数之一");
        }
    }

    public static <F> CodecChoice<F> builtIn(String name) {
        return new CodecChoice<>(Objects.requireNonNull(name, "name"), null);
    }

    public static <F> CodecChoice<F> custom(F function) {
        return new CodecChoice<>(null, Objects.requireNonNull(function, "function"));
    }

    public boolean isBuiltIn() {
        return builtInName != null;
    }
}
