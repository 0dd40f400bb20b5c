/**
 * ShellMode.java
 *
 * 定义会话与解释器进程之间交换数据的模式。
 * text 与 json 模式按行分帧，binary 模式为原始字节直通，不做任何分帧或解码。
 */
package club.ppmc.pyshell.model;

import java.util.Locale;

public enum ShellMode {
    TEXT,
    JSON,
    BINARY;

    /**
     * 内置编解码表中使用的名称 ("text", "json", "binary")。
     */
    public String codecName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 按名称解析模式，不区分大小写。
     *
     * @param name 模式名称，例如 "json"。
     * @return 对应的模式。
     * @throws IllegalArgumentException 如果名称不是已知模式。
     */
    public static ShellMode fromName(String name) {
        for (ShellMode mode : values()) {
            if (mode.codecName().equalsIgnoreCase(name.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("未知的会话模式: " + name);
    }
}
