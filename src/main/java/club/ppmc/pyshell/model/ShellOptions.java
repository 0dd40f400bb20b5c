/**
 * ShellOptions.java
 *
 * 单个会话的启动选项。
 * 它使用Lombok的 @Builder 注解，提供了链式调用的构建方式；所有字段都可以为 null，
 * 为 null 的字段由 ShellSettings 或 PythonShell 的内置默认值补全。
 */
package club.ppmc.pyshell.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
public class ShellOptions {

    private ShellMode mode;

    /** 出站编码函数，覆盖模式对应的内置格式化器。 */
    private CodecChoice<Function<Object, String>> formatter;

    /** stdout 记录的解码函数。 */
    private CodecChoice<Function<String, Object>> parser;

    /** stderr 记录的解码函数。 */
    private CodecChoice<Function<String, Object>> stderrParser;

    private String encoding;

    private String interpreterPath;

    private List<String> interpreterOptions;

    private String scriptFolder;

    private List<String> args;

    // --- 透传给进程启动器的通用选项 ---
    private Path workingDirectory;

    /** 合并进子进程环境变量的键值对。 */
    private Map<String, String> environment;

    /** 记录分隔符，默认为 System.lineSeparator()。 */
    private String lineSeparator;

    public static ShellOptions defaults() {
        return ShellOptions.builder().build();
    }

    /**
     * 用给定的默认配置填充本对象中为 null 的字段，返回一个新的选项对象。
     *
     * @param settings 默认配置。
     * @return 合并后的选项，本对象不变。
     */
    public ShellOptions withDefaults(ShellSettings settings) {
        var merged = toBuilder();
        if (mode == null) {
            merged.mode(settings.getMode());
        }
        if (encoding == null) {
            merged.encoding(settings.getEncoding());
        }
        if (interpreterPath == null) {
            merged.interpreterPath(settings.getInterpreterPath());
        }
        if (interpreterOptions == null) {
            merged.interpreterOptions(settings.getInterpreterOptions());
        }
        if (scriptFolder == null) {
            merged.scriptFolder(settings.getScriptFolder());
        }
        return merged.build();
    }
}
