/**
 * PythonShellException.java
 *
 * 解释器进程异常退出（退出码非0）时构造的错误。
 * 当 stderr 以 Traceback 开头时，消息为异常摘要行，traceback 字段保存中间的调用栈行；
 * 否则消息为完整的 stderr 文本，或 "process exited with code N"。
 * 它携带了结构化的错误信息（可执行文件、选项、脚本、参数、退出码），便于调用方记录或序列化。
 */
package club.ppmc.pyshell.exception;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;

@Getter
public class PythonShellException extends RuntimeException {

    /** 解释器调用栈（不含 Traceback 标记行和最后的异常摘要行）；没有调用栈时为 null。 */
    private final String traceback;

    /** 终止时累积的完整 stderr 文本；可能为空字符串。 */
    private final String stderr;

    private Integer exitCode;
    private String executable;
    private List<String> interpreterOptions;
    private String script;
    private List<String> args;

    public PythonShellException(String message, String traceback, String stderr) {
        super(message);
        this.traceback = traceback;
        this.stderr = stderr;
    }

    public PythonShellException(String message) {
        this(message, null, "");
    }

    /**
     * 附加进程相关的上下文信息。只在终止转换时调用一次。
     *
     * @return 当前实例，便于链式调用。
     */
    public PythonShellException withProcessContext(
            String executable, List<String> interpreterOptions, String script, List<String> args, Integer exitCode) {
        this.executable = executable;
        this.interpreterOptions = interpreterOptions == null || interpreterOptions.isEmpty() ? null : List.copyOf(interpreterOptions);
        this.script = script;
        this.args = args == null || args.isEmpty() ? null : List.copyOf(args);
        this.exitCode = exitCode;
        return this;
    }

    public boolean hasTraceback() {
        return traceback != null;
    }

    /**
     * 将异常信息转换为一个Map，便于记录日志或序列化为JSON。
     *
     * @return 包含结构化错误信息的Map，未设置的字段不会出现。
     */
    public Map<String, Object> toErrorData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", hasTraceback() ? "TRACEBACK" : "ABNORMAL_EXIT");
        data.put("message", getMessage());
        putIfPresent(data, "traceback", traceback);
        putIfPresent(data, "exitCode", exitCode);
        putIfPresent(data, "executable", executable);
        putIfPresent(data, "options", interpreterOptions);
        putIfPresent(data, "script", script);
        putIfPresent(data, "args", args);
        return data;
    }

    private static void putIfPresent(Map<String, Object> data, String key, Object value) {
        if (value != null) {
            data.put(key, value);
        }
    }

    @Override
    public String toString() {
        if (!hasTraceback()) {
            return super.toString();
        }
        String indented = traceback.replace("\n", "\n  ");
        return super.toString() + "\n    ----- Python Traceback -----\n  " + indented;
    }
}
