/**
 * TracebackParser.java
 *
 * 将终止时累积的 stderr 文本分类为结构化错误。
 * 以 "Traceback" 开头的文本视为解释器调用栈：最后一行是异常摘要，作为错误消息；
 * 去掉首行（标记行）和最后一行后的其余行作为 traceback 字段。
 * 否则整段文本原样作为错误消息。
 */
package club.ppmc.pyshell.shell;

import club.ppmc.pyshell.exception.PythonShellException;
import java.util.Arrays;
import java.util.regex.Pattern;

public class TracebackParser {

    static final String TRACEBACK_MARKER = "Traceback";

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    public PythonShellException parse(String stderrText) {
        if (!stderrText.startsWith(TRACEBACK_MARKER)) {
            return new PythonShellException(stderrText, null, stderrText);
        }
        String[] lines = LINE_BREAK.split(stderrText.strip());
        String exception = lines[lines.length - 1];
        String traceback = lines.length > 2
                ? String.join("\n", Arrays.asList(lines).subList(1, lines.length - 1))
                : "";
        return new PythonShellException(exception, traceback, stderrText);
    }
}
