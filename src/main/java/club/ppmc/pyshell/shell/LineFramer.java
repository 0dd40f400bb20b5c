/**
 * LineFramer.java
 *
 * 将任意切分的文本块还原为完整的行记录。每个流（stdout、stderr）各持有一个独立实例。
 * 未遇到分隔符的尾部片段会被缓存，与下一个文本块拼接；缓存中永远不会保存完整记录。
 */
package club.ppmc.pyshell.shell;

import java.util.ArrayList;
import java.util.List;

public class LineFramer {

    private final String separator;
    private final StringBuilder pending = new StringBuilder();

    /** 缓存中尚未检查过的起始位置，之前的部分已确认不含分隔符。 */
    private int scanFrom;

    public LineFramer(String lineSeparator) {
        if (lineSeparator == null || lineSeparator.isEmpty()) {
            throw new IllegalArgumentException("行分隔符不能为空");
        }
        this.separator = lineSeparator;
    }

    /**
     * 推入一个新的文本块，返回因此变得完整的记录（按到达顺序）。
     *
     * @param chunk 按流顺序到达的文本块。
     * @return 完整记录列表；没有新的完整记录时为空列表。
     */
    public List<String> push(String chunk) {
        if (chunk.isEmpty()) {
            return List.of();
        }
        pending.append(chunk);
        List<String> records = new ArrayList<>();
        int recordStart = 0;
        int index;
        // 只扫描新到达的部分，并回退 separator.length() - 1 个字符以识别跨块的分隔符 (例如 \r\n)
        while ((index = pending.indexOf(separator, Math.max(scanFrom, recordStart))) != -1) {
            records.add(pending.substring(recordStart, index));
            recordStart = index + separator.length();
        }
        if (recordStart > 0) {
            pending.delete(0, recordStart);
        }
        scanFrom = Math.max(0, pending.length() - (separator.length() - 1));
        return records.isEmpty() ? List.of() : records;
    }

    /**
     * 当前缓存的未完成片段，没有时为空字符串。
     */
    public String pendingFragment() {
        return pending.toString();
    }

    public boolean hasPendingFragment() {
        return pending.length() > 0;
    }
}
