/**
 * TempScriptFiles.java
 *
 * 将内联代码暂存为唯一命名的临时脚本文件，并负责删除。
 * 文件通过 Files.createTempFile 原子创建，不会与已有文件冲突。
 */
package club.ppmc.pyshell.util;

import club.ppmc.pyshell.exception.ScriptStagingException;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

@Slf4j
public final class TempScriptFiles {

    private TempScriptFiles() {}

    /**
     * 将代码写入一个新的临时 .py 文件。
     *
     * @param code 要暂存的代码。
     * @param prefix 文件名前缀。
     * @param directory 临时目录，为空时使用系统临时目录。
     * @param charset 写入代码所用的字符集。
     * @return 新文件的路径。
     * @throws ScriptStagingException 如果文件无法创建或写入。
     */
    public static Path stage(String code, String prefix, String directory, Charset charset) {
        Path file = null;
        try {
            file = StringUtils.hasText(directory)
                    ? Files.createTempFile(Files.createDirectories(Paths.get(directory)), prefix, ".py")
                    : Files.createTempFile(prefix, ".py");
            Files.writeString(file, code, charset);
            log.debug("已将代码暂存到 {}", file);
            return file;
        } catch (IOException e) {
            if (file != null) {
                delete(file);
            }
            throw new ScriptStagingException("无法暂存临时脚本: " + e.getMessage(), e);
        }
    }

    /**
     * 删除暂存的脚本。删除失败只记录警告，不影响调用方的结果。
     */
    public static void delete(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("删除临时脚本 {} 失败: {}", file, e.getMessage());
        }
    }
}
