/**
 * ShellSettings.java
 *
 * 该文件定义了一个POJO，用于保存所有会话共享的默认配置。
 * 它由 AppConfig 根据 application.properties 中的 pyshell.* 属性创建一次，
 * PythonShellService 在创建会话前用它填充 ShellOptions 中未指定的字段。
 * 它取代了进程级别可变的全局默认值：配置在构造时显式传入。
 */
package club.ppmc.pyshell.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class ShellSettings {

    /**
     * 解释器可执行文件。非Windows平台默认 "python3"，Windows 上为 "python"。
     */
    private String interpreterPath;

    /**
     * 默认的数据交换模式。
     */
    private ShellMode mode = ShellMode.TEXT;

    /**
     * 标准输入输出使用的字符集名称。
     */
    private String encoding = "UTF-8";

    /**
     * 放在脚本路径之前传给解释器的选项，例如 "-u"。
     */
    private List<String> interpreterOptions = new ArrayList<>();

    /**
     * 脚本路径的基准目录。为空时脚本路径按原样使用。
     */
    private String scriptFolder;

    /**
     * runString 与 checkSyntax 暂存代码的目录。为空时使用系统临时目录。
     */
    private String tempDirectory;
}
