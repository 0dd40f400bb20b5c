/**
 * AppConfig.java
 *
 * Spring Boot 应用的基础配置类。
 * 定义会话所需的应用级Bean：JSON 使用的 ObjectMapper、内置编解码注册表、进程启动器，
 * 以及根据 application.properties 中 pyshell.* 属性创建的默认配置 ShellSettings。
 */
package club.ppmc.pyshell.config;

import club.ppmc.pyshell.codec.CodecRegistry;
import club.ppmc.pyshell.model.ShellMode;
import club.ppmc.pyshell.model.ShellSettings;
import club.ppmc.pyshell.shell.ProcessBuilderLauncher;
import club.ppmc.pyshell.shell.ProcessLauncher;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Arrays;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Configuration
public class AppConfig {

    /**
     * json 模式使用的 ObjectMapper。不开启缩进，保证每条消息序列化后只占一行。
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public CodecRegistry codecRegistry(ObjectMapper objectMapper) {
        return new CodecRegistry(objectMapper);
    }

    @Bean
    public ProcessLauncher processLauncher() {
        return new ProcessBuilderLauncher();
    }

    /**
     * 所有会话共享的默认配置。空值表示使用内置默认值。
     */
    @Bean
    public ShellSettings shellSettings(
            @Value("${pyshell.interpreter-path:}") String interpreterPath,
            @Value("${pyshell.mode:text}") String mode,
            @Value("${pyshell.encoding:UTF-8}") String encoding,
            @Value("${pyshell.interpreter-options:}") String interpreterOptions,
            @Value("${pyshell.script-folder:}") String scriptFolder,
            @Value("${pyshell.temp-directory:}") String tempDirectory) {
        var settings = new ShellSettings();
        if (StringUtils.hasText(interpreterPath)) {
            settings.setInterpreterPath(interpreterPath.trim());
        }
        if (StringUtils.hasText(mode)) {
            settings.setMode(ShellMode.fromName(mode));
        }
        if (StringUtils.hasText(encoding)) {
            settings.setEncoding(encoding.trim());
        }
        settings.setInterpreterOptions(Arrays.stream(StringUtils.commaDelimitedListToStringArray(interpreterOptions))
                .map(String::trim)
                .filter(StringUtils::hasText)
                .toList());
        if (StringUtils.hasText(scriptFolder)) {
            settings.setScriptFolder(scriptFolder.trim());
        }
        if (StringUtils.hasText(tempDirectory)) {
            settings.setTempDirectory(tempDirectory.trim());
        }
        return settings;
    }
}
