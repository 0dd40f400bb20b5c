/**
 * PyShellApplication.java
 *
 * Spring Boot 应用的主入口类。
 * 以第一个位置参数作为脚本路径、其余参数作为脚本参数运行一次脚本，
 * 将收集到的每条消息逐行打印到标准输出，并以脚本的结果作为进程退出码。
 * 不带参数启动时只初始化上下文，供嵌入使用。
 */
package club.ppmc.pyshell;

import club.ppmc.pyshell.model.ShellOptions;
import club.ppmc.pyshell.service.PythonShellService;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@Slf4j
public class PyShellApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PyShellApplication.class, args)));
    }

    @Bean
    public ScriptRunner scriptRunner(PythonShellService pythonShellService) {
        return new ScriptRunner(pythonShellService);
    }

    /**
     * 运行命令行指定的脚本。
     */
    static class ScriptRunner implements CommandLineRunner, ExitCodeGenerator {

        private final PythonShellService pythonShellService;
        private int exitCode;

        ScriptRunner(PythonShellService pythonShellService) {
            this.pythonShellService = pythonShellService;
        }

        @Override
        public void run(String... args) throws InterruptedException {
            if (args.length == 0) {
                return;
            }
            var options = ShellOptions.builder().args(Arrays.asList(args).subList(1, args.length)).build();
            try {
                List<Object> messages = pythonShellService.run(args[0], options).get();
                messages.forEach(System.out::println);
            } catch (ExecutionException e) {
                log.error("脚本 {} 运行失败: {}", args[0], e.getCause().toString());
                exitCode = 1;
            }
        }

        @Override
        public int getExitCode() {
            return exitCode;
        }
    }
}
