package org.portal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PortalServerApplication {

    public static void main(String[] args) {
        ensureLogDirectory();
        SpringApplication application = new SpringApplication(PortalServerApplication.class);
        // 默认展示层是 Swing 对话框，不能使用 Spring Boot 默认的 headless 模式
        application.setHeadless(false);
        application.run(translateArgs(args));
    }

    /**
     * 兼容命令行 {@code --replace}：等价于 {@code --app.portal.replace=true}。
     */
    static String[] translateArgs(String[] args) {
        return Arrays.stream(args)
                .map(arg -> "--replace".equals(arg) ? "--app.portal.replace=true" : arg)
                .toArray(String[]::new);
    }

    /**
     * 提前创建日志目录（避免 logback 的 RollingFileAppender 因目录不存在而初始化失败）。
     * <p>
     * 规则与 logback-spring.xml 保持一致：优先读取系统属性/环境变量 LOG_PATH，默认使用 ./logs。
     * stdout 用于 MCP 通信，这里出错只能写到 stderr。
     */
    private static void ensureLogDirectory() {
        String logPath = System.getProperty("LOG_PATH");
        if (logPath == null || logPath.isBlank()) {
            logPath = System.getenv("LOG_PATH");
        }
        if (logPath == null || logPath.isBlank()) {
            logPath = "logs";
        }
        try {
            Files.createDirectories(Path.of(logPath));
        } catch (IOException e) {
            System.err.println("无法创建日志目录 " + logPath + "：" + e.getMessage());
        }
    }
}
