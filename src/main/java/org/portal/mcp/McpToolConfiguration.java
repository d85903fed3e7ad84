package org.portal.mcp;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * MCP 工具注册配置。
 * <p>
 * Spring AI MCP Server 会从 Spring 容器中收集 {@link ToolCallback}，
 * 并把文件选择门户的方法（open/save/save-many/close）作为 MCP 工具暴露给沙箱内的客户端。
 */
@Configuration
public class McpToolConfiguration {

    @Bean
    public List<ToolCallback> fileChooserToolCallbacks(FileChooserMcpTools tools) {
        return Arrays.asList(ToolCallbacks.from(tools));
    }
}
