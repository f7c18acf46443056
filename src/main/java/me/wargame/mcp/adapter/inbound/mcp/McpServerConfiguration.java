package me.wargame.mcp.adapter.inbound.mcp;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.server.McpAsyncServer;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.transport.WebFluxStreamableServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.extern.slf4j.Slf4j;
import me.wargame.mcp.infrastructure.config.WargameProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.server.RouterFunction;

import java.util.List;

/**
 * MCP server over the streamable HTTP transport, mounted on the WebFlux
 * server next to the REST API. Configured under {@code wargame.mcp.*}.
 */
@Configuration
@Slf4j
public class McpServerConfiguration {

    @Bean
    public McpJsonMapper mcpJsonMapper() {
        return McpJsonMapper.createDefault();
    }

    @Bean
    public WebFluxStreamableServerTransportProvider mcpTransportProvider(McpJsonMapper jsonMapper,
            WargameProperties properties) {
        WargameProperties.McpProperties mcp = properties.getMcp();
        log.info("[MCP] Streamable HTTP endpoint: {}", mcp.getEndpoint());
        return WebFluxStreamableServerTransportProvider.builder()
                .jsonMapper(jsonMapper)
                .disallowDelete(mcp.isDisallowDelete())
                .messageEndpoint(mcp.getEndpoint())
                .build();
    }

    @Bean
    public RouterFunction<?> mcpRouterFunction(WebFluxStreamableServerTransportProvider transportProvider) {
        return transportProvider.getRouterFunction();
    }

    @Bean
    public McpAsyncServer mcpAsyncServer(WebFluxStreamableServerTransportProvider transportProvider,
            McpToolBridge toolBridge, WargameProperties properties) {
        WargameProperties.McpProperties mcp = properties.getMcp();
        List<McpServerFeatures.AsyncToolSpecification> tools = toolBridge.toolSpecifications();
        log.info("[MCP] Serving {} tools as {} {}", tools.size(), mcp.getServerName(), mcp.getServerVersion());
        return McpServer.async(transportProvider)
                .serverInfo(mcp.getServerName(), mcp.getServerVersion())
                .capabilities(McpSchema.ServerCapabilities.builder().tools(true).logging().build())
                .tools(tools)
                .build();
    }
}
