package me.wargame.mcp.domain.system.toolloop;

import me.wargame.mcp.domain.service.ToolRegistry;
import me.wargame.mcp.infrastructure.config.WargameProperties;
import me.wargame.mcp.port.outbound.AgentDriver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/** Spring wiring for the tool loop (orchestrator + ports). */
@Configuration
public class ToolLoopConfiguration {

    @Bean(destroyMethod = "shutdown")
    public RegistryToolExecutorAdapter toolExecutorPort(ToolRegistry toolRegistry) {
        return new RegistryToolExecutorAdapter(toolRegistry);
    }

    @Bean
    public ToolCircuitBreaker toolCircuitBreaker(WargameProperties properties) {
        WargameProperties.OrchestratorProperties orchestrator = properties.getOrchestrator();
        return new ToolCircuitBreaker(orchestrator.getMaxConsecutiveFailedTools(),
                Duration.ofMillis(orchestrator.getCircuitCooldownMs()));
    }

    @Bean
    public RetryPolicy toolRetryPolicy(WargameProperties properties) {
        return RetryPolicy.from(properties.getOrchestrator().getRetry());
    }

    @Bean
    public AgentDriver agentDriver(WargameProperties properties) {
        return new MemoryFirstAgentDriver(properties.getRetrieval().getDefaultSpan());
    }

    @Bean
    public ToolOrchestrator toolOrchestrator(AgentDriver agentDriver, ToolExecutorPort toolExecutorPort,
            ToolRegistry toolRegistry, ToolCircuitBreaker toolCircuitBreaker, RetryPolicy toolRetryPolicy,
            WargameProperties properties, Clock clock) {
        return new ToolOrchestrator(agentDriver, toolExecutorPort, toolRegistry, toolCircuitBreaker,
                toolRetryPolicy, properties.getOrchestrator(), clock);
    }
}
