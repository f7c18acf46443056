package me.wargame.mcp.domain.system.toolloop;

import lombok.extern.slf4j.Slf4j;
import me.wargame.mcp.domain.model.ToolCall;
import me.wargame.mcp.domain.model.ToolResult;
import me.wargame.mcp.domain.service.CorrelationSupport;
import me.wargame.mcp.domain.service.ToolRegistry;
import org.slf4j.MDC;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs registry tools on a dedicated pool so the loop can bound and cancel
 * each call.
 */
@Slf4j
public class RegistryToolExecutorAdapter implements ToolExecutorPort {

    private final ToolRegistry registry;
    private final ExecutorService executor;

    public RegistryToolExecutorAdapter(ToolRegistry registry) {
        this.registry = registry;
        AtomicInteger threadNumber = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tool-call-" + threadNumber.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public Future<ToolResult> submit(ToolCall toolCall) {
        String correlationId = MDC.get(CorrelationSupport.MDC_KEY);
        return executor.submit(() -> {
            try (MDC.MDCCloseable ignored = CorrelationSupport.bind(correlationId)) {
                return registry.execute(toolCall.name(), toolCall.arguments()).get();
            }
        });
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[ToolLoop] Tool executor shut down");
    }
}
