package com.openforge.searchmate.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.searchmate.llm.model.Tool;
import com.openforge.searchmate.llm.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Name → Capability lookup plus the dispatcher for tool calls.
 *
 * Dispatch never throws. An unknown name, an undecodable argument string or
 * an exception from the capability becomes a JSON error payload, and that
 * payload is the tool turn's content, so the model can correct itself on
 * the next call.
 *
 * Capabilities are registered while the application starts and only read
 * afterwards.
 */
@Slf4j
public class CapabilityRegistry {

    private final Map<String, Capability> capabilities = new ConcurrentHashMap<>();
    private final List<String>            order        = new CopyOnWriteArrayList<>();
    private final ObjectMapper            objectMapper;
    private final ExecutorService         executor;

    public CapabilityRegistry(ObjectMapper objectMapper, ExecutorService capabilityExecutor) {
        this.objectMapper = objectMapper;
        this.executor     = capabilityExecutor;
    }

    // ── Registration ─────────────────────────────────────────────────────────

    public synchronized void register(Capability capability) {
        String name = capability.name();
        if (capabilities.put(name, capability) != null) {
            log.warn("[Registry] Capability '{}' registered twice; keeping the newer one", name);
        } else {
            order.add(name);
        }
        log.info("[Registry] Registered capability '{}'", name);
    }

    /** Wire-form definitions, in registration order, as offered to the model. */
    public List<Tool> listDefinitions() {
        return order.stream()
                .map(name -> Tool.ofFunction(capabilities.get(name).definition()))
                .toList();
    }

    public Set<String> names() {
        return Set.copyOf(order);
    }

    public boolean isEmpty() {
        return capabilities.isEmpty();
    }

    // ── Dispatch ─────────────────────────────────────────────────────────────

    public String execute(ToolCall invocation) {
        String name = invocation.name();
        Capability capability = name == null ? null : capabilities.get(name);
        if (capability == null) {
            log.warn("[Registry] Unknown tool requested: {}", name);
            return ToolErrors.unknownTool(objectMapper, name, List.copyOf(order));
        }

        String rawArguments = invocation.arguments();
        JsonNode arguments;
        try {
            arguments = decode(rawArguments);
        } catch (JsonProcessingException e) {
            log.warn("[Registry] Undecodable arguments for '{}': {}", name, rawArguments);
            return ToolErrors.invalidArguments(objectMapper, e.getOriginalMessage(), rawArguments);
        }

        log.info("[Registry] Executing tool '{}' id={} args={}", name, invocation.id(), rawArguments);
        try {
            return capability.execute(arguments);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) { // any other failure is reported to the model, not the caller
            log.error("[Registry] Tool '{}' failed: {}", name, e.getMessage(), e);
            return ToolErrors.executionFailed(objectMapper, name, describe(e));
        }
    }

    /**
     * Executes every invocation and maps each id to its result, in input order.
     * More than one invocation runs on the capability executor.
     */
    public Map<String, String> executeAll(List<ToolCall> invocations) {
        Map<String, String> results = new LinkedHashMap<>();
        if (invocations.size() == 1) {
            ToolCall only = invocations.get(0);
            results.put(only.id(), execute(only));
            return results;
        }

        Map<ToolCall, CompletableFuture<String>> pending = new LinkedHashMap<>();
        for (ToolCall invocation : invocations) {
            pending.put(invocation, submit(invocation));
        }
        pending.forEach((invocation, future) -> results.put(invocation.id(), future.join()));
        return results;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private CompletableFuture<String> submit(ToolCall invocation) {
        try {
            return CompletableFuture.supplyAsync(() -> execute(invocation), executor);
        } catch (RejectedExecutionException e) {
            log.warn("[Registry] Executor rejected tool '{}', running inline", invocation.name());
            return CompletableFuture.completedFuture(execute(invocation));
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private JsonNode decode(String rawArguments) throws JsonProcessingException {
        if (rawArguments == null || rawArguments.isBlank()) {
            return objectMapper.createObjectNode();
        }
        JsonNode node = objectMapper.readTree(rawArguments);
        if (!node.isObject()) {
            throw new ArgumentsNotAnObjectException(node.getNodeType().name().toLowerCase());
        }
        return node;
    }

    private static final class ArgumentsNotAnObjectException extends JsonProcessingException {
        private ArgumentsNotAnObjectException(String nodeType) {
            super("expected a JSON object but got " + nodeType);
        }
    }
}
