package com.openforge.searchmate.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.searchmate.llm.model.ChatRequest;
import com.openforge.searchmate.llm.model.ChatResponse;
import com.openforge.searchmate.llm.model.Message;
import com.openforge.searchmate.llm.model.Tool;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

import java.net.http.HttpClient;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Client of the reasoning service, shaped the way the orchestrator needs it.
 *
 *   decide()          : blocking, tools declared: Answer or Decision
 *   answer()          : blocking, no tools: final text
 *   streamAnswer()    : incremental, no tools: fragment stream
 *   streamWithTools() : incremental front for a tool-capable call. Tools and
 *                       streaming never share one upstream request, so this
 *                       makes a blocking decision first and only streams once
 *                       nothing is left to resolve.
 *
 * Every call goes through the "reasoning" circuit breaker so a dead provider
 * fails fast. A streamed answer that breaks while being read is recorded
 * against the breaker as well. There is no retry: a failure is an
 * LlmException for the caller.
 */
@Slf4j
@Service
@EnableConfigurationProperties(LlmProperties.class)
public class ReasoningService {

    private final LlmClient      llmClient;
    private final CircuitBreaker circuitBreaker;

    @Autowired
    public ReasoningService(HttpClient httpClient,
                            ObjectMapper objectMapper,
                            LlmProperties properties,
                            CircuitBreaker reasoningCircuitBreaker) {
        this(new LlmClient(httpClient, objectMapper, properties), reasoningCircuitBreaker);
    }

    public ReasoningService(LlmClient llmClient, CircuitBreaker circuitBreaker) {
        this.llmClient      = llmClient;
        this.circuitBreaker = circuitBreaker;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Blocking call with the given tools declared. With no tools this can only
     * ever return an Answer.
     */
    public ReasoningResult decide(List<Message> turns, List<Tool> tools) {
        requireTurns(turns);
        ChatRequest request = tools == null || tools.isEmpty()
                ? ChatRequest.of(llmClient.modelName(), llmClient.temperature(), turns)
                : ChatRequest.withTools(llmClient.modelName(), llmClient.temperature(), turns, tools);

        ChatResponse response = guarded(() -> llmClient.chat(request));
        Message reply = response.firstMessage();

        if (request.declaresTools() && reply.hasToolCalls()) {
            log.debug("[Reasoning] Decision with {} invocation(s)", reply.toolCalls().size());
            return new ReasoningResult.Decision(reply.content(), reply.toolCalls());
        }
        return new ReasoningResult.Answer(reply.content());
    }

    /** One-shot answer, no tools declared. */
    public String answer(List<Message> turns) {
        return ((ReasoningResult.Answer) decide(turns, null)).text();
    }

    /** Incremental answer, no tools declared. The connection opens on first pull. */
    public Stream<String> streamAnswer(List<Message> turns) {
        requireTurns(turns);
        ChatRequest request = ChatRequest.of(llmClient.modelName(), llmClient.temperature(), turns);
        return Fragments.deferred(() -> {
            long started = System.nanoTime();
            return Fragments.observed(guarded(() -> llmClient.stream(request)),
                    failure -> circuitBreaker.onError(System.nanoTime() - started, TimeUnit.NANOSECONDS, failure));
        });
    }

    /**
     * Incremental answer with tools available.
     *
     * Nothing is sent until the first fragment is pulled. A direct Answer comes
     * back as a single fragment; a Decision is handed to {@code onDecision},
     * whose stream becomes the rest of the output.
     */
    public Stream<String> streamWithTools(List<Message> turns,
                                          List<Tool> tools,
                                          Function<ReasoningResult.Decision, Stream<String>> onDecision) {
        requireTurns(turns);
        return Fragments.deferred(() -> {
            ReasoningResult result = decide(turns, tools);
            if (result instanceof ReasoningResult.Decision decision) {
                return onDecision.apply(decision);
            }
            return Fragments.single(((ReasoningResult.Answer) result).text());
        });
    }

    public String modelName() {
        return llmClient.modelName();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private <T> T guarded(Supplier<T> call) {
        try {
            return circuitBreaker.executeSupplier(call);
        } catch (CallNotPermittedException e) {
            throw new LlmClient.LlmException(
                    "Provider [%s] is unavailable (circuit open)".formatted(llmClient.providerName()), e);
        }
    }

    private static void requireTurns(List<Message> turns) {
        if (turns == null || turns.isEmpty()) {
            throw new IllegalArgumentException("At least one turn is required");
        }
    }
}
