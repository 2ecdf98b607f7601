package com.openforge.searchmate.agent;

import com.openforge.searchmate.llm.Fragments;
import com.openforge.searchmate.llm.ReasoningResult;
import com.openforge.searchmate.llm.ReasoningService;
import com.openforge.searchmate.llm.model.Message;
import com.openforge.searchmate.llm.model.Tool;
import com.openforge.searchmate.tool.CapabilityRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Search-and-answer pipeline for a single user query.
 *
 *   BUILD_CONTEXT  system prompt + last MAX_HISTORY_TURNS of history + user turn
 *   DECIDE         blocking call with the registered tools declared
 *   ANSWERED       no tool needed: the decision text is the answer
 *   RESOLVE_TOOLS  assistant turn replaying the invocations, then one tool
 *                  turn per invocation id, in the same order
 *   FINALIZE       second call without tools, one-shot or streamed as asked
 *
 * One-shot and streamed output share buildContext() and resolveTools(); they
 * differ only in how the final call is made. A streamed answer that needed a
 * lookup yields TOOL_INDICATOR before any answer text.
 *
 * The service keeps no state between calls. The caller's history list is
 * copied, never modified.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchAnswerService {

    public static final int    MAX_HISTORY_TURNS   = 10;
    public static final String TOOL_INDICATOR      = "Searching the internet...\n\n";
    public static final String EMPTY_QUERY_MESSAGE = "Please enter a question so I can search for an answer.";

    private final ReasoningService   reasoningService;
    private final CapabilityRegistry capabilityRegistry;

    // ── One-shot ─────────────────────────────────────────────────────────────

    public String answer(String query) {
        return answer(query, List.of());
    }

    public String answer(String query, List<Message> history) {
        if (isBlank(query)) {
            return EMPTY_QUERY_MESSAGE;
        }
        List<Tool>    tools   = capabilityRegistry.listDefinitions();
        List<Message> context = buildContext(query, history, !tools.isEmpty());

        if (tools.isEmpty()) {
            log.info("[SearchAnswer] No capabilities registered, answering without search");
            return reasoningService.answer(context);
        }

        ReasoningResult result = reasoningService.decide(context, tools);
        if (result instanceof ReasoningResult.Decision decision) {
            return reasoningService.answer(resolveTools(context, decision));
        }
        log.info("[SearchAnswer] Answered without a tool call");
        return ((ReasoningResult.Answer) result).text();
    }

    // ── Incremental ──────────────────────────────────────────────────────────

    public Stream<String> stream(String query) {
        return stream(query, List.of());
    }

    /**
     * Streamed variant of {@link #answer(String, List)}. No call is made until
     * the first fragment is pulled; an LlmException surfaces from the pull that
     * hits it. Close the stream when abandoning it early.
     */
    public Stream<String> stream(String query, List<Message> history) {
        if (isBlank(query)) {
            return Fragments.single(EMPTY_QUERY_MESSAGE);
        }
        List<Tool>    tools   = capabilityRegistry.listDefinitions();
        List<Message> context = buildContext(query, history, !tools.isEmpty());

        if (tools.isEmpty()) {
            log.info("[SearchAnswer] No capabilities registered, streaming without search");
            return reasoningService.streamAnswer(context);
        }

        return reasoningService.streamWithTools(context, tools,
                decision -> Fragments.prefixed(TOOL_INDICATOR,
                        () -> reasoningService.streamAnswer(resolveTools(context, decision))));
    }

    // ── Pipeline steps ───────────────────────────────────────────────────────

    List<Message> buildContext(String query, List<Message> history, boolean searchEnabled) {
        List<Message> context = new ArrayList<>();
        context.add(Message.system(searchEnabled
                ? Prompts.SEARCH_SYSTEM_PROMPT
                : Prompts.CONVERSATION_SYSTEM_PROMPT));

        if (history != null && !history.isEmpty()) {
            int from = Math.max(0, history.size() - MAX_HISTORY_TURNS);
            context.addAll(history.subList(from, history.size()));
        }
        context.add(Message.user(query));
        log.debug("[SearchAnswer] Context built: {} turn(s), {} from history",
                context.size(), context.size() - 2);
        return context;
    }

    /**
     * Returns a new context: the given turns, the assistant turn carrying the
     * decision's invocations verbatim, then one tool turn per invocation.
     */
    List<Message> resolveTools(List<Message> context, ReasoningResult.Decision decision) {
        log.info("[SearchAnswer] Model requested {} tool call(s): {}", decision.invocations().size(),
                decision.invocations().stream().map(call -> call.name()).toList());

        Map<String, String> results = capabilityRegistry.executeAll(decision.invocations());

        List<Message> extended = new ArrayList<>(context);
        extended.add(Message.assistantToolCalls(decision.text(), decision.invocations()));
        decision.invocations().forEach(call ->
                extended.add(Message.toolResult(call.id(), results.get(call.id()))));
        return extended;
    }

    private static boolean isBlank(String query) {
        return query == null || query.isBlank();
    }
}
