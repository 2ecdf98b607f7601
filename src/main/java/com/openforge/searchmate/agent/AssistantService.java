package com.openforge.searchmate.agent;

import com.openforge.searchmate.llm.Fragments;
import com.openforge.searchmate.llm.ReasoningService;
import com.openforge.searchmate.llm.model.Message;
import com.openforge.searchmate.tool.CapabilityRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Front door for callers holding a whole conversation.
 *
 * chat() answers the latest user turn through the search pipeline, with the
 * earlier turns as history. It falls back to a plain conversational reply when
 * search is not configured or there is no usable user turn. search() always
 * means search, and says so when it is unavailable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssistantService {

    public static final String SEARCH_UNAVAILABLE_MESSAGE =
            "Search functionality requires a SerpAPI key. Please set SERPAPI_KEY and restart.";

    private final SearchAnswerService searchAnswerService;
    private final ReasoningService    reasoningService;
    private final CapabilityRegistry  capabilityRegistry;

    public boolean isSearchAvailable() {
        return !capabilityRegistry.isEmpty();
    }

    // ── Conversation ─────────────────────────────────────────────────────────

    public String chat(List<Message> conversation) {
        int latest = latestUserTurn(conversation);
        if (latest >= 0) {
            return searchAnswerService.answer(
                    conversation.get(latest).content(), conversation.subList(0, latest));
        }
        return reasoningService.answer(conversationContext(conversation));
    }

    public Stream<String> streamChat(List<Message> conversation) {
        int latest = latestUserTurn(conversation);
        if (latest >= 0) {
            return searchAnswerService.stream(
                    conversation.get(latest).content(), conversation.subList(0, latest));
        }
        return reasoningService.streamAnswer(conversationContext(conversation));
    }

    // ── Direct search ────────────────────────────────────────────────────────

    public String search(String query) {
        if (!isSearchAvailable()) {
            return SEARCH_UNAVAILABLE_MESSAGE;
        }
        return searchAnswerService.answer(query);
    }

    public Stream<String> streamSearch(String query) {
        if (!isSearchAvailable()) {
            return Fragments.single(SEARCH_UNAVAILABLE_MESSAGE);
        }
        return searchAnswerService.stream(query);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Index of the latest user turn when it can drive a search, else -1.
     */
    private int latestUserTurn(List<Message> conversation) {
        if (!isSearchAvailable()) {
            return -1;
        }
        for (int i = conversation.size() - 1; i >= 0; i--) {
            Message turn = conversation.get(i);
            if (turn.isUser()) {
                return turn.content() != null && !turn.content().isBlank() ? i : -1;
            }
        }
        return -1;
    }

    private List<Message> conversationContext(List<Message> conversation) {
        log.info("[Assistant] Answering from conversation only ({} turn(s))", conversation.size());
        List<Message> context = new ArrayList<>(conversation.size() + 1);
        context.add(Message.system(Prompts.CONVERSATION_SYSTEM_PROMPT));
        context.addAll(conversation);
        return context;
    }
}
