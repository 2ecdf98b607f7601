package com.openforge.searchmate.api;

import com.openforge.searchmate.agent.AssistantService;
import com.openforge.searchmate.agent.SearchAnswerService;
import com.openforge.searchmate.api.dto.AnswerResponse;
import com.openforge.searchmate.api.dto.AskRequest;
import com.openforge.searchmate.api.dto.ConversationRequest;
import com.openforge.searchmate.llm.LlmClient;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.stream.Stream;

/**
 * HTTP surface of the assistant.
 *
 * Endpoints:
 *   POST /api/assistant/ask           : search-and-answer for one query (+ optional history)
 *   POST /api/assistant/ask/stream    : same, streamed as text/plain
 *   POST /api/assistant/search        : explicit search; says so when search is unavailable
 *   POST /api/assistant/search/stream : same, streamed
 *   POST /api/assistant/chat          : answer the latest user turn of a conversation
 *   POST /api/assistant/chat/stream   : same, streamed
 *
 * The server does not store conversations. Clients send the turns they want
 * considered and persist the answer themselves.
 */
@Slf4j
@RestController
@RequestMapping("/api/assistant")
@RequiredArgsConstructor
public class AssistantController {

    private static final MediaType TEXT_UTF8 = new MediaType("text", "plain", StandardCharsets.UTF_8);

    private final SearchAnswerService searchAnswerService;
    private final AssistantService    assistantService;

    @PostMapping("/ask")
    public AnswerResponse ask(@Valid @RequestBody AskRequest request) {
        return answered(searchAnswerService.answer(request.query(), request.historyMessages()));
    }

    @PostMapping("/ask/stream")
    public ResponseEntity<StreamingResponseBody> askStream(@Valid @RequestBody AskRequest request) {
        return streamed(searchAnswerService.stream(request.query(), request.historyMessages()));
    }

    @PostMapping("/search")
    public AnswerResponse search(@Valid @RequestBody AskRequest request) {
        return answered(assistantService.search(request.query()));
    }

    @PostMapping("/search/stream")
    public ResponseEntity<StreamingResponseBody> searchStream(@Valid @RequestBody AskRequest request) {
        return streamed(assistantService.streamSearch(request.query()));
    }

    @PostMapping("/chat")
    public AnswerResponse chat(@Valid @RequestBody ConversationRequest request) {
        return answered(assistantService.chat(request.toMessages()));
    }

    @PostMapping("/chat/stream")
    public ResponseEntity<StreamingResponseBody> chatStream(@Valid @RequestBody ConversationRequest request) {
        return streamed(assistantService.streamChat(request.toMessages()));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private AnswerResponse answered(String answer) {
        return new AnswerResponse(answer, assistantService.isSearchAvailable());
    }

    /**
     * Writes fragments as they are pulled, flushing after each one. The
     * fragment stream is closed when writing ends, also on failure or when the
     * client goes away.
     */
    private ResponseEntity<StreamingResponseBody> streamed(Stream<String> fragments) {
        StreamingResponseBody body = out -> {
            try (Stream<String> source = fragments) {
                Iterator<String> iterator = source.iterator();
                while (iterator.hasNext()) {
                    out.write(iterator.next().getBytes(StandardCharsets.UTF_8));
                    out.flush();
                }
            } catch (LlmClient.LlmException e) {
                log.warn("[API] Reasoning service failed mid-stream: {}", e.getMessage());
                throw e;
            }
        };
        return ResponseEntity.ok().contentType(TEXT_UTF8).body(body);
    }
}
