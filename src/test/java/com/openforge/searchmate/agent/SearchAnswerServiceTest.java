package com.openforge.searchmate.agent;

import com.openforge.searchmate.llm.LlmClient;
import com.openforge.searchmate.llm.ReasoningService;
import com.openforge.searchmate.llm.model.ChatRequest;
import com.openforge.searchmate.llm.model.ChatResponse;
import com.openforge.searchmate.llm.model.Message;
import com.openforge.searchmate.llm.model.Tool;
import com.openforge.searchmate.llm.model.ToolCall;
import com.openforge.searchmate.llm.model.ToolFunction;
import com.openforge.searchmate.tool.CapabilityRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SearchAnswerServiceTest {

    private static final List<Tool> TOOLS = List.of(
            Tool.ofFunction(new ToolFunction("search_internet", "search the web", null)));
    private static final ToolCall SEARCH_JAVA =
            ToolCall.function("call_1", "search_internet", "{\"query\":\"java release\"}");
    private static final ToolCall SEARCH_NEWS =
            ToolCall.function("call_2", "search_internet", "{\"query\":\"jdk\",\"search_type\":\"news\"}");

    private LlmClient llmClient;
    private CapabilityRegistry registry;
    private SearchAnswerService service;

    @BeforeEach
    void setUp() {
        llmClient = mock(LlmClient.class);
        when(llmClient.modelName()).thenReturn("gpt-test");
        when(llmClient.temperature()).thenReturn(0.0);
        when(llmClient.providerName()).thenReturn("test");
        registry = mock(CapabilityRegistry.class);
        when(registry.listDefinitions()).thenReturn(TOOLS);
        service = new SearchAnswerService(new ReasoningService(llmClient, CircuitBreaker.ofDefaults("test")), registry);
    }

    @Test
    void shouldShortCircuitBlankQuery() {
        assertEquals(SearchAnswerService.EMPTY_QUERY_MESSAGE, service.answer("   "));
        assertEquals(List.of(SearchAnswerService.EMPTY_QUERY_MESSAGE), service.stream(null).toList());

        verifyNoInteractions(registry);
        verify(llmClient, never()).chat(any());
        verify(llmClient, never()).stream(any());
    }

    @Test
    void shouldKeepOnlyLatestHistoryTurns() {
        List<Message> history = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            history.add(i % 2 == 0 ? Message.user("q" + i) : Message.assistant("a" + i));
        }

        List<Message> context = service.buildContext("latest", history, true);

        assertEquals(12, context.size());
        assertEquals(Message.ROLE_SYSTEM, context.get(0).role());
        assertEquals(Prompts.SEARCH_SYSTEM_PROMPT, context.get(0).content());
        assertEquals("a5", context.get(1).content());
        assertEquals("q14", context.get(10).content());
        assertEquals(Message.user("latest"), context.get(11));
        assertEquals(15, history.size());
    }

    @Test
    void shouldAnswerDirectlyWhenNoToolRequested() {
        when(llmClient.chat(any())).thenReturn(reply(Message.assistant("Paris.")));

        assertEquals("Paris.", service.answer("Capital of France?"));

        verify(llmClient, times(1)).chat(any());
        verify(registry, never()).executeAll(any());
    }

    @Test
    void shouldResolveToolsAndFinalizeWithoutTools() {
        when(llmClient.chat(any())).thenReturn(
                reply(Message.assistantToolCalls(null, List.of(SEARCH_JAVA, SEARCH_NEWS))),
                reply(Message.assistant("Java 23 shipped in September.")));
        when(registry.executeAll(List.of(SEARCH_JAVA, SEARCH_NEWS))).thenReturn(results());

        List<Message> history = List.of(Message.user("hi"), Message.assistant("hello"));
        String answer = service.answer("Latest Java?", history);

        assertEquals("Java 23 shipped in September.", answer);

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(llmClient, times(2)).chat(captor.capture());
        ChatRequest decide = captor.getAllValues().get(0);
        ChatRequest finalize = captor.getAllValues().get(1);

        assertTrue(decide.declaresTools());
        assertFalse(finalize.declaresTools());

        List<Message> turns = finalize.messages();
        assertEquals(7, turns.size());
        assertEquals(Message.ROLE_SYSTEM, turns.get(0).role());
        assertEquals("hi", turns.get(1).content());
        assertEquals("hello", turns.get(2).content());
        assertEquals(Message.user("Latest Java?"), turns.get(3));
        assertEquals(Message.ROLE_ASSISTANT, turns.get(4).role());
        assertNull(turns.get(4).content());
        assertEquals(List.of(SEARCH_JAVA, SEARCH_NEWS), turns.get(4).toolCalls());
        assertEquals(Message.toolResult("call_1", "{\"results\":[1]}"), turns.get(5));
        assertEquals(Message.toolResult("call_2", "{\"results\":[2]}"), turns.get(6));
    }

    @Test
    void shouldAnswerWithoutSearchWhenNoCapabilities() {
        when(registry.listDefinitions()).thenReturn(List.of());
        when(llmClient.chat(any())).thenReturn(reply(Message.assistant("From memory.")));

        assertEquals("From memory.", service.answer("Who wrote Dune?"));

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(llmClient).chat(captor.capture());
        assertFalse(captor.getValue().declaresTools());
        assertEquals(Prompts.CONVERSATION_SYSTEM_PROMPT, captor.getValue().messages().get(0).content());
    }

    @Test
    void shouldYieldIndicatorBeforeAnswerFragments() {
        when(llmClient.chat(any())).thenReturn(reply(Message.assistantToolCalls(null, List.of(SEARCH_JAVA))));
        when(registry.executeAll(List.of(SEARCH_JAVA))).thenReturn(Map.of("call_1", "{\"results\":[1]}"));
        when(llmClient.stream(any())).thenReturn(Stream.of("Java ", "23."));

        Stream<String> fragments = service.stream("Latest Java?");
        verify(llmClient, never()).chat(any());

        Iterator<String> iterator = fragments.iterator();
        assertEquals(SearchAnswerService.TOOL_INDICATOR, iterator.next());
        verify(llmClient, never()).stream(any());

        assertEquals("Java ", iterator.next());
        assertEquals("23.", iterator.next());
        assertFalse(iterator.hasNext());

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(llmClient).stream(captor.capture());
        List<Message> turns = captor.getValue().messages();
        assertEquals(Message.toolResult("call_1", "{\"results\":[1]}"), turns.get(turns.size() - 1));
    }

    @Test
    void shouldStreamDirectAnswerWithoutIndicator() {
        when(llmClient.chat(any())).thenReturn(reply(Message.assistant("Paris.")));

        assertEquals(List.of("Paris."), service.stream("Capital of France?").toList());
        verify(llmClient, never()).stream(any());
    }

    @Test
    void shouldProduceSameTextInBothModes() {
        when(llmClient.chat(any())).thenReturn(
                reply(Message.assistantToolCalls(null, List.of(SEARCH_JAVA))),
                reply(Message.assistant("Java 23 shipped.")),
                reply(Message.assistantToolCalls(null, List.of(SEARCH_JAVA))));
        when(registry.executeAll(List.of(SEARCH_JAVA))).thenReturn(Map.of("call_1", "{}"));
        when(llmClient.stream(any())).thenReturn(Stream.of("Java ", "23 ", "shipped."));

        String oneShot = service.answer("Latest Java?");
        String streamed = service.stream("Latest Java?").collect(Collectors.joining());

        assertEquals(SearchAnswerService.TOOL_INDICATOR + oneShot, streamed);
    }

    @Test
    void shouldSurfaceFailureOnPullNotOnCreation() {
        when(llmClient.chat(any())).thenThrow(new LlmClient.LlmException("provider down"));

        Stream<String> fragments = service.stream("anything");

        assertThrows(LlmClient.LlmException.class, () -> fragments.iterator().next());
    }

    private static Map<String, String> results() {
        Map<String, String> results = new LinkedHashMap<>();
        results.put("call_1", "{\"results\":[1]}");
        results.put("call_2", "{\"results\":[2]}");
        return results;
    }

    private static ChatResponse reply(Message message) {
        return new ChatResponse("r", "gpt-test", List.of(new ChatResponse.Choice(0, message, "stop")), null);
    }
}
