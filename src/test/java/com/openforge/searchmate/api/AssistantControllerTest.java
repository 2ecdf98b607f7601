package com.openforge.searchmate.api;

import com.openforge.searchmate.agent.AssistantService;
import com.openforge.searchmate.agent.SearchAnswerService;
import com.openforge.searchmate.llm.LlmClient;
import com.openforge.searchmate.llm.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.stream.Stream;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AssistantControllerTest {

    private SearchAnswerService searchAnswerService;
    private AssistantService assistantService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        searchAnswerService = mock(SearchAnswerService.class);
        assistantService = mock(AssistantService.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new AssistantController(searchAnswerService, assistantService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void shouldAnswerQueryWithHistory() throws Exception {
        when(assistantService.isSearchAvailable()).thenReturn(true);
        when(searchAnswerService.answer("And in 2023?",
                List.of(Message.user("Who won in 2022?"), Message.assistant("Argentina."))))
                .thenReturn("Nobody, it is held every four years.");

        mockMvc.perform(post("/api/assistant/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"query":"And in 2023?","history":[
                                  {"role":"user","content":"Who won in 2022?"},
                                  {"role":"assistant","content":"Argentina."}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Nobody, it is held every four years."))
                .andExpect(jsonPath("$.searchAvailable").value(true));
    }

    @Test
    void shouldStreamAnswerAsPlainText() throws Exception {
        when(searchAnswerService.stream(anyString(), anyList()))
                .thenReturn(Stream.of(SearchAnswerService.TOOL_INDICATOR, "Java ", "23."));

        MvcResult pending = mockMvc.perform(post("/api/assistant/ask/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"Latest Java?\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(content().string(SearchAnswerService.TOOL_INDICATOR + "Java 23."));
    }

    @Test
    void shouldRouteChatThroughAssistant() throws Exception {
        when(assistantService.chat(List.of(Message.user("Hi")))).thenReturn("Hello!");

        mockMvc.perform(post("/api/assistant/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messages\":[{\"role\":\"user\",\"content\":\"Hi\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Hello!"));
    }

    @Test
    void shouldReturnUnavailableMessageFromSearch() throws Exception {
        when(assistantService.search("weather")).thenReturn(AssistantService.SEARCH_UNAVAILABLE_MESSAGE);

        mockMvc.perform(post("/api/assistant/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"weather\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value(AssistantService.SEARCH_UNAVAILABLE_MESSAGE))
                .andExpect(jsonPath("$.searchAvailable").value(false));
    }

    @Test
    void shouldRejectEmptyConversation() throws Exception {
        mockMvc.perform(post("/api/assistant/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messages\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));

        verifyNoInteractions(assistantService);
    }

    @Test
    void shouldRejectToolRoleInHistory() throws Exception {
        mockMvc.perform(post("/api/assistant/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messages\":[{\"role\":\"tool\",\"content\":\"{}\"}]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldMapProviderFailureToBadGateway() throws Exception {
        when(searchAnswerService.answer(anyString(), anyList()))
                .thenThrow(new LlmClient.LlmException("Provider [openai] returned HTTP 500: boom"));

        mockMvc.perform(post("/api/assistant/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"q\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.status").value(502))
                .andExpect(jsonPath("$.message").value("Provider [openai] returned HTTP 500: boom"));
    }

    @Test
    void shouldMapRateLimitToTooManyRequests() throws Exception {
        when(assistantService.chat(any()))
                .thenThrow(new LlmClient.LlmRateLimitException("Rate-limited by provider [openai]."));

        mockMvc.perform(post("/api/assistant/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messages\":[{\"role\":\"user\",\"content\":\"Hi\"}]}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.status").value(429));
    }

    @Test
    void shouldPassBlankQueryThrough() throws Exception {
        when(searchAnswerService.answer("", List.of())).thenReturn(SearchAnswerService.EMPTY_QUERY_MESSAGE);

        mockMvc.perform(post("/api/assistant/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value(SearchAnswerService.EMPTY_QUERY_MESSAGE));

        verify(searchAnswerService).answer("", List.of());
    }
}
