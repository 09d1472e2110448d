package ch.so.arp.docchat.retrieval;

import static ch.so.arp.docchat.retrieval.RetrievalEngineTest.result;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import ch.so.arp.docchat.error.GlobalExceptionHandler;
import ch.so.arp.docchat.error.ValidationException;

class SearchControllerTest {

    private final RetrievalEngine retrievalEngine = mock(RetrievalEngine.class);
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SearchController(retrievalEngine))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void returnsRankedHits() throws Exception {
        when(retrievalEngine.search("remote work", 3)).thenReturn(List.of(result("doc-a", 1, 0.75d)));

        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"remote work\", \"limit\": 3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].chunkId").value("doc-a-c1"))
                .andExpect(jsonPath("$[0].documentId").value("doc-a"))
                .andExpect(jsonPath("$[0].category").value("politics"))
                .andExpect(jsonPath("$[0].similarityScore").value(0.75d));
    }

    @Test
    void usesDefaultLimitWhenNoneIsGiven() throws Exception {
        when(retrievalEngine.defaultLimit()).thenReturn(5);
        when(retrievalEngine.search("remote work", 5)).thenReturn(List.of());

        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"remote work\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void rejectsBlankQuery() throws Exception {
        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void mapsValidationErrorsOfTheEngine() throws Exception {
        when(retrievalEngine.search("x", 2)).thenThrow(new ValidationException("bad query"));

        mockMvc.perform(post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"x\", \"limit\": 2}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("bad query"));
    }
}
