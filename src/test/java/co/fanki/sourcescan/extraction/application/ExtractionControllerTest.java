package co.fanki.sourcescan.extraction.application;

import co.fanki.sourcescan.extraction.domain.SourceExtractor;
import co.fanki.sourcescan.extraction.domain.python.NativePythonFrontEnd;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for {@link ExtractionController}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ExtractionControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        final ExtractionService service = new ExtractionService(
                new SourceExtractor(new NativePythonFrontEnd()),
                new ObjectMapper(), 2);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ExtractionController(service))
                .build();
    }

    @Test
    void whenPostingSource_givenValidProgram_shouldAnswerEnvelope()
            throws Exception {
        mockMvc.perform(post("/api/extractions")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("from pkg.storage import upload\n"
                                + "upload(bucket='b', source='/tmp/x')\n"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.language").value("python"))
                .andExpect(jsonPath("$.imports[0].module")
                        .value("pkg.storage"))
                .andExpect(jsonPath("$.calls[0].function").value("upload"))
                .andExpect(jsonPath("$.calls[0].arguments.bucket.kind")
                        .value("string"))
                .andExpect(jsonPath("$.calls[0].arguments.bucket.value")
                        .value("b"))
                .andExpect(jsonPath("$.calls[0].module").doesNotExist())
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void whenPostingSource_givenSyntaxError_shouldAnswerOkWithFailure()
            throws Exception {
        mockMvc.perform(post("/api/extractions")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("upload(bucket='b'\nprint(1)\n"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.type").value("SyntaxFault"))
                .andExpect(jsonPath("$.error.line").value(1))
                .andExpect(jsonPath("$.imports").doesNotExist())
                .andExpect(jsonPath("$.language").doesNotExist());
    }

    @Test
    void whenPostingSource_givenEmptyBody_shouldTreatItAsEmptyModule()
            throws Exception {
        mockMvc.perform(post("/api/extractions")
                        .contentType(MediaType.TEXT_PLAIN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.calls", hasSize(0)))
                .andExpect(jsonPath("$.sourceCode").value(""));
    }

    @Test
    void whenPostingBatch_givenTwoSources_shouldAnswerInOrder()
            throws Exception {
        mockMvc.perform(post("/api/extractions/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[\"f(g(1))\\n\", \"x = (\\n\"]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].calls", hasSize(2)))
                .andExpect(jsonPath("$[0].calls[1].function").value("g"))
                .andExpect(jsonPath("$[1].success").value(false));
    }

    @Test
    void whenPostingBatch_givenNullSource_shouldAnswerBadRequest()
            throws Exception {
        mockMvc.perform(post("/api/extractions/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[\"f()\\n\", null]"))
                .andExpect(status().isBadRequest());
    }
}
