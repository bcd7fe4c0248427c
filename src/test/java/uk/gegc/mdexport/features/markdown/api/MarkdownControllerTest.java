package uk.gegc.mdexport.features.markdown.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.mdexport.features.markdown.application.MarkdownConversionService;
import uk.gegc.mdexport.features.markdown.application.TableOfContentsBuilder;
import uk.gegc.mdexport.features.markdown.domain.ConvertedMarkdown;
import uk.gegc.mdexport.features.markdown.domain.DocumentMetadata;
import uk.gegc.mdexport.features.markdown.domain.HeadingEntry;

import java.util.List;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MarkdownController.class)
@DisplayName("MarkdownController Tests")
class MarkdownControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private MarkdownConversionService conversionService;

    @MockitoBean
    private TableOfContentsBuilder tocBuilder;

    @Test
    @DisplayName("POST /api/v1/markdown/render: returns html and metadata")
    void render_returnsHtmlAndMetadata() throws Exception {
        // Given
        List<HeadingEntry> headings = List.of(new HeadingEntry(1, "Title", "title"));
        when(conversionService.convert(anyString())).thenReturn(new ConvertedMarkdown(
                "<h1 id=\"title\">Title</h1>\n",
                List.of(),
                new DocumentMetadata(headings, 1, 1),
                false
        ));

        // When / Then
        mockMvc.perform(post("/api/v1/markdown/render")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"markdown": "# Title"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.html").value("<h1 id=\"title\">Title</h1>\n"))
                .andExpect(jsonPath("$.headings[0].id").value("title"))
                .andExpect(jsonPath("$.wordCount").value(1))
                .andExpect(jsonPath("$.readingTimeMinutes").value(1))
                .andExpect(jsonPath("$.degraded").value(false));

        verify(tocBuilder, never()).build(anyList());
    }

    @Test
    @DisplayName("POST /api/v1/markdown/render: prepends the table of contents when requested")
    void render_withToc() throws Exception {
        // Given
        List<HeadingEntry> headings = List.of(new HeadingEntry(1, "Title", "title"));
        when(conversionService.convert(anyString())).thenReturn(new ConvertedMarkdown(
                "<h1 id=\"title\">Title</h1>\n", List.of(), new DocumentMetadata(headings, 1, 1), false));
        when(tocBuilder.build(headings)).thenReturn("<nav class=\"table-of-contents\"></nav>\n");

        // When / Then
        mockMvc.perform(post("/api/v1/markdown/render")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"markdown": "# Title", "includeToc": true}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.html").value(startsWith("<nav class=\"table-of-contents\">")));
    }

    @Test
    @DisplayName("POST /api/v1/markdown/render: missing markdown returns 400 with field errors")
    void render_missingMarkdown_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/markdown/render")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Validation Failed"))
                .andExpect(jsonPath("$.fieldErrors[0].field").value("markdown"));
    }

    @Test
    @DisplayName("POST /api/v1/markdown/render: malformed JSON returns 400")
    void render_malformedJson_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/markdown/render")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"markdown\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Malformed JSON"));
    }
}
