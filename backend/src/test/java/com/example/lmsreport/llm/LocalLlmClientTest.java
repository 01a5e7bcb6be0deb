package com.example.lmsreport.llm;

import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LocalLlmClientTest {

    private static final String HTML = "<html><script>var x = 1;</script><body><a href='/course/view.php?id=1'>Math</a></body></html>";

    private final ChatModel chatModel = mock(ChatModel.class);
    private final LocalLlmClient client = new LocalLlmClient(Optional.of(chatModel));

    @Test
    void extractCourses_parsesFencedJsonArray() {
        when(chatModel.chat(anyString())).thenReturn("""
                ```json
                [{"name": "Math", "url": "/course/view.php?id=1"}, {"name": "No url"}]
                ```
                """);

        List<LlmCourse> courses = client.extractCourses(HTML, "https://lms.example.edu", 1000);

        assertThat(courses).containsExactly(new LlmCourse("Math", "/course/view.php?id=1"));
    }

    @Test
    void extractCourses_malformedJsonIsEmpty() {
        when(chatModel.chat(anyString())).thenReturn("Here are the courses: Math, Physics");

        assertThat(client.extractCourses(HTML, "https://lms.example.edu", 1000)).isEmpty();
    }

    @Test
    void extractCourses_wrongShapeIsEmpty() {
        when(chatModel.chat(anyString())).thenReturn("{\"name\": \"Math\", \"url\": \"/course/view.php?id=1\"}");

        assertThat(client.extractCourses(HTML, "https://lms.example.edu", 1000)).isEmpty();
    }

    @Test
    void extractCourses_modelFailureIsEmpty() {
        when(chatModel.chat(anyString())).thenThrow(new RuntimeException("connection refused"));

        assertThat(client.extractCourses(HTML, "https://lms.example.edu", 1000)).isEmpty();
    }

    @Test
    void classifyCoursePage_requiresBooleanIsCourse() {
        when(chatModel.chat(anyString())).thenReturn("{\"is_course\": true, \"course_name\": \"Biology\"}");
        assertThat(client.classifyCoursePage(HTML, "https://lms.example.edu/x", 1000))
                .contains(new CoursePageClassification(true, "Biology"));

        when(chatModel.chat(anyString())).thenReturn("{\"is_course\": \"yes\"}");
        assertThat(client.classifyCoursePage(HTML, "https://lms.example.edu/x", 1000)).isEmpty();
    }

    @Test
    void extractAssignments_dropsEntriesWithoutTitleOrUrl() {
        when(chatModel.chat(anyString())).thenReturn("""
                [{"title": "Essay", "due_date": "2026-03-20", "url": "/mod/assign/view.php?id=3", "type": "assignment"},
                 {"title": "", "url": "/mod/quiz/view.php?id=4"},
                 {"title": "Orphan"}]
                """);

        List<LlmAssignment> assignments = client.extractAssignments(HTML, "Biology", "https://lms.example.edu/course/view.php?id=1", 1000);

        assertThat(assignments).containsExactly(
                new LlmAssignment("Essay", "2026-03-20", "/mod/assign/view.php?id=3", "assignment"));
    }

    @Test
    void unavailableClientReturnsEmptyResults() {
        LocalLlmClient unavailable = new LocalLlmClient(Optional.empty());

        assertThat(unavailable.isAvailable()).isFalse();
        assertThat(unavailable.extractCourses(HTML, "https://lms.example.edu", 1000)).isEmpty();
        assertThat(unavailable.classifyCoursePage(HTML, "https://lms.example.edu", 1000)).isEmpty();
        assertThat(unavailable.extractAssignments(HTML, "Biology", "https://lms.example.edu", 1000)).isEmpty();
    }

    @Test
    void stripCodeFence_removesMarkdownFence() {
        assertThat(LocalLlmClient.stripCodeFence("```json\n[1]\n```")).isEqualTo("[1]");
        assertThat(LocalLlmClient.stripCodeFence("[1]")).isEqualTo("[1]");
        assertThat(LocalLlmClient.stripCodeFence(null)).isEmpty();
    }
}
