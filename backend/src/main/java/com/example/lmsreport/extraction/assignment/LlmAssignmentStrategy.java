package com.example.lmsreport.extraction.assignment;

import com.example.lmsreport.dto.Assignment;
import com.example.lmsreport.dto.AssignmentType;
import com.example.lmsreport.extraction.ExtractionStrategy;
import com.example.lmsreport.extraction.UrlNormalizer;
import com.example.lmsreport.llm.LlmAssignment;
import com.example.lmsreport.llm.LocalLlmClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * コースページのHTMLをローカルLLMに渡し、課題を抽出させる。
 * 種別はLLMの回答ではなくURLのキーワードから決める (不明なら assignment)。
 */
public class LlmAssignmentStrategy implements ExtractionStrategy<CoursePage, Assignment> {

    public static final String NAME = "llm";

    static final int DEFAULT_MAX_CHARS = 18_000;

    private final LocalLlmClient llmClient;
    private final int maxChars;

    public LlmAssignmentStrategy(LocalLlmClient llmClient) {
        this(llmClient, DEFAULT_MAX_CHARS);
    }

    public LlmAssignmentStrategy(LocalLlmClient llmClient, int maxChars) {
        this.llmClient = llmClient;
        this.maxChars = maxChars;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Assignment> extract(CoursePage input) {
        if (input == null || input.page() == null || input.page().isBlank() || !llmClient.isAvailable()) {
            return List.of();
        }
        String courseUrl = input.page().url();
        List<Assignment> assignments = new ArrayList<>();
        for (LlmAssignment candidate : llmClient.extractAssignments(
                input.page().html(), input.course().name(), courseUrl, maxChars)) {
            Optional<String> url = UrlNormalizer.toAbsolute(courseUrl, candidate.url());
            if (url.isEmpty()) {
                continue;
            }
            assignments.add(Assignment.extracted(
                    candidate.title(),
                    candidate.dueDate(),
                    input.course().name(),
                    AssignmentType.fromUrl(url.get(), AssignmentType.ASSIGNMENT),
                    url.get(),
                    "Main",
                    null));
        }
        return assignments;
    }
}
