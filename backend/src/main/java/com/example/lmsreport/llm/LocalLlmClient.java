package com.example.lmsreport.llm;

import com.example.lmsreport.extraction.HtmlSnapshots;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import dev.langchain4j.model.chat.ChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * ローカルLLM (Ollama) への問い合わせを担当するクライアント。
 * ChatModelが登録されていない場合は利用不可として、全メソッドが空の結果を返す。
 * 応答のJSONが壊れている・形が違う場合も空の結果として扱い、例外は投げない。
 */
@Component
public class LocalLlmClient {

    private static final Logger log = LoggerFactory.getLogger(LocalLlmClient.class);

    private static final Pattern LEADING_FENCE = Pattern.compile("^```\\w*\\s*");
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```\\s*$");

    private final ChatModel chatModel;

    public LocalLlmClient(Optional<ChatModel> chatModel) {
        this.chatModel = chatModel.orElse(null);
    }

    public boolean isAvailable() {
        return chatModel != null;
    }

    /**
     * 「マイコース」ページのHTMLからコース一覧を抽出します。
     * @param html ページのHTML (script/styleは内部で除去)
     * @param baseUrl 相対URLの基準
     * @param maxChars プロンプトに含めるHTMLの上限文字数
     */
    public List<LlmCourse> extractCourses(String html, String baseUrl, int maxChars) {
        if (!isAvailable() || html == null || html.isBlank()) {
            return List.of();
        }
        String prompt = LlmPrompts.COURSE_LIST.formatted(baseUrl, baseUrl, HtmlSnapshots.stripAndTruncate(html, maxChars));
        Optional<JsonArray> array = parseArray(complete(prompt));
        if (array.isEmpty()) {
            return List.of();
        }
        List<LlmCourse> courses = new ArrayList<>();
        for (JsonElement element : array.get()) {
            if (!element.isJsonObject()) continue;
            JsonObject obj = element.getAsJsonObject();
            String url = stringField(obj, "url");
            if (url.isEmpty()) continue;
            courses.add(new LlmCourse(stringField(obj, "name"), url));
        }
        return courses;
    }

    /**
     * 訪問したページがコースページかどうかを判定します。
     * @return 判定できなかった場合は空
     */
    public Optional<CoursePageClassification> classifyCoursePage(String html, String url, int maxChars) {
        if (!isAvailable() || html == null || html.isBlank()) {
            return Optional.empty();
        }
        String prompt = LlmPrompts.COURSE_PAGE.formatted(url, HtmlSnapshots.stripAndTruncate(html, maxChars));
        String response = stripCodeFence(complete(prompt));
        if (response.isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonElement element = JsonParser.parseString(response);
            if (!element.isJsonObject()) {
                return Optional.empty();
            }
            JsonObject obj = element.getAsJsonObject();
            JsonElement isCourse = obj.get("is_course");
            if (isCourse == null || !isCourse.isJsonPrimitive() || !isCourse.getAsJsonPrimitive().isBoolean()) {
                return Optional.empty();
            }
            return Optional.of(new CoursePageClassification(isCourse.getAsBoolean(), stringField(obj, "course_name")));
        } catch (JsonParseException | IllegalStateException e) {
            log.debug("コース判定の応答をJSONとして解析できませんでした: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * コースページのHTMLから課題を抽出します。
     */
    public List<LlmAssignment> extractAssignments(String html, String courseName, String courseUrl, int maxChars) {
        if (!isAvailable() || html == null || html.isBlank()) {
            return List.of();
        }
        String prompt = LlmPrompts.ASSIGNMENTS.formatted(courseName, courseUrl, HtmlSnapshots.stripAndTruncate(html, maxChars));
        Optional<JsonArray> array = parseArray(complete(prompt));
        if (array.isEmpty()) {
            return List.of();
        }
        List<LlmAssignment> assignments = new ArrayList<>();
        for (JsonElement element : array.get()) {
            if (!element.isJsonObject()) continue;
            JsonObject obj = element.getAsJsonObject();
            String title = stringField(obj, "title");
            String url = stringField(obj, "url");
            if (title.isEmpty() || url.isEmpty()) continue;
            assignments.add(new LlmAssignment(title, stringField(obj, "due_date"), url, stringField(obj, "type")));
        }
        return assignments;
    }

    String complete(String prompt) {
        try {
            String response = chatModel.chat(prompt);
            return response == null ? "" : response.trim();
        } catch (Exception e) {
            log.warn("LLMの呼び出しに失敗しました: {}", e.getMessage());
            return "";
        }
    }

    private Optional<JsonArray> parseArray(String response) {
        String cleaned = stripCodeFence(response);
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonElement element = JsonParser.parseString(cleaned);
            return element.isJsonArray() ? Optional.of(element.getAsJsonArray()) : Optional.empty();
        } catch (JsonParseException e) {
            log.debug("LLMの応答をJSON配列として解析できませんでした: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static String stripCodeFence(String response) {
        if (response == null) return "";
        String out = LEADING_FENCE.matcher(response.trim()).replaceFirst("");
        return TRAILING_FENCE.matcher(out).replaceFirst("").trim();
    }

    private static String stringField(JsonObject obj, String key) {
        JsonElement value = obj.get(key);
        if (value == null || value.isJsonNull() || !value.isJsonPrimitive()) {
            return "";
        }
        return value.getAsString().trim();
    }
}
