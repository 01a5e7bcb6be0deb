package com.example.lmsreport.pipeline;

import com.example.lmsreport.classify.ClassificationResult;
import com.example.lmsreport.dto.Assignment;
import com.example.lmsreport.dto.Course;
import com.example.lmsreport.dto.SessionCookie;

import java.util.ArrayList;
import java.util.List;

/**
 * 1回の実行の間だけ存在するパイプラインの状態。
 * 不変で、ステージの結果は apply() で新しいインスタンスとして合成される。
 * errors は追記のみで、どのステージも消去しない。
 */
public record PipelineState(
    boolean authenticated,
    List<SessionCookie> sessionCookies,
    List<Course> courses,
    List<Assignment> assignments,
    ClassificationResult classification,
    List<String> errors,
    String reportPath
) {
    public PipelineState {
        sessionCookies = sessionCookies == null ? List.of() : List.copyOf(sessionCookies);
        courses = courses == null ? List.of() : List.copyOf(courses);
        assignments = assignments == null ? List.of() : List.copyOf(assignments);
        classification = classification == null ? ClassificationResult.empty() : classification;
        errors = errors == null ? List.of() : List.copyOf(errors);
        reportPath = reportPath == null ? "" : reportPath;
    }

    public static PipelineState initial() {
        return new PipelineState(false, List.of(), List.of(), List.of(), ClassificationResult.empty(), List.of(), "");
    }

    public PipelineState apply(StateUpdate update) {
        List<String> mergedErrors = errors;
        if (!update.errors().isEmpty()) {
            mergedErrors = new ArrayList<>(errors);
            mergedErrors.addAll(update.errors());
        }
        return new PipelineState(
                update.authenticated() != null ? update.authenticated() : authenticated,
                update.sessionCookies() != null ? update.sessionCookies() : sessionCookies,
                update.courses() != null ? update.courses() : courses,
                update.assignments() != null ? update.assignments() : assignments,
                update.classification() != null ? update.classification() : classification,
                mergedErrors,
                update.reportPath() != null ? update.reportPath() : reportPath);
    }

    // Cookieの値はログに出さない
    @Override
    public String toString() {
        return "PipelineState[authenticated=" + authenticated + ", cookies=" + sessionCookies.size()
                + ", courses=" + courses.size() + ", assignments=" + assignments.size()
                + ", errors=" + errors.size() + ", reportPath=" + reportPath + "]";
    }
}
