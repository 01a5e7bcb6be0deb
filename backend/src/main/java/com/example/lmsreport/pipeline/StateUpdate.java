package com.example.lmsreport.pipeline;

import com.example.lmsreport.classify.ClassificationResult;
import com.example.lmsreport.dto.Assignment;
import com.example.lmsreport.dto.Course;
import com.example.lmsreport.dto.SessionCookie;

import java.util.ArrayList;
import java.util.List;

/**
 * 1つのステージが返す部分更新。null のフィールドは「変更なし」を意味する。
 * errors は既存の一覧に追記される。
 */
public record StateUpdate(
    Boolean authenticated,
    List<SessionCookie> sessionCookies,
    List<Course> courses,
    List<Assignment> assignments,
    ClassificationResult classification,
    String reportPath,
    List<String> errors
) {
    public StateUpdate {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static StateUpdate authentication(boolean authenticated, List<SessionCookie> cookies) {
        return new StateUpdate(authenticated, cookies, null, null, null, null, null);
    }

    public static StateUpdate courses(List<Course> courses) {
        return new StateUpdate(null, null, courses, null, null, null, null);
    }

    public static StateUpdate assignments(List<Assignment> assignments) {
        return new StateUpdate(null, null, null, assignments, null, null, null);
    }

    public static StateUpdate classification(List<Assignment> assignments, ClassificationResult classification) {
        return new StateUpdate(null, null, null, assignments, classification, null, null);
    }

    public static StateUpdate report(String reportPath) {
        return new StateUpdate(null, null, null, null, null, reportPath, null);
    }

    public static StateUpdate error(String error) {
        return new StateUpdate(null, null, null, null, null, null, List.of(error));
    }

    public StateUpdate withErrors(List<String> additional) {
        if (additional == null || additional.isEmpty()) {
            return this;
        }
        List<String> merged = new ArrayList<>(errors);
        merged.addAll(additional);
        return new StateUpdate(authenticated, sessionCookies, courses, assignments, classification, reportPath, merged);
    }
}
