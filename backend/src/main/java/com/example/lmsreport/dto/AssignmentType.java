package com.example.lmsreport.dto;

import java.util.Locale;

/**
 * 活動の種別。URL中のキーワードのみから判定する。
 */
public enum AssignmentType {
    ASSIGNMENT("assign"),
    QUIZ("quiz"),
    FORUM("forum"),
    WORKSHOP("workshop"),
    ACTIVITY(null);

    private final String urlKeyword;

    AssignmentType(String urlKeyword) {
        this.urlKeyword = urlKeyword;
    }

    /**
     * URLに含まれるキーワードから種別を判定します。
     * @param url 活動のURL
     * @param fallback どのキーワードにも一致しない場合の種別
     */
    public static AssignmentType fromUrl(String url, AssignmentType fallback) {
        if (url == null) return fallback;
        String lower = url.toLowerCase(Locale.ROOT);
        for (AssignmentType type : values()) {
            if (type.urlKeyword != null && lower.contains(type.urlKeyword)) {
                return type;
            }
        }
        return fallback;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
