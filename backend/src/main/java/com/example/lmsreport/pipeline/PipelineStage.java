package com.example.lmsreport.pipeline;

/**
 * パイプラインの5つのノード。実行順は宣言順で固定。
 */
public enum PipelineStage {
    AUTHENTICATE(1, "認証"),
    DISCOVER_COURSES(2, "コース検出"),
    EXTRACT_ASSIGNMENTS(3, "課題抽出"),
    CLASSIFY(4, "分類"),
    GENERATE_REPORT(5, "レポート生成");

    public static final int TOTAL = values().length;

    private final int step;
    private final String label;

    PipelineStage(int step, String label) {
        this.step = step;
        this.label = label;
    }

    public int step() {
        return step;
    }

    public String label() {
        return label;
    }

    /** ログ用の "[n/5] ラベル" 形式。 */
    public String prefix() {
        return "[" + step + "/" + TOTAL + "] " + label;
    }
}
