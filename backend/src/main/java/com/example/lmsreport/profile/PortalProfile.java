package com.example.lmsreport.profile;

import java.util.List;
import java.util.Map;

/**
 * ポータルごとの宣言的プロファイル (profiles/*.yml)。
 * 抽出ロジックはこの値をパラメータとして受け取るだけで、特定の大学の値を埋め込まない。
 * YAML上のキーはスネークケース (例: success_indicators)。
 */
public record PortalProfile(
    Map<String, String> metadata,
    AuthProfile auth,
    NavigationProfile navigation,
    CoursesProfile courses,
    CourseDiscoveryProfile courseDiscovery,
    AssignmentsProfile assignments,
    DatesProfile dates,
    SubmissionProfile submission,
    ReportsProfile reports
) {
    public PortalProfile {
        metadata = metadata == null ? Map.of() : metadata;
        auth = auth == null ? new AuthProfile(null, null, null, null) : auth;
        navigation = navigation == null ? new NavigationProfile(null) : navigation;
        courses = courses == null ? new CoursesProfile(null, null, null, null, null) : courses;
        courseDiscovery = courseDiscovery == null ? new CourseDiscoveryProfile(null, false, null, null, null) : courseDiscovery;
        assignments = assignments == null ? new AssignmentsProfile(null, false) : assignments;
        dates = dates == null ? new DatesProfile(null, null) : dates;
        submission = submission == null ? new SubmissionProfile(null, null, null) : submission;
        reports = reports == null ? new ReportsProfile(null) : reports;
    }

    public record AuthProfile(
        String loginPath,
        FormSelectors formSelectors,
        List<Indicator> successIndicators,
        List<Indicator> errorIndicators
    ) {
        public AuthProfile {
            loginPath = loginPath == null ? "/login/" : loginPath;
            formSelectors = formSelectors == null ? new FormSelectors(null, null, null) : formSelectors;
            successIndicators = successIndicators == null ? List.of() : List.copyOf(successIndicators);
            errorIndicators = errorIndicators == null ? List.of() : List.copyOf(errorIndicators);
        }
    }

    public record FormSelectors(String username, String password, String submit) {
        public FormSelectors {
            username = username == null ? "#username" : username;
            password = password == null ? "#password" : password;
            submit = submit == null ? "#loginbtn" : submit;
        }
    }

    /** ログイン成否の判定条件。指定されたキーだけが評価される。 */
    public record Indicator(String urlContains, String elementPresent, String textContains) {}

    public record NavigationProfile(String coursesPage) {
        public NavigationProfile {
            coursesPage = coursesPage == null ? "/my/courses.php" : coursesPage;
        }
    }

    public record CoursesProfile(
        List<String> linkKeywords,
        List<String> cardSelectors,
        List<String> nameSelectors,
        List<String> containerSelectors,
        String linkPattern
    ) {
        public CoursesProfile {
            linkKeywords = linkKeywords == null ? List.of("course", "courses", "cursos") : List.copyOf(linkKeywords);
            cardSelectors = cardSelectors == null
                    ? List.of("[data-region='course-content']", ".course-card", "div.card.course-card")
                    : List.copyOf(cardSelectors);
            nameSelectors = nameSelectors == null
                    ? List.of("a.aalink.coursename, a.coursename, .coursename", "span.multiline")
                    : List.copyOf(nameSelectors);
            containerSelectors = containerSelectors == null
                    ? List.of("[data-region='courses-view']", ".card-grid", ".card-deck")
                    : List.copyOf(containerSelectors);
            linkPattern = linkPattern == null ? "course/view" : linkPattern;
        }
    }

    public record CourseDiscoveryProfile(
        List<String> strategyOrder,
        boolean fallbackWhenEmpty,
        Integer maxCandidates,
        List<String> candidatePatterns,
        List<String> excludePatterns
    ) {
        public CourseDiscoveryProfile {
            strategyOrder = strategyOrder == null
                    ? List.of("link-segment", "structural", "llm", "exploratory")
                    : List.copyOf(strategyOrder);
            maxCandidates = maxCandidates == null ? 25 : maxCandidates;
            candidatePatterns = candidatePatterns == null ? List.of("course/view.php", "/course/") : List.copyOf(candidatePatterns);
            excludePatterns = excludePatterns == null
                    ? List.of("/login", "logout", "/admin", "login.php", "logout.php", "course/index.php", "course/search.php")
                    : List.copyOf(excludePatterns);
        }
    }

    public record AssignmentsProfile(List<AssignmentTypeProfile> types, boolean useLlmFirst) {
        public AssignmentsProfile {
            types = types == null || types.isEmpty()
                    ? List.of(
                        new AssignmentTypeProfile("assignment", List.of("a[href*='mod/assign/view.php']")),
                        new AssignmentTypeProfile("quiz", List.of("a[href*='mod/quiz/view.php']")),
                        new AssignmentTypeProfile("forum", List.of("a[href*='mod/forum/view.php']")),
                        new AssignmentTypeProfile("workshop", List.of("a[href*='mod/workshop/view.php']")))
                    : List.copyOf(types);
        }
    }

    public record AssignmentTypeProfile(String name, List<String> selectors) {
        public AssignmentTypeProfile {
            selectors = selectors == null ? List.of() : List.copyOf(selectors);
        }
    }

    public record DatesProfile(List<String> selectors, List<String> patterns) {
        public DatesProfile {
            selectors = selectors == null ? List.of() : List.copyOf(selectors);
            patterns = patterns == null ? List.of() : List.copyOf(patterns);
        }
    }

    public record SubmissionProfile(List<String> indicators, List<String> negativeIndicators, List<String> datePatterns) {

        // 提出キーワードの後、締切の語をまたがずに現れる日付のみを提出日とみなす
        static final String SUBMITTED_PREFIX = "(?:submitted|entregado|presentado)(?:(?!due|vence|cierre)\\D)*";

        public SubmissionProfile {
            negativeIndicators = negativeIndicators == null
                    ? List.of("not submitted", "no submission", "no entregad", "sin entregar", "no presentad", "not completed")
                    : List.copyOf(negativeIndicators);
            indicators = indicators == null
                    ? List.of("entregado", "submitted", "presentado", "completado", "finalizado", "✓", "✅")
                    : List.copyOf(indicators);
            datePatterns = datePatterns == null
                    ? List.of(SUBMITTED_PREFIX + "(\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4})",
                            SUBMITTED_PREFIX + "(\\d{4}-\\d{1,2}-\\d{1,2})")
                    : List.copyOf(datePatterns);
        }
    }

    public record ReportsProfile(String titleTemplate) {
        public ReportsProfile {
            titleTemplate = titleTemplate == null ? "Assignment Report - {portal_name}" : titleTemplate;
        }
    }

    /** 全種別のセレクタを定義順に平坦化して返します。 */
    public List<String> assignmentSelectors() {
        return assignments.types().stream()
                .flatMap(type -> type.selectors().stream())
                .toList();
    }
}
