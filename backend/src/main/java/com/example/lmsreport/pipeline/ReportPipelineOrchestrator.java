package com.example.lmsreport.pipeline;

import com.example.lmsreport.browser.LoginResult;
import com.example.lmsreport.classify.AssignmentClassifier;
import com.example.lmsreport.classify.ClassificationResult;
import com.example.lmsreport.date.DueDateNormalizer;
import com.example.lmsreport.dto.Assignment;
import com.example.lmsreport.dto.Course;
import com.example.lmsreport.extraction.UrlNormalizer;
import com.example.lmsreport.profile.PortalProfile;
import com.example.lmsreport.profile.PortalProfileLoader;
import com.example.lmsreport.report.ReportAssembler;
import com.example.lmsreport.report.ReportFileSink;
import com.example.lmsreport.report.ReportMetadata;
import com.example.lmsreport.service.AssignmentExtractionService;
import com.example.lmsreport.service.AuthenticationService;
import com.example.lmsreport.service.CourseDiscoveryService;
import com.example.lmsreport.service.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Function;

/**
 * 認証 → コース検出 → 課題抽出 → 分類 → レポート生成 の5ステージを順番に実行する司令塔Service。
 * 各ステージは StateUpdate を返し、ここで PipelineState に合成する。
 * ステージ内の例外はエラー一覧に記録して次のステージへ進むため、run() は必ず最後まで到達する。
 */
@Service
public class ReportPipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ReportPipelineOrchestrator.class);

    private static final String DEFAULT_PORTAL_NAME = "LMS";

    private final PortalProfileLoader profileLoader;
    private final AuthenticationService authenticationService;
    private final CourseDiscoveryService courseDiscoveryService;
    private final AssignmentExtractionService assignmentExtractionService;
    private final DueDateNormalizer normalizer;
    private final AssignmentClassifier classifier;
    private final ReportAssembler reportAssembler;
    private final ReportFileSink reportFileSink;
    private final Clock clock;

    public ReportPipelineOrchestrator(PortalProfileLoader profileLoader,
                                      AuthenticationService authenticationService,
                                      CourseDiscoveryService courseDiscoveryService,
                                      AssignmentExtractionService assignmentExtractionService,
                                      DueDateNormalizer normalizer,
                                      AssignmentClassifier classifier,
                                      ReportAssembler reportAssembler,
                                      ReportFileSink reportFileSink,
                                      Clock clock) {
        this.profileLoader = profileLoader;
        this.authenticationService = authenticationService;
        this.courseDiscoveryService = courseDiscoveryService;
        this.assignmentExtractionService = assignmentExtractionService;
        this.normalizer = normalizer;
        this.classifier = classifier;
        this.reportAssembler = reportAssembler;
        this.reportFileSink = reportFileSink;
        this.clock = clock;
    }

    /**
     * プロファイルを読み込んでパイプラインを実行します。
     * @throws IllegalArgumentException プロファイルが存在しない・不正な場合 (パイプライン開始前の設定エラー)
     */
    public PipelineState run(RunRequest request, PipelineProgressListener listener) {
        PortalProfile profile = profileLoader.load(request.profile());
        return run(request, profile, listener);
    }

    public PipelineState run(RunRequest request, PortalProfile profile, PipelineProgressListener listener) {
        log.info("パイプラインを開始します: {}", request);
        PipelineState state = PipelineState.initial();

        state = step(state, PipelineStage.AUTHENTICATE, listener, s -> authenticate(request, profile));
        state = step(state, PipelineStage.DISCOVER_COURSES, listener, s -> discoverCourses(request, profile, s));
        state = step(state, PipelineStage.EXTRACT_ASSIGNMENTS, listener, s -> extractAssignments(request, profile, s));
        state = step(state, PipelineStage.CLASSIFY, listener, s -> classify(request, s));
        state = step(state, PipelineStage.GENERATE_REPORT, listener, s -> generateReport(request, profile, s));

        log.info("パイプラインが完了しました: {}", state);
        return state;
    }

    private PipelineState step(PipelineState state, PipelineStage stage, PipelineProgressListener listener,
                               Function<PipelineState, StateUpdate> node) {
        log.info("{} ...", stage.prefix());
        listener.onStageStarted(stage, stage.label() + "を実行しています...");
        try {
            return state.apply(node.apply(state));
        } catch (Exception e) {
            log.error("{} で予期しないエラーが発生しました", stage.prefix(), e);
            return state.apply(StateUpdate.error(stage.label() + "で予期しないエラーが発生しました: " + e.getMessage()));
        }
    }

    private StateUpdate authenticate(RunRequest request, PortalProfile profile) {
        StageResult<LoginResult> result = authenticationService.authenticate(request, profile);
        LoginResult login = result.value();
        return StateUpdate.authentication(login.success(), login.cookies()).withErrors(result.errors());
    }

    private StateUpdate discoverCourses(RunRequest request, PortalProfile profile, PipelineState state) {
        StageResult<List<Course>> result = courseDiscoveryService.discover(
                request, profile, state.authenticated(), state.sessionCookies());
        log.info("  コース: {}件", result.value().size());
        return StateUpdate.courses(result.value()).withErrors(result.errors());
    }

    private StateUpdate extractAssignments(RunRequest request, PortalProfile profile, PipelineState state) {
        StageResult<List<Assignment>> result = assignmentExtractionService.extract(
                request, profile, state.courses(), state.sessionCookies());
        return StateUpdate.assignments(result.value()).withErrors(result.errors());
    }

    // 正規化日付はこのステージで初めて付与する
    private StateUpdate classify(RunRequest request, PipelineState state) {
        List<Assignment> dated = state.assignments().stream()
                .map(a -> a.withNormalizedDueDate(normalizer.normalize(a.rawDueDate()).orElse(null)))
                .toList();
        ClassificationResult result = classifier.classifyAll(dated, request.daysAhead(), request.daysBehind());
        log.info("  期限切れ: {}件, 今日締切: {}件, 今後: {}件, 直近の提出済み: {}件",
                result.overdue().size(), result.dueToday().size(), result.upcoming().size(),
                result.recentlySubmitted().size());
        return StateUpdate.classification(dated, result);
    }

    private StateUpdate generateReport(RunRequest request, PortalProfile profile, PipelineState state) {
        LocalDateTime generatedAt = LocalDateTime.now(clock);
        ReportMetadata metadata = new ReportMetadata(
                reportTitle(profile, request.baseUrl()),
                generatedAt,
                request.daysAhead(),
                request.daysBehind(),
                state.courses().size());
        String content = reportAssembler.render(state.classification(), state.courses(), metadata);
        try {
            Path path = reportFileSink.write(content, Path.of(request.outputDir()), generatedAt);
            return StateUpdate.report(path.toString());
        } catch (IOException e) {
            log.error("レポートの保存に失敗しました", e);
            return StateUpdate.report("").withErrors(List.of("レポートの保存に失敗しました: " + e.getMessage()));
        }
    }

    static String reportTitle(PortalProfile profile, String baseUrl) {
        String host = UrlNormalizer.hostOf(UrlNormalizer.normalizeBaseUrl(baseUrl));
        return profile.reports().titleTemplate().replace("{portal_name}", host.isEmpty() ? DEFAULT_PORTAL_NAME : host);
    }
}
