package com.example.lmsreport.controller;

import com.example.lmsreport.config.ScraperProperties;
import com.example.lmsreport.pipeline.PipelineState;
import com.example.lmsreport.pipeline.RunRequest;
import com.example.lmsreport.profile.PortalProfileLoader;
import com.example.lmsreport.service.JobManagerService;
import com.example.lmsreport.service.JobManagerService.ReportJob;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * レポート生成ジョブを受け付けるAPIコントローラ。
 * リクエストで省略された項目は scraper.* の設定値で補う。
 */
@RestController
@RequestMapping("/api/report")
public class ReportController {

    private final JobManagerService jobManagerService;
    private final ScraperProperties properties;
    private final PortalProfileLoader profileLoader;

    public ReportController(JobManagerService jobManagerService, ScraperProperties properties,
                            PortalProfileLoader profileLoader) {
        this.jobManagerService = jobManagerService;
        this.properties = properties;
        this.profileLoader = profileLoader;
    }

    public record StartRequest(
        String profile,
        String baseUrl,
        String username,
        String password,
        Integer daysAhead,
        Integer daysBehind,
        Integer maxCourses
    ) {}

    /**
     * レポート生成ジョブを開始し、すぐにJob IDを返します。
     * POST /api/report/start
     */
    @PostMapping("/start")
    public ResponseEntity<Map<String, String>> start(@RequestBody(required = false) StartRequest request) {
        RunRequest runRequest;
        try {
            runRequest = toRunRequest(request == null ? new StartRequest(null, null, null, null, null, null, null) : request);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        ReportJob job = jobManagerService.startReportJob(runRequest);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("jobId", job.getId()));
    }

    /**
     * ジョブの現在のステータスを返します。
     * GET /api/report/status/{jobId}
     */
    @GetMapping("/status/{jobId}")
    public ResponseEntity<JobStatusResponse> status(@PathVariable String jobId) {
        ReportJob job = jobManagerService.getJob(jobId);
        if (job == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(toResponse(job));
    }

    /**
     * 利用可能なポータルプロファイル名の一覧。
     * GET /api/report/profiles
     */
    @GetMapping("/profiles")
    public List<String> profiles() {
        return profileLoader.listProfiles();
    }

    RunRequest toRunRequest(StartRequest request) {
        return new RunRequest(
                orDefault(request.profile(), properties.getProfile()),
                orDefault(request.baseUrl(), properties.getBaseUrl()),
                orDefault(request.username(), properties.getUsername()),
                orDefault(request.password(), properties.getPassword()),
                request.daysAhead() != null ? request.daysAhead() : properties.getDaysAhead(),
                request.daysBehind() != null ? request.daysBehind() : properties.getDaysBehind(),
                request.maxCourses() != null ? request.maxCourses() : properties.getMaxCourses(),
                properties.getOutputDir(),
                properties.isUseLlmForAssignments());
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private JobStatusResponse toResponse(ReportJob job) {
        PipelineState state = job.getResult();
        return new JobStatusResponse(
                job.getId(),
                job.getStatus(),
                job.getStage(),
                job.getMessage(),
                job.getError(),
                job.getUpdatedAt() != null ? job.getUpdatedAt().toString() : null,
                state != null ? new RunSummary(
                        state.authenticated(),
                        state.courses().size(),
                        state.assignments().size(),
                        state.classification().countTasksInPeriod(),
                        state.reportPath(),
                        state.errors()
                ) : null
        );
    }

    public record JobStatusResponse(
        String jobId,
        String status,
        String stage,
        String message,
        String error,
        String updatedAt,
        RunSummary result
    ) {}

    public record RunSummary(
        boolean authenticated,
        int courses,
        int assignments,
        int tasksInPeriod,
        String reportPath,
        List<String> errors
    ) {}
}
