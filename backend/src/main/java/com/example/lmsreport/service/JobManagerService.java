package com.example.lmsreport.service;

import com.example.lmsreport.pipeline.PipelineProgressListener;
import com.example.lmsreport.pipeline.PipelineState;
import com.example.lmsreport.pipeline.ReportPipelineOrchestrator;
import com.example.lmsreport.pipeline.RunRequest;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * レポート生成ジョブをバックグラウンドで実行し、進捗を保持するService。
 * ジョブごとに独立した PipelineState を持ち、ジョブ間で状態を共有しない。
 */
@Service
public class JobManagerService {

    private static final Logger log = LoggerFactory.getLogger(JobManagerService.class);
    private static final Duration JOB_TTL = Duration.ofMinutes(30);

    private final ExecutorService executor;
    private final ConcurrentHashMap<String, ReportJob> jobs = new ConcurrentHashMap<>();

    private final ReportPipelineOrchestrator orchestrator;

    @Autowired
    public JobManagerService(ReportPipelineOrchestrator orchestrator) {
        this(orchestrator, Executors.newFixedThreadPool(2));
    }

    JobManagerService(ReportPipelineOrchestrator orchestrator, ExecutorService executor) {
        this.orchestrator = orchestrator;
        this.executor = executor;
    }

    /**
     * 新しいレポート生成ジョブを開始します。
     * @return 開始されたジョブ (すぐに返り、処理はバックグラウンドで進む)
     */
    public ReportJob startReportJob(RunRequest request) {
        cleanupExpiredJobs();
        String jobId = UUID.randomUUID().toString();
        ReportJob job = new ReportJob(jobId);
        jobs.put(jobId, job);
        log.debug("新しいレポートジョブを開始しました: jobId={}", jobId);

        executor.submit(() -> executeJob(job, request));
        return job;
    }

    /**
     * @return ジョブ、または存在しない場合はnull
     */
    public ReportJob getJob(String jobId) {
        if (jobId == null) {
            return null;
        }
        ReportJob job = jobs.get(jobId);
        if (job == null) {
            log.warn("指定されたジョブIDが見つかりません: {}", jobId);
        }
        return job;
    }

    private void executeJob(ReportJob job, RunRequest request) {
        PipelineProgressListener listener = (stage, message) -> {
            log.debug("Job {} Stage={}, Message={}", job.getId(), stage, message);
            job.updateStage(stage.name(), message);
        };
        try {
            PipelineState state = orchestrator.run(request, listener);
            job.complete(state, "レポートの生成が完了しました。");
            log.debug("ジョブ実行成功: jobId={}", job.getId());
        } catch (IllegalArgumentException e) {
            // プロファイル不正など、パイプライン開始前の設定エラー
            log.warn("ジョブの設定が不正です: jobId={}: {}", job.getId(), e.getMessage());
            job.fail("設定エラー: " + e.getMessage());
        } catch (Exception e) {
            log.error("ジョブ実行中にエラーが発生しました: jobId={}", job.getId(), e);
            job.fail("予期しないエラーが発生しました: " + e.getMessage());
        }
    }

    private void cleanupExpiredJobs() {
        Instant expiration = Instant.now().minus(JOB_TTL);
        int removedCount = 0;
        Iterator<Map.Entry<String, ReportJob>> iterator = jobs.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, ReportJob> entry = iterator.next();
            if (entry.getValue().getUpdatedAt().isBefore(expiration)) {
                iterator.remove();
                removedCount++;
            }
        }
        if (removedCount > 0) {
            log.info("{}件の期限切れジョブを削除しました。", removedCount);
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    /**
     * ジョブの進捗状況と結果を保持するクラス。
     */
    public static final class ReportJob {
        private final String id;
        private volatile String status;
        private volatile String stage;
        private volatile String message;
        private volatile String error;
        private volatile PipelineState result;
        private volatile Instant updatedAt;

        private ReportJob(String id) {
            this.id = id;
            this.status = "QUEUED";
            this.stage = "QUEUED";
            this.message = "キューに登録しました";
            this.updatedAt = Instant.now();
        }

        public String getId() { return id; }
        public String getStatus() { return status; }
        public String getStage() { return stage; }
        public String getMessage() { return message; }
        public String getError() { return error; }
        public PipelineState getResult() { return result; }
        public Instant getUpdatedAt() { return updatedAt; }

        private synchronized void updateStage(String stage, String newMessage) {
            if (stage != null) {
                this.stage = stage;
                if (!"SUCCESS".equals(status) && !"FAILED".equals(status)) {
                    this.status = "IN_PROGRESS";
                }
            }
            if (newMessage != null && !newMessage.isBlank()) {
                this.message = newMessage;
            }
            this.updatedAt = Instant.now();
        }

        private synchronized void complete(PipelineState result, String finalMessage) {
            this.result = result;
            this.status = "SUCCESS";
            this.stage = "SUCCESS";
            this.message = finalMessage;
            this.error = null;
            this.updatedAt = Instant.now();
        }

        private synchronized void fail(String errorMessage) {
            this.status = "FAILED";
            this.stage = "FAILED";
            this.error = errorMessage;
            if (errorMessage != null && !errorMessage.isBlank()) {
                this.message = errorMessage;
            }
            this.result = null;
            this.updatedAt = Instant.now();
        }
    }
}
