package com.example.lmsreport.service;

import com.example.lmsreport.pipeline.PipelineProgressListener;
import com.example.lmsreport.pipeline.PipelineStage;
import com.example.lmsreport.pipeline.PipelineState;
import com.example.lmsreport.pipeline.ReportPipelineOrchestrator;
import com.example.lmsreport.pipeline.RunRequest;
import com.example.lmsreport.service.JobManagerService.ReportJob;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JobManagerServiceTest {

    private static final RunRequest REQUEST = new RunRequest("moodle_default", "https://lms.example.edu",
            "alice", "secret", 7, 7, 0, "reports", false);

    private final ReportPipelineOrchestrator orchestrator = mock(ReportPipelineOrchestrator.class);
    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final JobManagerService service = new JobManagerService(orchestrator, executor);

    @Test
    void startReportJob_completesWithPipelineState() throws Exception {
        PipelineState finalState = PipelineState.initial();
        when(orchestrator.run(any(RunRequest.class), any(PipelineProgressListener.class))).thenAnswer(invocation -> {
            PipelineProgressListener listener = invocation.getArgument(1);
            listener.onStageStarted(PipelineStage.CLASSIFY, "分類を実行しています...");
            return finalState;
        });

        ReportJob job = service.startReportJob(REQUEST);
        awaitJobs();

        assertThat(service.getJob(job.getId())).isSameAs(job);
        assertThat(job.getStatus()).isEqualTo("SUCCESS");
        assertThat(job.getResult()).isSameAs(finalState);
        assertThat(job.getError()).isNull();
    }

    @Test
    void startReportJob_profileErrorFailsJob() throws Exception {
        when(orchestrator.run(any(RunRequest.class), any(PipelineProgressListener.class)))
                .thenThrow(new IllegalArgumentException("プロファイルが見つかりません: missing"));

        ReportJob job = service.startReportJob(REQUEST);
        awaitJobs();

        assertThat(job.getStatus()).isEqualTo("FAILED");
        assertThat(job.getError()).startsWith("設定エラー").contains("missing");
        assertThat(job.getResult()).isNull();
    }

    @Test
    void getJob_unknownIdIsNull() {
        assertThat(service.getJob("nope")).isNull();
        assertThat(service.getJob(null)).isNull();
    }

    private void awaitJobs() throws InterruptedException {
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
    }
}
