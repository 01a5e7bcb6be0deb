package com.example.lmsreport.service;

import com.example.lmsreport.config.ScraperProperties;
import com.example.lmsreport.pipeline.PipelineProgressListener;
import com.example.lmsreport.pipeline.PipelineState;
import com.example.lmsreport.pipeline.ReportPipelineOrchestrator;
import com.example.lmsreport.pipeline.RunRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * scraper.run-on-startup=true のとき、起動時にパイプラインを一度実行して結果を要約表示する。
 */
@Component
@ConditionalOnProperty(prefix = "scraper", name = "run-on-startup", havingValue = "true")
public class StartupReportRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupReportRunner.class);

    private final ReportPipelineOrchestrator orchestrator;
    private final ScraperProperties properties;

    public StartupReportRunner(ReportPipelineOrchestrator orchestrator, ScraperProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        PipelineState state = orchestrator.run(RunRequest.from(properties), PipelineProgressListener.NONE);
        log.info("==== 実行結果 ====");
        log.info("認証: {}", state.authenticated() ? "成功" : "未認証");
        log.info("コース: {}件", state.courses().size());
        log.info("期間内のタスク: {}件", state.classification().countTasksInPeriod());
        log.info("レポート: {}", state.reportPath().isEmpty() ? "(未生成)" : state.reportPath());
        if (!state.errors().isEmpty()) {
            log.warn("エラー {}件:", state.errors().size());
            state.errors().forEach(error -> log.warn("  - {}", error));
        }
    }
}
