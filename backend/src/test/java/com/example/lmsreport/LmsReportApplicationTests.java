package com.example.lmsreport;

import com.example.lmsreport.llm.LocalLlmClient;
import com.example.lmsreport.pipeline.ReportPipelineOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {"ollama.enabled=false", "scraper.run-on-startup=false"})
class LmsReportApplicationTests {

    @Autowired
    private ReportPipelineOrchestrator orchestrator;

    @Autowired
    private LocalLlmClient llmClient;

    @Test
    void contextLoads() {
        assertThat(orchestrator).isNotNull();
        assertThat(llmClient.isAvailable()).isFalse();
    }
}
