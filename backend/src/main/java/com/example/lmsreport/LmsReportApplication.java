package com.example.lmsreport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LmsReportApplication {

    public static void main(String[] args) {
        SpringApplication.run(LmsReportApplication.class, args);
    }

    // 「今日」の基準。テストでは固定Clockに差し替える
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
