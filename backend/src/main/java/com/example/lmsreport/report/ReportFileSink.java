package com.example.lmsreport.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * レンダリング済みのレポートを出力ディレクトリにタイムスタンプ付きで保存する。
 */
@Component
public class ReportFileSink {

    private static final Logger log = LoggerFactory.getLogger(ReportFileSink.class);

    private static final String PREFIX = "assignments_report";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    /**
     * @return 保存したファイルのパス
     * @throws IOException ディレクトリ作成や書き込みに失敗した場合
     */
    public Path write(String content, Path outputDir, LocalDateTime generatedAt) throws IOException {
        Files.createDirectories(outputDir);
        Path path = outputDir.resolve(PREFIX + "_" + generatedAt.format(TIMESTAMP) + ".md");
        Files.writeString(path, content, StandardCharsets.UTF_8);
        log.info("レポートを保存しました: {}", path);
        return path;
    }
}
