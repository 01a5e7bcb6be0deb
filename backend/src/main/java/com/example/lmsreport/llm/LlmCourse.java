package com.example.lmsreport.llm;

/** コース一覧抽出プロンプトの応答要素 {name, url}。 */
public record LlmCourse(String name, String url) {}
