package com.example.lmsreport.llm;

/** 課題抽出プロンプトの応答要素 {title, due_date, url, type}。 */
public record LlmAssignment(String title, String dueDate, String url, String type) {}
