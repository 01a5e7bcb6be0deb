package com.example.lmsreport.llm;

/** コースページ判定プロンプトの応答 {is_course, course_name}。 */
public record CoursePageClassification(boolean isCourse, String courseName) {}
