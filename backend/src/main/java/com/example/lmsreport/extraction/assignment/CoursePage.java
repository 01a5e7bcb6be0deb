package com.example.lmsreport.extraction.assignment;

import com.example.lmsreport.dto.Course;
import com.example.lmsreport.extraction.PageSnapshot;

/**
 * 課題抽出の入力。取得済みのコースページとそのコース。
 */
public record CoursePage(Course course, PageSnapshot page) {}
