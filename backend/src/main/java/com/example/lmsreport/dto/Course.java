package com.example.lmsreport.dto;

/**
 * 発見されたコース。URLは絶対URLに正規化済みで、重複排除のキーになる。
 */
public record Course(
    String url,
    String name
) {}
