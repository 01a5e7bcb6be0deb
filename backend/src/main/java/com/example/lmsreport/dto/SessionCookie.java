package com.example.lmsreport.dto;

public record SessionCookie(
    String name,
    String value,
    String domain
) {}
