package com.example.lmsreport.dto;

public enum DueStatus {
    OVERDUE,
    DUE_TODAY,
    UPCOMING
}
