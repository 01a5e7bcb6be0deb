package com.example.lmsreport.browser;

import com.example.lmsreport.profile.PortalProfile.FormSelectors;
import com.example.lmsreport.profile.PortalProfile.Indicator;

import java.time.Duration;
import java.util.List;

public record LoginRequest(
    String loginUrl,
    FormSelectors selectors,
    String username,
    String password,
    List<Indicator> successIndicators,
    List<Indicator> errorIndicators,
    Duration timeout
) {
    // パスワードをログに出さない
    @Override
    public String toString() {
        return "LoginRequest[loginUrl=" + loginUrl + ", username=" + username + "]";
    }
}
