package com.example.lmsreport.extraction.course;

import com.example.lmsreport.browser.BrowserAutomation;
import com.example.lmsreport.browser.BrowserPage;
import com.example.lmsreport.dto.Course;
import com.example.lmsreport.dto.SessionCookie;
import com.example.lmsreport.extraction.PageSnapshot;
import com.example.lmsreport.llm.CoursePageClassification;
import com.example.lmsreport.llm.LocalLlmClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExploratoryCourseStrategyTest {

    private static final String BASE = "https://lms.example.edu";
    private static final String COURSE_URL = BASE + "/course/view.php?id=1";
    private static final String PROFILE_URL = BASE + "/user/profile.php";
    private static final PageSnapshot PAGE = new PageSnapshot(BASE + "/my/", """
            <a href="/user/profile.php">Profile</a>
            <a href="/course/view.php?id=1">Statistics</a>
            <a href="/login/logout.php">Log out</a>
            <a href="https://other.edu/course/view.php?id=2">Elsewhere</a>
            """);

    private final BrowserAutomation browser = mock(BrowserAutomation.class);
    private final BrowserPage tab = mock(BrowserPage.class);
    private final LocalLlmClient llmClient = mock(LocalLlmClient.class);
    private final List<SessionCookie> cookies = List.of(new SessionCookie("MoodleSession", "abc", "lms.example.edu"));

    @BeforeEach
    void setUp() throws Exception {
        when(browser.isAvailable()).thenReturn(true);
        when(llmClient.isAvailable()).thenReturn(true);
        when(browser.open(anyString(), anyList())).thenReturn(tab);
        when(tab.render(anyString())).thenReturn(Optional.of("<html>page</html>"));
        when(llmClient.classifyCoursePage(anyString(), eq(COURSE_URL), anyInt()))
                .thenReturn(Optional.of(new CoursePageClassification(true, "Statistics 101")));
        when(llmClient.classifyCoursePage(anyString(), eq(PROFILE_URL), anyInt()))
                .thenReturn(Optional.of(new CoursePageClassification(false, "")));
    }

    @Test
    void extract_acceptsOnlyPagesClassifiedAsCourses() {
        ExploratoryCourseStrategy strategy = strategy(10);

        List<Course> courses = strategy.extract(PAGE);

        assertThat(courses).containsExactly(new Course(COURSE_URL, "Statistics 101"));
        verify(tab).close();
    }

    @Test
    void candidateLinks_staysOnSameHostAndPrefersCandidatePatterns() {
        assertThat(strategy(10).candidateLinks(PAGE)).containsExactly(COURSE_URL, PROFILE_URL);
    }

    @Test
    void extract_isBoundedByMaxCandidates() {
        strategy(1).extract(PAGE);

        verify(tab, times(1)).render(anyString());
        verify(tab).render(COURSE_URL);
    }

    @Test
    void extract_skipsWhenBrowserUnavailable() throws Exception {
        when(browser.isAvailable()).thenReturn(false);

        assertThat(strategy(10).extract(PAGE)).isEmpty();
        verify(browser, never()).open(anyString(), anyList());
    }

    private ExploratoryCourseStrategy strategy(int maxCandidates) {
        return new ExploratoryCourseStrategy(browser, llmClient, BASE, cookies,
                List.of("course/view.php"), List.of("/login", "logout", "/admin"), maxCandidates);
    }
}
