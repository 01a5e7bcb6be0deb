package com.example.lmsreport.service;

import com.example.lmsreport.browser.PageFetcher;
import com.example.lmsreport.config.ScraperProperties;
import com.example.lmsreport.date.DueDateNormalizer;
import com.example.lmsreport.dto.Assignment;
import com.example.lmsreport.dto.Course;
import com.example.lmsreport.extraction.ExtractionStrategy;
import com.example.lmsreport.extraction.PageSnapshot;
import com.example.lmsreport.llm.LocalLlmClient;
import com.example.lmsreport.pipeline.RunRequest;
import com.example.lmsreport.profile.PortalProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AssignmentExtractionServiceTest {

    private static final Course BIOLOGY = new Course("https://lms.example.edu/course/view.php?id=1", "Biology");
    private static final Course CHEMISTRY = new Course("https://lms.example.edu/course/view.php?id=2", "Chemistry");
    private static final String COURSE_HTML = """
            <li class="activity"><a href="/mod/assign/view.php?id=10">Essay one</a> <span>2026-03-20</span></li>
            <li class="activity"><a href="/mod/quiz/view.php?id=11">Quiz one</a></li>
            """;

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private final PageFetcher pageFetcher = mock(PageFetcher.class);
    private final PortalProfile profile = new PortalProfile(null, null, null, null, null, null,
            new PortalProfile.DatesProfile(null, List.of("(\\d{4}-\\d{2}-\\d{2})")), null, null);
    private AssignmentExtractionService service;

    @BeforeEach
    void setUp() {
        ScraperProperties properties = new ScraperProperties();
        properties.setFetchDelayMillis(0);
        service = new AssignmentExtractionService(pageFetcher, new LocalLlmClient(Optional.empty()),
                new DueDateNormalizer(clock), properties, clock);
    }

    @Test
    void extract_noCoursesMeansNoFetch() {
        StageResult<List<Assignment>> result = service.extract(request(0), profile, List.of(), List.of());

        assertThat(result.value()).isEmpty();
        assertThat(result.hasErrors()).isFalse();
        verify(pageFetcher, never()).fetch(anyString(), anyList());
    }

    @Test
    void extract_collectsAssignmentsPerCourse() {
        when(pageFetcher.fetch(eq(BIOLOGY.url()), anyList())).thenReturn(Optional.of(new PageSnapshot(BIOLOGY.url(), COURSE_HTML)));

        StageResult<List<Assignment>> result = service.extract(request(0), profile, List.of(BIOLOGY), List.of());

        assertThat(result.value()).extracting(Assignment::title).containsExactly("Essay one", "Quiz one");
        assertThat(result.value().get(0).rawDueDate()).isEqualTo("2026-03-20");
        assertThat(result.value()).allSatisfy(a -> assertThat(a.course()).isEqualTo("Biology"));
    }

    @Test
    void extract_respectsMaxCourses() {
        when(pageFetcher.fetch(anyString(), anyList())).thenReturn(Optional.of(new PageSnapshot(BIOLOGY.url(), COURSE_HTML)));

        service.extract(request(1), profile, List.of(BIOLOGY, CHEMISTRY), List.of());

        verify(pageFetcher, times(1)).fetch(anyString(), anyList());
        verify(pageFetcher).fetch(eq(BIOLOGY.url()), anyList());
    }

    @Test
    void extract_unreachableCourseIsRecordedAndOthersContinue() {
        when(pageFetcher.fetch(eq(BIOLOGY.url()), anyList())).thenReturn(Optional.empty());
        when(pageFetcher.fetch(eq(CHEMISTRY.url()), anyList())).thenReturn(Optional.of(new PageSnapshot(CHEMISTRY.url(), COURSE_HTML)));

        StageResult<List<Assignment>> result = service.extract(request(0), profile, List.of(BIOLOGY, CHEMISTRY), List.of());

        assertThat(result.value()).hasSize(2).allSatisfy(a -> assertThat(a.course()).isEqualTo("Chemistry"));
        assertThat(result.errors()).singleElement().asString().contains("Biology");
    }

    @Test
    void buildStrategies_putsLlmFirstWhenRequested() {
        PortalProfile llmFirst = new PortalProfile(null, null, null, null, null,
                new PortalProfile.AssignmentsProfile(null, true), null, null, null);

        assertThat(service.buildStrategies(request(0), llmFirst)).extracting(ExtractionStrategy::name)
                .containsExactly("llm", "selector");
        assertThat(service.buildStrategies(request(0), profile)).extracting(ExtractionStrategy::name)
                .containsExactly("selector", "llm");
    }

    private static RunRequest request(int maxCourses) {
        return new RunRequest("moodle_default", "https://lms.example.edu", "alice", "secret", 7, 7, maxCourses, "reports", false);
    }
}
