package com.example.lmsreport.extraction.course;

import com.example.lmsreport.dto.Course;
import com.example.lmsreport.extraction.PageSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StructuralCourseStrategyTest {

    private static final String PAGE_URL = "https://lms.example.edu/my/courses.php";

    private final StructuralCourseStrategy strategy = new StructuralCourseStrategy(
            List.of(".course-card"), List.of(".coursename"), List.of(".card-grid"), "course/view");

    @Test
    void extract_readsNamesFromCourseCards() {
        String html = """
                <div class="course-card">
                  <a href="/course/view.php?id=7"><img src="x.png"></a>
                  <a href="/course/view.php?id=7" class="coursename">Biology</a>
                </div>
                <div class="course-card">
                  <a href="/course/view.php?id=8"><span class="coursename">Chemistry</span></a>
                </div>
                <div class="course-card"><span>No link in this card</span></div>
                """;

        List<Course> courses = strategy.extract(new PageSnapshot(PAGE_URL, html));

        assertThat(courses).containsExactly(
                new Course("https://lms.example.edu/course/view.php?id=7", "Biology"),
                new Course("https://lms.example.edu/course/view.php?id=8", "Chemistry"));
    }

    @Test
    void extract_fallsBackToContainerLinksWhenNoCards() {
        String html = """
                <div class="card-grid">
                  <a href="/course/view.php?id=9">History</a>
                  <a href="/user/profile.php">Profile</a>
                </div>
                """;

        assertThat(strategy.extract(new PageSnapshot(PAGE_URL, html)))
                .containsExactly(new Course("https://lms.example.edu/course/view.php?id=9", "History"));
    }

    @Test
    void extract_skipsInvalidSelectors() {
        StructuralCourseStrategy broken = new StructuralCourseStrategy(
                List.of("div[[", ".course-card"), List.of(".coursename"), List.of(), "course/view");
        String html = "<div class=\"course-card\"><a class=\"coursename\" href=\"/course/view.php?id=1\">Art</a></div>";

        assertThat(broken.extract(new PageSnapshot(PAGE_URL, html)))
                .extracting(Course::name)
                .containsExactly("Art");
    }
}
