package com.example.lmsreport.extraction;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UrlNormalizerTest {

    @Test
    void toAbsolute_resolvesRelativeHrefAndDropsFragment() {
        assertThat(UrlNormalizer.toAbsolute("https://lms.example.edu/my/courses.php", "/course/view.php?id=5#section-1"))
                .contains("https://lms.example.edu/course/view.php?id=5");
        assertThat(UrlNormalizer.toAbsolute("https://lms.example.edu", "course/view.php?id=1"))
                .contains("https://lms.example.edu/course/view.php?id=1");
    }

    @Test
    void toAbsolute_ignoresNonNavigableLinks() {
        String base = "https://lms.example.edu/";
        assertThat(UrlNormalizer.toAbsolute(base, "javascript:void(0)")).isEmpty();
        assertThat(UrlNormalizer.toAbsolute(base, "mailto:help@example.edu")).isEmpty();
        assertThat(UrlNormalizer.toAbsolute(base, "#")).isEmpty();
        assertThat(UrlNormalizer.toAbsolute(base, "  ")).isEmpty();
        assertThat(UrlNormalizer.toAbsolute(base, null)).isEmpty();
    }

    @Test
    void normalizeBaseUrl_reducesLoginUrlToOrigin() {
        assertThat(UrlNormalizer.normalizeBaseUrl("https://campus.example.edu/login/index.php"))
                .isEqualTo("https://campus.example.edu");
        assertThat(UrlNormalizer.normalizeBaseUrl("http://localhost:8081/"))
                .isEqualTo("http://localhost:8081");
        assertThat(UrlNormalizer.normalizeBaseUrl(null)).isEmpty();
    }

    @Test
    void hasPathSegment_matchesWholeSegmentsOnly() {
        List<String> keywords = List.of("course", "courses", "cursos");

        assertThat(UrlNormalizer.hasPathSegment("https://x.edu/courses/12", keywords)).isTrue();
        assertThat(UrlNormalizer.hasPathSegment("https://x.edu/Cursos/algebra", keywords)).isTrue();
        assertThat(UrlNormalizer.hasPathSegment("https://x.edu/coursework/1", keywords)).isFalse();
        assertThat(UrlNormalizer.hasPathSegment("https://x.edu/search?type=course", keywords)).isFalse();
    }

    @Test
    void isSameHost_comparesHostCaseInsensitively() {
        assertThat(UrlNormalizer.isSameHost("https://LMS.example.edu/a", "https://lms.example.edu/b")).isTrue();
        assertThat(UrlNormalizer.isSameHost("https://lms.example.edu/a", "https://other.edu/b")).isFalse();
    }

    @Test
    void absoluteHref_resolvesAgainstDocumentBase() {
        Element doc = Jsoup.parse("""
                <a id="rel" href="/courses/Intro Algebra#top">x</a>
                <a id="js" href="javascript:void(0)">y</a>
                """, "https://lms.example.edu/my/");

        assertThat(UrlNormalizer.absoluteHref(doc.getElementById("rel")))
                .hasValueSatisfying(url -> assertThat(url)
                        .startsWith("https://lms.example.edu/courses/Intro")
                        .doesNotContain("#top"));
        assertThat(UrlNormalizer.absoluteHref(doc.getElementById("js"))).isEmpty();
    }

    @Test
    void hostAndPath_tolerateUnencodedCharacters() {
        assertThat(UrlNormalizer.hostOf("https://lms.example.edu/courses/Intro Algebra")).isEqualTo("lms.example.edu");
        assertThat(UrlNormalizer.hasPathSegment("https://lms.example.edu/courses/Intro Algebra", List.of("courses"))).isTrue();
        assertThat(UrlNormalizer.hostOf("not a url")).isEmpty();
    }
}
