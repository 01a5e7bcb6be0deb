package com.example.lmsreport.profile;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PortalProfileLoaderTest {

    private final PortalProfileLoader loader = new PortalProfileLoader();

    @Test
    void load_bindsSnakeCaseYamlIntoProfile() {
        PortalProfile profile = loader.load("moodle_default");

        assertThat(profile.metadata()).containsEntry("name", "Moodle (default)");
        assertThat(profile.auth().loginPath()).isEqualTo("/login/index.php");
        assertThat(profile.auth().formSelectors().submit()).isEqualTo("#loginbtn");
        assertThat(profile.auth().successIndicators()).hasSize(2);
        assertThat(profile.auth().successIndicators().get(0).urlContains()).isEqualTo("/my/");
        assertThat(profile.auth().errorIndicators()).extracting(PortalProfile.Indicator::textContains)
                .contains("Invalid login");
        assertThat(profile.navigation().coursesPage()).isEqualTo("/my/courses.php");
        assertThat(profile.courseDiscovery().strategyOrder())
                .containsExactly("link-segment", "structural", "llm", "exploratory");
        assertThat(profile.courseDiscovery().fallbackWhenEmpty()).isTrue();
        assertThat(profile.courseDiscovery().maxCandidates()).isEqualTo(25);
        assertThat(profile.assignments().types()).extracting(PortalProfile.AssignmentTypeProfile::name)
                .containsExactly("assignment", "quiz", "forum", "workshop");
        assertThat(profile.submission().indicators()).contains("entregado", "✅");
        assertThat(profile.submission().negativeIndicators()).isNotEmpty();
        assertThat(profile.reports().titleTemplate()).contains("{portal_name}");
    }

    @Test
    void load_fillsDefaultsForOmittedSections() {
        PortalProfile profile = loader.load("generic_lms");

        assertThat(profile.courses().cardSelectors()).isNotEmpty();
        assertThat(profile.submission().indicators()).contains("submitted");
        assertThat(profile.assignments().useLlmFirst()).isTrue();
        assertThat(profile.courseDiscovery().excludePatterns()).contains("logout");
    }

    @Test
    void load_cachesByName() {
        assertThat(loader.load("moodle_default")).isSameAs(loader.load("moodle_default"));
    }

    @Test
    void load_unknownProfileIsConfigurationError() {
        assertThatThrownBy(() -> loader.load("does_not_exist"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does_not_exist");
        assertThatThrownBy(() -> loader.load(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void listProfiles_returnsSortedNames() {
        assertThat(loader.listProfiles()).containsSubsequence("generic_lms", "moodle_default");
    }
}
