package com.example.lmsreport.controller;

import com.example.lmsreport.config.ScraperProperties;
import com.example.lmsreport.pipeline.RunRequest;
import com.example.lmsreport.profile.PortalProfileLoader;
import com.example.lmsreport.service.JobManagerService;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ReportControllerTest {

    private final JobManagerService jobManagerService = mock(JobManagerService.class);
    private final ScraperProperties properties = new ScraperProperties();
    private final ReportController controller = new ReportController(jobManagerService, properties, new PortalProfileLoader());

    @Test
    void toRunRequest_fillsOmittedFieldsFromProperties() {
        properties.setBaseUrl("https://lms.example.edu");
        properties.setUsername("alice");
        properties.setPassword("secret");
        properties.setDaysAhead(14);

        RunRequest request = controller.toRunRequest(
                new ReportController.StartRequest(null, null, "bob", null, null, 3, null));

        assertThat(request.profile()).isEqualTo("moodle_default");
        assertThat(request.baseUrl()).isEqualTo("https://lms.example.edu");
        assertThat(request.username()).isEqualTo("bob");
        assertThat(request.password()).isEqualTo("secret");
        assertThat(request.daysAhead()).isEqualTo(14);
        assertThat(request.daysBehind()).isEqualTo(3);
    }

    @Test
    void start_rejectsNegativeWindow() {
        ResponseEntity<?> response = controller.start(new ReportController.StartRequest(null, null, null, null, -1, null, null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void status_unknownJobIsNotFound() {
        when(jobManagerService.getJob("missing")).thenReturn(null);

        assertThat(controller.status("missing").getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void profiles_listsBundledProfiles() {
        assertThat(controller.profiles()).contains("moodle_default", "generic_lms");
    }
}
