package com.example.loankeeper.requests;

import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.loankeeper.models.JobType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CreateScheduleServiceRequestTest {

    @Test
    @DisplayName("job type and cron expression are required")
    void requiredFields() {
        assertThrows(NullPointerException.class, () -> new CreateScheduleServiceRequest(null, "0 3 * * *", true));
        assertThrows(NullPointerException.class, () -> new CreateScheduleServiceRequest(JobType.CHECK, null, true));
    }

    @Test
    @DisplayName("enabled is left null when the payload omits it")
    void enabledOptionalInPayload() throws Exception {
        CreateScheduleHttpRequest parsed = new ObjectMapper().readValue(
                "{\"job_type\":\"check\",\"cron_expression\":\"0 3 * * *\"}", CreateScheduleHttpRequest.class);

        assertNull(parsed.enabled());
    }
}
