package com.ratiowatch.backend.modules.ratio.presentation;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import com.ratiowatch.backend.global.config.RatioProperties;
import com.ratiowatch.backend.global.error.RestExceptionHandler;
import com.ratiowatch.backend.modules.ratio.application.RatioSnapshotService;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = RatioSnapshotController.class)
@AutoConfigureMockMvc(addFilters = false)
class RatioSnapshotControllerTest {

    @SpringBootConfiguration
    @Import({RatioSnapshotController.class, RestExceptionHandler.class})
    static class TestApplication {
    }

    private static final String PERIOD_ID = "00000000-0000-0000-0000-00000000a001";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RatioSnapshotService ratioSnapshotService;

    @MockBean
    private RatioProperties ratioProperties;

    @Test
    void malformedTimeInBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/ratio/snapshots")
                        .param("periodId", PERIOD_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ageGroup\":\"TODDLER\",\"date\":\"2025-03-01\",\"time\":\"25:99\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PARAMETERS"))
                .andExpect(jsonPath("$.detail").value("Invalid value for field 'time'"));

        verifyNoInteractions(ratioSnapshotService);
    }

    @Test
    void unparseableJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/ratio/snapshots/batch")
                        .param("periodId", PERIOD_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"date\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PARAMETERS"));

        verifyNoInteractions(ratioSnapshotService);
    }

    @Test
    void malformedPeriodIdIsBadRequest() throws Exception {
        mockMvc.perform(post("/ratio/snapshots")
                        .param("periodId", "not-a-uuid")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ageGroup\":\"TODDLER\",\"date\":\"2025-03-01\",\"time\":\"10:00:00\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PARAMETERS"));
    }

    @Test
    void wellFormedBodyIsRecorded() throws Exception {
        UUID snapshotId = UUID.randomUUID();
        when(ratioSnapshotService.record(any())).thenReturn(snapshotId);

        mockMvc.perform(post("/ratio/snapshots")
                        .param("periodId", PERIOD_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ageGroup\":\"TODDLER\",\"date\":\"2025-03-01\",\"time\":\"10:00:00\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.snapshotId").value(snapshotId.toString()));
    }
}
