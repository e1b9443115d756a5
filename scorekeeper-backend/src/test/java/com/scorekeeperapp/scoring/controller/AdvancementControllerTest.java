package com.scorekeeperapp.scoring.controller;

import com.scorekeeperapp.common.exception.ApiExceptionHandler;
import com.scorekeeperapp.common.exception.BadRequestException;
import com.scorekeeperapp.common.result.ErrorCode;
import com.scorekeeperapp.common.result.ScoringError;
import com.scorekeeperapp.scoring.dto.advancement.response.AdvancementOutcomeResponse;
import com.scorekeeperapp.scoring.dto.advancement.response.PlayValidationResponse;
import com.scorekeeperapp.scoring.dto.advancement.response.RuleViolationResponse;
import com.scorekeeperapp.scoring.dto.common.ApiResponse;
import com.scorekeeperapp.scoring.dto.common.BasesPayload;
import com.scorekeeperapp.scoring.service.AdvancementService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AdvancementController.class)
@Import(ApiExceptionHandler.class)
@DisplayName("AdvancementController")
class AdvancementControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AdvancementService advancementService;

    @Test
    @DisplayName("POST /api/advancement/standard returns the standard outcome")
    void standard() throws Exception {
        given(advancementService.standard(any())).willReturn(ApiResponse.ok("Standard advancement computed",
                new AdvancementOutcomeResponse(new BasesPayload(null, "p1", "p4"), List.of(), 0, 0)));

        mockMvc.perform(post("/api/advancement/standard")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"baserunnersBefore\":{\"first\":\"p4\"},\"result\":\"DOUBLE\",\"batterId\":\"p1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.baserunnersAfter.second").value("p1"))
                .andExpect(jsonPath("$.data.baserunnersAfter.third").value("p4"))
                .andExpect(jsonPath("$.data.rbis").value(0));
    }

    @Test
    @DisplayName("a result that cannot happen with these runners is a 400")
    void notApplicable() throws Exception {
        given(advancementService.standard(any())).willThrow(new BadRequestException(
                new ScoringError(ErrorCode.OUTCOME_NOT_APPLICABLE, "A sacrifice fly requires a runner on third")));

        mockMvc.perform(post("/api/advancement/standard")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"result\":\"SACRIFICE_FLY\",\"batterId\":\"p1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("OUTCOME_NOT_APPLICABLE"));
    }

    @Test
    @DisplayName("an invalid play is still a 200 carrying violations and suggestions")
    void validate() throws Exception {
        PlayValidationResponse invalid = new PlayValidationResponse(false,
                List.of(new RuleViolationResponse("RBI_BOUND", "RBI_BOUND_VIOLATED", true,
                        "RBIs cannot exceed runs scored", Map.of("rbis", 2, "runsScored", 1))),
                List.of(new AdvancementOutcomeResponse(new BasesPayload("p1", null, null), List.of("p4"), 1, 0)));
        given(advancementService.validate(any())).willReturn(ApiResponse.ok("Play violates scoring rules", invalid));

        mockMvc.perform(post("/api/advancement/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"baserunnersBefore\":{\"third\":\"p4\"},\"result\":\"SINGLE\",\"batterId\":\"p1\","
                                + "\"baserunnersAfter\":{\"first\":\"p1\"},\"runsScored\":[\"p4\"],\"rbis\":2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.valid").value(false))
                .andExpect(jsonPath("$.data.violations[0].rule").value("RBI_BOUND"))
                .andExpect(jsonPath("$.data.suggestions[0].runsScored[0]").value("p4"));
    }

    @Test
    @DisplayName("outs before the play must leave room for another out")
    void outsBeforePlayBound() throws Exception {
        mockMvc.perform(post("/api/advancement/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"result\":\"WALK\",\"batterId\":\"p1\",\"rbis\":0,\"outsBeforePlay\":3}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.errors[0].field").value("outsBeforePlay"));
    }
}
