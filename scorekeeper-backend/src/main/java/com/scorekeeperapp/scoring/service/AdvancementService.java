package com.scorekeeperapp.scoring.service;

import com.scorekeeperapp.common.exception.BadRequestException;
import com.scorekeeperapp.common.exception.ScoringExceptions;
import com.scorekeeperapp.common.result.ErrorCode;
import com.scorekeeperapp.common.result.Result;
import com.scorekeeperapp.scoring.domain.advancement.AdvancementEngine;
import com.scorekeeperapp.scoring.domain.advancement.AdvancementOutcome;
import com.scorekeeperapp.scoring.domain.advancement.Aggressiveness;
import com.scorekeeperapp.scoring.domain.advancement.OutcomeParameters;
import com.scorekeeperapp.scoring.domain.advancement.PlayScenario;
import com.scorekeeperapp.scoring.domain.advancement.RuleConfiguration;
import com.scorekeeperapp.scoring.domain.advancement.RuleValidation;
import com.scorekeeperapp.scoring.domain.advancement.RuleViolation;
import com.scorekeeperapp.scoring.domain.bases.BaserunnerState;
import com.scorekeeperapp.scoring.dto.advancement.request.AdvancementRequest;
import com.scorekeeperapp.scoring.dto.advancement.request.ValidatePlayRequest;
import com.scorekeeperapp.scoring.dto.advancement.response.AdvancementOutcomeResponse;
import com.scorekeeperapp.scoring.dto.advancement.response.PlayValidationResponse;
import com.scorekeeperapp.scoring.dto.advancement.response.RuleViolationResponse;
import com.scorekeeperapp.scoring.dto.common.ApiResponse;
import com.scorekeeperapp.scoring.dto.common.BasesPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Stateless advancement queries. Nothing here touches a game, so no locking.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdvancementService {

    private final AdvancementEngine advancementEngine;
    private final RuleConfiguration ruleConfiguration;

    public ApiResponse<AdvancementOutcomeResponse> standard(AdvancementRequest request) {
        if (request == null) throw new BadRequestException("Request body is required");
        BaserunnerState before = toState(request.baserunnersBefore());

        Result<AdvancementOutcome> result = advancementEngine.standardAdvancement(before, request.result(),
                request.batterId(), ruleConfiguration);
        if (result.isFailure()) {
            log.debug("Standard advancement rejected: {} {}", result.getError().code(), result.getError().message());
        }
        return ApiResponse.ok("Standard advancement computed", toResponse(ScoringExceptions.unwrap(result)));
    }

    public ApiResponse<List<AdvancementOutcomeResponse>> validOutcomes(AdvancementRequest request) {
        if (request == null) throw new BadRequestException("Request body is required");
        BaserunnerState before = toState(request.baserunnersBefore());
        OutcomeParameters parameters = toParameters(request.aggressiveness(), request.errorOccurred(),
                request.runningErrorOccurred());

        Set<AdvancementOutcome> outcomes = advancementEngine.validOutcomes(before, request.result(),
                request.batterId(), parameters, ruleConfiguration);
        if (outcomes.isEmpty()) {
            // surfaces why the play is impossible
            ScoringExceptions.unwrap(advancementEngine.standardAdvancement(before, request.result(),
                    request.batterId(), ruleConfiguration));
        }
        log.debug("Valid outcomes: result={}, bases={}, count={}", request.result(), before.shape(), outcomes.size());
        return ApiResponse.ok("Valid outcomes computed", outcomes.stream().map(this::toResponse).toList());
    }

    public ApiResponse<PlayValidationResponse> validate(ValidatePlayRequest request) {
        if (request == null) throw new BadRequestException("Request body is required");
        if (request.rbis() == null) throw new BadRequestException("rbis is required");

        PlayScenario scenario = new PlayScenario(
                toState(request.baserunnersBefore()),
                request.result(),
                request.batterId(),
                toParameters(request.aggressiveness(), request.errorOccurred(), request.runningErrorOccurred()),
                toState(request.baserunnersAfter()),
                request.runsScored(),
                request.rbis(),
                request.outsBeforePlay() == null ? 0 : request.outsBeforePlay());

        RuleValidation validation = advancementEngine.validate(scenario, ruleConfiguration);
        if (!validation.isValid()) {
            log.debug("Play failed validation: result={}, violations={}", request.result(),
                    validation.violations().stream().map(v -> v.rule().name()).toList());
        }
        PlayValidationResponse response = new PlayValidationResponse(
                validation.isValid(),
                validation.violations().stream().map(this::toResponse).toList(),
                validation.suggestions().stream().map(this::toResponse).toList());
        return ApiResponse.ok(validation.isValid() ? "Play is valid" : "Play violates scoring rules", response);
    }

    private static BaserunnerState toState(BasesPayload payload) {
        try {
            return BasesPayload.toState(payload);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(e.getMessage(), ErrorCode.INCONSISTENT_RUNNERS.name(), null);
        }
    }

    private static OutcomeParameters toParameters(
            Aggressiveness aggressiveness,
            Boolean errorOccurred, Boolean runningErrorOccurred) {
        return new OutcomeParameters(aggressiveness, Boolean.TRUE.equals(errorOccurred),
                Boolean.TRUE.equals(runningErrorOccurred));
    }

    private AdvancementOutcomeResponse toResponse(AdvancementOutcome o) {
        return new AdvancementOutcomeResponse(BasesPayload.from(o.baserunnersAfter()), o.runsScored(), o.rbis(),
                o.outs());
    }

    private RuleViolationResponse toResponse(RuleViolation v) {
        return new RuleViolationResponse(v.rule().name(), v.rule().errorCode().name(), v.rule().isNonNegotiable(),
                v.message(), v.details());
    }
}
