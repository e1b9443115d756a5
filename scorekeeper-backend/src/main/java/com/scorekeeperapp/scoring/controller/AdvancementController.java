package com.scorekeeperapp.scoring.controller;

import com.scorekeeperapp.scoring.dto.advancement.request.AdvancementRequest;
import com.scorekeeperapp.scoring.dto.advancement.request.ValidatePlayRequest;
import com.scorekeeperapp.scoring.dto.advancement.response.AdvancementOutcomeResponse;
import com.scorekeeperapp.scoring.dto.advancement.response.PlayValidationResponse;
import com.scorekeeperapp.scoring.dto.common.ApiResponse;
import com.scorekeeperapp.scoring.service.AdvancementService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/advancement")
public class AdvancementController {

    private final AdvancementService advancementService;

    @PostMapping("/standard")
    public ApiResponse<AdvancementOutcomeResponse> standard(@Valid @RequestBody AdvancementRequest request) {
        return advancementService.standard(request);
    }

    @PostMapping("/valid-outcomes")
    public ApiResponse<List<AdvancementOutcomeResponse>> validOutcomes(@Valid @RequestBody AdvancementRequest request) {
        return advancementService.validOutcomes(request);
    }

    @PostMapping("/validate")
    public ApiResponse<PlayValidationResponse> validate(@Valid @RequestBody ValidatePlayRequest request) {
        return advancementService.validate(request);
    }
}
