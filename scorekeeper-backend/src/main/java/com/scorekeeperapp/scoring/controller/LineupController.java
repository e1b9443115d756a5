package com.scorekeeperapp.scoring.controller;

import com.scorekeeperapp.scoring.dto.common.ApiResponse;
import com.scorekeeperapp.scoring.dto.lineup.request.SetupLineupRequest;
import com.scorekeeperapp.scoring.dto.lineup.request.SubstitutePlayerRequest;
import com.scorekeeperapp.scoring.dto.lineup.response.LineupResponse;
import com.scorekeeperapp.scoring.service.LineupService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/lineups")
public class LineupController {

    private final LineupService lineupService;

    @PostMapping("/setup")
    public ApiResponse<LineupResponse> setup(@Valid @RequestBody SetupLineupRequest request) {
        return lineupService.setup(request);
    }

    @PostMapping("/substitute")
    public ApiResponse<LineupResponse> substitute(@Valid @RequestBody SubstitutePlayerRequest request) {
        return lineupService.substitute(request);
    }
}
