package com.scorekeeperapp.scoring.controller;

import com.scorekeeperapp.scoring.dto.atbat.request.ListAtBatsRequest;
import com.scorekeeperapp.scoring.dto.atbat.request.RecordAtBatRequest;
import com.scorekeeperapp.scoring.dto.atbat.response.AtBatResponse;
import com.scorekeeperapp.scoring.dto.common.ApiResponse;
import com.scorekeeperapp.scoring.service.AtBatService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/at-bats")
public class AtBatController {

    private final AtBatService atBatService;

    @PostMapping("/record")
    public ApiResponse<AtBatResponse> record(@Valid @RequestBody RecordAtBatRequest request) {
        return atBatService.record(request);
    }

    @PostMapping("/list")
    public ApiResponse<List<AtBatResponse>> list(@Valid @RequestBody ListAtBatsRequest request) {
        return atBatService.list(request);
    }
}
