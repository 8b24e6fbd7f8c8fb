package com.anxietycompanion.controller;

import com.anxietycompanion.model.dto.AnalysisRequest;
import com.anxietycompanion.model.dto.AssessmentDto;
import com.anxietycompanion.service.AnxietyAnalysisService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * One-shot analysis of a message outside any conversation.
 */
@RestController
@RequestMapping("/api/analysis")
@RequiredArgsConstructor
public class AnalysisController {

    private final AnxietyAnalysisService analysisService;

    @PostMapping
    public ResponseEntity<AssessmentDto> analyze(@Valid @RequestBody AnalysisRequest request) {
        return ResponseEntity.ok(AssessmentDto.from(
                analysisService.analyze(request.getMessage(), request.getRecentHistory())));
    }
}
