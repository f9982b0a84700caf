package com.tony.gridironAnalytics.controller;

import com.tony.gridironAnalytics.config.BettingProperties;
import com.tony.gridironAnalytics.model.VegasLine;
import com.tony.gridironAnalytics.model.dto.ValidationMetrics;
import com.tony.gridironAnalytics.model.dto.ValidationRequest;
import com.tony.gridironAnalytics.model.dto.ValueBet;
import com.tony.gridironAnalytics.model.dto.ValueBetRequest;
import com.tony.gridironAnalytics.service.MockMarketService;
import com.tony.gridironAnalytics.service.ValueBetService;
import com.tony.gridironAnalytics.service.VegasValidationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/vegas")
@RequiredArgsConstructor
@Slf4j
public class VegasController {
    private final ValueBetService valueBetService;
    private final VegasValidationService validationService;
    private final MockMarketService mockMarketService;
    private final BettingProperties properties;

    // Les prédictions viennent du classifieur externe, le marché est simulé
    @PostMapping("/value-bets")
    public ResponseEntity<List<ValueBet>> findValueBets(@Valid @RequestBody ValueBetRequest request) {
        double minEdge = request.minEdge() != null ? request.minEdge() : properties.getMinEdge();
        double minConfidence = request.minConfidence() != null ? request.minConfidence() : properties.getMinConfidence();

        List<VegasLine> lines = mockMarketService.createMockLinesForPredictions(request.predictions());
        return ResponseEntity.ok(valueBetService.findValueBets(request.predictions(), lines, minEdge, minConfidence));
    }

    @PostMapping("/validation")
    public ResponseEntity<ValidationMetrics> validate(@Valid @RequestBody ValidationRequest request) {
        log.info("🚀 Validation de {} prédictions contre le marché", request.predictions().size());
        List<VegasLine> lines = mockMarketService.createMockLinesForPredictions(request.predictions());
        return ResponseEntity.ok(validationService.validatePredictions(
                request.predictions(), lines, request.actualWinners()));
    }
}
