package com.tradejournal.service.controller;

import com.tradejournal.core.analytics.MonthlySummary;
import com.tradejournal.core.analytics.StrategyPerformance;
import com.tradejournal.core.equity.EquityCurve;
import com.tradejournal.core.model.Metrics;
import com.tradejournal.core.model.Trade;
import com.tradejournal.core.model.UserProfile;
import com.tradejournal.core.model.UserSettings;
import com.tradejournal.core.risk.RiskBudget;
import com.tradejournal.service.dto.CreateProfileRequest;
import com.tradejournal.service.dto.ResetRequest;
import com.tradejournal.service.dto.TradeCloseRequest;
import com.tradejournal.service.dto.TradeEntryRequest;
import com.tradejournal.service.service.JournalService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.YearMonth;
import java.util.List;

/**
 * REST API of the trade journal. Thin: every endpoint delegates to
 * {@link JournalService}; errors are mapped by {@link JournalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/journal")
public class JournalController {

    private static final Logger log = LoggerFactory.getLogger(JournalController.class);

    private final JournalService journalService;

    public JournalController(JournalService journalService) {
        this.journalService = journalService;
    }

    @PostMapping("/profiles")
    public Mono<ResponseEntity<UserProfile>> createProfile(@RequestBody CreateProfileRequest request) {
        log.info("Profile creation requested. name={}", request.name());
        return journalService.createProfile(request)
            .map(p -> ResponseEntity.status(HttpStatus.CREATED).body(p));
    }

    @GetMapping("/profiles/{profileId}")
    public Mono<ResponseEntity<UserProfile>> profile(@PathVariable String profileId) {
        return journalService.getProfile(profileId).map(ResponseEntity::ok);
    }

    @PutMapping("/profiles/{profileId}/settings")
    public Mono<ResponseEntity<UserProfile>> updateSettings(@PathVariable String profileId,
                                                            @RequestBody UserSettings settings) {
        log.info("Settings update requested. profile={}", profileId);
        return journalService.updateSettings(profileId, settings).map(ResponseEntity::ok);
    }

    @PostMapping("/profiles/{profileId}/trades")
    public Mono<ResponseEntity<Trade>> addTrade(@PathVariable String profileId,
                                                @RequestBody TradeEntryRequest request) {
        log.info("Trade entry requested. profile={} ticker={}", profileId, request.ticker());
        return journalService.addTrade(profileId, request)
            .map(t -> ResponseEntity.status(HttpStatus.CREATED).body(t))
            .doOnError(e -> log.warn("Trade entry rejected. profile={} reason={}", profileId, e.getMessage()));
    }

    @PutMapping("/profiles/{profileId}/trades/{tradeId}")
    public Mono<ResponseEntity<Trade>> editTrade(@PathVariable String profileId,
                                                 @PathVariable String tradeId,
                                                 @RequestBody TradeEntryRequest request) {
        log.info("Trade edit requested. profile={} trade={}", profileId, tradeId);
        return journalService.editTrade(profileId, tradeId, request).map(ResponseEntity::ok);
    }

    @PostMapping("/profiles/{profileId}/trades/{tradeId}/close")
    public Mono<ResponseEntity<Trade>> closeTrade(@PathVariable String profileId,
                                                  @PathVariable String tradeId,
                                                  @RequestBody TradeCloseRequest request) {
        log.info("Trade close requested. profile={} trade={} exitPrice={}", profileId, tradeId, request.exitPrice());
        return journalService.closeTrade(profileId, tradeId, request).map(ResponseEntity::ok);
    }

    @PostMapping("/profiles/{profileId}/trades/{tradeId}/reopen")
    public Mono<ResponseEntity<Trade>> reopenTrade(@PathVariable String profileId,
                                                   @PathVariable String tradeId) {
        log.info("Trade reopen requested. profile={} trade={}", profileId, tradeId);
        return journalService.reopenTrade(profileId, tradeId).map(ResponseEntity::ok);
    }

    @DeleteMapping("/profiles/{profileId}/trades/{tradeId}")
    public Mono<ResponseEntity<Void>> deleteTrade(@PathVariable String profileId,
                                                  @PathVariable String tradeId) {
        log.info("Trade delete requested. profile={} trade={}", profileId, tradeId);
        return journalService.deleteTrade(profileId, tradeId)
            .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @GetMapping("/profiles/{profileId}/metrics")
    public Mono<ResponseEntity<Metrics>> metrics(@PathVariable String profileId) {
        return journalService.metrics(profileId).map(ResponseEntity::ok);
    }

    @GetMapping("/profiles/{profileId}/equity-curve")
    public Mono<ResponseEntity<EquityCurve>> equityCurve(@PathVariable String profileId) {
        return journalService.equityCurve(profileId).map(ResponseEntity::ok);
    }

    @GetMapping("/profiles/{profileId}/strategy-performance")
    public Mono<ResponseEntity<List<StrategyPerformance>>> strategyPerformance(@PathVariable String profileId) {
        return journalService.strategyPerformance(profileId).map(ResponseEntity::ok);
    }

    @GetMapping("/profiles/{profileId}/calendar/{month}")
    public Mono<ResponseEntity<MonthlySummary>> calendar(@PathVariable String profileId,
                                                         @PathVariable String month) {
        return Mono.fromCallable(() -> YearMonth.parse(month))
            .flatMap(ym -> journalService.calendar(profileId, ym))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/profiles/{profileId}/risk-budget")
    public Mono<ResponseEntity<RiskBudget>> riskBudget(@PathVariable String profileId,
                                                       @RequestParam(required = false) Double entryPrice) {
        return journalService.riskBudget(profileId, entryPrice).map(ResponseEntity::ok);
    }

    @PostMapping("/profiles/{profileId}/reset")
    public Mono<ResponseEntity<UserProfile>> reset(@PathVariable String profileId,
                                                   @RequestBody ResetRequest request) {
        log.info("Session reset requested. profile={} newCapital={}", profileId, request.newInitialCapital());
        return journalService.resetSession(profileId, request.newInitialCapital()).map(ResponseEntity::ok);
    }

    @GetMapping(value = "/profiles/{profileId}/backup", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<String>> exportBackup(@PathVariable String profileId) {
        log.info("Backup export requested. profile={}", profileId);
        return journalService.exportBackup(profileId).map(ResponseEntity::ok);
    }

    @PutMapping(value = "/profiles/{profileId}/backup", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<UserProfile>> importBackup(@PathVariable String profileId,
                                                          @RequestBody String backup) {
        log.info("Backup import requested. profile={}", profileId);
        return journalService.importBackup(profileId, backup).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
