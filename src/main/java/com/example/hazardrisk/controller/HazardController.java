package com.example.hazardrisk.controller;

import com.example.hazardrisk.application.service.CategoryStatsService;
import com.example.hazardrisk.application.service.EvidenceRetriever;
import com.example.hazardrisk.application.service.HazardScorer;
import com.example.hazardrisk.application.service.IndexRebuildService;
import com.example.hazardrisk.application.service.RiskReportFormatter;
import com.example.hazardrisk.application.service.SiteRiskAggregator;
import com.example.hazardrisk.domain.dto.CategoryStatsResponse;
import com.example.hazardrisk.domain.dto.ResponseData;
import com.example.hazardrisk.domain.dto.ScoreRequest;
import com.example.hazardrisk.domain.dto.SiteRiskRequest;
import com.example.hazardrisk.domain.model.CategoryStats;
import com.example.hazardrisk.domain.model.EvidenceResult;
import com.example.hazardrisk.domain.model.HazardScoreBreakdown;
import com.example.hazardrisk.domain.model.SiteRiskResult;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/hazards")
public class HazardController {

    static final int MAX_K = 50;

    private final EvidenceRetriever evidenceRetriever;
    private final HazardScorer hazardScorer;
    private final SiteRiskAggregator siteRiskAggregator;
    private final CategoryStatsService categoryStatsService;
    private final IndexRebuildService indexRebuildService;

    public HazardController(
            EvidenceRetriever evidenceRetriever,
            HazardScorer hazardScorer,
            SiteRiskAggregator siteRiskAggregator,
            CategoryStatsService categoryStatsService,
            IndexRebuildService indexRebuildService
    ) {
        this.evidenceRetriever = evidenceRetriever;
        this.hazardScorer = hazardScorer;
        this.siteRiskAggregator = siteRiskAggregator;
        this.categoryStatsService = categoryStatsService;
        this.indexRebuildService = indexRebuildService;
    }

    @GetMapping(path = "/evidence", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseData<List<EvidenceResult>>> evidence(
            @RequestParam("label") String label,
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "k", defaultValue = "3") int k
    ) {
        validateEvidenceParams(label, k);
        List<EvidenceResult> results = evidenceRetriever.retrieve(label, category, k);
        return ResponseEntity.ok(ResponseData.ok("Found " + results.size() + " incidents", results));
    }

    @GetMapping(path = "/evidence/text", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> evidenceText(
            @RequestParam("label") String label,
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "k", defaultValue = "3") int k
    ) {
        validateEvidenceParams(label, k);
        return ResponseEntity.ok(RiskReportFormatter.formatEvidence(evidenceRetriever.retrieve(label, category, k)));
    }

    @PostMapping(path = "/score", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseData<HazardScoreBreakdown>> score(@Valid @RequestBody ScoreRequest request) {
        HazardScoreBreakdown breakdown = hazardScorer.score(
                request.getFrequency(),
                request.getFatalCount(),
                request.getAvgDaysAway(),
                request.getSevereCount()
        );
        return ResponseEntity.ok(ResponseData.ok("Hazard scored", breakdown));
    }

    @PostMapping(path = "/site-risk", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseData<SiteRiskResult>> siteRisk(@Valid @RequestBody SiteRiskRequest request) {
        SiteRiskResult result = siteRiskAggregator.assess(request.getHazards());
        return ResponseEntity.ok(ResponseData.ok("Site assessed", result));
    }

    @PostMapping(path = "/site-risk/report", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> siteRiskReport(@Valid @RequestBody SiteRiskRequest request) {
        return ResponseEntity.ok(RiskReportFormatter.formatSiteReport(siteRiskAggregator.assess(request.getHazards())));
    }

    @GetMapping(path = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseData<Map<String, CategoryStats>>> allStats() {
        return ResponseEntity.ok(ResponseData.ok("Category statistics", categoryStatsService.allStats()));
    }

    @GetMapping(path = "/stats/category", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseData<CategoryStatsResponse>> categoryStats(@RequestParam("name") String category) {
        if (!StringUtils.hasText(category)) {
            throw new IllegalArgumentException("name is required");
        }
        CategoryStats stats = categoryStatsService.allStats().get(category);
        if (stats == null) {
            stats = categoryStatsService.statsFor(category);
        }
        CategoryStatsResponse body = CategoryStatsResponse.builder()
                .category(category)
                .stats(stats)
                .headline(RiskReportFormatter.formatHeadline(category, stats))
                .build();
        return ResponseEntity.ok(ResponseData.ok("Category statistics", body));
    }

    @GetMapping(path = "/stats/category/text", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> categoryStatsText(@RequestParam("name") String category) {
        if (!StringUtils.hasText(category)) {
            throw new IllegalArgumentException("name is required");
        }
        return ResponseEntity.ok(categoryStatsService.detailedReport(category));
    }

    @PostMapping(path = "/stats/refresh", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseData<Map<String, CategoryStats>>> refreshStats() {
        return ResponseEntity.ok(ResponseData.ok("Category statistics rebuilt", categoryStatsService.refresh()));
    }

    @PostMapping(path = "/index/rebuild", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ResponseData<IndexRebuildService.RebuildResult>> rebuildIndex() {
        return ResponseEntity.ok(ResponseData.ok("Lexical index rebuilt", indexRebuildService.rebuild()));
    }

    private static void validateEvidenceParams(String label, int k) {
        if (!StringUtils.hasText(label)) {
            throw new IllegalArgumentException("label is required");
        }
        if (k <= 0 || k > MAX_K) {
            throw new IllegalArgumentException("k must be between 1 and " + MAX_K);
        }
    }
}
