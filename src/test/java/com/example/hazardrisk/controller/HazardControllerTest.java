package com.example.hazardrisk.controller;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.hazardrisk.application.service.CategoryStatsService;
import com.example.hazardrisk.application.service.EvidenceRetriever;
import com.example.hazardrisk.application.service.HazardScorer;
import com.example.hazardrisk.application.service.IndexRebuildService;
import com.example.hazardrisk.application.service.SiteRiskAggregator;
import com.example.hazardrisk.controller.exception.GlobalExceptionHandler;
import com.example.hazardrisk.domain.model.CategoryStats;
import com.example.hazardrisk.domain.model.EvidenceResult;
import com.example.hazardrisk.domain.model.RiskGrade;
import com.example.hazardrisk.domain.model.SiteRiskResult;
import com.example.hazardrisk.domain.model.ValueCount;
import com.example.hazardrisk.infrastructure.corpus.CorpusUnavailableException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class HazardControllerTest {

    private final EvidenceRetriever evidenceRetriever = mock(EvidenceRetriever.class);
    private final SiteRiskAggregator siteRiskAggregator = mock(SiteRiskAggregator.class);
    private final CategoryStatsService categoryStatsService = mock(CategoryStatsService.class);
    private final IndexRebuildService indexRebuildService = mock(IndexRebuildService.class);

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        HazardController controller = new HazardController(
                evidenceRetriever, new HazardScorer(), siteRiskAggregator, categoryStatsService, indexRebuildService);
        mvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static EvidenceResult fatalFall() {
        return new EvidenceResult(17L, "Worker fell from ladder", "Worker fell from ladder", "Fractured skull",
                "Ladder", "Warehouse", "FATAL", 0, "Fall to lower level", "Ladders", "Fracture", "Head",
                2022, true, 0.9);
    }

    @Test
    void evidenceReturnsWrappedResults() throws Exception {
        when(evidenceRetriever.retrieve("ladder", "Fall Hazard", 2)).thenReturn(List.of(fatalFall()));

        mvc.perform(get("/api/hazards/evidence")
                        .param("label", "ladder")
                        .param("category", "Fall Hazard")
                        .param("k", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value(200))
                .andExpect(jsonPath("$.message").value("Found 1 incidents"))
                .andExpect(jsonPath("$.data[0].incidentId").value(17))
                .andExpect(jsonPath("$.data[0].fatal").value(true))
                .andExpect(jsonPath("$.data[0].outcome").value("FATAL"));
    }

    @Test
    void evidenceAsText() throws Exception {
        when(evidenceRetriever.retrieve("ladder", null, 3)).thenReturn(List.of(fatalFall()));

        mvc.perform(get("/api/hazards/evidence/text").param("label", "ladder"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("1. [2022 | FATAL] Worker fell from ladder -> Fracture, Head")));
    }

    @Test
    void evidenceRejectsOutOfRangeK() throws Exception {
        mvc.perform(get("/api/hazards/evidence").param("label", "ladder").param("k", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("k must be between 1 and 50"))
                .andExpect(jsonPath("$.path").value("/api/hazards/evidence"))
                .andExpect(jsonPath("$.trace").doesNotExist());

        mvc.perform(get("/api/hazards/evidence").param("label", "ladder").param("k", "51"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(evidenceRetriever);
    }

    @Test
    void evidenceRequiresLabel() throws Exception {
        mvc.perform(get("/api/hazards/evidence"))
                .andExpect(status().isBadRequest());
        mvc.perform(get("/api/hazards/evidence").param("label", "   "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("label is required"));
    }

    @Test
    void nonNumericKIsBadRequest() throws Exception {
        mvc.perform(get("/api/hazards/evidence").param("label", "ladder").param("k", "many"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void scoreComputesBreakdown() throws Exception {
        mvc.perform(post("/api/hazards/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"frequency\":250,\"fatalCount\":25,\"avgDaysAway\":45.0,\"severeCount\":50}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.finalScore").value(31.5));
    }

    @Test
    void scoreValidatesBody() throws Exception {
        mvc.perform(post("/api/hazards/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"frequency\":-1,\"fatalCount\":0,\"avgDaysAway\":0,\"severeCount\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("frequency")));

        mvc.perform(post("/api/hazards/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void everyMissingScoreFieldIsListed() throws Exception {
        mvc.perform(post("/api/hazards/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", startsWith("avgDaysAway: ")))
                .andExpect(jsonPath("$.details", hasSize(4)));
    }

    @Test
    void siteRiskDelegatesRegistry() throws Exception {
        SiteRiskResult result = new SiteRiskResult(0.0, RiskGrade.A, RiskGrade.A.explanation(),
                List.of(), List.of(), "None", "", RiskGrade.A.recommendation());
        when(siteRiskAggregator.assess(anyMap())).thenReturn(result);

        mvc.perform(post("/api/hazards/site-risk")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"hazards\":{\"h1\":{\"label\":\"Open trench\",\"category\":\"Caught In/Between\"}}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.grade").value("A"))
                .andExpect(jsonPath("$.data.topConcern").value("None"));
    }

    @Test
    void siteRiskRejectsBlankHazardLabel() throws Exception {
        mvc.perform(post("/api/hazards/site-risk")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"hazards\":{\"h1\":{\"label\":\"\",\"category\":\"Fall Hazard\"}}}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(siteRiskAggregator);
    }

    @Test
    void unavailableCorpusIs503() throws Exception {
        when(siteRiskAggregator.assess(anyMap()))
                .thenThrow(new CorpusUnavailableException("Incident corpus unavailable (count)", null));

        mvc.perform(post("/api/hazards/site-risk")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"hazards\":{\"h1\":{\"label\":\"Ladder\",\"category\":\"Fall Hazard\"}}}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("SERVICE_UNAVAILABLE"))
                .andExpect(jsonPath("$.message").value("Incident corpus unavailable (count)"));
    }

    @Test
    void unexpectedFailureIs500WithoutDetails() throws Exception {
        when(evidenceRetriever.retrieve(anyString(), any(), anyInt())).thenThrow(new IllegalStateException("boom"));

        mvc.perform(get("/api/hazards/evidence").param("label", "ladder"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Internal server error"));
    }

    @Test
    void categoryStatsFallsBackToLiveForUnconfiguredCategory() throws Exception {
        CategoryStats live = new CategoryStats(4, 0, 2, 12.0, 20, 0.0,
                List.of(new ValueCount("Ice", 3)), List.of(new ValueCount("Ankle", 2)), Map.of("2024", 4L));
        when(categoryStatsService.allStats()).thenReturn(Map.of());
        when(categoryStatsService.statsFor(eq("Overexertion"))).thenReturn(live);

        mvc.perform(get("/api/hazards/stats/category").param("name", "Overexertion"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.category").value("Overexertion"))
                .andExpect(jsonPath("$.data.stats.totalCount").value(4))
                .andExpect(jsonPath("$.data.headline", containsString("4 Overexertion incidents recorded.")));
    }

    @Test
    void categoryReportAsText() throws Exception {
        when(categoryStatsService.detailedReport("Fall Hazard")).thenReturn("Fall Hazard Statistics");

        mvc.perform(get("/api/hazards/stats/category/text").param("name", "Fall Hazard"))
                .andExpect(status().isOk())
                .andExpect(content().string("Fall Hazard Statistics"));
    }

    @Test
    void rebuildIndexReportsCounts() throws Exception {
        when(indexRebuildService.rebuild()).thenReturn(new IndexRebuildService.RebuildResult(1200, 2, 350));

        mvc.perform(post("/api/hazards/index/rebuild"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.indexed").value(1200))
                .andExpect(jsonPath("$.data.pages").value(2));
    }
}
