package com.example.hazardrisk.application.service;

import static com.example.hazardrisk.support.IncidentFixtures.incident;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.hazardrisk.infrastructure.corpus.CorpusUnavailableException;
import com.example.hazardrisk.infrastructure.search.ElasticsearchIncidentSearch;
import com.example.hazardrisk.support.InMemoryIncidentCorpus;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

class IndexRebuildServiceTest {

    private final ElasticsearchIncidentSearch index = mock(ElasticsearchIncidentSearch.class);

    private final InMemoryIncidentCorpus corpus = new InMemoryIncidentCorpus(
            incident(1).build(), incident(2).build(), incident(3).build(),
            incident(4).build(), incident(5).build());

    @BeforeEach
    void setUp() {
        when(index.bulkIndex(anyList())).thenAnswer(inv -> inv.<List<?>>getArgument(0).size());
    }

    @Test
    void pagesThroughCorpusInIdOrder() {
        IndexRebuildService service = new IndexRebuildService(corpus, index, 2, false, false);

        IndexRebuildService.RebuildResult result = service.rebuild();

        assertThat(result.indexed()).isEqualTo(5);
        assertThat(result.pages()).isEqualTo(3);
        verify(index).ensureIndexExists();
        verify(index, times(3)).bulkIndex(anyList());
    }

    @Test
    void exactMultipleOfPageSizeStopsOnEmptyPage() {
        InMemoryIncidentCorpus four = new InMemoryIncidentCorpus(
                incident(10).build(), incident(20).build(), incident(30).build(), incident(40).build());
        IndexRebuildService service = new IndexRebuildService(four, index, 2, false, false);

        assertThat(service.rebuild().pages()).isEqualTo(2);
    }

    @Test
    void startupRebuildOnlyWhenEnabled() {
        new IndexRebuildService(corpus, index, 100, false, false).run(new DefaultApplicationArguments());
        verify(index, never()).ensureIndexExists();
        verify(index, never()).indexExists();

        new IndexRebuildService(corpus, index, 100, true, false).run(new DefaultApplicationArguments());
        verify(index).ensureIndexExists();
        verify(index).bulkIndex(anyList());
    }

    @Test
    void missingIndexIsBuiltAtStartup() {
        when(index.indexExists()).thenReturn(false);

        new IndexRebuildService(corpus, index, 100, false, true).run(new DefaultApplicationArguments());

        verify(index).ensureIndexExists();
        verify(index).bulkIndex(anyList());
    }

    @Test
    void existingIndexIsLeftAloneAtStartup() {
        when(index.indexExists()).thenReturn(true);

        new IndexRebuildService(corpus, index, 100, false, true).run(new DefaultApplicationArguments());

        verify(index, never()).ensureIndexExists();
        verify(index, never()).bulkIndex(anyList());
    }

    @Test
    void unreachableClusterDoesNotFailStartup() {
        when(index.indexExists()).thenThrow(new CorpusUnavailableException("es down", null));
        IndexRebuildService service = new IndexRebuildService(corpus, index, 100, false, true);

        assertThatCode(() -> service.run(new DefaultApplicationArguments())).doesNotThrowAnyException();
        verify(index, never()).bulkIndex(anyList());
    }
}
