package com.chuckbox.reconcile.interfaces.batch;

import com.chuckbox.reconcile.application.reconcile.ChecklistReconcileAppService;
import com.chuckbox.reconcile.application.reconcile.ReconcileBatchResult;
import com.chuckbox.reconcile.interfaces.batch.dto.AuthoritativeIdDocument;
import com.chuckbox.reconcile.interfaces.batch.dto.CanonicalOutputDocument;
import com.chuckbox.reconcile.interfaces.batch.dto.DiscrepancyOutputDocument;
import com.chuckbox.reconcile.interfaces.batch.dto.VisualScrapeDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReconcileBatchRunnerTest {

    @Mock
    private ChecklistDocumentStore documentStore;

    @Mock
    private ChecklistReconcileAppService reconcileAppService;

    private ReconcileBatchRunner runner;

    private final AuthoritativeIdDocument identifiers = new AuthoritativeIdDocument(null, null, List.of());

    private final ReconcileBatchResult result = new ReconcileBatchResult(
            new CanonicalOutputDocument("2026-01-02T03:04:05Z", "chuckbox-reconcile", List.of()),
            new DiscrepancyOutputDocument("2026-01-02T03:04:05Z", 0, Map.of(), Map.of(), List.of())
    );

    @BeforeEach
    void setUp() {
        runner = new ReconcileBatchRunner(documentStore, reconcileAppService);
        ReflectionTestUtils.setField(runner, "identifiersPath", "in/ids.json");
        ReflectionTestUtils.setField(runner, "scrapePath", "in/scrape.json");
        ReflectionTestUtils.setField(runner, "canonicalPath", "out/canonical.json");
        ReflectionTestUtils.setField(runner, "discrepancyPath", "out/discrepancies.json");
        ReflectionTestUtils.setField(runner, "sampleSize", 5);
    }

    @Test
    @DisplayName("loads both inputs, reconciles and writes both outputs")
    void runs_batch() {
        VisualScrapeDocument scrape = new VisualScrapeDocument(List.of(), List.of(), null, null);
        when(documentStore.loadIdentifiers(Path.of("in/ids.json"))).thenReturn(identifiers);
        when(documentStore.loadScrape(Path.of("in/scrape.json"))).thenReturn(Optional.of(scrape));
        when(reconcileAppService.reconcile(identifiers, scrape)).thenReturn(result);

        runner.run(new DefaultApplicationArguments());

        verify(documentStore).write(Path.of("out/canonical.json"), result.canonical());
        verify(documentStore).write(Path.of("out/discrepancies.json"), result.discrepancies());
    }

    @Test
    @DisplayName("missing scrape document reconciles with identifiers only")
    void missing_scrape() {
        when(documentStore.loadIdentifiers(any())).thenReturn(identifiers);
        when(documentStore.loadScrape(any())).thenReturn(Optional.empty());
        when(reconcileAppService.reconcile(any(), isNull())).thenReturn(result);

        runner.run(new DefaultApplicationArguments());

        verify(reconcileAppService).reconcile(identifiers, null);
    }

    @Test
    @DisplayName("unreadable identifier document aborts before writing")
    void identifier_failure() {
        when(documentStore.loadIdentifiers(any())).thenThrow(new ChecklistDocumentException("Identifier document not found"));

        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments()))
                .isInstanceOf(ChecklistDocumentException.class);

        verify(documentStore, never()).write(any(), any());
    }
}
