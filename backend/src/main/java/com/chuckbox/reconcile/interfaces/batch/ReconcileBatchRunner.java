package com.chuckbox.reconcile.interfaces.batch;

import com.chuckbox.reconcile.application.reconcile.ChecklistReconcileAppService;
import com.chuckbox.reconcile.application.reconcile.ReconcileBatchResult;
import com.chuckbox.reconcile.interfaces.batch.dto.AuthoritativeIdDocument;
import com.chuckbox.reconcile.interfaces.batch.dto.CanonicalOutputDocument.CanonicalChecklist;
import com.chuckbox.reconcile.interfaces.batch.dto.CanonicalOutputDocument.CanonicalVersion;
import com.chuckbox.reconcile.interfaces.batch.dto.DiscrepancyOutputDocument;
import com.chuckbox.reconcile.interfaces.batch.dto.DiscrepancyOutputDocument.DiscrepancyRecord;
import com.chuckbox.reconcile.interfaces.batch.dto.VisualScrapeDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * One-shot batch entry: load both inputs, reconcile, write both outputs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "reconcile.batch.enabled", havingValue = "true")
public class ReconcileBatchRunner implements ApplicationRunner {

    private final ChecklistDocumentStore documentStore;
    private final ChecklistReconcileAppService reconcileAppService;

    @Value("${reconcile.input.identifiers-path:data/csv-requirement-ids.json}")
    private String identifiersPath;

    @Value("${reconcile.input.scrape-path:data/merit-badge-requirements-scraped.json}")
    private String scrapePath;

    @Value("${reconcile.output.canonical-path:data/bsa-data-canonical-new.json}")
    private String canonicalPath;

    @Value("${reconcile.output.discrepancy-path:data/discrepancy-report.json}")
    private String discrepancyPath;

    @Value("${reconcile.output.sample-size:5}")
    private int sampleSize;

    @Override
    public void run(ApplicationArguments args) {
        AuthoritativeIdDocument identifiers = documentStore.loadIdentifiers(Path.of(identifiersPath));
        VisualScrapeDocument scrape = documentStore.loadScrape(Path.of(scrapePath)).orElse(null);

        ReconcileBatchResult result = reconcileAppService.reconcile(identifiers, scrape);

        documentStore.write(Path.of(canonicalPath), result.canonical());
        documentStore.write(Path.of(discrepancyPath), result.discrepancies());

        logSummary(result);
    }

    private void logSummary(ReconcileBatchResult result) {
        int versions = 0;
        int requirements = 0;
        for (CanonicalChecklist checklist : result.canonical().checklists()) {
            for (CanonicalVersion version : checklist.versions()) {
                versions++;
                requirements += version.requirementCount();
            }
        }
        DiscrepancyOutputDocument report = result.discrepancies();
        log.info("Reconciled {} checklists, {} versions, {} requirements",
                result.canonical().checklists().size(), versions, requirements);
        log.info("Discrepancies: total={}, byKind={}, unmatchedByFormat={}",
                report.totalDiscrepancies(), report.byKind(), report.unmatchedByFormat());
        log.info("Wrote {} and {}", canonicalPath, discrepancyPath);

        report.discrepancies().stream()
                .limit(sampleSize)
                .forEach(this::logSample);
    }

    private void logSample(DiscrepancyRecord record) {
        log.info("  [{}] {} v{}: {}", record.type(), record.badgeName(), record.versionYear(), record.description());
    }
}
