package com.chuckbox.reconcile.application.reconcile;

import com.chuckbox.reconcile.domain.requirement.model.DiscrepancyEntry;
import com.chuckbox.reconcile.domain.requirement.model.DiscrepancyKind;
import com.chuckbox.reconcile.domain.requirement.model.IdFormat;
import com.chuckbox.reconcile.domain.requirement.model.ReconciliationResult;
import com.chuckbox.reconcile.infrastructure.reconcile.ReconciliationPipeline;
import com.chuckbox.reconcile.interfaces.batch.dto.AuthoritativeIdDocument;
import com.chuckbox.reconcile.interfaces.batch.dto.AuthoritativeIdDocument.ChecklistIds;
import com.chuckbox.reconcile.interfaces.batch.dto.CanonicalOutputDocument;
import com.chuckbox.reconcile.interfaces.batch.dto.CanonicalOutputDocument.CanonicalChecklist;
import com.chuckbox.reconcile.interfaces.batch.dto.CanonicalOutputDocument.CanonicalRequirement;
import com.chuckbox.reconcile.interfaces.batch.dto.CanonicalOutputDocument.CanonicalVersion;
import com.chuckbox.reconcile.interfaces.batch.dto.DiscrepancyOutputDocument;
import com.chuckbox.reconcile.interfaces.batch.dto.DiscrepancyOutputDocument.DiscrepancyRecord;
import com.chuckbox.reconcile.interfaces.batch.dto.VisualScrapeDocument;
import com.chuckbox.reconcile.interfaces.batch.dto.VisualScrapeDocument.ScrapedChecklist;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Document-level merge: pairs every identifier version with its scraped version,
 * reconciles each pair and assembles the canonical and discrepancy documents.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChecklistReconcileAppService {

    private final ReconciliationPipeline reconciliationPipeline;
    private final Clock clock;

    @Value("${reconcile.output.source:chuckbox-reconcile}")
    private String source;

    @Value("${reconcile.output.eagle-required:}")
    private List<String> eagleRequired;

    /**
     * Reconcile every checklist version of the identifier document.
     *
     * @param identifiers authoritative identifiers per version
     * @param scrape      visual-scrape document, or null when none is available
     */
    public ReconcileBatchResult reconcile(AuthoritativeIdDocument identifiers, VisualScrapeDocument scrape) {
        Map<String, ScrapedChecklist> scrapedByKey = new HashMap<>();
        Map<String, Set<Integer>> scrapedYearsByName = new HashMap<>();
        if (scrape != null) {
            for (ScrapedChecklist scraped : scrape.badges()) {
                if (scraped == null) {
                    continue;
                }
                scrapedByKey.put(key(scraped.badgeName(), scraped.versionYear()), scraped);
                scrapedYearsByName.computeIfAbsent(scraped.badgeName().toLowerCase(Locale.ROOT), k -> new TreeSet<>())
                        .add(scraped.versionYear());
            }
        }

        Map<String, List<ChecklistIds>> versionsByName = new LinkedHashMap<>();
        for (ChecklistIds version : identifiers.badges()) {
            if (version == null) {
                continue;
            }
            versionsByName.computeIfAbsent(version.badgeName().toLowerCase(Locale.ROOT), k -> new ArrayList<>())
                    .add(version);
        }

        List<DiscrepancyRecord> discrepancies = new ArrayList<>();
        Map<IdFormat, Integer> unmatchedByFormat = new EnumMap<>(IdFormat.class);
        List<CanonicalChecklist> checklists = new ArrayList<>();

        for (List<ChecklistIds> versions : versionsByName.values()) {
            String name = versions.get(0).badgeName();
            List<CanonicalVersion> canonicalVersions = new ArrayList<>();

            for (ChecklistIds version : versions) {
                ScrapedChecklist scraped = scrapedByKey.get(key(name, version.versionYear()));
                if (scraped == null) {
                    discrepancies.add(missingScrape(name, version.versionYear(),
                            scrapedYearsByName.get(name.toLowerCase(Locale.ROOT))));
                    canonicalVersions.add(identifiersOnly(version));
                    continue;
                }

                ReconciliationResult result = reconciliationPipeline.execute(
                        name, version.versionYear(), version.requirementIds(), scraped.toVisualNodes());

                canonicalVersions.add(new CanonicalVersion(
                        version.versionYear(),
                        result.roots().stream().map(CanonicalRequirement::from).toList()
                ));
                for (DiscrepancyEntry entry : result.discrepancies().entries()) {
                    discrepancies.add(toRecord(name, version.versionYear(), entry));
                }
                result.discrepancies().unmatchedByFormat()
                        .forEach((format, count) -> unmatchedByFormat.merge(format, count, Integer::sum));
            }

            canonicalVersions.sort(Comparator.comparingInt(CanonicalVersion::versionYear).reversed());
            checklists.add(new CanonicalChecklist(slugify(name), name, null, isEagleRequired(name), true,
                    List.copyOf(canonicalVersions)));
        }

        checklists.sort(Comparator.comparing(CanonicalChecklist::name, String.CASE_INSENSITIVE_ORDER));

        String generatedAt = clock.instant().toString();
        CanonicalOutputDocument canonical = new CanonicalOutputDocument(generatedAt, source, List.copyOf(checklists));
        DiscrepancyOutputDocument report = new DiscrepancyOutputDocument(
                generatedAt,
                discrepancies.size(),
                countByKind(discrepancies),
                tagged(unmatchedByFormat),
                List.copyOf(discrepancies)
        );
        return new ReconcileBatchResult(canonical, report);
    }

    static String slugify(String name) {
        return name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_|_$", "");
    }

    private boolean isEagleRequired(String name) {
        return eagleRequired != null && eagleRequired.stream().anyMatch(n -> n.strip().equalsIgnoreCase(name));
    }

    private static CanonicalVersion identifiersOnly(ChecklistIds version) {
        List<CanonicalRequirement> requirements = new ArrayList<>();
        List<String> ids = version.requirementIds();
        for (int i = 0; i < ids.size(); i++) {
            requirements.add(new CanonicalRequirement(ids.get(i), ids.get(i), "", false, i, null, List.of(), List.of()));
        }
        return new CanonicalVersion(version.versionYear(), List.copyOf(requirements));
    }

    private static DiscrepancyRecord missingScrape(String name, int year, Set<Integer> scrapedYears) {
        if (scrapedYears == null || scrapedYears.isEmpty()) {
            log.warn("No scraped UI data for {} v{}", name, year);
            return new DiscrepancyRecord(DiscrepancyKind.BADGE_NOT_ACCESSIBLE.tag(), name, year, null, null,
                    "No scraped UI data found for " + name + " version " + year,
                    "Run scraper on this badge version");
        }
        log.warn("Scraped UI data for {} covers {} but not v{}", name, scrapedYears, year);
        return new DiscrepancyRecord(DiscrepancyKind.VERSION_MISMATCH.tag(), name, year, null, null,
                "Scraped UI data for " + name + " covers versions " + scrapedYears + " but not " + year,
                "Scrape version " + year + " or check the version year in the CSV export");
    }

    private static DiscrepancyRecord toRecord(String name, int year, DiscrepancyEntry entry) {
        boolean uiSide = entry.kind() == DiscrepancyKind.UI_NOT_MATCHED;
        return new DiscrepancyRecord(
                entry.kind().tag(),
                name,
                year,
                uiSide ? null : entry.identifier(),
                uiSide ? entry.identifier() : null,
                entry.explanation(),
                entry.suggestedAction()
        );
    }

    private static Map<String, Integer> countByKind(List<DiscrepancyRecord> discrepancies) {
        Map<String, Integer> byKind = new LinkedHashMap<>();
        for (DiscrepancyRecord record : discrepancies) {
            byKind.merge(record.type(), 1, Integer::sum);
        }
        return byKind;
    }

    private static Map<String, Integer> tagged(Map<IdFormat, Integer> byFormat) {
        Map<String, Integer> result = new LinkedHashMap<>();
        byFormat.forEach((format, count) -> result.put(format.tag(), count));
        return result;
    }

    private static String key(String name, int year) {
        return name.toLowerCase(Locale.ROOT) + ":" + year;
    }
}
