package com.yescount.planner.application;

import com.yescount.planner.domain.model.Event;
import com.yescount.planner.domain.model.IngestionOutcome;
import com.yescount.planner.domain.model.IngestionRun;
import com.yescount.planner.domain.model.IngestionSettings;
import com.yescount.planner.domain.model.RunStatus;
import com.yescount.planner.domain.model.SourceCheck;
import com.yescount.planner.domain.model.SourceCheckStatus;
import com.yescount.planner.domain.model.SourceTarget;
import com.yescount.planner.domain.model.VectorMetadata;
import com.yescount.planner.domain.port.out.EmbeddingClient;
import com.yescount.planner.domain.port.out.EventRepository;
import com.yescount.planner.domain.port.out.IngestionLock;
import com.yescount.planner.domain.port.out.IngestionRunRepository;
import com.yescount.planner.domain.port.out.ScrapedEventProvider;
import com.yescount.planner.domain.port.out.SourceCatalog;
import com.yescount.planner.domain.port.out.SourceFetchException;
import com.yescount.planner.domain.port.out.StructuredEventProvider;
import com.yescount.planner.domain.port.out.VectorCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Runs the ingestion pipeline once: structured API first, then every configured scraped site,
 * each isolated from the others. Every started run is finalized exactly once.
 */
@Service
public class RunIngestion {

    private static final Logger logger = LoggerFactory.getLogger(RunIngestion.class);

    static final String REASON_FRESH_ENOUGH = "fresh_enough";
    static final String REASON_ALREADY_RUNNING = "already_running";
    static final String NOT_CONFIGURED = "NYC_OPEN_DATA_DATASET_ID not configured";
    static final String DISABLED = "disabled";
    static final String NO_EVENTS = "no events extracted";

    private final StructuredEventProvider structuredProvider;
    private final ScrapedEventProvider scrapedProvider;
    private final SourceCatalog sourceCatalog;
    private final EventRepository eventRepository;
    private final IngestionRunRepository runRepository;
    private final IngestionLock ingestionLock;
    private final Optional<EmbeddingClient> embeddingClient;
    private final Optional<VectorCollection> vectorCollection;
    private final IngestionSettings settings;
    private final Clock clock;

    public RunIngestion(StructuredEventProvider structuredProvider,
                        ScrapedEventProvider scrapedProvider,
                        SourceCatalog sourceCatalog,
                        EventRepository eventRepository,
                        IngestionRunRepository runRepository,
                        IngestionLock ingestionLock,
                        Optional<EmbeddingClient> embeddingClient,
                        Optional<VectorCollection> vectorCollection,
                        IngestionSettings settings,
                        Clock clock) {
        this.structuredProvider = structuredProvider;
        this.scrapedProvider = scrapedProvider;
        this.sourceCatalog = sourceCatalog;
        this.eventRepository = eventRepository;
        this.runRepository = runRepository;
        this.ingestionLock = ingestionLock;
        this.embeddingClient = embeddingClient;
        this.vectorCollection = vectorCollection;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * @param force ignore the staleness gate
     */
    public IngestionOutcome run(boolean force) {
        if (!ingestionLock.tryAcquire(settings.lockTtl())) {
            logger.info("Ingestion already running elsewhere, skipping");
            return IngestionOutcome.skipped(REASON_ALREADY_RUNNING);
        }
        try {
            if (!force && !shouldRefresh()) {
                logger.info("Latest ingestion is fresh enough, skipping");
                return IngestionOutcome.skipped(REASON_FRESH_ENOUGH);
            }
            return ingest();
        } finally {
            ingestionLock.release();
        }
    }

    boolean shouldRefresh() {
        Optional<IngestionRun> latest = runRepository.findLatestCompleted();
        if (latest.isEmpty() || latest.get().finishedAt() == null) {
            return true;
        }
        Duration age = Duration.between(latest.get().finishedAt(), OffsetDateTime.now(clock));
        return age.compareTo(settings.maxStaleness()) > 0;
    }

    // ===== Private Helper Methods =====

    private IngestionOutcome ingest() {
        long runId = runRepository.createRun();
        RunState state = new RunState();

        try {
            processStructuredSource(runId, state);
            for (SourceTarget source : sourceCatalog.loadSources()) {
                processScrapedSource(runId, source, state);
            }

            if (!state.requiredFailed.isEmpty()) {
                RunStatus status = settings.requiredSourcesStrict() ? RunStatus.FAILED : RunStatus.DEGRADED;
                List<String> failed = new ArrayList<>(new TreeSet<>(state.requiredFailed));
                String summary = "required source failures: " + String.join(", ", failed);
                runRepository.finalizeRun(runId, status, state.totalUpserted, summary);
                logger.warn("run_status={} total_events={} {}", status.code(), state.totalUpserted, summary);
                return IngestionOutcome.requiredSourcesFailed(status, state.totalUpserted, failed);
            }

            runRepository.finalizeRun(runId, RunStatus.SUCCESS, state.totalUpserted, "");
            logger.info("run_status={} total_events={}", RunStatus.SUCCESS.code(), state.totalUpserted);
            return IngestionOutcome.success(state.totalUpserted);

        } catch (Exception e) {
            List<String> errors = List.of(messageOf(e));
            String summary = SourceCheck.truncate(String.join("; ", errors), SourceCheck.MAX_ERROR_LENGTH);
            runRepository.finalizeRun(runId, RunStatus.FAILED, state.totalUpserted, summary);
            logger.error("run_status={} total_events={} error={}", RunStatus.FAILED.code(),
                    state.totalUpserted, errors.get(0), e);
            return IngestionOutcome.failed(state.totalUpserted, errors);
        }
    }

    private void processStructuredSource(long runId, RunState state) {
        String name = structuredProvider.sourceName();
        String url = structuredProvider.sourceUrl();

        if (!structuredProvider.isConfigured()) {
            record(new SourceCheck(runId, name, url, true, SourceCheckStatus.SKIPPED, 0, NOT_CONFIGURED));
            state.requiredFailed.add(name);
            return;
        }
        fetchAndStore(runId, name, url, true, structuredProvider::fetchEvents, false, state);
    }

    private void processScrapedSource(long runId, SourceTarget source, RunState state) {
        if (!source.enabled()) {
            record(new SourceCheck(runId, source.name(), source.url(), source.required(),
                    SourceCheckStatus.SKIPPED, 0, DISABLED));
            return;
        }
        fetchAndStore(runId, source.name(), source.url(), source.required(),
                () -> scrapedProvider.scrape(source), true, state);
    }

    private void fetchAndStore(long runId, String name, String url, boolean required,
                               Supplier<List<Event>> fetch, boolean reportEmpty, RunState state) {
        BatchResult result;
        try {
            result = upsertAndEmbed(fetch.get());
        } catch (SourceFetchException e) {
            failSource(runId, name, url, required, e, state);
            return;
        } catch (Exception e) {
            logger.error("Unexpected error processing source {}", name, e);
            failSource(runId, name, url, required, e, state);
            return;
        }

        state.totalUpserted += result.inserted();
        SourceCheckStatus status = result.inserted() > 0 ? SourceCheckStatus.SUCCESS : SourceCheckStatus.PARTIAL;
        List<String> notes = new ArrayList<>();
        if (reportEmpty && result.inserted() == 0) {
            notes.add(NO_EVENTS);
        }
        if (result.skippedInvalidDate() > 0) {
            notes.add("skipped_invalid_date=" + result.skippedInvalidDate());
        }
        if (result.skippedUpsertError() > 0) {
            notes.add("skipped_upsert_error=" + result.skippedUpsertError());
        }
        record(new SourceCheck(runId, name, url, required, status, result.inserted(), String.join("; ", notes)));
    }

    private void failSource(long runId, String name, String url, boolean required, Exception e, RunState state) {
        if (required) {
            state.requiredFailed.add(name);
        }
        record(new SourceCheck(runId, name, url, required, SourceCheckStatus.FAILED, 0, messageOf(e)));
    }

    private BatchResult upsertAndEmbed(List<Event> events) {
        List<Event> stored = new ArrayList<>();
        int skippedInvalidDate = 0;
        int skippedUpsertError = 0;

        for (Event event : events) {
            if (event.dateStart() == null) {
                skippedInvalidDate++;
                logger.warn("skip_event reason=invalid_date_start source={} source_id={} title={}",
                        event.source().code(), event.sourceId(), abbreviate(event.title(), 80));
                continue;
            }
            try {
                stored.add(event.withId(eventRepository.upsert(event)));
            } catch (RuntimeException e) {
                skippedUpsertError++;
                logger.warn("skip_event reason=upsert_error source={} source_id={} error={}",
                        event.source().code(), event.sourceId(), e.getMessage());
            }
        }

        embed(stored);
        return new BatchResult(stored.size(), skippedInvalidDate, skippedUpsertError);
    }

    private void embed(List<Event> stored) {
        if (stored.isEmpty() || embeddingClient.isEmpty() || vectorCollection.isEmpty()) {
            return;
        }
        try {
            List<String> documents = stored.stream().map(RunIngestion::embeddingDocument).toList();
            List<List<Double>> vectors = embeddingClient.get().embedBatch(documents);
            for (int i = 0; i < stored.size() && i < vectors.size(); i++) {
                List<Double> vector = vectors.get(i);
                if (vector == null || vector.isEmpty()) {
                    continue;
                }
                Event event = stored.get(i);
                vectorCollection.get().upsert(VectorCollection.idFor(event.id()), documents.get(i), vector,
                        VectorMetadata.of(event));
            }
        } catch (RuntimeException e) {
            logger.warn("Embedding upsert failed for {} events, search will fall back to filters: {}",
                    stored.size(), e.getMessage());
        }
    }

    private void record(SourceCheck check) {
        runRepository.recordSourceCheck(check);
        if (check.status() == SourceCheckStatus.FAILED || check.status() == SourceCheckStatus.PARTIAL) {
            logger.warn("source={} status={} events={} error={}", check.sourceName(), check.status().code(),
                    check.eventsFound(), check.error());
        } else {
            logger.info("source={} status={} events={} error={}", check.sourceName(), check.status().code(),
                    check.eventsFound(), check.error());
        }
    }

    static String embeddingDocument(Event event) {
        return String.join(" | ", event.title(), event.description(), event.location()).strip();
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String abbreviate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }

    private record BatchResult(int inserted, int skippedInvalidDate, int skippedUpsertError) {}

    private static final class RunState {
        int totalUpserted;
        final List<String> requiredFailed = new ArrayList<>();
    }
}
