package com.fincore.foresight.training;

import com.fincore.foresight.config.ForesightProperties;
import com.fincore.foresight.domain.exception.TrainingFailureException;
import com.fincore.foresight.domain.model.MetricPoint;
import com.fincore.foresight.domain.model.SeriesKey;
import com.fincore.foresight.domain.repository.MetricStore;
import com.fincore.foresight.ml.AnomalyModel;
import com.fincore.foresight.ml.FitLease;
import com.fincore.foresight.ml.ForecastModel;
import com.fincore.foresight.ml.ModelRegistry;
import com.fincore.foresight.observability.ForesightMetrics;
import com.fincore.foresight.observability.ForesightStructuredLogger;
import com.fincore.foresight.observability.ForesightStructuredLogger.SeriesEventType;
import com.fincore.foresight.observability.ForesightStructuredLogger.TrainingEventType;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs training passes over everything currently in the metric store.
 * <p>
 * A pass works on a point-in-time snapshot, groups it by series and fits the forecast
 * and anomaly model of every series with enough points. Series are fitted on a bounded
 * worker pool, each under its own time budget, so one failing or stuck series never
 * aborts the others. Failures are logged and counted, never rethrown.
 * <p>
 * Passes requested through {@link #triggerTraining()} run on a dedicated background
 * thread. A request arriving while a pass is running schedules exactly one follow-up
 * pass.
 */
@Slf4j
@Component
public class TrainingOrchestrator {

    private final MetricStore metricStore;
    private final ModelRegistry modelRegistry;
    private final ForesightProperties.Training settings;
    private final ForesightMetrics metrics;
    private final ForesightStructuredLogger structuredLogger;
    private final Clock clock;

    private final ExecutorService trainingExecutor;
    private final ExecutorService fitExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean rerunRequested = new AtomicBoolean(false);
    private final AtomicReference<TrainingSummary> lastSummary = new AtomicReference<>();

    public TrainingOrchestrator(MetricStore metricStore,
                                ModelRegistry modelRegistry,
                                ForesightProperties properties,
                                ForesightMetrics metrics,
                                ForesightStructuredLogger structuredLogger,
                                Clock clock) {
        this.metricStore = metricStore;
        this.modelRegistry = modelRegistry;
        this.settings = properties.getTraining();
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
        this.trainingExecutor = Executors.newSingleThreadExecutor(
                r -> daemon(r, "foresight-training"));
        // unbounded so a fit that ignores cancellation cannot starve later series;
        // the dispatch loop caps fits in flight at the configured parallelism
        AtomicInteger fitThreads = new AtomicInteger();
        this.fitExecutor = Executors.newCachedThreadPool(
                r -> daemon(r, "foresight-fit-" + fitThreads.incrementAndGet()));
    }

    /**
     * Request a training pass in the background and return immediately.
     *
     * @return {@code true} if a new pass was started, {@code false} if the request was
     * folded into the pass already running
     */
    public boolean triggerTraining() {
        rerunRequested.set(true);
        if (!running.compareAndSet(false, true)) {
            log.debug("Training pass already running, follow-up pass queued");
            return false;
        }
        trainingExecutor.execute(this::drainRequests);
        return true;
    }

    /**
     * Periodic retraining, enabled with {@code foresight.training.schedule-enabled}.
     */
    @Scheduled(fixedDelayString = "${foresight.training.schedule-interval:PT15M}",
            initialDelayString = "${foresight.training.schedule-interval:PT15M}")
    public void scheduledTraining() {
        if (settings.isScheduleEnabled()) {
            log.debug("Scheduled training triggered");
            triggerTraining();
        }
    }

    public boolean isTrainingInProgress() {
        return running.get();
    }

    public Optional<TrainingSummary> getLastSummary() {
        return Optional.ofNullable(lastSummary.get());
    }

    private void drainRequests() {
        try {
            while (rerunRequested.getAndSet(false)) {
                try {
                    trainAll();
                } catch (RuntimeException e) {
                    log.error("Training pass aborted", e);
                }
            }
        } finally {
            running.set(false);
        }
        // a trigger may have landed between the last check and the reset above
        if (rerunRequested.get() && running.compareAndSet(false, true)) {
            trainingExecutor.execute(this::drainRequests);
        }
    }

    /**
     * Run one training pass synchronously on the calling thread.
     */
    public TrainingSummary trainAll() {
        String runId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        Timer.Sample sample = metrics.startTrainingTimer();

        List<MetricPoint> snapshot = metricStore.snapshot();
        Map<SeriesKey, List<MetricPoint>> groups = new LinkedHashMap<>();
        for (MetricPoint point : snapshot) {
            groups.computeIfAbsent(point.seriesKey(), k -> new ArrayList<>()).add(point);
        }

        structuredLogger.logTrainingEvent(runId, TrainingEventType.PASS_STARTED, "Training pass started",
                Map.of("snapshotPoints", snapshot.size(), "series", groups.size()));

        TrainingSummary summary = TrainingSummary.builder()
                .runId(runId)
                .startedAt(startedAt)
                .snapshotPoints(snapshot.size())
                .seriesSeen(groups.size())
                .build();

        List<Map.Entry<SeriesKey, List<MetricPoint>>> eligible = new ArrayList<>();
        for (Map.Entry<SeriesKey, List<MetricPoint>> group : groups.entrySet()) {
            if (group.getValue().size() < settings.getMinSeriesPoints()) {
                summary.setSeriesSkipped(summary.getSeriesSkipped() + 1);
                metrics.recordSeriesSkipped();
                structuredLogger.logSeriesEvent(runId, group.getKey(), SeriesEventType.SKIPPED,
                        "Not enough points to train", Map.of("points", group.getValue().size()));
            } else {
                eligible.add(group);
            }
        }

        runFits(runId, eligible, summary);

        summary.setCompletedAt(clock.instant());
        metrics.recordTrainingPass(sample);
        lastSummary.set(summary);

        Duration duration = Duration.between(startedAt, summary.getCompletedAt());
        structuredLogger.logTrainingDuration(runId, duration, groups.size());
        structuredLogger.logTrainingEvent(runId, TrainingEventType.PASS_COMPLETED, "Training pass completed",
                Map.of("trained", summary.getSeriesTrained(),
                        "skipped", summary.getSeriesSkipped(),
                        "failed", summary.getSeriesFailed(),
                        "timedOut", summary.getSeriesTimedOut()));
        return summary;
    }

    /**
     * Fit every eligible series with at most {@code parallelism} fits in flight. A fit's
     * budget starts when it is dispatched. A fit that overruns it has its lease revoked,
     * is interrupted and gives up its slot at once, whether or not it honours the
     * interrupt.
     */
    private void runFits(String runId, List<Map.Entry<SeriesKey, List<MetricPoint>>> eligible,
                         TrainingSummary summary) {
        CompletionService<Boolean> completions = new ExecutorCompletionService<>(fitExecutor);
        Map<Future<Boolean>, FitTask> inFlight = new HashMap<>();
        long budget = settings.getSeriesTimeout().toNanos();
        int next = 0;

        while (next < eligible.size() || !inFlight.isEmpty()) {
            while (next < eligible.size() && inFlight.size() < settings.getParallelism()) {
                Map.Entry<SeriesKey, List<MetricPoint>> group = eligible.get(next++);
                ForecastModel forecastModel = modelRegistry.getOrCreateForecastModel(group.getKey());
                AnomalyModel anomalyModel = modelRegistry.getOrCreateAnomalyModel(group.getKey());
                FitLease lease = FitLease.open();
                Future<Boolean> future = completions.submit(
                        () -> fitSeries(forecastModel, anomalyModel, group.getValue(), lease));
                inFlight.put(future, new FitTask(group.getKey(), group.getValue().size(), lease,
                        System.nanoTime() + budget));
            }

            long earliestDeadline = inFlight.values().stream()
                    .mapToLong(FitTask::getDeadline)
                    .min()
                    .orElseThrow();
            Future<Boolean> done;
            try {
                done = completions.poll(Math.max(0L, earliestDeadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                inFlight.forEach((future, task) -> abandon(future, task));
                Thread.currentThread().interrupt();
                log.warn("Training pass {} interrupted", runId);
                return;
            }

            if (done != null) {
                // abandoned fits still complete into the queue eventually
                FitTask task = inFlight.remove(done);
                if (task != null) {
                    recordOutcome(runId, task, done, summary);
                }
            }

            long now = System.nanoTime();
            Iterator<Map.Entry<Future<Boolean>, FitTask>> it = inFlight.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<Future<Boolean>, FitTask> entry = it.next();
                if (entry.getKey().isDone() || now - entry.getValue().getDeadline() < 0) {
                    continue;
                }
                it.remove();
                abandon(entry.getKey(), entry.getValue());
                summary.setSeriesTimedOut(summary.getSeriesTimedOut() + 1);
                metrics.recordSeriesTimedOut();
                structuredLogger.logSeriesEvent(runId, entry.getValue().getKey(), SeriesEventType.TIMED_OUT,
                        "Series fit exceeded its time budget",
                        Map.of("timeoutMs", settings.getSeriesTimeout().toMillis()));
            }
        }
    }

    private void recordOutcome(String runId, FitTask task, Future<Boolean> future, TrainingSummary summary) {
        SeriesKey key = task.getKey();
        try {
            if (future.get()) {
                summary.setSeriesTrained(summary.getSeriesTrained() + 1);
                metrics.recordSeriesTrained();
                double accuracy = modelRegistry.findForecastModel(key)
                        .map(ForecastModel::getAccuracy)
                        .orElse(0.0);
                structuredLogger.logSeriesEvent(runId, key, SeriesEventType.TRAINED, "Series trained",
                        Map.of("points", task.getPoints(), "accuracy", accuracy));
            } else {
                summary.setSeriesNotFitted(summary.getSeriesNotFitted() + 1);
                structuredLogger.logSeriesEvent(runId, key, SeriesEventType.NOT_FITTED,
                        "Forecast model not fitted", Map.of("points", task.getPoints()));
            }
        } catch (ExecutionException e) {
            TrainingFailureException failure =
                    new TrainingFailureException(key, String.valueOf(e.getCause().getMessage()), e.getCause());
            summary.setSeriesFailed(summary.getSeriesFailed() + 1);
            metrics.recordSeriesFailed();
            structuredLogger.logSeriesEvent(runId, key, SeriesEventType.FAILED, failure.getMessage(),
                    Map.of("errorType", e.getCause().getClass().getSimpleName()));
            log.debug("Training failure detail for {}", key, failure);
        } catch (InterruptedException e) {
            // the future is already done, get() does not block
            Thread.currentThread().interrupt();
        }
    }

    private static void abandon(Future<Boolean> future, FitTask task) {
        task.getLease().revoke();
        future.cancel(true);
    }

    private boolean fitSeries(ForecastModel forecastModel, AnomalyModel anomalyModel,
                              List<MetricPoint> points, FitLease lease) {
        if (lease.isRevoked()) {
            return false;
        }
        boolean forecastFitted = forecastModel.train(points, lease);
        if (forecastFitted) {
            metrics.recordModelAccuracy(ForesightMetrics.MODEL_TYPE_FORECAST, forecastModel.getAccuracy());
        }
        if (lease.isRevoked()) {
            return false;
        }
        anomalyModel.train(points, lease);
        return forecastFitted;
    }

    @Value
    private static class FitTask {
        SeriesKey key;
        int points;
        FitLease lease;
        long deadline;
    }

    @PreDestroy
    void shutdown() {
        log.info("Shutting down training executors");
        trainingExecutor.shutdownNow();
        fitExecutor.shutdownNow();
        try {
            if (!fitExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Fit workers did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Thread daemon(Runnable runnable, String name) {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        return thread;
    }
}
