package com.fincore.foresight.ml;

import com.amazon.randomcutforest.RandomCutForest;
import com.fincore.foresight.config.ForesightProperties;
import com.fincore.foresight.domain.model.AnomalyDetection;
import com.fincore.foresight.domain.model.AnomalyEvent;
import com.fincore.foresight.domain.model.AnomalySeverity;
import com.fincore.foresight.domain.model.MetricPoint;
import com.fincore.foresight.domain.model.SeriesKey;
import com.fincore.foresight.feature.FeatureBuilder;
import com.fincore.foresight.feature.FeatureScaler;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Anomaly model for one series, backed by a Random Cut Forest.
 * <p>
 * Each observation after the first is scored on its value, relative rate of change
 * and calendar position. The forest's raw score grows with abnormality; it is turned
 * into a decision score {@code offset - rcfScore}, where the offset is the training
 * score quantile implied by the contamination prior. Negative decision scores are
 * outliers, and lower means more anomalous.
 */
@Slf4j
public class AnomalyModel {

    private final SeriesKey seriesKey;
    private final FeatureBuilder featureBuilder;
    private final ForesightProperties.Anomaly settings;

    private volatile FittedState state;

    public AnomalyModel(SeriesKey seriesKey, FeatureBuilder featureBuilder,
                        ForesightProperties.Anomaly settings) {
        this.seriesKey = seriesKey;
        this.featureBuilder = featureBuilder;
        this.settings = settings;
    }

    /**
     * Fit the scaler and forest on the given slice.
     *
     * @return {@code false} when there is too little data; the model is left untouched
     */
    public boolean train(Collection<MetricPoint> series) {
        return train(series, FitLease.unbounded());
    }

    /**
     * Fit on the given slice, publishing the result only while {@code lease} is held.
     */
    public boolean train(Collection<MetricPoint> series, FitLease lease) {
        if (series.size() < settings.getMinTrainingPoints()) {
            log.debug("Skipping anomaly fit for {}: {} points, need {}",
                    seriesKey, series.size(), settings.getMinTrainingPoints());
            return false;
        }

        double[][] features = featureBuilder.buildAnomalyFeatures(series);
        if (features.length == 0) {
            return false;
        }

        FeatureScaler scaler = FeatureScaler.fit(features);
        double[][] scaled = scaler.transform(features);

        RandomCutForest forest = RandomCutForest.builder()
                .dimensions(FeatureBuilder.ANOMALY_FEATURES)
                .numberOfTrees(settings.getNumberOfTrees())
                .sampleSize(settings.getSampleSize())
                .outputAfter(1)
                .randomSeed(settings.getRandomSeed())
                .parallelExecutionEnabled(false)
                .build();
        for (double[] row : scaled) {
            forest.update(row);
        }

        double[] trainingScores = new double[scaled.length];
        for (int i = 0; i < scaled.length; i++) {
            trainingScores[i] = forest.getAnomalyScore(scaled[i]);
        }
        double offset = new Percentile().evaluate(trainingScores, 100.0 * (1.0 - settings.getContamination()));

        FittedState fitted = new FittedState(scaler, forest, offset);
        if (!lease.commit(() -> state = fitted)) {
            log.debug("Discarding abandoned anomaly fit for {}", seriesKey);
            return false;
        }
        log.info("Anomaly model trained for {} on {} rows", seriesKey, scaled.length);
        return true;
    }

    /**
     * Score every observation after the first and report the outliers.
     *
     * @return an empty detection when the model is untrained or the slice yields no rows
     */
    public AnomalyDetection detect(Collection<MetricPoint> series) {
        FittedState fitted = state;
        if (fitted == null) {
            return AnomalyDetection.empty();
        }

        List<MetricPoint> sorted = FeatureBuilder.sortByTimestamp(series);
        double[][] features = featureBuilder.buildAnomalyFeatures(sorted);
        if (features.length == 0) {
            return AnomalyDetection.empty();
        }

        double[] scores = new double[features.length];
        boolean[] outliers = new boolean[features.length];
        synchronized (fitted.forest) {
            for (int i = 0; i < features.length; i++) {
                scores[i] = fitted.offset - fitted.forest.getAnomalyScore(fitted.scaler.transform(features[i]));
                outliers[i] = scores[i] < 0.0;
            }
        }

        return AnomalyDetection.builder()
                .events(toEvents(sorted, scores, outliers))
                .evaluatedRows(features.length)
                .build();
    }

    /**
     * Build events for the rows labelled as outliers. Row {@code i} describes point
     * {@code i + 1} of the sorted slice.
     */
    static List<AnomalyEvent> toEvents(List<MetricPoint> sorted, double[] scores, boolean[] outliers) {
        List<AnomalyEvent> events = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            if (!outliers[i]) {
                continue;
            }
            MetricPoint point = sorted.get(i + 1);
            events.add(AnomalyEvent.builder()
                    .timestamp(point.getTimestamp())
                    .value(point.getValue())
                    .anomalyScore(scores[i])
                    .severity(AnomalySeverity.fromScore(scores[i]))
                    .build());
        }
        return events;
    }

    public SeriesKey getSeriesKey() {
        return seriesKey;
    }

    public boolean isTrained() {
        return state != null;
    }

    /**
     * Reported decision threshold. Fixed, not re-estimated by training.
     */
    public double getThreshold() {
        return settings.getThreshold();
    }

    private static final class FittedState {
        private final FeatureScaler scaler;
        private final RandomCutForest forest;
        private final double offset;

        private FittedState(FeatureScaler scaler, RandomCutForest forest, double offset) {
            this.scaler = scaler;
            this.forest = forest;
            this.offset = offset;
        }
    }
}
