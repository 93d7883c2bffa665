package com.fincore.foresight.ml;

import com.fincore.foresight.config.ForesightProperties;
import com.fincore.foresight.domain.model.ConfidenceInterval;
import com.fincore.foresight.domain.model.Forecast;
import com.fincore.foresight.domain.model.ForecastPoint;
import com.fincore.foresight.domain.model.MetricPoint;
import com.fincore.foresight.domain.model.SeriesKey;
import com.fincore.foresight.feature.FeatureBuilder;
import com.fincore.foresight.feature.FeatureScaler;
import com.fincore.foresight.feature.TrainingSet;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.util.MathArrays;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Forecast model for one series.
 * <p>
 * Regresses the next value from the trailing window plus calendar and trend features,
 * and forecasts several steps ahead by feeding each prediction back into the window.
 * Errors therefore compound with the horizon.
 * <p>
 * The fitted state is swapped in atomically at the end of a successful fit, so a
 * failed retrain keeps the previous state and accuracy.
 */
@Slf4j
public class ForecastModel {

    /** z-value of the fixed 95% band */
    static final double Z_95 = 1.96;
    static final double CONFIDENCE_LEVEL = 0.95;
    private static final double EPSILON = 1e-8;

    private final SeriesKey seriesKey;
    private final FeatureBuilder featureBuilder;
    private final ForesightProperties.Forecast settings;

    private volatile FittedState state;

    public ForecastModel(SeriesKey seriesKey, FeatureBuilder featureBuilder,
                         ForesightProperties.Forecast settings) {
        this.seriesKey = seriesKey;
        this.featureBuilder = featureBuilder;
        this.settings = settings;
    }

    /**
     * Fit on the given slice of the series.
     *
     * @return {@code false} when there is too little data; the model is left untouched
     */
    public boolean train(Collection<MetricPoint> series) {
        return train(series, FitLease.unbounded());
    }

    /**
     * Fit on the given slice, publishing the result only while {@code lease} is held.
     *
     * @return {@code false} when there is too little data or the lease was revoked;
     * the model is left untouched
     */
    public boolean train(Collection<MetricPoint> series, FitLease lease) {
        if (series.size() < settings.getMinTrainingPoints()) {
            log.debug("Skipping forecast fit for {}: {} points, need {}",
                    seriesKey, series.size(), settings.getMinTrainingPoints());
            return false;
        }

        TrainingSet data = featureBuilder.buildTrainingSet(series);
        if (data.isEmpty()) {
            return false;
        }

        int testSize = (int) Math.ceil(data.size() * settings.getTestFraction());
        int trainSize = data.size() - testSize;
        if (trainSize < 1 || testSize < 1) {
            return false;
        }

        int[] order = MathArrays.natural(data.size());
        MathArrays.shuffle(order, new Well19937c(settings.getRandomSeed()));
        TrainingSet test = data.select(Arrays.copyOfRange(order, 0, testSize));
        TrainingSet train = data.select(Arrays.copyOfRange(order, testSize, data.size()));

        FeatureScaler scaler = FeatureScaler.fit(train.getFeatures());
        RidgeRegression regression = RidgeRegression.fit(
                scaler.transform(train.getFeatures()), train.getTargets(), settings.getRidgeAlpha());

        double[] predicted = regression.predict(scaler.transform(test.getFeatures()));
        double[] actual = test.getTargets();
        double absoluteError = 0.0;
        for (int i = 0; i < actual.length; i++) {
            absoluteError += Math.abs(actual[i] - predicted[i]);
        }
        double mae = absoluteError / actual.length;
        double meanActual = new Mean().evaluate(actual);
        double accuracy = Math.min(1.0, Math.max(0.0, 1.0 - mae / (meanActual + EPSILON)));

        FittedState fitted = new FittedState(scaler, regression, accuracy);
        if (!lease.commit(() -> state = fitted)) {
            log.debug("Discarding abandoned forecast fit for {}", seriesKey);
            return false;
        }
        log.info("Forecast model trained for {} - accuracy: {}", seriesKey,
                String.format("%.3f", accuracy));
        return true;
    }

    /**
     * Forecast {@code horizon} one-minute steps past the most recent observation.
     *
     * @return empty when the model is untrained or fewer than {@code windowSize} points are given
     */
    public Optional<Forecast> predict(Collection<MetricPoint> recent, int horizon) {
        if (horizon < 1) {
            throw new IllegalArgumentException("Horizon must be at least 1: " + horizon);
        }
        FittedState fitted = state;
        if (fitted == null) {
            return Optional.empty();
        }

        int windowSize = featureBuilder.getWindowSize();
        List<MetricPoint> sorted = FeatureBuilder.sortByTimestamp(recent);
        if (sorted.size() < windowSize) {
            return Optional.empty();
        }

        List<MetricPoint> tail = sorted.subList(sorted.size() - windowSize, sorted.size());
        double[] window = tail.stream().mapToDouble(MetricPoint::getValue).toArray();
        Instant lastTimestamp = tail.get(windowSize - 1).getTimestamp();
        StandardDeviation deviation = new StandardDeviation(false);

        Forecast forecast = new Forecast();
        for (int step = 1; step <= horizon; step++) {
            double[] features = featureBuilder.buildStepFeatures(window, lastTimestamp, step, windowSize);
            double prediction = fitted.regression.predict(fitted.scaler.transform(features));
            Instant timestamp = featureBuilder.stepTimestamp(lastTimestamp, step);
            double sigma = deviation.evaluate(window);

            forecast.getPredictions().add(ForecastPoint.builder()
                    .timestamp(timestamp)
                    .predictedValue(prediction)
                    .stepAhead(step)
                    .build());
            forecast.getConfidenceIntervals().add(ConfidenceInterval.builder()
                    .timestamp(timestamp)
                    .lowerBound(prediction - Z_95 * sigma)
                    .upperBound(prediction + Z_95 * sigma)
                    .confidenceLevel(CONFIDENCE_LEVEL)
                    .build());

            System.arraycopy(window, 1, window, 0, windowSize - 1);
            window[windowSize - 1] = prediction;
        }
        return Optional.of(forecast);
    }

    public SeriesKey getSeriesKey() {
        return seriesKey;
    }

    public boolean isTrained() {
        return state != null;
    }

    /**
     * Held-out accuracy of the last successful fit, 0.0 when never trained.
     */
    public double getAccuracy() {
        FittedState fitted = state;
        return fitted != null ? fitted.accuracy : 0.0;
    }

    private static final class FittedState {
        private final FeatureScaler scaler;
        private final RidgeRegression regression;
        private final double accuracy;

        private FittedState(FeatureScaler scaler, RidgeRegression regression, double accuracy) {
            this.scaler = scaler;
            this.regression = regression;
            this.accuracy = accuracy;
        }
    }
}
