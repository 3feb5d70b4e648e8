/*
 * Copyright 2025 The AegisGRID Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.aegisgrid.simulator;

import static com.aegisgrid.CommonUtils.checkArgument;
import static com.aegisgrid.CommonUtils.round;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.aegisgrid.sample.PointSample;
import com.aegisgrid.sample.SampleSource;
import com.aegisgrid.sample.SequenceSample;
import com.aegisgrid.sample.TelemetrySample;

/**
 * Generates synchronized SCADA and PMU readings for a synthetic substation
 * network, one reading per simulated second.
 *
 * Ordinary readings scatter around nominal grid values, with load current
 * following a slow daily-like swing. When anomaly injection is enabled each
 * reading is anomalous with probability {@value #ANOMALY_RATE}; anomalous
 * readings show an overvoltage, a current drop and a frequency excursion on
 * the SCADA side together with a phase shift and a magnitude sag on the PMU
 * side.
 *
 * In high-anomaly mode the simulator also moves between calm periods and
 * storms. A calm tick starts a storm with probability
 * {@value #STORM_START_PROBABILITY}, a storm tick ends it with probability
 * {@value #STORM_END_PROBABILITY}, and every reading taken during a storm is
 * anomalous.
 *
 * All randomness comes from one seeded generator, so two simulators built
 * with the same settings produce the same readings.
 */
public class GridTelemetrySimulator implements SampleSource {

    public static final double ANOMALY_RATE = 0.05;
    public static final double STORM_START_PROBABILITY = 0.1;
    public static final double STORM_END_PROBABILITY = 0.25;

    public static final List<String> LOCATIONS = List.of("Substation-Alpha", "Substation-Bravo",
            "Substation-Charlie", "Feeder-North", "Feeder-South", "Transmission-Line-7");

    static final double BASE_VOLTAGE = 230.0;
    static final double BASE_CURRENT = 50.0;
    static final double BASE_FREQUENCY = 50.0;
    static final double BASE_PHASE_ANGLE = 15.0;
    static final double BASE_MAGNITUDE = 1.0;
    static final int BREAKER_CLOSED = 1;

    private final boolean anomalyInjectionEnabled;
    private final boolean highAnomalyMode;
    private final NormalDistribution dist;

    private long timestamp;
    private boolean storm;

    public static Builder builder() {
        return new Builder();
    }

    protected GridTelemetrySimulator(Builder builder) {
        this.anomalyInjectionEnabled = builder.anomalyInjectionEnabled;
        this.highAnomalyMode = builder.highAnomalyMode;
        this.timestamp = (builder.startTimestamp != null) ? builder.startTimestamp
                : Instant.now().getEpochSecond();
        this.dist = new NormalDistribution(
                (builder.randomSeed != null) ? new Random(builder.randomSeed) : new Random());
        this.storm = false;
    }

    @Override
    public TelemetrySample getNextSample() {
        timestamp++;
        boolean anomaly = nextIsAnomalous();
        String location = LOCATIONS.get(dist.nextInt(LOCATIONS.size()));
        return new TelemetrySample(timestamp, generatePoint(anomaly), generateSequence(anomaly), location, anomaly);
    }

    /**
     * @param count the number of readings to take
     * @return the next {@code count} readings, in order
     */
    public List<TelemetrySample> generate(int count) {
        checkArgument(count >= 0, "count must be non-negative");
        List<TelemetrySample> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add(getNextSample());
        }
        return result;
    }

    public boolean isAnomalyInjectionEnabled() {
        return anomalyInjectionEnabled;
    }

    public boolean isHighAnomalyMode() {
        return highAnomalyMode;
    }

    /**
     * @return true while a storm is in progress
     */
    public boolean isStorm() {
        return storm;
    }

    private boolean nextIsAnomalous() {
        if (!anomalyInjectionEnabled) {
            return false;
        }
        if (highAnomalyMode) {
            if (storm) {
                if (dist.nextBernoulli(STORM_END_PROBABILITY)) {
                    storm = false;
                }
            } else if (dist.nextBernoulli(STORM_START_PROBABILITY)) {
                storm = true;
            }
        }
        boolean base = dist.nextBernoulli(ANOMALY_RATE);
        return storm || base;
    }

    private PointSample generatePoint(boolean anomaly) {
        double voltage;
        double current;
        double frequency;
        if (!anomaly) {
            voltage = dist.nextDouble(BASE_VOLTAGE, 2.0);
            current = BASE_CURRENT + dist.nextDouble(0.0, 5.0) * (1 + Math.sin(timestamp / 60.0));
            frequency = dist.nextDouble(BASE_FREQUENCY, 0.02);
        } else {
            voltage = BASE_VOLTAGE + dist.nextUniform(15.0, 20.0);
            current = BASE_CURRENT - dist.nextUniform(25.0, 30.0);
            frequency = BASE_FREQUENCY + dist.nextUniform(0.8, 1.2);
        }
        return new PointSample(round(voltage, 2), round(current, 2), round(frequency, 3), BREAKER_CLOSED);
    }

    private SequenceSample generateSequence(boolean anomaly) {
        double phaseAngle;
        double magnitude;
        if (!anomaly) {
            phaseAngle = dist.nextDouble(BASE_PHASE_ANGLE, 0.1);
            magnitude = dist.nextDouble(BASE_MAGNITUDE, 0.005);
        } else {
            phaseAngle = BASE_PHASE_ANGLE + dist.nextUniform(1.0, 2.0);
            magnitude = BASE_MAGNITUDE - dist.nextUniform(0.05, 0.1);
        }
        return new SequenceSample(round(phaseAngle, 4), round(magnitude, 4));
    }

    public static class Builder {
        private Long randomSeed = null;
        private boolean anomalyInjectionEnabled = true;
        private boolean highAnomalyMode = false;
        private Long startTimestamp = null;

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public Builder anomalyInjectionEnabled(boolean anomalyInjectionEnabled) {
            this.anomalyInjectionEnabled = anomalyInjectionEnabled;
            return this;
        }

        public Builder highAnomalyMode(boolean highAnomalyMode) {
            this.highAnomalyMode = highAnomalyMode;
            return this;
        }

        /**
         * @param startTimestamp epoch seconds; the first reading is taken one
         *                       second later
         */
        public Builder startTimestamp(long startTimestamp) {
            this.startTimestamp = startTimestamp;
            return this;
        }

        public GridTelemetrySimulator build() {
            return new GridTelemetrySimulator(this);
        }
    }
}
