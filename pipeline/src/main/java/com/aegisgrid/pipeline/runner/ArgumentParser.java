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

package com.aegisgrid.pipeline.runner;

import static com.aegisgrid.CommonUtils.checkArgument;
import static com.aegisgrid.CommonUtils.checkNotNull;

import java.io.PrintStream;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import com.aegisgrid.fusion.FusionPolicy;
import com.aegisgrid.pipeline.PipelineConfig;
import com.aegisgrid.scorer.SequenceAnomalyScorer;

/**
 * A utility class for parsing command-line arguments into a
 * {@link PipelineConfig}.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "aegisgrid-pipeline.jar";
    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> longFlags;
    private final IntegerArgument timesteps;
    private final IntegerArgument trainingSize;
    private final LongArgument cadenceMillis;
    private final DoubleArgument pointWeight;
    private final DoubleArgument alertThreshold;
    private final StringArgument modelDirectory;
    private final BooleanArgument highAnomalyMode;
    private final LongArgument randomSeed;
    private final LongArgument maxIterations;
    private boolean helpRequested;

    /**
     * Create a new ArgumentParser. The runner class and runner description will
     * be used in help text.
     *
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner class where this
     *                          argument parser is being invoked.
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        longFlags = new LinkedHashMap<>();

        timesteps = new IntegerArgument("--timesteps", "Length of the PMU window scored by the sequence model.",
                SequenceAnomalyScorer.DEFAULT_TIMESTEPS, n -> checkArgument(n > 0, "timesteps should be greater than 0"));
        addArgument(timesteps);

        trainingSize = new IntegerArgument("--training-size",
                "Number of clean samples to train on when no saved model exists.",
                PipelineConfig.DEFAULT_TRAINING_CORPUS_SIZE,
                n -> checkArgument(n > 0, "training size should be greater than 0"));
        addArgument(trainingSize);

        cadenceMillis = new LongArgument("--cadence-millis", "Pause between monitoring iterations in milliseconds.",
                PipelineConfig.DEFAULT_CADENCE.toMillis(),
                n -> checkArgument(n >= 0, "cadence should be non-negative"));
        addArgument(cadenceMillis);

        pointWeight = new DoubleArgument("--point-weight",
                "Weight of the SCADA verdict in the combined confidence; the PMU verdict gets the rest.",
                FusionPolicy.DEFAULT_POINT_WEIGHT,
                x -> checkArgument(x >= 0 && x <= 1, "point weight should be between 0 and 1"));
        addArgument(pointWeight);

        alertThreshold = new DoubleArgument("--alert-threshold",
                "Combined confidence above which an alert is raised.", FusionPolicy.DEFAULT_ALERT_THRESHOLD,
                x -> checkArgument(x >= 0 && x <= 1, "alert threshold should be between 0 and 1"));
        addArgument(alertThreshold);

        modelDirectory = new StringArgument("--model-dir", "Directory holding the saved models.",
                PipelineConfig.DEFAULT_MODEL_DIRECTORY,
                s -> checkArgument(!s.isEmpty(), "model directory should not be empty"));
        addArgument(modelDirectory);

        highAnomalyMode = new BooleanArgument("--high-anomaly-mode",
                "Set to 'true' to simulate storms of correlated anomalies.", false);
        addArgument(highAnomalyMode);

        randomSeed = new LongArgument("--random-seed", "Random seed for the simulator and the forest.", 42L);
        addArgument(randomSeed);

        maxIterations = new LongArgument("--max-iterations",
                "Stop after this many monitoring iterations, or 0 to run until interrupted.", 0L,
                n -> checkArgument(n >= 0, "max iterations should be non-negative"));
        addArgument(maxIterations);
    }

    /**
     * Add a new argument to this argument parser.
     *
     * @param argument An Argument instance for a command-line argument that
     *                 should be parsed.
     */
    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");
        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));
        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Parse the given array of command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     * @throws IllegalArgumentException if a flag is unknown, lacks a value or
     *                                  has an invalid value
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];
            if ("-h".equals(flag) || "--help".equals(flag)) {
                helpRequested = true;
            } else if (longFlags.containsKey(flag)) {
                checkArgument(i + 1 < arguments.length, "Missing value for " + flag);
                try {
                    longFlags.get(flag).parse(arguments[++i]);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException(
                            String.format("Invalid value for %s: %s", flag, arguments[i]), e);
                }
            } else {
                throw new IllegalArgumentException("Unknown argument: " + flag);
            }
            i++;
        }
    }

    /**
     * @return true if {@code --help} or {@code -h} was given.
     */
    public boolean isHelpRequested() {
        return helpRequested;
    }

    /**
     * Print a usage message.
     *
     * @param out where to print
     */
    public void printUsage(PrintStream out) {
        out.println(String.format("Usage: java -cp %s %s [options]", ARCHIVE_NAME, runnerClass));
        out.println();
        out.println(runnerDescription);
        out.println();
        out.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted().forEach(msg -> out.println("\t" + msg));

        out.println();
        out.println("\t--help, -h: Print this help message and exit.");
    }

    /**
     * Print an error message, the usage message, and exit the application.
     *
     * @param errorMessage  An error message to show the user.
     * @param formatObjects An array of format objects that will be interpolated
     *                      into the error message using {@link String#format}.
     */
    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage(System.err);
        System.exit(1);
    }

    public int getTimesteps() {
        return timesteps.getValue();
    }

    public int getTrainingSize() {
        return trainingSize.getValue();
    }

    public long getCadenceMillis() {
        return cadenceMillis.getValue();
    }

    public double getPointWeight() {
        return pointWeight.getValue();
    }

    public double getAlertThreshold() {
        return alertThreshold.getValue();
    }

    public String getModelDirectory() {
        return modelDirectory.getValue();
    }

    public boolean getHighAnomalyMode() {
        return highAnomalyMode.getValue();
    }

    public long getRandomSeed() {
        return randomSeed.getValue();
    }

    public long getMaxIterations() {
        return maxIterations.getValue();
    }

    /**
     * @return the parsed values as a validated pipeline configuration
     * @throws IllegalArgumentException if the values are inconsistent with
     *                                  each other
     */
    public PipelineConfig toConfig() {
        PipelineConfig config = PipelineConfig.builder().timesteps(getTimesteps())
                .trainingCorpusSize(getTrainingSize()).cadence(Duration.ofMillis(getCadenceMillis()))
                .pointWeight(getPointWeight()).alertThreshold(getAlertThreshold())
                .modelDirectory(getModelDirectory()).highAnomalyMode(getHighAnomalyMode())
                .randomSeed(getRandomSeed()).maxIterations(getMaxIterations()).build();
        config.validate();
        return config;
    }

    public static class Argument<T> {

        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String longFlag, String description, T defaultValue, Function<String, T> parseFunction,
                Consumer<T> validateFunction) {
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String longFlag, String description, T defaultValue, Function<String, T> parseFunction) {
            this(longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getHelpMessage() {
            return String.format("%s: %s (default: %s)", longFlag, description, defaultValue);
        }

        public void parse(String string) {
            T parsed = parseFunction.apply(string);
            validateFunction.accept(parsed);
            value = parsed;
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String longFlag, String description, String defaultValue,
                Consumer<String> validateFunction) {
            super(longFlag, description, defaultValue, x -> x, validateFunction);
        }
    }

    public static class BooleanArgument extends Argument<Boolean> {
        public BooleanArgument(String longFlag, String description, boolean defaultValue) {
            super(longFlag, description, defaultValue, BooleanArgument::parseStrict);
        }

        private static Boolean parseStrict(String string) {
            checkArgument("true".equalsIgnoreCase(string) || "false".equalsIgnoreCase(string),
                    "expected 'true' or 'false' but was " + string);
            return Boolean.parseBoolean(string);
        }
    }

    public static class IntegerArgument extends Argument<Integer> {
        public IntegerArgument(String longFlag, String description, int defaultValue,
                Consumer<Integer> validateFunction) {
            super(longFlag, description, defaultValue, Integer::parseInt, validateFunction);
        }
    }

    public static class LongArgument extends Argument<Long> {
        public LongArgument(String longFlag, String description, long defaultValue,
                Consumer<Long> validateFunction) {
            super(longFlag, description, defaultValue, Long::parseLong, validateFunction);
        }

        public LongArgument(String longFlag, String description, long defaultValue) {
            super(longFlag, description, defaultValue, Long::parseLong);
        }
    }

    public static class DoubleArgument extends Argument<Double> {
        public DoubleArgument(String longFlag, String description, double defaultValue,
                Consumer<Double> validateFunction) {
            super(longFlag, description, defaultValue, Double::parseDouble, validateFunction);
        }
    }
}
