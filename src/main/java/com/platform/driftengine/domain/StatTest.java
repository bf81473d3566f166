package com.platform.driftengine.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Column-level statistical tests a distribution monitor may request.
 * <p>
 * P-value tests flag drift when {@code p < threshold}; distance tests when
 * {@code distance > threshold}. Equality never counts as drift.
 */
public enum StatTest {

    KS("ks", Interpretation.P_VALUE, true),
    CHISQUARE("chisquare", Interpretation.P_VALUE, false),
    Z("z", Interpretation.P_VALUE, true),
    WASSERSTEIN("wasserstein", Interpretation.DISTANCE, true),
    PSI("psi", Interpretation.DISTANCE, false),
    JENSENSHANNON("jensenshannon", Interpretation.DISTANCE, false),
    KL_DIV("kl_div", Interpretation.DISTANCE, false);

    public enum Interpretation { P_VALUE, DISTANCE }

    private static final double DEFAULT_THRESHOLD = 0.1;

    private final String configName;
    private final Interpretation interpretation;
    private final boolean numericOnly;

    StatTest(String configName, Interpretation interpretation, boolean numericOnly) {
        this.configName = configName;
        this.interpretation = interpretation;
        this.numericOnly = numericOnly;
    }

    @JsonValue
    public String configName() {
        return configName;
    }

    public Interpretation interpretation() {
        return interpretation;
    }

    /** Whether the test works on raw numeric samples rather than frequency tables. */
    public boolean numericOnly() {
        return numericOnly;
    }

    public double defaultThreshold() {
        return this == PSI ? MonitorKind.DISTRIBUTION.defaultThreshold() : DEFAULT_THRESHOLD;
    }

    public boolean drifted(double metric, double threshold) {
        return interpretation == Interpretation.P_VALUE ? metric < threshold : metric > threshold;
    }

    public static Optional<StatTest> fromConfigName(String name) {
        return Arrays.stream(values())
                .filter(t -> t.configName.equals(name))
                .findFirst();
    }
}
