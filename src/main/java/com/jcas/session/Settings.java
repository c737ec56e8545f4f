package com.jcas.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Per-session tunables. Defaults come from {@code jcas-defaults.properties} on the classpath.
 */
public final class Settings {
    private static final Logger logger = LoggerFactory.getLogger(Settings.class);
    static final String DEFAULTS_RESOURCE = "/jcas-defaults.properties";

    private int precision = 21;
    private long timeoutMillis = 2000;
    private int integrationDepth = 10;
    private int laplaceIntegrationDepth = 40;
    private int maxSolveDepth = 10;
    private int maxNewtonIterations = 200;
    private int maxBisectionIterations = 2000;
    private double solveRadius = 1000;
    private double solveStep = 0.1;
    private int maxQuadratureDepth = 40;
    private int maxSimplifyIterations = 20;
    private boolean immutable = true;
    private boolean numeric = false;

    public Settings() {
    }

    /**
     * Settings initialized from the bundled defaults resource, falling back to the compiled-in
     * values when the resource is missing.
     */
    public static Settings defaults() {
        Settings settings = new Settings();
        try (InputStream in = Settings.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.warn("{} not found on classpath, using built-in defaults", DEFAULTS_RESOURCE);
                return settings;
            }
            Properties properties = new Properties();
            properties.load(in);
            settings.apply(properties);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + DEFAULTS_RESOURCE, e);
        }
        return settings;
    }

    /**
     * Applies every recognized key present in {@code properties}. Unknown keys are ignored.
     */
    public void apply(Properties properties) {
        precision = intValue(properties, "precision", precision);
        timeoutMillis = longValue(properties, "timeoutMillis", timeoutMillis);
        integrationDepth = intValue(properties, "integrationDepth", integrationDepth);
        laplaceIntegrationDepth = intValue(properties, "laplaceIntegrationDepth", laplaceIntegrationDepth);
        maxSolveDepth = intValue(properties, "maxSolveDepth", maxSolveDepth);
        maxNewtonIterations = intValue(properties, "maxNewtonIterations", maxNewtonIterations);
        maxBisectionIterations = intValue(properties, "maxBisectionIterations", maxBisectionIterations);
        solveRadius = doubleValue(properties, "solveRadius", solveRadius);
        solveStep = doubleValue(properties, "solveStep", solveStep);
        maxQuadratureDepth = intValue(properties, "maxQuadratureDepth", maxQuadratureDepth);
        maxSimplifyIterations = intValue(properties, "maxSimplifyIterations", maxSimplifyIterations);
        immutable = booleanValue(properties, "immutable", immutable);
        numeric = booleanValue(properties, "numeric", numeric);
    }

    private static int intValue(Properties properties, String key, int fallback) {
        String value = properties.getProperty(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting '" + key + "' must be an integer: " + value, e);
        }
    }

    private static long longValue(Properties properties, String key, long fallback) {
        String value = properties.getProperty(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting '" + key + "' must be an integer: " + value, e);
        }
    }

    private static double doubleValue(Properties properties, String key, double fallback) {
        String value = properties.getProperty(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting '" + key + "' must be a number: " + value, e);
        }
    }

    private static boolean booleanValue(Properties properties, String key, boolean fallback) {
        String value = properties.getProperty(key);
        return value == null ? fallback : Boolean.parseBoolean(value.trim());
    }

    // ========== scoped override ==========

    /**
     * Runs {@code body} with the mutations applied and restores every field afterwards,
     * whether the body returns or throws.
     */
    public <T> T override(Consumer<Settings> mutator, Supplier<T> body) {
        Settings snapshot = copy();
        try {
            mutator.accept(this);
            logger.debug("Settings overridden for scoped call: {}", this);
            return body.get();
        } finally {
            restore(snapshot);
        }
    }

    public Settings copy() {
        Settings copy = new Settings();
        copy.restore(this);
        return copy;
    }

    private void restore(Settings other) {
        precision = other.precision;
        timeoutMillis = other.timeoutMillis;
        integrationDepth = other.integrationDepth;
        laplaceIntegrationDepth = other.laplaceIntegrationDepth;
        maxSolveDepth = other.maxSolveDepth;
        maxNewtonIterations = other.maxNewtonIterations;
        maxBisectionIterations = other.maxBisectionIterations;
        solveRadius = other.solveRadius;
        solveStep = other.solveStep;
        maxQuadratureDepth = other.maxQuadratureDepth;
        maxSimplifyIterations = other.maxSimplifyIterations;
        immutable = other.immutable;
        numeric = other.numeric;
    }

    // ========== accessors ==========

    public int precision() {
        return precision;
    }

    public Settings setPrecision(int precision) {
        if (precision < 0) {
            throw new IllegalArgumentException("precision must not be negative: " + precision);
        }
        this.precision = precision;
        return this;
    }

    public long timeoutMillis() {
        return timeoutMillis;
    }

    /**
     * A budget of 0 disables the deadline.
     */
    public Settings setTimeoutMillis(long timeoutMillis) {
        if (timeoutMillis < 0) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeoutMillis);
        }
        this.timeoutMillis = timeoutMillis;
        return this;
    }

    public int integrationDepth() {
        return integrationDepth;
    }

    public Settings setIntegrationDepth(int integrationDepth) {
        this.integrationDepth = integrationDepth;
        return this;
    }

    public int laplaceIntegrationDepth() {
        return laplaceIntegrationDepth;
    }

    public Settings setLaplaceIntegrationDepth(int laplaceIntegrationDepth) {
        this.laplaceIntegrationDepth = laplaceIntegrationDepth;
        return this;
    }

    public int maxSolveDepth() {
        return maxSolveDepth;
    }

    public Settings setMaxSolveDepth(int maxSolveDepth) {
        this.maxSolveDepth = maxSolveDepth;
        return this;
    }

    public int maxNewtonIterations() {
        return maxNewtonIterations;
    }

    public Settings setMaxNewtonIterations(int maxNewtonIterations) {
        this.maxNewtonIterations = maxNewtonIterations;
        return this;
    }

    public int maxBisectionIterations() {
        return maxBisectionIterations;
    }

    public Settings setMaxBisectionIterations(int maxBisectionIterations) {
        this.maxBisectionIterations = maxBisectionIterations;
        return this;
    }

    public double solveRadius() {
        return solveRadius;
    }

    public Settings setSolveRadius(double solveRadius) {
        this.solveRadius = solveRadius;
        return this;
    }

    public double solveStep() {
        return solveStep;
    }

    public Settings setSolveStep(double solveStep) {
        if (solveStep <= 0) {
            throw new IllegalArgumentException("solve step must be positive: " + solveStep);
        }
        this.solveStep = solveStep;
        return this;
    }

    public int maxQuadratureDepth() {
        return maxQuadratureDepth;
    }

    public Settings setMaxQuadratureDepth(int maxQuadratureDepth) {
        this.maxQuadratureDepth = maxQuadratureDepth;
        return this;
    }

    public int maxSimplifyIterations() {
        return maxSimplifyIterations;
    }

    public Settings setMaxSimplifyIterations(int maxSimplifyIterations) {
        this.maxSimplifyIterations = maxSimplifyIterations;
        return this;
    }

    public boolean isImmutable() {
        return immutable;
    }

    public Settings setImmutable(boolean immutable) {
        this.immutable = immutable;
        return this;
    }

    public boolean isNumeric() {
        return numeric;
    }

    public Settings setNumeric(boolean numeric) {
        this.numeric = numeric;
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Settings)) {
            return false;
        }
        Settings other = (Settings) o;
        return precision == other.precision
                && timeoutMillis == other.timeoutMillis
                && integrationDepth == other.integrationDepth
                && laplaceIntegrationDepth == other.laplaceIntegrationDepth
                && maxSolveDepth == other.maxSolveDepth
                && maxNewtonIterations == other.maxNewtonIterations
                && maxBisectionIterations == other.maxBisectionIterations
                && Double.compare(solveRadius, other.solveRadius) == 0
                && Double.compare(solveStep, other.solveStep) == 0
                && maxQuadratureDepth == other.maxQuadratureDepth
                && maxSimplifyIterations == other.maxSimplifyIterations
                && immutable == other.immutable
                && numeric == other.numeric;
    }

    @Override
    public int hashCode() {
        return Objects.hash(precision, timeoutMillis, integrationDepth, laplaceIntegrationDepth, maxSolveDepth,
                maxNewtonIterations, maxBisectionIterations, solveRadius, solveStep, maxQuadratureDepth,
                maxSimplifyIterations, immutable, numeric);
    }

    @Override
    public String toString() {
        return "Settings{precision=" + precision
                + ", timeoutMillis=" + timeoutMillis
                + ", integrationDepth=" + integrationDepth
                + ", laplaceIntegrationDepth=" + laplaceIntegrationDepth
                + ", maxSolveDepth=" + maxSolveDepth
                + ", maxNewtonIterations=" + maxNewtonIterations
                + ", maxBisectionIterations=" + maxBisectionIterations
                + ", solveRadius=" + solveRadius
                + ", solveStep=" + solveStep
                + ", maxQuadratureDepth=" + maxQuadratureDepth
                + ", maxSimplifyIterations=" + maxSimplifyIterations
                + ", immutable=" + immutable
                + ", numeric=" + numeric + '}';
    }
}
