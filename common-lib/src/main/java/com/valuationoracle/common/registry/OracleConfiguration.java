package com.valuationoracle.common.registry;

import com.valuationoracle.common.model.ConfigurationSnapshot;

import java.util.Objects;

/**
 * Process-wide settings of the valuation oracle.
 *
 * <p>Values are volatile so the consensus engine can read them without taking a lock.
 * They change only through the admin-gated operations on {@link OracleRegistry}, which is
 * why the mutators are package-private. The administrative identity is fixed at construction.
 *
 * <p>{@code consensusThreshold} gates two things at once: the minimum number of contributing
 * submissions and the minimum aggregate weight of their oracles.
 */
public final class OracleConfiguration {

    public static final int  DEFAULT_MAX_ORACLES               = 10;
    public static final int  DEFAULT_CONSENSUS_THRESHOLD       = 3;
    public static final int  DEFAULT_MAX_SUBMISSIONS_PER_ORACLE = 5;
    public static final long DEFAULT_STALENESS_WINDOW          = 3600;

    public static final int MIN_WEIGHT    = 1;
    public static final int MAX_WEIGHT    = 100;
    public static final int MIN_THRESHOLD = 1;
    public static final int MAX_THRESHOLD = 10;

    private final String adminId;

    private volatile int  maxOracles;
    private volatile int  consensusThreshold;
    private volatile int  maxSubmissionsPerOracle;
    private volatile long stalenessWindow;

    public OracleConfiguration(String adminId,
                               int maxOracles,
                               int consensusThreshold,
                               int maxSubmissionsPerOracle,
                               long stalenessWindow) {
        this.adminId = Objects.requireNonNull(adminId, "adminId");
        if (adminId.isBlank()) {
            throw new IllegalArgumentException("adminId must not be blank");
        }
        if (maxOracles < 1) {
            throw new IllegalArgumentException("maxOracles must be >= 1, was " + maxOracles);
        }
        if (!isValidThreshold(consensusThreshold)) {
            throw new IllegalArgumentException("consensusThreshold must be in ["
                + MIN_THRESHOLD + ", " + MAX_THRESHOLD + "], was " + consensusThreshold);
        }
        if (maxSubmissionsPerOracle < 1) {
            throw new IllegalArgumentException(
                "maxSubmissionsPerOracle must be >= 1, was " + maxSubmissionsPerOracle);
        }
        if (stalenessWindow < 0) {
            throw new IllegalArgumentException("stalenessWindow must be >= 0, was " + stalenessWindow);
        }
        this.maxOracles              = maxOracles;
        this.consensusThreshold      = consensusThreshold;
        this.maxSubmissionsPerOracle = maxSubmissionsPerOracle;
        this.stalenessWindow         = stalenessWindow;
    }

    public static OracleConfiguration withDefaults(String adminId) {
        return new OracleConfiguration(adminId,
            DEFAULT_MAX_ORACLES,
            DEFAULT_CONSENSUS_THRESHOLD,
            DEFAULT_MAX_SUBMISSIONS_PER_ORACLE,
            DEFAULT_STALENESS_WINDOW);
    }

    public static boolean isValidWeight(int weight) {
        return weight >= MIN_WEIGHT && weight <= MAX_WEIGHT;
    }

    public static boolean isValidThreshold(int threshold) {
        return threshold >= MIN_THRESHOLD && threshold <= MAX_THRESHOLD;
    }

    public boolean isAdmin(String caller) {
        return adminId.equals(caller);
    }

    public String adminId()                { return adminId; }
    public int maxOracles()                { return maxOracles; }
    public int consensusThreshold()        { return consensusThreshold; }
    public int maxSubmissionsPerOracle()   { return maxSubmissionsPerOracle; }
    public long stalenessWindow()          { return stalenessWindow; }

    public ConfigurationSnapshot snapshot() {
        return new ConfigurationSnapshot(adminId, maxOracles, consensusThreshold,
            maxSubmissionsPerOracle, stalenessWindow);
    }

    void setMaxOracles(int maxOracles)                           { this.maxOracles = maxOracles; }
    void setConsensusThreshold(int consensusThreshold)           { this.consensusThreshold = consensusThreshold; }
    void setMaxSubmissionsPerOracle(int maxSubmissionsPerOracle) { this.maxSubmissionsPerOracle = maxSubmissionsPerOracle; }
    void setStalenessWindow(long stalenessWindow)                { this.stalenessWindow = stalenessWindow; }

    /** Applies persisted settings. The administrative identity is never taken from storage. */
    void restore(ConfigurationSnapshot settings) {
        this.maxOracles              = settings.maxOracles();
        this.consensusThreshold      = settings.consensusThreshold();
        this.maxSubmissionsPerOracle = settings.maxSubmissionsPerOracle();
        this.stalenessWindow         = settings.stalenessWindow();
    }
}
