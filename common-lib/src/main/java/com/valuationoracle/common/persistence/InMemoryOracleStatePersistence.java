package com.valuationoracle.common.persistence;

import com.valuationoracle.common.model.ConfigurationSnapshot;
import com.valuationoracle.common.model.Oracle;
import com.valuationoracle.common.model.OracleActivity;
import com.valuationoracle.common.model.Submission;
import com.valuationoracle.common.model.Valuation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local {@link OracleStatePersistence} for embedding and tests. Outlives any number
 * of {@code ValuationOracle} instances built over it, not the process.
 */
public class InMemoryOracleStatePersistence implements OracleStatePersistence {

    private final Map<String, Oracle> oracles = new LinkedHashMap<>();
    private final Map<String, Submission> submissions = new LinkedHashMap<>();
    private final Map<String, OracleActivity> activity = new HashMap<>();
    private final Map<Long, Valuation> valuations = new HashMap<>();
    private ConfigurationSnapshot settings;

    @Override
    public synchronized List<Oracle> loadOracles() {
        return List.copyOf(oracles.values());
    }

    @Override
    public synchronized void saveOracle(Oracle oracle) {
        oracles.put(oracle.oracleId(), oracle);
    }

    @Override
    public synchronized void deleteOracle(String oracleId) {
        oracles.remove(oracleId);
    }

    @Override
    public synchronized Optional<ConfigurationSnapshot> loadSettings() {
        return Optional.ofNullable(settings);
    }

    @Override
    public synchronized void saveSettings(ConfigurationSnapshot settings) {
        this.settings = settings;
    }

    @Override
    public synchronized List<Submission> loadSubmissions() {
        return new ArrayList<>(submissions.values());
    }

    @Override
    public synchronized Map<String, OracleActivity> loadActivity() {
        return Map.copyOf(activity);
    }

    @Override
    public synchronized void saveSubmission(Submission submission, OracleActivity oracleActivity) {
        submissions.put(submission.subjectId() + "/" + submission.oracleId(), submission);
        activity.put(submission.oracleId(), oracleActivity);
    }

    @Override
    public synchronized Map<Long, Valuation> loadValuations() {
        return Map.copyOf(valuations);
    }

    @Override
    public synchronized void saveValuation(long subjectId, Valuation valuation) {
        valuations.put(subjectId, valuation);
    }
}
