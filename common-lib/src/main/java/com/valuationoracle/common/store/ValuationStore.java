package com.valuationoracle.common.store;

import com.valuationoracle.common.model.Valuation;
import com.valuationoracle.common.persistence.OracleStatePersistence;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Committed valuation per subject: the only artifact downstream consumers read.
 *
 * <p>{@link Valuation} is immutable and replaced whole on commit, so readers never observe
 * a partially updated entry. The consensus engine is the single writer; a committed entry
 * is never cleared, only overwritten by a later successful computation.
 *
 * <p>Commits are written through {@link OracleStatePersistence} first; the map is a read view
 * of what has been persisted, reloaded on construction.
 */
public class ValuationStore {

    private final OracleStatePersistence persistence;

    private final ConcurrentHashMap<Long, Valuation> valuations = new ConcurrentHashMap<>();

    public ValuationStore(OracleStatePersistence persistence) {
        this.persistence = persistence;
        valuations.putAll(persistence.loadValuations());
    }

    public Optional<Valuation> get(long subjectId) {
        return Optional.ofNullable(valuations.get(subjectId));
    }

    public void commit(long subjectId, Valuation valuation) {
        Objects.requireNonNull(valuation, "valuation");
        persistence.saveValuation(subjectId, valuation);
        valuations.put(subjectId, valuation);
    }
}
