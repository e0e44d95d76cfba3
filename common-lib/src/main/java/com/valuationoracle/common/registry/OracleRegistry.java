package com.valuationoracle.common.registry;

import com.valuationoracle.common.model.ConfigurationSnapshot;
import com.valuationoracle.common.model.Oracle;
import com.valuationoracle.common.persistence.OracleStatePersistence;
import com.valuationoracle.common.result.OracleError;
import com.valuationoracle.common.result.OracleResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Approved oracle set, their trust weights, and the admin-gated configuration setters.
 *
 * <h3>Admission rules for {@link #addOracle}</h3>
 * <ol>
 *   <li>caller is the administrative identity: otherwise {@link OracleError#NOT_ADMIN}</li>
 *   <li>oracle id is non-blank: otherwise {@link OracleError#NOT_ORACLE}</li>
 *   <li>oracle is not yet approved: otherwise {@link OracleError#ORACLE_ALREADY_APPROVED}</li>
 *   <li>weight in [1, 100]: otherwise {@link OracleError#INVALID_WEIGHT}</li>
 *   <li>approved count below {@code maxOracles}: otherwise {@link OracleError#MAX_ORACLES_EXCEEDED}</li>
 * </ol>
 *
 * <p>Approvals and settings are written through {@link OracleStatePersistence} before they
 * take effect, and reloaded from it on construction; persisted settings win over the
 * configured defaults.
 *
 * <p>All mutations hold the write lock. Submissions run inside {@link #underReadLock} so
 * that an oracle removal can never land between a submission's approval check and the
 * consensus recomputation that follows it.
 */
public class OracleRegistry {

    private final OracleConfiguration configuration;
    private final OracleStatePersistence persistence;

    /** oracleId → weight, in approval order. Weight 0 is never stored. */
    private final Map<String, Integer> weights = new LinkedHashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public OracleRegistry(OracleConfiguration configuration, OracleStatePersistence persistence) {
        this.configuration = configuration;
        this.persistence   = persistence;
        persistence.loadSettings().ifPresent(configuration::restore);
        for (Oracle oracle : persistence.loadOracles()) {
            weights.put(oracle.oracleId(), oracle.weight());
        }
    }

    public OracleConfiguration configuration() {
        return configuration;
    }

    public OracleResult<Boolean> addOracle(String caller, String oracleId, int weight) {
        return underWriteLock(() -> {
            if (!configuration.isAdmin(caller))             return OracleResult.failure(OracleError.NOT_ADMIN);
            if (oracleId == null || oracleId.isBlank())     return OracleResult.failure(OracleError.NOT_ORACLE);
            if (weights.containsKey(oracleId))              return OracleResult.failure(OracleError.ORACLE_ALREADY_APPROVED);
            if (!OracleConfiguration.isValidWeight(weight)) return OracleResult.failure(OracleError.INVALID_WEIGHT);
            if (weights.size() >= configuration.maxOracles()) {
                return OracleResult.failure(OracleError.MAX_ORACLES_EXCEEDED);
            }
            persistence.saveOracle(new Oracle(oracleId, weight));
            weights.put(oracleId, weight);
            return OracleResult.success(true);
        });
    }

    /**
     * Removes the oracle and its weight. Submissions it already made stay in the ledger;
     * they simply stop being visible to consensus.
     */
    public OracleResult<Boolean> removeOracle(String caller, String oracleId) {
        return underWriteLock(() -> {
            if (!configuration.isAdmin(caller))      return OracleResult.failure(OracleError.NOT_ADMIN);
            if (!weights.containsKey(oracleId))      return OracleResult.failure(OracleError.ORACLE_NOT_APPROVED);
            persistence.deleteOracle(oracleId);
            weights.remove(oracleId);
            return OracleResult.success(true);
        });
    }

    public boolean isApproved(String oracleId) {
        return underReadLock(() -> oracleId != null && weights.containsKey(oracleId));
    }

    /** Empty when the oracle is not approved; a present weight is always in [1, 100]. */
    public OptionalInt weightOf(String oracleId) {
        return underReadLock(() -> {
            Integer weight = oracleId == null ? null : weights.get(oracleId);
            return weight == null ? OptionalInt.empty() : OptionalInt.of(weight);
        });
    }

    public int approvedCount() {
        return underReadLock(weights::size);
    }

    public List<Oracle> approvedOracles() {
        return underReadLock(() -> {
            List<Oracle> oracles = new ArrayList<>(weights.size());
            weights.forEach((id, weight) -> oracles.add(new Oracle(id, weight)));
            return List.copyOf(oracles);
        });
    }

    // ── admin-gated configuration ───────────────────────────────────────────

    public OracleResult<Boolean> setConsensusThreshold(String caller, int threshold) {
        return underWriteLock(() -> {
            if (!configuration.isAdmin(caller))                   return OracleResult.failure(OracleError.NOT_ADMIN);
            if (!OracleConfiguration.isValidThreshold(threshold)) return OracleResult.failure(OracleError.INVALID_SETTING);
            return commitSettings(() -> configuration.setConsensusThreshold(threshold));
        });
    }

    /** Lowering the limit below the current count blocks new admissions but evicts no one. */
    public OracleResult<Boolean> setMaxOracles(String caller, int maxOracles) {
        return underWriteLock(() -> {
            if (!configuration.isAdmin(caller)) return OracleResult.failure(OracleError.NOT_ADMIN);
            if (maxOracles < 1)                 return OracleResult.failure(OracleError.INVALID_SETTING);
            return commitSettings(() -> configuration.setMaxOracles(maxOracles));
        });
    }

    public OracleResult<Boolean> setMaxSubmissionsPerOracle(String caller, int maxSubmissions) {
        return underWriteLock(() -> {
            if (!configuration.isAdmin(caller)) return OracleResult.failure(OracleError.NOT_ADMIN);
            if (maxSubmissions < 1)             return OracleResult.failure(OracleError.INVALID_SETTING);
            return commitSettings(() -> configuration.setMaxSubmissionsPerOracle(maxSubmissions));
        });
    }

    public OracleResult<Boolean> setStalenessWindow(String caller, long window) {
        return underWriteLock(() -> {
            if (!configuration.isAdmin(caller)) return OracleResult.failure(OracleError.NOT_ADMIN);
            if (window < 0)                     return OracleResult.failure(OracleError.INVALID_SETTING);
            return commitSettings(() -> configuration.setStalenessWindow(window));
        });
    }

    /** Applies {@code change}, persists the resulting settings, and rolls back if that fails. */
    private OracleResult<Boolean> commitSettings(Runnable change) {
        ConfigurationSnapshot previous = configuration.snapshot();
        change.run();
        try {
            persistence.saveSettings(configuration.snapshot());
        } catch (RuntimeException e) {
            configuration.restore(previous);
            throw e;
        }
        return OracleResult.success(true);
    }

    // ── locking ─────────────────────────────────────────────────────────────

    /**
     * Runs {@code action} while holding the shared lock, excluding concurrent admin changes.
     * The lock is reentrant, so lookups on this registry may be called from inside.
     */
    public <T> T underReadLock(Supplier<T> action) {
        return locked(lock.readLock(), action);
    }

    private <T> T underWriteLock(Supplier<T> action) {
        return locked(lock.writeLock(), action);
    }

    private static <T> T locked(Lock l, Supplier<T> action) {
        l.lock();
        try {
            return action.get();
        } finally {
            l.unlock();
        }
    }
}
