package com.valuationoracle.common.ledger;

import com.valuationoracle.common.model.OracleActivity;
import com.valuationoracle.common.model.Submission;
import com.valuationoracle.common.persistence.OracleStatePersistence;
import com.valuationoracle.common.registry.OracleRegistry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest submission per (subject, oracle) pair plus the per-oracle activity counters.
 *
 * <p>Rows are keyed independently of approval status. {@link #submissionsFor(long)} consults
 * the {@link OracleRegistry} at query time, so a removed oracle's rows stay stored but drop
 * out of every later consensus computation without any cascading delete.
 *
 * <p>The submission quota is a lifetime counter: it is never reset or decremented. Rows and
 * counters are written through {@link OracleStatePersistence} and reloaded on construction,
 * so a restart does not restore anyone's quota.
 */
public class SubmissionLedger {

    private final OracleRegistry registry;
    private final OracleStatePersistence persistence;

    /** subjectId → (oracleId → latest submission). */
    private final ConcurrentHashMap<Long, ConcurrentHashMap<String, Submission>> submissions =
        new ConcurrentHashMap<>();

    private final ConcurrentHashMap<String, OracleActivity> activity = new ConcurrentHashMap<>();

    public SubmissionLedger(OracleRegistry registry, OracleStatePersistence persistence) {
        this.registry    = registry;
        this.persistence = persistence;
        for (Submission submission : persistence.loadSubmissions()) {
            submissions.computeIfAbsent(submission.subjectId(), k -> new ConcurrentHashMap<>())
                       .put(submission.oracleId(), submission);
        }
        activity.putAll(persistence.loadActivity());
    }

    /**
     * Records the submission if the oracle still has quota left, overwriting any earlier
     * submission from the same oracle for the same subject.
     *
     * <p>Quota check, durable write, counter increment and row update happen as one atomic
     * step per oracle, so concurrent submissions for different subjects cannot overrun the
     * quota. If the durable write fails nothing changes in memory.
     *
     * @return {@code false} when the oracle has already made {@code maxSubmissions}
     *         submissions; nothing is written in that case
     * @throws IllegalArgumentException if {@code price} is not positive
     */
    public boolean recordSubmission(long subjectId, String oracleId, long price, long now,
                                    int maxSubmissions) {
        if (price <= 0) {
            throw new IllegalArgumentException("price must be positive, was " + price);
        }
        boolean[] recorded = {false};
        activity.compute(oracleId, (id, current) -> {
            if (current != null && current.submissionCount() >= maxSubmissions) {
                return current;
            }
            Submission submission = new Submission(subjectId, oracleId, price, now);
            OracleActivity updated = current == null ? OracleActivity.first(now) : current.next(now);
            persistence.saveSubmission(submission, updated);
            submissions.computeIfAbsent(subjectId, k -> new ConcurrentHashMap<>())
                       .put(oracleId, submission);
            recorded[0] = true;
            return updated;
        });
        return recorded[0];
    }

    /**
     * Current submissions for a subject from oracles that are approved right now,
     * ordered by oracle id.
     */
    public List<Submission> submissionsFor(long subjectId) {
        Map<String, Submission> bySubject = submissions.get(subjectId);
        if (bySubject == null) {
            return List.of();
        }
        List<Submission> visible = new ArrayList<>(bySubject.size());
        for (Submission submission : bySubject.values()) {
            if (registry.isApproved(submission.oracleId())) {
                visible.add(submission);
            }
        }
        visible.sort(Comparator.comparing(Submission::oracleId));
        return visible;
    }

    /** Raw stored row, visible whether or not the oracle is still approved. */
    public Optional<Submission> submissionOf(long subjectId, String oracleId) {
        Map<String, Submission> bySubject = submissions.get(subjectId);
        return bySubject == null ? Optional.empty() : Optional.ofNullable(bySubject.get(oracleId));
    }

    public Optional<OracleActivity> activityOf(String oracleId) {
        return Optional.ofNullable(activity.get(oracleId));
    }
}
