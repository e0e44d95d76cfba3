package com.valuationoracle.common.consensus;

import com.valuationoracle.common.model.Valuation;

/**
 * Outcome of an accepted submission: the price as submitted and the valuation that the
 * same submission committed, captured while the subject was still locked.
 */
public record SubmissionReceipt(long price, Valuation valuation) {}
