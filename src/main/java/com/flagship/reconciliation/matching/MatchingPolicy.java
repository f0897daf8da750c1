package com.flagship.reconciliation.matching;

import com.flagship.reconciliation.transaction.Transaction;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * The matching predicate.
 *
 * Two transactions are a match when:
 * - they are different transactions from different providers
 * - their currencies are the same code (exact string equality)
 * - their amounts differ by at most the amount tolerance (absolute, inclusive)
 * - their dates are at most the date window apart (absolute days, inclusive)
 * - both are still PENDING
 *
 * Pure and stateless; evaluated over snapshots loaded by the caller.
 */
public class MatchingPolicy {

    public static final BigDecimal DEFAULT_AMOUNT_TOLERANCE = new BigDecimal("0.01");
    public static final int DEFAULT_DATE_WINDOW_DAYS = 3;

    private final BigDecimal amountTolerance;
    private final int dateWindowDays;

    public MatchingPolicy(BigDecimal amountTolerance, int dateWindowDays) {
        if (amountTolerance == null || amountTolerance.signum() < 0) {
            throw new IllegalArgumentException("Amount tolerance must be zero or positive");
        }
        if (dateWindowDays < 0) {
            throw new IllegalArgumentException("Date window must be zero or positive");
        }
        this.amountTolerance = amountTolerance;
        this.dateWindowDays = dateWindowDays;
    }

    public static MatchingPolicy defaults() {
        return new MatchingPolicy(DEFAULT_AMOUNT_TOLERANCE, DEFAULT_DATE_WINDOW_DAYS);
    }

    public boolean matches(Transaction transaction, Transaction candidate) {
        return evaluate(transaction, candidate).isEmpty();
    }

    /**
     * Evaluates the predicate.
     *
     * @return empty if the pair matches, otherwise the first rule it failed
     */
    public Optional<MismatchReason> evaluate(Transaction transaction, Transaction candidate) {
        if (transaction.getId().equals(candidate.getId())) {
            return Optional.of(MismatchReason.SAME_TRANSACTION);
        }
        if (transaction.getProvider() == candidate.getProvider()) {
            return Optional.of(MismatchReason.SAME_PROVIDER);
        }
        if (!transaction.getCurrency().equals(candidate.getCurrency())) {
            return Optional.of(MismatchReason.CURRENCY_MISMATCH);
        }
        if (!amountsWithinTolerance(transaction.getAmount(), candidate.getAmount())) {
            return Optional.of(MismatchReason.AMOUNT_OUT_OF_TOLERANCE);
        }
        if (!datesWithinWindow(transaction.getTransactionDate(), candidate.getTransactionDate())) {
            return Optional.of(MismatchReason.DATE_OUT_OF_WINDOW);
        }
        if (!transaction.isPending() || !candidate.isPending()) {
            return Optional.of(MismatchReason.NOT_PENDING);
        }
        return Optional.empty();
    }

    boolean amountsWithinTolerance(BigDecimal a, BigDecimal b) {
        return a.subtract(b).abs().compareTo(amountTolerance) <= 0;
    }

    boolean datesWithinWindow(LocalDate a, LocalDate b) {
        return Math.abs(ChronoUnit.DAYS.between(a, b)) <= dateWindowDays;
    }

    public BigDecimal getAmountTolerance() {
        return amountTolerance;
    }

    public int getDateWindowDays() {
        return dateWindowDays;
    }
}
