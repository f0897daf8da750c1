package com.flagship.reconciliation.transaction;

import com.flagship.reconciliation.matching.ReconciliationEngine;
import com.flagship.reconciliation.observability.ReconciliationMetrics;
import com.flagship.reconciliation.transaction.dto.IngestTransactionRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Currency;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Ingestion gateway: validates, normalizes and persists provider records, then
 * hands them to the reconciliation engine.
 *
 * The engine only ever sees well-formed PENDING transactions:
 * - provider is one of the supported accounting sources
 * - amount is positive with at most two decimals (stored at scale 2)
 * - currency is a valid ISO-4217 code (stored upper-case)
 * - optional descriptive fields are trimmed, blank ones dropped
 *
 * Ingestion is idempotent on (provider, externalId): a record seen before is not stored
 * again, it is only reconciled again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionIngestionService {

    private final TransactionStore store;
    private final ReconciliationEngine reconciliationEngine;
    private final ReconciliationMetrics metrics;

    /**
     * Ingests a provider record and reconciles it.
     *
     * @param request Provider record
     * @return the stored transaction, in its state after reconciliation
     * @throws IllegalArgumentException if the record is invalid
     */
    public IngestionResult ingest(IngestTransactionRequest request) {
        Provider provider;
        String externalId;
        BigDecimal amount;
        String currency;
        try {
            provider = parseProvider(request.getProvider());
            externalId = requireText(request.getExternalId(), "External ID is required");
            amount = normalizeAmount(request.getAmount());
            currency = normalizeCurrency(request.getCurrency());
            if (request.getTransactionDate() == null) {
                throw new IllegalArgumentException("Transaction date is required");
            }
        } catch (IllegalArgumentException e) {
            metrics.recordIngested("unknown", "invalid");
            log.warn("Rejected provider record: {}", e.getMessage());
            throw e;
        }

        Optional<Transaction> existing = store.findByExternalId(provider, externalId);
        if (existing.isPresent()) {
            return reingest(existing.get());
        }

        Transaction transaction = Transaction.create(
            UUID.randomUUID(),
            provider,
            externalId,
            amount,
            currency,
            request.getTransactionDate(),
            request.getDescription(),
            detailsOf(request),
            Instant.now().truncatedTo(ChronoUnit.MICROS)
        );

        Transaction saved;
        try {
            saved = store.create(transaction);
        } catch (DataIntegrityViolationException e) {
            // Same record delivered twice concurrently; the other delivery won the insert
            Transaction winner = store.findByExternalId(provider, externalId).orElseThrow(() -> e);
            return reingest(winner);
        }

        metrics.recordIngested(provider.name(), "created");
        log.info("Ingested transaction {}: provider={}, externalId={}, amount={}, currency={}, date={}",
                saved.getId(), provider, externalId, amount, currency, saved.getTransactionDate());

        reconciliationEngine.reconcile(saved.getId());
        return new IngestionResult(reload(saved.getId()), true);
    }

    private IngestionResult reingest(Transaction existing) {
        metrics.recordIngested(existing.getProvider().name(), "duplicate");
        log.info("Transaction {} already ingested (provider={}, externalId={}), reconciling again",
                existing.getId(), existing.getProvider(), existing.getExternalId());
        reconciliationEngine.reconcile(existing.getId());
        return new IngestionResult(reload(existing.getId()), false);
    }

    private Transaction reload(UUID transactionId) {
        return store.get(transactionId)
            .orElseThrow(() -> new TransactionNotFoundException(transactionId));
    }

    private static TransactionDetails detailsOf(IngestTransactionRequest request) {
        String transactionType = trimToNull(request.getTransactionType());
        return TransactionDetails.builder()
            .entityId(request.getEntityId())
            .reference(trimToNull(request.getReference()))
            .transactionType(transactionType != null ? transactionType.toUpperCase(Locale.ROOT) : null)
            .contactName(trimToNull(request.getContactName()))
            .accountCode(trimToNull(request.getAccountCode()))
            .build();
    }

    private Provider parseProvider(String provider) {
        String value = requireText(provider, "Provider is required");
        try {
            return Provider.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported provider: " + provider);
        }
    }

    private BigDecimal normalizeAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        if (amount.stripTrailingZeros().scale() > 2) {
            throw new IllegalArgumentException("Amount must have at most 2 decimal places: " + amount);
        }
        return amount.setScale(2, RoundingMode.UNNECESSARY);
    }

    private String normalizeCurrency(String currency) {
        String code = requireText(currency, "Currency is required").trim().toUpperCase(Locale.ROOT);
        try {
            return Currency.getInstance(code).getCurrencyCode();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid currency code: " + currency);
        }
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }
}
