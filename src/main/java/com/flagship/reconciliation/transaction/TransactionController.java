package com.flagship.reconciliation.transaction;

import com.flagship.reconciliation.matching.ReconciliationEngine;
import com.flagship.reconciliation.matching.ReconciliationResult;
import com.flagship.reconciliation.transaction.dto.IngestTransactionRequest;
import com.flagship.reconciliation.transaction.dto.ReconciliationResponse;
import com.flagship.reconciliation.transaction.dto.TransactionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST Controller for transactions.
 *
 * - POST /api/transactions ingests a record and reconciles it immediately
 * - POST /api/transactions/{id}/reconcile is the manual trigger; it runs the same
 *   reconciliation as ingestion and is safe to repeat
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private final TransactionIngestionService ingestionService;
    private final TransactionStore transactionStore;
    private final ReconciliationEngine reconciliationEngine;

    /**
     * Ingests a transaction.
     *
     * @return 201 with the stored transaction, or 200 if it had already been ingested
     */
    @PostMapping
    public ResponseEntity<TransactionResponse> ingestTransaction(@Valid @RequestBody IngestTransactionRequest request) {
        log.info("Received transaction: provider={}, externalId={}, amount={}, currency={}",
                request.getProvider(), request.getExternalId(), request.getAmount(), request.getCurrency());

        IngestionResult result = ingestionService.ingest(request);
        TransactionResponse body = TransactionResponse.from(result.getTransaction());

        return result.isCreated()
            ? ResponseEntity.status(HttpStatus.CREATED).body(body)
            : ResponseEntity.ok(body);
    }

    /**
     * Lists transactions, optionally filtered by status, provider and entity.
     */
    @GetMapping
    public List<TransactionResponse> listTransactions(
            @RequestParam(name = "status", required = false) ReconciliationStatus status,
            @RequestParam(name = "provider", required = false) Provider provider,
            @RequestParam(name = "entity_id", required = false) UUID entityId) {
        return transactionStore.list(new TransactionFilter(status, provider, entityId))
            .stream()
            .map(TransactionResponse::from)
            .toList();
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransactionResponse> getTransaction(@PathVariable("id") UUID id) {
        return transactionStore.get(id)
            .map(transaction -> ResponseEntity.ok(TransactionResponse.from(transaction)))
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Manually triggers reconciliation for a transaction.
     * An already matched transaction returns its existing match.
     */
    @PostMapping("/{id}/reconcile")
    public ReconciliationResponse reconcileTransaction(@PathVariable("id") UUID id) {
        ReconciliationResult result = reconciliationEngine.reconcile(id);
        return ReconciliationResponse.from(result);
    }
}
