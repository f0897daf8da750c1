package com.flagship.reconciliation.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.reconciliation.observability.CorrelationContext;
import com.flagship.reconciliation.transaction.IngestionResult;
import com.flagship.reconciliation.transaction.TransactionIngestionService;
import com.flagship.reconciliation.transaction.dto.IngestTransactionRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Kafka consumer for provider transaction feeds.
 *
 * Each record is one provider transaction as JSON (same shape as the REST ingestion body).
 *
 * - Manual acknowledgment: offsets are committed only after ingestion completes
 * - Malformed or invalid records are logged and acknowledged, so they cannot block the partition
 * - Any other failure is rethrown without acknowledging, and the record is redelivered;
 *   redelivery is safe because ingestion is idempotent on (provider, externalId)
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ProviderTransactionConsumer {

    private final TransactionIngestionService ingestionService;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.provider-transactions:provider-transactions}",
        groupId = "${spring.kafka.consumer.group-id:reconciliation-ingestion}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        CorrelationContext.setCorrelationId(headerValue(record, CorrelationContext.CORRELATION_ID_HEADER));
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.getCorrelationId());

        log.debug("Received provider record: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        try {
            IngestTransactionRequest request = parse(record.value());
            if (request == null) {
                log.warn("Could not parse provider record, acknowledging to skip: offset={}", record.offset());
                ack.acknowledge();
                return;
            }

            IngestionResult result = ingestionService.ingest(request);
            ack.acknowledge();

            log.info("Ingested provider record: transactionId={}, created={}, status={}",
                    result.getTransaction().getId(), result.isCreated(), result.getTransaction().getStatus());

        } catch (IllegalArgumentException e) {
            log.warn("Invalid provider record, acknowledging to skip: offset={}, error={}",
                    record.offset(), e.getMessage());
            ack.acknowledge();
        } catch (Exception e) {
            log.error("Error ingesting provider record: offset={}, error={}", record.offset(), e.getMessage(), e);
            throw e;
        } finally {
            CorrelationContext.clear();
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }

    private IngestTransactionRequest parse(String payload) {
        if (payload == null || payload.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(payload, IngestTransactionRequest.class);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse provider record: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String headerValue(ConsumerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header != null && header.value() != null
            ? new String(header.value(), StandardCharsets.UTF_8)
            : null;
    }
}
