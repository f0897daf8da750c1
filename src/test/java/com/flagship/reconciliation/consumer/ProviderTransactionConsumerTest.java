package com.flagship.reconciliation.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flagship.reconciliation.observability.CorrelationContext;
import com.flagship.reconciliation.transaction.IngestionResult;
import com.flagship.reconciliation.transaction.TransactionFixtures;
import com.flagship.reconciliation.transaction.Transaction;
import com.flagship.reconciliation.transaction.TransactionIngestionService;
import com.flagship.reconciliation.transaction.dto.IngestTransactionRequest;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.kafka.support.Acknowledgment;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Provider feed consumer tests.
 *
 * These tests verify:
 * - A valid record is ingested, then acknowledged
 * - Malformed or invalid records are acknowledged and skipped
 * - Any other failure leaves the record unacknowledged for redelivery
 */
class ProviderTransactionConsumerTest {

    private static final String TOPIC = "provider-transactions";

    private TransactionIngestionService ingestionService;
    private Acknowledgment ack;
    private ObjectMapper objectMapper;
    private ProviderTransactionConsumer consumer;

    @BeforeEach
    void setUp() {
        ingestionService = mock(TransactionIngestionService.class);
        ack = mock(Acknowledgment.class);
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        consumer = new ProviderTransactionConsumer(ingestionService, objectMapper);
    }

    private ConsumerRecord<String, String> record(String value) {
        return new ConsumerRecord<>(TOPIC, 0, 42L, "INV-3001", value);
    }

    private String validPayload() throws Exception {
        return objectMapper.writeValueAsString(IngestTransactionRequest.builder()
                .provider("QUICKBOOKS")
                .externalId("INV-3001")
                .amount(new BigDecimal("80.00"))
                .currency("CAD")
                .transactionDate(LocalDate.of(2024, 3, 3))
                .build());
    }

    @Test
    @DisplayName("Valid record is ingested and acknowledged")
    void testConsume_ValidRecord() throws Exception {
        Transaction stored = TransactionFixtures.quickBooks("80.00", "CAD", "2024-03-03");
        when(ingestionService.ingest(any())).thenReturn(new IngestionResult(stored, true));

        consumer.consume(record(validPayload()), ack);

        ArgumentCaptor<IngestTransactionRequest> captor = ArgumentCaptor.forClass(IngestTransactionRequest.class);
        verify(ingestionService).ingest(captor.capture());
        assertEquals("INV-3001", captor.getValue().getExternalId());
        assertEquals(LocalDate.of(2024, 3, 3), captor.getValue().getTransactionDate());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Correlation id header is used for the duration of the record only")
    void testConsume_CorrelationIdFromHeader() throws Exception {
        Transaction stored = TransactionFixtures.quickBooks("80.00", "CAD", "2024-03-03");
        String[] seen = new String[1];
        when(ingestionService.ingest(any())).thenAnswer(invocation -> {
            seen[0] = MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY);
            return new IngestionResult(stored, true);
        });

        ConsumerRecord<String, String> record = record(validPayload());
        record.headers().add(CorrelationContext.CORRELATION_ID_HEADER, "feed-789".getBytes(StandardCharsets.UTF_8));

        consumer.consume(record, ack);

        assertEquals("feed-789", seen[0]);
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
    }

    @Test
    @DisplayName("Malformed JSON is acknowledged without ingesting")
    void testConsume_MalformedRecord() {
        consumer.consume(record("{not json"), ack);

        verify(ingestionService, never()).ingest(any());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Empty record is acknowledged without ingesting")
    void testConsume_EmptyRecord() {
        consumer.consume(record(null), ack);

        verify(ingestionService, never()).ingest(any());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Record rejected by validation is acknowledged and skipped")
    void testConsume_InvalidRecord() throws Exception {
        when(ingestionService.ingest(any())).thenThrow(new IllegalArgumentException("Invalid currency code: CAX"));

        consumer.consume(record(validPayload()), ack);

        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Store failure is rethrown and the record left unacknowledged")
    void testConsume_StoreFailure() throws Exception {
        when(ingestionService.ingest(any())).thenThrow(new DataAccessResourceFailureException("db down"));
        ConsumerRecord<String, String> record = record(validPayload());

        assertThrows(DataAccessResourceFailureException.class, () -> consumer.consume(record, ack));
        verify(ack, never()).acknowledge();
    }
}
