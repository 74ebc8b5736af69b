package com.qqsuccubus.pipeline.core.dlq;

import com.qqsuccubus.pipeline.core.model.DeadLetterEnvelope;
import com.qqsuccubus.pipeline.core.model.Message;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Header layout of a dead-lettered record: the original headers followed by failure metadata.
 */
public final class DeadLetterHeaders {
    public static final String FAILURE_REASON = "dlq-failure-reason";
    public static final String FAILURE_DETAIL = "dlq-failure-detail";
    public static final String ATTEMPT_COUNT = "dlq-attempt-count";
    public static final String FIRST_FAILED_AT = "dlq-first-failed-at";
    public static final String LAST_FAILED_AT = "dlq-last-failed-at";
    public static final String ORIGINAL_TOPIC = "dlq-original-topic";
    public static final String ORIGINAL_PARTITION = "dlq-original-partition";
    public static final String ORIGINAL_SEQUENCE = "dlq-original-sequence";

    private DeadLetterHeaders() {
    }

    public static Map<String, String> of(DeadLetterEnvelope envelope) {
        Message original = envelope.getOriginalMessage();
        Map<String, String> headers = new LinkedHashMap<>(original.getHeaders());
        headers.put(FAILURE_REASON, envelope.getFailureReason().name());
        headers.put(FAILURE_DETAIL, envelope.getFailureDetail() == null ? "" : envelope.getFailureDetail());
        headers.put(ATTEMPT_COUNT, Integer.toString(envelope.getAttemptCount()));
        headers.put(FIRST_FAILED_AT, String.valueOf(envelope.getFirstFailedAt()));
        headers.put(LAST_FAILED_AT, String.valueOf(envelope.getLastFailedAt()));
        headers.put(ORIGINAL_TOPIC, original.getTopic());
        headers.put(ORIGINAL_PARTITION, original.getPartitionKey());
        headers.put(ORIGINAL_SEQUENCE, Long.toString(original.getSequenceToken()));
        return headers;
    }
}
