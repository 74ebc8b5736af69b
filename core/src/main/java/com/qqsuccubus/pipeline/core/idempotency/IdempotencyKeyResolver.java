package com.qqsuccubus.pipeline.core.idempotency;

import com.qqsuccubus.pipeline.core.model.IdempotencyKey;
import com.qqsuccubus.pipeline.core.model.Message;

import java.util.function.Function;

/**
 * Derives the idempotency key of a message.
 */
@FunctionalInterface
public interface IdempotencyKeyResolver {

    IdempotencyKey resolve(Message message);

    /**
     * Uses a logical id extracted by the caller (e.g. {@code paymentId} from the payload),
     * falling back to delivery coordinates when the extractor yields null or blank.
     */
    static IdempotencyKeyResolver logicalId(Function<Message, String> extractor) {
        return message -> {
            String logicalId = extractor.apply(message);
            return logicalId == null || logicalId.isBlank()
                ? IdempotencyKey.fromCoordinates(message)
                : IdempotencyKey.logical(logicalId);
        };
    }

    /**
     * Uses the value of a header as the logical id.
     */
    static IdempotencyKeyResolver fromHeader(String headerName) {
        return logicalId(message -> message.header(headerName));
    }
}
