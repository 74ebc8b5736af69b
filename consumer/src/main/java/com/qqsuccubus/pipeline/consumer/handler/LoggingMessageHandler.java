package com.qqsuccubus.pipeline.consumer.handler;

import com.qqsuccubus.pipeline.core.model.Message;
import com.qqsuccubus.pipeline.core.pipeline.MessageHandler;
import com.qqsuccubus.pipeline.core.pipeline.ProcessingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Default handler registered through {@code META-INF/services}: logs each message and records
 * it as processed. Deployments put their own handler first on the classpath.
 */
public class LoggingMessageHandler implements MessageHandler {
    private static final Logger log = LoggerFactory.getLogger(LoggingMessageHandler.class);

    @Override
    public Mono<Void> process(Message message, ProcessingContext context) {
        return Mono.fromRunnable(() -> log.info("Received {} (key={}, {} bytes, attempt {})",
                message.coordinates(), message.getKey(), message.getPayload().length, context.getAttempt()))
            .then(context.markProcessed());
    }
}
