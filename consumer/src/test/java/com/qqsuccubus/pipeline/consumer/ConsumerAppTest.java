package com.qqsuccubus.pipeline.consumer;

import com.qqsuccubus.pipeline.consumer.handler.LoggingMessageHandler;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConsumerAppTest {

    @Test
    void testLoadHandler_FindsRegisteredService() {
        assertEquals(LoggingMessageHandler.class, ConsumerApp.loadHandler().getClass());
    }
}
