package io.groupstream.log.impl;

import io.groupstream.log.type.LogConsumer;
import io.groupstream.log.type.LogConsumerFactory;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public final class KafkaLogConsumerFactory implements LogConsumerFactory {
    private final String bootstrapServers;

    @Override
    public LogConsumer open(final String logId, final String consumerGroupId) {
        return new KafkaLogConsumer(bootstrapServers, logId, consumerGroupId);
    }
}
