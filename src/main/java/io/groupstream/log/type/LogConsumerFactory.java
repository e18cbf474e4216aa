package io.groupstream.log.type;

/** Opens readers of derived logs; one call per (re)connection. */
@FunctionalInterface
public interface LogConsumerFactory {

    LogConsumer open(String logId, String consumerGroupId);
}
