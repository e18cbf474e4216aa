package io.groupstream.metadata;

/**
 * ksqlDB rejected a statement or query (4xx). Not retryable.
 */
public final class KsqlStatementException extends RuntimeException {

    public KsqlStatementException(final String message) {
        super(message);
    }
}
