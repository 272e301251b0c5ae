package com.abhinavmehta.sgraph.sdk.exception;

/** The query exceeded its time budget and was abandoned. */
public class QueryTimeoutException extends SGraphException {
    public QueryTimeoutException(long budgetMillis) {
        super(ErrorKind.QUERY_TIMEOUT, "Query exceeded its time budget of " + budgetMillis + " ms");
    }
}
