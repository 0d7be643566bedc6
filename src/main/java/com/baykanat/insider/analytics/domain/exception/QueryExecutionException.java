package com.baykanat.insider.analytics.domain.exception;

/** ClickHouse sorguyu reddetti veya çalıştıramadı. SQL metni mesaja konmaz. */
public class QueryExecutionException extends RuntimeException {

    private final String statementName;

    public QueryExecutionException(String statementName, Throwable cause) {
        super("Failed to execute analytics query: " + statementName, cause);
        this.statementName = statementName;
    }

    public String getStatementName() {
        return statementName;
    }
}
