package com.platform.driftengine.exception;

import com.platform.driftengine.domain.TableRef;

/**
 * Current or reference snapshot could not be retrieved. Fatal to the run.
 */
public class DataFetchException extends DriftEngineException {

    private final TableRef table;
    private final Integer offsetDays;

    public DataFetchException(TableRef table, Integer offsetDays, String message) {
        this("DATA_FETCH_ERROR", table, offsetDays, message, null);
    }

    public DataFetchException(TableRef table, Integer offsetDays, String message, Throwable cause) {
        this("DATA_FETCH_ERROR", table, offsetDays, message, cause);
    }

    protected DataFetchException(String errorCode, TableRef table, Integer offsetDays,
                                 String message, Throwable cause) {
        super(errorCode, message, cause);
        this.table = table;
        this.offsetDays = offsetDays;
    }

    public TableRef getTable() {
        return table;
    }

    /**
     * Requested time-travel offset, or null when the current snapshot failed.
     */
    public Integer getOffsetDays() {
        return offsetDays;
    }
}
