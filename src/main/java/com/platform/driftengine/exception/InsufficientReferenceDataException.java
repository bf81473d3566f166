package com.platform.driftengine.exception;

import com.platform.driftengine.domain.TableRef;

/**
 * The reference fetch worked but returned no rows (table too new, history purged).
 */
public class InsufficientReferenceDataException extends DataFetchException {

    public InsufficientReferenceDataException(TableRef table, int offsetDays) {
        super("INSUFFICIENT_REFERENCE_DATA", table, offsetDays,
                "No historical data available for table " + table.qualifiedName()
                        + " at " + offsetDays + " day(s) ago", null);
    }
}
