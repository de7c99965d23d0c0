package com.jay.valuator.layer1_data;

/** An external data source (research service, market data) failed or returned unusable data. */
public class AcquisitionException extends RuntimeException {

    public AcquisitionException(String message) {
        super(message);
    }

    public AcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
