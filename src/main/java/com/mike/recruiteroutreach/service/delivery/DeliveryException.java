package com.mike.recruiteroutreach.service.delivery;

/**
 * Mail transport failure. Aborts the rest of a send batch; sends already
 * persisted stay recorded.
 */
public class DeliveryException extends RuntimeException {

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
