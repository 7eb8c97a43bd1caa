package com.leasedesk.showing.calendar.exception;

/**
 * The free/busy answer was received but is unusable for the requested calendar.
 */
public class CalendarReadException extends RuntimeException {
    public CalendarReadException(String message) {
        super(message);
    }
}
