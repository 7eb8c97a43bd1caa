package com.leasedesk.showing.calendar.exception;

public class CalendarTokenNotFoundException extends RuntimeException {
    public CalendarTokenNotFoundException(String message) {
        super(message);
    }
}
