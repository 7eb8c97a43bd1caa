package com.leasedesk.showing.showing.service;

/**
 * Terminal outcome of a showing availability lookup.
 */
public enum PipelineOutcome {
    SUCCESS,
    PROPERTY_NOT_FOUND,
    PROPERTY_DETAILS_UNAVAILABLE,
    AGENT_UNMAPPED,
    CALENDAR_ACCESS_UNAVAILABLE,
    CALENDAR_READ_FAILED
}
