package com.leasedesk.showing.showing.service;

/**
 * Pipeline stages in execution order.
 */
public enum PipelineStage {
    RESOLVE_PROPERTY_ID,
    FETCH_PROPERTY_DETAILS,
    FETCH_PROPERTY_GROUPS,
    MAP_AGENT,
    FETCH_CALENDAR_CREDENTIAL,
    FETCH_BUSY_INTERVALS,
    GENERATE_AVAILABILITY,
    FORMAT_MESSAGE
}
