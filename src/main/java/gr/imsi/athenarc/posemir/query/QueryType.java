package gr.imsi.athenarc.posemir.query;

/**
 * Enumeration of different query types supported by the system.
 */
public enum QueryType {
    DISCOVERY,
    MATCH
}
