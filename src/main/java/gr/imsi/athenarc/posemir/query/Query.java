package gr.imsi.athenarc.posemir.query;

/**
 * Base interface for all query types in the system.
 */
public interface Query {

    /**
     * Gets the type of this query.
     *
     * @return The query type
     */
    QueryType getType();
}
