package gr.imsi.athenarc.posemir.query;

/**
 * Base interface for the results of a query.
 */
public interface QueryResults {

    /**
     * Gets the time spent computing the results.
     *
     * @return The execution time in milliseconds
     */
    long getExecutionTime();

    /**
     * Gets the number of results, TECs or occurrences depending on the query.
     */
    int getResultCount();
}
