package com.queryroute.connector;

/**
 * Capability interface for one registered source.
 */
public interface SourceConnector extends AutoCloseable {

    String getSourceId();

    /**
     * @return normalized source type, e.g. {@code postgres}, {@code mysql}, {@code csv}
     */
    String getDbType();

    /**
     * @return whether the source executes SQL text (otherwise it takes operation sequences)
     */
    boolean supportsSql();

    /**
     * Opens a session.
     *
     * @return open session, to be closed by the caller
     * @throws SourceAccessException when the source cannot be reached
     */
    SourceSession connect();

    @Override
    void close();
}
