package com.queryroute.connector;

/**
 * Looks up the connector of a registered source.
 */
@FunctionalInterface
public interface SourceConnectorProvider {

    /**
     * @param sourceId registered source id
     * @return connector
     * @throws com.queryroute.catalog.SourceNotFoundException when the id is not registered
     */
    SourceConnector connectorFor(String sourceId);
}
