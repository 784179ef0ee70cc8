package com.p14n.amqpsub.broker;

/**
 * Handle to an open broker connection. Shared process-wide; engines open their
 * own channels on it and never close it.
 */
public interface BrokerConnection extends AutoCloseable {

    /**
     * Opens a new channel on this connection.
     *
     * @return the channel
     * @throws com.p14n.amqpsub.errors.TransportException if the connection is closed
     */
    BrokerChannel openChannel();

    /**
     * @return true while the connection is usable
     */
    boolean isOpen();

    /**
     * Closes the connection and every channel opened on it.
     */
    @Override
    void close();
}
