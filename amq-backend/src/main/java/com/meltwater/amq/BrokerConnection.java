package com.meltwater.amq;

import com.google.common.base.Preconditions;
import com.meltwater.amq.impl.AmqpClientBackend;
import com.meltwater.amq.util.Logger;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

import java.io.Closeable;
import java.io.IOException;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Owns one connection to the broker. The connection is established on first use and handed out to the
 * backends created from this object, each of which opens its own channel on it.
 *
 * Closing is idempotent and terminal: a closed broker connection is never re-established.
 */
public class BrokerConnection implements Closeable {

    private static final Logger log = new Logger(BrokerConnection.class);

    public static final int DEFAULT_PORT = ConnectionFactory.DEFAULT_AMQP_PORT;

    private final ConnectionInfo info;
    private final BackendSettings settings;
    private final Supplier<ConnectionFactory> connectionFactories;

    private Connection connection;
    private DateTime connectTime;
    private boolean closed;

    public BrokerConnection(ConnectionInfo info, BackendSettings settings) {
        this(info, settings, DEFAULT_PORT, ConnectionFactory::new);
    }

    /**
     * @param info where and how to connect
     * @param settings backend settings
     * @param defaultPort the port used when {@code info} does not specify one
     * @param connectionFactories creates the client {@link ConnectionFactory} that is configured and used to connect
     */
    public BrokerConnection(ConnectionInfo info, BackendSettings settings, int defaultPort, Supplier<ConnectionFactory> connectionFactories) {
        Preconditions.checkNotNull(info, "info");
        Preconditions.checkNotNull(settings, "settings");
        this.info = info.withDefaultPort(defaultPort);
        this.settings = settings;
        this.connectionFactories = connectionFactories;
    }

    /**
     * @return the connection info with the port resolved
     */
    public ConnectionInfo getConnectionInfo() {
        return info;
    }

    public BackendSettings getSettings() {
        return settings;
    }

    /**
     * Returns the open connection, establishing it if this is the first call.
     *
     * @throws ChannelClosedException if this broker connection has been closed, or the connection was lost
     * @throws IOException if the connection could not be established
     */
    public synchronized Connection establishConnection() throws IOException {
        if (closed) {
            throw new ChannelClosedException("Broker connection " + info + " has been closed");
        }
        if (connection != null) {
            if (!connection.isOpen()) {
                throw closedConnectionError(connection.getCloseReason());
            }
            return connection;
        }
        connectTime = new DateTime(DateTimeZone.UTC);
        String connectionName = settings.app_id + "-" + connectTime.getMillis();

        ConnectionFactory cf = connectionFactories.get();
        cf.setHost(info.host);
        cf.setPort(info.port);
        cf.setUsername(info.userId);
        cf.setPassword(info.password);
        cf.setVirtualHost(info.virtualHost);
        cf.setConnectionTimeout(info.connectTimeoutMillis);
        cf.setRequestedHeartbeat(settings.heartbeat);
        cf.setHandshakeTimeout(settings.handshake_timeout_millis);
        cf.setShutdownTimeout(settings.shutdown_timeout_millis);
        cf.setRequestedFrameMax(settings.frame_max);
        cf.setAutomaticRecoveryEnabled(false);
        cf.setTopologyRecoveryEnabled(false);
        if (info.ssl) {
            try {
                cf.useSslProtocol();
            } catch (NoSuchAlgorithmException | KeyManagementException e) {
                throw new IOException("Could not set up TLS for " + info, e);
            }
        }

        Map<String, Object> clientProperties = new HashMap<>(cf.getClientProperties());
        clientProperties.put("app_id", settings.app_id);
        clientProperties.put("connect_time", connectTime.toString());
        clientProperties.put("insist", info.insist);
        cf.setClientProperties(clientProperties);
        if (info.insist) {
            log.debugWithParams("The insist flag has no AMQP 0-9-1 equivalent and is only sent as a client property.",
                    "address", info);
        }

        try {
            connection = cf.newConnection(connectionName);
        } catch (TimeoutException e) {
            throw new IOException("Timed out connecting to " + info, e);
        }
        log.infoWithParams("Successfully created connection to broker.",
                "address", info,
                "name", connectionName,
                "connectTime", connectTime,
                "settings", settings);
        return connection;
    }

    /**
     * Opens a new channel on the (possibly newly established) connection.
     */
    public Channel createChannel() throws IOException {
        Channel channel;
        try {
            channel = establishConnection().createChannel();
        } catch (ShutdownSignalException e) {
            throw closedConnectionError(e);
        }
        if (channel == null) {
            throw new ProtocolException(ProtocolException.UNKNOWN_REPLY_CODE, "No channel number available on " + info);
        }
        return channel;
    }

    private ChannelClosedException closedConnectionError(ShutdownSignalException reason) {
        if (reason == null) {
            return new ChannelClosedException("Connection to " + info + " is closed");
        }
        return new ChannelClosedException(ProtocolException.replyCodeOf(reason),
                "Connection to " + info + " was closed: " + reason.getMessage(), reason);
    }

    /**
     * Creates a backend that logs advisories.
     */
    public Backend createBackend() {
        return createBackend(new LoggingAdvisoryListener());
    }

    public Backend createBackend(AdvisoryListener advisoryListener) {
        return new AmqpClientBackend(this, advisoryListener);
    }

    public synchronized boolean isConnected() {
        return connection != null && connection.isOpen();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (connection == null) {
            return;
        }
        boolean wasOpen = connection.isOpen();
        if (wasOpen) {
            try {
                connection.close();
            } catch (Exception e) {
                log.warnWithParams("Unexpected error when closing connection.", e,
                        "wasOpen", wasOpen,
                        "isOpen", connection.isOpen());
            }
        }
        log.infoWithParams("Closed and disposed connection.",
                "address", info,
                "connectTime", connectTime,
                "wasOpen", wasOpen);
    }
}
