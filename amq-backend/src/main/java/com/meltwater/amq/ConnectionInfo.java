package com.meltwater.amq;


import com.rabbitmq.client.ConnectionFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;

import static com.rabbitmq.client.ConnectionFactory.DEFAULT_AMQP_PORT;
import static com.rabbitmq.client.ConnectionFactory.DEFAULT_CONNECTION_TIMEOUT;
import static com.rabbitmq.client.ConnectionFactory.DEFAULT_HOST;
import static com.rabbitmq.client.ConnectionFactory.DEFAULT_PASS;
import static com.rabbitmq.client.ConnectionFactory.DEFAULT_USER;
import static com.rabbitmq.client.ConnectionFactory.DEFAULT_VHOST;
import static com.rabbitmq.client.ConnectionFactory.USE_DEFAULT_PORT;

/**
 * Everything needed to open one logical connection to the broker.
 *
 * An unset port ({@link ConnectionFactory#USE_DEFAULT_PORT}) resolves to the default port of the backend.
 *
 * @see <a href="https://www.rabbitmq.com/uri-spec.html">AMQP URI spec</a>
 */
public class ConnectionInfo {

    public final String host;
    public final int port;
    public final String userId;
    public final String password;
    public final String virtualHost;
    public final boolean ssl;
    /**
     * AMQP 0-8 'insist' flag. AMQP 0-9-1 has no equivalent, the value is only reported as a client property.
     */
    public final boolean insist;
    public final int connectTimeoutMillis;

    private ConnectionInfo(String host, int port, String userId, String password, String virtualHost,
                           boolean ssl, boolean insist, int connectTimeoutMillis) {
        this.host = host;
        this.port = port;
        this.userId = userId;
        this.password = password;
        this.virtualHost = virtualHost;
        this.ssl = ssl;
        this.insist = insist;
        this.connectTimeoutMillis = connectTimeoutMillis;
    }

    public boolean hasPort() {
        return port != USE_DEFAULT_PORT;
    }

    /**
     * @param defaultPort the port to use when none was configured
     * @return a copy with the port filled in, or this instance when the port is already set
     */
    public ConnectionInfo withDefaultPort(int defaultPort) {
        if (hasPort()) {
            return this;
        }
        return new ConnectionInfo(host, defaultPort, userId, password, virtualHost, ssl, insist, connectTimeoutMillis);
    }

    @Override
    public String toString() {
        int shownPort = hasPort() ? port : DEFAULT_AMQP_PORT;
        return (ssl ? "amqps" : "amqp") + "://" + host + ":" + shownPort + "/" + (virtualHost.equals("/") ? "" : virtualHost);
    }

    public static class Builder {

        private String host         = DEFAULT_HOST;
        private int port            = USE_DEFAULT_PORT;
        private String userId       = DEFAULT_USER;
        private String password     = DEFAULT_PASS;
        private String virtualHost  = DEFAULT_VHOST;
        private boolean ssl         = false;
        private boolean insist      = false;
        private int connectTimeout  = DEFAULT_CONNECTION_TIMEOUT;

        public ConnectionInfo build() {
            return new ConnectionInfo(host, port, userId, password, virtualHost, ssl, insist, connectTimeout);
        }

        /**
         * Copies host, port, credentials, virtual host and ssl from an amqp:// or amqps:// URI.
         * The port is only taken from the URI when it is explicitly given there.
         */
        public Builder withUriString(String amqpUriString) throws URISyntaxException, NoSuchAlgorithmException, KeyManagementException {
            ConnectionFactory tmp = new ConnectionFactory();
            tmp.setUri(amqpUriString);
            URI uri = new URI(amqpUriString);
            host = tmp.getHost();
            port = uri.getPort() == -1 ? USE_DEFAULT_PORT : uri.getPort();
            userId = tmp.getUsername();
            password = tmp.getPassword();
            virtualHost = tmp.getVirtualHost();
            ssl = tmp.isSSL();
            return this;
        }

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withUserId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder withPassword(String password) {
            this.password = password;
            return this;
        }

        public Builder withVirtualHost(String virtualHost) {
            this.virtualHost = virtualHost;
            return this;
        }

        public Builder withSsl(boolean ssl) {
            this.ssl = ssl;
            return this;
        }

        public Builder withInsist(boolean insist) {
            this.insist = insist;
            return this;
        }

        public Builder withConnectTimeoutMillis(int connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }
    }
}
