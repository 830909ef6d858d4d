package com.meltwater.amq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

public class BrokerConnectionTest {

    private FakeBroker broker;
    private ConnectionFactory factory;
    private BrokerConnection brokerConnection;

    @Before
    public void setup() {
        broker = new FakeBroker();
        factory = broker.connectionFactory();
        ConnectionInfo info = new ConnectionInfo.Builder().withHost("mq.example.com").withSsl(false).build();
        BackendSettings settings = new BackendSettings.Builder().withAppId("indexer").withHeartbeatSecs(7).build();
        brokerConnection = new BrokerConnection(info, settings, BrokerConnection.DEFAULT_PORT, () -> factory);
    }

    @Test
    public void connects_lazily_and_only_once() throws Exception {
        verify(factory, never()).newConnection(anyString());

        Connection first = brokerConnection.establishConnection();
        Connection second = brokerConnection.createBackend().establishConnection();

        assertThat(first, sameInstance(second));
        assertThat(first, sameInstance(broker.connection()));
        verify(factory, times(1)).newConnection(anyString());
        assertTrue(brokerConnection.isConnected());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void configures_the_client_from_info_and_settings() throws Exception {
        brokerConnection.establishConnection();

        verify(factory).setHost("mq.example.com");
        verify(factory).setPort(5672);
        verify(factory).setRequestedHeartbeat(7);
        verify(factory).setAutomaticRecoveryEnabled(false);
        verify(factory, never()).useSslProtocol();
        ArgumentCaptor<Map> clientProperties = ArgumentCaptor.forClass(Map.class);
        verify(factory).setClientProperties(clientProperties.capture());
        assertThat(clientProperties.getValue().get("app_id"), equalTo("indexer"));
        assertThat(clientProperties.getValue().get("insist"), equalTo(false));
    }

    @Test
    public void closed_connection_is_never_re_established() throws Exception {
        brokerConnection.establishConnection();

        brokerConnection.close();
        brokerConnection.close();

        verify(broker.connection(), times(1)).close();
        assertTrue(brokerConnection.isClosed());
        assertFalse(brokerConnection.isConnected());
        try {
            brokerConnection.establishConnection();
            fail("expected a closed connection to stay closed");
        } catch (ChannelClosedException e) {
            verify(factory, times(1)).newConnection(anyString());
        }
    }

    @Test
    public void closing_before_connecting_does_not_connect() throws Exception {
        brokerConnection.close();

        verify(factory, never()).newConnection(anyString());
        assertThat(brokerConnection.isClosed(), is(true));
    }

    @Test
    public void backend_close_connection_ignores_closed_connections() throws Exception {
        Backend backend = brokerConnection.createBackend();
        Connection connection = backend.establishConnection();

        backend.closeConnection(connection);
        backend.closeConnection(connection);
        backend.closeConnection(null);

        verify(connection, times(1)).close();
    }

    @Test
    public void dropped_connection_fails_with_closed_channel_error() throws Exception {
        brokerConnection.establishConnection();

        broker.dropConnection(AMQP.CONNECTION_FORCED, "CONNECTION_FORCED - broker forced connection closure");

        try {
            brokerConnection.establishConnection();
            fail("expected a dropped connection to be reported");
        } catch (ChannelClosedException e) {
            assertThat(e.getReplyCode(), is(AMQP.CONNECTION_FORCED));
            verify(factory, times(1)).newConnection(anyString());
        }
    }

    @Test
    public void connection_closing_while_opening_a_channel_fails_with_closed_channel_error() throws Exception {
        Connection connection = brokerConnection.establishConnection();
        AMQP.Connection.Close close = new AMQP.Connection.Close.Builder()
                .replyCode(AMQP.INTERNAL_ERROR)
                .replyText("INTERNAL_ERROR")
                .build();
        doThrow(new AlreadyClosedException(new ShutdownSignalException(true, false, close, null)))
                .when(connection).createChannel();

        try {
            brokerConnection.createChannel();
            fail("expected channel creation on a closing connection to fail");
        } catch (ChannelClosedException e) {
            assertThat(e.getReplyCode(), is(AMQP.INTERNAL_ERROR));
            assertThat(e.getCause(), instanceOf(AlreadyClosedException.class));
        }
    }
}
