package com.meltwater.amq.impl;

import com.google.common.base.Preconditions;
import com.meltwater.amq.Acknowledger;
import com.meltwater.amq.Advisory;
import com.meltwater.amq.AdvisoryListener;
import com.meltwater.amq.Backend;
import com.meltwater.amq.BackendSettings;
import com.meltwater.amq.BrokerConnection;
import com.meltwater.amq.ChannelClosedException;
import com.meltwater.amq.ConsumeLoop;
import com.meltwater.amq.ConsumeTimeoutException;
import com.meltwater.amq.ConsumerRegistration;
import com.meltwater.amq.DeclaredQueue;
import com.meltwater.amq.DeliveryInfo;
import com.meltwater.amq.DeliveryListener;
import com.meltwater.amq.DeliveryMode;
import com.meltwater.amq.DeliveryTag;
import com.meltwater.amq.Message;
import com.meltwater.amq.OutgoingMessage;
import com.meltwater.amq.ProtocolException;
import com.meltwater.amq.UnroutableMessageException;
import com.meltwater.amq.util.Logger;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.GetResponse;
import com.rabbitmq.client.ShutdownSignalException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link Backend} on top of the RabbitMQ Java client.
 *
 * Deliveries for registered consumers arrive on the client's dispatch thread and are queued; they are handed to
 * the consumer callbacks by {@link #waitForEvent()} on the calling thread. Delivery tags issued by this backend
 * are tracked until they are settled so that settling an unknown or already settled tag fails immediately
 * instead of closing the channel with a PRECONDITION_FAILED later on.
 */
public class AmqpClientBackend implements Backend {

    private static final Logger log = new Logger(AmqpClientBackend.class);

    private static final AtomicLong channelIds = new AtomicLong();

    private final BrokerConnection brokerConnection;
    private final BackendSettings settings;
    private final AdvisoryListener advisoryListener;

    private final BlockingQueue<ChannelEvent> events = new LinkedBlockingQueue<>();
    private final ConcurrentLinkedQueue<ReturnedMessage> returns = new ConcurrentLinkedQueue<>();
    private final Map<String, ConsumerRegistration> consumers = new HashMap<>();
    private final Set<Long> unsettled = new HashSet<>();

    private Channel channel;
    private long channelId = -1;
    private boolean closed;

    public AmqpClientBackend(BrokerConnection brokerConnection, AdvisoryListener advisoryListener) {
        Preconditions.checkNotNull(brokerConnection, "brokerConnection");
        Preconditions.checkNotNull(advisoryListener, "advisoryListener");
        this.brokerConnection = brokerConnection;
        this.settings = brokerConnection.getSettings();
        this.advisoryListener = advisoryListener;
    }

    @Override
    public Connection establishConnection() throws IOException {
        return brokerConnection.establishConnection();
    }

    @Override
    public void closeConnection(Connection connection) {
        if (connection == null || !connection.isOpen()) {
            return;
        }
        try {
            connection.close();
        } catch (IOException | ShutdownSignalException e) {
            log.warnWithParams("Unexpected error when closing connection.", e,
                    "isOpen", connection.isOpen());
        }
    }

    @Override
    public Channel ensureChannel() throws IOException {
        if (closed) {
            throw new ChannelClosedException("Channel " + channelId + " has been closed");
        }
        if (channel != null) {
            if (!channel.isOpen()) {
                ShutdownSignalException reason = channel.getCloseReason();
                markClosed();
                throw closedError("ensureChannel", reason);
            }
            return channel;
        }
        Channel newChannel = brokerConnection.createChannel();
        newChannel.addShutdownListener(signal -> events.add(ChannelEvent.shutdown(signal)));
        newChannel.addReturnListener((replyCode, replyText, exchange, routingKey, properties, body) ->
                onReturn(new ReturnedMessage(replyCode, replyText, exchange, routingKey)));
        if (settings.publisher_confirms) {
            newChannel.confirmSelect();
        }
        channel = newChannel;
        channelId = channelIds.incrementAndGet();
        log.infoWithParams("Successfully created channel.",
                "channelId", channelId,
                "channelNr", newChannel.getChannelNumber(),
                "address", brokerConnection.getConnectionInfo(),
                "publisherConfirms", settings.publisher_confirms);
        return channel;
    }

    @Override
    public boolean queueExists(String queue) throws IOException {
        Preconditions.checkNotNull(queue, "queue");
        requireNotClosed();
        // the broker closes a channel that fails a passive declare, so check on a throw-away channel
        Channel check = brokerConnection.createChannel();
        try {
            check.queueDeclarePassive(queue);
            return true;
        } catch (IOException e) {
            ShutdownSignalException signal = shutdownCause(e);
            if (signal == null) {
                throw e;
            }
            int replyCode = ProtocolException.replyCodeOf(signal);
            if (replyCode == AMQP.NOT_FOUND) {
                return false;
            }
            throw new ProtocolException(replyCode, "Passive declare of queue '" + queue + "' failed: " + signal.getMessage(), e);
        } finally {
            closeCheckChannel(check);
        }
    }

    @Override
    public DeclaredQueue queueDeclare(String queue, boolean durable, boolean exclusive, boolean autoDelete, boolean warnIfExists) throws IOException {
        Preconditions.checkNotNull(queue, "queue");
        if (warnIfExists && !queue.isEmpty() && queueExists(queue)) {
            advisoryListener.onAdvisory(Advisory.queueAlreadyExists(queue));
        }
        AMQP.Queue.DeclareOk ok = call("queue.declare", ch -> ch.queueDeclare(queue, durable, exclusive, autoDelete, null));
        log.debugWithParams("Declared queue.",
                "queue", ok.getQueue(),
                "durable", durable,
                "exclusive", exclusive,
                "autoDelete", autoDelete);
        return new DeclaredQueue(ok.getQueue(), ok.getMessageCount(), ok.getConsumerCount());
    }

    @Override
    public void exchangeDeclare(String exchange, String type, boolean durable, boolean autoDelete) throws IOException {
        Preconditions.checkNotNull(exchange, "exchange");
        Preconditions.checkNotNull(type, "type");
        call("exchange.declare", ch -> ch.exchangeDeclare(exchange, type, durable, autoDelete, null));
        log.debugWithParams("Declared exchange.",
                "exchange", exchange,
                "type", type,
                "durable", durable,
                "autoDelete", autoDelete);
    }

    @Override
    public void queueBind(String queue, String exchange, String routingKey) throws IOException {
        Preconditions.checkNotNull(queue, "queue");
        Preconditions.checkNotNull(exchange, "exchange");
        call("queue.bind", ch -> ch.queueBind(queue, exchange, routingKey == null ? "" : routingKey));
    }

    @Override
    public int queuePurge(String queue) throws IOException {
        Preconditions.checkNotNull(queue, "queue");
        AMQP.Queue.PurgeOk ok = call("queue.purge", ch -> ch.queuePurge(queue));
        log.infoWithParams("Purged queue.",
                "queue", queue,
                "purged", ok.getMessageCount());
        return ok.getMessageCount();
    }

    @Override
    public OutgoingMessage prepareMessage(byte[] body, DeliveryMode deliveryMode, Integer priority, String contentType, String contentEncoding) {
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .deliveryMode(deliveryMode == null ? null : deliveryMode.code)
                .priority(priority)
                .contentType(contentType)
                .contentEncoding(contentEncoding)
                .build();
        return new OutgoingMessage(body, properties);
    }

    @Override
    public void publish(OutgoingMessage message, String exchange, String routingKey, boolean mandatory, boolean immediate) throws IOException {
        Preconditions.checkNotNull(message, "message");
        Preconditions.checkNotNull(exchange, "exchange");
        String key = routingKey == null ? "" : routingKey;
        Channel ch = ensureChannel();
        returns.clear();
        call("basic.publish", c -> {
            c.basicPublish(exchange, key, mandatory, immediate, message.properties, message.body);
            return null;
        });
        if (!settings.publisher_confirms) {
            return;
        }
        boolean acked;
        try {
            acked = ch.waitForConfirms(settings.publish_timeout_millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for publish confirm");
        } catch (TimeoutException e) {
            throw new ProtocolException(ProtocolException.UNKNOWN_REPLY_CODE,
                    "No publish confirm within " + settings.publish_timeout_millis + " ms [exchange=" + exchange + ", routingKey=" + key + "]", e);
        } catch (ShutdownSignalException e) {
            markClosed();
            throw closedError("basic.publish", e);
        }
        if (!acked) {
            throw new ProtocolException(ProtocolException.UNKNOWN_REPLY_CODE,
                    "Broker nacked message [exchange=" + exchange + ", routingKey=" + key + "]");
        }
        ReturnedMessage returned = returns.poll();
        if (mandatory && returned != null) {
            throw new UnroutableMessageException(returned.replyCode, returned.replyText, returned.exchange, returned.routingKey);
        }
        log.debugWithParams("Published message.",
                "exchange", exchange,
                "routingKey", key,
                "mandatory", mandatory);
    }

    @Override
    public Optional<Message> get(String queue, boolean noAck) throws IOException {
        Preconditions.checkNotNull(queue, "queue");
        GetResponse response = call("basic.get", ch -> ch.basicGet(queue, noAck));
        if (response == null) {
            return Optional.empty();
        }
        Message message = toMessage(response);
        if (!noAck && message.getDeliveryTag() != null) {
            unsettled.add(message.getDeliveryTag().getValue());
        }
        return Optional.of(message);
    }

    @Override
    public ConsumerRegistration declareConsume(String queue, boolean noAck, DeliveryListener callback, String consumerTag) throws IOException {
        return declareConsumer(queue, noAck, callback, consumerTag, false);
    }

    @Override
    public ConsumerRegistration declareConsumer(String queue, boolean noAck, DeliveryListener callback, String consumerTag, boolean noWait) throws IOException {
        Preconditions.checkNotNull(queue, "queue");
        Preconditions.checkNotNull(callback, "callback");
        String tag = consumerTag == null ? "" : consumerTag;
        Channel ch = ensureChannel();
        if (consumers.containsKey(tag)) {
            throw new ProtocolException(AMQP.NOT_ALLOWED, "Consumer tag '" + tag + "' is already in use on channel " + channelId);
        }
        DispatchingConsumer consumer = new DispatchingConsumer(ch, events, noAck);
        ConsumerRegistration requested = new ConsumerRegistration(queue, noAck, callback, tag, noWait);
        String brokerTag = call("basic.consume", c -> c.basicConsume(queue, noAck, tag, consumer));
        ConsumerRegistration registration = requested.withConsumerTag(brokerTag);
        consumers.put(brokerTag, registration);
        log.infoWithParams("Registered consumer.",
                "queue", queue,
                "consumerTag", brokerTag,
                "noAck", noAck,
                "channelId", channelId);
        return registration;
    }

    @Override
    public ConsumeLoop consume(Integer limit) {
        return new ConsumeLoop(limit, this::waitForEvent);
    }

    @Override
    public void waitForEvent() throws IOException {
        ensureChannel();
        ChannelEvent event;
        try {
            if (settings.wait_timeout_millis > 0) {
                event = events.poll(settings.wait_timeout_millis, TimeUnit.MILLISECONDS);
            } else {
                event = events.take();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for broker events");
        }
        if (event == null) {
            throw new ConsumeTimeoutException(settings.wait_timeout_millis);
        }
        dispatch(event);
    }

    private void dispatch(ChannelEvent event) throws IOException {
        switch (event.kind) {
            case DELIVERY:
                dispatchDelivery(event);
                break;
            case CANCELLED_BY_BROKER:
                consumers.remove(event.consumerTag);
                log.warnWithParams("Consumer was cancelled by the broker.",
                        "consumerTag", event.consumerTag,
                        "channelId", channelId);
                break;
            case SHUTDOWN:
                markClosed();
                throw closedError("wait", event.signal);
        }
    }

    private void dispatchDelivery(ChannelEvent event) throws IOException {
        ConsumerRegistration registration = consumers.get(event.consumerTag);
        Envelope envelope = event.delivery.getEnvelope();
        if (registration == null) {
            log.debugWithParams("Dropping delivery for cancelled consumer.",
                    "consumerTag", event.consumerTag,
                    "deliveryTag", envelope.getDeliveryTag());
            if (!event.noAck) {
                call("basic.reject", ch -> {
                    ch.basicReject(envelope.getDeliveryTag(), true);
                    return null;
                });
            }
            return;
        }
        if (!registration.noAck) {
            unsettled.add(envelope.getDeliveryTag());
        }
        registration.callback.onDelivery(event.consumerTag, event.delivery);
    }

    @Override
    public void cancel(String consumerTag) throws IOException {
        Preconditions.checkNotNull(consumerTag, "consumerTag");
        if (closed || channel == null) {
            return;
        }
        if (!channel.isOpen()) {
            markClosed();
            return;
        }
        if (consumers.remove(consumerTag) == null) {
            log.debugWithParams("Ignoring cancel of unknown consumer, it was already cancelled or never registered.",
                    "consumerTag", consumerTag,
                    "channelId", channelId);
            return;
        }
        call("basic.cancel", ch -> {
            ch.basicCancel(consumerTag);
            return null;
        });
        log.infoWithParams("Cancelled consumer.",
                "consumerTag", consumerTag,
                "channelId", channelId);
    }

    @Override
    public void ack(DeliveryTag deliveryTag) throws IOException {
        settle(deliveryTag, "basic.ack");
        call("basic.ack", ch -> {
            ch.basicAck(deliveryTag.getValue(), false);
            return null;
        });
    }

    @Override
    public void reject(DeliveryTag deliveryTag) throws IOException {
        settle(deliveryTag, "basic.reject");
        call("basic.reject", ch -> {
            ch.basicReject(deliveryTag.getValue(), false);
            return null;
        });
    }

    @Override
    public void requeue(DeliveryTag deliveryTag) throws IOException {
        settle(deliveryTag, "basic.reject");
        call("basic.reject", ch -> {
            ch.basicReject(deliveryTag.getValue(), true);
            return null;
        });
    }

    private void settle(DeliveryTag deliveryTag, String operation) throws IOException {
        Preconditions.checkNotNull(deliveryTag, "deliveryTag");
        requireNotClosed();
        if (channel == null || deliveryTag.getChannelId() != channelId) {
            throw new ProtocolException(AMQP.PRECONDITION_FAILED,
                    operation + ": delivery tag " + deliveryTag + " was not issued by channel " + channelId);
        }
        if (!unsettled.remove(deliveryTag.getValue())) {
            throw new ProtocolException(AMQP.PRECONDITION_FAILED,
                    operation + ": unknown delivery tag " + deliveryTag.getValue() + " (already settled or delivered with no_ack)");
        }
    }

    @Override
    public Message toMessage(GetResponse raw) {
        if (raw == null) {
            return new Message(null, null, null, null, null);
        }
        Envelope envelope = raw.getEnvelope();
        DeliveryInfo info = envelope == null
                ? new DeliveryInfo("", "", false, null, raw.getMessageCount())
                : new DeliveryInfo(envelope.getExchange(), envelope.getRoutingKey(), envelope.isRedeliver(), null, raw.getMessageCount());
        return newMessage(raw.getBody(), raw.getProps(), info, envelope);
    }

    @Override
    public Message toMessage(String consumerTag, Delivery raw) {
        if (raw == null) {
            return new Message(null, null, null, null, null);
        }
        Envelope envelope = raw.getEnvelope();
        DeliveryInfo info = envelope == null
                ? new DeliveryInfo("", "", false, consumerTag, null)
                : new DeliveryInfo(envelope.getExchange(), envelope.getRoutingKey(), envelope.isRedeliver(), consumerTag, null);
        return newMessage(raw.getBody(), raw.getProperties(), info, envelope);
    }

    private Message newMessage(byte[] body, AMQP.BasicProperties properties, DeliveryInfo info, Envelope envelope) {
        if (envelope == null) {
            return new Message(body, properties, info, null, null);
        }
        DeliveryTag tag = new DeliveryTag(channelId, envelope.getDeliveryTag());
        return new Message(body, properties, info, tag, new BoundAcknowledger(tag));
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        markClosed();
        if (channel == null) {
            return;
        }
        final boolean channelIsOpen = channel.isOpen();
        if (channelIsOpen) {
            try {
                channel.close();
            } catch (IOException | TimeoutException | ShutdownSignalException e) {
                log.warnWithParams("Unexpected error when closing channel.", e,
                        "wasOpen", channelIsOpen,
                        "isOpen", channel.isOpen());
            }
        }
        log.infoWithParams("Closed and disposed channel.",
                "channelId", channelId,
                "channelNr", channel.getChannelNumber(),
                "wasOpen", channelIsOpen);
    }

    private void markClosed() {
        closed = true;
        consumers.clear();
        unsettled.clear();
        events.clear();
    }

    private void requireNotClosed() throws IOException {
        if (closed) {
            throw new ChannelClosedException("Channel " + channelId + " has been closed");
        }
        if (channel != null && !channel.isOpen()) {
            ShutdownSignalException reason = channel.getCloseReason();
            markClosed();
            throw closedError("channel", reason);
        }
    }

    private void onReturn(ReturnedMessage returned) {
        if (settings.publisher_confirms) {
            returns.add(returned);
        } else {
            advisoryListener.onAdvisory(Advisory.messageReturned(returned.exchange, returned.routingKey, returned.replyCode, returned.replyText));
        }
    }

    private interface ChannelCall<T> {
        T call(Channel channel) throws IOException;
    }

    private <T> T call(String operation, ChannelCall<T> call) throws IOException {
        Channel ch = ensureChannel();
        try {
            return call.call(ch);
        } catch (ShutdownSignalException e) {
            markClosed();
            throw closedError(operation, e);
        } catch (ProtocolException e) {
            throw e;
        } catch (IOException e) {
            ShutdownSignalException signal = shutdownCause(e);
            if (signal == null) {
                throw e;
            }
            if (!ch.isOpen()) {
                markClosed();
            }
            throw new ProtocolException(ProtocolException.replyCodeOf(signal), operation + " failed: " + signal.getMessage(), e);
        }
    }

    private ChannelClosedException closedError(String operation, ShutdownSignalException signal) {
        if (signal == null) {
            return new ChannelClosedException(operation + ": channel " + channelId + " is closed");
        }
        return new ChannelClosedException(ProtocolException.replyCodeOf(signal),
                operation + ": channel " + channelId + " was closed: " + signal.getMessage(), signal);
    }

    private static ShutdownSignalException shutdownCause(IOException e) {
        return e.getCause() instanceof ShutdownSignalException ? (ShutdownSignalException) e.getCause() : null;
    }

    private static void closeCheckChannel(Channel check) {
        if (!check.isOpen()) {
            return;
        }
        try {
            check.close();
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
            log.debugWithParams("Could not close existence check channel.", e,
                    "channelNr", check.getChannelNumber());
        }
    }

    private class BoundAcknowledger implements Acknowledger {
        private final DeliveryTag tag;

        BoundAcknowledger(DeliveryTag tag) {
            this.tag = tag;
        }

        @Override
        public void ack() throws IOException {
            AmqpClientBackend.this.ack(tag);
        }

        @Override
        public void reject() throws IOException {
            AmqpClientBackend.this.reject(tag);
        }

        @Override
        public void requeue() throws IOException {
            AmqpClientBackend.this.requeue(tag);
        }
    }

    private static class ReturnedMessage {
        final int replyCode;
        final String replyText;
        final String exchange;
        final String routingKey;

        ReturnedMessage(int replyCode, String replyText, String exchange, String routingKey) {
            this.replyCode = replyCode;
            this.replyText = replyText;
            this.exchange = exchange;
            this.routingKey = routingKey;
        }
    }
}
