package com.meltwater.amq;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.GetResponse;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * A message queue backend bound to one channel.
 *
 * The channel is opened on first use and is owned exclusively by this backend. Once closed, by {@link #close()} or
 * by the broker, it is never re-opened and every operation except {@link #close()} and {@link #cancel(String)} fails
 * with {@link ChannelClosedException}.
 *
 * A backend is not thread safe. Use one backend per thread that needs to talk to the broker.
 *
 * @see BrokerConnection#createBackend()
 */
public interface Backend extends Closeable {

    /**
     * @return the connection of the owning {@link BrokerConnection}, established if needed
     */
    Connection establishConnection() throws IOException;

    /**
     * Closes the given connection. Does nothing if it is already closed.
     */
    void closeConnection(Connection connection);

    /**
     * Returns the channel of this backend, opening it on first use.
     *
     * @throws ChannelClosedException if the channel has been closed
     */
    Channel ensureChannel() throws IOException;

    /**
     * Checks if a queue exists with a passive declare.
     *
     * @return false if the broker answered NOT_FOUND
     * @throws ProtocolException for any other channel error, for example when the queue is exclusively owned by
     * another connection
     */
    boolean queueExists(String queue) throws IOException;

    /**
     * Declares a queue.
     *
     * @param queue the queue name, or the empty string for a server named queue
     * @param warnIfExists check for the queue first and emit a {@link Advisory.Type#QUEUE_ALREADY_EXISTS} advisory if it exists
     * @return the declared queue, carrying the server generated name where applicable
     */
    DeclaredQueue queueDeclare(String queue, boolean durable, boolean exclusive, boolean autoDelete, boolean warnIfExists) throws IOException;

    /**
     * Declares an exchange.
     *
     * @param type the exchange type, for example "direct", "topic" or "fanout"
     */
    void exchangeDeclare(String exchange, String type, boolean durable, boolean autoDelete) throws IOException;

    /**
     * Binds a queue to an exchange. A queue can be bound with several routing keys.
     */
    void queueBind(String queue, String exchange, String routingKey) throws IOException;

    /**
     * Discards all messages waiting in the queue. Messages delivered but not yet settled are not affected.
     *
     * @return the number of messages purged
     */
    int queuePurge(String queue) throws IOException;

    /**
     * Wraps data into a message that can be published.
     *
     * @param priority may be null
     * @param contentType may be null
     * @param contentEncoding may be null
     */
    OutgoingMessage prepareMessage(byte[] body, DeliveryMode deliveryMode, Integer priority, String contentType, String contentEncoding);

    /**
     * Publishes a message.
     *
     * When publisher confirms are enabled the call returns once the broker confirmed the message and fails with
     * {@link ProtocolException} if the broker nacked it, or with {@link UnroutableMessageException} if a
     * {@code mandatory} message was returned.
     *
     * @param mandatory ask the broker to return the message if it can not be routed to a queue
     * @param immediate AMQP 0-8 routing hint, RabbitMQ 3.0 and later close the connection when it is set
     */
    void publish(OutgoingMessage message, String exchange, String routingKey, boolean mandatory, boolean immediate) throws IOException;

    /**
     * Fetches one message without waiting.
     *
     * @param noAck true if the broker should consider the message settled once it is delivered
     * @return the message, or empty if the queue had no messages
     */
    Optional<Message> get(String queue, boolean noAck) throws IOException;

    /**
     * Same as {@link #declareConsumer(String, boolean, DeliveryListener, String, boolean)} with noWait false.
     */
    ConsumerRegistration declareConsume(String queue, boolean noAck, DeliveryListener callback, String consumerTag) throws IOException;

    /**
     * Registers a consumer. Deliveries are dispatched to {@code callback} while a {@link ConsumeLoop} is driven.
     *
     * @param consumerTag the tag, or the empty string to let the broker generate one
     * @param noWait the RabbitMQ Java client always waits for consume-ok, so this flag is recorded on the
     * registration only
     * @return the registration, carrying the broker generated tag where applicable
     * @throws ProtocolException if a consumer with the same tag is already registered on this channel
     */
    ConsumerRegistration declareConsumer(String queue, boolean noAck, DeliveryListener callback, String consumerTag, boolean noWait) throws IOException;

    /**
     * Returns a loop that waits for deliveries and dispatches them to the registered consumers.
     *
     * @param limit the maximum number of waits, null for no limit
     * @see ConsumeLoop
     */
    ConsumeLoop consume(Integer limit);

    /**
     * Performs one blocking wait for a channel event and dispatches it.
     */
    void waitForEvent() throws IOException;

    /**
     * Cancels a consumer by tag. Does nothing if the channel was never opened or is closed, or if no consumer with
     * that tag is registered (already cancelled by the caller or by the broker).
     */
    void cancel(String consumerTag) throws IOException;

    /**
     * Acknowledges a message.
     *
     * @throws ProtocolException if the tag is unknown to this channel or was already settled
     */
    void ack(DeliveryTag deliveryTag) throws IOException;

    /**
     * Rejects a message without requeueing it.
     *
     * @throws ProtocolException if the tag is unknown to this channel or was already settled
     */
    void reject(DeliveryTag deliveryTag) throws IOException;

    /**
     * Rejects a message and asks the broker to requeue it.
     *
     * @throws ProtocolException if the tag is unknown to this channel or was already settled
     */
    void requeue(DeliveryTag deliveryTag) throws IOException;

    /**
     * Converts the result of a basic.get into a {@link Message}. Missing metadata results in empty values.
     */
    Message toMessage(GetResponse raw);

    /**
     * Converts a consumer delivery into a {@link Message}. Missing metadata results in empty values.
     */
    Message toMessage(String consumerTag, Delivery raw);

    /**
     * @return true once the channel of this backend has been closed
     */
    boolean isClosed();

    /**
     * Closes the channel, if it was opened. Does nothing if already closed.
     */
    @Override
    void close();
}
