package com.meltwater.amq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.AMQP;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Arrays;
import java.util.Optional;

/**
 * An immutable view of a message received from the broker.
 *
 * The message also holds an {@link Acknowledger} bound to the channel it was received on.
 *
 * NOTE:
 * Unless the message was received with auto ack (no_ack) the consuming code is expected to settle it with
 * {@link #ack()}, {@link #reject()} or {@link #requeue()}. The broker stops delivering once the prefetch window
 * is full of unsettled messages.
 */
public class Message {

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final String JSON_CONTENT_TYPE = "application/json";

    private final byte[] body;
    private final String contentType;
    private final String contentEncoding;
    private final DeliveryInfo deliveryInfo;
    private final AMQP.BasicProperties properties;
    private final DeliveryTag deliveryTag;
    private final Acknowledger acknowledger;

    public Message(byte[] body,
                   AMQP.BasicProperties properties,
                   DeliveryInfo deliveryInfo,
                   DeliveryTag deliveryTag,
                   Acknowledger acknowledger) {
        this.body = body == null ? new byte[0] : body.clone();
        this.properties = properties == null ? new AMQP.BasicProperties() : properties;
        this.contentType = this.properties.getContentType();
        this.contentEncoding = this.properties.getContentEncoding();
        this.deliveryInfo = deliveryInfo == null ? DeliveryInfo.EMPTY : deliveryInfo;
        this.deliveryTag = deliveryTag;
        this.acknowledger = acknowledger;
    }

    public byte[] getBody() {
        return body.clone();
    }

    public Optional<String> getContentType() {
        return Optional.ofNullable(contentType);
    }

    public Optional<String> getContentEncoding() {
        return Optional.ofNullable(contentEncoding);
    }

    public DeliveryInfo getDeliveryInfo() {
        return deliveryInfo;
    }

    /**
     * @return all message properties, such as headers, priority, delivery mode or message id
     */
    public AMQP.BasicProperties getProperties() {
        return properties;
    }

    public DeliveryTag getDeliveryTag() {
        return deliveryTag;
    }

    public void ack() throws IOException {
        acknowledger().ack();
    }

    public void reject() throws IOException {
        acknowledger().reject();
    }

    public void requeue() throws IOException {
        acknowledger().requeue();
    }

    private Acknowledger acknowledger() {
        if (acknowledger == null) {
            throw new IllegalStateException("Message has no delivery tag and can not be settled");
        }
        return acknowledger;
    }

    /**
     * Decodes the body using the content encoding as charset. Falls back to UTF-8 when the encoding is
     * missing or not a charset name (for example 'gzip').
     */
    public String bodyAsString() {
        return new String(body, charset());
    }

    /**
     * Deserializes a JSON body.
     *
     * @throws IllegalStateException if the content type is not application/json
     * @throws IOException if the body is not valid JSON for the given type
     */
    public <T> T decode(Class<T> type) throws IOException {
        String mimeType = contentType == null ? "" : contentType.split(";")[0].trim();
        if (!JSON_CONTENT_TYPE.equalsIgnoreCase(mimeType)) {
            throw new IllegalStateException("Can not decode content type '" + contentType + "' as JSON");
        }
        return mapper.readValue(bodyAsString(), type);
    }

    private Charset charset() {
        if (contentEncoding == null || contentEncoding.isEmpty()) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(contentEncoding);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            return StandardCharsets.UTF_8;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Message message = (Message) o;
        return properties.equals(message.properties)
                && deliveryInfo.asMap().equals(message.deliveryInfo.asMap())
                && Arrays.equals(body, message.body)
                && (deliveryTag == null ? message.deliveryTag == null : deliveryTag.equals(message.deliveryTag));
    }

    @Override
    public int hashCode() {
        int result = properties.hashCode();
        result = 31 * result + deliveryInfo.asMap().hashCode();
        result = 31 * result + Arrays.hashCode(body);
        return result;
    }

    @Override
    public String toString() {
        return "{deliveryTag=" + deliveryTag +
                ", contentType=" + contentType +
                ", contentEncoding=" + contentEncoding +
                ", deliveryInfo=" + deliveryInfo +
                ", bodySize=" + body.length +
                '}';
    }
}
