package com.meltwater.amq.example;

import com.meltwater.amq.Backend;
import com.meltwater.amq.BackendSettings;
import com.meltwater.amq.BrokerConnection;
import com.meltwater.amq.ConnectionInfo;
import com.meltwater.amq.ConsumeLoop;
import com.meltwater.amq.ConsumerRegistration;
import com.meltwater.amq.DeliveryMode;
import com.meltwater.amq.Message;
import com.meltwater.amq.OutgoingMessage;
import com.meltwater.amq.util.Logger;
import com.rabbitmq.client.Delivery;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * An example app which moves every message from an input queue to an output exchange, keeping its routing key
 * and content metadata.
 */
public class ExampleAppShovel {

    private static final Logger log = new Logger(ExampleAppShovel.class);

    public static void main(String[] args) throws Exception {
        Properties prop = new Properties();
        prop.load(ExampleAppShovel.class.getResourceAsStream("/example_app_shovel.properties"));
        prop.putAll(System.getProperties());

        final BrokerConnection connection = new BrokerConnection(
                new ConnectionInfo.Builder().withUriString(prop.getProperty("amq.broker.uri")).build(),
                new BackendSettings.Builder(prop.getProperty("amq.settings", "")).build());

        final ExampleAppShovel shovel = new ExampleAppShovel(
                connection.createBackend(),
                prop.getProperty("amq.input.queue"),
                prop.getProperty("amq.output.exchange"));

        //On shutdown stop the loop and close the connection, which also ends a wait in progress
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.infoWithParams("Closing app ...");
            shovel.stop();
            connection.close();
        }));

        String limit = prop.getProperty("shovel.limit", "").trim();
        long shoveled = shovel.run(limit.isEmpty() ? null : Integer.valueOf(limit));
        log.infoWithParams("Shovel finished.", "shoveled", shoveled);
        connection.close();
    }

    private final Backend backend;
    private final String inputQueue;
    private final String outputExchange;

    private volatile boolean stopped;
    private long shoveled;

    public ExampleAppShovel(Backend backend, String inputQueue, String outputExchange) {
        this.backend = backend;
        this.inputQueue = inputQueue;
        this.outputExchange = outputExchange;
    }

    /**
     * Consumes the input queue until the limit is reached or {@link #stop()} is called.
     *
     * @param limit the maximum number of waits, null to run until stopped
     * @return the number of messages shoveled
     */
    public long run(Integer limit) throws IOException {
        ConsumerRegistration registration = backend.declareConsume(inputQueue, false, this::handleDelivery, "");
        log.infoWithParams("Shoveling messages.",
                "inputQueue", inputQueue,
                "outputExchange", outputExchange,
                "consumerTag", registration.consumerTag,
                "limit", limit);
        ConsumeLoop loop = backend.consume(limit);
        try {
            for (Long waits : loop) {
                if (stopped) {
                    break;
                }
            }
        } catch (UncheckedIOException e) {
            if (!stopped) {
                throw e.getCause();
            }
            log.infoWithParams("Wait interrupted by shutdown.", "error", e.getCause().getMessage());
        } finally {
            try {
                backend.cancel(registration.consumerTag);
            } finally {
                backend.close();
            }
        }
        return shoveled;
    }

    public void stop() {
        stopped = true;
    }

    private void handleDelivery(String consumerTag, Delivery delivery) throws IOException {
        Message message = backend.toMessage(consumerTag, delivery);
        //change in logback.xml to DEBUG level to see every message logged
        log.debugWithParams("Received message.",
                "body", message.getBody(),
                "deliveryInfo", message.getDeliveryInfo());
        try {
            backend.publish(copyOf(message), outputExchange, message.getDeliveryInfo().routingKey, false, false);
        } catch (IOException e) {
            log.warnWithParams("Could not republish message, rejecting it.", e,
                    "routingKey", message.getDeliveryInfo().routingKey);
            message.reject();
            return;
        }
        message.ack();
        shoveled++;
    }

    private OutgoingMessage copyOf(Message message) {
        return backend.prepareMessage(
                message.getBody(),
                deliveryModeOf(message),
                message.getProperties().getPriority(),
                message.getContentType().orElse(null),
                message.getContentEncoding().orElse(null));
    }

    /**
     * @return the delivery mode of the message, or null when it is missing or not a standard AMQP code
     */
    private static DeliveryMode deliveryModeOf(Message message) {
        Integer code = message.getProperties().getDeliveryMode();
        if (code == null) {
            return null;
        }
        for (DeliveryMode mode : DeliveryMode.values()) {
            if (mode.code == code) {
                return mode;
            }
        }
        log.debugWithParams("Dropping non-standard delivery mode.", "deliveryMode", code);
        return null;
    }
}
