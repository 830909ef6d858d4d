package com.meltwater.amq;

import com.rabbitmq.client.AMQP;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

public class MessageTest {

    @Test
    public void missing_metadata_results_in_empty_values() {
        Message message = new Message("x".getBytes(StandardCharsets.UTF_8), null, null, null, null);

        assertThat(message.getContentType(), is(Optional.<String>empty()));
        assertThat(message.getContentEncoding(), is(Optional.<String>empty()));
        assertThat(message.getDeliveryInfo().exchange, equalTo(""));
        assertThat(message.getDeliveryInfo().routingKey, equalTo(""));
        assertThat(message.getDeliveryInfo().redelivered, is(false));
        assertThat(message.getProperties().getHeaders(), nullValue());
    }

    @Test
    public void body_is_decoded_with_the_content_encoding() {
        byte[] latin1 = "smörgås".getBytes(StandardCharsets.ISO_8859_1);
        Message message = new Message(latin1, properties("text/plain", "ISO-8859-1"), null, null, null);

        assertThat(message.bodyAsString(), equalTo("smörgås"));
    }

    @Test
    public void non_charset_encoding_falls_back_to_utf8() {
        Message message = new Message("smörgås".getBytes(StandardCharsets.UTF_8), properties("text/plain", "gzip"), null, null, null);

        assertThat(message.bodyAsString(), equalTo("smörgås"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void json_body_is_decoded() throws Exception {
        byte[] body = "{\"id\":7,\"name\":\"job\"}".getBytes(StandardCharsets.UTF_8);
        Message message = new Message(body, properties("application/json; charset=utf-8", null), null, null, null);

        Map<String, Object> decoded = message.decode(Map.class);

        assertThat(decoded.get("id"), equalTo(7));
        assertThat(decoded.get("name"), equalTo("job"));
    }

    @Test(expected = IllegalStateException.class)
    public void only_json_can_be_decoded() throws Exception {
        new Message("<a/>".getBytes(StandardCharsets.UTF_8), properties("text/xml", null), null, null, null).decode(Map.class);
    }

    @Test
    public void body_can_not_be_modified_through_the_message() {
        byte[] body = {1, 2, 3};
        Message message = new Message(body, null, null, null, null);

        body[0] = 9;
        message.getBody()[1] = 9;

        assertThat(message.getBody(), equalTo(new byte[]{1, 2, 3}));
    }

    @Test
    public void settling_goes_through_the_acknowledger() throws Exception {
        Acknowledger acknowledger = mock(Acknowledger.class);
        Message message = new Message(new byte[0], null, DeliveryInfo.EMPTY, new DeliveryTag(1, 42), acknowledger);

        message.ack();
        message.requeue();
        message.reject();

        verify(acknowledger).ack();
        verify(acknowledger).requeue();
        verify(acknowledger).reject();
    }

    @Test(expected = IllegalStateException.class)
    public void message_without_acknowledger_can_not_be_settled() throws Exception {
        new Message(new byte[0], null, null, null, null).requeue();
    }

    @Test
    public void delivery_info_map_only_holds_reported_fields() {
        DeliveryInfo fetched = new DeliveryInfo("ex", "key", true, null, 3);
        DeliveryInfo consumed = new DeliveryInfo("ex", "key", false, "ctag", null);

        assertThat(fetched.asMap().get("message_count"), equalTo(3));
        assertThat(fetched.asMap().containsKey("consumer_tag"), is(false));
        assertThat(consumed.asMap().get("consumer_tag"), equalTo("ctag"));
        assertThat(consumed.asMap().containsKey("message_count"), is(false));
    }

    private static AMQP.BasicProperties properties(String contentType, String contentEncoding) {
        return new AMQP.BasicProperties.Builder()
                .contentType(contentType)
                .contentEncoding(contentEncoding)
                .build();
    }
}
