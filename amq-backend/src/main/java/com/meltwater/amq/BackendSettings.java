package com.meltwater.amq;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meltwater.amq.util.Logger;
import com.rabbitmq.client.ConnectionFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Settings used by {@link BrokerConnection} and {@link Backend} that are not part of {@link ConnectionInfo}.
 *
 * This object can be built programmatically with the {@link BackendSettings.Builder} withXX methods or from a
 * JSON formatted String passed to {@link BackendSettings.Builder#Builder(String)}.
 * The JSON parameter names are available as String constants and correspond to the field names of this class.
 *
 * {@link #toString()} renders the JSON representation, which is accepted by the JSON builder.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.PUBLIC_ONLY)
public class BackendSettings {

    private final static Logger log = new Logger(BackendSettings.class);
    private final static ObjectMapper mapper = new ObjectMapper()
            .configure(JsonParser.Feature.ALLOW_UNQUOTED_FIELD_NAMES, true)
            .configure(JsonParser.Feature.STRICT_DUPLICATE_DETECTION, true);

    public static final int DEFAULT_HEARTBEAT               = 10;
    public static final int DEFAULT_PUBLISH_TIMEOUT_MILLIS  = 20_000;
    public static final int DEFAULT_WAIT_TIMEOUT_MILLIS     = 0; //wait forever
    public static final boolean DEFAULT_PUBLISHER_CONFIRMS  = false;
    public static final String DEFAULT_APP_ID               = "unknown";

    public final static String heartbeat_param                 = "heartbeat";
    public final static String handshake_timeout_millis_param  = "handshake_timeout_millis";
    public final static String shutdown_timeout_millis_param   = "shutdown_timeout_millis";
    public final static String frame_max_param                 = "frame_max";
    public final static String publisher_confirms_param        = "publisher_confirms";
    public final static String publish_timeout_millis_param    = "publish_timeout_millis";
    public final static String wait_timeout_millis_param       = "wait_timeout_millis";
    public final static String app_id_param                    = "app_id";

    //NOTE 0 means forever for all timeout settings
    public final int heartbeat; //in seconds
    public final int handshake_timeout_millis;
    public final int shutdown_timeout_millis;
    public final int frame_max;
    public final boolean publisher_confirms;
    public final int publish_timeout_millis;
    public final int wait_timeout_millis;
    public final String app_id;

    private BackendSettings(int heartbeat, int handshakeTimeout, int shutdownTimeout, int frameMax,
                            boolean publisherConfirms, int publishTimeout, int waitTimeout, String appId) {
        this.heartbeat = heartbeat;
        this.handshake_timeout_millis = handshakeTimeout;
        this.shutdown_timeout_millis = shutdownTimeout;
        this.frame_max = frameMax;
        this.publisher_confirms = publisherConfirms;
        this.publish_timeout_millis = publishTimeout;
        this.wait_timeout_millis = waitTimeout;
        this.app_id = appId;
    }

    public static BackendSettings defaults() {
        return new Builder().build();
    }

    @Override
    public String toString() {
        try {
            return mapper.writeValueAsString(this);
        } catch (IOException e) {
            return e.toString();
        }
    }

    public static class Builder {

        private int heartbeat;
        private int handshakeTimeout;
        private int shutdownTimeout;
        private int frameMax;
        private boolean publisherConfirms;
        private int publishTimeout;
        private int waitTimeout;
        private String appId;

        public Builder() {
            setDefaults(new HashMap<>());
        }

        public Builder(String settingsJSONString) {
            String json = settingsJSONString.trim();
            if (!json.startsWith("{")) {
                json = "{" + json + "}";
            }
            try {
                setDefaults(mapper.readValue(json, new TypeReference<Map<String, Object>>() {}));
            } catch (Exception e) {
                log.errorWithParams("Could not parse settings string.", e, "settings", settingsJSONString);
                throw new IllegalArgumentException(e);
            }
        }

        private void setDefaults(Map<String, Object> map) {
            heartbeat = intValue(map, heartbeat_param, DEFAULT_HEARTBEAT);
            handshakeTimeout = intValue(map, handshake_timeout_millis_param, ConnectionFactory.DEFAULT_HANDSHAKE_TIMEOUT);
            shutdownTimeout = intValue(map, shutdown_timeout_millis_param, ConnectionFactory.DEFAULT_SHUTDOWN_TIMEOUT);
            frameMax = intValue(map, frame_max_param, ConnectionFactory.DEFAULT_FRAME_MAX);
            publisherConfirms = (boolean) map.getOrDefault(publisher_confirms_param, DEFAULT_PUBLISHER_CONFIRMS);
            publishTimeout = intValue(map, publish_timeout_millis_param, DEFAULT_PUBLISH_TIMEOUT_MILLIS);
            waitTimeout = intValue(map, wait_timeout_millis_param, DEFAULT_WAIT_TIMEOUT_MILLIS);
            appId = (String) map.getOrDefault(app_id_param, DEFAULT_APP_ID);
        }

        private static int intValue(Map<String, Object> map, String key, int defaultValue) {
            Object value = map.get(key);
            if (value == null) {
                return defaultValue;
            }
            if (!(value instanceof Number)) {
                throw new IllegalArgumentException("Setting '" + key + "' must be a number but was '" + value + "'");
            }
            return ((Number) value).intValue();
        }

        public BackendSettings build() {
            return new BackendSettings(heartbeat, handshakeTimeout, shutdownTimeout, frameMax,
                    publisherConfirms, publishTimeout, waitTimeout, appId);
        }

        public Builder withHeartbeatSecs(int heartbeat) {
            this.heartbeat = heartbeat;
            return this;
        }

        public Builder withHandshakeTimeoutMillis(int handshakeTimeout) {
            this.handshakeTimeout = handshakeTimeout;
            return this;
        }

        public Builder withShutdownTimeoutMillis(int shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder withFrameMax(int frameMax) {
            this.frameMax = frameMax;
            return this;
        }

        public Builder withPublisherConfirms(boolean publisherConfirms) {
            this.publisherConfirms = publisherConfirms;
            return this;
        }

        public Builder withPublishTimeoutMillis(int publishTimeout) {
            this.publishTimeout = publishTimeout;
            return this;
        }

        public Builder withWaitTimeoutMillis(int waitTimeout) {
            this.waitTimeout = waitTimeout;
            return this;
        }

        public Builder withAppId(String appId) {
            this.appId = appId;
            return this;
        }
    }
}
