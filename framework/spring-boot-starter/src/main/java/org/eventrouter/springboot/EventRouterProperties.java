/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventrouter.springboot;

import org.eventrouter.destination.http.RocksetDestination;
import org.eventrouter.router.PositionOrdering;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "eventrouter")
public class EventRouterProperties {

    /**
     * The destination that events are forwarded to: stdout, log (or glog), syslog, http, influxdb, rockset, kafka or s3.
     * Unknown values fall back to stdout.
     */
    private String sink = DestinationRegistry.STDOUT;

    /**
     * Count delivered events per type with Micrometer. Requires a MeterRegistry bean, for example a Prometheus registry.
     */
    private boolean enablePrometheus = true;

    /**
     * How position tokens are ordered. Use lexicographic only if the source guarantees fixed width tokens.
     */
    private PositionOrdering positionOrdering = PositionOrdering.NUMERIC;

    /**
     * The position to start from when no position is stored. Empty means that every event is forwarded.
     */
    private String initialPosition;

    private PositionProperties position = new PositionProperties();
    private StdoutProperties stdout = new StdoutProperties();
    private SyslogProperties syslog = new SyslogProperties();
    private HttpProperties http = new HttpProperties();
    private InfluxDbProperties influxdb = new InfluxDbProperties();
    private RocksetProperties rockset = new RocksetProperties();
    private KafkaProperties kafka = new KafkaProperties();
    private S3Properties s3 = new S3Properties();

    public static class PositionProperties {
        /**
         * File to persist the position in. When not set the position is only kept in memory.
         */
        private String file;

        /**
         * The key that the position is stored under.
         */
        private String routerId = "eventrouter";

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }

        public String getRouterId() {
            return routerId;
        }

        public void setRouterId(String routerId) {
            this.routerId = routerId;
        }
    }

    public static class StdoutProperties {
        /**
         * Wrap every envelope in a JSON object with this key.
         */
        private String jsonNamespace;

        public String getJsonNamespace() {
            return jsonNamespace;
        }

        public void setJsonNamespace(String jsonNamespace) {
            this.jsonNamespace = jsonNamespace;
        }
    }

    public static class SyslogProperties {
        private String host = "localhost";
        private int port = 514;
        /**
         * udp or tcp
         */
        private String protocol = "udp";
        private String appName = "eventrouter";

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getProtocol() {
            return protocol;
        }

        public void setProtocol(String protocol) {
            this.protocol = protocol;
        }

        public String getAppName() {
            return appName;
        }

        public void setAppName(String appName) {
            this.appName = appName;
        }
    }

    public static class HttpProperties {
        /**
         * The endpoint that envelopes are posted to.
         */
        private String url;

        /**
         * json or cloudevents
         */
        private String format = "json";
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofMillis(100);
        private Duration maxBackoff = Duration.ofSeconds(5);

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getFormat() {
            return format;
        }

        public void setFormat(String format) {
            this.format = format;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }
    }

    public static class InfluxDbProperties {
        private String url;
        private String database = "eventrouter";
        private String measurement = "events";
        private String username;
        private String password;
        private int maxAttempts = 3;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getDatabase() {
            return database;
        }

        public void setDatabase(String database) {
            this.database = database;
        }

        public String getMeasurement() {
            return measurement;
        }

        public void setMeasurement(String measurement) {
            this.measurement = measurement;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class RocksetProperties {
        private String apiServer = RocksetDestination.DEFAULT_API_SERVER;
        private String apiKey;
        private String workspace = "commons";
        private String collection;
        private int maxAttempts = 3;

        public String getApiServer() {
            return apiServer;
        }

        public void setApiServer(String apiServer) {
            this.apiServer = apiServer;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getWorkspace() {
            return workspace;
        }

        public void setWorkspace(String workspace) {
            this.workspace = workspace;
        }

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class KafkaProperties {
        private List<String> brokers = new ArrayList<>();
        private String topic = "eventrouter";
        private String clientId = "eventrouter";
        /**
         * Producer acknowledgements: 0, 1 or all
         */
        private String acks = "1";

        public List<String> getBrokers() {
            return brokers;
        }

        public void setBrokers(List<String> brokers) {
            this.brokers = brokers;
        }

        public String getTopic() {
            return topic;
        }

        public void setTopic(String topic) {
            this.topic = topic;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getAcks() {
            return acks;
        }

        public void setAcks(String acks) {
            this.acks = acks;
        }
    }

    public static class S3Properties {
        private String bucket;
        private String region;
        private String prefix = "eventrouter";
        /**
         * Upload buffered events this often.
         */
        private Duration uploadInterval = Duration.ofMinutes(2);
        /**
         * Upload as soon as this many events are buffered.
         */
        private int maxBufferedEvents = 1000;

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public Duration getUploadInterval() {
            return uploadInterval;
        }

        public void setUploadInterval(Duration uploadInterval) {
            this.uploadInterval = uploadInterval;
        }

        public int getMaxBufferedEvents() {
            return maxBufferedEvents;
        }

        public void setMaxBufferedEvents(int maxBufferedEvents) {
            this.maxBufferedEvents = maxBufferedEvents;
        }
    }

    public String getSink() {
        return sink;
    }

    public void setSink(String sink) {
        this.sink = sink;
    }

    public boolean isEnablePrometheus() {
        return enablePrometheus;
    }

    public void setEnablePrometheus(boolean enablePrometheus) {
        this.enablePrometheus = enablePrometheus;
    }

    public PositionOrdering getPositionOrdering() {
        return positionOrdering;
    }

    public void setPositionOrdering(PositionOrdering positionOrdering) {
        this.positionOrdering = positionOrdering;
    }

    public String getInitialPosition() {
        return initialPosition;
    }

    public void setInitialPosition(String initialPosition) {
        this.initialPosition = initialPosition;
    }

    public PositionProperties getPosition() {
        return position;
    }

    public void setPosition(PositionProperties position) {
        this.position = position;
    }

    public StdoutProperties getStdout() {
        return stdout;
    }

    public void setStdout(StdoutProperties stdout) {
        this.stdout = stdout;
    }

    public SyslogProperties getSyslog() {
        return syslog;
    }

    public void setSyslog(SyslogProperties syslog) {
        this.syslog = syslog;
    }

    public HttpProperties getHttp() {
        return http;
    }

    public void setHttp(HttpProperties http) {
        this.http = http;
    }

    public InfluxDbProperties getInfluxdb() {
        return influxdb;
    }

    public void setInfluxdb(InfluxDbProperties influxdb) {
        this.influxdb = influxdb;
    }

    public RocksetProperties getRockset() {
        return rockset;
    }

    public void setRockset(RocksetProperties rockset) {
        this.rockset = rockset;
    }

    public KafkaProperties getKafka() {
        return kafka;
    }

    public void setKafka(KafkaProperties kafka) {
        this.kafka = kafka;
    }

    public S3Properties getS3() {
        return s3;
    }

    public void setS3(S3Properties s3) {
        this.s3 = s3;
    }
}
