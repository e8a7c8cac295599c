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

package org.eventrouter.destination.log;

import org.eventrouter.api.DestinationDeliveryException;
import org.eventrouter.api.EventCategory;
import org.eventrouter.api.EventDestination;
import org.eventrouter.api.EventEnvelope;
import org.eventrouter.codec.jackson.JacksonEnvelopeCodec;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

import static java.util.Objects.requireNonNull;

/**
 * Sends every envelope as an RFC 5424 syslog message, with facility {@code local0}. Events of type {@code Warning}
 * are sent with severity {@code warning}, all others with severity {@code informational}. The message body is the
 * envelope JSON.
 * <p>
 * Messages are sent as UDP datagrams or over TCP using octet counting framing (RFC 6587). A broken TCP connection is
 * re-established on the next delivery.
 * </p>
 */
public class SyslogDestination implements EventDestination {
    private static final Logger log = LoggerFactory.getLogger(SyslogDestination.class);

    static final int FACILITY_LOCAL0 = 16;
    static final int SEVERITY_WARNING = 4;
    static final int SEVERITY_INFORMATIONAL = 6;
    private static final int CONNECT_TIMEOUT_MILLIS = 5000;

    public enum Protocol {
        UDP, TCP;

        public static Protocol parse(String protocol) {
            requireNonNull(protocol, "protocol cannot be null");
            String name = protocol.trim();
            for (Protocol candidate : values()) {
                if (candidate.name().equalsIgnoreCase(name)) {
                    return candidate;
                }
            }
            throw new IllegalArgumentException("Unsupported syslog protocol: " + protocol + ", expecting udp or tcp");
        }
    }

    private final JacksonEnvelopeCodec codec;
    private final InetSocketAddress target;
    private final Protocol protocol;
    private final String appName;
    private final String hostname;
    private final Clock clock;

    private @Nullable DatagramSocket datagramSocket;
    private @Nullable Socket socket;

    public SyslogDestination(JacksonEnvelopeCodec codec, String host, int port, Protocol protocol, String appName) {
        this(codec, host, port, protocol, appName, localHostname(), Clock.systemUTC());
    }

    SyslogDestination(JacksonEnvelopeCodec codec, String host, int port, Protocol protocol, String appName, String hostname, Clock clock) {
        requireNonNull(codec, JacksonEnvelopeCodec.class.getSimpleName() + " cannot be null");
        requireNonNull(host, "host cannot be null");
        requireNonNull(protocol, Protocol.class.getSimpleName() + " cannot be null");
        requireNonNull(appName, "appName cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535");
        }
        this.codec = codec;
        this.target = new InetSocketAddress(host, port);
        this.protocol = protocol;
        this.appName = appName.isBlank() ? "-" : appName;
        this.hostname = hostname == null || hostname.isBlank() ? "-" : hostname;
        this.clock = clock;
    }

    @Override
    public synchronized void deliver(EventEnvelope envelope) {
        try {
            byte[] message = format(envelope).getBytes(StandardCharsets.UTF_8);
            if (protocol == Protocol.UDP) {
                sendDatagram(message);
            } else {
                sendOverTcp(message);
            }
        } catch (IOException | RuntimeException e) {
            log.error("Failed to send {} event to syslog at {}", envelope.verb(), target, new DestinationDeliveryException("Syslog delivery failed", e));
        }
    }

    String format(EventEnvelope envelope) {
        int severity = envelope.event().category() == EventCategory.WARNING ? SEVERITY_WARNING : SEVERITY_INFORMATIONAL;
        int priority = FACILITY_LOCAL0 * 8 + severity;
        String timestamp = DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS));
        // <PRI>VERSION TIMESTAMP HOSTNAME APP-NAME PROCID MSGID STRUCTURED-DATA MSG
        return "<" + priority + ">1 " + timestamp + " " + hostname + " " + appName + " - " + envelope.verb() + " - " + codec.toJson(envelope);
    }

    private void sendDatagram(byte[] message) throws IOException {
        if (datagramSocket == null) {
            datagramSocket = new DatagramSocket();
        }
        datagramSocket.send(new DatagramPacket(message, message.length, target));
    }

    private void sendOverTcp(byte[] message) throws IOException {
        byte[] frame = (message.length + " ").getBytes(StandardCharsets.US_ASCII);
        try {
            OutputStream out = connectedSocket().getOutputStream();
            out.write(frame);
            out.write(message);
            out.flush();
        } catch (IOException e) {
            closeSocket();
            throw e;
        }
    }

    private Socket connectedSocket() throws IOException {
        if (socket == null || socket.isClosed()) {
            Socket newSocket = new Socket();
            newSocket.connect(target, CONNECT_TIMEOUT_MILLIS);
            socket = newSocket;
        }
        return socket;
    }

    private void closeSocket() {
        if (socket != null) {
            try {
                socket.close();
            } catch (IOException e) {
                log.debug("Failed to close syslog connection to {}", target, e);
            }
            socket = null;
        }
    }

    @Override
    public synchronized void close() {
        closeSocket();
        if (datagramSocket != null) {
            datagramSocket.close();
            datagramSocket = null;
        }
    }

    private static String localHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Could not resolve local hostname, syslog messages will use '-'", e);
            return "-";
        }
    }
}
