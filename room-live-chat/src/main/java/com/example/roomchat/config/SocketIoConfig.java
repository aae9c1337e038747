package com.example.roomchat.config;

import com.corundumstudio.socketio.AckMode;
import com.corundumstudio.socketio.Configuration;
import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.Transport;
import com.corundumstudio.socketio.protocol.JacksonJsonSupport;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;

/**
 * Starts the Socket.IO listener next to the servlet container. Rooms, calls and signaling all run
 * over this single server.
 */
@Slf4j
@org.springframework.context.annotation.Configuration
public class SocketIoConfig implements DisposableBean {

    private SocketIOServer server;

    @Bean
    public SocketIOServer socketIOServer(
            @Value("${chat.socketio.host:0.0.0.0}") String host,
            @Value("${chat.socketio.port:9094}") int port,
            @Value("${chat.socketio.origin:*}") String origin,
            @Value("${chat.socketio.ping-interval:PT25S}") Duration pingInterval,
            @Value("${chat.socketio.ping-timeout:PT20S}") Duration pingTimeout,
            @Value("${chat.socketio.max-frame-payload-length:1048576}") int maxFramePayloadLength,
            ObjectMapper objectMapper) {
        Configuration configuration = new Configuration();
        configuration.setHostname(host);
        configuration.setPort(port);
        configuration.setOrigin(origin);
        configuration.setTransports(Transport.WEBSOCKET, Transport.POLLING);
        configuration.setPingInterval((int) pingInterval.toMillis());
        configuration.setPingTimeout((int) pingTimeout.toMillis());
        // SDP offers and media-bearing messages exceed the 64 KiB default.
        configuration.setMaxFramePayloadLength(maxFramePayloadLength);
        configuration.getSocketConfig().setReuseAddress(true);
        configuration.setJsonSupport(new RoomChatJsonSupport(objectMapper));
        // Handlers run on a worker pool and acknowledge once the outcome is known.
        configuration.setAckMode(AckMode.MANUAL);

        server = new SocketIOServer(configuration);
        server.start();
        log.info("Socket.IO server listening on {}:{}", host, port);
        return server;
    }

    @PreDestroy
    @Override
    public void destroy() {
        if (server != null) {
            server.stop();
        }
    }

    /**
     * Socket payload mapping aligned with the REST mapper's time handling. Browser clients send
     * loosely shaped payloads, so unknown properties never fail an event.
     */
    static class RoomChatJsonSupport extends JacksonJsonSupport {

        RoomChatJsonSupport(ObjectMapper baseMapper) {
            super(new JavaTimeModule());
            objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
            objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
                    baseMapper.isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
            objectMapper.setTimeZone(baseMapper.getSerializationConfig().getTimeZone());
        }
    }
}
