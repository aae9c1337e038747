package com.example.roomchat.websocket;

import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.example.roomchat.dto.SignalRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Forwards WebRTC offers, answers and ICE candidates between two connections. Payloads are
 * opaque; the relay only stamps the sender id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SignalingRelay {

    public static final String OFFER_EVENT = "webrtc_offer";
    public static final String ANSWER_EVENT = "webrtc_answer";
    public static final String ICE_CANDIDATE_EVENT = "webrtc_ice_candidate";

    private final SocketIOServer socketIOServer;

    public boolean relayOffer(UUID from, SignalRequest request) {
        return forward(from, request.getTo(), OFFER_EVENT, "sdp", request.getSdp());
    }

    public boolean relayAnswer(UUID from, SignalRequest request) {
        return forward(from, request.getTo(), ANSWER_EVENT, "sdp", request.getSdp());
    }

    public boolean relayIceCandidate(UUID from, SignalRequest request) {
        return forward(from, request.getTo(), ICE_CANDIDATE_EVENT, "candidate", request.getCandidate());
    }

    private boolean forward(UUID from, String to, String event, String field, Object data) {
        Optional<SocketIOClient> target = BroadcastHub.parseSessionId(to).map(socketIOServer::getClient);
        if (target.isEmpty()) {
            log.debug("Dropping {} from {}: target {} is not connected", event, from, to);
            return false;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", from.toString());
        payload.put(field, data);
        target.get().sendEvent(event, payload);
        return true;
    }
}
