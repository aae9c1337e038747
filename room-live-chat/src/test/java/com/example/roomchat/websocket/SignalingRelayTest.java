package com.example.roomchat.websocket;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.example.roomchat.dto.SignalRequest;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SignalingRelayTest {

    private final UUID sender = UUID.randomUUID();
    private final UUID receiver = UUID.randomUUID();

    @Mock
    private SocketIOServer server;

    @Mock
    private SocketIOClient target;

    @Test
    void offerIsForwardedWithSenderId() {
        when(server.getClient(receiver)).thenReturn(target);
        Map<String, Object> sdp = Map.of("type", "offer", "sdp", "v=0");

        boolean delivered = new SignalingRelay(server).relayOffer(sender, signal(receiver.toString(), sdp, null));

        assertTrue(delivered);
        verify(target).sendEvent(SignalingRelay.OFFER_EVENT, Map.of("from", sender.toString(), "sdp", sdp));
    }

    @Test
    void candidateIsForwardedVerbatim() {
        when(server.getClient(receiver)).thenReturn(target);
        Map<String, Object> candidate = Map.of("candidate", "candidate:1 1 udp 2122260223 10.0.0.2 50000 typ host");

        new SignalingRelay(server).relayIceCandidate(sender, signal(receiver.toString(), null, candidate));

        verify(target).sendEvent(SignalingRelay.ICE_CANDIDATE_EVENT,
                Map.of("from", sender.toString(), "candidate", candidate));
    }

    @Test
    void unknownTargetIsDropped() {
        when(server.getClient(receiver)).thenReturn(null);

        assertFalse(new SignalingRelay(server).relayAnswer(sender, signal(receiver.toString(), "sdp", null)));
    }

    @Test
    void malformedTargetIsDropped() {
        assertFalse(new SignalingRelay(server).relayAnswer(sender, signal("not-a-session", "sdp", null)));
    }

    private static SignalRequest signal(String to, Object sdp, Object candidate) {
        SignalRequest request = new SignalRequest();
        request.setTo(to);
        request.setSdp(sdp);
        request.setCandidate(candidate);
        return request;
    }
}
