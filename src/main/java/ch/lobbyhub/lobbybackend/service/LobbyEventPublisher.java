package ch.lobbyhub.lobbybackend.service;

import ch.lobbyhub.lobbybackend.web.api.dto.LobbyChatMessageDto;
import ch.lobbyhub.lobbybackend.web.api.dto.LobbyEventDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes lobby events and chat messages to the lobby topics.
 *
 * <p>Destinations:
 * <ul>
 *   <li>{@code /topic/lobbies/{lobbyId}/events} for {@link LobbyEventDto}</li>
 *   <li>{@code /topic/lobbies/{lobbyId}/chat} for {@link LobbyChatMessageDto}</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LobbyEventPublisher {

    private final SimpMessagingTemplate messagingTemplate;

    public void publishEvent(LobbyEventDto event) {
        if (messagingTemplate != null) {
            String destination = "/topic/lobbies/" + event.lobbyId() + "/events";
            messagingTemplate.convertAndSend(destination, event);
            log.debug("Sent {} event for lobby {}", event.type(), event.lobbyId());
        }
    }

    public void publishChatMessage(LobbyChatMessageDto message) {
        if (messagingTemplate != null) {
            String destination = "/topic/lobbies/" + message.lobbyId() + "/chat";
            messagingTemplate.convertAndSend(destination, message);
        }
    }
}
