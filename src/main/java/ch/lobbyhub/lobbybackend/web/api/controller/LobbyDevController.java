package ch.lobbyhub.lobbybackend.web.api.controller;

import ch.lobbyhub.lobbybackend.domain.enums.LobbyState;
import ch.lobbyhub.lobbybackend.lobby.Lobby;
import ch.lobbyhub.lobbybackend.repository.PeerRegistry;
import ch.lobbyhub.lobbybackend.service.LobbyCleanupService;
import ch.lobbyhub.lobbybackend.service.LobbyCoordinationService;
import ch.lobbyhub.lobbybackend.web.api.dto.LobbyCleanupResultDto;
import ch.lobbyhub.lobbybackend.web.api.dto.LobbyRegistryStatusDto;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Development-only endpoints to run the empty-lobby sweep and inspect the registries.
 *
 * <p>Only available with the {@code dev} or {@code test} profile.
 */
@RestController
@RequestMapping("/api/dev/lobbies")
@RequiredArgsConstructor
@Profile({"dev", "test"})
public class LobbyDevController {

    private final LobbyCleanupService cleanupService;
    private final LobbyCoordinationService coordinationService;
    private final PeerRegistry peerRegistry;

    /**
     * Runs the sweep immediately.
     *
     * <p>Example response:
     * <pre>
     * {
     *   "message": "Cleanup completed",
     *   "destroyedCount": 2,
     *   "lobbiesBefore": 5,
     *   "lobbiesAfter": 3,
     *   "emptyTtlSeconds": 300
     * }
     * </pre>
     */
    @PostMapping("/cleanup")
    @Operation(summary = "Destroys lobbies that stayed empty longer than the configured TTL")
    public ResponseEntity<LobbyCleanupResultDto> triggerCleanup() {
        int before = coordinationService.getLobbies().size();
        int destroyed = cleanupService.triggerCleanup();
        int after = coordinationService.getLobbies().size();

        return ResponseEntity.ok(new LobbyCleanupResultDto(
                "Cleanup completed",
                destroyed,
                before,
                after,
                cleanupService.getEmptyTtlSeconds()
        ));
    }

    @GetMapping("/status")
    @Operation(summary = "Gets lobby and connection counts")
    public ResponseEntity<LobbyRegistryStatusDto> getStatus() {
        List<Lobby> lobbies = coordinationService.getLobbies();

        long empty = lobbies.stream().filter(lobby -> lobby.getPlayerCount() == 0).count();
        long inProgress = lobbies.stream().filter(lobby -> lobby.getState() == LobbyState.IN_PROGRESS).count();

        return ResponseEntity.ok(new LobbyRegistryStatusDto(
                lobbies.size(),
                empty,
                inProgress,
                peerRegistry.count(),
                coordinationService.getFactoryIds()
        ));
    }
}
