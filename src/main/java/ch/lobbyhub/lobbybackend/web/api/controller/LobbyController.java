package ch.lobbyhub.lobbybackend.web.api.controller;

import ch.lobbyhub.lobbybackend.service.LobbyCoordinationService;
import ch.lobbyhub.lobbybackend.web.api.dto.GameInfoDto;
import ch.lobbyhub.lobbybackend.web.api.dto.LobbyDataDto;
import ch.lobbyhub.lobbybackend.web.api.dto.LobbyMemberDataDto;
import ch.lobbyhub.lobbybackend.web.api.dto.LobbyResponse;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/lobbies")
public class LobbyController {

    private final LobbyCoordinationService coordinationService;

    public LobbyController(LobbyCoordinationService coordinationService) {
        this.coordinationService = coordinationService;
    }

    @Operation(summary = "Lists live lobbies; query parameters filter on public lobby properties")
    @GetMapping("/public")
    public List<GameInfoDto> getPublicGames(@RequestParam Map<String, String> filters) {
        return coordinationService.getPublicGames(null, filters);
    }

    @Operation(summary = "Lists the registered lobby factory ids")
    @GetMapping("/factories")
    public List<String> getFactories() {
        return coordinationService.getFactoryIds();
    }

    @Operation(summary = "Gets a snapshot of a lobby")
    @GetMapping("/{lobbyId}")
    public ResponseEntity<LobbyDataDto> getLobbyInfo(@PathVariable int lobbyId) {
        return toResponseEntity(coordinationService.getLobbyInfo(null, lobbyId));
    }

    @Operation(summary = "Gets the data of one lobby member")
    @GetMapping("/{lobbyId}/members/{peerId}")
    public ResponseEntity<LobbyMemberDataDto> getMemberData(@PathVariable int lobbyId,
                                                            @PathVariable int peerId) {
        return toResponseEntity(coordinationService.getLobbyMemberData(lobbyId, peerId));
    }

    private static <T> ResponseEntity<T> toResponseEntity(LobbyResponse<T> response) {
        if (response.isSuccess()) {
            return ResponseEntity.ok(response.data());
        }
        return ResponseEntity.status(response.errorType().getHttpStatus()).build();
    }
}
