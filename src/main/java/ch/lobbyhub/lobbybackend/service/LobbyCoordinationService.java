package ch.lobbyhub.lobbybackend.service;

import ch.lobbyhub.lobbybackend.domain.LobbyException;
import ch.lobbyhub.lobbybackend.domain.LobbyMember;
import ch.lobbyhub.lobbybackend.domain.LobbyPeer;
import ch.lobbyhub.lobbybackend.domain.LobbyUserContext;
import ch.lobbyhub.lobbybackend.domain.enums.GameInfoType;
import ch.lobbyhub.lobbybackend.domain.enums.LobbyErrorType;
import ch.lobbyhub.lobbybackend.lobby.Lobby;
import ch.lobbyhub.lobbybackend.lobby.LobbyFactory;
import ch.lobbyhub.lobbybackend.lobby.LobbyOptionKeys;
import ch.lobbyhub.lobbybackend.repository.LobbyFactoryRegistry;
import ch.lobbyhub.lobbybackend.repository.LobbyRegistry;
import ch.lobbyhub.lobbybackend.repository.LobbyUserContextRegistry;
import ch.lobbyhub.lobbybackend.web.api.dto.GameInfoDto;
import ch.lobbyhub.lobbybackend.web.api.dto.LobbyDataDto;
import ch.lobbyhub.lobbybackend.web.api.dto.LobbyMemberDataDto;
import ch.lobbyhub.lobbybackend.web.api.dto.LobbyResponse;
import ch.lobbyhub.lobbybackend.web.api.dto.RoomAccessDto;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for every lobby request.
 *
 * <p>Owns the factory, lobby and connection-context registries, checks the
 * cross-cutting policies (creation permission, joined-lobbies limit) and routes
 * each request to the target lobby. Lobby failures are turned into a
 * {@link LobbyResponse}; no {@link LobbyException} leaves this service.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code lobbies.create-permission-level}: minimum permission level to create lobbies (default: 0)</li>
 *   <li>{@code lobbies.dont-allow-creating-if-joined}: reject creation while in a lobby (default: true)</li>
 *   <li>{@code lobbies.joined-lobbies-limit}: lobbies one connection may be in at once (default: 1)</li>
 * </ul>
 */
@Service
@Slf4j
public class LobbyCoordinationService {

    private final LobbyFactoryRegistry factoryRegistry = new LobbyFactoryRegistry();
    private final LobbyRegistry lobbyRegistry = new LobbyRegistry();
    private final LobbyUserContextRegistry contextRegistry;

    private final int createPermissionLevel;
    private final boolean dontAllowCreatingIfJoined;

    public LobbyCoordinationService(List<LobbyFactory> factories,
                                    @Value("${lobbies.create-permission-level:0}") int createPermissionLevel,
                                    @Value("${lobbies.dont-allow-creating-if-joined:true}") boolean dontAllowCreatingIfJoined,
                                    @Value("${lobbies.joined-lobbies-limit:1}") int joinedLobbiesLimit) {
        this.createPermissionLevel = createPermissionLevel;
        this.dontAllowCreatingIfJoined = dontAllowCreatingIfJoined;
        this.contextRegistry = new LobbyUserContextRegistry(joinedLobbiesLimit);

        factories.forEach(factoryRegistry::register);
        lobbyRegistry.addRemovalListener(lobby -> contextRegistry.detachFromLobby(lobby.getId()));
    }

    // ------------------------------------------------------------------------------------
    // Lifecycle requests
    // ------------------------------------------------------------------------------------

    /**
     * Creates a lobby through the requested factory and lets the creator join it.
     *
     * <p>The factory id is taken from {@code factoryId}, or from the
     * {@code lobbyFactoryId} option when the field is blank. A lobby that fails
     * to build or register is never visible to other requests.
     *
     * @return id of the new lobby
     */
    public LobbyResponse<Integer> createLobby(LobbyPeer peer, String factoryId, Map<String, String> options) {
        if (peer.getPermissionLevel() < createPermissionLevel) {
            return LobbyResponse.failure(LobbyErrorType.UNAUTHORIZED, "Insufficient permissions");
        }

        LobbyUserContext context = getOrCreateContext(peer);
        if (dontAllowCreatingIfJoined && currentLobby(context).isPresent()) {
            return LobbyResponse.failure(LobbyErrorType.CONFLICT, "You are already in a lobby");
        }

        Map<String, String> safeOptions = options != null ? options : Map.of();
        String resolvedFactoryId = factoryId != null && !factoryId.isBlank()
                ? factoryId
                : safeOptions.get(LobbyOptionKeys.FACTORY_ID);

        if (resolvedFactoryId == null || resolvedFactoryId.isBlank()) {
            return LobbyResponse.failure(LobbyErrorType.INVALID_REQUEST, "Invalid request (undefined factory)");
        }

        Optional<LobbyFactory> factory = factoryRegistry.resolve(resolvedFactoryId);
        if (factory.isEmpty()) {
            return LobbyResponse.failure(LobbyErrorType.INVALID_REQUEST, "Unavailable lobby factory");
        }

        Lobby lobby;
        try {
            lobby = factory.get().createLobby(lobbyRegistry.generateLobbyId(), safeOptions, peer);
        } catch (LobbyException e) {
            log.info("Lobby creation by {} rejected: {}", peer, e.getMessage());
            return LobbyResponse.failure(e);
        }

        if (!lobbyRegistry.add(lobby)) {
            lobby.destroy();
            return LobbyResponse.failure(LobbyErrorType.INTERNAL_ERROR, "Lobby registration failed");
        }

        log.info("Peer {} created lobby {} '{}' ({})", peer, lobby.getId(), lobby.getName(), resolvedFactoryId);

        if (context.hasCapacity()) {
            try {
                lobby.addPlayer(context);
            } catch (LobbyException e) {
                // the lobby stays listed; the cleanup sweep removes it if nobody joins
                log.warn("Creator {} could not join lobby {}: {}", peer, lobby.getId(), e.getMessage());
            }
        }

        return LobbyResponse.success(lobby.getId());
    }

    /**
     * @return lobby snapshot personalised for the joining connection
     */
    public LobbyResponse<LobbyDataDto> joinLobby(LobbyPeer peer, int lobbyId) {
        LobbyUserContext context = getOrCreateContext(peer);
        pruneStaleLobbies(context);

        if (!context.hasCapacity()) {
            return LobbyResponse.failure(LobbyErrorType.CONFLICT, "You're already in a lobby");
        }

        Optional<Lobby> lobby = lobbyRegistry.get(lobbyId);
        if (lobby.isEmpty()) {
            return LobbyResponse.failure(LobbyErrorType.NOT_FOUND, "Lobby was not found");
        }

        try {
            lobby.get().addPlayer(context);
        } catch (LobbyException e) {
            log.debug("Join of {} to lobby {} rejected: {}", peer, lobbyId, e.getMessage());
            return LobbyResponse.failure(e);
        }

        return LobbyResponse.success(lobby.get().generateLobbyData(context));
    }

    /**
     * Leaves the given lobby. Leaving a lobby that no longer exists succeeds.
     */
    public LobbyResponse<Void> leaveLobby(LobbyPeer peer, int lobbyId) {
        LobbyUserContext context = getOrCreateContext(peer);

        Optional<Lobby> lobby = lobbyRegistry.get(lobbyId);
        if (lobby.isEmpty()) {
            context.detach(lobbyId);
            return LobbyResponse.success();
        }

        lobby.get().removePlayer(context);
        return LobbyResponse.success();
    }

    /**
     * Applies the properties in iteration order. The first rejected write aborts the
     * batch; writes applied before it are kept.
     */
    public LobbyResponse<Void> setLobbyProperties(LobbyPeer peer, int lobbyId, Map<String, String> properties) {
        if (properties == null) {
            return LobbyResponse.failure(LobbyErrorType.INVALID_REQUEST, "Invalid request");
        }

        Optional<Lobby> lobby = lobbyRegistry.get(lobbyId);
        if (lobby.isEmpty()) {
            return LobbyResponse.failure(LobbyErrorType.NOT_FOUND, "Lobby was not found");
        }

        LobbyUserContext context = getOrCreateContext(peer);
        for (Map.Entry<String, String> entry : properties.entrySet()) {
            if (!lobby.get().setProperty(context, entry.getKey(), entry.getValue())) {
                return LobbyResponse.failure(LobbyErrorType.INVALID_REQUEST,
                        "Failed to set the property: " + entry.getKey());
            }
        }

        return LobbyResponse.success();
    }

    /**
     * Sets member properties of the caller in its current lobby, with the same abort rule
     * as {@link #setLobbyProperties}.
     */
    public LobbyResponse<Void> setMyProperties(LobbyPeer peer, Map<String, String> properties) {
        if (properties == null) {
            return LobbyResponse.failure(LobbyErrorType.INVALID_REQUEST, "Invalid request");
        }

        Optional<Membership> membership = currentMembership(peer);
        if (membership.isEmpty()) {
            return notInLobby();
        }

        for (Map.Entry<String, String> entry : properties.entrySet()) {
            if (!membership.get().lobby().setPlayerProperty(membership.get().member(), entry.getKey(), entry.getValue())) {
                return LobbyResponse.failure(LobbyErrorType.INVALID_REQUEST,
                        "Failed to set property: " + entry.getKey());
            }
        }

        return LobbyResponse.success();
    }

    public LobbyResponse<Void> setReadyStatus(LobbyPeer peer, boolean ready) {
        Optional<Membership> membership = currentMembership(peer);
        if (membership.isEmpty()) {
            return notInLobby();
        }

        membership.get().lobby().setReadyState(membership.get().member(), ready);
        return LobbyResponse.success();
    }

    public LobbyResponse<Void> joinTeam(LobbyPeer peer, String teamName) {
        if (teamName == null || teamName.isBlank()) {
            return LobbyResponse.failure(LobbyErrorType.INVALID_REQUEST, "Invalid request");
        }

        Optional<Membership> membership = currentMembership(peer);
        if (membership.isEmpty()) {
            return notInLobby();
        }

        if (!membership.get().lobby().tryJoinTeam(teamName, membership.get().member())) {
            return LobbyResponse.failure(LobbyErrorType.CONFLICT, "Failed to join a team: " + teamName);
        }

        return LobbyResponse.success();
    }

    /**
     * Forwards a chat message to the caller's current lobby. Messages from
     * connections outside a lobby are dropped without a reply.
     *
     * @return {@code true} if the message was handed to a lobby
     */
    public boolean sendChatMessage(LobbyPeer peer, String message) {
        Optional<Membership> membership = currentMembership(peer);
        if (membership.isEmpty()) {
            log.debug("Dropped chat message from {}: not in a lobby", peer);
            return false;
        }

        membership.get().lobby().chatMessageHandler(membership.get().member(), message);
        return true;
    }

    public LobbyResponse<Void> startGame(LobbyPeer peer) {
        LobbyUserContext context = getOrCreateContext(peer);
        Optional<Lobby> lobby = currentLobby(context);
        if (lobby.isEmpty()) {
            return notInLobby();
        }

        try {
            lobby.get().startGameManually(context);
        } catch (LobbyException e) {
            log.info("Start of lobby {} by {} failed: {}", lobby.get().getId(), peer, e.getMessage());
            return LobbyResponse.failure(e);
        }

        return LobbyResponse.success();
    }

    public LobbyResponse<RoomAccessDto> getLobbyRoomAccess(LobbyPeer peer) {
        LobbyUserContext context = getOrCreateContext(peer);
        Optional<Lobby> lobby = currentLobby(context);
        if (lobby.isEmpty()) {
            return notInLobby();
        }

        try {
            return LobbyResponse.success(lobby.get().gameAccessRequestHandler(context));
        } catch (LobbyException e) {
            return LobbyResponse.failure(e);
        }
    }

    // ------------------------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------------------------

    public LobbyResponse<LobbyMemberDataDto> getLobbyMemberData(int lobbyId, int peerId) {
        Optional<Lobby> lobby = lobbyRegistry.get(lobbyId);
        if (lobby.isEmpty()) {
            return LobbyResponse.failure(LobbyErrorType.NOT_FOUND, "Lobby not found");
        }

        return lobby.get().getMemberByPeerId(peerId)
                .map(member -> LobbyResponse.success(member.generateDataPacket()))
                .orElseGet(() -> LobbyResponse.failure(LobbyErrorType.NOT_FOUND, "Player is not in the lobby"));
    }

    /**
     * @param peer requesting connection, {@code null} for anonymous (REST) callers
     */
    public LobbyResponse<LobbyDataDto> getLobbyInfo(LobbyPeer peer, int lobbyId) {
        Optional<Lobby> lobby = lobbyRegistry.get(lobbyId);
        if (lobby.isEmpty()) {
            return LobbyResponse.failure(LobbyErrorType.NOT_FOUND, "Lobby not found");
        }

        LobbyUserContext context = peer != null ? contextRegistry.find(peer.getPeerId()).orElse(null) : null;
        return LobbyResponse.success(lobby.get().generateLobbyData(context));
    }

    /**
     * Public game listing.
     *
     * @param peer    requesting connection, may be {@code null}
     * @param filters property values an entry must match exactly; empty or {@code null} lists every lobby
     */
    public List<GameInfoDto> getPublicGames(LobbyPeer peer, Map<String, String> filters) {
        Map<String, String> safeFilters = filters != null ? filters : Map.of();

        return lobbyRegistry.getAll().stream()
                .filter(lobby -> !lobby.isDestroyed())
                .map(lobby -> toGameInfo(lobby, peer))
                .filter(info -> matchesFilters(info.customOptions(), safeFilters))
                .toList();
    }

    private static GameInfoDto toGameInfo(Lobby lobby, LobbyPeer peer) {
        String address = lobby.getGameIp() != null ? lobby.getGameIp() + ":" + lobby.getGamePort() : null;
        return new GameInfoDto(
                address,
                lobby.getId(),
                lobby.getMaxPlayers(),
                lobby.getName(),
                lobby.getPlayerCount(),
                lobby.getPublicProperties(peer),
                GameInfoType.LOBBY
        );
    }

    private static boolean matchesFilters(Map<String, String> properties, Map<String, String> filters) {
        return filters.entrySet().stream()
                .allMatch(filter -> filter.getValue().equals(properties.get(filter.getKey())));
    }

    // ------------------------------------------------------------------------------------
    // Connections
    // ------------------------------------------------------------------------------------

    /**
     * Removes the peer from every lobby it joined and forgets its context.
     */
    public void handleDisconnect(LobbyPeer peer) {
        contextRegistry.remove(peer.getPeerId()).ifPresent(context -> {
            for (Integer lobbyId : context.getJoinedLobbyIds()) {
                lobbyRegistry.get(lobbyId).ifPresent(lobby -> lobby.removePlayer(context));
            }
            log.debug("Dropped lobby context of {}", peer);
        });
    }

    public LobbyUserContext getOrCreateContext(LobbyPeer peer) {
        return contextRegistry.getOrCreate(peer);
    }

    private Optional<Lobby> currentLobby(LobbyUserContext context) {
        Optional<Integer> lobbyId = context.getCurrentLobbyId();
        if (lobbyId.isEmpty()) {
            return Optional.empty();
        }

        Optional<Lobby> lobby = lobbyRegistry.get(lobbyId.get());
        if (lobby.isEmpty()) {
            context.detach(lobbyId.get());
        }
        return lobby;
    }

    private Optional<Membership> currentMembership(LobbyPeer peer) {
        LobbyUserContext context = getOrCreateContext(peer);
        return currentLobby(context)
                .flatMap(lobby -> lobby.getMember(context).map(member -> new Membership(lobby, member)));
    }

    private void pruneStaleLobbies(LobbyUserContext context) {
        for (Integer lobbyId : context.getJoinedLobbyIds()) {
            if (lobbyRegistry.get(lobbyId).isEmpty()) {
                context.detach(lobbyId);
            }
        }
    }

    private static <T> LobbyResponse<T> notInLobby() {
        return LobbyResponse.failure(LobbyErrorType.NOT_FOUND, "You're not in a lobby");
    }

    private record Membership(Lobby lobby, LobbyMember member) {
    }

    // ------------------------------------------------------------------------------------
    // Registry access
    // ------------------------------------------------------------------------------------

    public void addFactory(LobbyFactory factory) {
        factoryRegistry.register(factory);
    }

    public List<String> getFactoryIds() {
        return factoryRegistry.getFactoryIds();
    }

    /**
     * Registers a lobby built outside of {@link #createLobby}.
     *
     * @return {@code false} if the id is already taken
     */
    public boolean addLobby(Lobby lobby) {
        return lobbyRegistry.add(lobby);
    }

    public int generateLobbyId() {
        return lobbyRegistry.generateLobbyId();
    }

    public Optional<Lobby> getLobby(int lobbyId) {
        return lobbyRegistry.get(lobbyId);
    }

    public List<Lobby> getLobbies() {
        return lobbyRegistry.getAll();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down lobby coordination ({} lobbies)", lobbyRegistry.size());
        lobbyRegistry.clear();
        contextRegistry.clear();
        factoryRegistry.clear();
    }
}
