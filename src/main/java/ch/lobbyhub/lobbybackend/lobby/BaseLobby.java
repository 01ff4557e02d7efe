package ch.lobbyhub.lobbybackend.lobby;

import ch.lobbyhub.lobbybackend.domain.GameServerInfo;
import ch.lobbyhub.lobbybackend.domain.LobbyConfig;
import ch.lobbyhub.lobbybackend.domain.LobbyException;
import ch.lobbyhub.lobbybackend.domain.LobbyMember;
import ch.lobbyhub.lobbybackend.domain.LobbyPeer;
import ch.lobbyhub.lobbybackend.domain.LobbyTeam;
import ch.lobbyhub.lobbybackend.domain.LobbyUserContext;
import ch.lobbyhub.lobbybackend.domain.enums.LobbyErrorType;
import ch.lobbyhub.lobbybackend.domain.enums.LobbyState;
import ch.lobbyhub.lobbybackend.service.LobbyEventPublisher;
import ch.lobbyhub.lobbybackend.service.RoomSpawner;
import ch.lobbyhub.lobbybackend.web.api.dto.LobbyChatMessageDto;
import ch.lobbyhub.lobbybackend.web.api.dto.LobbyDataDto;
import ch.lobbyhub.lobbybackend.web.api.dto.LobbyEventDto;
import ch.lobbyhub.lobbybackend.web.api.dto.RoomAccessDto;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Lobby protocol shared by all lobby types.
 *
 * <p>Implements membership, properties, teams, readiness and the state machine
 * {@code FORMING → STARTING → IN_PROGRESS → DESTROYED}. Subclasses customize the
 * rules through the validation hooks ({@link #isLobbyPropertyValid},
 * {@link #isPlayerPropertyValid}, {@link #isPlayerAllowedToJoinTeam}) and team
 * assignment ({@link #pickTeamForPlayer}).
 *
 * <p>Every mutation runs under one lock per lobby. Unrelated lobbies never
 * contend, and concurrent requests against the same lobby observe a consistent
 * before/after state. The lock is not held while waiting for the room spawner
 * or while notifying destroyed listeners.
 *
 * <p>The game master is the member allowed to start the game: the first member
 * to join (normally the creator). When the master leaves, the member that has
 * been in the lobby the longest takes over.
 */
@Slf4j
public abstract class BaseLobby implements Lobby {

    private final int id;
    private final String type;
    private final String name;
    private final LobbyConfig config;
    private final LobbyEventPublisher eventPublisher;
    private final RoomSpawner roomSpawner;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Integer, LobbyMember> members = new LinkedHashMap<>();
    private final Map<String, LobbyTeam> teams = new LinkedHashMap<>();
    private final Map<String, String> properties = new LinkedHashMap<>();
    private final List<Consumer<Lobby>> destroyedListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean destroyed = new AtomicBoolean();

    private volatile LobbyState state = LobbyState.FORMING;
    private volatile LobbyMember gameMaster;
    private volatile GameServerInfo gameServer;
    private volatile Instant emptySince = Instant.now();

    protected BaseLobby(int id,
                        String type,
                        String name,
                        LobbyConfig config,
                        LobbyEventPublisher eventPublisher,
                        RoomSpawner roomSpawner) {
        this.id = id;
        this.type = type;
        this.name = name;
        this.config = config;
        this.eventPublisher = eventPublisher;
        this.roomSpawner = roomSpawner;
    }

    // ------------------------------------------------------------------------------------
    // Read access
    // ------------------------------------------------------------------------------------

    @Override
    public int getId() {
        return id;
    }

    @Override
    public String getType() {
        return type;
    }

    @Override
    public String getName() {
        return name;
    }

    public LobbyConfig getConfig() {
        return config;
    }

    @Override
    public int getMaxPlayers() {
        return config.getMaxPlayers();
    }

    @Override
    public int getPlayerCount() {
        lock.lock();
        try {
            return members.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String getGameIp() {
        GameServerInfo server = gameServer;
        return server != null ? server.ip() : null;
    }

    @Override
    public int getGamePort() {
        GameServerInfo server = gameServer;
        return server != null ? server.port() : 0;
    }

    @Override
    public LobbyState getState() {
        return state;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed.get();
    }

    @Override
    public Optional<Instant> getEmptySince() {
        lock.lock();
        try {
            return Optional.ofNullable(emptySince);
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> getGameMasterName() {
        LobbyMember master = gameMaster;
        return Optional.ofNullable(master).map(LobbyMember::getUsername);
    }

    @Override
    public Optional<LobbyMember> getMember(LobbyUserContext context) {
        return getMemberByPeerId(context.getPeerId());
    }

    @Override
    public Optional<LobbyMember> getMemberByPeerId(int peerId) {
        lock.lock();
        try {
            return Optional.ofNullable(members.get(peerId));
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------------------------
    // Membership
    // ------------------------------------------------------------------------------------

    @Override
    public void addPlayer(LobbyUserContext context) {
        lock.lock();
        try {
            if (state == LobbyState.DESTROYED) {
                throw new LobbyException(LobbyErrorType.NOT_FOUND, "Lobby was not found");
            }
            if (members.containsKey(context.getPeerId())) {
                throw new LobbyException(LobbyErrorType.CONFLICT, "You're already in this lobby");
            }
            boolean joinable = state == LobbyState.FORMING
                    || (state == LobbyState.IN_PROGRESS && config.isAllowJoiningWhenGameIsLive());
            if (!joinable) {
                throw new LobbyException(LobbyErrorType.CONFLICT, "Game has already started");
            }
            if (members.size() >= getMaxPlayers()) {
                throw new LobbyException(LobbyErrorType.CONFLICT, "Lobby is full");
            }

            LobbyMember member = new LobbyMember(context.getPeerId(), context.getUsername());

            LobbyTeam team = null;
            if (!teams.isEmpty()) {
                team = pickTeamForPlayer(member)
                        .orElseThrow(() -> new LobbyException(LobbyErrorType.CONFLICT, "No team has a free slot"));
            }

            if (!context.tryAttach(id)) {
                throw new LobbyException(LobbyErrorType.CONFLICT, "You're already in a lobby");
            }

            members.put(member.getPeerId(), member);
            if (team != null) {
                team.addMember(member);
                member.setTeam(team.getName());
            }
            emptySince = null;

            log.info("Player {} joined lobby {} ({}/{})", member.getUsername(), id, members.size(), getMaxPlayers());
            eventPublisher.publishEvent(LobbyEventDto.memberJoined(id, state, member));

            if (gameMaster == null) {
                pickNewGameMaster();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void removePlayer(LobbyUserContext context) {
        boolean destroyedNow = false;

        lock.lock();
        try {
            context.detach(id);

            LobbyMember member = members.remove(context.getPeerId());
            if (member == null) {
                return;
            }

            if (member.getTeam() != null) {
                LobbyTeam team = teams.get(member.getTeam());
                if (team != null) {
                    team.removeMember(member);
                }
                member.setTeam(null);
            }

            log.info("Player {} left lobby {}", member.getUsername(), id);
            eventPublisher.publishEvent(LobbyEventDto.memberLeft(id, state, member));

            if (member == gameMaster) {
                pickNewGameMaster();
            }

            if (members.isEmpty()) {
                emptySince = Instant.now();
                // decided under the lock so a racing join sees DESTROYED
                destroyedNow = shouldDestroyWhenEmpty() && markDestroyed();
            }
        } finally {
            lock.unlock();
        }

        if (destroyedNow) {
            finishDestroy();
        }
    }

    private void pickNewGameMaster() {
        LobbyMember next = members.values().stream()
                .min(Comparator.comparing(LobbyMember::getJoinedAt))
                .orElse(null);
        if (next == gameMaster) {
            return;
        }
        gameMaster = next;
        eventPublisher.publishEvent(LobbyEventDto.masterChanged(id, state, next));
    }

    // ------------------------------------------------------------------------------------
    // Properties
    // ------------------------------------------------------------------------------------

    /**
     * Applies creation options as lobby properties, before the lobby is registered.
     */
    void initProperties(Map<String, String> initialProperties) {
        lock.lock();
        try {
            for (Map.Entry<String, String> entry : initialProperties.entrySet()) {
                if (!isLobbyPropertyValid(entry.getKey(), entry.getValue())) {
                    throw new LobbyException(LobbyErrorType.INVALID_REQUEST,
                            "Invalid lobby option: " + entry.getKey());
                }
                properties.put(entry.getKey(), entry.getValue());
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean setProperty(LobbyUserContext setter, String key, String value) {
        lock.lock();
        try {
            if (state == LobbyState.DESTROYED) {
                return false;
            }

            LobbyMember member = members.get(setter.getPeerId());
            if (member == null) {
                log.debug("Rejected property {} in lobby {}: {} is not a member", key, id, setter.getUsername());
                return false;
            }

            if (!config.isAllowPlayersChangeLobbyProperties() && member != gameMaster) {
                log.debug("Rejected property {} in lobby {}: {} is not the game master", key, id, member.getUsername());
                return false;
            }

            if (!isLobbyPropertyValid(key, value)) {
                return false;
            }

            properties.put(key, value);
            eventPublisher.publishEvent(LobbyEventDto.propertyChanged(id, state, key, value));
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> getProperty(String key) {
        lock.lock();
        try {
            return Optional.ofNullable(properties.get(key));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean setPlayerProperty(LobbyMember member, String key, String value) {
        lock.lock();
        try {
            if (member == null || members.get(member.getPeerId()) != member) {
                return false;
            }

            if (!isPlayerPropertyValid(member, key, value)) {
                return false;
            }

            member.setProperty(key, value);
            eventPublisher.publishEvent(LobbyEventDto.memberPropertyChanged(id, state, member, key, value));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, String> getPublicProperties(LobbyPeer requester) {
        lock.lock();
        try {
            Map<String, String> visible = new LinkedHashMap<>(properties);
            visible.keySet().removeAll(config.getPrivatePropertyKeys());
            return visible;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Validation hook for lobby-level properties.
     *
     * <p>Rejects blank keys, missing or over-long values and non-integer values
     * for the configured numeric keys.
     */
    protected boolean isLobbyPropertyValid(String key, String value) {
        if (!isWellFormed(key, value)) {
            return false;
        }
        return !config.getNumericPropertyKeys().contains(key) || isInteger(value);
    }

    /**
     * Validation hook for member-level properties.
     */
    protected boolean isPlayerPropertyValid(LobbyMember member, String key, String value) {
        return isWellFormed(key, value);
    }

    private boolean isWellFormed(String key, String value) {
        return key != null
                && !key.isBlank()
                && value != null
                && value.length() <= config.getMaxPropertyValueLength();
    }

    protected static boolean isInteger(String value) {
        try {
            Integer.parseInt(value.strip());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    // ------------------------------------------------------------------------------------
    // Readiness and teams
    // ------------------------------------------------------------------------------------

    @Override
    public void setReadyState(LobbyMember member, boolean ready) {
        boolean starting = false;

        lock.lock();
        try {
            if (member == null || members.get(member.getPeerId()) != member) {
                return;
            }

            member.setReady(ready);
            eventPublisher.publishEvent(LobbyEventDto.memberReadyChanged(id, state, member));

            if (ready
                    && config.isStartGameWhenAllReady()
                    && state == LobbyState.FORMING
                    && members.size() >= config.getMinPlayers()
                    && allMembersReady()) {
                try {
                    beginStart();
                    starting = true;
                } catch (LobbyException e) {
                    log.warn("Automatic start of lobby {} failed: {}", id, e.getMessage());
                }
            }
        } finally {
            lock.unlock();
        }

        if (starting) {
            try {
                provisionGameServer();
            } catch (LobbyException e) {
                log.warn("Automatic start of lobby {} failed: {}", id, e.getMessage());
            }
        }
    }

    private boolean allMembersReady() {
        return !members.isEmpty() && members.values().stream().allMatch(LobbyMember::isReady);
    }

    @Override
    public boolean tryJoinTeam(String teamName, LobbyMember member) {
        lock.lock();
        try {
            if (!config.isEnableTeamSwitching() || state != LobbyState.FORMING) {
                return false;
            }
            if (member == null || members.get(member.getPeerId()) != member) {
                return false;
            }

            LobbyTeam newTeam = teamName != null ? teams.get(teamName) : null;
            if (newTeam == null) {
                return false;
            }
            if (newTeam.hasMember(member)) {
                return true;
            }
            if (newTeam.isFull() || !isPlayerAllowedToJoinTeam(member, newTeam)) {
                return false;
            }

            LobbyTeam currentTeam = member.getTeam() != null ? teams.get(member.getTeam()) : null;
            if (currentTeam != null) {
                currentTeam.removeMember(member);
            }
            newTeam.addMember(member);
            member.setTeam(newTeam.getName());
            eventPublisher.publishEvent(LobbyEventDto.memberTeamChanged(id, state, member));

            // a ready flag given for the old team does not carry over
            if (config.isEnableReadySystem() && member.isReady()) {
                member.setReady(false);
                eventPublisher.publishEvent(LobbyEventDto.memberReadyChanged(id, state, member));
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers a team. Intended for subclass constructors.
     */
    protected final void addTeam(LobbyTeam team) {
        lock.lock();
        try {
            teams.put(team.getName(), team);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Teams of this lobby. Only safe to use while the caller holds the lobby lock,
     * which is the case inside every hook.
     */
    protected final Collection<LobbyTeam> teams() {
        return teams.values();
    }

    /**
     * Picks the team a new member is placed in. Only called for lobbies with teams.
     */
    protected Optional<LobbyTeam> pickTeamForPlayer(LobbyMember member) {
        return Optional.empty();
    }

    protected boolean isPlayerAllowedToJoinTeam(LobbyMember member, LobbyTeam team) {
        return true;
    }

    // ------------------------------------------------------------------------------------
    // Game start
    // ------------------------------------------------------------------------------------

    @Override
    public void startGameManually(LobbyUserContext context) {
        lock.lock();
        try {
            LobbyMember member = members.get(context.getPeerId());
            if (member == null || member != gameMaster) {
                throw new LobbyException(LobbyErrorType.UNAUTHORIZED, "Only the game master can start the game");
            }
            if (!config.isEnableManualStart()) {
                throw new LobbyException(LobbyErrorType.CONFLICT, "Manual start is disabled for this lobby");
            }
            beginStart();
        } finally {
            lock.unlock();
        }

        provisionGameServer();
    }

    /**
     * Validates the start preconditions and moves the lobby to {@link LobbyState#STARTING}.
     *
     * <p>Must be called under the lobby lock. A lobby that is already starting
     * rejects further start requests through the state check.
     */
    private void beginStart() {
        if (state != LobbyState.FORMING) {
            throw new LobbyException(LobbyErrorType.CONFLICT, "Game cannot be started while lobby is " + state);
        }
        if (members.size() < config.getMinPlayers()) {
            throw new LobbyException(LobbyErrorType.CONFLICT,
                    "Not enough players (" + members.size() + "/" + config.getMinPlayers() + ")");
        }
        for (LobbyTeam team : teams.values()) {
            if (team.getPlayerCount() < team.getMinPlayers()) {
                throw new LobbyException(LobbyErrorType.CONFLICT,
                        "Team " + team.getName() + " needs at least " + team.getMinPlayers() + " players");
            }
        }
        if (config.isEnableReadySystem() && !allMembersReady()) {
            throw new LobbyException(LobbyErrorType.CONFLICT, "Not all players are ready");
        }

        changeState(LobbyState.STARTING);
    }

    /**
     * Provisions the game server for a lobby in {@link LobbyState#STARTING}.
     *
     * <p>Runs without the lobby lock, so snapshots and discovery stay responsive
     * while the spawner works. The spawner is awaited for at most
     * {@link LobbyConfig#getStartTimeout()}; on failure or timeout the lobby
     * returns to {@link LobbyState#FORMING} and the cause is reported as
     * {@link LobbyErrorType#INTERNAL_ERROR}.
     */
    private void provisionGameServer() {
        CompletableFuture<GameServerInfo> provisioning = null;
        GameServerInfo server;
        try {
            provisioning = roomSpawner.provision(this);
            server = provisioning.get(config.getStartTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            provisioning.cancel(true);
            throw abortStart("Game server provisioning timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            provisioning.cancel(true);
            throw abortStart("Game start was interrupted", e);
        } catch (ExecutionException e) {
            String reason = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
            throw abortStart("Failed to start game server: " + reason, e);
        } catch (RuntimeException e) {
            throw abortStart("Failed to start game server: " + e.getMessage(), e);
        }

        if (server == null) {
            throw abortStart("Room spawner returned no game server", null);
        }

        boolean committed;
        lock.lock();
        try {
            committed = state == LobbyState.STARTING;
            if (committed) {
                gameServer = server;
                changeState(LobbyState.IN_PROGRESS);
            }
        } finally {
            lock.unlock();
        }

        if (!committed) {
            roomSpawner.release(server);
            throw new LobbyException(LobbyErrorType.NOT_FOUND, "Lobby was destroyed while starting");
        }
        log.info("Lobby {} started game on {}:{}", id, server.ip(), server.port());
    }

    private LobbyException abortStart(String reason, Exception cause) {
        log.warn("Start of lobby {} aborted: {}", id, reason);
        lock.lock();
        try {
            if (state == LobbyState.STARTING) {
                changeState(LobbyState.FORMING);
            }
        } finally {
            lock.unlock();
        }
        return new LobbyException(LobbyErrorType.INTERNAL_ERROR, reason, cause);
    }

    private void changeState(LobbyState newState) {
        LobbyState previous = state;
        if (previous == newState) {
            return;
        }
        state = newState;
        eventPublisher.publishEvent(LobbyEventDto.stateChanged(id, previous, newState));
    }

    @Override
    public RoomAccessDto gameAccessRequestHandler(LobbyUserContext context) {
        LobbyMember member;
        GameServerInfo server;

        lock.lock();
        try {
            member = members.get(context.getPeerId());
            if (member == null) {
                throw new LobbyException(LobbyErrorType.NOT_FOUND, "You're not in this lobby");
            }
            server = gameServer;
            if (state != LobbyState.IN_PROGRESS || server == null) {
                throw new LobbyException(LobbyErrorType.CONFLICT, "Game is not running");
            }
        } finally {
            lock.unlock();
        }

        try {
            return roomSpawner.requestAccess(server, member.getUsername());
        } catch (RuntimeException e) {
            throw new LobbyException(LobbyErrorType.INTERNAL_ERROR, "Failed to get room access: " + e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------------------------
    // Snapshots and chat
    // ------------------------------------------------------------------------------------

    @Override
    public LobbyDataDto generateLobbyData(LobbyUserContext requester) {
        lock.lock();
        try {
            String currentUsername = null;
            if (requester != null) {
                LobbyMember self = members.get(requester.getPeerId());
                currentUsername = self != null ? self.getUsername() : null;
            }

            return new LobbyDataDto(
                    id,
                    type,
                    name,
                    state,
                    gameMaster != null ? gameMaster.getUsername() : null,
                    config.getMinPlayers(),
                    getMaxPlayers(),
                    members.size(),
                    new LinkedHashMap<>(properties),
                    members.values().stream().map(LobbyMember::generateDataPacket).toList(),
                    teams.values().stream().map(LobbyTeam::toDto).toList(),
                    config.isEnableReadySystem(),
                    config.isEnableManualStart(),
                    currentUsername
            );
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void chatMessageHandler(LobbyMember member, String message) {
        if (message == null || message.isBlank()) {
            return;
        }

        lock.lock();
        try {
            if (member == null || members.get(member.getPeerId()) != member) {
                log.debug("Dropped chat message for lobby {} from a non-member", id);
                return;
            }
        } finally {
            lock.unlock();
        }

        String text = message.strip();
        if (text.length() > config.getMaxChatMessageLength()) {
            text = text.substring(0, config.getMaxChatMessageLength());
        }

        eventPublisher.publishChatMessage(new LobbyChatMessageDto(id, member.getUsername(), text, Instant.now()));
    }

    // ------------------------------------------------------------------------------------
    // Destruction
    // ------------------------------------------------------------------------------------

    /**
     * Destroy policy applied when the last member leaves.
     */
    protected boolean shouldDestroyWhenEmpty() {
        return true;
    }

    @Override
    public void addDestroyedListener(Consumer<Lobby> listener) {
        destroyedListeners.add(listener);
    }

    @Override
    public void removeDestroyedListener(Consumer<Lobby> listener) {
        destroyedListeners.remove(listener);
    }

    @Override
    public void destroy() {
        boolean destroyedNow;
        lock.lock();
        try {
            destroyedNow = markDestroyed();
        } finally {
            lock.unlock();
        }

        if (destroyedNow) {
            finishDestroy();
        }
    }

    @Override
    public boolean destroyIfEmptySince(Instant threshold) {
        lock.lock();
        try {
            if (!members.isEmpty() || emptySince == null || emptySince.isAfter(threshold) || !markDestroyed()) {
                return false;
            }
        } finally {
            lock.unlock();
        }

        finishDestroy();
        return true;
    }

    /**
     * Switches to {@link LobbyState#DESTROYED} and drops all members. Must be called
     * under the lobby lock.
     *
     * @return {@code false} if the lobby was already destroyed
     */
    private boolean markDestroyed() {
        if (!destroyed.compareAndSet(false, true)) {
            return false;
        }

        LobbyState previous = state;
        state = LobbyState.DESTROYED;
        teams.values().forEach(team -> team.getMembers().clear());
        members.clear();
        gameMaster = null;
        log.info("Lobby {} destroyed (was {})", id, previous);
        eventPublisher.publishEvent(LobbyEventDto.lobbyDestroyed(id));
        return true;
    }

    /**
     * Releases the game server and notifies the destroyed listeners, outside the lobby lock.
     */
    private void finishDestroy() {
        GameServerInfo server = gameServer;
        if (server != null) {
            roomSpawner.release(server);
        }

        for (Consumer<Lobby> listener : destroyedListeners) {
            try {
                listener.accept(this);
            } catch (RuntimeException e) {
                log.error("Destroyed listener failed for lobby {}", id, e);
            }
        }
    }
}
