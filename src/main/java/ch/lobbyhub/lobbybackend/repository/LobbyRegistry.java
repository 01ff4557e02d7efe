package ch.lobbyhub.lobbybackend.repository;

import ch.lobbyhub.lobbybackend.lobby.Lobby;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-memory registry of live lobbies.
 *
 * <p>Allocates lobby ids and removes a lobby as soon as it is destroyed. The
 * registry subscribes to each lobby it holds and unsubscribes on removal, so a
 * destroyed lobby keeps no reference back to the registry.
 */
@Slf4j
public class LobbyRegistry {

    private final Map<Integer, Lobby> lobbies = new ConcurrentHashMap<>();
    private final AtomicInteger nextLobbyId = new AtomicInteger();
    private final List<Consumer<Lobby>> removalListeners = new CopyOnWriteArrayList<>();

    private final Consumer<Lobby> destroyedHandler = this::onLobbyDestroyed;

    /**
     * @return a new lobby id, starting at 0 and never reused
     */
    public int generateLobbyId() {
        return nextLobbyId.getAndIncrement();
    }

    /**
     * Registers the lobby under its id.
     *
     * @return {@code false} if another lobby already holds that id; the registry is left unchanged
     */
    public boolean add(Lobby lobby) {
        Lobby existing = lobbies.putIfAbsent(lobby.getId(), lobby);
        if (existing != null) {
            log.error("Failed to add lobby {}: the id is already taken", lobby.getId());
            return false;
        }
        lobby.addDestroyedListener(destroyedHandler);

        // the lobby may have been destroyed before the listener was attached
        if (lobby.isDestroyed()) {
            onLobbyDestroyed(lobby);
        }
        return true;
    }

    public Optional<Lobby> get(int lobbyId) {
        return Optional.ofNullable(lobbies.get(lobbyId));
    }

    /**
     * @return snapshot of all registered lobbies, ordered by id
     */
    public List<Lobby> getAll() {
        List<Lobby> snapshot = new ArrayList<>(lobbies.values());
        snapshot.sort(Comparator.comparingInt(Lobby::getId));
        return snapshot;
    }

    public int size() {
        return lobbies.size();
    }

    /**
     * Registers a callback run once for every lobby that leaves the registry.
     */
    public void addRemovalListener(Consumer<Lobby> listener) {
        removalListeners.add(listener);
    }

    /**
     * Removes the lobby with the given id without destroying it. Unknown ids are ignored.
     */
    public boolean remove(int lobbyId) {
        Lobby lobby = lobbies.get(lobbyId);
        return lobby != null && remove(lobby);
    }

    /**
     * Removes the lobby without destroying it.
     */
    public boolean remove(Lobby lobby) {
        if (!lobbies.remove(lobby.getId(), lobby)) {
            return false;
        }
        lobby.removeDestroyedListener(destroyedHandler);
        removalListeners.forEach(listener -> listener.accept(lobby));
        return true;
    }

    private void onLobbyDestroyed(Lobby lobby) {
        if (remove(lobby)) {
            log.info("Lobby {} removed from registry", lobby.getId());
        }
    }

    /**
     * Destroys every registered lobby. Used on shutdown.
     */
    public void clear() {
        for (Lobby lobby : getAll()) {
            lobby.destroy();
            remove(lobby);
        }
    }
}
