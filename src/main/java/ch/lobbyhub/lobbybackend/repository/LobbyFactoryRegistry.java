package ch.lobbyhub.lobbybackend.repository;

import ch.lobbyhub.lobbybackend.lobby.LobbyFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lobby factories by id. Registering an id twice replaces the earlier factory.
 */
@Slf4j
public class LobbyFactoryRegistry {

    private final Map<String, LobbyFactory> factories = new ConcurrentHashMap<>();

    public void register(LobbyFactory factory) {
        LobbyFactory previous = factories.put(factory.getId(), factory);
        if (previous != null && previous != factory) {
            log.warn("Lobby factory '{}' was replaced by {}", factory.getId(), factory.getClass().getSimpleName());
        } else {
            log.info("Registered lobby factory '{}'", factory.getId());
        }
    }

    public Optional<LobbyFactory> resolve(String factoryId) {
        if (factoryId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(factories.get(factoryId));
    }

    public List<String> getFactoryIds() {
        return factories.keySet().stream().sorted().toList();
    }

    public void clear() {
        factories.clear();
    }
}
