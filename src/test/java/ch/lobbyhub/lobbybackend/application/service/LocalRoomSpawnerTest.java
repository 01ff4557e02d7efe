package ch.lobbyhub.lobbybackend.application.service;

import ch.lobbyhub.lobbybackend.domain.GameServerInfo;
import ch.lobbyhub.lobbybackend.lobby.Lobby;
import ch.lobbyhub.lobbybackend.service.LocalRoomSpawner;
import ch.lobbyhub.lobbybackend.web.api.dto.RoomAccessDto;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

class LocalRoomSpawnerTest {

    private final Lobby lobby = mock(Lobby.class);

    @Test
    void provision_shouldHandOutDistinctPorts_untilRangeIsExhausted() throws Exception {
        LocalRoomSpawner spawner = new LocalRoomSpawner("10.0.0.5", 9000, 2);

        GameServerInfo first = spawner.provision(lobby).get();
        GameServerInfo second = spawner.provision(lobby).get();
        CompletableFuture<GameServerInfo> third = spawner.provision(lobby);

        assertThat(first.ip()).isEqualTo("10.0.0.5");
        assertThat(first.port()).isEqualTo(9000);
        assertThat(second.port()).isEqualTo(9001);
        assertThat(third).isCompletedExceptionally();
        ExecutionException e = assertThrows(ExecutionException.class, third::get);
        assertThat(e.getCause()).hasMessage("No free game server available");
    }

    @Test
    void release_shouldFreePortForNextLobby() throws Exception {
        LocalRoomSpawner spawner = new LocalRoomSpawner("127.0.0.1", 9000, 1);
        GameServerInfo server = spawner.provision(lobby).get();

        spawner.release(server);
        spawner.release(server);

        assertThat(spawner.getRoomsInUse()).isZero();
        assertThat(spawner.provision(lobby).get().port()).isEqualTo(9000);
    }

    @Test
    void requestAccess_shouldIssueTokenForMember() {
        LocalRoomSpawner spawner = new LocalRoomSpawner("127.0.0.1", 9000, 1);
        GameServerInfo server = new GameServerInfo("room-1", "127.0.0.1", 9000);

        RoomAccessDto first = spawner.requestAccess(server, "Alice");
        RoomAccessDto second = spawner.requestAccess(server, "Alice");

        assertThat(first.roomId()).isEqualTo("room-1");
        assertThat(first.roomPort()).isEqualTo(9000);
        assertThat(first.username()).isEqualTo("Alice");
        assertThat(first.token()).isNotBlank().isNotEqualTo(second.token());
    }
}
