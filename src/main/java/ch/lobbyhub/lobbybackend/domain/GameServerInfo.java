package ch.lobbyhub.lobbybackend.domain;

/**
 * Connection details of a provisioned game server.
 *
 * @param roomId id assigned by the room spawner
 * @param ip     address clients connect to
 * @param port   port clients connect to
 */
public record GameServerInfo(
        String roomId,
        String ip,
        int port
) {}
