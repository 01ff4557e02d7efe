package ch.lobbyhub.lobbybackend.web.api.dto;

/**
 * Ready flag sent as an integer: any value above zero means ready.
 */
public record SetReadyRequest(
        int ready
) {
    public boolean isReady() {
        return ready > 0;
    }
}
