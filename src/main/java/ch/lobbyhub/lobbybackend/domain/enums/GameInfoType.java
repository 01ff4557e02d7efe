package ch.lobbyhub.lobbybackend.domain.enums;

/**
 * Kind of entry listed in the public game-discovery feed.
 */
public enum GameInfoType {

    /**
     * Entry backed by a live lobby (the only source this backend lists).
     */
    LOBBY
}
