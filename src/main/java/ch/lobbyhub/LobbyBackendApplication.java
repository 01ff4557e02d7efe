package ch.lobbyhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Lobby backend. Scheduling is enabled for the empty-lobby sweep.
 */
@SpringBootApplication
@EnableScheduling
public class LobbyBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(LobbyBackendApplication.class, args);
    }
}
