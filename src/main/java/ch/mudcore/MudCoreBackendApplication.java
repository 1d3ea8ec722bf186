package ch.mudcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the MudCore identity backend.
 *
 * <p>Enables:
 * <ul>
 *   <li>Spring Boot auto-configuration</li>
 *   <li>Component scanning for the entire application</li>
 *   <li>Scheduled task execution ({@code @EnableScheduling}) for the periodic player save
 *       and the delayed teardown of superseded connections</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class MudCoreBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(MudCoreBackendApplication.class, args);
    }

}
