package ch.mudcore.mudcorebackend.web.api.controller;

import ch.mudcore.mudcorebackend.service.session.SessionRegistry;
import ch.mudcore.mudcorebackend.service.user.UserStore;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness endpoint for container probes and quick manual checks.
 *
 * <p>Does not touch any backend; reports only what is already held in memory.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HealthController {

    private final UserStore userStore;
    private final SessionRegistry sessionRegistry;

    /**
     * @return {@code status: OK} plus the number of known users and live sessions
     */
    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of(
                "status", "OK",
                "users", userStore.size(),
                "sessions", sessionRegistry.getAllActiveSessions().size()
        );
    }
}
