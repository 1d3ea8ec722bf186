package ch.mudcore.mudcorebackend.application.service;

import ch.mudcore.mudcorebackend.domain.PlayerRecord;
import ch.mudcore.mudcorebackend.domain.enums.LoginOutcome;
import ch.mudcore.mudcorebackend.domain.enums.TransferPhase;
import ch.mudcore.mudcorebackend.service.auth.PasswordAuthenticator;
import ch.mudcore.mudcorebackend.service.session.LoginService;
import ch.mudcore.mudcorebackend.service.session.SessionRegistry;
import ch.mudcore.mudcorebackend.service.session.TransferCoordinator;
import ch.mudcore.mudcorebackend.service.user.UserStore;
import ch.mudcore.mudcorebackend.testutil.FakeGameConnection;
import ch.mudcore.mudcorebackend.testutil.MutableClock;
import ch.mudcore.mudcorebackend.testutil.PlayerFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link LoginService} wired to a real {@link SessionRegistry} and
 * {@link TransferCoordinator}.
 *
 * <p>Focus areas:
 * <ul>
 *   <li>Login outcomes: invalid, direct bind, transfer requested, transfer rejected</li>
 *   <li>Disconnect of the bound connection, a waiting newcomer and a superseded owner</li>
 *   <li>Play time accounting on disconnect, including the handover window of a transfer</li>
 * </ul>
 *
 * <p>Notes:
 * <ul>
 *   <li>Time is driven by a {@link MutableClock}, so play time assertions are exact</li>
 * </ul>
 */
@ExtendWith(MockitoExtension.class)
class LoginServiceTest {

    @Mock
    private PasswordAuthenticator authenticator;

    @Mock
    private UserStore userStore;

    @Mock
    private TaskScheduler taskScheduler;

    private MutableClock clock;
    private SessionRegistry registry;
    private TransferCoordinator coordinator;
    private LoginService loginService;

    private PlayerRecord alice;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        registry = new SessionRegistry();
        coordinator = new TransferCoordinator(userStore, registry, Optional.empty(), taskScheduler, clock);
        loginService = new LoginService(authenticator, userStore, registry, coordinator, clock);

        alice = PlayerFixtures.player("alice");
        lenient().when(userStore.getUser("alice")).thenReturn(Optional.of(alice));
        lenient().when(authenticator.authenticate(anyString(), eq("secret"))).thenReturn(true);
    }

    // ------------------------------------------------------------------------------------
    // login
    // ------------------------------------------------------------------------------------

    @Test
    void login_shouldReturnInvalidCredentials_whenPasswordWrong() {
        FakeGameConnection connection = new FakeGameConnection("telnet:1");

        LoginOutcome outcome = loginService.login("alice", "wrong", connection);

        assertThat(outcome).isEqualTo(LoginOutcome.INVALID_CREDENTIALS);
        assertThat(registry.isActive("alice")).isFalse();
        assertThat(connection.isAuthenticated()).isFalse();
    }

    @Test
    void login_shouldBindDirectly_whenIdentityFree() {
        // Arrange
        FakeGameConnection connection = new FakeGameConnection("telnet:1");

        // Act
        LoginOutcome outcome = loginService.login("Alice", "secret", connection);

        // Assert
        assertThat(outcome).isEqualTo(LoginOutcome.LOGGED_IN);
        assertThat(registry.getActiveSession("alice")).containsSame(connection);
        assertThat(connection.isAuthenticated()).isTrue();
        assertThat(connection.getPlayer()).isNotSameAs(alice);
        assertThat(connection.getPlayer().getUsername()).isEqualTo("alice");
        verify(userStore).updateLastLogin("alice");
    }

    @Test
    void login_shouldRequestTransfer_whenIdentityBound_andRejectThirdLogin() {
        FakeGameConnection first = new FakeGameConnection("telnet:1");
        FakeGameConnection second = new FakeGameConnection("ws:2");
        FakeGameConnection third = new FakeGameConnection("telnet:3");

        assertThat(loginService.login("alice", "secret", first)).isEqualTo(LoginOutcome.LOGGED_IN);
        assertThat(loginService.login("alice", "secret", second)).isEqualTo(LoginOutcome.TRANSFER_REQUESTED);
        assertThat(loginService.login("alice", "secret", third)).isEqualTo(LoginOutcome.TRANSFER_REJECTED);

        assertThat(coordinator.phaseOf("alice")).isEqualTo(TransferPhase.TRANSFER_PENDING);
        assertThat(registry.getPendingTransfer("alice").orElseThrow().incoming()).isSameAs(second);
    }

    // ------------------------------------------------------------------------------------
    // disconnect
    // ------------------------------------------------------------------------------------

    @Test
    void disconnect_shouldUnregisterBoundConnection_andRecordPlayTime() {
        FakeGameConnection connection = new FakeGameConnection("telnet:1");
        loginService.login("alice", "secret", connection);
        clock.advance(Duration.ofMinutes(5));

        loginService.disconnect(connection);

        assertThat(registry.isActive("alice")).isFalse();
        verify(userStore).updateTotalPlayTime("alice", 300L);
    }

    @Test
    void disconnect_ofWaitingNewcomer_shouldCancelTransfer_andKeepOwner() {
        // Arrange
        FakeGameConnection owner = new FakeGameConnection("telnet:1");
        FakeGameConnection newcomer = new FakeGameConnection("ws:2");
        loginService.login("alice", "secret", owner);
        loginService.login("alice", "secret", newcomer);

        // Act
        loginService.disconnect(newcomer);

        // Assert
        assertThat(coordinator.phaseOf("alice")).isEqualTo(TransferPhase.ACTIVE);
        assertThat(registry.getActiveSession("alice")).containsSame(owner);
        verify(userStore, never()).updateTotalPlayTime(anyString(), anyLong());
    }

    @Test
    void disconnect_ofSupersededOwner_shouldNotUnregisterLiveSession() {
        // Arrange: alice logs in twice, the owner approves
        FakeGameConnection owner = new FakeGameConnection("telnet:1");
        FakeGameConnection newcomer = new FakeGameConnection("ws:2");
        loginService.login("alice", "secret", owner);
        loginService.login("alice", "secret", newcomer);
        coordinator.resolveTransfer("alice", true);

        ArgumentCaptor<Runnable> teardown = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(teardown.capture(), any(Instant.class));
        teardown.getValue().run();

        // Act: the transport reports the closed old connection
        loginService.disconnect(owner);

        // Assert
        assertThat(registry.getActiveSession("alice")).containsSame(newcomer);
        verify(userStore).updateTotalPlayTime(eq("alice"), anyLong());
    }

    @Test
    void disconnect_afterTransfer_shouldCountHandoverWindowOnlyOnce() {
        // Arrange: owner plays 60s, newcomer waits 30s for the decision
        FakeGameConnection owner = new FakeGameConnection("telnet:1");
        FakeGameConnection newcomer = new FakeGameConnection("ws:2");
        loginService.login("alice", "secret", owner);
        clock.advance(Duration.ofSeconds(60));
        loginService.login("alice", "secret", newcomer);
        clock.advance(Duration.ofSeconds(30));
        coordinator.resolveTransfer("alice", true);

        // Act: old connection closes after the grace delay, newcomer plays on for 100s
        clock.advance(Duration.ofSeconds(7));
        ArgumentCaptor<Runnable> teardown = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(teardown.capture(), any(Instant.class));
        teardown.getValue().run();
        loginService.disconnect(owner);

        clock.advance(Duration.ofSeconds(93));
        loginService.disconnect(newcomer);

        // Assert: 90s up to the handover, 100s after it
        verify(userStore).updateTotalPlayTime("alice", 90L);
        verify(userStore).updateTotalPlayTime("alice", 100L);
        assertThat(registry.isActive("alice")).isFalse();
    }
}
