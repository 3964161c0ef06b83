package com.visionai.gateway.database.single;

import com.visionai.gateway.core.model.CleanupOutcome;
import com.visionai.gateway.database.config.PrimaryDatabaseProperties;
import com.visionai.gateway.database.registry.ReadyState;
import com.visionai.gateway.testing.FakeDatabaseConnector;
import com.visionai.gateway.testing.FakeDatabaseHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class PrimaryDatabaseConnectionTest {

    private final FakeDatabaseConnector connector = new FakeDatabaseConnector();
    private VirtualTimeScheduler timer;
    private PrimaryDatabaseProperties props;

    @BeforeEach
    void setUp() {
        timer = VirtualTimeScheduler.create();
        props = new PrimaryDatabaseProperties();
        props.setUri("mongodb://primary:27017");
        props.setName("visionai");
        props.setMaxRetries(2);
        props.setBaseDelay(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        timer.dispose();
    }

    @Test
    void initializeShouldRetryWithLinearBackoff() {
        connector.failNext(PrimaryDatabaseConnection.SERVICE_NAME, 2);
        PrimaryDatabaseConnection connection = new PrimaryDatabaseConnection(connector, props, timer);

        StepVerifier.withVirtualTime(connection::initialize, () -> timer, Long.MAX_VALUE)
                .expectSubscription()
                .expectNoEvent(Duration.ofSeconds(14))
                .thenAwait(Duration.ofSeconds(1))
                .assertNext(handle -> assertThat(handle.databaseName()).isEqualTo("visionai"))
                .verifyComplete();

        assertThat(connection.getStatus().connected()).isTrue();
    }

    @Test
    void initializeShouldGiveUpAfterMaxRetries() {
        connector.failNext(PrimaryDatabaseConnection.SERVICE_NAME, 10);
        PrimaryDatabaseConnection connection = new PrimaryDatabaseConnection(connector, props, timer);

        StepVerifier.withVirtualTime(connection::initialize, () -> timer, Long.MAX_VALUE)
                .expectSubscription()
                .thenAwait(Duration.ofSeconds(15))
                .expectErrorMessage("connection refused")
                .verify();
    }

    @Test
    void lostConnectionShouldBeMarkedFailedPastTheRetryCap() {
        PrimaryDatabaseConnection connection = new PrimaryDatabaseConnection(connector, props, timer);
        FakeDatabaseHandle handle = (FakeDatabaseHandle) connection.initialize().block();
        connector.failNext(PrimaryDatabaseConnection.SERVICE_NAME, 10);

        handle.setState(ReadyState.DISCONNECTED);
        timer.advanceTimeBy(Duration.ofSeconds(4));
        assertThat(connector.openCount()).isEqualTo(1);
        assertThat(connection.getStatus().retryCount()).isEqualTo(1);

        timer.advanceTimeBy(Duration.ofSeconds(1));
        timer.advanceTimeBy(Duration.ofSeconds(10));

        PrimaryStatus status = connection.getStatus();
        assertThat(status.failed()).isTrue();
        assertThat(status.connected()).isFalse();
        StepVerifier.create(connection.healthCheck())
                .assertNext(report -> {
                    assertThat(report.status()).isEqualTo("failed");
                    assertThat(report.healthy()).isFalse();
                })
                .verifyComplete();

        timer.advanceTimeBy(Duration.ofMinutes(5));
        assertThat(connector.openCount()).isEqualTo(1);
    }

    @Test
    void successfulReconnectShouldResetTheAttemptCounter() {
        PrimaryDatabaseConnection connection = new PrimaryDatabaseConnection(connector, props, timer);
        FakeDatabaseHandle first = (FakeDatabaseHandle) connection.initialize().block();
        connector.failNext(PrimaryDatabaseConnection.SERVICE_NAME, 1);

        first.setState(ReadyState.DISCONNECTED);
        timer.advanceTimeBy(Duration.ofSeconds(5));
        assertThat(connection.getStatus().retryCount()).isEqualTo(2);
        timer.advanceTimeBy(Duration.ofSeconds(10));

        PrimaryStatus status = connection.getStatus();
        assertThat(connector.openCount()).isEqualTo(2);
        assertThat(status.connected()).isTrue();
        assertThat(status.retryCount()).isZero();
        assertThat(status.failed()).isFalse();
    }

    @Test
    void driverRecoveryBeforeTheDelayShouldNotOpenANewConnection() {
        PrimaryDatabaseConnection connection = new PrimaryDatabaseConnection(connector, props, timer);
        FakeDatabaseHandle handle = (FakeDatabaseHandle) connection.initialize().block();

        handle.setState(ReadyState.DISCONNECTED);
        handle.setState(ReadyState.CONNECTED);
        timer.advanceTimeBy(Duration.ofSeconds(5));

        assertThat(connector.openCount()).isEqualTo(1);
        assertThat(connection.getStatus().retryCount()).isZero();
    }

    @Test
    void healthCheckShouldReportPingFailureAsError() {
        PrimaryDatabaseConnection connection = new PrimaryDatabaseConnection(connector, props, timer);
        FakeDatabaseHandle handle = (FakeDatabaseHandle) connection.initialize().block();

        StepVerifier.create(connection.healthCheck())
                .assertNext(report -> {
                    assertThat(report.status()).isEqualTo("connected");
                    assertThat(report.healthy()).isTrue();
                    assertThat(report.details()).containsEntry("database", "visionai");
                })
                .verifyComplete();

        handle.failPingWith(new IllegalStateException("not primary"));
        StepVerifier.create(connection.healthCheck())
                .assertNext(report -> {
                    assertThat(report.status()).isEqualTo("error");
                    assertThat(report.details()).containsEntry("error", "not primary");
                })
                .verifyComplete();
    }

    @Test
    void explicitDisconnectShouldSuppressReconnects() {
        PrimaryDatabaseConnection connection = new PrimaryDatabaseConnection(connector, props, timer);
        FakeDatabaseHandle handle = (FakeDatabaseHandle) connection.initialize().block();

        CleanupOutcome outcome = connection.disconnect().block();
        timer.advanceTimeBy(Duration.ofMinutes(1));

        assertThat(outcome.succeeded()).isTrue();
        assertThat(handle.closeCalls()).isEqualTo(1);
        assertThat(connector.openCount()).isEqualTo(1);
        assertThat(connection.getStatus().readyState()).isEqualTo("disconnected");
    }
}
