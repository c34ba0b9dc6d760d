package in.receipttrack.bootstrap;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Tests for RelayConfig loading and StartupConfigValidator.
 */
class StartupConfigValidatorTest {

    @AfterEach
    void tearDown() {
        System.clearProperty("RELAY_PORT");
        System.clearProperty("CHANNEL_MODE");
        System.clearProperty("RELAY_OUTBOUND_QUEUE_CAPACITY");
    }

    @Test
    void testDefaults() {
        RelayConfig config = RelayConfig.fromEnv();

        // Skip when the build environment itself sets relay variables
        if (System.getenv("RELAY_PORT") == null) {
            assertEquals(8765, config.port());
        }
        if (System.getenv("PUBSUB_SUBSCRIPTION_ID") == null) {
            assertEquals("webapp-sub", config.subscriptionId());
        }
        if (System.getenv("RELAY_PING_INTERVAL_MS") == null) {
            assertEquals(Duration.ofSeconds(30), config.pingInterval());
        }
        assertDoesNotThrow(() -> StartupConfigValidator.validate(config));
    }

    @Test
    void testOverridesFromProperties() {
        assumeUnsetInEnvironment("RELAY_PORT", "CHANNEL_MODE", "RELAY_OUTBOUND_QUEUE_CAPACITY");
        System.setProperty("RELAY_PORT", "9000");
        System.setProperty("CHANNEL_MODE", "Memory");
        System.setProperty("RELAY_OUTBOUND_QUEUE_CAPACITY", "8");

        RelayConfig config = RelayConfig.fromEnv();

        assertEquals(9000, config.port());
        assertEquals(RelayConfig.ChannelMode.MEMORY, config.channelMode());
        assertEquals(8, config.outboundQueueCapacity());
    }

    @Test
    void testUnknownChannelMode() {
        assumeUnsetInEnvironment("CHANNEL_MODE");
        System.setProperty("CHANNEL_MODE", "kafka");

        assertThrows(IllegalStateException.class, RelayConfig::fromEnv);
    }

    @Test
    void testValidConfigPasses() {
        assertDoesNotThrow(() -> StartupConfigValidator.validate(valid()));
    }

    @Test
    void testAllProblemsReportedTogether() {
        RelayConfig bad = new RelayConfig(
            "0.0.0.0", 70000, "ws", 0, 64,
            Duration.ofSeconds(30), Duration.ofSeconds(10),
            RelayConfig.ChannelMode.NATS,
            "receipt.tracking", "receipt-updates", "webapp-sub",
            " ", true, 32, Duration.ofMillis(500));

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(bad));

        String message = e.getMessage();
        assertTrue(message.contains("RELAY_PORT"), message);
        assertTrue(message.contains("RELAY_WS_PATH"), message);
        assertTrue(message.contains("RELAY_MAX_CONNECTIONS"), message);
        assertTrue(message.contains("RELAY_PING_TIMEOUT_MS"), message);
        assertTrue(message.contains("PUBSUB_PROJECT_ID"), message);
        assertTrue(message.contains("NATS_URL"), message);
    }

    @Test
    void testNatsUrlNotRequiredInMemoryMode() {
        RelayConfig memory = new RelayConfig(
            "127.0.0.1", 0, "/", 10, 4,
            Duration.ofMillis(100), Duration.ofMillis(200),
            RelayConfig.ChannelMode.MEMORY,
            "proj", "topic", "sub",
            "", false, 1, Duration.ofMillis(10));

        assertDoesNotThrow(() -> StartupConfigValidator.validate(memory));
    }

    private static RelayConfig valid() {
        return new RelayConfig(
            "0.0.0.0", 8765, "/", 10_000, 64,
            Duration.ofSeconds(30), Duration.ofSeconds(60),
            RelayConfig.ChannelMode.NATS,
            "receipt-tracking-application", "receipt-updates", "webapp-sub",
            "nats://localhost:4222", true, 32, Duration.ofMillis(500));
    }

    private static void assumeUnsetInEnvironment(String... names) {
        for (String name : names) {
            assumeTrue(System.getenv(name) == null,
                name + " is set in the environment");
        }
    }
}
