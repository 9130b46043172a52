package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.ConfigurationException;
import me.golemcore.gateway.domain.model.GatewayConfig;
import me.golemcore.gateway.port.outbound.ConfigSourcePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ConfigSnapshotHolderTest {

    private ConfigSourcePort configSource;
    private ConfigSnapshotHolder holder;

    @BeforeEach
    void setUp() {
        configSource = mock(ConfigSourcePort.class);
        holder = new ConfigSnapshotHolder(configSource);
    }

    private static GatewayConfig config(String model) {
        GatewayConfig.CompactionSettings compaction = new GatewayConfig.CompactionSettings(
                true, 0.85, 128000, Map.of(), 0, Duration.ofSeconds(30), 1024, null);
        return new GatewayConfig("anthropic", model, 50, compaction,
                new GatewayConfig.ContextSettings(Duration.ofSeconds(1), 5, "."),
                GatewayConfig.HookSettings.disabled());
    }

    @Test
    void shouldKeepSnapshotUntilReload() {
        GatewayConfig first = config("one");
        GatewayConfig second = config("two");
        when(configSource.load()).thenReturn(first, second);
        holder.init();

        GatewayConfig captured = holder.current();
        assertSame(first, holder.current());

        holder.reload();

        assertSame(second, holder.current());
        assertEquals("one", captured.model());
    }

    @Test
    void shouldKeepPreviousSnapshotWhenReloadFails() {
        GatewayConfig first = config("one");
        when(configSource.load()).thenReturn(first).thenThrow(new ConfigurationException("bad hook entry"));
        holder.init();

        assertThrows(ConfigurationException.class, holder::reload);

        assertSame(first, holder.current());
    }

    @Test
    void shouldLoadLazilyWithoutInit() {
        when(configSource.load()).thenReturn(config("lazy"));

        assertEquals("lazy", holder.current().model());
        holder.current();

        verify(configSource, times(1)).load();
    }

    @Test
    void shouldSwapSnapshot() {
        holder.swap(config("swapped"));

        assertEquals("swapped", holder.current().model());
        verifyNoInteractions(configSource);
    }
}
