package me.golemcore.gateway.adapter.outbound.hook;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.domain.model.hook.HookDefinition;
import me.golemcore.gateway.domain.model.hook.HookEventKind;
import me.golemcore.gateway.domain.model.hook.HookHandlerType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClaudeSettingsHookLoaderTest {

    private static final Map<HookHandlerType, Duration> DEFAULTS = Map.of(
            HookHandlerType.COMMAND, Duration.ofSeconds(60),
            HookHandlerType.PROMPT, Duration.ofSeconds(30));

    @TempDir
    Path home;

    @TempDir
    Path project;

    private ClaudeSettingsHookLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ClaudeSettingsHookLoader(new ObjectMapper());
    }

    private static void writeSettings(Path root, String json) throws IOException {
        Path dir = root.resolve(".claude");
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("settings.json"), json);
    }

    @Test
    void shouldLoadUserThenProjectEntries() throws IOException {
        writeSettings(home, """
                {"hooks":{"PreToolUse":[{"matcher":"Bash","hooks":[
                  {"type":"command","command":"./check.sh","timeout":5}]}]}}
                """);
        writeSettings(project, """
                {"hooks":{"Stop":[{"hooks":[
                  {"type":"prompt","prompt":"Finished? $ARGUMENTS"}]}]}}
                """);

        List<HookDefinition> definitions = loader.load(home, project, DEFAULTS);

        assertEquals(2, definitions.size());
        HookDefinition first = definitions.get(0);
        assertEquals(HookEventKind.PRE_TOOL_USE, first.getEvent());
        assertEquals("Bash", first.getMatcher());
        assertEquals("./check.sh", first.getCommand());
        assertEquals(Duration.ofSeconds(5), first.getTimeout());
        HookDefinition second = definitions.get(1);
        assertEquals(HookEventKind.STOP, second.getEvent());
        assertEquals(HookHandlerType.PROMPT, second.getType());
        assertNull(second.getMatcher());
        assertEquals(Duration.ofSeconds(30), second.getTimeout());
    }

    @Test
    void shouldSkipUnknownEventsAndEmptyBodies() throws IOException {
        writeSettings(project, """
                {"hooks":{
                  "OnMoonrise":[{"hooks":[{"type":"command","command":"x"}]}],
                  "SessionStart":[{"hooks":[{"type":"command"},{"type":"agent","command":"y"},
                                            {"command":"git status"}]}]}}
                """);

        List<HookDefinition> definitions = loader.load(null, project, DEFAULTS);

        assertEquals(1, definitions.size());
        assertEquals("git status", definitions.get(0).getCommand());
        assertEquals(HookHandlerType.COMMAND, definitions.get(0).getType());
    }

    @Test
    void shouldIgnoreMissingAndMalformedFiles() throws IOException {
        writeSettings(project, "{not json");

        assertTrue(loader.load(home, project, DEFAULTS).isEmpty());
    }

    @Test
    void shouldNotLoadSameFileTwiceWhenProjectIsHome() throws IOException {
        writeSettings(home, """
                {"hooks":{"Notification":[{"hooks":[{"command":"notify-send hi"}]}]}}
                """);

        assertEquals(1, loader.load(home, home, DEFAULTS).size());
    }
}
