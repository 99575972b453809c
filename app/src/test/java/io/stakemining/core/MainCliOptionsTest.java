package io.stakemining.core;

import io.stakemining.core.protocol.Amounts;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainCliOptionsTest {

    @Test
    void parsesDefaults() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {});
        assertFalse(options.showHelp());
        assertNull(options.errorMessage());
        assertFalse(options.enableApi());
        assertTrue(options.demo());
        assertFalse(options.resetState());
        assertEquals(Path.of("./data/mining").normalize(), options.dataDir().normalize());
        assertEquals(-1L, options.treasuryMinor());
    }

    @Test
    void enablesApiWithToken() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {
                "--enable-api",
                "--api-bind=0.0.0.0",
                "--api-port=8181",
                "--api-token=test-api",
                "--no-demo",
                "--in-memory",
                "--admin=ops-team",
                "--config=conf/mining.json"
        });
        assertFalse(options.showHelp());
        assertTrue(options.enableApi());
        assertEquals("0.0.0.0", options.apiBind());
        assertEquals(8181, options.apiPort());
        assertEquals("test-api", options.apiToken());
        assertFalse(options.demo());
        assertTrue(options.inMemory());
        assertTrue(options.keepAlive());
        assertEquals("ops-team", options.administrator());
        assertEquals(Path.of("conf/mining.json"), options.configFile());
    }

    @Test
    void treasuryIsParsedAsDecimalTokens() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--treasury=2500.5"});
        assertEquals(2_500 * Amounts.UNIT + Amounts.UNIT / 2, options.treasuryMinor());

        Main.CliOptions tooPrecise = Main.CliOptions.parse(new String[] {"--treasury=0.000000001"});
        assertTrue(tooPrecise.showHelp());
        assertTrue(tooPrecise.errorMessage().contains("--treasury"));
    }

    @Test
    void invalidPortSetsError() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--api-port=70000"});
        assertTrue(options.showHelp());
        assertTrue(options.errorMessage().contains("--api-port"));
    }

    @Test
    void unknownFlagTriggersHelp() {
        Main.CliOptions options = Main.CliOptions.parse(new String[] {"--unknown-flag"});
        assertTrue(options.showHelp());
        assertEquals("Unknown option: --unknown-flag", options.errorMessage());
    }
}
