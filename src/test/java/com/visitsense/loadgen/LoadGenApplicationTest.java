package com.visitsense.loadgen;

import java.util.HashMap;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import com.visitsense.loadgen.config.ConfigurationManager;
import com.visitsense.loadgen.config.LoadGeneratorConfig;

import static org.junit.Assert.*;

/**
 * Tests des options de ligne de commande
 */
public class LoadGenApplicationTest {

    private LoadGeneratorConfig config;

    @Before
    public void setUp() {
        Map<String, String> env = new HashMap<>();
        env.put("MATOMO_URL", "https://stats.example.org/matomo.php");
        env.put("BACKFILL_ENABLED", "true");
        env.put("BACKFILL_RUN_ONCE", "false");
        config = LoadGeneratorConfig.fromConfiguration(ConfigurationManager.fromMap(env));
    }

    @Test
    public void testParseAllOptions() {
        LoadGenApplication.CommandLineOptions options = LoadGenApplication.parseCommandLine(new String[] {
            "--config", "/etc/loadgen.properties", "--urls", "/data/urls.txt",
            "--funnels", "/data/funnels.json", "--mode", "backfill", "--duration", "120"
        });

        assertEquals("/etc/loadgen.properties", options.configFile);
        assertEquals("/data/urls.txt", options.urlsFile);
        assertEquals("/data/funnels.json", options.funnelsFile);
        assertEquals("backfill", options.mode);
        assertEquals(120, options.duration);
    }

    @Test
    public void testNoArguments() {
        LoadGenApplication.CommandLineOptions options = LoadGenApplication.parseCommandLine(new String[0]);

        assertNull(options.configFile);
        assertNull(options.mode);
        assertEquals(0, options.duration);
    }

    @Test
    public void testOverridesApplied() {
        LoadGenApplication.CommandLineOptions options = LoadGenApplication.parseCommandLine(new String[] {
            "-u", "/data/urls.txt", "-f", "/data/funnels.json"
        });
        options.applyTo(config);

        assertEquals("/data/urls.txt", config.getUrlsFile());
        assertEquals("/data/funnels.json", config.getFunnelConfigPath());
        assertTrue("No mode leaves backfill settings alone", config.isBackfillEnabled());
        assertFalse(config.isBackfillRunOnce());
    }

    @Test
    public void testBackfillModeRunsOnce() {
        LoadGenApplication.parseCommandLine(new String[] {"--mode", "backfill"}).applyTo(config);

        assertTrue(config.isBackfillEnabled());
        assertTrue(config.isBackfillRunOnce());
    }

    @Test
    public void testRealtimeModeDisablesBackfill() {
        LoadGenApplication.parseCommandLine(new String[] {"--mode", "realtime"}).applyTo(config);

        assertFalse(config.isBackfillEnabled());
    }
}
