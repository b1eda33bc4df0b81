package org.ledgerswap.settings;

import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.json.JSONObject;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.ledgerswap.repository.DataException;

public class ConfigStoreTests {

	@Rule
	public TemporaryFolder temporaryFolder = new TemporaryFolder();

	private Path configPath;
	private ConfigStore configStore;

	@Before
	public void beforeTest() {
		this.configPath = this.temporaryFolder.getRoot().toPath().resolve("config.json");
		this.configStore = new ConfigStore(this.configPath);
	}

	@Test
	public void testDefaultsWithoutFile() {
		JSONObject config = this.configStore.getConfig();

		assertEquals("", config.getJSONObject(ConfigStore.LND).getString("hostName"));
		assertFalse(config.getJSONObject(ConfigStore.LND).getBoolean("configured"));
		assertEquals("", config.getJSONObject(ConfigStore.AUTH).getString("apiKey"));
		assertEquals("", config.getJSONObject(ConfigStore.ANCHOR).getString("apiKey"));

		assertFalse(Files.exists(this.configPath));
	}

	@Test
	public void testCorruptFileFallsBackToDefaults() throws IOException {
		Files.write(this.configPath, "{ not json".getBytes(StandardCharsets.UTF_8));

		assertEquals("", this.configStore.getAnchorConfig().getApiKey());
	}

	@Test
	public void testAddConfigMergesDeeply() throws DataException {
		this.configStore.addConfig(ConfigStore.LND, Map.of("hostName", "localhost", "port", 10009));
		this.configStore.addConfig(ConfigStore.LND, Map.of("configured", true));
		this.configStore.addConfig(ConfigStore.ANCHOR, new JSONObject().put("apiKey", "anchor-key"));

		ConfigStore.LndConfig lndConfig = this.configStore.getLndConfig();
		assertEquals("localhost", lndConfig.getHostName());
		assertEquals(10009, lndConfig.getPort());
		assertTrue(lndConfig.isConfigured());
		// Untouched default survives
		assertEquals("", lndConfig.getMacaroonPath());

		assertEquals("anchor-key", this.configStore.getAnchorConfig().getApiKey());

		// Reads from disk, not from memory
		ConfigStore reopened = new ConfigStore(this.configPath);
		assertEquals("localhost", reopened.getLndConfig().getHostName());
		assertEquals("anchor-key", reopened.getAnchorConfig().getApiKey());
	}

	@Test
	public void testScalarOverwrites() throws DataException {
		this.configStore.addConfig(ConfigStore.AUTH, Map.of("uuid", "first"));
		this.configStore.addConfig(ConfigStore.AUTH, Map.of("uuid", "second", "apiKey", "swap-key"));

		ConfigStore.AuthConfig authConfig = this.configStore.getAuthConfig();
		assertEquals("second", authConfig.getUuid());
		assertEquals("swap-key", authConfig.getApiKey());

		this.configStore.addConfig("theme", "dark");
		assertEquals("dark", this.configStore.getConfig().getString("theme"));
	}

	@Test
	public void testDeepMergeLeavesArgumentsAlone() {
		JSONObject target = new JSONObject("{ \"a\": { \"b\": 1, \"c\": 2 }, \"d\": 3 }");
		JSONObject source = new JSONObject("{ \"a\": { \"c\": 20, \"e\": 5 }, \"d\": { \"f\": 6 } }");

		JSONObject merged = ConfigStore.deepMerge(target, source);

		assertEquals(1, merged.getJSONObject("a").getInt("b"));
		assertEquals(20, merged.getJSONObject("a").getInt("c"));
		assertEquals(5, merged.getJSONObject("a").getInt("e"));
		assertEquals(6, merged.getJSONObject("d").getInt("f"));

		assertEquals(2, target.getJSONObject("a").getInt("c"));
		assertFalse(target.getJSONObject("a").has("e"));
		assertEquals(3, target.getInt("d"));
	}

	@Test
	public void testUnwritablePath() {
		ConfigStore unwritable = new ConfigStore(this.temporaryFolder.getRoot().toPath().resolve("missing-dir").resolve("config.json"));

		try {
			unwritable.addConfig(ConfigStore.AUTH, Map.of("uuid", "x"));
			fail("Expected DataException");
		} catch (DataException e) {
			// expected
		}
	}

}
