package org.ledgerswap.settings;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.ledgerswap.repository.DataException;

/**
 * Persisted user config: credentials for the channel engine, the swap service and the escrow service.
 * <p>
 * Stored as a keyed JSON document. Writes are deep-merged into whatever is already stored:
 * object values merge recursively, anything else overwrites.
 * Reads overlay the stored document onto defaults, so every known field is always present.
 */
public class ConfigStore {

	private static final Logger LOGGER = LogManager.getLogger(ConfigStore.class);

	public static final String LND = "lnd";
	public static final String AUTH = "auth";
	public static final String ANCHOR = "anchor";

	private static final int PRETTY_PRINT_INDENT = 2;

	private final Path configPath;

	public ConfigStore(Path configPath) {
		this.configPath = configPath;
	}

	public static ConfigStore fromSettings() {
		return new ConfigStore(Path.of(Settings.getInstance().getConfigPath()));
	}

	private static JSONObject defaults() {
		JSONObject lnd = new JSONObject();
		lnd.put("hostName", "");
		lnd.put("port", 0);
		lnd.put("tlsCertPath", "");
		lnd.put("macaroonPath", "");
		lnd.put("configured", false);

		JSONObject auth = new JSONObject();
		auth.put("uuid", "");
		auth.put("apiKey", "");

		JSONObject anchor = new JSONObject();
		anchor.put("apiKey", "");

		JSONObject defaults = new JSONObject();
		defaults.put(LND, lnd);
		defaults.put(AUTH, auth);
		defaults.put(ANCHOR, anchor);
		return defaults;
	}

	/** Stored document, or empty if there's nothing usable on disk. */
	private JSONObject load() {
		try {
			String json = new String(Files.readAllBytes(this.configPath), StandardCharsets.UTF_8);
			return new JSONObject(json);
		} catch (IOException | JSONException e) {
			LOGGER.warn(() -> String.format("No configuration available at path: %s", this.configPath));
			return new JSONObject();
		}
	}

	/**
	 * Deep-merges <tt>value</tt> under <tt>key</tt> into the stored document and writes it back.
	 *
	 * @param value a {@link JSONObject}, a {@link Map} or a scalar
	 */
	public synchronized void addConfig(String key, Object value) throws DataException {
		JSONObject source = new JSONObject();
		source.put(key, value instanceof Map ? new JSONObject((Map<?, ?>) value) : value);

		JSONObject updated = deepMerge(load(), source);

		try {
			Files.write(this.configPath, updated.toString(PRETTY_PRINT_INDENT).getBytes(StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new DataException(String.format("Unable to write configuration to %s", this.configPath), e);
		}
	}

	/** Returns defaults overlaid by the stored document. */
	public synchronized JSONObject getConfig() {
		return deepMerge(defaults(), load());
	}

	/** Returns a new object holding <tt>target</tt> with <tt>source</tt> merged in. Neither argument is modified. */
	/*package*/ static JSONObject deepMerge(JSONObject target, JSONObject source) {
		JSONObject merged = new JSONObject();
		for (String key : target.keySet())
			merged.put(key, target.get(key));

		for (String key : source.keySet()) {
			Object sourceValue = source.get(key);
			Object targetValue = merged.opt(key);

			if (sourceValue instanceof JSONObject) {
				JSONObject base = targetValue instanceof JSONObject ? (JSONObject) targetValue : new JSONObject();
				merged.put(key, deepMerge(base, (JSONObject) sourceValue));
			} else {
				merged.put(key, sourceValue);
			}
		}

		return merged;
	}

	public LndConfig getLndConfig() {
		JSONObject lnd = getConfig().getJSONObject(LND);
		return new LndConfig(lnd.optString("hostName"), lnd.optInt("port"), lnd.optString("tlsCertPath"),
				lnd.optString("macaroonPath"), lnd.optBoolean("configured"));
	}

	public AuthConfig getAuthConfig() {
		JSONObject auth = getConfig().getJSONObject(AUTH);
		return new AuthConfig(auth.optString("uuid"), auth.optString("apiKey"));
	}

	public AnchorConfig getAnchorConfig() {
		JSONObject anchor = getConfig().getJSONObject(ANCHOR);
		return new AnchorConfig(anchor.optString("apiKey"));
	}

	public static class LndConfig {
		private final String hostName;
		private final int port;
		private final String tlsCertPath;
		private final String macaroonPath;
		private final boolean configured;

		public LndConfig(String hostName, int port, String tlsCertPath, String macaroonPath, boolean configured) {
			this.hostName = hostName;
			this.port = port;
			this.tlsCertPath = tlsCertPath;
			this.macaroonPath = macaroonPath;
			this.configured = configured;
		}

		public String getHostName() {
			return this.hostName;
		}

		public int getPort() {
			return this.port;
		}

		public String getTlsCertPath() {
			return this.tlsCertPath;
		}

		public String getMacaroonPath() {
			return this.macaroonPath;
		}

		public boolean isConfigured() {
			return this.configured;
		}
	}

	public static class AuthConfig {
		private final String uuid;
		private final String apiKey;

		public AuthConfig(String uuid, String apiKey) {
			this.uuid = uuid;
			this.apiKey = apiKey;
		}

		public String getUuid() {
			return this.uuid;
		}

		public String getApiKey() {
			return this.apiKey;
		}
	}

	public static class AnchorConfig {
		private final String apiKey;

		public AnchorConfig(String apiKey) {
			this.apiKey = apiKey;
		}

		public String getApiKey() {
			return this.apiKey;
		}
	}

}
