package org.ledgerswap.repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.ledgerswap.crosschain.SwapException;
import org.ledgerswap.data.swap.SwapData;
import org.ledgerswap.settings.Settings;

/**
 * Exports swap records to, and imports them from, a JSON backup file.
 * <p>
 * The file wraps the records with their type so unrelated backups can't be imported by mistake:
 * <pre>
 * { "type": "swapStates", "dataset": "current", "data": [ ... ] }
 * </pre>
 */
public class SwapBackup {

	private static final Logger LOGGER = LogManager.getLogger(SwapBackup.class);

	public static final String BACKUP_FILENAME = "SwapStates.json";

	private static final String TYPE = "swapStates";
	private static final String DATASET = "current";

	private final Path backupDirectory;

	public SwapBackup(Path backupDirectory) {
		this.backupDirectory = backupDirectory;
	}

	/** Backup under the directory configured in {@link Settings}. */
	public static SwapBackup fromSettings() {
		return new SwapBackup(Path.of(Settings.getInstance().getSwapBackupPath()));
	}

	public Path getBackupFile() {
		return this.backupDirectory.resolve(BACKUP_FILENAME);
	}

	public void exportSwaps(Collection<SwapData> allSwapData) throws DataException {
		JSONArray swapDataJson = new JSONArray();
		for (SwapData swapData : allSwapData)
			swapDataJson.put(swapData.toJson());

		JSONObject wrapper = new JSONObject();
		wrapper.put("type", TYPE);
		wrapper.put("dataset", DATASET);
		wrapper.put("data", swapDataJson);

		try {
			Files.createDirectories(this.backupDirectory);
			Files.write(getBackupFile(), wrapper.toString(2).getBytes(StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new DataException("Unable to export swap states", e);
		}

		LOGGER.info("Exported swap states");
	}

	/** @return imported swap records, or empty list if there's no backup file */
	public List<SwapData> importSwaps() throws DataException {
		Path backupFile = getBackupFile();
		if (!Files.exists(backupFile))
			return new ArrayList<>();

		try {
			String jsonString = new String(Files.readAllBytes(backupFile), StandardCharsets.UTF_8);
			JSONObject wrapper = new JSONObject(jsonString);

			if (!TYPE.equals(wrapper.optString("type")) || !DATASET.equals(wrapper.optString("dataset")))
				throw new DataException(String.format("Format mismatch when importing swap states from %s", backupFile));

			JSONArray data = wrapper.getJSONArray("data");

			List<SwapData> allSwapData = new ArrayList<>(data.length());
			for (int i = 0; i < data.length(); ++i)
				allSwapData.add(SwapData.fromJson(data.getJSONObject(i)));

			LOGGER.info(() -> String.format("Imported %d swap state%s", allSwapData.size(), allSwapData.size() != 1 ? "s" : ""));

			return allSwapData;
		} catch (IOException | JSONException | SwapException.InvalidEncodingException e) {
			throw new DataException(String.format("Unable to import swap states from %s", backupFile), e);
		}
	}

}
