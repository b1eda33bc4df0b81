package org.ledgerswap.settings;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

import javax.xml.bind.JAXBContext;
import javax.xml.bind.JAXBException;
import javax.xml.bind.UnmarshalException;
import javax.xml.bind.Unmarshaller;
import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import javax.xml.transform.stream.StreamSource;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.persistence.exceptions.XMLMarshalException;
import org.eclipse.persistence.jaxb.JAXBContextFactory;
import org.eclipse.persistence.jaxb.UnmarshallerProperties;

// All properties to be converted to JSON via JAXB
@XmlAccessorType(XmlAccessType.FIELD)
public class Settings {

	private static final Logger LOGGER = LogManager.getLogger(Settings.class);
	private static final String SETTINGS_FILENAME = "settings.json";

	// Properties
	private static Settings instance;

	// Escrow service
	private String escrowApiUrl = "https://api.anchorusd.com";
	/** Maximum number of escrows fetched when listing by hash. */
	private int escrowPageLimit = 200;
	/** HTTP status codes whose response bodies count as success when creating a deposit intent. */
	private Integer[] depositIntentIgnoredStatusCodes = new Integer[] {
		403
	};
	/** Milliseconds */
	private int httpConnectTimeout = 10 * 1000;
	/** Milliseconds */
	private int httpReadTimeout = 30 * 1000;

	// Payment channels
	/** Approximate seconds between blocks on the channel network's chain. */
	private int secondsPerBlock = 600;
	/** Desired seconds until a new channel's funding transaction confirms. */
	private long defaultConfirmationDelay = 1800;
	private boolean privateChannels = false;
	/** Time-lock delta, in blocks, for the final hop of a channel-leg payment. */
	private int finalCltvDelta = 40;
	/** Seconds a channel-leg time-lock must stay clear of the escrow timeout, either side. */
	private long swapSafetyMargin = 600;

	// Swap coordination
	/** How often swaps are progressed. (milliseconds) */
	private long swapPollInterval = 5 * 1000L;
	/** Directory for swap state backups. */
	private String swapBackupPath = "backups";
	/** Persisted user config, holding credentials. */
	private String configPath = "ledgerswap-config.json";

	// Constructors

	private Settings() {
	}

	// Other methods

	public static synchronized Settings getInstance() {
		if (instance == null)
			fileInstance(SETTINGS_FILENAME);

		return instance;
	}

	/**
	 * Parse settings from given file.
	 * <p>
	 * Throws <tt>RuntimeException</tt> so only the first caller of {@link #getInstance()} needs to handle failures.
	 *
	 * @throws RuntimeException with UnmarshalException as cause if settings file could not be parsed or is invalid
	 * @throws RuntimeException with FileNotFoundException as cause if settings file could not be found/opened
	 * @throws RuntimeException with JAXBException as cause if some unexpected JAXB-related error occurred
	 * @throws RuntimeException with IOException as cause if some unexpected I/O-related error occurred
	 */
	public static synchronized void fileInstance(String filename) {
		Unmarshaller unmarshaller;

		try {
			JAXBContext jc = JAXBContextFactory.createContext(new Class[] {
				Settings.class
			}, null);

			unmarshaller = jc.createUnmarshaller();

			// Settings are JSON, without a root element
			unmarshaller.setProperty(UnmarshallerProperties.MEDIA_TYPE, "application/json");
			unmarshaller.setProperty(UnmarshallerProperties.JSON_INCLUDE_ROOT, false);
		} catch (JAXBException e) {
			String message = "Failed to setup unmarshaller to process settings file";
			LOGGER.error(message, e);
			throw new RuntimeException(message, e);
		}

		Settings settings;

		LOGGER.info("Using settings file: " + filename);

		try (Reader settingsReader = new FileReader(filename)) {
			StreamSource json = new StreamSource(settingsReader);

			settings = unmarshaller.unmarshal(json, Settings.class).getValue();
		} catch (FileNotFoundException e) {
			String message = "Settings file not found: " + filename;
			LOGGER.error(message, e);
			throw new RuntimeException(message, e);
		} catch (UnmarshalException e) {
			Throwable linkedException = e.getLinkedException();
			if (linkedException instanceof XMLMarshalException) {
				String message = ((XMLMarshalException) linkedException).getInternalException().getLocalizedMessage();
				LOGGER.error(message);
				throw new RuntimeException(message, e);
			}

			String message = "Failed to parse settings file";
			LOGGER.error(message, e);
			throw new RuntimeException(message, e);
		} catch (JAXBException e) {
			String message = "Unexpected JAXB issue while processing settings file";
			LOGGER.error(message, e);
			throw new RuntimeException(message, e);
		} catch (IOException e) {
			String message = "Unexpected I/O issue while processing settings file";
			LOGGER.error(message, e);
			throw new RuntimeException(message, e);
		}

		settings.validate();

		instance = settings;
	}

	public static void throwValidationError(String message) {
		throw new RuntimeException(message, new UnmarshalException(message));
	}

	private void validate() {
		if (this.escrowApiUrl == null || this.escrowApiUrl.isEmpty())
			throwValidationError("escrowApiUrl must be set");

		if (this.escrowPageLimit < 2)
			throwValidationError("escrowPageLimit must be at least 2");

		if (this.secondsPerBlock < 1)
			throwValidationError("secondsPerBlock must be at least 1");

		if (this.defaultConfirmationDelay < 0)
			throwValidationError("defaultConfirmationDelay can't be negative");

		if (this.finalCltvDelta < 1)
			throwValidationError("finalCltvDelta must be at least 1");

		if (this.swapSafetyMargin < 0)
			throwValidationError("swapSafetyMargin can't be negative");

		if (this.swapPollInterval < 1)
			throwValidationError("swapPollInterval must be at least 1");

		if (this.depositIntentIgnoredStatusCodes == null)
			this.depositIntentIgnoredStatusCodes = new Integer[0];
	}

	// Getters / setters

	public String getEscrowApiUrl() {
		return this.escrowApiUrl;
	}

	public int getEscrowPageLimit() {
		return this.escrowPageLimit;
	}

	public Set<Integer> getDepositIntentIgnoredStatusCodes() {
		return Arrays.stream(this.depositIntentIgnoredStatusCodes).collect(Collectors.toUnmodifiableSet());
	}

	public int getHttpConnectTimeout() {
		return this.httpConnectTimeout;
	}

	public int getHttpReadTimeout() {
		return this.httpReadTimeout;
	}

	public int getSecondsPerBlock() {
		return this.secondsPerBlock;
	}

	public long getDefaultConfirmationDelay() {
		return this.defaultConfirmationDelay;
	}

	public boolean isPrivateChannels() {
		return this.privateChannels;
	}

	public int getFinalCltvDelta() {
		return this.finalCltvDelta;
	}

	public long getSwapSafetyMargin() {
		return this.swapSafetyMargin;
	}

	public long getSwapPollInterval() {
		return this.swapPollInterval;
	}

	public String getSwapBackupPath() {
		return this.swapBackupPath;
	}

	public String getConfigPath() {
		return this.configPath;
	}

}
