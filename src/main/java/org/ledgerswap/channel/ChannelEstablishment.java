package org.ledgerswap.channel;

import java.time.Clock;
import java.util.concurrent.TimeoutException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ledgerswap.crosschain.SwapException;

/**
 * Makes sure a funded channel toward a peer exists before a channel-leg commitment is attempted.
 * <p>
 * Resolves on the first pending-open or open event and never waits for full confirmation depth.
 * Nothing is retried here; failures surface as {@link SwapException.ChannelOpenFailedException}
 * carrying the engine's original exception as cause.
 */
public class ChannelEstablishment {

	private static final Logger LOGGER = LogManager.getLogger(ChannelEstablishment.class);

	/** Approximate block interval, in seconds, of the underlying chain. */
	public static final int DEFAULT_SECONDS_PER_BLOCK = 600;

	private static final String ALREADY_CONNECTED = "already connected";

	private final ChannelEngine engine;
	private final int secondsPerBlock;
	private final Clock clock;

	public ChannelEstablishment(ChannelEngine engine, int secondsPerBlock, Clock clock) {
		if (secondsPerBlock <= 0)
			throw new IllegalArgumentException("Seconds per block must be positive");

		this.engine = engine;
		this.secondsPerBlock = secondsPerBlock;
		this.clock = clock;
	}

	public ChannelEstablishment(ChannelEngine engine) {
		this(engine, DEFAULT_SECONDS_PER_BLOCK, Clock.systemUTC());
	}

	/** Returns number of blocks to target for <tt>targetTime</tt> seconds, never less than 1. */
	public static int confirmationTargetBlocks(long targetTime, int secondsPerBlock) {
		return (int) Math.max(targetTime / secondsPerBlock, 1L);
	}

	/**
	 * Opens a channel of <tt>fundingAmount</tt> satoshis to <tt>address</tt>.
	 *
	 * @param deadline time, in milliseconds since epoch, by which the channel must be at least pending-open
	 * @throws IllegalArgumentException if <tt>address</tt> can't be parsed
	 * @throws SwapException.ChannelOpenFailedException if connecting, opening or waiting fails
	 */
	public void createChannel(String address, long fundingAmount, ChannelOptions options, long deadline)
			throws SwapException, InterruptedException {
		PaymentChannelNetworkAddress networkAddress = PaymentChannelNetworkAddress.parse(address);
		String loggablePublicKey = networkAddress.getLoggablePublicKey();

		int confirmationTarget = confirmationTargetBlocks(options.getTargetTime(), this.secondsPerBlock);

		if (networkAddress.hasHost()) {
			connect(networkAddress);
		} else {
			LOGGER.debug(() -> String.format("No host for peer %s, assuming already connected", loggablePublicKey));
		}

		ChannelOpenRequest request = new ChannelOpenRequest(networkAddress.getPublicKey(), fundingAmount,
				confirmationTarget, options.isPrivateChannel());

		LOGGER.debug(() -> String.format("Opening channel of %d to %s with confirmation target of %d blocks",
				fundingAmount, loggablePublicKey, confirmationTarget));

		try (ChannelOpenSubscription subscription = open(request, loggablePublicKey)) {
			while (true) {
				long remaining = deadline - this.clock.millis();
				if (remaining <= 0)
					throw new SwapException.ChannelOpenFailedException(String.format("Timed out opening channel to %s", loggablePublicKey),
							new TimeoutException());

				ChannelOpenEvent event = nextEvent(subscription, remaining, loggablePublicKey);

				if (event == null)
					throw new SwapException.ChannelOpenFailedException(String.format("Channel open to %s ended without a pending channel", loggablePublicKey));

				if (event.isUsable) {
					LOGGER.debug(() -> String.format("Channel to %s reached %s", loggablePublicKey, event.name()));
					return;
				}

				LOGGER.trace(() -> String.format("Ignoring %s while opening channel to %s", event.name(), loggablePublicKey));
			}
		}
	}

	private ChannelOpenSubscription open(ChannelOpenRequest request, String loggablePublicKey) throws SwapException.ChannelOpenFailedException {
		try {
			return this.engine.openChannel(request);
		} catch (SwapException | RuntimeException e) {
			throw new SwapException.ChannelOpenFailedException(String.format("Unable to request channel to %s", loggablePublicKey), e);
		}
	}

	private static ChannelOpenEvent nextEvent(ChannelOpenSubscription subscription, long timeout, String loggablePublicKey)
			throws SwapException.ChannelOpenFailedException, InterruptedException {
		try {
			return subscription.next(timeout);
		} catch (TimeoutException e) {
			throw new SwapException.ChannelOpenFailedException(String.format("Timed out opening channel to %s", loggablePublicKey), e);
		} catch (SwapException | RuntimeException e) {
			throw new SwapException.ChannelOpenFailedException(String.format("Error opening channel to %s", loggablePublicKey), e);
		}
	}

	private void connect(PaymentChannelNetworkAddress networkAddress) throws SwapException.ChannelOpenFailedException {
		try {
			this.engine.connectPeer(networkAddress.getPublicKey(), networkAddress.getHost());
		} catch (SwapException | RuntimeException e) {
			String message = e.getMessage();

			if (message != null && message.contains(ALREADY_CONNECTED)) {
				LOGGER.debug(() -> String.format("Peer %s already connected", networkAddress.getLoggablePublicKey()));
				return;
			}

			throw new SwapException.ChannelOpenFailedException(String.format("Unable to connect to peer %s at %s",
					networkAddress.getLoggablePublicKey(), networkAddress.getHost()), e);
		}
	}

}
