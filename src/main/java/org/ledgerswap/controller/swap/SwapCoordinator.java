package org.ledgerswap.controller.swap;

import static java.util.Arrays.stream;
import static java.util.stream.Collectors.toMap;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ledgerswap.api.model.swap.SwapCreateRequest;
import org.ledgerswap.asset.Amount;
import org.ledgerswap.asset.Asset;
import org.ledgerswap.channel.ChannelEngine;
import org.ledgerswap.channel.ChannelEstablishment;
import org.ledgerswap.channel.ChannelOptions;
import org.ledgerswap.channel.EngineStatus;
import org.ledgerswap.channel.PaymentChannelNetworkAddress;
import org.ledgerswap.crosschain.SwapException;
import org.ledgerswap.crosschain.SwapHash;
import org.ledgerswap.crosschain.SwapPreimage;
import org.ledgerswap.data.escrow.EscrowData;
import org.ledgerswap.data.escrow.EscrowStatus;
import org.ledgerswap.data.swap.SettleTarget;
import org.ledgerswap.data.swap.SwapData;
import org.ledgerswap.data.swap.SwapRole;
import org.ledgerswap.escrow.EscrowGateway;
import org.ledgerswap.event.Event;
import org.ledgerswap.event.EventBus;
import org.ledgerswap.repository.DataException;
import org.ledgerswap.repository.SwapBackup;
import org.ledgerswap.settings.ConfigStore;
import org.ledgerswap.settings.Settings;

/**
 * Performs both legs of atomic swaps on behalf of user.
 * <p>
 * We deal with three different independent state-spaces here:
 * <ul>
 * 	<li>Escrow service</li>
 * 	<li>Payment channel network</li>
 * 	<li>Swap entries</li>
 * </ul>
 * A preimage is only ever presented to one ledger once the other ledger holds a commitment to the same hash.
 * Until both legs are committed, either deadline passing cancels the swap.
 * Once settling has started, the swap is never canceled.
 */
public class SwapCoordinator {

	private static final Logger LOGGER = LogManager.getLogger(SwapCoordinator.class);

	public interface StateNameAndValueSupplier {
		public String getState();
		public int getStateValue();
	}

	public enum State implements StateNameAndValueSupplier {
		INIT(10),
		ESCROW_PENDING(20),
		CHANNEL_READY(30),
		COMMITTED(40),
		SETTLING(50),
		SETTLED(60),
		CANCELED(70);

		private static final Map<Integer, State> map = stream(State.values()).collect(toMap(state -> state.value, state -> state));

		public final int value;

		State(int value) {
			this.value = value;
		}

		public static State valueOf(int value) {
			return map.get(value);
		}

		@Override
		public String getState() {
			return this.name();
		}

		@Override
		public int getStateValue() {
			return this.value;
		}
	}

	public static class StateChangeEvent implements Event {
		private final SwapData swapData;

		public StateChangeEvent(SwapData swapData) {
			this.swapData = swapData;
		}

		public SwapData getSwapData() {
			return this.swapData;
		}
	}

	private final List<String> endStates = Arrays.asList(State.SETTLED, State.CANCELED).stream()
			.map(State::name)
			.collect(Collectors.toUnmodifiableList());

	private final EscrowGateway escrowGateway;
	private final ChannelEngine engine;
	private final ChannelEstablishment channelEstablishment;
	private final Clock clock;
	/** Optional */
	private final SwapBackup swapBackup;

	private final int secondsPerBlock;
	private final int finalCltvDelta;
	private final long confirmationDelay;
	private final boolean privateChannels;
	private final long pollInterval;
	/** Milliseconds */
	private final long safetyMargin;

	private final Map<SwapHash, SwapData> swapsByHash = new ConcurrentHashMap<>();

	// Outstanding engine waits, keyed by swap hash. Not persisted; re-requested after restart.
	private final Map<SwapHash, CompletableFuture<Void>> channelFutures = new ConcurrentHashMap<>();
	private final Map<SwapHash, CompletableFuture<Long>> commitmentFutures = new ConcurrentHashMap<>();
	private final Map<SwapHash, CompletableFuture<SwapPreimage>> preimageFutures = new ConcurrentHashMap<>();

	private ScheduledExecutorService executor;
	/** Runs channel opens, which can take many blocks, off the progress thread. */
	private final ExecutorService channelExecutor;

	/**
	 * @param swapBackup optional
	 * @param channelExecutor runs channel opens; shut down by {@link #shutdown()}
	 */
	public SwapCoordinator(EscrowGateway escrowGateway, ChannelEngine engine, Clock clock, SwapBackup swapBackup, ExecutorService channelExecutor) {
		Settings settings = Settings.getInstance();

		this.escrowGateway = escrowGateway;
		this.engine = engine;
		this.clock = clock;
		this.swapBackup = swapBackup;
		this.channelExecutor = channelExecutor;

		this.secondsPerBlock = settings.getSecondsPerBlock();
		this.finalCltvDelta = settings.getFinalCltvDelta();
		this.confirmationDelay = settings.getDefaultConfirmationDelay();
		this.privateChannels = settings.isPrivateChannels();
		this.pollInterval = settings.getSwapPollInterval();
		this.safetyMargin = settings.getSwapSafetyMargin() * 1000L;

		this.channelEstablishment = new ChannelEstablishment(engine, this.secondsPerBlock, clock);
	}

	public SwapCoordinator(EscrowGateway escrowGateway, ChannelEngine engine, Clock clock, SwapBackup swapBackup) {
		this(escrowGateway, engine, clock, swapBackup, Executors.newCachedThreadPool());
	}

	/**
	 * Returns coordinator wired from {@link Settings}: escrow service endpoint, escrow API key from config store, and swap backup.
	 *
	 * @throws IllegalStateException if config store holds no escrow API key
	 */
	public static SwapCoordinator fromSettings(ChannelEngine engine) {
		ConfigStore configStore = ConfigStore.fromSettings();

		return new SwapCoordinator(EscrowGateway.fromSettings(configStore), engine, Clock.systemUTC(), SwapBackup.fromSettings());
	}

	public List<String> getEndStates() {
		return this.endStates;
	}

	// Scheduling

	/** Restores swaps from backup, if any, then progresses all swaps every poll interval. */
	public synchronized void start() {
		if (this.executor != null)
			return;

		if (this.swapBackup != null)
			try {
				for (SwapData swapData : this.swapBackup.importSwaps())
					this.swapsByHash.putIfAbsent(swapData.getHash(), swapData);
			} catch (DataException e) {
				LOGGER.error("Couldn't restore swaps from backup", e);
			}

		this.executor = Executors.newSingleThreadScheduledExecutor();
		this.executor.scheduleWithFixedDelay(this::processAll, 0, this.pollInterval, TimeUnit.MILLISECONDS);
	}

	/** Stops progressing swaps and abandons any channel opens in flight. Not restartable. */
	public synchronized void shutdown() {
		if (this.executor != null) {
			this.executor.shutdownNow();

			try {
				if (!this.executor.awaitTermination(5, TimeUnit.SECONDS))
					LOGGER.warn("Swap coordinator didn't shut down in time");
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}

			this.executor = null;
		}

		this.channelExecutor.shutdownNow();
	}

	// Swap entries

	/**
	 * Creates a new swap entry, in {@link State#INIT}.
	 * <p>
	 * Nothing is sent to either ledger until the swap is next progressed.
	 *
	 * @throws IllegalArgumentException if request is incomplete or a swap already exists for the hash
	 * @throws SwapException.InvalidEncodingException if request's hash is malformed
	 * @throws SwapException if channel engine isn't ready to swap
	 */
	public SwapData createSwap(SwapCreateRequest request) throws SwapException {
		SwapHash hash = SwapHash.fromBase64(request.hash);

		if (request.role == null)
			throw new IllegalArgumentException("Missing swap role");

		if (request.recipientId == null)
			throw new IllegalArgumentException("Missing escrow recipient");

		if (request.escrowAmount <= 0 || request.channelAmount <= 0)
			throw new IllegalArgumentException("Swap amounts must be positive");

		// Fail early on unparseable address
		PaymentChannelNetworkAddress.parse(request.counterpartyAddress);

		long now = this.clock.millis();
		long channelExpiration = request.channelExpiration != null ? request.channelExpiration : defaultChannelExpiration(request);

		if (request.escrowExpiration <= now || channelExpiration <= now)
			throw new IllegalArgumentException("Swap expirations must be in the future");

		EngineStatus engineStatus = this.engine.getStatus();
		if (engineStatus != EngineStatus.VALIDATED)
			throw new SwapException(String.format("Channel engine isn't ready to swap: %s", engineStatus));

		SwapData swapData = new SwapData(hash, request.role, State.INIT.name(), State.INIT.value, now,
				request.userId, request.recipientId, request.counterpartyAddress,
				request.escrowAmount, request.channelAmount, request.escrowExpiration, channelExpiration,
				null, null, false, null, null);

		if (this.swapsByHash.putIfAbsent(hash, swapData) != null)
			throw new IllegalArgumentException(String.format("Swap already exists for hash %s", hash));

		updateSwapState(swapData, State.INIT, () -> String.format("Created %s swap for hash %s", request.role, hash));

		return swapData;
	}

	/**
	 * A PAYER's channel leg must outlive the escrow by the safety margin, so our refund window opens first.
	 * A PAYEE's time-lock is bounded by the escrow instead.
	 */
	private long defaultChannelExpiration(SwapCreateRequest request) {
		if (request.role == SwapRole.PAYER)
			return request.escrowExpiration + this.safetyMargin;

		return request.escrowExpiration;
	}

	public SwapData getSwap(SwapHash hash) {
		return this.swapsByHash.get(hash);
	}

	public List<SwapData> getAllSwaps() {
		return new ArrayList<>(this.swapsByHash.values());
	}

	public boolean canDelete(SwapData swapData) {
		State swapState = State.valueOf(swapData.getStateValue());
		if (swapState == null)
			return true;

		switch (swapState) {
			case INIT:
				// No escrow yet, but a PAYER might be creating one right now
				return swapData.getEscrowId() == null;

			case SETTLED:
			case CANCELED:
				return true;

			default:
				return false;
		}
	}

	public boolean deleteEntry(SwapHash hash) {
		SwapData swapData = this.swapsByHash.get(hash);
		if (swapData == null)
			// Can't delete what we don't have!
			return false;

		synchronized (swapData) {
			if (!canDelete(swapData))
				return false;

			this.swapsByHash.remove(hash);
			cancelEngineWaits(hash);
		}

		backupSwapData();

		return true;
	}

	/**
	 * Cancels swap, releasing whichever legs we committed.
	 * <p>
	 * Repeat cancels of an already canceled swap succeed.
	 *
	 * @throws IllegalArgumentException if no swap exists for <tt>hash</tt>
	 * @throws SwapException.TooLateToCancelException if the preimage may already be public,
	 * 		or we have an outgoing channel payment in flight
	 */
	public void cancel(SwapHash hash) throws SwapException {
		SwapData swapData = this.swapsByHash.get(hash);
		if (swapData == null)
			throw new IllegalArgumentException(String.format("No swap for hash %s", hash));

		synchronized (swapData) {
			State swapState = State.valueOf(swapData.getStateValue());

			if (swapState == State.CANCELED)
				return;

			if (swapState == State.SETTLING || swapState == State.SETTLED)
				throw new SwapException.TooLateToCancelException(String.format("Swap for hash %s is already %s", hash, swapState.name()));

			if (swapState == State.COMMITTED && swapData.getRole() == SwapRole.PAYEE)
				throw new SwapException.TooLateToCancelException(String.format("Channel payment for hash %s is already in flight", hash));

			cancelLegs(swapData, () -> String.format("Canceled swap for hash %s on request", hash));
		}
	}

	// Progress

	/** Progresses every swap once. Failures are logged and retried next time. */
	public void processAll() {
		for (SwapData swapData : getAllSwaps())
			try {
				progress(swapData);
			} catch (SwapException.NetworkException | SwapException.ChannelOpenFailedException e) {
				LOGGER.warn(() -> String.format("Transient issue progressing swap for hash %s: %s", swapData.getHash(), e.getMessage()));
			} catch (SwapException e) {
				LOGGER.error(() -> String.format("Couldn't progress swap for hash %s: %s", swapData.getHash(), e.getMessage()));
			} catch (RuntimeException e) {
				LOGGER.error(String.format("Unexpected failure progressing swap for hash %s", swapData.getHash()), e);
			}
	}

	public void progress(SwapData swapData) throws SwapException {
		synchronized (swapData) {
			State swapState = State.valueOf(swapData.getStateValue());
			if (swapState == null) {
				LOGGER.info(() -> String.format("Swap for hash %s has invalid state?", swapData.getHash()));
				return;
			}

			switch (swapState) {
				case INIT:
					handleInit(swapData);
					break;

				case ESCROW_PENDING:
					handleEscrowPending(swapData);
					break;

				case CHANNEL_READY:
					handleChannelReady(swapData);
					break;

				case COMMITTED:
					handleCommitted(swapData);
					break;

				case SETTLING:
					handleSettling(swapData);
					break;

				case SETTLED:
				case CANCELED:
					break;
			}
		}
	}

	/**
	 * Swap has no escrow yet.
	 * <p>
	 * Any existing escrow for our hash is adopted. Otherwise a PAYER creates one,
	 * while a PAYEE waits for the counterparty to create one.
	 */
	private void handleInit(SwapData swapData) throws SwapException {
		SwapHash hash = swapData.getHash();

		if (this.clock.millis() >= preCommitDeadline(swapData)) {
			updateSwapState(swapData, State.CANCELED, () -> String.format("Swap for hash %s expired before escrow was ready", hash));
			return;
		}

		EscrowData escrowData = this.escrowGateway.getEscrowByHash(hash, swapData.getUserId(), swapData.getRecipientId());

		if (escrowData == null) {
			if (swapData.getRole() == SwapRole.PAYEE) {
				LOGGER.debug(() -> String.format("Waiting for counterparty's escrow for hash %s", hash));
				return;
			}

			escrowData = this.escrowGateway.createEscrow(hash, swapData.getRecipientId(),
					Amount.of(Asset.USDX, swapData.getEscrowAmount()), swapData.getEscrowExpiration());
		}

		if (escrowData.getAmount() != swapData.getEscrowAmount()) {
			long escrowAmount = escrowData.getAmount();
			LOGGER.warn(() -> String.format("Escrow for hash %s holds %d cents, not %d", hash, escrowAmount, swapData.getEscrowAmount()));
			return;
		}

		swapData.setEscrowId(escrowData.getId());
		swapData.setEscrowTimeout(escrowData.getTimeout());

		if (escrowData.getStatus() != EscrowStatus.PENDING) {
			EscrowStatus escrowStatus = escrowData.getStatus();
			updateSwapState(swapData, State.CANCELED, () -> String.format("Escrow %s for hash %s is already %s",
					swapData.getEscrowId(), hash, escrowStatus.wireValue));
			return;
		}

		updateSwapState(swapData, State.ESCROW_PENDING, () -> String.format("Escrow %s ready for hash %s", swapData.getEscrowId(), hash));
	}

	/**
	 * Escrow is pending. Makes sure we have a channel to the counterparty able to carry the channel leg.
	 * <p>
	 * Channel opens run on {@link #channelExecutor} and are polled here, so other swaps keep progressing meanwhile.
	 */
	private void handleEscrowPending(SwapData swapData) throws SwapException {
		SwapHash hash = swapData.getHash();

		if (cancelIfExpired(swapData))
			return;

		if (cancelIfEscrowFinal(swapData, fetchEscrow(swapData)))
			return;

		CompletableFuture<Void> channelFuture = this.channelFutures.get(hash);

		if (channelFuture == null) {
			long channelAmount = swapData.getChannelAmount();
			long availableCapacity = getChannelCapacity(swapData) - reservedChannelCapacity(swapData);

			if (availableCapacity >= channelAmount) {
				LOGGER.debug(() -> String.format("Existing channel capacity %d covers %d for hash %s", availableCapacity, channelAmount, hash));
				updateSwapState(swapData, State.CHANNEL_READY, () -> String.format("Channel ready for hash %s", hash));
				return;
			}

			String address = swapData.getCounterpartyAddress();
			ChannelOptions options = new ChannelOptions(this.confirmationDelay, this.privateChannels);
			long deadline = preCommitDeadline(swapData);

			LOGGER.debug(() -> String.format("Channel capacity %d short of %d for hash %s, opening channel", availableCapacity, channelAmount, hash));

			channelFuture = CompletableFuture.runAsync(() -> createChannel(address, channelAmount, options, deadline), this.channelExecutor);
			this.channelFutures.put(hash, channelFuture);
		}

		if (!channelFuture.isDone())
			return;

		this.channelFutures.remove(hash);

		// Failures propagate, to be retried next time
		joinEngineFuture(channelFuture);

		updateSwapState(swapData, State.CHANNEL_READY, () -> String.format("Channel ready for hash %s", hash));
	}

	/** Runs channel establishment workflow, rethrowing failures unchecked for the enclosing future. */
	private void createChannel(String address, long fundingAmount, ChannelOptions options, long deadline) {
		try {
			this.channelEstablishment.createChannel(address, fundingAmount, options, deadline);
		} catch (SwapException e) {
			throw new CompletionException(e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CompletionException(new SwapException.ChannelOpenFailedException("Interrupted while opening channel", e));
		}
	}

	/** Direct channel capacity to the counterparty, in the direction our channel leg flows. */
	private long getChannelCapacity(SwapData swapData) throws SwapException {
		String publicKey = counterpartyPublicKey(swapData);

		if (swapData.getRole() == SwapRole.PAYEE)
			return this.engine.getOutboundCapacity(publicKey);

		return this.engine.getInboundCapacity(publicKey);
	}

	/** Channel capacity to swap's counterparty already spoken for by our other swaps in the same direction. */
	private long reservedChannelCapacity(SwapData swapData) {
		String publicKey = counterpartyPublicKey(swapData);
		long reserved = 0;

		for (SwapData otherSwapData : this.swapsByHash.values()) {
			if (otherSwapData == swapData || otherSwapData.getRole() != swapData.getRole())
				continue;

			State otherState = State.valueOf(otherSwapData.getStateValue());
			boolean holdsCapacity = otherState == State.CHANNEL_READY
					|| (otherState == State.ESCROW_PENDING && this.channelFutures.containsKey(otherSwapData.getHash()));

			if (holdsCapacity && publicKey.equals(counterpartyPublicKey(otherSwapData)))
				reserved += otherSwapData.getChannelAmount();
		}

		return reserved;
	}

	private static String counterpartyPublicKey(SwapData swapData) {
		return PaymentChannelNetworkAddress.parse(swapData.getCounterpartyAddress()).getPublicKey();
	}

	/**
	 * Channel is usable. Issues our channel-leg commitment.
	 * <p>
	 * A PAYER prepares to receive, then waits for the counterparty's payment to arrive.<br>
	 * A PAYEE pays the counterparty, the claim of which will reveal the preimage.
	 */
	private void handleChannelReady(SwapData swapData) throws SwapException {
		SwapHash hash = swapData.getHash();
		EscrowData escrowData = fetchEscrow(swapData);

		boolean awaitingCommitment = swapData.getRole() == SwapRole.PAYER && swapData.isCommitmentIssued();

		if (awaitingCommitment && escrowData.getStatus() == EscrowStatus.COMPLETE && escrowData.getPreimage() != null) {
			// Preimage is public already, so keep our invoice open in case the counterparty still pays it
			LOGGER.warn(() -> String.format("Escrow %s for hash %s completed before channel leg was committed", escrowData.getId(), hash));
		} else {
			if (cancelIfExpired(swapData))
				return;

			if (cancelIfEscrowFinal(swapData, escrowData))
				return;
		}

		if (swapData.getRole() == SwapRole.PAYEE) {
			// Our payment must be refundable before the escrow can be refunded to the counterparty
			long timeLockDeadline = Math.min(swapData.getChannelExpiration(), escrowData.getTimeout() - this.safetyMargin);
			long remainingSeconds = (timeLockDeadline - this.clock.millis()) / 1000L;
			int maxTimeLock = (int) Math.max(0L, remainingSeconds / this.secondsPerBlock);

			if (maxTimeLock < 1) {
				cancelLegs(swapData, () -> String.format("Too little time left before escrow timeout to pay channel leg for hash %s", hash));
				return;
			}

			CompletableFuture<SwapPreimage> preimageFuture = this.engine.initiateSwap(swapData.getCounterpartyAddress(), hash,
					swapData.getChannelAmount(), maxTimeLock, this.finalCltvDelta);
			this.preimageFutures.put(hash, preimageFuture);

			swapData.setCommitmentIssued(true);
			updateSwapState(swapData, State.COMMITTED, () -> String.format("Paying channel leg for hash %s, time-lock %d blocks", hash, maxTimeLock));
			return;
		}

		if (!swapData.isCommitmentIssued()) {
			// Counterparty's payment must stay locked until after our escrow can be refunded to us
			if (swapData.getChannelExpiration() < escrowData.getTimeout() + this.safetyMargin) {
				cancelLegs(swapData, () -> String.format("Channel leg for hash %s would expire within %ds of escrow timeout",
						hash, this.safetyMargin / 1000L));
				return;
			}

			this.engine.prepareSwap(hash, swapData.getChannelAmount(), swapData.getChannelExpiration(), this.finalCltvDelta);

			swapData.setCommitmentIssued(true);
			updateSwapState(swapData, () -> String.format("Prepared to receive channel leg for hash %s", hash));
		}

		CompletableFuture<Long> commitmentFuture = this.commitmentFutures.computeIfAbsent(hash, this.engine::waitForSwapCommitment);
		if (!commitmentFuture.isDone())
			return;

		this.commitmentFutures.remove(hash);

		long commitmentTimestamp;
		try {
			commitmentTimestamp = joinEngineFuture(commitmentFuture);
		} catch (SwapException.AlreadyCanceledException | SwapException.ExpiredSwapException | SwapException.PermanentSwapException e) {
			cancelLegs(swapData, () -> String.format("Channel leg for hash %s failed: %s", hash, e.getMessage()));
			return;
		}

		updateSwapState(swapData, State.COMMITTED, () -> String.format("Counterparty committed channel leg for hash %s at %d", hash, commitmentTimestamp));
	}

	/**
	 * Both legs are committed. Waits for the preimage to appear on either ledger.
	 */
	private void handleCommitted(SwapData swapData) throws SwapException {
		SwapHash hash = swapData.getHash();

		EscrowData escrowData = fetchEscrow(swapData);

		if (escrowData.getStatus() == EscrowStatus.COMPLETE) {
			if (escrowData.getPreimage() == null) {
				LOGGER.warn(() -> String.format("Escrow %s for hash %s is complete but has no preimage", escrowData.getId(), hash));
				return;
			}

			startSettling(swapData, escrowData.getPreimage(), SettleTarget.CHANNEL,
					() -> String.format("Escrow %s revealed preimage for hash %s", escrowData.getId(), hash));
			return;
		}

		if (escrowData.getStatus() == EscrowStatus.CANCELED) {
			cancelLegs(swapData, () -> String.format("Escrow %s for hash %s was canceled by escrow service", escrowData.getId(), hash));
			return;
		}

		CompletableFuture<SwapPreimage> preimageFuture = this.preimageFutures.computeIfAbsent(hash, this.engine::getSettledSwapPreimage);
		if (!preimageFuture.isDone())
			return;

		this.preimageFutures.remove(hash);

		SwapPreimage preimage;
		try {
			preimage = joinEngineFuture(preimageFuture);
		} catch (SwapException.AlreadyCanceledException | SwapException.ExpiredSwapException | SwapException.PermanentSwapException e) {
			cancelLegs(swapData, () -> String.format("Channel leg for hash %s failed: %s", hash, e.getMessage()));
			return;
		}

		startSettling(swapData, preimage, SettleTarget.ESCROW,
				() -> String.format("Channel leg revealed preimage for hash %s", hash));
	}

	/**
	 * Preimage is known. Presents it to the remaining ledger until that ledger reports settlement.
	 * <p>
	 * Already-settled and expired legs are terminal.
	 */
	private void handleSettling(SwapData swapData) throws SwapException {
		SwapHash hash = swapData.getHash();
		SwapPreimage preimage = swapData.getPreimage();

		if (swapData.getSettleTarget() == SettleTarget.ESCROW) {
			EscrowData escrowData = fetchEscrow(swapData);

			if (escrowData.getStatus() == EscrowStatus.COMPLETE) {
				updateSwapState(swapData, State.SETTLED, () -> String.format("Escrow %s for hash %s already complete", escrowData.getId(), hash));
				return;
			}

			// Never reveal on an escrow that may already have been refunded
			if (escrowData.getStatus() == EscrowStatus.CANCELED || this.clock.millis() >= escrowData.getTimeout()) {
				LOGGER.warn(() -> String.format("Escrow %s for hash %s expired before it could be completed", escrowData.getId(), hash));
				updateSwapState(swapData, State.SETTLED, () -> String.format("Escrow leg for hash %s expired", hash));
				return;
			}

			try {
				this.escrowGateway.completeEscrow(escrowData.getId(), preimage);
			} catch (SwapException.RemoteRejectedException e) {
				// Someone else may have beaten us to it
				if (fetchEscrow(swapData).getStatus() != EscrowStatus.COMPLETE)
					throw e;
			}

			updateSwapState(swapData, State.SETTLED, () -> String.format("Completed escrow %s for hash %s", escrowData.getId(), hash));
			return;
		}

		if (swapData.getRole() == SwapRole.PAYEE) {
			// Our outgoing payment settles once the counterparty claims it
			CompletableFuture<SwapPreimage> preimageFuture = this.preimageFutures.computeIfAbsent(hash, this.engine::getSettledSwapPreimage);
			if (!preimageFuture.isDone())
				return;

			this.preimageFutures.remove(hash);

			try {
				joinEngineFuture(preimageFuture);
			} catch (SwapException.AlreadySettledException | SwapException.AlreadyCanceledException
					| SwapException.ExpiredSwapException | SwapException.PermanentSwapException e) {
				LOGGER.warn(() -> String.format("Channel leg for hash %s ended without settling: %s", hash, e.getMessage()));
			}

			updateSwapState(swapData, State.SETTLED, () -> String.format("Channel leg for hash %s settled", hash));
			return;
		}

		try {
			this.engine.settleSwap(preimage);
		} catch (SwapException.AlreadySettledException e) {
			LOGGER.debug(() -> String.format("Channel leg for hash %s already settled", hash));
		} catch (SwapException.ExpiredSwapException | SwapException.AlreadyCanceledException | SwapException.PermanentSwapException e) {
			LOGGER.warn(() -> String.format("Channel leg for hash %s couldn't be settled: %s", hash, e.getMessage()));
		}

		updateSwapState(swapData, State.SETTLED, () -> String.format("Settled channel leg for hash %s", hash));
	}

	private void startSettling(SwapData swapData, SwapPreimage preimage, SettleTarget settleTarget, Supplier<String> logMessageSupplier) throws SwapException {
		swapData.setPreimage(preimage);
		swapData.setSettleTarget(settleTarget);

		updateSwapState(swapData, State.SETTLING, logMessageSupplier);

		handleSettling(swapData);
	}

	// Cancelation

	/** Latest time both legs must be committed by. */
	private static long preCommitDeadline(SwapData swapData) {
		long escrowDeadline = swapData.getEscrowTimeout() != null ? swapData.getEscrowTimeout() : swapData.getEscrowExpiration();
		return Math.min(escrowDeadline, swapData.getChannelExpiration());
	}

	private boolean cancelIfExpired(SwapData swapData) throws SwapException {
		if (this.clock.millis() < preCommitDeadline(swapData))
			return false;

		cancelLegs(swapData, () -> String.format("Swap for hash %s expired before both legs were committed", swapData.getHash()));
		return true;
	}

	/** Cancels swap if escrow reached a final status before both legs were committed. */
	private boolean cancelIfEscrowFinal(SwapData swapData, EscrowData escrowData) throws SwapException {
		if (!escrowData.getStatus().isFinal())
			return false;

		if (escrowData.getStatus() == EscrowStatus.COMPLETE)
			LOGGER.warn(() -> String.format("Escrow %s for hash %s completed before channel leg was committed", escrowData.getId(), swapData.getHash()));

		cancelLegs(swapData, () -> String.format("Escrow %s for hash %s is %s", escrowData.getId(), swapData.getHash(), escrowData.getStatus().wireValue));
		return true;
	}

	/**
	 * Releases our legs then moves swap to {@link State#CANCELED}.
	 * <p>
	 * If our escrow turns out to have been completed, and the counterparty's channel commitment exists,
	 * the swap moves to settling instead.
	 */
	private void cancelLegs(SwapData swapData, Supplier<String> logMessageSupplier) throws SwapException {
		SwapHash hash = swapData.getHash();
		String escrowId = swapData.getEscrowId();

		if (swapData.getRole() == SwapRole.PAYER && escrowId != null) {
			try {
				this.escrowGateway.cancelEscrow(escrowId);
			} catch (SwapException.AlreadyCanceledException e) {
				LOGGER.debug(() -> String.format("Escrow %s for hash %s already canceled", escrowId, hash));
			} catch (SwapException.RemoteRejectedException e) {
				// Escrow service rejects canceling a completed escrow
				EscrowData escrowData = fetchEscrow(swapData);

				if (escrowData.getStatus() != EscrowStatus.COMPLETE)
					throw e;

				if (escrowData.getPreimage() != null) {
					if (swapData.isCommitmentIssued() && State.valueOf(swapData.getStateValue()) == State.COMMITTED) {
						startSettling(swapData, escrowData.getPreimage(), SettleTarget.CHANNEL,
								() -> String.format("Escrow %s revealed preimage for hash %s while canceling", escrowId, hash));
						return;
					}

					LOGGER.warn(() -> String.format("Escrow %s for hash %s completed without a channel commitment", escrowId, hash));
				}
			}
		}

		if (swapData.isCommitmentIssued()) {
			try {
				this.engine.cancelSwap(hash);
			} catch (SwapException.AlreadyCanceledException | SwapException.ExpiredSwapException e) {
				LOGGER.debug(() -> String.format("Channel leg for hash %s already released: %s", hash, e.getMessage()));
			} catch (SwapException.AlreadySettledException e) {
				LOGGER.warn(() -> String.format("Channel leg for hash %s already settled while canceling", hash));
			}
		}

		cancelEngineWaits(hash);

		updateSwapState(swapData, State.CANCELED, logMessageSupplier);
	}

	/** Drops outstanding engine waits for <tt>hash</tt>. A channel open already underway runs on to its own deadline. */
	private void cancelEngineWaits(SwapHash hash) {
		CompletableFuture<Void> channelFuture = this.channelFutures.remove(hash);
		if (channelFuture != null)
			channelFuture.cancel(false);

		CompletableFuture<Long> commitmentFuture = this.commitmentFutures.remove(hash);
		if (commitmentFuture != null)
			commitmentFuture.cancel(false);

		CompletableFuture<SwapPreimage> preimageFuture = this.preimageFutures.remove(hash);
		if (preimageFuture != null)
			preimageFuture.cancel(false);
	}

	// Utilities

	/** Fetches swap's escrow, checking it's still the escrow for our hash. */
	private EscrowData fetchEscrow(SwapData swapData) throws SwapException {
		EscrowData escrowData = this.escrowGateway.getEscrow(swapData.getEscrowId());

		if (!swapData.getHash().equals(escrowData.getHash()))
			throw new SwapException(String.format("Escrow %s has hash %s, not %s", escrowData.getId(), escrowData.getHash(), swapData.getHash()));

		swapData.setEscrowTimeout(escrowData.getTimeout());

		return escrowData;
	}

	/** Returns result of completed engine future, unwrapping any {@link SwapException} it failed with. */
	private static <T> T joinEngineFuture(CompletableFuture<T> future) throws SwapException {
		try {
			return future.join();
		} catch (CompletionException e) {
			Throwable cause = e.getCause() != null ? e.getCause() : e;

			if (cause instanceof SwapException)
				throw (SwapException) cause;

			throw new SwapException.NetworkException(String.format("Channel engine failure: %s", cause.getMessage()), cause);
		} catch (CancellationException e) {
			throw new SwapException.NetworkException("Channel engine wait was canceled", e);
		}
	}

	/** Updates swap entry to new state, with current timestamp, logs message and notifies state-change listeners. */
	private void updateSwapState(SwapData swapData, StateNameAndValueSupplier newStateSupplier, Supplier<String> logMessageSupplier) {
		swapData.setState(newStateSupplier.getState());
		swapData.setStateValue(newStateSupplier.getStateValue());
		swapData.setTimestamp(this.clock.millis());

		if (logMessageSupplier != null)
			LOGGER.info(logMessageSupplier);

		LOGGER.debug(() -> String.format("new state for swap with hash %s: %s", swapData.getHash(), newStateSupplier.getState()));

		backupSwapData();

		EventBus.INSTANCE.notify(new StateChangeEvent(swapData));
	}

	/** Updates swap entry with current timestamp, logs message and notifies state-change listeners. */
	private void updateSwapState(SwapData swapData, Supplier<String> logMessageSupplier) {
		updateSwapState(swapData, State.valueOf(swapData.getStateValue()), logMessageSupplier);
	}

	private void backupSwapData() {
		if (this.swapBackup == null)
			return;

		// Backup is optional and doesn't impact swapping, so don't throw on failure
		try {
			this.swapBackup.exportSwaps(getAllSwaps());
		} catch (DataException e) {
			LOGGER.info(String.format("Issue when exporting swap data: %s", e.getMessage()));
		}
	}

}
