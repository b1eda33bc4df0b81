package org.ledgerswap.channel;

import java.util.concurrent.CompletableFuture;

import org.ledgerswap.crosschain.SwapException;
import org.ledgerswap.crosschain.SwapHash;
import org.ledgerswap.crosschain.SwapPreimage;

/**
 * Capability over the local payment-channel engine.
 * <p>
 * Implementations own the engine connection and must be safe for concurrent use by independent swaps.
 * Hashes and preimages are passed as objects; converting them to the engine's native form is the implementation's job.
 * <p>
 * Long waits are returned as futures. Futures complete exceptionally with a {@link SwapException}:
 * <ul>
 * 	<li>{@link SwapException.AlreadySettledException} if the swap was already settled</li>
 * 	<li>{@link SwapException.AlreadyCanceledException} if the swap was canceled</li>
 * 	<li>{@link SwapException.ExpiredSwapException} if the swap's time-lock passed</li>
 * 	<li>{@link SwapException.PermanentSwapException} if the swap can never succeed</li>
 * 	<li>{@link SwapException.NetworkException} for transient failures</li>
 * </ul>
 * Synchronous methods throw the same exceptions directly.
 */
public interface ChannelEngine {

	public void validateEngine() throws SwapException;

	public EngineStatus getStatus() throws SwapException;

	/** This node's own address, for counterparties to reach us. */
	public String getPaymentChannelNetworkAddress() throws SwapException;

	public void connectPeer(String publicKey, String host) throws SwapException;

	public ChannelOpenSubscription openChannel(ChannelOpenRequest request) throws SwapException;

	// Swap primitives

	/**
	 * Prepares to receive <tt>amount</tt> satoshis locked to <tt>hash</tt>.
	 *
	 * @param timeout absolute time, in milliseconds since epoch, after which the commitment may expire
	 * @param finalCltvDelta time-lock delta, in blocks, required of the final hop
	 */
	public void prepareSwap(SwapHash hash, long amount, long timeout, int finalCltvDelta) throws SwapException;

	/**
	 * Pays <tt>amount</tt> satoshis to <tt>address</tt>, locked to <tt>hash</tt>.
	 *
	 * @return future completing with the preimage once the counterparty claims the payment
	 */
	public CompletableFuture<SwapPreimage> initiateSwap(String address, SwapHash hash, long amount, int maxTimeLock, int finalDelta);

	/**
	 * Like {@link #initiateSwap(String, SwapHash, long, int, int)} but bounded by absolute <tt>maxTime</tt> (ms since epoch).
	 */
	public CompletableFuture<SwapPreimage> translateSwap(String address, SwapHash hash, long amount, long maxTime);

	/** Settles a prepared swap by revealing <tt>preimage</tt>. */
	public void settleSwap(SwapPreimage preimage) throws SwapException;

	public void cancelSwap(SwapHash hash) throws SwapException;

	/** @return future completing with the time (ms since epoch) the counterparty's commitment to <tt>hash</tt> was received */
	public CompletableFuture<Long> waitForSwapCommitment(SwapHash hash);

	/** @return future completing with the preimage once the swap for <tt>hash</tt> has settled */
	public CompletableFuture<SwapPreimage> getSettledSwapPreimage(SwapHash hash);

	// Balances, all in satoshis

	public long getTotalChannelBalance() throws SwapException;

	public long getTotalPendingChannelBalance() throws SwapException;

	public long getUncommittedBalance() throws SwapException;

	public long getUncommittedPendingBalance() throws SwapException;

	/** Largest balance a single channel may hold. */
	public long getMaxChannelBalance();

	/** Amount we can currently send to peer <tt>publicKey</tt> over direct channels, including pending-open ones. */
	public long getOutboundCapacity(String publicKey) throws SwapException;

	/** Amount peer <tt>publicKey</tt> can currently send to us over direct channels, including pending-open ones. */
	public long getInboundCapacity(String publicKey) throws SwapException;

}
