package org.ledgerswap.channel;

import java.util.concurrent.TimeoutException;

import org.ledgerswap.crosschain.SwapException;

/**
 * Finite, lazily-produced stream of {@link ChannelOpenEvent}s for one channel-open request.
 * <p>
 * Closing the subscription discards any further events; it does not abort the channel open.
 */
public interface ChannelOpenSubscription extends AutoCloseable {

	/**
	 * Waits for the next event.
	 *
	 * @return next event, or null if the stream has ended
	 * @throws SwapException if the engine reports an error for this channel open
	 * @throws TimeoutException if no event arrives within <tt>timeoutMillis</tt>
	 */
	public ChannelOpenEvent next(long timeoutMillis) throws SwapException, TimeoutException, InterruptedException;

	@Override
	public void close();

}
