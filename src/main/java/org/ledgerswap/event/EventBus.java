package org.ledgerswap.event;

import java.util.concurrent.CopyOnWriteArrayList;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Process-wide swap event delivery.
 * <p>
 * Events are delivered synchronously, on the notifying thread, to listeners in registration order.
 * A listener that throws is logged and skipped; remaining listeners still receive the event
 * and the notifier never sees the failure.
 */
public enum EventBus {
	INSTANCE;

	private static final Logger LOGGER = LogManager.getLogger(EventBus.class);

	private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

	/** Registers <tt>listener</tt>. Registering the same listener again has no effect. */
	public void addListener(Listener listener) {
		this.listeners.addIfAbsent(listener);
	}

	public void removeListener(Listener listener) {
		this.listeners.remove(listener);
	}

	public int getListenerCount() {
		return this.listeners.size();
	}

	/**
	 * Delivers <tt>event</tt> to every listener on the caller's thread.
	 * <p>
	 * Listeners must not call back into the swap coordinator for the swap
	 * that raised the event, as the coordinator still holds that swap's lock.
	 */
	public void notify(Event event) {
		for (Listener listener : this.listeners)
			try {
				listener.listen(event);
			} catch (RuntimeException e) {
				LOGGER.warn(String.format("Listener failed to handle %s", event.getClass().getSimpleName()), e);
			}
	}
}
