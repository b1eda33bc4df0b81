package org.ledgerswap.event;

@FunctionalInterface
public interface Listener {
	void listen(Event event);
}
