package org.ledgerswap.event;

public interface Event {
}
