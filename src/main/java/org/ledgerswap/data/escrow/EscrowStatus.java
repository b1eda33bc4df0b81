package org.ledgerswap.data.escrow;

import java.util.Map;

import org.ledgerswap.crosschain.SwapException;

import static java.util.Arrays.stream;
import static java.util.stream.Collectors.toMap;

/**
 * Lifecycle of an escrow, as reported by the escrow service.
 * <p>
 * Strictly forward-moving: an escrow never returns to {@link #PENDING}.
 */
public enum EscrowStatus {
	PENDING("pending"),
	CANCELED("canceled"),
	COMPLETE("complete");

	private static final Map<String, EscrowStatus> map = stream(EscrowStatus.values()).collect(toMap(status -> status.wireValue, status -> status));

	public final String wireValue;

	EscrowStatus(String wireValue) {
		this.wireValue = wireValue;
	}

	/** @throws SwapException.UnknownStatusException if <tt>wireValue</tt> is not a known status */
	public static EscrowStatus fromWireValue(String wireValue) throws SwapException.UnknownStatusException {
		EscrowStatus status = wireValue == null ? null : map.get(wireValue);
		if (status == null)
			throw new SwapException.UnknownStatusException(wireValue);

		return status;
	}

	public boolean isFinal() {
		return this != PENDING;
	}
}
