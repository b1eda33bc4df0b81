package org.ledgerswap.data.escrow;

import static org.junit.Assert.*;

import org.junit.Test;
import org.ledgerswap.crosschain.SwapException;

public class EscrowStatusTests {

	@Test
	public void testKnownStatuses() throws SwapException {
		assertEquals(EscrowStatus.PENDING, EscrowStatus.fromWireValue("pending"));
		assertEquals(EscrowStatus.CANCELED, EscrowStatus.fromWireValue("canceled"));
		assertEquals(EscrowStatus.COMPLETE, EscrowStatus.fromWireValue("complete"));

		assertFalse(EscrowStatus.PENDING.isFinal());
		assertTrue(EscrowStatus.CANCELED.isFinal());
		assertTrue(EscrowStatus.COMPLETE.isFinal());
	}

	@Test
	public void testUnknownStatus() {
		for (String wireValue : new String[] { "cancelled", "PENDING", "", null })
			try {
				EscrowStatus.fromWireValue(wireValue);
				fail("Expected UnknownStatusException for " + wireValue);
			} catch (SwapException.UnknownStatusException e) {
				assertEquals(wireValue, e.getStatus());
			}
	}

}
