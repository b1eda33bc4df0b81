package org.ledgerswap.test.common;

import java.util.ArrayList;
import java.util.List;

/** Ordered record of calls made to fake ledgers, shared so cross-ledger ordering can be asserted. */
public class CallLog {

	private final List<String> calls = new ArrayList<>();

	public synchronized void add(String call) {
		this.calls.add(call);
	}

	public synchronized List<String> getCalls() {
		return new ArrayList<>(this.calls);
	}

	/** Index of first call starting with <tt>prefix</tt>, or -1. */
	public synchronized int indexOf(String prefix) {
		for (int i = 0; i < this.calls.size(); ++i)
			if (this.calls.get(i).startsWith(prefix))
				return i;

		return -1;
	}

	public synchronized boolean contains(String prefix) {
		return indexOf(prefix) >= 0;
	}

	public synchronized int count(String prefix) {
		return (int) this.calls.stream().filter(call -> call.startsWith(prefix)).count();
	}

	public synchronized void clear() {
		this.calls.clear();
	}

	@Override
	public synchronized String toString() {
		return this.calls.toString();
	}

}
