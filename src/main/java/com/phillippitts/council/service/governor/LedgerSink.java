package com.phillippitts.council.service.governor;

/**
 * Storage collaborator that persists ledger entries. Called after each append, outside the
 * ledger lock, in sequence order per appending thread.
 */
public interface LedgerSink {

    void append(LedgerEntry entry);
}
