package com.bankledger.ledger;

import lombok.Value;

/**
 * Both sides of a completed transfer.
 */
@Value
public class TransferRecord {
    TransferTransaction sent;
    TransferTransaction received;
}
