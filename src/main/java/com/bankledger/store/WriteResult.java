package com.bankledger.store;

import lombok.Value;

/**
 * Result of a mutating operation: the value it produced and how the follow-up save went.
 * The mutation is applied in memory even when the save failed; {@link #isDurable()}
 * tells the caller whether it also reached disk.
 */
@Value
public class WriteResult<T> {
    T value;
    SaveResult saveResult;

    public static <T> WriteResult<T> of(T value, SaveResult saveResult) {
        return new WriteResult<>(value, saveResult);
    }

    public boolean isDurable() {
        return saveResult.isSuccessful();
    }
}
