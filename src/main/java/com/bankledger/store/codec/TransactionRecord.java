package com.bankledger.store.codec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * JSON shape of one element of the transaction log column.
 *
 * Only the keys relevant to the type are present: {@code to_account} for
 * "Transfer Sent", {@code from_account} for "Transfer Received", {@code rate}
 * for "Interest Applied".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"timestamp", "type", "amount", "to_account", "from_account", "rate"})
public class TransactionRecord {

    private String timestamp;

    private String type;

    private BigDecimal amount;

    @JsonProperty("to_account")
    private String toAccount;

    @JsonProperty("from_account")
    private String fromAccount;

    private BigDecimal rate;
}
