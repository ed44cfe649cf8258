package com.bankledger.reporting;

import com.bankledger.users.UserRole;
import lombok.Value;

import java.util.List;

/**
 * One row of the user listing.
 */
@Value
public class UserSummary {
    String nic;
    String name;
    UserRole role;
    List<String> ownedAccounts;

    /**
     * "N/A" for admins, "None" for customers without accounts, otherwise a comma-separated list.
     */
    public String getOwnedAccountsDisplay() {
        if (role != UserRole.CUSTOMER) {
            return "N/A";
        }
        return ownedAccounts.isEmpty() ? "None" : String.join(", ", ownedAccounts);
    }
}
