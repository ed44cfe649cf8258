package com.bankledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Bank Ledger.
 *
 * Bank Ledger keeps users, accounts, balances and transaction histories in flat text files.
 * On startup the files are loaded (creating a first admin if none exist); the identity,
 * account, ledger and reporting services then serve a single interactive session.
 */
@SpringBootApplication
public class BankLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BankLedgerApplication.class, args);
    }
}
