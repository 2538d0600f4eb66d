package com.corebank.ledger;

import com.corebank.ledger.config.CoreBankProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * CoreBank ledger service: double-entry ledger engine plus the investment
 * accounting overlay.
 *
 * @EnableTransactionManagement is declared explicitly: every public engine
 * operation is exactly one @Transactional unit of work and that must never be
 * switched off by accident.
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableConfigurationProperties(CoreBankProperties.class)
public class CoreBankLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoreBankLedgerApplication.class, args);
    }

}
