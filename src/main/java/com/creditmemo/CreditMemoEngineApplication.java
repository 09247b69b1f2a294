package com.creditmemo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Credit Memo Engine.
 *
 * Credit Memo Engine validates credit memos against amount-tiered approval
 * matrices and an approval SLA, producing a SOX verdict, a risk tier and a
 * violation breakdown per memo. Ingestion, export and presentation are left
 * to the calling systems.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CreditMemoEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CreditMemoEngineApplication.class, args);
    }
}
