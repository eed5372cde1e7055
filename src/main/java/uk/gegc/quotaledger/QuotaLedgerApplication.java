package uk.gegc.quotaledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QuotaLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuotaLedgerApplication.class, args);
    }
}
