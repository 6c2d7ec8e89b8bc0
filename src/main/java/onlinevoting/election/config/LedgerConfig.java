package onlinevoting.election.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import onlinevoting.election.ledger.ElectionLedger;

@Configuration
public class LedgerConfig {

    private static final Logger log = LoggerFactory.getLogger(LedgerConfig.class);

    @Bean
    public ElectionLedger electionLedger(
            @Value("${app.candidate-id-prefix:" + ElectionLedger.DEFAULT_ID_PREFIX + "}") String idPrefix
    ) {
        log.info("Election ledger created with candidate id prefix: {}", idPrefix);
        return new ElectionLedger(idPrefix);
    }
}
