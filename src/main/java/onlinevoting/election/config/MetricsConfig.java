package onlinevoting.election.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import onlinevoting.election.service.ElectionService;

@Configuration
public class MetricsConfig {

    @Bean
    public Gauge totalVotesGauge(MeterRegistry registry, ElectionService electionService) {
        return Gauge.builder("election.votes.total", electionService, ElectionService::totalVotes)
                .description("Number of votes in the ledger")
                .register(registry);
    }

    @Bean
    public Gauge candidatesGauge(MeterRegistry registry, ElectionService electionService) {
        return Gauge.builder("election.candidates.count", electionService,
                        service -> service.listCandidates().size())
                .description("Number of registered candidates")
                .register(registry);
    }
}
