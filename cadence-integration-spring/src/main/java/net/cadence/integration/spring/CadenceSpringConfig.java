package net.cadence.integration.spring;

import net.cadence.adapter.jdbc.repo.JdbcJobExecutionRepository;
import net.cadence.adapter.jdbc.repo.JdbcScheduledJobRepository;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.JobExecutionRepository;
import net.cadence.core.spi.ScheduledJobRepository;
import net.cadence.core.spi.TxRunner;
import net.cadence.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/**
 * 애플리케이션의 DataSource/트랜잭션 매니저 위에 저장소 배선.
 */
@Configuration
public class CadenceSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // adapter-jdbc 리포지토리 (TxRunner 안에서만 사용)
    @Bean public ScheduledJobRepository scheduledJobRepository() { return new JdbcScheduledJobRepository(); }
    @Bean public JobExecutionRepository jobExecutionRepository() { return new JdbcJobExecutionRepository(); }

    @Bean public Clock systemClock() { return Clock.system(); }
}
