package net.cadence.bootstrap.autoconfigure;

import net.cadence.bootstrap.catalog.JobCatalogRegistrar;
import net.cadence.bootstrap.props.CadenceProperties;
import net.cadence.core.maintenance.ExecutionMaintenanceService;
import net.cadence.core.service.JobScheduler;
import net.cadence.core.service.SchedulerOptions;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.JobExecutionRepository;
import net.cadence.core.spi.ScheduledJobRepository;
import net.cadence.core.spi.TxRunner;
import net.cadence.integration.spring.CadenceSpringConfig;
import net.cadence.integration.spring.sched.MaintenanceScheduler;
import net.cadence.integration.spring.sched.SchedulerLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Duration;

@AutoConfiguration(
        after = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class},
        afterName = "org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration")
@ConditionalOnBean({DataSource.class, PlatformTransactionManager.class})
@EnableConfigurationProperties(CadenceProperties.class)
@Import(CadenceSpringConfig.class) // integration-spring: repo/tx/clock 배선
public class CadenceAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(CadenceAutoConfiguration.class);

    // --- core 서비스 ---

    @Bean
    @ConditionalOnMissingBean
    public SchedulerOptions schedulerOptions(CadenceProperties props) {
        CadenceProperties.Scheduler s = props.getScheduler();
        return new SchedulerOptions(s.getPollInterval(), s.getExecutionTimeout(), s.getShutdownGrace());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(ScheduledJobRepository jobs,
                                     JobExecutionRepository executions,
                                     TxRunner tx,
                                     Clock clock,
                                     SchedulerOptions options) {
        return new JobScheduler(jobs, executions, tx, clock, options);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionMaintenanceService executionMaintenance(JobExecutionRepository executions,
                                                            TxRunner tx,
                                                            Clock clock) {
        return new ExecutionMaintenanceService(executions, tx, clock);
    }

    // --- lifecycle ---

    @Bean
    @ConditionalOnProperty(prefix = "cadence.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SchedulerLifecycle schedulerLifecycle(JobScheduler scheduler) {
        return new SchedulerLifecycle(scheduler);
    }

    // --- catalog: 싱글톤 생성 완료 후, 스케줄러 시작 전에 등록 ---

    @Bean
    public JobCatalogRegistrar jobCatalogRegistrar(JobScheduler scheduler, BeanFactory beanFactory) {
        return new JobCatalogRegistrar(scheduler, beanFactory);
    }

    @Bean
    @ConditionalOnProperty(prefix = "cadence.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SmartInitializingSingleton jobCatalogInitializer(JobCatalogRegistrar registrar, CadenceProperties props) {
        return () -> {
            log.info("Cadence catalog: {} job(s) declared", props.getCatalog().getJobs().size());
            try {
                registrar.register(props.getCatalog());
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException("catalog registration failed", e);
            }
        };
    }

    @Configuration(proxyBeanMethods = false)
    @EnableScheduling
    @ConditionalOnProperty(prefix = "cadence.maintenance", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class MaintenanceConfiguration {

        // @Scheduled 주기는 cadence.maintenance.delay-ms, 나머지는 여기서 세팅
        @Bean
        public MaintenanceScheduler maintenanceScheduler(ExecutionMaintenanceService maintenance,
                                                         SchedulerOptions options,
                                                         CadenceProperties props) {
            MaintenanceScheduler s = new MaintenanceScheduler(maintenance);
            Duration staleAfter = props.getMaintenance().getStaleAfter();
            s.setStaleAfter(staleAfter != null ? staleAfter : options.staleExecutionThreshold());
            s.setRetention(props.getMaintenance().getRetention());
            return s;
        }
    }
}
