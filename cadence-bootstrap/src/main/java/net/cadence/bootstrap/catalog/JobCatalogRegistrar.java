package net.cadence.bootstrap.catalog;

import net.cadence.bootstrap.props.CadenceProperties;
import net.cadence.core.model.JobConfig;
import net.cadence.core.service.JobHandler;
import net.cadence.core.service.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.BeanNotOfRequiredTypeException;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;

/**
 * {@code cadence.catalog.jobs} 에 선언된 잡 등록.
 * 핸들러는 같은 이름의 {@link JobHandler} 빈이며, 빈 이름이 곧 handler id.
 */
public class JobCatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(JobCatalogRegistrar.class);

    private final JobScheduler scheduler;
    private final BeanFactory beans;

    public JobCatalogRegistrar(JobScheduler scheduler, BeanFactory beans) {
        this.scheduler = scheduler;
        this.beans = beans;
    }

    public void register(CadenceProperties.Catalog catalog) throws Exception {
        for (CadenceProperties.JobDef def : catalog.getJobs()) {
            register(def);
        }
        log.info("Catalog registered: {} job(s)", catalog.getJobs().size());
    }

    private void register(CadenceProperties.JobDef def) throws Exception {
        if (def.getHandler() == null || def.getHandler().isBlank()) {
            throw new IllegalArgumentException("job.handler is required for job '" + def.getName() + "'");
        }
        JobHandler handler;
        try {
            handler = beans.getBean(def.getHandler(), JobHandler.class);
        } catch (NoSuchBeanDefinitionException | BeanNotOfRequiredTypeException e) {
            throw new IllegalStateException("no JobHandler bean named '" + def.getHandler()
                    + "' for job '" + def.getName() + "'", e);
        }

        scheduler.registerJobWithSchedule(def.getHandler(), handler,
                JobConfig.of(def.getName(), def.getDescription(), def.getIntervalMinutes()));
        log.debug("Catalog job: {}", def);
    }
}
