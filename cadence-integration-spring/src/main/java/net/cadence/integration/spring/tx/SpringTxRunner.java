package net.cadence.integration.spring.tx;

import net.cadence.adapter.jdbc.TxContext;
import net.cadence.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * Spring 트랜잭션 기반 {@link TxRunner}. Spring 이 바인딩한 커넥션을
 * {@link TxContext} 로 JDBC 리포지토리에 노출.
 */
public final class SpringTxRunner implements TxRunner {
    private final TransactionTemplate required;
    private final TransactionTemplate requiresNew;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.required = template(tm, TransactionDefinition.PROPAGATION_REQUIRED);
        this.requiresNew = template(tm, TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.ds = ds;
    }

    private static TransactionTemplate template(PlatformTransactionManager tm, int propagation) {
        TransactionTemplate tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);
        return tpl;
    }

    @Override
    public <T> T required(Callable<T> body) {
        return execute(required, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) {
        return execute(requiresNew, body);
    }

    private <T> T execute(TransactionTemplate tpl, Callable<T> body) {
        return tpl.execute(status -> {
            // REQUIRED 면 바깥과 같은 커넥션, REQUIRES_NEW 면 새 커넥션
            Connection outer = TxContext.get();
            Connection con = DataSourceUtils.getConnection(ds);
            try {
                TxContext.set(con);
                return body.call();
            } catch (RuntimeException re) {
                throw re;
            } catch (Exception e) {
                throw new RuntimeException(e);
            } finally {
                if (outer != null) TxContext.set(outer);
                else TxContext.clear();
                DataSourceUtils.releaseConnection(con, ds);
            }
        });
    }
}
