package net.cadence.core.support;

import net.cadence.core.spi.TxRunner;

import java.util.concurrent.Callable;

/** 트랜잭션 없음. 인메모리 저장소는 호출 단위로 원자적 */
public final class DirectTxRunner implements TxRunner {
    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return body.call();
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return body.call();
    }
}
