package net.cadence.adapter.jdbc;

import java.sql.Connection;

/** 현재 스레드에 바인딩된 트랜잭션 커넥션 */
public final class TxContext {
    private static final ThreadLocal<Connection> LOCAL = new ThreadLocal<>();
    private TxContext() {}

    public static void set(Connection c) { LOCAL.set(c); }
    public static Connection get() { return LOCAL.get(); }
    public static void clear() { LOCAL.remove(); }

    /** @throws IllegalStateException {@link JdbcTxRunner} 블록 밖에서 호출 시 */
    public static Connection require() {
        Connection c = LOCAL.get();
        if (c == null) throw new IllegalStateException("TxContext required (wrap with a TxRunner)");
        return c;
    }
}
