package id.go.kemenkeu.djpbn.sakti.zk.example;

import id.go.kemenkeu.djpbn.sakti.zk.core.lock.DistributedLock;
import id.go.kemenkeu.djpbn.sakti.zk.core.lock.LockManager;
import id.go.kemenkeu.djpbn.sakti.zk.core.lock.LockOptions;
import id.go.kemenkeu.djpbn.sakti.zk.core.lock.LockResults;
import id.go.kemenkeu.djpbn.sakti.zk.starter.annotation.ZkLocked;
import jakarta.annotation.PreDestroy;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

@Service
public class SampleService {
    @Autowired
    private JdbcTemplate jdbcTemplateMain;

    @Autowired
    private ExecutorService lockedWorkers;

    private final DistributedLock refreshLock;

    public SampleService(LockManager lockManager) {
        this.refreshLock = lockManager.createLock("refresh-{table}");
    }

    @ZkLocked(key = "sample-{orderNumber}")
    public void doWork(String orderNumber) {
        jdbcTemplateMain.update("MERGE INTO demo(id, val, processed_at) KEY(id) VALUES(?,?,?)",
            orderNumber, "processed", Timestamp.from(Instant.now()));
    }

    @ZkLocked(key = "sample-sync", blocking = false, returnWhenLocked = true, lockedValue = "Sync already running")
    public String sync() {
        Integer count = jdbcTemplateMain.queryForObject("SELECT COUNT(*) FROM demo", Integer.class);
        return "Synced " + count + " rows";
    }

    /**
     * Refresh on a pooled worker; skipped when another node is already refreshing
     */
    public Future<String> refreshInBackground(String table) {
        return lockedWorkers.submit(() -> LockResults.callReturningWhenLocked("Refresh already running",
            () -> refreshLock.execute(LockOptions.nonBlocking().param("table", table),
                () -> "Refreshed " + table)));
    }

    @PreDestroy
    public void close() {
        refreshLock.close();
    }
}
