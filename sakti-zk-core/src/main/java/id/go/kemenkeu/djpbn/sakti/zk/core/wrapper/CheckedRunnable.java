package id.go.kemenkeu.djpbn.sakti.zk.core.wrapper;

@FunctionalInterface
public interface CheckedRunnable {
    void run() throws Exception;
}
