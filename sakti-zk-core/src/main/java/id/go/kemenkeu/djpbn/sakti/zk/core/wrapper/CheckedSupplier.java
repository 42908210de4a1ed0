package id.go.kemenkeu.djpbn.sakti.zk.core.wrapper;

/**
 * Supplier that may throw checked exceptions
 */
@FunctionalInterface
public interface CheckedSupplier<T> {
    T get() throws Exception;
}
