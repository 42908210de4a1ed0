package id.go.kemenkeu.djpbn.sakti.zk.starter.annotation;

import java.lang.annotation.*;

/**
 * Run the method while holding a ZooKeeper lock.
 * <p>
 * Placeholders in {@link #key()} are filled from method parameters of the same name,
 * e.g. {@code @ZkLocked(key = "order-{orderId}")} on {@code process(long orderId)}.
 */
@Target({ ElementType.METHOD })
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ZkLocked {
    String key();

    boolean blocking() default true;

    /**
     * Maximum wait for a blocking lock; negative waits indefinitely
     */
    long timeoutMs() default -1;

    /**
     * Return {@link #lockedValue()} (String methods) or {@code null} instead of
     * throwing when a non-blocking lock is taken
     */
    boolean returnWhenLocked() default false;

    String lockedValue() default "Locked";
}
