package id.go.kemenkeu.djpbn.sakti.zk.starter.aspect;

import id.go.kemenkeu.djpbn.sakti.zk.core.exception.LockedException;
import id.go.kemenkeu.djpbn.sakti.zk.core.lock.DistributedLock;
import id.go.kemenkeu.djpbn.sakti.zk.core.lock.LockHandle;
import id.go.kemenkeu.djpbn.sakti.zk.core.lock.LockManager;
import id.go.kemenkeu.djpbn.sakti.zk.core.lock.LockOptions;
import id.go.kemenkeu.djpbn.sakti.zk.starter.annotation.ZkLocked;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import java.lang.reflect.Method;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Guards {@link ZkLocked} methods. One {@link DistributedLock} is created per key template
 * and shared by every method using it.
 */
@Aspect
public class ZkLockedAspect implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(ZkLockedAspect.class);

    private final LockManager lockManager;
    private final Map<String, DistributedLock> locks = new ConcurrentHashMap<>();

    public ZkLockedAspect(LockManager lockManager) {
        this.lockManager = lockManager;
    }

    @Around("@annotation(id.go.kemenkeu.djpbn.sakti.zk.starter.annotation.ZkLocked)")
    public Object around(ProceedingJoinPoint pjp) throws Throwable {
        MethodSignature signature = (MethodSignature) pjp.getSignature();
        Method method = signature.getMethod();
        ZkLocked annotation = method.getAnnotation(ZkLocked.class);

        DistributedLock lock = locks.computeIfAbsent(annotation.key(), lockManager::createLock);
        LockOptions options = LockOptions.defaults()
            .blocking(annotation.blocking())
            .timeout(annotation.timeoutMs() >= 0 ? Duration.ofMillis(annotation.timeoutMs()) : null)
            .params(keyParams(lock, signature.getParameterNames(), pjp.getArgs()));

        LockHandle handle;
        try {
            handle = lock.acquire(options);
        } catch (LockedException e) {
            if (!annotation.returnWhenLocked() || isPrimitiveResult(method)) {
                throw e;
            }
            log.debug("{} skipped - {}", method.getName(), e.getMessage());
            return String.class.equals(method.getReturnType()) ? annotation.lockedValue() : null;
        }

        Object result;
        try {
            result = pjp.proceed();
        } catch (Throwable t) {
            handle.releaseAfterFailure(t);
            throw t;
        }
        handle.release();
        return result;
    }

    /**
     * Arguments whose parameter names appear in the key template. Absent or null
     * values are left out so the template reports them as missing.
     */
    private Map<String, Object> keyParams(DistributedLock lock, String[] names, Object[] args) {
        Set<String> placeholders = lock.getTemplate().getPlaceholders();
        Map<String, Object> params = new LinkedHashMap<>();
        if (names == null) {
            return params;
        }
        for (int i = 0; i < names.length && i < args.length; i++) {
            if (placeholders.contains(names[i]) && args[i] != null) {
                params.put(names[i], args[i]);
            }
        }
        return params;
    }

    private boolean isPrimitiveResult(Method method) {
        Class<?> type = method.getReturnType();
        return type.isPrimitive() && type != void.class;
    }

    public Map<String, DistributedLock> getLocks() {
        return Map.copyOf(locks);
    }

    @Override
    public void destroy() {
        locks.values().forEach(DistributedLock::close);
        locks.clear();
    }
}
