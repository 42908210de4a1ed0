package id.go.kemenkeu.djpbn.sakti.zk.core.lock;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * Concrete keys held by the current thread, partitioned by process id.
 * <p>
 * Only the entry of the current process is ever read or written, so markers
 * copied into a child process image never count as held there.
 */
class HeldKeys {

    private final ThreadLocal<Map<Long, Set<String>>> byProcess = ThreadLocal.withInitial(HashMap::new);
    private final LongSupplier processId;

    HeldKeys() {
        this(() -> ProcessHandle.current().pid());
    }

    HeldKeys(LongSupplier processId) {
        this.processId = processId;
    }

    boolean contains(String key) {
        Set<String> keys = byProcess.get().get(processId.getAsLong());
        return keys != null && keys.contains(key);
    }

    void add(String key) {
        byProcess.get().computeIfAbsent(processId.getAsLong(), pid -> new HashSet<>()).add(key);
    }

    void remove(String key) {
        Map<Long, Set<String>> processes = byProcess.get();
        long pid = processId.getAsLong();
        Set<String> keys = processes.get(pid);
        if (keys != null) {
            keys.remove(key);
            if (keys.isEmpty()) {
                processes.remove(pid);
            }
        }
        if (processes.isEmpty()) {
            byProcess.remove();
        }
    }
}
