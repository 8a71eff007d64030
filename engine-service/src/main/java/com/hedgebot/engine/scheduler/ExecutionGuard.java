package com.hedgebot.engine.scheduler;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-key mutual exclusion with acquire-or-skip semantics: a task whose key is already held is not run.
 */
public class ExecutionGuard {

    private final Set<String> held = ConcurrentHashMap.newKeySet();

    /**
     * @return false when another task holds {@code key}
     */
    public boolean tryRun(String key, Runnable task) {
        if (!held.add(key)) {
            return false;
        }
        try {
            task.run();
            return true;
        } finally {
            held.remove(key);
        }
    }

    public boolean isHeld(String key) {
        return held.contains(key);
    }

    public int heldCount() {
        return held.size();
    }
}
