package com.yescount.planner.domain.port.out;

import java.time.Duration;

/**
 * Guards against two processes running the ingestion pipeline at once.
 */
public interface IngestionLock {

    boolean tryAcquire(Duration ttl);

    void release();
}
