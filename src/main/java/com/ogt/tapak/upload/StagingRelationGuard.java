package com.ogt.tapak.upload;

import com.ogt.tapak.config.TapakProperties;
import com.ogt.tapak.exception.StagingBusyException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializa import + reconcile + truncate sobre la relación de staging compartida.
 * Sin esto dos cargas concurrentes pisan el overwrite de ogr2ogr y se mezclan filas.
 * <p>
 * El lock es local a la JVM: con varias instancias cada una necesita su propia tabla de staging.
 */
@Component
public class StagingRelationGuard {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Duration timeout;

    @Autowired
    public StagingRelationGuard(TapakProperties properties) {
        this(properties.getStagingLockTimeout());
    }

    public StagingRelationGuard(Duration timeout) {
        this.timeout = timeout;
    }

    public <T> T exclusively(String stagingRelation, Supplier<T> criticalSection) {
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StagingBusyException(stagingRelation);
        }
        if (!acquired) {
            throw new StagingBusyException(stagingRelation);
        }
        try {
            return criticalSection.get();
        } finally {
            lock.unlock();
        }
    }
}
