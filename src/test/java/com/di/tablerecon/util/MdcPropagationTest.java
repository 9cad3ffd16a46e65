package com.di.tablerecon.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MdcPropagation Tests")
class MdcPropagationTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void testWrapExecutor_WorkerSeesSubmitterMdc() throws Exception {
        ExecutorService pool = MdcPropagation.wrapExecutor(Executors.newSingleThreadExecutor());
        try {
            MDC.put(MdcPropagation.RECONCILIATION_ID, "recon-1");
            Future<String> seen = pool.submit(() -> MDC.get(MdcPropagation.RECONCILIATION_ID));
            assertEquals("recon-1", seen.get(5, TimeUnit.SECONDS));

            MDC.remove(MdcPropagation.RECONCILIATION_ID);
            Future<String> afterwards = pool.submit(() -> MDC.get(MdcPropagation.RECONCILIATION_ID));
            assertNull(afterwards.get(5, TimeUnit.SECONDS), "worker must not keep a previous run's id");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testWrapRunnable_RemovesKeysAfterRun() {
        MDC.put(MdcPropagation.RECONCILIATION_ID, "recon-2");
        Runnable wrapped = MdcPropagation.wrapRunnable(() ->
                assertEquals("recon-2", MDC.get(MdcPropagation.RECONCILIATION_ID)));

        wrapped.run();

        assertNull(MDC.get(MdcPropagation.RECONCILIATION_ID));
    }
}
