package com.vtb.traffic.automation;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Сигнал отмены прогона. Прерывает ожидание между запросами.
 */
public class CancellationSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void cancel() {
        latch.countDown();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Ждать {@code delayMs} или до отмены
     *
     * @return {@code true}, если ожидание прервано отменой или прерыванием потока
     */
    public boolean await(long delayMs) {
        try {
            return latch.await(delayMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
