package org.dxdomain.analyzer.common;

import org.slf4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/*
Logs at info level, but at most once per 'delay' milliseconds; other calls are dropped.
 */
public class TimedLogger {
    private final Logger logger;
    private final long delay;
    private final AtomicLong lastLog = new AtomicLong();

    public TimedLogger(Logger logger, long delay) {
        this.logger = logger;
        this.delay = delay;
    }

    public void info(String msg, Object... objects) {
        long now = System.currentTimeMillis();
        long last = lastLog.get();
        if (now - last >= delay && lastLog.compareAndSet(last, now)) {
            logger.info(msg, objects);
        }
    }
}
