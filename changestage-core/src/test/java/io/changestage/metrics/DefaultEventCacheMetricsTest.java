/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.changestage.metrics;

import static org.assertj.core.api.Assertions.assertThat;

import java.lang.management.ManagementFactory;

import javax.management.MBeanServer;
import javax.management.ObjectName;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import io.changestage.cache.EventAppender;
import io.changestage.cache.RedoEventCache;
import io.changestage.pipeline.ChangeEvent;
import io.changestage.relational.TableId;

public class DefaultEventCacheMetricsTest {

    private final MBeanServer server = ManagementFactory.getPlatformMBeanServer();
    private DefaultEventCacheMetrics metrics;

    @AfterEach
    public void afterEach() {
        if (metrics != null) {
            metrics.close();
        }
    }

    @Test
    public void shouldNameMBeanAfterJob() throws Exception {
        metrics = new DefaultEventCacheMetrics("job-1", 100);

        assertThat(metrics.getName()).isEqualTo(new ObjectName("changestage.redo-event-cache:job=job-1"));
    }

    @Test
    public void shouldQuoteJobIdentifierWithSpecialCharacters() throws Exception {
        metrics = new DefaultEventCacheMetrics("job:2,a=b", 100);

        assertThat(metrics.getName().getKeyProperty("job")).isEqualTo(ObjectName.quote("job:2,a=b"));
    }

    @Test
    public void shouldExposeAttributesOverJmx() throws Exception {
        metrics = new DefaultEventCacheMetrics("job-jmx", 500);
        metrics.register();

        metrics.add(120);
        metrics.add(30);
        metrics.subtract(100);

        ObjectName name = metrics.getName();
        assertThat(server.isRegistered(name)).isTrue();
        assertThat(server.getAttribute(name, "CachedBytes")).isEqualTo(50L);
        assertThat(server.getAttribute(name, "CapacityBytes")).isEqualTo(500L);
        assertThat(server.getAttribute(name, "AdmittedBytes")).isEqualTo(150L);
        assertThat(server.getAttribute(name, "ReleasedBytes")).isEqualTo(100L);

        server.invoke(name, "reset", new Object[0], new String[0]);
        assertThat(server.getAttribute(name, "AdmittedBytes")).isEqualTo(0L);
        assertThat(server.getAttribute(name, "ReleasedBytes")).isEqualTo(0L);
        assertThat(server.getAttribute(name, "CachedBytes")).isEqualTo(50L);
    }

    @Test
    public void shouldReplaceMBeanOfSameJob() {
        DefaultEventCacheMetrics previous = new DefaultEventCacheMetrics("job-restarted", 100);
        previous.register();
        metrics = new DefaultEventCacheMetrics("job-restarted", 100);
        metrics.register();

        metrics.add(10);
        assertThat(metrics.isRegistered()).isTrue();
        assertThat(server.isRegistered(metrics.getName())).isTrue();
    }

    @Test
    public void shouldUnregisterOnClose() {
        metrics = new DefaultEventCacheMetrics("job-closed", 100);
        metrics.register();
        ObjectName name = metrics.getName();

        metrics.close();
        assertThat(metrics.isRegistered()).isFalse();
        assertThat(server.isRegistered(name)).isFalse();

        // closing twice is harmless
        metrics.close();
    }

    @Test
    public void shouldTrackBytesOfCache() {
        metrics = new DefaultEventCacheMetrics("job-cache", 100);
        metrics.register();
        TableId orders = TableId.parse("shop.orders");

        RedoEventCache<SizedEvent> cache = new RedoEventCache<>("job-cache", 100, metrics);
        EventAppender<SizedEvent> appender = cache.getAppender(orders);
        appender.push(new SizedEvent(1), 60, true);
        appender.push(new SizedEvent(2), 50, true);
        assertThat(metrics.getCachedBytes()).isEqualTo(60L);

        cache.pop(orders);
        assertThat(metrics.getCachedBytes()).isZero();
        assertThat(metrics.getAdmittedBytes()).isEqualTo(60L);
        assertThat(metrics.getReleasedBytes()).isEqualTo(60L);

        cache.close();
        assertThat(server.isRegistered(metrics.getName())).isFalse();
    }

    private static class SizedEvent implements ChangeEvent {
        private final long commitSequence;

        SizedEvent(long commitSequence) {
            this.commitSequence = commitSequence;
        }

        @Override
        public long commitSequence() {
            return commitSequence;
        }

        @Override
        public long startSequence() {
            return commitSequence - 1;
        }

        @Override
        public long objectSize() {
            return 10;
        }
    }
}
