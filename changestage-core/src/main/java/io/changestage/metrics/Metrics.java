/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.changestage.metrics;

import java.lang.management.ManagementFactory;
import java.util.Map;
import java.util.stream.Collectors;

import javax.management.InstanceAlreadyExistsException;
import javax.management.InstanceNotFoundException;
import javax.management.JMException;
import javax.management.MBeanServer;
import javax.management.MalformedObjectNameException;
import javax.management.ObjectName;

import org.apache.kafka.common.utils.Sanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.changestage.ChangeStageException;
import io.changestage.annotation.ThreadSafe;

/**
 * Base for metrics implementations exposed as MBeans on the platform MBean server.
 *
 * @author Jiri Pechanec
 */
@ThreadSafe
public abstract class Metrics {

    private static final Logger LOGGER = LoggerFactory.getLogger(Metrics.class);

    private final ObjectName name;
    private volatile boolean registered = false;

    protected Metrics(String contextName, Map<String, String> tags) {
        this.name = metricName(contextName, tags);
    }

    public ObjectName getName() {
        return name;
    }

    public boolean isRegistered() {
        return registered;
    }

    /**
     * Registers a metrics MBean into the platform MBean server.
     * Synchronized so that registration and unregistration never interleave.
     */
    public synchronized void register() {
        try {
            final MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
            if (mBeanServer == null) {
                LOGGER.info("JMX not supported, bean '{}' not registered", name);
                return;
            }
            try {
                mBeanServer.registerMBean(this, name);
            }
            catch (InstanceAlreadyExistsException e) {
                // a cache of a restarted job may still be around, replace it
                LOGGER.warn("Metrics MBean '{}' already registered, replacing it", name);
                mBeanServer.unregisterMBean(name);
                mBeanServer.registerMBean(this, name);
            }
            registered = true;
        }
        catch (JMException e) {
            throw new ChangeStageException("Unable to register the MBean '" + name + "'", e);
        }
    }

    /**
     * Unregisters a metrics MBean from the platform MBean server.
     */
    public synchronized void unregister() {
        if (this.name != null && registered) {
            try {
                final MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
                if (mBeanServer == null) {
                    LOGGER.debug("JMX not supported, bean '{}' not registered", name);
                    return;
                }
                try {
                    mBeanServer.unregisterMBean(name);
                }
                catch (InstanceNotFoundException e) {
                    LOGGER.info("Unable to unregister metrics MBean '{}' as it was not found", name);
                }
                registered = false;
            }
            catch (JMException e) {
                throw new ChangeStageException("Unable to unregister the MBean '" + name + "'", e);
            }
        }
    }

    /**
     * Create a JMX metric name for the given context and tags.
     * @return the JMX metric name
     */
    protected ObjectName metricName(String contextName, Map<String, String> tags) {
        final String metricName = "changestage." + contextName.toLowerCase() + ":"
                + tags.entrySet().stream()
                        .map(e -> e.getKey() + "=" + Sanitizer.jmxSanitize(e.getValue()))
                        .collect(Collectors.joining(","));
        try {
            return new ObjectName(metricName);
        }
        catch (MalformedObjectNameException e) {
            throw new ChangeStageException("Invalid metric name '" + metricName + "'", e);
        }
    }
}
