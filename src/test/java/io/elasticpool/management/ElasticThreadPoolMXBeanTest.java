package io.elasticpool.management;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.management.ManagementFactory;
import java.time.Duration;

import javax.management.Attribute;
import javax.management.JMX;
import javax.management.MBeanServer;
import javax.management.ObjectName;

import io.elasticpool.ElasticThreadPool;
import io.elasticpool.PoolStatus;
import org.junit.jupiter.api.Test;

public final class ElasticThreadPoolMXBeanTest {

    @Test
    public void testAttributes() throws Exception {
        final ElasticThreadPool pool = new ElasticThreadPool(1, 3, Duration.ofMillis(500));
        try {
            final ElasticThreadPoolMXBean bean = pool.getThreadPoolMXBean();
            assertEquals(1, bean.getMinThreads());
            assertEquals(3, bean.getMaxThreads());
            assertEquals(500L, bean.getMaxIdleTimeMillis());
            assertEquals("STOP", bean.getStatus());
            pool.submit(() -> "x").get();
            assertEquals("RUNNING", bean.getStatus());
            assertEquals(1L, bean.getSubmittedTaskCount());
            assertTrue(bean.getCurrentThreadCount() >= 1);
            assertTrue(bean.pause());
            assertEquals(PoolStatus.PAUSE, pool.getStatus());
            assertTrue(bean.resume());
            bean.setMaxThreads(5);
            bean.setMinThreads(2);
            bean.setMaxIdleTimeMillis(1000L);
            assertEquals(5, pool.getMaxThreads());
            assertEquals(2, pool.getMinThreads());
            assertEquals(Duration.ofSeconds(1), pool.getMaxIdleTime());
        } finally {
            pool.stop();
        }
    }

    @Test
    public void testPlatformRegistration() throws Exception {
        final ElasticThreadPool pool = new ElasticThreadPool(1, 2, Duration.ofMillis(250));
        final MBeanServer server = ManagementFactory.getPlatformMBeanServer();
        final ObjectName name = new ObjectName("io.elasticpool:type=ElasticThreadPool,name=mxbean-test");
        server.registerMBean(pool.getThreadPoolMXBean(), name);
        try {
            assertEquals(Integer.valueOf(2), server.getAttribute(name, "MaxThreads"));
            server.setAttribute(name, new Attribute("MaxThreads", Integer.valueOf(4)));
            assertEquals(4, pool.getMaxThreads());
            assertEquals("STOP", server.getAttribute(name, "Status"));
            pool.start();
            final ElasticThreadPoolMXBean proxy = JMX.newMXBeanProxy(server, name, ElasticThreadPoolMXBean.class);
            assertEquals(1, proxy.getCurrentThreadCount());
            assertEquals(Boolean.TRUE, server.invoke(name, "pause", new Object[0], new String[0]));
            assertTrue(pool.isPaused());
        } finally {
            server.unregisterMBean(name);
            pool.stop();
        }
    }
}
