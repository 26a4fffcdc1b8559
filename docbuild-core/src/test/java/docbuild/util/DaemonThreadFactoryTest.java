package docbuild.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsSequentiallyNamedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("docbuild-worker-");

        Thread t1 = factory.newThread(() -> {
        });
        Thread t2 = factory.newThread(() -> {
        });

        assertTrue(t1.isDaemon());
        assertEquals("docbuild-worker-1", t1.getName());
        assertEquals("docbuild-worker-2", t2.getName());
        assertNotNull(t1.getUncaughtExceptionHandler());
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
    }
}
