package cz.vut.fit.txtdirect;

import cz.vut.fit.txtdirect.models.RecordType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class TxtDirectConfigTest {

    @Test
    void defaults() {
        final var config = TxtDirectConfig.fromProperties(new Properties());

        assertEquals(EnumSet.of(RecordType.HOST, RecordType.PATH, RecordType.GOMETA, RecordType.DOCKERV2),
                config.enabled());
        assertEquals("", config.redirect());
        assertTrue(config.resolvers().isEmpty());
        assertEquals(Duration.ofSeconds(3), config.resolverTimeout());
        assertEquals(1, config.resolverRetries());
        assertEquals(8080, config.httpPort());
        assertEquals(32, config.workers());
        assertFalse(config.gomods().enabled());
        assertEquals("https://proxy.golang.org", config.gomods().upstream());
        assertFalse(config.metrics().enabled());
    }

    @Test
    void readsProperties() {
        final var properties = new Properties();
        properties.setProperty(RedirectorConfig.ENABLE_CONFIG, " host , proxy,gomods ");
        properties.setProperty(RedirectorConfig.REDIRECT_CONFIG, " https://fallback.test ");
        properties.setProperty(RedirectorConfig.RESOLVER_CONFIG, "127.0.0.1:5353, 10.0.0.1");
        properties.setProperty(RedirectorConfig.REQUEST_TIMEOUT_MS_CONFIG, "1500");
        properties.setProperty(RedirectorConfig.METRICS_ENABLE_CONFIG, "true");

        final var config = TxtDirectConfig.fromProperties(properties);

        assertEquals(EnumSet.of(RecordType.HOST, RecordType.PROXY, RecordType.GOMODS), config.enabled());
        assertEquals("https://fallback.test", config.redirect());
        assertEquals(List.of("127.0.0.1:5353", "10.0.0.1"), config.resolvers());
        assertEquals(Duration.ofMillis(1500), config.requestTimeout());
        assertTrue(config.metrics().enabled());
    }

    @Test
    void unknownTypesAreIgnored() {
        final var properties = new Properties();
        properties.setProperty(RedirectorConfig.ENABLE_CONFIG, "host,ftp");

        final var config = TxtDirectConfig.fromProperties(properties);

        assertEquals(EnumSet.of(RecordType.HOST), config.enabled());
        assertFalse(config.isEnabled(RecordType.UNSUPPORTED));
        assertFalse(config.isEnabled(null));
    }

    @Test
    void invalidNumberIsRejected() {
        final var properties = new Properties();
        properties.setProperty(RedirectorConfig.WORKERS_CONFIG, "many");

        assertThrows(NumberFormatException.class, () -> TxtDirectConfig.fromProperties(properties));
    }

    @Test
    void withEnabledNeverEnablesUnsupported() {
        final var config = TxtDirectConfig.withEnabled(EnumSet.of(RecordType.PATH, RecordType.UNSUPPORTED), "x");

        assertEquals(EnumSet.of(RecordType.PATH), config.enabled());
        assertEquals("x", config.redirect());
        assertThrows(UnsupportedOperationException.class, () -> config.enabled().add(RecordType.HOST));
    }
}
