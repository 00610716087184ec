package cz.vut.fit.txtdirect.redirector.handlers;

import cz.vut.fit.txtdirect.RedirectorConfig;
import cz.vut.fit.txtdirect.TxtDirectConfig;
import cz.vut.fit.txtdirect.exceptions.TypeHandlerException;
import cz.vut.fit.txtdirect.http.BufferedResponseSink;
import cz.vut.fit.txtdirect.http.ResponseSink;
import cz.vut.fit.txtdirect.models.FallbackMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class GoModsHandlerTest {

    private static GoModsHandler handler(boolean enabled) {
        final var properties = new Properties();
        properties.setProperty(RedirectorConfig.GOMODS_ENABLE_CONFIG, Boolean.toString(enabled));
        properties.setProperty(RedirectorConfig.GOMODS_UPSTREAM_CONFIG, "https://goproxy.test/");
        return new GoModsHandler(TxtDirectConfig.fromProperties(properties));
    }

    @ParameterizedTest
    @ValueSource(strings = {"/example.test/mod/@v/list", "/example.test/mod/@v/v1.0.0.zip", "/example.test/mod/@latest"})
    void redirectsModuleRequests(String path) throws TypeHandlerException {
        final var sink = new BufferedResponseSink();
        handler(true).handle(sink, "mods.example.test", path);

        assertEquals(302, sink.status());
        assertEquals("https://goproxy.test" + path, sink.header(ResponseSink.LOCATION_HEADER));
        assertEquals("302", sink.header(ResponseSink.STATUS_CODE_HEADER));
    }

    @Test
    void otherPathsAreRejected() {
        final var e = assertThrows(TypeHandlerException.class, () ->
                handler(true).handle(new BufferedResponseSink(), "mods.example.test", "/example.test/mod"));
        assertEquals(FallbackMode.TO, e.fallbackMode());
    }

    @Test
    void disabledHandlerRejectsEverything() {
        assertThrows(TypeHandlerException.class, () ->
                handler(false).handle(new BufferedResponseSink(), "mods.example.test", "/example.test/mod/@latest"));
    }
}
