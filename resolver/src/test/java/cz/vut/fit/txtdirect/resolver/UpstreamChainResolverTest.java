package cz.vut.fit.txtdirect.resolver;

import cz.vut.fit.txtdirect.TxtDirectConfig;
import cz.vut.fit.txtdirect.exceptions.TxtDirectException;
import cz.vut.fit.txtdirect.exceptions.UpstreamExhaustedException;
import cz.vut.fit.txtdirect.http.RedirectRequest;
import cz.vut.fit.txtdirect.models.RecordType;
import cz.vut.fit.txtdirect.models.RedirectRecord;
import cz.vut.fit.txtdirect.models.ResolutionContext;
import cz.vut.fit.txtdirect.resolver.placeholders.PlaceholderExpander;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UpstreamChainResolverTest {

    private static UpstreamChainResolver makeResolver(Map<String, List<String>> zones) {
        final var config = TxtDirectConfig.withEnabled(EnumSet.of(RecordType.HOST, RecordType.DOCKERV2), "");
        final var parser = new DirectiveParser(config, new PlaceholderExpander());
        return new UpstreamChainResolver(new ZoneResolver(ZoneResolverTest.mapLookup(zones), parser));
    }

    private static RedirectRecord pointer(String... zones) {
        final var builder = RedirectRecord.builder();
        for (var zone : zones)
            builder.addUse(zone);
        return builder.build();
    }

    @Test
    void firstResolvingZoneWins() throws TxtDirectException {
        final var resolver = makeResolver(Map.of(
                "_redirect.backup.test.", List.of("to=https://backup.test"),
                "_redirect.mirror.test.", List.of("to=https://mirror.test")));
        final var context = new ResolutionContext();
        final var request = RedirectRequest.builder().host("example.test").build();

        final var result = resolver.resolveUpstream(
                pointer("_redirect.missing.test", "_redirect.backup.test", "_redirect.mirror.test"),
                request, context);

        assertEquals("_redirect.backup.test", result.zone());
        assertEquals("https://backup.test", result.record().to());
        assertEquals("backup.test", context.upstreamZone());
        assertSame(result.record(), context.lastRecord());
    }

    @Test
    void exhaustedZonesFail() {
        final var resolver = makeResolver(Map.of());
        final var context = new ResolutionContext();

        final var e = assertThrows(UpstreamExhaustedException.class, () -> resolver.resolveUpstream(
                pointer("_redirect.one.test", "_redirect.two.test"),
                RedirectRequest.builder().host("example.test").build(), context));
        assertNotNull(e.getCause());
        assertNull(context.upstreamZone());
    }
}
