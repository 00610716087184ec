package cz.vut.fit.txtdirect.models;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionContextTest {

    @Test
    void laterRecordsOverrideHeaders() {
        final var context = new ResolutionContext();
        assertFalse(context.hasRecords());
        assertNull(context.lastRecord());

        final var apex = RedirectRecord.builder().header("X-A", "apex").header("X-B", "b").build();
        final var upstream = RedirectRecord.builder().header("X-A", "upstream").build();
        context.addRecord(apex);
        context.addRecord(upstream);

        assertEquals(List.of(apex, upstream), context.records());
        assertSame(upstream, context.lastRecord());
        assertEquals("upstream", context.headers().get("X-A"));
        assertEquals("b", context.headers().get("X-B"));
    }

    @Test
    void pathMappingIsCopied() {
        final var context = new ResolutionContext();
        final var captures = new ArrayList<>(List.of("docs"));
        context.setPathMapping(captures, "/intro");
        captures.add("other");

        assertEquals(List.of("docs"), context.pathCaptures());
        assertEquals("/intro", context.pathRemainder());
    }

    @Test
    void recordTypeTags() {
        assertEquals(RecordType.DOCKERV2, RecordType.fromTag("dockerv2"));
        assertEquals(RecordType.UNSUPPORTED, RecordType.fromTag("Host"));
        assertNull(RecordType.fromTag(""));
        assertNull(RecordType.fromTag(null));
    }
}
