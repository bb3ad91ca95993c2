package io.branchlite.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EventTest {

    @Test
    void target_splits_into_namespace_and_local_id() {
        var e = Events.create("e1", 1, "posts:p1", "{}");
        assertEquals("posts", e.namespace());
        assertEquals("p1", e.localId());

        var bare = Events.create("e2", 1, "singleton", "{}");
        assertEquals("singleton", bare.namespace());
        assertEquals("", bare.localId());
    }

    @Test
    void relationship_ops_classify_with_their_entity_counterparts() {
        assertTrue(EventOp.REL_CREATE.isCreate());
        assertTrue(EventOp.REL_DELETE.isDelete());
        assertFalse(EventOp.REL_CREATE.isUpdate());
        assertTrue(EventOp.UPDATE.isUpdate());
    }

    @Test
    void ops_parse_case_insensitively() {
        assertEquals(EventOp.REL_DELETE, EventOp.parse(" rel_delete "));
        var ex = assertThrows(IllegalArgumentException.class, () -> EventOp.parse("MOVE"));
        assertEquals("Unknown event op: MOVE", ex.getMessage());
    }

    @Test
    void events_read_from_json_keep_absent_and_null_apart() throws Exception {
        String json = "{\"id\":\"e1\",\"ts\":5,\"op\":\"update\",\"target\":\"posts:p1\","
                + "\"before\":null,\"after\":{\"title\":\"x\"},\"actor\":\"alice\"}";

        Event e = new ObjectMapper().readValue(json, Event.class);

        assertEquals(EventOp.UPDATE, e.op());
        assertEquals(5L, e.ts());
        assertNotNull(e.before());
        assertTrue(e.before().isNull());
        assertNull(e.metadata());
        assertEquals("x", e.after().get("title").textValue());
    }

    @Test
    void written_events_omit_absent_fields_and_helpers() throws Exception {
        String json = new ObjectMapper().writeValueAsString(Events.delete("e1", 5, "posts:p1", "{'a':1}"));

        assertFalse(json.contains("\"after\""), json);
        assertFalse(json.contains("\"create\""), json);
        assertTrue(json.contains("\"op\":\"DELETE\""), json);
    }
}
