package io.branchlite.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static io.branchlite.core.Events.json;
import static org.junit.jupiter.api.Assertions.*;

class CommutativeOpsTest {

    private static UpdateOps ops(String singleQuoted) {
        return UpdateOps.fromJson(json(singleQuoted));
    }

    @Test
    void same_accumulator_on_same_field_commutes() {
        assertTrue(CommutativeOps.isCommutative(ops("{'$inc':{'n':1}}"), ops("{'$inc':{'n':5}}")));
        assertTrue(CommutativeOps.isCommutative(ops("{'$max':{'n':1}}"), ops("{'$max':{'n':5}}")));
        assertTrue(CommutativeOps.isCommutative(ops("{'$addToSet':{'tags':'a'}}"), ops("{'$addToSet':{'tags':'b'}}")));
    }

    @Test
    void mixing_operator_kinds_on_one_field_does_not_commute() {
        assertFalse(CommutativeOps.isCommutative(ops("{'$inc':{'n':1}}"), ops("{'$set':{'n':5}}")));
        assertFalse(CommutativeOps.isCommutative(ops("{'$min':{'n':1}}"), ops("{'$max':{'n':5}}")));
        assertFalse(CommutativeOps.isCommutative(ops("{'$unset':{'n':''}}"), ops("{'$inc':{'n':5}}")));
    }

    @Test
    void push_never_commutes_on_the_same_field() {
        assertFalse(CommutativeOps.isCommutative(ops("{'$push':{'log':'a'}}"), ops("{'$push':{'log':'b'}}")));
        assertFalse(CommutativeOps.isCommutative(ops("{'$push':{'log':'a'}}"), ops("{'$addToSet':{'log':'b'}}")));
        // different fields are fine
        assertTrue(CommutativeOps.isCommutative(ops("{'$push':{'log':'a'}}"), ops("{'$set':{'title':'b'}}")));
    }

    @Test
    void disjoint_and_empty_sets_always_commute() {
        assertTrue(CommutativeOps.isCommutative(ops("{'$set':{'a':1}}"), ops("{'$set':{'b':2}}")));
        assertTrue(CommutativeOps.isCommutative(UpdateOps.empty(), ops("{'$set':{'a':1}}")));
        assertTrue(CommutativeOps.isCommutative(UpdateOps.empty(), UpdateOps.empty()));
    }

    @Test
    void is_commutative_is_symmetric_for_every_operator_pair() {
        List<String> operators = List.of("$set", "$unset", "$inc", "$push", "$pull", "$addToSet", "$min", "$max");
        List<UpdateOps> samples = new ArrayList<>();
        for (String op : operators) {
            samples.add(UpdateOps.builder().put(op, "f", 1).build());
            samples.add(UpdateOps.builder().put(op, "f", 2).put(op, "g", 3).build());
            samples.add(UpdateOps.builder().put(op, "other", 1).build());
        }
        samples.add(UpdateOps.empty());
        for (UpdateOps a : samples) {
            for (UpdateOps b : samples) {
                assertEquals(CommutativeOps.isCommutative(a, b), CommutativeOps.isCommutative(b, a),
                        () -> a + " vs " + b);
            }
        }
    }

    @Test
    void combine_sums_increments_and_unions_sets() {
        UpdateOps combined = CommutativeOps.combineOperations(
                ops("{'$inc':{'views':2},'$addToSet':{'tags':{'$each':['a','b']}}}"),
                ops("{'$inc':{'views':3},'$addToSet':{'tags':{'$each':['b','c']}}}"));

        assertEquals(5L, combined.fields("$inc").get("views").longValue());
        assertTrue(JsonValues.deepEquals(json("{'$each':['a','b','c']}"), combined.fields("$addToSet").get("tags")));
    }

    @Test
    void combine_takes_pointwise_min_and_max() {
        UpdateOps combined = CommutativeOps.combineOperations(
                ops("{'$min':{'low':4},'$max':{'high':10}}"),
                ops("{'$min':{'low':2},'$max':{'high':7}}"));

        assertEquals(2, combined.fields("$min").get("low").intValue());
        assertEquals(10, combined.fields("$max").get("high").intValue());
    }

    @Test
    void combine_unions_disjoint_sets() {
        UpdateOps combined = CommutativeOps.combineOperations(ops("{'$set':{'a':1}}"), ops("{'$set':{'b':2}}"));
        assertEquals(Set.of("a", "b"), combined.fields("$set").keySet());
    }

    @Test
    void affected_fields_span_all_operators() {
        assertEquals(Set.of("a", "b", "c"),
                CommutativeOps.getAffectedFields(ops("{'$set':{'a':1,'b':2},'$inc':{'c':1}}")));
    }

    @Test
    void operators_come_from_ops_key_or_metadata_update() {
        assertEquals(ops("{'$inc':{'n':1}}"), CommutativeOps.extractOperations(json("{'n':2,'_ops':{'$inc':{'n':1}}}")));
        assertTrue(CommutativeOps.extractOperations(json("{'n':2}")).isEmpty());
        assertTrue(CommutativeOps.extractOperations((com.fasterxml.jackson.databind.JsonNode) null).isEmpty());

        var fromMetadata = new Event("e1", 1, EventOp.UPDATE, "c:1", json("{'n':1}"), json("{'n':2}"), "bob",
                json("{'update':{'$inc':{'n':1}}}"));
        assertEquals(ops("{'$inc':{'n':1}}"), CommutativeOps.extractOperations(fromMetadata));
    }
}
