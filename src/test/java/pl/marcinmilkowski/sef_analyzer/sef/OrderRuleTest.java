package pl.marcinmilkowski.sef_analyzer.sef;

import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for OrderRule.
 */
class OrderRuleTest {

    @Test
    @DisplayName("Rules are selected by relation and tags")
    void rulesFor() {
        assertEquals(List.of(OrderRule.PREMODIFIER_PRECEDES_HEAD), OrderRule.rulesFor(new Sef("N", "MOD", "ADJ")));
        assertEquals(List.of(OrderRule.PREMODIFIER_PRECEDES_HEAD), OrderRule.rulesFor(new Sef("PERSON", "MOD", "AGE")));
        assertEquals(List.of(OrderRule.NOUN_COMPOUND_ADJACENT), OrderRule.rulesFor(new Sef("N", "MOD", "N")));
        assertEquals(List.of(OrderRule.SUBJECT_VERB_OBJECT), OrderRule.rulesFor(new Sef("PERSON", "HIT", "PERSON")));
        assertEquals(List.of(OrderRule.COMPARISON_BETWEEN), OrderRule.rulesFor(new Sef("INSECT", "SIMILAR", "WEAPON")));
        assertEquals(List.of(OrderRule.LEFT_BEFORE_RIGHT), OrderRule.rulesFor(new Sef("BIRD", "LOC", "PLACE")));
        assertTrue(OrderRule.rulesFor(new Sef("PERSON", "DISCOVER", "OBJECT")).isEmpty());
        assertTrue(OrderRule.rulesFor(new Sef("ACTION", "MOD", "SPEED")).isEmpty());
    }

    @Test
    @DisplayName("Size, color and quality modifiers may follow their head")
    void unorderedModifiers() {
        assertTrue(OrderRule.rulesFor(new Sef("OBJECT", "MOD", "COLOR")).isEmpty());
        assertTrue(OrderRule.rulesFor(new Sef("BIRD", "MOD", "SIZE")).isEmpty());
        assertTrue(OrderRule.rulesFor(new Sef("QUALITY", "MOD", "INTENSIFIER")).isEmpty());
        assertTrue(legal(new Sef("OBJECT", "MOD", "QUALITY"), 3, 0, 6));
        assertTrue(legal(new Sef("OBJECT", "MOD", "COLOR"), 6, 0, 3));
    }

    @Test
    @DisplayName("Movement is ordered only with a nominal subject")
    void movement() {
        assertEquals(List.of(OrderRule.SUBJECT_VERB_OBJECT), OrderRule.rulesFor(new Sef("PERSON", "MOVE", "PLACE")));
        assertTrue(OrderRule.rulesFor(new Sef("DURATION", "MOVE", "WEAPON")).isEmpty());
        assertFalse(legal(new Sef("PERSON", "MOVE", "PLACE"), 4, 2, 1));
        assertTrue(legal(new Sef("DURATION", "MOVE", "WEAPON"), 4, 2, 1));
    }

    @Test
    @DisplayName("Premodifiers come before their head")
    void premodifier() {
        Sef sef = new Sef("PERSON", "MOD", "EMOTION");
        assertTrue(legal(sef, 3, 0, 2));
        assertFalse(legal(sef, 3, 0, 6));
    }

    @Test
    @DisplayName("Noun compounds must be adjacent")
    void nounCompound() {
        Sef sef = new Sef("N", "MOD", "N");
        assertTrue(legal(sef, 2, 0, 1));
        assertTrue(legal(sef, 1, 0, 2));
        assertFalse(legal(sef, 1, 0, 4));
    }

    @Test
    @DisplayName("Verb relations read subject, verb, object")
    void subjectVerbObject() {
        Sef sef = new Sef("PERSON", "HIT", "PERSON");
        assertTrue(legal(sef, 3, 4, 7));
        assertFalse(legal(sef, 7, 4, 3));
        assertFalse(legal(sef, 3, 2, 7));
        assertTrue(legal(sef, 3, 0, 7));
        assertFalse(legal(sef, 7, 0, 3));
    }

    @Test
    @DisplayName("Comparison word sits between the compared items")
    void comparison() {
        Sef sef = new Sef("INSECT", "SIMILAR", "WEAPON");
        assertTrue(legal(sef, 2, 3, 4));
        assertFalse(legal(sef, 2, 0, 4));
        assertFalse(legal(sef, 4, 3, 2));
    }

    @Test
    @DisplayName("Relations without a rule accept any order")
    void unconstrained() {
        assertTrue(legal(new Sef("PERSON", "DISCOVER", "OBJECT"), 7, 4, 3));
        assertTrue(legal(new Sef("N", "R/P", "WHO"), 5, 0, 1));
    }

    private static boolean legal(Sef sef, int left, int relation, int right) {
        return OrderRule.isLegal(new ComplexTriple(sef, new Positions(left, relation, right), "l", "r", "r"));
    }
}
