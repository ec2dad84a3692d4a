package pl.marcinmilkowski.sef_analyzer.analysis;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.sef_analyzer.sef.ComplexTriple;
import pl.marcinmilkowski.sef_analyzer.sef.Positions;
import pl.marcinmilkowski.sef_analyzer.sef.Sef;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InterpretationFormatter.
 */
class InterpretationFormatterTest {

    @Test
    @DisplayName("Leaves render as uppercase triples")
    void leaf() {
        Interpretation leaf = Interpretation.leaf(new ComplexTriple(new Sef("N", "BE", "N"),
            new Positions(1, 0, 2), "time", "BE", "flies"));

        assertEquals("(TIME BE FLIES)", InterpretationFormatter.format(leaf));
        assertEquals("(TIME BE FLIES)", leaf.toString());
    }

    @Test
    @DisplayName("Children replace the argument they modify")
    void nested() {
        ComplexTriple root = new ComplexTriple(new Sef("INSECT", "SIMILAR", "WEAPON"),
            new Positions(2, 3, 4), "flies", "like", "arrows");
        ComplexTriple compound = new ComplexTriple(new Sef("N", "MOD", "N"),
            new Positions(2, 0, 1), "flies", "MOD", "time");
        Interpretation tree = new Interpretation(root, Interpretation.leaf(compound), null);

        assertEquals("((FLIES MOD TIME) LIKE ARROWS)", InterpretationFormatter.format(tree));

        SensedInterpretation sensed = new SensedInterpretation(tree, "flies_1", "like_1", "arrows_1",
            new SensedInterpretation(tree.left(), "flies_1", "MOD", "time_1", null, null), null);
        assertEquals("((FLIES_1 MOD TIME_1) LIKE_1 ARROWS_1)", InterpretationFormatter.formatWithSenses(sensed));
    }

    @Test
    @DisplayName("Missing interpretation renders the sentinel")
    void sentinel() {
        assertEquals(InterpretationFormatter.NO_INTERPRETATION, InterpretationFormatter.format(null));
        assertEquals("NO INTERPRETATION", InterpretationFormatter.formatWithSenses(null));
    }
}
