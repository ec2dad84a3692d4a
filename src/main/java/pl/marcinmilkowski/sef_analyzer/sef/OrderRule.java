package pl.marcinmilkowski.sef_analyzer.sef;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Word-order legality rules, keyed by relation.
 *
 * A complex triple is legal when every rule that applies to its SEF accepts its
 * positions. Triples no rule applies to are legal.
 */
public enum OrderRule {

    /** Premodifiers precede their head: "angry pitcher", "the batter". */
    PREMODIFIER_PRECEDES_HEAD {
        @Override
        public boolean appliesTo(Sef sef) {
            return sef.isModification() && PREMODIFIER_CLASSES.contains(sef.right());
        }

        @Override
        public boolean accepts(Positions p) {
            return p.right() < p.left();
        }
    },

    /** Noun compounds are adjacent: "time flies". */
    NOUN_COMPOUND_ADJACENT {
        @Override
        public boolean appliesTo(Sef sef) {
            return sef.isModification() && "N".equals(sef.left()) && "N".equals(sef.right());
        }

        @Override
        public boolean accepts(Positions p) {
            return Math.abs(p.left() - p.right()) == 1;
        }
    },

    /**
     * Subject, verb, object. An implicit verb only needs subject before object.
     * {@code MOVE} is only ordered with a nominal subject.
     */
    SUBJECT_VERB_OBJECT {
        @Override
        public boolean appliesTo(Sef sef) {
            if ("MOVE".equals(sef.relation())) {
                return NOMINAL_SUBJECTS.contains(sef.left());
            }
            return VERB_RELATIONS.contains(sef.relation());
        }

        @Override
        public boolean accepts(Positions p) {
            if (!p.hasExplicitRelation()) {
                return p.left() < p.right();
            }
            return p.left() < p.relation() && p.relation() < p.right();
        }
    },

    /** Comparison needs its word between the compared items: "flies like arrows". */
    COMPARISON_BETWEEN {
        @Override
        public boolean appliesTo(Sef sef) {
            return "SIMILAR".equals(sef.relation());
        }

        @Override
        public boolean accepts(Positions p) {
            return p.left() < p.relation() && p.relation() < p.right();
        }
    },

    /** Prepositional, locative and part-of relations read left to right. */
    LEFT_BEFORE_RIGHT {
        @Override
        public boolean appliesTo(Sef sef) {
            return LEFT_TO_RIGHT_RELATIONS.contains(sef.relation());
        }

        @Override
        public boolean accepts(Positions p) {
            return p.left() < p.right();
        }
    };

    /** Right-hand MOD tags that must precede the modified word. */
    public static final Set<String> PREMODIFIER_CLASSES = Set.of("ADJ", "ART", "EMOTION", "ATTITUDE", "AGE");

    public static final Set<String> VERB_RELATIONS = Set.of("V", "HIT", "CONSUME", "BE", "EQUIV", "MOVE");

    public static final Set<String> NOMINAL_SUBJECTS = Set.of("N", "PERSON", "ANIMAL", "OBJECT");

    public static final Set<String> LEFT_TO_RIGHT_RELATIONS = Set.of("PREP", "LOC", "PART");

    public abstract boolean appliesTo(Sef sef);

    public abstract boolean accepts(Positions positions);

    /**
     * Rules relevant to a SEF.
     */
    public static List<OrderRule> rulesFor(Sef sef) {
        List<OrderRule> rules = new ArrayList<>();
        for (OrderRule rule : values()) {
            if (rule.appliesTo(sef)) {
                rules.add(rule);
            }
        }
        return rules;
    }

    /**
     * Check a complex triple against every applicable rule.
     */
    public static boolean isLegal(ComplexTriple triple) {
        for (OrderRule rule : values()) {
            if (rule.appliesTo(triple.sef()) && !rule.accepts(triple.positions())) {
                return false;
            }
        }
        return true;
    }
}
