package pl.marcinmilkowski.sef_analyzer.analysis;

import pl.marcinmilkowski.sef_analyzer.lexicon.WordSense;
import pl.marcinmilkowski.sef_analyzer.sef.ComplexTriple;
import pl.marcinmilkowski.sef_analyzer.sef.Positions;
import pl.marcinmilkowski.sef_analyzer.sef.Sef;
import pl.marcinmilkowski.sef_analyzer.tagging.WordClassTable;
import pl.marcinmilkowski.sef_analyzer.tagging.WordPosition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chooses one sense per word position given the SEFs an interpretation uses.
 *
 * A sense earns a point for every binding in the tree where its position fills
 * the left, right or explicit relation slot and the sense matches the SEF's tag
 * for that slot. The first sense wins ties.
 */
public class SenseSelector {

    /**
     * Annotate an interpretation with the best sense of each position.
     *
     * @return the annotated tree, or null when there is nothing to annotate
     */
    public SensedInterpretation selectWordSenses(Interpretation interpretation, WordClassTable table) {
        if (interpretation == null || table == null || table.isEmpty()) {
            return null;
        }
        Map<Integer, WordSense> senses = chooseSenses(interpretation, table);
        return annotate(interpretation, senses);
    }

    /**
     * Best sense for every position of the sentence.
     */
    public Map<Integer, WordSense> chooseSenses(Interpretation interpretation, WordClassTable table) {
        List<ComplexTriple> bindings = interpretation.bindings();
        Map<Integer, WordSense> chosen = new LinkedHashMap<>();

        for (WordPosition word : table) {
            int position = word.position();
            WordSense best = null;
            int bestScore = -1;
            for (WordSense sense : word.senses()) {
                int score = 0;
                for (ComplexTriple binding : bindings) {
                    score += slotMatch(binding, position, sense);
                }
                if (score > bestScore) {
                    bestScore = score;
                    best = sense;
                }
            }
            if (best != null) {
                chosen.put(position, best);
            }
        }
        return chosen;
    }

    private static int slotMatch(ComplexTriple binding, int position, WordSense sense) {
        Positions p = binding.positions();
        Sef sef = binding.sef();
        if (position == p.left()) {
            return sense.matchesClass(sef.left()) ? 1 : 0;
        }
        if (position == p.right()) {
            return sense.matchesClass(sef.right()) ? 1 : 0;
        }
        if (p.hasExplicitRelation() && position == p.relation()) {
            return sense.matchesClass(sef.relation()) ? 1 : 0;
        }
        return 0;
    }

    private static SensedInterpretation annotate(Interpretation node, Map<Integer, WordSense> senses) {
        ComplexTriple triple = node.triple();
        Positions p = triple.positions();
        return new SensedInterpretation(
            node,
            label(senses, p.left(), triple.leftWord()),
            p.hasExplicitRelation() ? label(senses, p.relation(), triple.relationWord()) : triple.relationWord(),
            label(senses, p.right(), triple.rightWord()),
            node.left() == null ? null : annotate(node.left(), senses),
            node.right() == null ? null : annotate(node.right(), senses)
        );
    }

    private static String label(Map<Integer, WordSense> senses, int position, String fallback) {
        WordSense sense = senses.get(position);
        return sense != null ? sense.label() : fallback;
    }
}
