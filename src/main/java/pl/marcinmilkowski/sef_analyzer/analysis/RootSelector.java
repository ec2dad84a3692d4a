package pl.marcinmilkowski.sef_analyzer.analysis;

import pl.marcinmilkowski.sef_analyzer.lexicon.WordSense;
import pl.marcinmilkowski.sef_analyzer.sef.ComplexTriple;
import pl.marcinmilkowski.sef_analyzer.sef.Positions;
import pl.marcinmilkowski.sef_analyzer.tagging.WordClassTable;
import pl.marcinmilkowski.sef_analyzer.tagging.WordPosition;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Picks the main predications a sentence's trees are built from.
 *
 * <p>Candidates are final triples with a verb-like relation. Each is scored by
 * how well the words at its positions support it:</p>
 * <ul>
 *   <li>relation word: {@value #RELATION_WEIGHT} if one of its senses has the
 *       relation among its semantic classes,</li>
 *   <li>each argument: {@value #ARGUMENT_WEIGHT} if one of its senses matches
 *       the SEF's tag,</li>
 * </ul>
 * <p>plus {@code max(0, 1 - index)} for a match on the first semantic class.
 * The best-scoring candidates are kept, then only the least abstract of them.</p>
 *
 * <p>Fallbacks, in order: when no candidate scores above zero all candidates are
 * roots; when there is no candidate at all the first final triple is the root.</p>
 */
public class RootSelector {

    public static final Set<String> ROOT_RELATIONS = Set.of(
        "V", "HIT", "CONSUME", "MOVE", "BE", "EQUIV", "DISCOVER", "BOYCOTT", "SIMILAR", "RESEMBLE");

    static final int RELATION_WEIGHT = 3;
    static final int ARGUMENT_WEIGHT = 2;

    /**
     * Select the roots among the final triples.
     *
     * @return roots in final-triple order; empty only if there are no triples
     */
    public List<ComplexTriple> selectRoots(List<ComplexTriple> finalTriples, WordClassTable table) {
        if (finalTriples.isEmpty()) {
            return List.of();
        }

        List<ComplexTriple> candidates = new ArrayList<>();
        for (ComplexTriple triple : finalTriples) {
            if (ROOT_RELATIONS.contains(triple.sef().relation())) {
                candidates.add(triple);
            }
        }
        if (candidates.isEmpty()) {
            return List.of(finalTriples.get(0));
        }

        int[] scores = new int[candidates.size()];
        int maxScore = Integer.MIN_VALUE;
        for (int i = 0; i < candidates.size(); i++) {
            scores[i] = score(candidates.get(i), table);
            maxScore = Math.max(maxScore, scores[i]);
        }
        if (maxScore <= 0) {
            return candidates;
        }

        List<ComplexTriple> best = new ArrayList<>();
        int minAbstraction = Integer.MAX_VALUE;
        for (int i = 0; i < candidates.size(); i++) {
            if (scores[i] == maxScore) {
                best.add(candidates.get(i));
                minAbstraction = Math.min(minAbstraction, candidates.get(i).abstractionLevel());
            }
        }

        List<ComplexTriple> roots = new ArrayList<>();
        for (ComplexTriple triple : best) {
            if (triple.abstractionLevel() == minAbstraction) {
                roots.add(triple);
            }
        }
        return roots;
    }

    /**
     * Support score of one candidate.
     */
    public int score(ComplexTriple candidate, WordClassTable table) {
        Positions p = candidate.positions();
        String relation = candidate.sef().relation();
        int score = 0;

        WordPosition relationWord = p.hasExplicitRelation() ? table.get(p.relation()) : null;
        if (relationWord != null) {
            for (WordSense sense : relationWord.senses()) {
                int index = sense.semanticClasses().indexOf(relation);
                if (index >= 0) {
                    score += RELATION_WEIGHT + specificityBonus(index);
                    break;
                }
            }
        }

        score += argumentScore(table.get(p.left()), candidate.sef().left());
        score += argumentScore(table.get(p.right()), candidate.sef().right());
        return score;
    }

    private static int argumentScore(WordPosition word, String tag) {
        if (word == null) {
            return 0;
        }
        for (WordSense sense : word.senses()) {
            if (sense.matchesClass(tag)) {
                int index = sense.semanticClasses().indexOf(tag);
                // A syntactic-class match earns no specificity bonus
                return ARGUMENT_WEIGHT + (index >= 0 ? specificityBonus(index) : 0);
            }
        }
        return 0;
    }

    private static int specificityBonus(int index) {
        return Math.max(0, 1 - index);
    }
}
