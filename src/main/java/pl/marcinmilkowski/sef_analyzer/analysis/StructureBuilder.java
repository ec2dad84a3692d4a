package pl.marcinmilkowski.sef_analyzer.analysis;

import pl.marcinmilkowski.sef_analyzer.sef.ComplexTriple;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Assembles an interpretation tree from a root triple and the sentence's final triples.
 *
 * <p>Starting at the root, the node's positions are marked as seen. For its
 * left argument and then its right argument the builder looks for a {@code MOD}
 * triple anchored at that argument (its left position is the argument's
 * position) whose other positions are all unseen, takes the least abstract one
 * (first encountered on ties) and recurses into it.</p>
 *
 * <p>Both sides are searched against the same seen set, so siblings may reuse
 * a position the other sibling claimed. Every recursive call works on its own
 * copy; claims never flow back up to the parent. Each step claims at least one
 * new position, so recursion ends.</p>
 */
public class StructureBuilder {

    /**
     * Build the tree rooted at a triple.
     */
    public Interpretation build(ComplexTriple root, List<ComplexTriple> finalTriples) {
        return build(root, finalTriples, new HashSet<>());
    }

    private Interpretation build(ComplexTriple node, List<ComplexTriple> finalTriples, Set<Integer> seen) {
        Set<Integer> claimed = new HashSet<>(seen);
        claimed.addAll(node.positions().occupied());

        Interpretation left = null;
        ComplexTriple leftModifier = findModifier(node, node.positions().left(), finalTriples, claimed);
        if (leftModifier != null) {
            left = build(leftModifier, finalTriples, new HashSet<>(claimed));
        }

        Interpretation right = null;
        ComplexTriple rightModifier = findModifier(node, node.positions().right(), finalTriples, claimed);
        if (rightModifier != null) {
            right = build(rightModifier, finalTriples, new HashSet<>(claimed));
        }

        return new Interpretation(node, left, right);
    }

    /**
     * The least abstract unseen MOD triple anchored at a position, or null.
     */
    ComplexTriple findModifier(ComplexTriple node, int anchor, List<ComplexTriple> finalTriples,
                               Set<Integer> seen) {
        if (anchor == 0) {
            return null;
        }
        ComplexTriple best = null;
        for (ComplexTriple candidate : finalTriples) {
            if (candidate == node || !candidate.sef().isModification()
                    || candidate.positions().left() != anchor) {
                continue;
            }
            if (!isUnseen(candidate, anchor, seen)) {
                continue;
            }
            if (best == null || candidate.abstractionLevel() < best.abstractionLevel()) {
                best = candidate;
            }
        }
        return best;
    }

    private static boolean isUnseen(ComplexTriple candidate, int anchor, Set<Integer> seen) {
        for (int position : candidate.positions().occupied()) {
            if (position != anchor && seen.contains(position)) {
                return false;
            }
        }
        return true;
    }
}
