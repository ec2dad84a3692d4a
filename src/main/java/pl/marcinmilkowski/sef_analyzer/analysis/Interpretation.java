package pl.marcinmilkowski.sef_analyzer.analysis;

import pl.marcinmilkowski.sef_analyzer.sef.ComplexTriple;
import pl.marcinmilkowski.sef_analyzer.sef.Positions;
import pl.marcinmilkowski.sef_analyzer.sef.Sef;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * One node of an interpretation tree.
 *
 * {@code left} and {@code right} are modifier structures attached to this node's
 * left and right argument words, or null. Each node owns its children; nodes are
 * never shared between trees.
 */
public record Interpretation(
    ComplexTriple triple,
    Interpretation left,
    Interpretation right
) {

    public static Interpretation leaf(ComplexTriple triple) {
        return new Interpretation(triple, null, null);
    }

    public Sef sef() {
        return triple.sef();
    }

    public Positions positions() {
        return triple.positions();
    }

    /**
     * Every word position used anywhere in this tree, ascending.
     */
    public Set<Integer> coveredPositions() {
        Set<Integer> covered = new TreeSet<>();
        collectPositions(this, covered);
        return covered;
    }

    /**
     * Every SEF binding in this tree, pre-order (node, left subtree, right subtree).
     */
    public List<ComplexTriple> bindings() {
        List<ComplexTriple> bindings = new ArrayList<>();
        collectBindings(this, bindings);
        return bindings;
    }

    /**
     * True when the tree accounts for every given sentence position.
     */
    public boolean isComplete(Collection<Integer> sentencePositions) {
        return coveredPositions().equals(new TreeSet<>(sentencePositions));
    }

    public int depth() {
        int l = left == null ? 0 : left.depth();
        int r = right == null ? 0 : right.depth();
        return 1 + Math.max(l, r);
    }

    private static void collectPositions(Interpretation node, Set<Integer> out) {
        out.addAll(node.positions().occupied());
        if (node.left != null) collectPositions(node.left, out);
        if (node.right != null) collectPositions(node.right, out);
    }

    private static void collectBindings(Interpretation node, List<ComplexTriple> out) {
        out.add(node.triple);
        if (node.left != null) collectBindings(node.left, out);
        if (node.right != null) collectBindings(node.right, out);
    }

    @Override
    public String toString() {
        return InterpretationFormatter.format(this);
    }
}
