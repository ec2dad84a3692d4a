package pl.marcinmilkowski.sef_analyzer.sef;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Word positions bound to a SEF. A relation position of 0 means the relation is implicit.
 */
public record Positions(int left, int relation, int right) {

    public boolean hasExplicitRelation() {
        return relation != 0;
    }

    /**
     * The positions actually occupied by words, left to right in SEF order.
     */
    public Set<Integer> occupied() {
        Set<Integer> occupied = new LinkedHashSet<>();
        if (left != 0) occupied.add(left);
        if (relation != 0) occupied.add(relation);
        if (right != 0) occupied.add(right);
        return occupied;
    }

    @Override
    public String toString() {
        return "(" + left + ", " + relation + ", " + right + ")";
    }
}
