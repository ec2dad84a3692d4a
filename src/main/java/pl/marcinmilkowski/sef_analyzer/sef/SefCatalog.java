package pl.marcinmilkowski.sef_analyzer.sef;

import pl.marcinmilkowski.sef_analyzer.tagging.WordClassTable;
import pl.marcinmilkowski.sef_analyzer.tagging.WordPosition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The set of known SEFs and the four stages that turn a sentence's class table
 * into its final grammar.
 *
 * <p>Every stage is a pure function from one collection to another, so the
 * stages can be run and tested in isolation:</p>
 * <ol>
 *   <li>{@link #getRelevantSefs} - SEFs whose classes occur in the sentence</li>
 *   <li>{@link #createComplexTriples} - every binding of those SEFs to positions</li>
 *   <li>{@link #filterByOrder} - bindings with legal word order</li>
 *   <li>{@link #eliminateAbstractDuplicates} - the most specific binding per position tuple</li>
 * </ol>
 */
public class SefCatalog {

    private final String version;
    private final List<Sef> sefs;
    private final Set<Sef> sefSet;

    public SefCatalog(String version, Collection<Sef> sefs) {
        this.version = version;
        this.sefs = List.copyOf(sefs);
        this.sefSet = Collections.unmodifiableSet(new LinkedHashSet<>(sefs));
    }

    public String getVersion() {
        return version;
    }

    /**
     * All SEFs in declaration order.
     */
    public List<Sef> getSefs() {
        return sefs;
    }

    public boolean contains(Sef sef) {
        return sefSet.contains(sef);
    }

    public int size() {
        return sefs.size();
    }

    /**
     * Select the SEFs that can take part in an analysis of the sentence.
     *
     * <p>A SEF is relevant when its left or right tag occurs in the sentence.
     * Relevant SEFs whose tags are carried by fewer than two positions cannot
     * bind two distinct words and are dropped, unless that drops everything.</p>
     */
    public List<Sef> getRelevantSefs(WordClassTable table) {
        Set<String> allClasses = table.allClasses();

        List<Sef> relevant = new ArrayList<>();
        for (Sef sef : sefs) {
            if (allClasses.contains(sef.left()) || allClasses.contains(sef.right())) {
                relevant.add(sef);
            }
        }

        List<Sef> supported = new ArrayList<>();
        for (Sef sef : relevant) {
            if (table.countPositionsWithAny(sef.left(), sef.right()) >= 2) {
                supported.add(sef);
            }
        }
        return supported.isEmpty() ? relevant : supported;
    }

    /**
     * Bind every SEF to every pair of distinct positions that can fill its arguments.
     *
     * <p>{@code MOD} is always implicit. Other relations take the first position
     * strictly between the two arguments that carries the relation tag or
     * spells it; without one the relation stays implicit.</p>
     */
    public List<ComplexTriple> createComplexTriples(List<Sef> relevantSefs, WordClassTable table) {
        List<ComplexTriple> triples = new ArrayList<>();

        for (Sef sef : relevantSefs) {
            List<WordPosition> leftFillers = new ArrayList<>();
            List<WordPosition> rightFillers = new ArrayList<>();
            List<WordPosition> relationFillers = new ArrayList<>();

            for (WordPosition word : table) {
                if (word.hasClass(sef.left())) {
                    leftFillers.add(word);
                }
                if (word.hasClass(sef.right())) {
                    rightFillers.add(word);
                }
                if (word.hasClass(sef.relation())
                        || word.word().toLowerCase(Locale.ROOT).equals(sef.relation().toLowerCase(Locale.ROOT))) {
                    relationFillers.add(word);
                }
            }

            for (WordPosition left : leftFillers) {
                for (WordPosition right : rightFillers) {
                    if (left.position() == right.position()) {
                        continue;
                    }
                    WordPosition relation = sef.isModification() ? null
                        : firstBetween(relationFillers, left.position(), right.position());
                    if (relation == null) {
                        triples.add(new ComplexTriple(sef,
                            new Positions(left.position(), 0, right.position()),
                            left.word(), sef.relation(), right.word()));
                    } else {
                        triples.add(new ComplexTriple(sef,
                            new Positions(left.position(), relation.position(), right.position()),
                            left.word(), relation.word(), right.word()));
                    }
                }
            }
        }
        return triples;
    }

    /**
     * Keep the triples whose word order every applicable {@link OrderRule} accepts.
     */
    public List<ComplexTriple> filterByOrder(List<ComplexTriple> triples) {
        List<ComplexTriple> legal = new ArrayList<>();
        for (ComplexTriple triple : triples) {
            if (OrderRule.isLegal(triple)) {
                legal.add(triple);
            }
        }
        return legal;
    }

    /**
     * For each position tuple keep only the least abstract triples; ties are all kept.
     *
     * Groups are emitted in first-encounter order, triples within a group in input order.
     */
    public List<ComplexTriple> eliminateAbstractDuplicates(List<ComplexTriple> triples) {
        Map<Positions, List<ComplexTriple>> groups = new LinkedHashMap<>();
        for (ComplexTriple triple : triples) {
            groups.computeIfAbsent(triple.positions(), k -> new ArrayList<>()).add(triple);
        }

        List<ComplexTriple> kept = new ArrayList<>();
        for (List<ComplexTriple> group : groups.values()) {
            int best = Integer.MAX_VALUE;
            for (ComplexTriple triple : group) {
                best = Math.min(best, triple.abstractionLevel());
            }
            for (ComplexTriple triple : group) {
                if (triple.abstractionLevel() == best) {
                    kept.add(triple);
                }
            }
        }
        return kept;
    }

    private static WordPosition firstBetween(List<WordPosition> fillers, int a, int b) {
        int low = Math.min(a, b);
        int high = Math.max(a, b);
        for (WordPosition filler : fillers) {
            if (low < filler.position() && filler.position() < high) {
                return filler;
            }
        }
        return null;
    }
}
