package pl.marcinmilkowski.sef_analyzer.analysis;

import pl.marcinmilkowski.sef_analyzer.sef.ComplexTriple;
import pl.marcinmilkowski.sef_analyzer.sef.Sef;
import pl.marcinmilkowski.sef_analyzer.tagging.WordClassTable;

import java.util.List;

/**
 * Everything one analysis produced: the class table, each filtering stage's
 * output, the chosen roots and one interpretation per root.
 */
public record Analysis(
    List<String> tokens,
    WordClassTable classTable,
    List<Sef> relevantSefs,
    List<ComplexTriple> candidateTriples,
    List<ComplexTriple> orderedTriples,
    List<ComplexTriple> finalTriples,
    List<ComplexTriple> roots,
    List<Interpretation> interpretations
) {

    public Analysis {
        tokens = List.copyOf(tokens);
        relevantSefs = List.copyOf(relevantSefs);
        candidateTriples = List.copyOf(candidateTriples);
        orderedTriples = List.copyOf(orderedTriples);
        finalTriples = List.copyOf(finalTriples);
        roots = List.copyOf(roots);
        interpretations = List.copyOf(interpretations);
    }

    public boolean hasInterpretation() {
        return !interpretations.isEmpty();
    }

    /**
     * Whether an interpretation covers every word of the sentence.
     */
    public boolean isComplete(Interpretation interpretation) {
        return interpretation.isComplete(classTable.positions());
    }
}
