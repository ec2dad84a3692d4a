package pl.marcinmilkowski.sef_analyzer.sef;

/**
 * A SEF bound to concrete positions and words of one sentence.
 *
 * An implicit relation has position 0 and the relation tag as its word.
 */
public record ComplexTriple(
    Sef sef,
    Positions positions,
    String leftWord,
    String relationWord,
    String rightWord
) {

    public int abstractionLevel() {
        return AbstractionLevel.of(sef);
    }

    @Override
    public String toString() {
        return sef + " -> " + positions + " -> (" + leftWord + ", " + relationWord + ", " + rightWord + ")";
    }
}
