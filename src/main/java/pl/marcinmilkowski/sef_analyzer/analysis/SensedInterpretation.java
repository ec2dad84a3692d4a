package pl.marcinmilkowski.sef_analyzer.analysis;

/**
 * An interpretation node annotated with the chosen senses.
 *
 * Labels are {@code word_senseNumber} where a sense was chosen for the position,
 * otherwise the bound word (or relation tag, for an implicit relation).
 */
public record SensedInterpretation(
    Interpretation node,
    String leftLabel,
    String relationLabel,
    String rightLabel,
    SensedInterpretation left,
    SensedInterpretation right
) {

    @Override
    public String toString() {
        return InterpretationFormatter.formatWithSenses(this);
    }
}
