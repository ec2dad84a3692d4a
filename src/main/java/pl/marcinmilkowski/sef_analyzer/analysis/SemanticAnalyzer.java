package pl.marcinmilkowski.sef_analyzer.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sef_analyzer.config.SefCatalogLoader;
import pl.marcinmilkowski.sef_analyzer.lexicon.Lexicon;
import pl.marcinmilkowski.sef_analyzer.sef.ComplexTriple;
import pl.marcinmilkowski.sef_analyzer.sef.Sef;
import pl.marcinmilkowski.sef_analyzer.sef.SefCatalog;
import pl.marcinmilkowski.sef_analyzer.tagging.SentenceTagger;
import pl.marcinmilkowski.sef_analyzer.tagging.WordClassTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns deep semantic interpretations to sentences.
 *
 * <p>Pipeline:</p>
 * <ol>
 *   <li>clean the input and look up every word, with normalization and generic fallbacks</li>
 *   <li>select relevant SEFs, bind them to positions, filter by word order,
 *       drop abstract duplicates</li>
 *   <li>select root predications</li>
 *   <li>attach modifiers recursively to build one tree per root</li>
 * </ol>
 *
 * <p>The analyzer keeps no state between calls other than the lexicon, which may
 * gain generic senses for unknown words.</p>
 */
public class SemanticAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final Lexicon lexicon;
    private final SefCatalog catalog;
    private final SentenceTagger tagger;
    private final RootSelector rootSelector = new RootSelector();
    private final StructureBuilder structureBuilder = new StructureBuilder();
    private final SenseSelector senseSelector = new SenseSelector();

    public SemanticAnalyzer(Lexicon lexicon, SefCatalog catalog) {
        this.lexicon = lexicon;
        this.catalog = catalog;
        this.tagger = new SentenceTagger(lexicon);
    }

    /**
     * Analyzer over the bundled seed vocabulary and SEF catalog.
     */
    public static SemanticAnalyzer createDefault() {
        return new SemanticAnalyzer(Lexicon.createDefault(), SefCatalogLoader.createDefault().toCatalog());
    }

    /**
     * Interpret a raw sentence.
     *
     * @return one interpretation per root, empty if no structure could be formed
     */
    public List<Interpretation> analyze(String sentence) {
        return analyzeSentence(sentence).interpretations();
    }

    /**
     * Interpret pre-split tokens.
     */
    public List<Interpretation> analyze(List<String> tokens) {
        return analyzeTokens(tokens).interpretations();
    }

    /**
     * Interpret a raw sentence, keeping every intermediate result.
     */
    public Analysis analyzeSentence(String sentence) {
        logger.debug("Analyzing: {}", sentence);
        return run(SentenceTagger.clean(sentence));
    }

    /**
     * Interpret pre-split tokens, keeping every intermediate result.
     */
    public Analysis analyzeTokens(List<String> tokens) {
        logger.debug("Analyzing tokens: {}", tokens);
        return run(SentenceTagger.clean(tokens));
    }

    private Analysis run(List<String> tokens) {
        WordClassTable table = tagger.tag(tokens);
        if (table.isEmpty()) {
            return new Analysis(tokens, table, List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Word classes:\n{}", table);
        }

        List<Sef> relevant = catalog.getRelevantSefs(table);
        logger.debug("Relevant SEFs ({}): {}", relevant.size(), relevant);

        List<ComplexTriple> candidates = catalog.createComplexTriples(relevant, table);
        logger.debug("Complex triples before filtering: {}", candidates.size());

        List<ComplexTriple> ordered = catalog.filterByOrder(candidates);
        logger.debug("After ordering filter: {}", ordered.size());

        List<ComplexTriple> finals = catalog.eliminateAbstractDuplicates(ordered);
        if (logger.isDebugEnabled()) {
            logger.debug("Final grammar ({} triples):", finals.size());
            finals.forEach(t -> logger.debug("  {}", t));
        }

        List<ComplexTriple> roots = rootSelector.selectRoots(finals, table);
        logger.debug("Roots: {}", roots);

        List<Interpretation> interpretations = new ArrayList<>(roots.size());
        for (ComplexTriple root : roots) {
            Interpretation interpretation = structureBuilder.build(root, finals);
            if (!interpretation.isComplete(table.positions())) {
                logger.debug("Partial interpretation {} covers {} of {} positions",
                    interpretation, interpretation.coveredPositions().size(), table.size());
            }
            interpretations.add(interpretation);
        }
        logger.debug("Generated {} interpretation(s)", interpretations.size());

        return new Analysis(tokens, table, relevant, candidates, ordered, finals, roots, interpretations);
    }

    /**
     * Choose the best sense of every word for one interpretation.
     *
     * @return the sense-annotated tree, or null if there is nothing to annotate
     */
    public SensedInterpretation selectWordSenses(Interpretation interpretation, WordClassTable table) {
        return senseSelector.selectWordSenses(interpretation, table);
    }

    public String formatInterpretation(Interpretation interpretation) {
        return InterpretationFormatter.format(interpretation);
    }

    public String formatWithSenses(SensedInterpretation interpretation) {
        return InterpretationFormatter.formatWithSenses(interpretation);
    }

    public Lexicon getLexicon() {
        return lexicon;
    }

    public SefCatalog getCatalog() {
        return catalog;
    }
}
