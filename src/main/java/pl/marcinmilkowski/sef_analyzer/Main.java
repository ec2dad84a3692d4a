package pl.marcinmilkowski.sef_analyzer;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sef_analyzer.analysis.Analysis;
import pl.marcinmilkowski.sef_analyzer.analysis.Interpretation;
import pl.marcinmilkowski.sef_analyzer.analysis.SemanticAnalyzer;
import pl.marcinmilkowski.sef_analyzer.analysis.SensedInterpretation;
import pl.marcinmilkowski.sef_analyzer.config.SefCatalogLoader;
import pl.marcinmilkowski.sef_analyzer.lexicon.CustomLexiconStore;
import pl.marcinmilkowski.sef_analyzer.lexicon.Lexicon;
import pl.marcinmilkowski.sef_analyzer.lexicon.SeedLexicon;
import pl.marcinmilkowski.sef_analyzer.lexicon.WordSense;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point: analyzes one sentence, inspects or extends the lexicon.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            showUsage();
            return;
        }

        try {
            String command = args[0].toLowerCase();
            Options options = Options.parse(args);

            switch (command) {
                case "analyze":
                    handleAnalyzeCommand(options);
                    break;
                case "lookup":
                    handleLookupCommand(options);
                    break;
                case "learn":
                    handleLearnCommand(options);
                    break;
                case "catalog":
                    handleCatalogCommand(options);
                    break;
                case "help":
                    showUsage();
                    break;
                default:
                    logger.error("Unknown command: {}", command);
                    showUsage();
            }
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
        }
    }

    private static void handleAnalyzeCommand(Options options) throws IOException {
        if (options.words.isEmpty()) {
            System.err.println("Error: a sentence is required");
            System.err.println("Usage: java -jar sef-analyzer.jar analyze <sentence>");
            return;
        }

        SemanticAnalyzer analyzer = new SemanticAnalyzer(createLexicon(options), loadCatalog(options).toCatalog());
        String sentence = String.join(" ", options.words);
        Analysis analysis = analyzer.analyzeSentence(sentence);

        System.out.println("Sentence: " + sentence);
        if (!analysis.hasInterpretation()) {
            System.out.println("No structure could be formed.");
            return;
        }

        int n = 1;
        for (Interpretation interpretation : analysis.interpretations()) {
            SensedInterpretation sensed = analyzer.selectWordSenses(interpretation, analysis.classTable());
            System.out.println();
            System.out.println("Interpretation " + n++ + (analysis.isComplete(interpretation) ? "" : " (partial)"));
            System.out.println("  " + analyzer.formatInterpretation(interpretation));
            System.out.println("  " + analyzer.formatWithSenses(sensed));
        }
    }

    private static void handleLookupCommand(Options options) {
        if (options.words.isEmpty()) {
            System.err.println("Error: a word is required");
            System.err.println("Usage: java -jar sef-analyzer.jar lookup <word>");
            return;
        }

        Lexicon lexicon = createLexicon(options);
        for (String word : options.words) {
            List<WordSense> senses = lexicon.lookup(word);
            if (senses.isEmpty()) {
                System.out.println(word + ": unknown");
                continue;
            }
            System.out.println(word + ": " + lexicon.getClassesForWord(word));
            for (WordSense sense : senses) {
                System.out.println("  " + sense + " " + sense.features());
            }
        }
    }

    private static void handleLearnCommand(Options options) {
        if (options.words.isEmpty() || options.lexiconStore == null) {
            System.err.println("Error: a word and --lexicon-store are required");
            System.err.println("Usage: java -jar sef-analyzer.jar learn <word> --lexicon-store <file>");
            return;
        }

        Lexicon lexicon = createLexicon(options);
        for (String word : options.words) {
            List<WordSense> senses = lexicon.addGenericSense(word, true);
            System.out.println("Added " + senses.get(senses.size() - 1));
        }
    }

    private static void handleCatalogCommand(Options options) throws IOException {
        SefCatalogLoader loader = loadCatalog(options);
        System.out.println(JSON.toJSONString(loader.toJson(), JSONWriter.Feature.PrettyFormat));
    }

    private static Lexicon createLexicon(Options options) {
        CustomLexiconStore store = options.lexiconStore != null ? new CustomLexiconStore(options.lexiconStore) : null;
        return new Lexicon(SeedLexicon.loadBundled().getSenses(), store);
    }

    private static SefCatalogLoader loadCatalog(Options options) throws IOException {
        return options.catalog != null ? new SefCatalogLoader(options.catalog) : SefCatalogLoader.createDefault();
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar sef-analyzer.jar <command> [options]");
        System.out.println();
        System.out.println("Available commands:");
        System.out.println("  analyze   - Print the interpretations of a sentence");
        System.out.println("  lookup    - Show the senses and classes of words");
        System.out.println("  learn     - Store a generic noun sense for new words");
        System.out.println("  catalog   - Print the SEF catalog as JSON");
        System.out.println("  help      - Show this help message");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --catalog <file>        SEF catalog to use instead of the bundled one");
        System.out.println("  --lexicon-store <file>  Custom lexicon entries to merge (and write, for learn)");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  java -jar sef-analyzer.jar analyze the angry pitcher struck the careless batter");
        System.out.println("  java -jar sef-analyzer.jar lookup pitcher struck");
        System.out.println("  java -jar sef-analyzer.jar learn xyzzy --lexicon-store custom-lexicon.json");
    }

    /**
     * Options shared by all commands; everything that is not an option is a word.
     */
    static final class Options {
        final List<String> words = new ArrayList<>();
        Path catalog;
        Path lexiconStore;

        static Options parse(String[] args) {
            Options options = new Options();
            for (int i = 1; i < args.length; i++) {
                switch (args[i]) {
                    case "--catalog":
                    case "-c":
                        options.catalog = Paths.get(requireValue(args, ++i, "--catalog"));
                        break;
                    case "--lexicon-store":
                    case "-l":
                        options.lexiconStore = Paths.get(requireValue(args, ++i, "--lexicon-store"));
                        break;
                    default:
                        options.words.add(args[i]);
                }
            }
            return options;
        }

        private static String requireValue(String[] args, int i, String option) {
            if (i >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[i];
        }
    }
}
