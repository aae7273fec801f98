package spmconvertcli;

import picocli.CommandLine.*;
import spmconvert.ModelSummary;

import java.io.File;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subcommand for printing a summary of a SentencePiece model file.
 */
@Command(name = "inspect", description = "\033[1;34mShow a summary of a SentencePiece model\033[0m", mixinStandardHelpOptions = true)
public class InspectCommand implements Callable<Integer> {

    @Option(names = {"-m", "--model"}, paramLabel = "<file>", description = "Model file", required = true)
    private File model;

    @Option(names = {"-n", "--normalize"}, paramLabel = "<text>", description = "Also print <text> after the model's normalizer and denormalizer")
    private String text;

    private static final Logger LOGGER = Logger.getLogger(InspectCommand.class.getName());

    @Override
    public Integer call() {
        try {
            ModelSummary summary = ModelSummary.read(model.toPath());
            System.out.print(summary.describe());

            if (text != null && summary.normalizer() != null) {
                String normalized = summary.normalizer().normalize(text);
                System.out.println("Normalized:   " + normalized);
                if (summary.denormalizer() != null) {
                    System.out.println("Denormalized: " + summary.denormalizer().normalize(normalized));
                }
            }
            return 0;
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Error reading model " + model, e);
            System.err.println("❌ Cannot inspect model: " + e.getMessage());
            return 1;
        }
    }
}
