package spmconvertcli;

import picocli.CommandLine.*;
import spmconvert.HfTokenizerConverter;
import spmconvert.ModelDescriptor;

import java.io.File;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subcommand for converting a Hugging Face tokenizer directory into a SentencePiece model.
 */
@Command(name = "convert", description = "\033[1;34mConvert a Hugging Face tokenizer to a SentencePiece model\033[0m", mixinStandardHelpOptions = true)
public class ConvertCommand implements Callable<Integer> {

    @Option(names = {"-i", "--input"}, paramLabel = "<dir>", description = "Directory with tokenizer_config.json and tokenizer.json", required = true)
    private File input;

    @Option(names = {"-o", "--output"}, paramLabel = "<file>", description = "Output model file (default: <input>/spm.model)")
    private File output;

    @Option(names = {"-v", "--verbose"}, description = "Log conversion progress (default: false)")
    private boolean verbose;

    private static final Logger LOGGER = Logger.getLogger(ConvertCommand.class.getName());
    private static final String BLUE = "\033[1;34m";
    private static final String RESET = "\033[0m";

    @Override
    public Integer call() {
        HfTokenizerConverter.setVerboseLogging(verbose);

        File outputFile = (output != null) ? output : new File(input, "spm.model");
        try {
            ModelDescriptor model = HfTokenizerConverter.convert(input.toPath(), outputFile.toPath());
            System.err.println(BLUE + "Model saved at: " + outputFile.getAbsolutePath()
                    + " (" + model.pieces().size() + " pieces)" + RESET);
            return 0;
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Error during tokenizer conversion", e);
            System.err.println("❌ Conversion failed: " + e.getMessage());
            return 1;
        }
    }
}
