package spmconvertcli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "spmconvert",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "\033[1;34mConvert Hugging Face tokenizers to SentencePiece models\033[0m",
        subcommands = {
                ConvertCommand.class,
                InspectCommand.class
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        // Called when no subcommand is provided
        System.out.println("Use --help or a subcommand (convert / inspect)");
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
