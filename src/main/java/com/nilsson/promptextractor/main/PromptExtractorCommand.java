package com.nilsson.promptextractor.main;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
        name = "prompt-extractor",
        mixinStandardHelpOptions = true,
        version = "prompt-extractor 1.0.0",
        description = "Extract the positive prompts embedded in AI-generated PNG images.",
        subcommands = {ExtractCommand.class, InspectCommand.class}
)
public class PromptExtractorCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
