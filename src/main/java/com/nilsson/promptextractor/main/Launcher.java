package com.nilsson.promptextractor.main;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.nilsson.promptextractor.data.ExtractorSettings;
import com.nilsson.promptextractor.data.SettingsException;
import com.nilsson.promptextractor.data.SettingsRepository;
import picocli.CommandLine;

/**
 <h2>Launcher</h2>
 <p>
 Entry point of the <b>Prompt Extractor</b>. Loads settings, builds the Guice injector and hands
 control to picocli.
 </p>
 */
public class Launcher {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        ExtractorSettings settings;
        try {
            settings = new SettingsRepository().load();
        } catch (SettingsException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        Injector injector = Guice.createInjector(new AppModule(settings));
        return new CommandLine(PromptExtractorCommand.class, new GuiceFactory(injector)).execute(args);
    }
}
