package com.nilsson.promptextractor.main;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.nilsson.promptextractor.data.ExtractorSettings;
import com.nilsson.promptextractor.service.BatchCoordinator;
import com.nilsson.promptextractor.service.BatchListener;
import com.nilsson.promptextractor.service.LoggingBatchListener;
import com.nilsson.promptextractor.service.MetadataReader;
import com.nilsson.promptextractor.service.PromptParser;
import com.nilsson.promptextractor.service.ResultWriter;
import org.slf4j.LoggerFactory;

import java.time.Clock;

public class AppModule extends AbstractModule {

    static final String BATCH_LOGGER = "com.nilsson.promptextractor.batch";

    private final ExtractorSettings settings;

    public AppModule(ExtractorSettings settings) {
        this.settings = settings;
    }

    @Override
    protected void configure() {
        bind(ExtractorSettings.class).toInstance(settings);
        bind(Clock.class).toInstance(Clock.systemDefaultZone());
        bind(MetadataReader.class).in(Singleton.class);
        bind(PromptParser.class).in(Singleton.class);
        bind(ResultWriter.class).in(Singleton.class);
        bind(BatchCoordinator.class).in(Singleton.class);
    }

    /**
     * Batch events go to a dedicated logger so the run log can pick them up by name.
     */
    @Provides
    @Singleton
    public BatchListener provideBatchListener() {
        return new LoggingBatchListener(LoggerFactory.getLogger(BATCH_LOGGER), settings.getProgressLogPercent());
    }
}
