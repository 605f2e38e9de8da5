package de.bsommerfeld.fdf.service;

import com.google.inject.AbstractModule;
import de.bsommerfeld.fdf.core.config.ExportConfig;
import de.bsommerfeld.fdf.core.config.FdfConfig;
import de.bsommerfeld.fdf.core.config.LayoutConfig;

import java.nio.file.Path;

/**
 * Guice module wiring {@link FdfService} with its configuration.
 */
public class FdfModule extends AbstractModule {

    private final Path configPath;
    private final IncludeResolver includeResolver;

    public FdfModule() {
        this(null, IncludeResolver.none());
    }

    /**
     * @param configPath      configuration file, or {@code null} to look it up
     *                        as {@link FdfConfigLoader} describes
     * @param includeResolver source of included files
     */
    public FdfModule(Path configPath, IncludeResolver includeResolver) {
        this.configPath = configPath;
        this.includeResolver = includeResolver;
    }

    @Override
    protected void configure() {
        FdfConfig config = new FdfConfigLoader().load(configPath);
        bind(FdfConfig.class).toInstance(config);

        // Sections for components that only need one
        bind(LayoutConfig.class).toInstance(config.getLayout());
        bind(ExportConfig.class).toInstance(config.getExport());

        bind(IncludeResolver.class).toInstance(includeResolver);
        bind(FdfService.class);
    }
}
