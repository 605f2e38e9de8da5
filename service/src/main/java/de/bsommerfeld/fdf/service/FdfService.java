package de.bsommerfeld.fdf.service;

import com.google.common.collect.ImmutableList;
import de.bsommerfeld.fdf.core.ast.Include;
import de.bsommerfeld.fdf.core.ast.Program;
import de.bsommerfeld.fdf.core.config.ExportConfig;
import de.bsommerfeld.fdf.core.config.LayoutConfig;
import de.bsommerfeld.fdf.core.model.Frame;
import de.bsommerfeld.fdf.export.FdfExporter;
import de.bsommerfeld.fdf.layout.FdfTransformer;
import de.bsommerfeld.fdf.layout.LayoutCycleException;
import de.bsommerfeld.fdf.layout.TemplateRegistry;
import de.bsommerfeld.fdf.layout.TransformWarning;
import de.bsommerfeld.fdf.layout.TransformWarning.Kind;
import de.bsommerfeld.fdf.parser.FdfParser;
import de.bsommerfeld.fdf.parser.FrameSyntaxException;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for working with FDF documents: parsing, loading into resolved
 * frames, exporting, validating and reformatting.
 *
 * <h3>Includes</h3>
 * {@code IncludeFile} directives are looked up through the
 * {@link IncludeResolver} before the document itself is transformed. Included
 * documents are loaded depth-first and their top-level frames become templates
 * of the including document; they are not part of the result. An include that
 * cannot be resolved is a warning, an include that includes itself (directly or
 * through other files) fails with {@link IncludeResolutionException}.
 *
 * <p>
 * Every call works on its own transformer, so one instance can serve
 * concurrent callers.
 */
@Singleton
public class FdfService {

    private static final Logger LOG = LoggerFactory.getLogger(FdfService.class);

    private final LayoutConfig layoutConfig;
    private final ExportConfig exportConfig;
    private final IncludeResolver includeResolver;

    public FdfService() {
        this(new LayoutConfig(), new ExportConfig(), IncludeResolver.none());
    }

    @Inject
    public FdfService(LayoutConfig layoutConfig, ExportConfig exportConfig, IncludeResolver includeResolver) {
        this.layoutConfig = layoutConfig;
        this.exportConfig = exportConfig;
        this.includeResolver = includeResolver;
    }

    /**
     * Parses {@code text} without resolving anything.
     *
     * @throws FrameSyntaxException if the text is not well-formed FDF
     */
    public Program parse(String text) {
        return FdfParser.parse(text);
    }

    /**
     * Parses and transforms {@code text} into resolved frames in document order.
     *
     * @throws FrameSyntaxException        if the text or an included file is not well-formed
     * @throws LayoutCycleException        if anchors reference each other in a cycle
     * @throws IncludeResolutionException  if includes form a cycle or an include file cannot be read
     */
    public ImmutableList<Frame> load(String text) {
        ImmutableList<Frame> frames = load(parse(text), new ArrayList<>());
        LOG.info("Loaded {} frames", frames.size());
        return frames;
    }

    public String export(List<Frame> frames) {
        return new FdfExporter(exportConfig).export(frames);
    }

    /**
     * Checks whether {@code text} loads. Never throws: syntax errors, anchor
     * cycles and include failures are reported as errors.
     */
    public ValidationResult validate(String text) {
        List<TransformWarning> warnings = new ArrayList<>();
        try {
            load(parse(text), warnings);
            return ValidationResult.passed(warnings);
        } catch (FrameSyntaxException | LayoutCycleException | IncludeResolutionException e) {
            LOG.debug("Validation failed: {}", e.getMessage());
            return ValidationResult.failed(e.getMessage(), warnings);
        }
    }

    /**
     * Loads {@code text} and exports it again in canonical form. The document's
     * {@code IncludeFile} directives are kept.
     */
    public String format(String text) {
        Program program = parse(text);
        ImmutableList<Frame> frames = load(program, new ArrayList<>());
        List<String> includes = program.includes().stream().map(Include::path).toList();
        return new FdfExporter(exportConfig).export(frames, includes);
    }

    private ImmutableList<Frame> load(Program program, List<TransformWarning> warnings) {
        TemplateRegistry templates = new TemplateRegistry();
        includeTemplates(program, new ArrayList<>(), templates, warnings);

        FdfTransformer transformer = new FdfTransformer(layoutConfig, templates);
        try {
            return transformer.transform(program);
        } finally {
            warnings.addAll(transformer.warnings());
        }
    }

    /**
     * Registers the frames of every file {@code program} includes, and of the
     * files those include, in {@code templates}.
     *
     * @param chain include paths currently being loaded, outermost first
     */
    private void includeTemplates(Program program, List<String> chain, TemplateRegistry templates,
            List<TransformWarning> warnings) {
        for (Include include : program.includes()) {
            String path = include.path();
            if (chain.contains(path)) {
                List<String> cycle = new ArrayList<>(chain.subList(chain.indexOf(path), chain.size()));
                cycle.add(path);
                throw new IncludeResolutionException(cycle);
            }

            Optional<String> text = includeResolver.resolve(path);
            if (text.isEmpty()) {
                LOG.warn("Include file '{}' could not be resolved", path);
                warnings.add(new TransformWarning(Kind.MISSING_INCLUDE, path,
                        "Include file '" + path + "' could not be resolved, its templates are not available"));
                continue;
            }

            chain.add(path);
            Program included = parse(text.get());
            includeTemplates(included, chain, templates, warnings);

            FdfTransformer transformer = new FdfTransformer(layoutConfig, templates);
            ImmutableList<Frame> frames = transformer.transform(included);
            templates.registerAll(transformer.templates());
            chain.remove(chain.size() - 1);

            LOG.info("Included {}: {} frames, {} templates available", path, frames.size(), templates.size());
        }
    }
}
