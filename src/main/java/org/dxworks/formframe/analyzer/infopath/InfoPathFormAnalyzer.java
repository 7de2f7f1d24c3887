package org.dxworks.formframe.analyzer.infopath;

import org.dxworks.formframe.FormframeConfig;
import org.dxworks.formframe.analyzer.FormAnalyzer;
import org.dxworks.formframe.model.infopath.DynamicSection;
import org.dxworks.formframe.model.infopath.FormAnalysis;
import org.dxworks.formframe.model.infopath.ViewModel;
import org.w3c.dom.Document;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Analyses one InfoPath form given its extracted view files.
 *
 * <p>Each view is loaded and parsed on its own, optionally in parallel; the per-view
 * results are joined in input order before the form-wide passes run (visibility map,
 * data columns, metadata, messages). A view that cannot be loaded or walked contributes
 * an empty {@link ViewModel} carrying the error; the other views of the form are kept.</p>
 */
public class InfoPathFormAnalyzer implements FormAnalyzer {

    private final FormframeConfig config;
    private final ViewDocumentLoader loader;
    private final ViewStructuralParser parser;
    private final LabelAssociationPass labelAssociation = new LabelAssociationPass();
    private final MultiLineLabelMerger labelMerger = new MultiLineLabelMerger();
    private final DynamicSectionExtractor dynamicSections = new DynamicSectionExtractor();
    private final DataColumnConsolidator consolidator = new DataColumnConsolidator();
    private final FormMetadataBuilder metadataBuilder = new FormMetadataBuilder();
    private final MigrationAdvisor advisor;

    public InfoPathFormAnalyzer() {
        this(FormframeConfig.defaults());
    }

    public InfoPathFormAnalyzer(FormframeConfig config) {
        this(config, new ViewStructuralParser(config.getLabelLookback()));
    }

    InfoPathFormAnalyzer(FormframeConfig config, ViewStructuralParser parser) {
        this.config = config;
        this.loader = new ViewDocumentLoader(config.getMaxViewBytes());
        this.parser = parser;
        this.advisor = new MigrationAdvisor(config.getLargeFormThreshold());
    }

    @Override
    public FormAnalysis analyze(String formPath, List<Path> viewFiles) {
        Stream<Path> stream = config.isParallelViews() ? viewFiles.parallelStream() : viewFiles.stream();
        List<ViewAnalysis> results = stream.map(this::analyzeView).collect(Collectors.toList());
        return assemble(formPath, results);
    }

    /**
     * Runs the per-view pipeline on an already loaded document.
     */
    public ViewModel analyzeView(Document document, String viewName) {
        return analyzeDocument(document, viewName).view;
    }

    private ViewAnalysis analyzeView(Path viewFile) {
        String viewName = viewFile.getFileName().toString();
        Document document;
        try {
            document = loader.load(viewFile);
        } catch (ViewLoadException e) {
            System.err.println("[InfoPathFormAnalyzer] " + e.getMessage());
            ViewModel failed = new ViewModel();
            failed.viewName = viewName;
            failed.loadError = e.getMessage();
            return new ViewAnalysis(failed, new ArrayList<>());
        }
        return analyzeDocument(document, viewName);
    }

    private ViewAnalysis analyzeDocument(Document document, String viewName) {
        try {
            ViewModel view = parser.parse(document, viewName);
            labelAssociation.apply(view.controls);
            labelMerger.apply(view.controls);
            List<DynamicSection> sections = dynamicSections.extract(document);
            return new ViewAnalysis(view, sections);
        } catch (RuntimeException | StackOverflowError e) {
            String reason = describe(e);
            System.err.println("[InfoPathFormAnalyzer] Failed to parse view " + viewName + ": " + reason);
            ViewModel failed = new ViewModel();
            failed.viewName = viewName;
            failed.parseError = reason;
            return new ViewAnalysis(failed, new ArrayList<>());
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isEmpty()
                ? e.getClass().getSimpleName()
                : e.getClass().getSimpleName() + ": " + message;
    }

    private FormAnalysis assemble(String formPath, List<ViewAnalysis> results) {
        FormAnalysis form = new FormAnalysis();
        form.formPath = formPath;
        for (ViewAnalysis result : results) {
            form.views.add(result.view);
            form.dynamicSections.addAll(result.dynamicSections);
            DynamicSectionExtractor.foldVisibility(result.dynamicSections, form.conditionalVisibility);
        }
        form.data = consolidator.consolidate(form.views, form.conditionalVisibility);
        form.metadata = metadataBuilder.build(form.views, form.dynamicSections, form.conditionalVisibility);
        form.messages = advisor.advise(form);
        return form;
    }
}
