package hydro.swmm.mapping.service;

import hydro.swmm.mapping.discovery.DiscoveryResult;
import hydro.swmm.mapping.discovery.InputSlot;
import hydro.swmm.mapping.discovery.OutputSlot;
import hydro.swmm.mapping.discovery.SlotDiscovery;
import hydro.swmm.mapping.discovery.SlotSelector;
import hydro.swmm.mapping.fingerprint.ContentFingerprint;
import hydro.swmm.mapping.mapping.InterfaceDocument;
import hydro.swmm.mapping.mapping.MappingEmitter;
import hydro.swmm.mapping.mapping.MappingWriter;
import hydro.swmm.mapping.parse.SectionParser;
import hydro.swmm.mapping.parse.SectionTable;
import hydro.swmm.mapping.validate.StructuralValidator;
import hydro.swmm.mapping.validate.ValidationIssue;
import hydro.swmm.mapping.validate.ValidationReport;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the generation pipeline: read, parse, validate, discover, fingerprint, emit and write.
 * Parse and I/O failures propagate; validation and discovery findings are returned with the result.
 */
public class MappingGenerationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(MappingGenerationService.class);

    private final SectionParser parser;
    private final StructuralValidator validator;
    private final SlotDiscovery discovery;
    private final SlotSelector selector;
    private final MappingEmitter emitter;
    private final MappingWriter writer;

    public MappingGenerationService() {
        this(new SectionParser(), new StructuralValidator(), new SlotDiscovery(), new SlotSelector(),
                new MappingEmitter(), new MappingWriter());
    }

    public MappingGenerationService(SectionParser parser,
                                    StructuralValidator validator,
                                    SlotDiscovery discovery,
                                    SlotSelector selector,
                                    MappingEmitter emitter,
                                    MappingWriter writer) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.discovery = Objects.requireNonNull(discovery, "discovery");
        this.selector = Objects.requireNonNull(selector, "selector");
        this.emitter = Objects.requireNonNull(emitter, "emitter");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    public GenerationResult generate(GenerationRequest request) {
        Objects.requireNonNull(request, "request");
        String content = SectionParser.read(request.modelFile());
        SectionTable sections = parser.parse(content);
        LOGGER.info("Parsed {} section(s) from {}", sections.size(), request.modelFile());

        ValidationReport report = validator.validate(sections);
        for (ValidationIssue issue : report.issues()) {
            if (issue.isError()) {
                LOGGER.error("{}", issue.message());
            } else {
                LOGGER.warn("{}", issue.message());
            }
        }
        if (report.hasErrors() && request.abortOnValidationErrors()) {
            throw new ValidationFailedException(report);
        }

        DiscoveryResult discovered = discovery.discover(sections);
        List<InputSlot> inputs = request.inputSelections().isEmpty()
                ? discovered.inputs()
                : selector.selectInputs(sections, request.inputSelections());
        List<OutputSlot> outputs = request.outputSelections().isEmpty()
                ? discovered.outputs()
                : selector.selectOutputs(sections, request.outputSelections());

        List<String> warnings = request.inputSelections().isEmpty() ? discovered.warnings() : List.of();

        String fingerprint = ContentFingerprint.of(content);
        InterfaceDocument document = emitter.emit(inputs, outputs, fingerprint);
        writer.write(document, request.outputFile());
        LOGGER.info("Generated {} with {} input(s) and {} output(s), fingerprint {}",
                request.outputFile(), document.inputCount(), document.outputCount(), fingerprint);

        return new GenerationResult(document, report, warnings, rowCounts(sections), request.outputFile());
    }

    private static Map<String, Integer> rowCounts(SectionTable sections) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String name : sections.sectionNames()) {
            counts.put(name, sections.rows(name).size());
        }
        return counts;
    }
}
