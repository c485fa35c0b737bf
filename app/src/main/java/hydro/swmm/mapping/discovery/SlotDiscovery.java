package hydro.swmm.mapping.discovery;

import static hydro.swmm.mapping.parse.SectionNames.CONTROLS;
import static hydro.swmm.mapping.parse.SectionNames.DWF;
import static hydro.swmm.mapping.parse.SectionNames.ORIFICES;
import static hydro.swmm.mapping.parse.SectionNames.OUTFALLS;
import static hydro.swmm.mapping.parse.SectionNames.PUMPS;
import static hydro.swmm.mapping.parse.SectionNames.RAINGAGES;
import static hydro.swmm.mapping.parse.SectionNames.STORAGE;
import static hydro.swmm.mapping.parse.SectionNames.SUBCATCHMENTS;
import static hydro.swmm.mapping.parse.SectionNames.WEIRS;

import hydro.swmm.mapping.parse.SectionNames;
import hydro.swmm.mapping.parse.SectionTable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which model elements become interface slots and assigns their indices.
 *
 * <p>Inputs are sentinel driven: an element is exposed only when the model wires it to the literal
 * {@value #SENTINEL} token. Outputs are exhaustive over storage, outfalls, orifices, weirs and subcatchments.
 * Both run as an ordered list of stages over {@link #scan}, so the stage order fixes index assignment.</p>
 */
public class SlotDiscovery {

    private static final Logger LOGGER = LoggerFactory.getLogger(SlotDiscovery.class);

    public static final String SENTINEL = "DUMMY";

    private static final String TIMESERIES = "TIMESERIES";
    private static final int FIRST_PATTERN_FIELD = 3;
    private static final int LAST_PATTERN_FIELD = 6;

    static final List<InputStage> INPUT_STAGES = List.of(
            InputStage.of(InputObjectType.GAGE, RAINGAGES, 6,
                    (row, context) -> TIMESERIES.equals(row.get(4)) && SENTINEL.equals(row.get(5))),
            InputStage.of(InputObjectType.PUMP, PUMPS, 4,
                    (row, context) -> SENTINEL.equals(row.get(3))),
            InputStage.controlled(InputObjectType.ORIFICE, ORIFICES),
            InputStage.controlled(InputObjectType.WEIR, WEIRS),
            new InputStage(InputObjectType.NODE, DWF, FIRST_PATTERN_FIELD + 1, true,
                    SlotDiscovery::isDeclaredSentinelInflow, context -> { }));

    static final List<OutputStage> OUTPUT_STAGES = List.of(
            new OutputStage(OutputObjectType.STORAGE, ValueKind.VOLUME, STORAGE),
            new OutputStage(OutputObjectType.OUTFALL, ValueKind.FLOW, OUTFALLS),
            new OutputStage(OutputObjectType.ORIFICE, ValueKind.FLOW, ORIFICES),
            new OutputStage(OutputObjectType.WEIR, ValueKind.FLOW, WEIRS),
            new OutputStage(OutputObjectType.SUBCATCH, ValueKind.RUNOFF, SUBCATCHMENTS));

    public DiscoveryResult discover(SectionTable sections) {
        List<String> warnings = new ArrayList<>();
        List<InputSlot> inputs = discoverInputs(sections, warnings);
        List<OutputSlot> outputs = discoverOutputs(sections);
        return new DiscoveryResult(inputs, outputs, warnings);
    }

    /**
     * Runs the input stages in priority order. {@code ElapsedTime} always takes index 0.
     *
     * @param warnings sink for references to elements missing from their declaring section
     */
    public List<InputSlot> discoverInputs(SectionTable sections, List<String> warnings) {
        Objects.requireNonNull(sections, "sections");
        Objects.requireNonNull(warnings, "warnings");
        DiscoveryContext context = new DiscoveryContext(sections, warnings);
        List<InputSlot> inputs = new ArrayList<>();
        inputs.add(InputSlot.elapsedTime());
        for (InputStage stage : INPUT_STAGES) {
            stage.prepare().accept(context);
            List<String> names = scan(sections.rows(stage.section()), stage.minFields(), stage.distinct(),
                    row -> stage.predicate().test(row, context));
            for (String name : names) {
                inputs.add(new InputSlot(name, stage.objectType(), inputs.size()));
            }
            LOGGER.debug("Input stage {} matched {} element(s)", stage.objectType(), names.size());
        }
        return inputs;
    }

    public List<OutputSlot> discoverOutputs(SectionTable sections) {
        Objects.requireNonNull(sections, "sections");
        List<OutputSlot> outputs = new ArrayList<>();
        for (OutputStage stage : OUTPUT_STAGES) {
            for (String name : scan(sections.rows(stage.section()), 1, false, row -> true)) {
                outputs.add(new OutputSlot(name, stage.objectType(), stage.valueKind(), outputs.size()));
            }
        }
        return outputs;
    }

    /**
     * Filtered scan over the rows of one section: skips rows shorter than {@code minFields},
     * keeps the element name (first field) of every row accepted by {@code filter}.
     */
    static List<String> scan(List<List<String>> rows, int minFields, boolean distinct,
                             Predicate<List<String>> filter) {
        List<String> names = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (List<String> row : rows) {
            if (row.size() < minFields || row.isEmpty()) {
                continue;
            }
            String name = row.get(0);
            if (distinct && seen.contains(name)) {
                continue;
            }
            if (filter.test(row)) {
                names.add(name);
                seen.add(name);
            }
        }
        return names;
    }

    private static boolean isDeclaredSentinelInflow(List<String> row, DiscoveryContext context) {
        int end = Math.min(row.size(), LAST_PATTERN_FIELD + 1);
        if (!row.subList(FIRST_PATTERN_FIELD, end).contains(SENTINEL)) {
            return false;
        }
        String node = row.get(0);
        if (!context.declaredNodes().contains(node)) {
            context.warn("Skipping " + SENTINEL + " reference to node '" + node
                    + "' - not found in [JUNCTIONS], [STORAGE], or [OUTFALLS] sections");
            return false;
        }
        return true;
    }

    /**
     * Ordered input stage: category, section scanned, minimum row width and acceptance rule.
     * {@code prepare} runs before the scan even when the section has no rows.
     */
    record InputStage(InputObjectType objectType,
                      String section,
                      int minFields,
                      boolean distinct,
                      BiPredicate<List<String>, DiscoveryContext> predicate,
                      Consumer<DiscoveryContext> prepare) {

        static InputStage of(InputObjectType objectType, String section, int minFields,
                             BiPredicate<List<String>, DiscoveryContext> predicate) {
            return new InputStage(objectType, section, minFields, false, predicate, context -> { });
        }

        /**
         * Stage for links switched by a control rule; emitted in the order of their declaring section.
         */
        static InputStage controlled(InputObjectType objectType, String declaringSection) {
            String keyword = objectType.name();
            return new InputStage(objectType, declaringSection, 1, false,
                    (row, context) -> context.controlTargets(keyword, declaringSection).contains(row.get(0)),
                    context -> context.controlTargets(keyword, declaringSection));
        }
    }

    /**
     * Ordered output stage; every declared element of the section is exposed.
     */
    record OutputStage(OutputObjectType objectType, ValueKind valueKind, String section) {
    }

    /**
     * Per-run state shared by the stage predicates: the table, the warning sink and lazily built lookups.
     */
    static final class DiscoveryContext {

        private final SectionTable sections;
        private final List<String> warnings;
        private final Map<String, Set<String>> controlTargets = new HashMap<>();
        private Set<String> declaredNodes;

        DiscoveryContext(SectionTable sections, List<String> warnings) {
            this.sections = sections;
            this.warnings = warnings;
        }

        void warn(String message) {
            LOGGER.warn(message);
            warnings.add(message);
        }

        Set<String> declaredNodes() {
            if (declaredNodes == null) {
                declaredNodes = new HashSet<>();
                for (String section : SectionNames.NODE_SECTIONS) {
                    declaredNodes.addAll(sections.names(section));
                }
            }
            return declaredNodes;
        }

        /**
         * Elements named by a control rule line holding both {@code keyword} and the sentinel.
         * The element is the token right after the first {@code keyword}; names missing from
         * {@code declaringSection} are reported once and left out.
         */
        Set<String> controlTargets(String keyword, String declaringSection) {
            return controlTargets.computeIfAbsent(keyword, key -> collectControlTargets(key, declaringSection));
        }

        private Set<String> collectControlTargets(String keyword, String declaringSection) {
            Set<String> declared = new HashSet<>(sections.names(declaringSection));
            Set<String> targets = new LinkedHashSet<>();
            for (List<String> line : sections.rows(CONTROLS)) {
                if (!line.contains(SENTINEL) || !line.contains(keyword)) {
                    continue;
                }
                int position = line.indexOf(keyword);
                if (position + 1 >= line.size()) {
                    continue;
                }
                String name = line.get(position + 1);
                if (declared.contains(name)) {
                    targets.add(name);
                } else {
                    warn("Skipping " + SENTINEL + " reference to " + keyword.toLowerCase(Locale.ROOT) + " '" + name
                            + "' - not found in [" + declaringSection + "] section");
                }
            }
            return targets;
        }
    }
}
