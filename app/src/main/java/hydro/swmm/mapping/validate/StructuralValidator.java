package hydro.swmm.mapping.validate;

import static hydro.swmm.mapping.parse.SectionNames.CONDUITS;
import static hydro.swmm.mapping.parse.SectionNames.INFILTRATION;
import static hydro.swmm.mapping.parse.SectionNames.OPTIONS;
import static hydro.swmm.mapping.parse.SectionNames.ORIFICES;
import static hydro.swmm.mapping.parse.SectionNames.OUTFALLS;
import static hydro.swmm.mapping.parse.SectionNames.PUMPS;
import static hydro.swmm.mapping.parse.SectionNames.RAINGAGES;
import static hydro.swmm.mapping.parse.SectionNames.SUBAREAS;
import static hydro.swmm.mapping.parse.SectionNames.SUBCATCHMENTS;
import static hydro.swmm.mapping.parse.SectionNames.WEIRS;
import static hydro.swmm.mapping.parse.SectionNames.XSECTIONS;

import hydro.swmm.mapping.parse.SectionNames;
import hydro.swmm.mapping.parse.SectionTable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Catches structural problems that would make the simulation engine reject a model:
 * missing sections, links pointing at undeclared nodes, and cross-section rows with the wrong number of parameters.
 * Never throws; the caller decides whether {@link Severity#ERROR} issues block generation.
 */
public class StructuralValidator {

    static final List<String> REQUIRED_SECTIONS = List.of(OPTIONS, RAINGAGES, SUBCATCHMENTS, SUBAREAS, INFILTRATION);

    private static final String RECT_OPEN = "RECT_OPEN";
    private static final String CIRCULAR = "CIRCULAR";

    public ValidationReport validate(SectionTable sections) {
        Objects.requireNonNull(sections, "sections");
        List<ValidationIssue> issues = new ArrayList<>();
        checkRequiredSections(sections, issues);
        checkNodeReferences(sections, issues);
        checkCrossSections(sections, issues);
        return new ValidationReport(issues);
    }

    void checkRequiredSections(SectionTable sections, List<ValidationIssue> issues) {
        for (String section : REQUIRED_SECTIONS) {
            if (!sections.hasRows(section)) {
                issues.add(ValidationIssue.warning("Missing or empty [" + section + "] section - model may not run"));
            }
        }
        if (!sections.hasRows(OUTFALLS)) {
            issues.add(ValidationIssue.error("No outfalls defined - SWMM requires at least one outlet node"));
        }
    }

    void checkNodeReferences(SectionTable sections, List<ValidationIssue> issues) {
        Set<String> nodes = new HashSet<>();
        for (String section : SectionNames.NODE_SECTIONS) {
            nodes.addAll(sections.names(section));
        }
        if (nodes.isEmpty()) {
            issues.add(ValidationIssue.warning("No nodes defined in model"));
            return;
        }
        for (LinkCategory category : LinkCategory.values()) {
            for (List<String> row : sections.rows(category.section())) {
                if (row.size() < 3) {
                    continue;
                }
                checkEndpoint(category, row.get(0), "from-node", row.get(1), nodes, issues);
                checkEndpoint(category, row.get(0), "to-node", row.get(2), nodes, issues);
            }
        }
    }

    private void checkEndpoint(LinkCategory category, String link, String role, String node,
                               Set<String> nodes, List<ValidationIssue> issues) {
        if (!nodes.contains(node)) {
            issues.add(ValidationIssue.error(String.format("%s '%s' references non-existent %s '%s'",
                    category.label(), link, role, node)));
        }
    }

    void checkCrossSections(SectionTable sections, List<ValidationIssue> issues) {
        Set<String> conduits = new HashSet<>(sections.names(CONDUITS));
        Set<String> orifices = new HashSet<>(sections.names(ORIFICES));
        Set<String> weirs = new HashSet<>(sections.names(WEIRS));
        Set<String> pumps = new HashSet<>(sections.names(PUMPS));

        for (List<String> row : sections.rows(XSECTIONS)) {
            if (row.size() < 2) {
                continue;
            }
            String link = row.get(0);
            String shape = row.get(1);
            if (!conduits.contains(link) && !orifices.contains(link) && !weirs.contains(link) && !pumps.contains(link)) {
                issues.add(ValidationIssue.warning("XSECTION for '" + link
                        + "' but link not found in CONDUITS, ORIFICES, WEIRS, or PUMPS"));
                continue;
            }

            int params = row.size() - 2;
            String current = "Current line: " + String.join(" ", row);

            if (weirs.contains(link) && RECT_OPEN.equals(shape)) {
                if (params < 2) {
                    issues.add(ValidationIssue.error(String.format(
                            "Weir '%s' with RECT_OPEN needs at least 2 parameters (height, width), found %d", link, params),
                            current,
                            "Expected format: " + link + " RECT_OPEN <height> <width> [side_slope_left] [side_slope_right]"));
                } else if (params == 3) {
                    issues.add(ValidationIssue.error(String.format(
                            "Weir '%s' with RECT_OPEN has 3 parameters - SWMM expects 2 or 4", link),
                            current,
                            "Fix: Either use 2 params (height width) or 4 params (height width slope_left slope_right)"));
                }
            }

            if (orifices.contains(link) && CIRCULAR.equals(shape) && params < 1) {
                issues.add(ValidationIssue.error(String.format(
                        "Orifice '%s' with CIRCULAR needs at least 1 parameter (diameter), found %d", link, params),
                        current,
                        "Expected format: " + link + " CIRCULAR <diameter>"));
            }

            if (conduits.contains(link)) {
                if (CIRCULAR.equals(shape) && params < 1) {
                    issues.add(ValidationIssue.error(String.format(
                            "Conduit '%s' with CIRCULAR needs at least 1 parameter (diameter), found %d", link, params),
                            current,
                            "Expected format: " + link + " CIRCULAR <diameter>"));
                } else if (RECT_OPEN.equals(shape) && params < 2) {
                    issues.add(ValidationIssue.error(String.format(
                            "Conduit '%s' with RECT_OPEN needs at least 2 parameters, found %d", link, params),
                            current,
                            "Expected format: " + link + " RECT_OPEN <height> <width>"));
                }
            }
        }
    }

    /**
     * Link sections whose endpoints are checked against declared nodes.
     */
    enum LinkCategory {
        CONDUIT(CONDUITS, "Conduit"),
        ORIFICE(ORIFICES, "Orifice"),
        WEIR(WEIRS, "Weir");

        private final String section;
        private final String label;

        LinkCategory(String section, String label) {
            this.section = section;
            this.label = label;
        }

        String section() {
            return section;
        }

        String label() {
            return label;
        }
    }
}
