package hydro.swmm.mapping.cli;

import hydro.swmm.mapping.mapping.InterfaceDocument;
import hydro.swmm.mapping.service.GenerationResult;
import hydro.swmm.mapping.validate.ValidationIssue;
import hydro.swmm.mapping.validate.ValidationReport;
import java.io.PrintWriter;
import java.util.Map;

/**
 * Human-readable report of a generation run.
 */
class SummaryPrinter {

    private final PrintWriter out;

    SummaryPrinter(PrintWriter out) {
        this.out = out;
    }

    void print(GenerationResult result) {
        printValidation(out, result.validationReport());

        out.printf("Successfully parsed %d sections%n", result.sectionRowCounts().size());
        for (Map.Entry<String, Integer> entry : result.sectionRowCounts().entrySet()) {
            out.printf("  [%s]: %d entries%n", entry.getKey(), entry.getValue());
        }

        InterfaceDocument document = result.document();
        out.printf("%nContent hash: %s%n", document.contentFingerprint());

        if (!result.discoveryWarnings().isEmpty()) {
            out.println();
            result.discoveryWarnings().forEach(warning -> out.println("Warning: " + warning));
        }

        out.printf("%nDiscovered %d input(s):%n", document.inputCount());
        for (InterfaceDocument.InputEntry input : document.inputs()) {
            out.printf("  [%d] %s (%s/%s)%n", input.index(), input.name(), input.objectType(), input.property());
        }
        out.printf("%nDiscovered %d output(s):%n", document.outputCount());
        for (InterfaceDocument.OutputEntry output : document.outputs()) {
            out.printf("  [%d] %s (%s/%s)%n", output.index(), output.name(), output.objectType(), output.property());
        }

        out.printf("%nSuccessfully generated: %s%n", result.outputFile());
        out.printf("Input count: %d%n", document.inputCount());
        out.printf("Output count: %d%n", document.outputCount());
        out.flush();
    }

    static void printValidation(PrintWriter writer, ValidationReport report) {
        if (report.isClean()) {
            writer.println("No validation issues found");
            writer.println();
            return;
        }
        writer.println("Validation issues found:");
        for (ValidationIssue issue : report.issues()) {
            writer.println("  " + issue);
            issue.details().forEach(detail -> writer.println("    " + detail));
        }
        if (report.hasErrors()) {
            writer.println("CRITICAL ERRORS FOUND - model will likely fail to run in SWMM");
        } else {
            writer.println("Warnings found - model may have issues but generation continues");
        }
        writer.println();
        writer.flush();
    }
}
