package com.rustarchitect.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rustarchitect.core.detector.SignatureCatalogLoader;
import com.rustarchitect.core.generator.ReportGenerator;
import com.rustarchitect.core.generator.ReportGenerators;
import com.rustarchitect.core.model.Signature;
import com.rustarchitect.core.model.SignatureCatalog;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list available report generators or the bundled signature catalogs.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # List all generators
 * rustarchitect list generators
 *
 * # List bundled catalog signatures
 * rustarchitect list catalogs
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available report generators or signature catalogs",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: generators or catalogs"
    )
    private String type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "generators", "generator" -> listGenerators(out);
            case "catalogs", "catalog" -> listCatalogs(out);
            default -> {
                log.error("Unknown type: {}. Use: generators or catalogs", type);
                spec.commandLine().getErr().println("✗ Unknown type: " + type + ". Use: generators or catalogs");
                yield 1;
            }
        };
    }

    private int listGenerators(PrintWriter out) {
        out.println("Available Generators:");
        out.println();

        List<ReportGenerator> generators = ReportGenerators.discover();
        for (ReportGenerator generator : generators) {
            out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            out.printf("    File Extension: .%s%n", generator.getFileExtension());
            out.printf("    Report Types: %s%n", generator.getSupportedReportTypes());
            out.println();
        }

        if (generators.isEmpty()) {
            out.println("  No generators found.");
        }
        return 0;
    }

    private int listCatalogs(PrintWriter out) {
        out.println("Bundled Signature Catalogs:");
        out.println();

        SignatureCatalogLoader loader = new SignatureCatalogLoader();
        for (String id : SignatureCatalogLoader.BUNDLED_IDS) {
            SignatureCatalog catalog = loader.loadBundled(id);
            out.printf("  • %s (version %s, %d signatures)%n",
                catalog.id(), catalog.version(), catalog.signatures().size());
            for (Signature signature : catalog.signatures()) {
                out.printf("    - %s (max score %d)%n", signature.name(), signature.maxScore());
            }
            out.println();
        }
        return 0;
    }
}
