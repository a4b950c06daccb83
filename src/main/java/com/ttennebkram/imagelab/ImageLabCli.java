package com.ttennebkram.imagelab;

import com.ttennebkram.imagelab.batch.BatchInput;
import com.ttennebkram.imagelab.batch.BatchReport;
import com.ttennebkram.imagelab.errors.ImageLabException;
import com.ttennebkram.imagelab.operations.ImageOperation;
import com.ttennebkram.imagelab.operations.OperationRegistry;
import com.ttennebkram.imagelab.params.ParameterSpec;
import com.ttennebkram.imagelab.render.ExportedImage;
import com.ttennebkram.imagelab.service.ImageLabService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line front end for the image lab.
 *
 * <pre>
 * imagelab list
 * imagelab info &lt;image&gt;
 * imagelab apply &lt;operation&gt; &lt;input&gt; &lt;output.png&gt; [--params JSON]
 * imagelab batch &lt;operation&gt; &lt;output.zip&gt; &lt;input&gt;... [--params JSON] [--manifest FILE]
 * imagelab compare &lt;operation&gt; &lt;input&gt; &lt;output.png&gt; [--params JSON]
 * imagelab export &lt;input&gt; &lt;output&gt; [--format FMT] [--quality N]
 * imagelab report &lt;input&gt; --operations JSON [--name NAME]
 * </pre>
 */
public class ImageLabCli {

    private static final Logger log = LoggerFactory.getLogger(ImageLabCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILED = 2;
    static final int EXIT_IO = 3;

    private final ImageLabService service;
    private final PrintStream out;
    private final PrintStream err;

    ImageLabCli(ImageLabService service, PrintStream out, PrintStream err) {
        this.service = service;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        ImageLabCli cli = new ImageLabCli(ImageLabService.createDefault(), System.out, System.err);
        System.exit(cli.run(args));
    }

    /**
     * Run one command and return the process exit code.
     */
    int run(String[] args) {
        if (args.length == 0 || "-h".equals(args[0]) || "--help".equals(args[0])) {
            printHelp(args.length == 0 ? err : out);
            return args.length == 0 ? EXIT_USAGE : EXIT_OK;
        }

        // Split positional arguments from --options
        List<String> positional = new ArrayList<>();
        String params = null;
        String manifest = null;
        String format = null;
        Integer quality = null;
        String operations = null;
        String name = null;
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                positional.add(arg);
                continue;
            }
            if (i + 1 >= args.length) {
                err.println("Error: " + arg + " requires a value");
                return EXIT_USAGE;
            }
            String value = args[++i];
            switch (arg) {
                case "--params":
                    params = value;
                    break;
                case "--manifest":
                    manifest = value;
                    break;
                case "--format":
                    format = value;
                    break;
                case "--quality":
                    try {
                        quality = Integer.parseInt(value);
                    } catch (NumberFormatException e) {
                        err.println("Error: --quality requires an integer between 0 and 100");
                        return EXIT_USAGE;
                    }
                    break;
                case "--operations":
                    operations = value;
                    break;
                case "--name":
                    name = value;
                    break;
                default:
                    err.println("Unknown option: " + arg);
                    printHelp(err);
                    return EXIT_USAGE;
            }
        }

        String command = args[0];
        try {
            switch (command) {
                case "list":
                    return list();
                case "info":
                    if (positional.size() != 1) return usage("info <image>");
                    out.println(service.describe(read(positional.get(0))));
                    return EXIT_OK;
                case "apply":
                    if (positional.size() != 3) return usage("apply <operation> <input> <output.png> [--params JSON]");
                    write(positional.get(2), service.apply(read(positional.get(1)), positional.get(0), params));
                    return EXIT_OK;
                case "batch":
                    if (positional.size() < 3) return usage("batch <operation> <output.zip> <input>... [--params JSON]");
                    return batch(positional, params, manifest);
                case "compare":
                    if (positional.size() != 3) return usage("compare <operation> <input> <output.png> [--params JSON]");
                    write(positional.get(2), service.compare(read(positional.get(1)), positional.get(0), params));
                    return EXIT_OK;
                case "export":
                    if (positional.size() != 2) return usage("export <input> <output> [--format FMT] [--quality N]");
                    return export(positional.get(0), positional.get(1), format, quality);
                case "report":
                    if (positional.size() != 1 || operations == null) {
                        return usage("report <input> --operations JSON [--name NAME]");
                    }
                    Path input = Paths.get(positional.get(0));
                    String filename = name != null ? name : input.getFileName().toString();
                    out.println(service.createReport(filename, Files.readAllBytes(input), operations));
                    return EXIT_OK;
                default:
                    err.println("Unknown command: " + command);
                    printHelp(err);
                    return EXIT_USAGE;
            }
        } catch (ImageLabException e) {
            log.error("{} failed: {} {}", command, e.getKind(), e.getMessage(), e);
            err.println("Error (" + e.getKind() + "): " + e.getMessage());
            return EXIT_FAILED;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return EXIT_IO;
        }
    }

    private int list() {
        OperationRegistry registry = service.getRegistry();
        for (ImageOperation operation : registry.getOperations()) {
            out.println(operation.getOperationId() + "  [" + operation.getCategory() + "]");
            for (ParameterSpec spec : operation.getParameterSchema().getSpecs()) {
                out.println("    " + spec);
            }
        }
        for (String id : registry.getIdentifiers()) {
            registry.find(id)
                    .filter(entry -> entry.isAlias())
                    .ifPresent(entry -> out.println("alias " + entry));
        }
        return EXIT_OK;
    }

    private int batch(List<String> positional, String params, String manifest) throws IOException {
        List<BatchInput> inputs = new ArrayList<>();
        for (String file : positional.subList(2, positional.size())) {
            Path path = Paths.get(file);
            byte[] data;
            try {
                data = Files.readAllBytes(path);
            } catch (IOException e) {
                // An unreadable file fails its own item, like an undecodable one
                log.warn("Could not read {}: {}", path, e.getMessage());
                data = new byte[0];
            }
            inputs.add(BatchInput.encoded(path.getFileName().toString(), data));
        }

        BatchReport report = service.batch(positional.get(0), params, inputs);
        write(positional.get(1), report.getArchive().getContent());
        if (manifest != null) {
            write(manifest, service.batchManifest(report, false).getBytes(StandardCharsets.UTF_8));
        }
        out.println(report.getSuccessCount() + " of " + report.getTotalProcessed() + " images processed"
                + report.getBatchId().map(id -> " (batch " + id + ")").orElse(""));
        report.getItems().stream()
                .filter(item -> !item.isSuccess())
                .forEach(item -> err.println("  failed: " + item.getSourceName() + ": " + item.getErrorMessage()));
        return EXIT_OK;
    }

    private int export(String input, String output, String format, Integer quality) throws IOException {
        String target = format;
        if (target == null) {
            int dot = output.lastIndexOf('.');
            if (dot < 0) {
                return usage("export <input> <output> --format FMT (output has no extension)");
            }
            target = output.substring(dot + 1);
        }
        ExportedImage exported = service.export(read(input), target, quality);
        write(output, exported.getContent());
        out.println("Wrote " + exported.getMediaType() + " to " + output);
        return EXIT_OK;
    }

    private int usage(String synopsis) {
        err.println("Usage: imagelab " + synopsis);
        return EXIT_USAGE;
    }

    private static byte[] read(String file) throws IOException {
        return Files.readAllBytes(Paths.get(file));
    }

    private static void write(String file, byte[] data) throws IOException {
        Files.write(Paths.get(file), data);
    }

    private static void printHelp(PrintStream stream) {
        stream.println("Usage: imagelab <command> [arguments]");
        stream.println();
        stream.println("Commands:");
        stream.println("  list                                          List operations, parameters and aliases");
        stream.println("  info <image>                                  Show image dimensions");
        stream.println("  apply <op> <input> <output.png>               Apply one operation");
        stream.println("  batch <op> <output.zip> <input>...            Apply one operation to many images");
        stream.println("  compare <op> <input> <output.png>             Render original and result side by side");
        stream.println("  export <input> <output>                       Re-encode as png, jpg, pdf, ...");
        stream.println("  report <input> --operations JSON              Print a JSON processing report");
        stream.println();
        stream.println("Options:");
        stream.println("  --params JSON      Operation parameters, e.g. '{\"ksize\": 5}'");
        stream.println("  --manifest FILE    Write the batch manifest as JSON");
        stream.println("  --format FMT       Export format (default: output extension)");
        stream.println("  --quality N        Lossy export quality 0-100");
        stream.println("  --name NAME        File name recorded in the report");
        stream.println("  -h, --help         Show this help");
    }
}
