package info.isaksson.erland.codeatlas;

import info.isaksson.erland.codeatlas.annotate.SampleInput;
import info.isaksson.erland.codeatlas.core.CodeAtlasOptions;
import info.isaksson.erland.codeatlas.core.CodeAtlasResult;
import info.isaksson.erland.codeatlas.core.CodeAtlasService;
import info.isaksson.erland.codeatlas.ir.AtlasJson;
import info.isaksson.erland.codeatlas.report.MarkdownReportWriter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI entrypoint: scan a source tree, analyse it and write the Markdown atlas (and optionally the
 * JSON snapshot).
 */
public final class Main {

    private static final CodeAtlasService SERVICE = new CodeAtlasService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.source == null) {
            System.err.println("Error: --source is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path sourcePath = Paths.get(parsed.source).toAbsolutePath().normalize();
        if (!Files.exists(sourcePath)) {
            System.err.println("Error: --source does not exist: " + sourcePath);
            return 1;
        }
        if (!Files.isDirectory(sourcePath)) {
            System.err.println("Error: --source must be a directory: " + sourcePath);
            return 1;
        }

        final String projectName = (parsed.name != null && !parsed.name.isBlank())
                ? parsed.name
                : (sourcePath.getFileName() != null ? sourcePath.getFileName().toString() : "project");
        final Path reportOut = resolveReportOutput(parsed.output);

        try {
            Files.createDirectories(reportOut.getParent());
        } catch (IOException e) {
            System.err.println("Error: could not create output directory.");
            System.err.println(e.getMessage());
            return 2;
        }

        final CodeAtlasResult res;
        try {
            res = SERVICE.analyzeDirectory(sourcePath, parsed.excludes, toCoreOptions(parsed, projectName));
        } catch (RuntimeException | IOException e) {
            System.err.println("Error: analysis failed.");
            System.err.println(e.getMessage());
            return 2;
        }

        try {
            MarkdownReportWriter.write(res, reportOut);
        } catch (IOException e) {
            System.err.println("Error: could not write report to: " + reportOut);
            System.err.println(e.getMessage());
            return 2;
        }

        Path jsonOut = null;
        if (parsed.writeJson != null && !parsed.writeJson.isBlank()) {
            jsonOut = resolveJsonOutput(parsed.writeJson, reportOut);
            try {
                AtlasJson.write(res.snapshot(), jsonOut);
            } catch (IOException e) {
                System.err.println("Error: could not write JSON to: " + jsonOut);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        // Exit code rules
        int degraded = res.degradedFileCount();
        if (parsed.failOnDegraded && degraded > 0) {
            System.err.println("Degraded parses present (" + degraded + ") and --fail-on-degraded is set.");
            System.err.println("See report: " + reportOut);
            return 3;
        }

        System.out.println(
                "code-atlas\n" +
                "- Source: " + sourcePath + "\n" +
                "- Report: " + reportOut + "\n" +
                (jsonOut != null ? "- JSON: " + jsonOut + "\n" : "") +
                "- Files: " + res.files.size() + "\n" +
                "- Degraded parses: " + degraded + "\n" +
                "- Classes: " + res.stats.classes + "\n" +
                "- Functions: " + res.stats.functions + "\n" +
                "- Warnings: " + res.warnings.size()
        );
        return 0;
    }

    static CodeAtlasOptions toCoreOptions(CliArgs parsed, String projectName) {
        CodeAtlasOptions o = new CodeAtlasOptions();
        o.projectName = projectName;
        if (parsed.threads != null) o.parallelism = parsed.threads;
        if (parsed.maxTraceSteps != null) o.maxTraceSteps = parsed.maxTraceSteps;
        o.includeDryRun = parsed.dryRun;
        for (CliArgs.Sample s : parsed.samples) {
            o.withSample(s.path, s.function, s.input);
        }
        return o;
    }

    private static Path resolveReportOutput(String outputArg) {
        // A path ending with .md is the report file; anything else is an output directory.
        if (outputArg != null && outputArg.toLowerCase().endsWith(".md")) {
            return Paths.get(outputArg).toAbsolutePath().normalize();
        }
        String dir = (outputArg == null || outputArg.isBlank()) ? "./output" : outputArg;
        return Paths.get(dir).toAbsolutePath().normalize().resolve("atlas.md");
    }

    private static Path resolveJsonOutput(String jsonArg, Path reportOut) {
        if (jsonArg.toLowerCase().endsWith(".json")) {
            return Paths.get(jsonArg).toAbsolutePath().normalize();
        }
        return Paths.get(jsonArg).toAbsolutePath().normalize().resolve("atlas.json");
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String source;
        String output = "./output";
        String name;
        String writeJson;

        Integer threads;
        Integer maxTraceSteps;
        boolean dryRun = true;
        boolean failOnDegraded = false;

        final List<String> excludes = new ArrayList<>();
        final List<Sample> samples = new ArrayList<>();

        /** One {@code --sample path#function=assignments} value. */
        static final class Sample {
            final String path;
            final String function;
            final SampleInput input;

            Sample(String path, String function, SampleInput input) {
                this.path = path;
                this.function = function;
                this.input = input;
            }

            static Sample parse(String v) {
                int hash = v.indexOf('#');
                int eq = hash < 0 ? -1 : v.indexOf('=', hash);
                if (hash <= 0 || eq < 0) {
                    throw new IllegalArgumentException("Invalid value for --sample (expected path#function=assignments): " + v);
                }
                String path = v.substring(0, hash).trim().replace('\\', '/');
                String function = v.substring(hash + 1, eq).trim();
                if (function.isEmpty()) {
                    throw new IllegalArgumentException("Missing function name in --sample: " + v);
                }
                return new Sample(path, function, SampleInput.parse(v.substring(eq + 1)));
            }
        }

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                // support --exclude=glob
                if (a.startsWith("--exclude=")) {
                    out.excludes.add(a.substring("--exclude=".length()));
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--source":
                        out.source = requireValue(args, ++i, "--source");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--name":
                        out.name = requireValue(args, ++i, "--name");
                        break;
                    case "--write-json":
                        out.writeJson = requireValue(args, ++i, "--write-json");
                        break;
                    case "--exclude":
                        out.excludes.add(requireValue(args, ++i, "--exclude"));
                        break;
                    case "--threads":
                        out.threads = parsePositive(requireValue(args, ++i, "--threads"), "--threads");
                        break;
                    case "--max-trace-steps":
                        out.maxTraceSteps = parsePositive(requireValue(args, ++i, "--max-trace-steps"), "--max-trace-steps");
                        break;
                    case "--dry-run":
                        out.dryRun = parseBoolean(requireValue(args, ++i, "--dry-run"), "--dry-run");
                        break;
                    case "--sample":
                        out.samples.add(Sample.parse(requireValue(args, ++i, "--sample")));
                        break;
                    case "--fail-on-degraded":
                        out.failOnDegraded = parseBoolean(requireValue(args, ++i, "--fail-on-degraded"), "--fail-on-degraded");
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --source
                        if (out.source == null) {
                            out.source = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static boolean parseBoolean(String v, String flag) {
            if (v == null) throw new IllegalArgumentException("Missing value for " + flag);
            String s = v.trim().toLowerCase();
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static int parsePositive(String v, String flag) {
            int n;
            try {
                n = Integer.parseInt(v.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + flag + ": " + v, e);
            }
            if (n < 1) throw new IllegalArgumentException(flag + " must be >= 1: " + v);
            return n;
        }

        static void printHelp() {
            System.out.println(
                    "code-atlas\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar code-atlas.jar --source <path> [--output <dir|file.md>] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --source <path>        Root folder containing Python/JavaScript/TypeScript sources (required)\n" +
                    "  --output <path>        Output folder, or the report file when ending in .md (default: ./output)\n" +
                    "  --exclude <glob>       Exclude paths matching glob (repeatable). Matches are evaluated\n" +
                    "                         against paths *relative to --source* using '/' separators.\n" +
                    "                         Also supports --exclude=<glob>.\n" +
                    "  --name <name>          Project name used in the report title (default: source folder name)\n" +
                    "  --write-json <path>    Also write the JSON snapshot (folder, or file when ending in .json)\n" +
                    "  --threads <n>          Worker threads for per-file analysis (default: available processors)\n" +
                    "  --max-trace-steps <n>  Step bound for dry-run traces (default: 200)\n" +
                    "  --dry-run <bool>       Synthesize dry-run traces (default: true)\n" +
                    "  --sample <value>       Dry-run input as path#function=assignments (repeatable), e.g.\n" +
                    "                         app/solution.py#Solution.twoSum=nums = [2, 7, 11, 15], target = 9\n" +
                    "  --fail-on-degraded <bool>  Exit with code 3 when any file fell back to pattern parsing.\n" +
                    "                         Default: false.\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Exit codes: 0 ok, 1 usage error, 2 I/O or analysis failure, 3 degraded parses with --fail-on-degraded\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/code-atlas.jar --source samples/mini --output out\n" +
                    "  java -jar target/code-atlas.jar samples/mini\n" +
                    "  java -jar target/code-atlas.jar --source . --exclude \"**/generated/**\" --write-json out\n"
            );
        }
    }
}
